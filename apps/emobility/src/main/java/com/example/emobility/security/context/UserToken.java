package com.example.emobility.security.context;

import com.example.emobility.authz.model.Role;

import java.util.Objects;

/**
 * Authenticated caller as seen by the authorization layer.
 *
 * @param id       user ID
 * @param tenantId tenant the session was opened in
 * @param role     role of the user inside that tenant
 * @param name     display name, used for logging only
 */
public record UserToken(String id, String tenantId, Role role, String name) {

    public UserToken {
        Objects.requireNonNull(id, "user id");
        Objects.requireNonNull(tenantId, "tenant id");
        Objects.requireNonNull(role, "role");
    }

    public boolean belongsTo(Tenant tenant) {
        return tenant != null && tenantId.equals(tenant.id());
    }
}
