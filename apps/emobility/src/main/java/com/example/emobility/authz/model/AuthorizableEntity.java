package com.example.emobility.authz.model;

import org.springframework.lang.Nullable;

/**
 * An entity that can carry the authorization flags computed for the current user.
 */
public interface AuthorizableEntity {

    Object getId();

    /**
     * Whether this entity was created by the local organization (as opposed to roaming/external data).
     * Entities without an issuer notion are always local.
     */
    default boolean isIssuer() {
        return true;
    }

    /**
     * User ID owning this entity, if the entity has an owner.
     */
    @Nullable
    default String ownerId() {
        return null;
    }

    @Nullable
    AuthorizationActions getAuthorizations();

    void setAuthorizations(AuthorizationActions authorizations);
}
