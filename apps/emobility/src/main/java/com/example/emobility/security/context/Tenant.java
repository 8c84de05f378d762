package com.example.emobility.security.context;

import java.util.Objects;

/**
 * Organization whose data lives in its own set of collections.
 */
public record Tenant(String id) {

    public static final String DEFAULT_TENANT_ID = "default";

    public Tenant {
        Objects.requireNonNull(id, "tenant id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("tenant id must not be blank");
        }
    }

    public static Tenant of(String id) {
        return new Tenant(id);
    }

    public boolean isDefault() {
        return DEFAULT_TENANT_ID.equals(id);
    }
}
