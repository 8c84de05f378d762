package com.example.emobility.authz.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Role of a user inside one tenant. Loaded from the authenticated session, immutable per request.
 */
public enum Role {
    SUPER_ADMIN("S"),
    ADMIN("A"),
    BASIC("B"),
    DEMO("D"),
    SITE_ADMIN("SA"),
    SITE_OWNER("SO");

    private final String code;

    Role(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolve a role from its short code or its enum name (case-insensitive).
     */
    public static Optional<Role> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(r -> r.code.equalsIgnoreCase(trimmed) || r.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
