package com.example.emobility.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.authz")
public record AuthorizationProperties(
        AuditProperties audit,
        BatchProperties batch,
        ListProperties list,
        String defaultTenantId
) {
    public AuthorizationProperties {
        if (audit == null) {
            audit = new AuditProperties(true, true);
        }
        if (batch == null) {
            batch = new BatchProperties(1000);
        }
        if (list == null) {
            list = new ListProperties(1000);
        }
        if (defaultTenantId == null || defaultTenantId.isBlank()) {
            defaultTenantId = "default";
        }
    }

    public static AuthorizationProperties defaults() {
        return new AuthorizationProperties(null, null, null, null);
    }

    /**
     * @param enabled      publish AUTHZ_AUDIT events
     * @param logAllowed   also publish events for granted requests, not only denials
     */
    public record AuditProperties(
            boolean enabled,
            boolean logAllowed
    ) {}

    /**
     * @param maxIds upper bound on IDs accepted by one batch assignment check
     */
    public record BatchProperties(
            int maxIds
    ) {
        public BatchProperties {
            if (maxIds <= 0) {
                maxIds = 1000;
            }
        }
    }

    public record ListProperties(
            int maxResults
    ) {
        public ListProperties {
            if (maxResults <= 0) {
                maxResults = 1000;
            }
        }
    }
}
