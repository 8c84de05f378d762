package com.example.emobility.authz.audit;

import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.Entity;
import com.example.emobility.security.context.Tenant;
import com.example.emobility.security.context.UserToken;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit event for entity access decisions.
 */
public record AccessAuditEvent(
        String eventId,
        Instant timestamp,

        Outcome outcome,
        String reason,

        String tenantId,
        String userId,
        String role,

        Entity entity,
        String entityId,
        Action action
) {
    public enum Outcome {
        ALLOW, DENY, ERROR
    }

    public static AccessAuditEvent of(Outcome outcome, String reason, Tenant tenant, UserToken user,
            Entity entity, String entityId, Action action) {
        return new AccessAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                outcome,
                reason,
                tenant != null ? tenant.id() : null,
                user != null ? user.id() : null,
                user != null ? user.role().name() : null,
                entity,
                entityId,
                action
        );
    }

    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "entity_access"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("outcome", outcome.name()),
                Map.entry("reason", reason != null ? reason : ""),
                Map.entry("tenant_id", tenantId != null ? tenantId : ""),
                Map.entry("user_id", userId != null ? userId : ""),
                Map.entry("role", role != null ? role : ""),
                Map.entry("entity", entity != null ? entity.getValue() : ""),
                Map.entry("entity_id", entityId != null ? entityId : ""),
                Map.entry("action", action != null ? action.getValue() : "")
        );
    }
}
