package com.example.emobility.authz.audit;

import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.Entity;
import com.example.emobility.common.util.StringSanitizer;
import com.example.emobility.config.properties.AuthorizationProperties;
import com.example.emobility.security.context.Tenant;
import com.example.emobility.security.context.UserToken;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Publishes entity access decisions in structured JSON format on the AUTHZ_AUDIT logger.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.authz.audit.enabled", havingValue = "true", matchIfMissing = true)
public class AccessAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("AUTHZ_AUDIT");

    private final ObjectMapper objectMapper;
    private final AuthorizationProperties properties;

    public void logAllowed(@NonNull Tenant tenant, @NonNull UserToken user, @NonNull Entity entity,
            @Nullable String entityId, @NonNull Action action) {
        if (!properties.audit().logAllowed()) {
            return;
        }
        logEvent(AccessAuditEvent.of(AccessAuditEvent.Outcome.ALLOW, "granted", tenant, user, entity, entityId, action));
    }

    public void logDenied(@NonNull Tenant tenant, @NonNull UserToken user, @NonNull Entity entity,
            @Nullable String entityId, @NonNull Action action, @NonNull String reason) {
        logEvent(AccessAuditEvent.of(AccessAuditEvent.Outcome.DENY, reason, tenant, user, entity, entityId, action));
    }

    public void logError(@Nullable Tenant tenant, @Nullable UserToken user, @NonNull Entity entity,
            @Nullable String entityId, @NonNull Action action, @NonNull String reason) {
        logEvent(AccessAuditEvent.of(AccessAuditEvent.Outcome.ERROR, reason, tenant, user, entity, entityId, action));
    }

    private void logEvent(@NonNull AccessAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            switch (event.outcome()) {
                case ALLOW -> AUDIT_LOG.info(json);
                case DENY -> AUDIT_LOG.warn(json);
                case ERROR -> AUDIT_LOG.error(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            AUDIT_LOG.warn("Access {} - tenant={}, user={}, entity={}/{}, action={}, reason={}",
                    event.outcome(),
                    StringSanitizer.forLog(event.tenantId()),
                    StringSanitizer.forLog(event.userId()),
                    event.entity(),
                    StringSanitizer.forLog(event.entityId()),
                    event.action(),
                    StringSanitizer.forLog(event.reason()));
        }
    }
}
