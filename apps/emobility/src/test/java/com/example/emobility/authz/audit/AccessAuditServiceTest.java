package com.example.emobility.authz.audit;

import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.Entity;
import com.example.emobility.config.properties.AuthorizationProperties;
import com.example.emobility.config.properties.AuthorizationProperties.AuditProperties;
import com.example.emobility.security.context.Tenant;
import com.example.emobility.security.context.UserToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.example.emobility.util.UserTokenTestBuilder.aBasicUser;
import static com.example.emobility.util.UserTokenTestBuilder.aTenant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("AccessAuditService")
class AccessAuditServiceTest {

    private ObjectMapper objectMapper;
    private Tenant tenant;
    private UserToken user;

    @BeforeEach
    void setUp() {
        objectMapper = spy(new ObjectMapper());
        tenant = aTenant();
        user = aBasicUser();
    }

    private AccessAuditService service(boolean logAllowed) {
        return new AccessAuditService(objectMapper,
                new AuthorizationProperties(new AuditProperties(true, logAllowed), null, null, null));
    }

    @Test
    @DisplayName("should skip granted events unless configured")
    void shouldSkipGrantedEventsUnlessConfigured() throws Exception {
        service(false).logAllowed(tenant, user, Entity.SITE, "s1", Action.READ);

        verify(objectMapper, never()).writeValueAsString(any());
    }

    @Test
    @DisplayName("should always publish denials")
    void shouldAlwaysPublishDenials() throws Exception {
        AccessAuditService service = service(false);

        service.logDenied(tenant, user, Entity.SITE, "s1", Action.UPDATE, "Not authorized");
        service.logError(tenant, user, Entity.SITE, "s1", Action.UPDATE, "mongodb unavailable");

        verify(objectMapper, times(2)).writeValueAsString(any());
    }

    @Test
    @DisplayName("should describe the decision in the structured event")
    void shouldDescribeDecision() {
        AccessAuditEvent event = AccessAuditEvent.of(AccessAuditEvent.Outcome.DENY, "Not authorized",
                tenant, user, Entity.SITE_AREA, "sa1", Action.ASSIGN_ASSETS_TO_SITE_AREA);

        Map<String, Object> log = event.toStructuredLog();

        assertThat(log)
                .containsEntry("event_type", "entity_access")
                .containsEntry("outcome", "DENY")
                .containsEntry("tenant_id", "tenant-a")
                .containsEntry("user_id", user.id())
                .containsEntry("role", "BASIC")
                .containsEntry("entity_id", "sa1")
                .containsEntry("action", "AssignAssetsToSiteArea");
    }
}
