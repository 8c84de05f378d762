package com.example.emobility.security.resolver;

import com.example.emobility.authz.model.Role;
import com.example.emobility.common.util.StringSanitizer;
import com.example.emobility.config.properties.AuthorizationProperties;
import com.example.emobility.security.annotation.ResolvedCaller;
import com.example.emobility.security.context.CallerContext;
import com.example.emobility.security.context.Tenant;
import com.example.emobility.security.context.UserToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.BindingContext;
import org.springframework.web.reactive.result.method.HandlerMethodArgumentResolver;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Resolves {@link CallerContext} from the identity headers set by the upstream gateway after authentication.
 *
 * <ul>
 *   <li>{@code X-Tenant-ID}: tenant addressed by the request (defaults to the configured default tenant)</li>
 *   <li>{@code X-User-ID}, {@code X-User-Role}: authenticated user and role</li>
 *   <li>{@code X-User-Tenant-ID}: tenant the session belongs to (defaults to {@code X-Tenant-ID})</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallerContextArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String HEADER_TENANT_ID = "X-Tenant-ID";
    public static final String HEADER_USER_ID = "X-User-ID";
    public static final String HEADER_USER_ROLE = "X-User-Role";
    public static final String HEADER_USER_TENANT_ID = "X-User-Tenant-ID";
    public static final String HEADER_USER_NAME = "X-User-Name";

    private final AuthorizationProperties properties;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(ResolvedCaller.class)
                && parameter.getParameterType().equals(CallerContext.class);
    }

    @Override
    public Mono<Object> resolveArgument(
            MethodParameter parameter,
            BindingContext bindingContext,
            ServerWebExchange exchange) {
        return Mono.fromCallable(() -> resolve(exchange.getRequest().getHeaders()))
                .cast(Object.class);
    }

    CallerContext resolve(HttpHeaders headers) {
        String tenantId = Optional.ofNullable(StringSanitizer.headerValue(headers.getFirst(HEADER_TENANT_ID)))
                .filter(value -> !value.isEmpty())
                .orElse(properties.defaultTenantId());
        String userId = StringSanitizer.headerValue(headers.getFirst(HEADER_USER_ID));
        String userTenantId = Optional.ofNullable(StringSanitizer.headerValue(headers.getFirst(HEADER_USER_TENANT_ID)))
                .filter(value -> !value.isEmpty())
                .orElse(tenantId);

        if (!StringSanitizer.isValidSafeId(tenantId) || !StringSanitizer.isValidSafeId(userTenantId)) {
            log.warn("Rejected request with invalid tenant header: {}", StringSanitizer.forLog(tenantId));
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid tenant identifier");
        }
        if (!StringSanitizer.isValidSafeId(userId)) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Authentication required");
        }
        Role role = Role.fromValue(headers.getFirst(HEADER_USER_ROLE))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Authentication required"));

        String name = StringSanitizer.headerValue(headers.getFirst(HEADER_USER_NAME));
        return new CallerContext(
                Tenant.of(tenantId),
                new UserToken(userId, userTenantId, role, name != null ? name : userId));
    }
}
