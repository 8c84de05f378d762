package com.example.emobility.observability.metrics;

import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.Entity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/**
 * Counters for entity access decisions. Tag values come from enums only, so cardinality stays bounded.
 */
@Component
public class AuthorizationMetrics {

    private final MeterRegistry registry;

    private final Counter accessGranted;
    private final Counter accessDenied;

    public AuthorizationMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.accessGranted = Counter.builder("authz.access")
                .tag("result", "granted")
                .description("Entity access checks that granted access")
                .register(registry);

        this.accessDenied = Counter.builder("authz.access")
                .tag("result", "denied")
                .description("Entity access checks that refused access")
                .register(registry);
    }

    public void recordGranted(@NonNull Entity entity, @NonNull Action action) {
        accessGranted.increment();
        registry.counter("authz.access.detailed",
                Tags.of("result", "granted", "entity", entity.name().toLowerCase(), "action", action.name().toLowerCase()))
                .increment();
    }

    public void recordRefused(@NonNull Entity entity, @NonNull Action action, @NonNull String errorCode) {
        accessDenied.increment();
        registry.counter("authz.access.detailed",
                Tags.of("result", errorCode, "entity", entity.name().toLowerCase(), "action", action.name().toLowerCase()))
                .increment();
    }

    public void recordSystemError(@NonNull Entity entity) {
        registry.counter("authz.access.errors", Tags.of("entity", entity.name().toLowerCase())).increment();
    }
}
