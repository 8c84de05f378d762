package com.example.emobility.exception;

import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.Entity;
import lombok.Getter;
import org.springframework.lang.Nullable;

/**
 * Base class for every refusal raised by an entity access gate.
 * Carries enough context for audit logging without exposing it to the client.
 */
@Getter
public abstract class AccessException extends RuntimeException {

    @Nullable
    private final Entity entity;
    @Nullable
    private final String entityId;
    @Nullable
    private final Action action;
    @Nullable
    private final String userId;

    protected AccessException(String message, @Nullable Entity entity, @Nullable String entityId,
            @Nullable Action action, @Nullable String userId) {
        super(message);
        this.entity = entity;
        this.entityId = entityId;
        this.action = action;
        this.userId = userId;
    }

    /**
     * Short machine-readable error code returned to API clients.
     */
    public abstract String getErrorCode();
}
