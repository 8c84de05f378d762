package com.example.emobility.exception;

import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.Entity;

public class ForbiddenException extends AccessException {

    public ForbiddenException(String message, Entity entity, String entityId, Action action, String userId) {
        super(message, entity, entityId, action, userId);
    }

    @Override
    public String getErrorCode() {
        return "authorization_error";
    }
}
