package com.example.emobility.exception;

import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.Entity;

public class NotFoundException extends AccessException {

    public NotFoundException(String message, Entity entity, String entityId, Action action, String userId) {
        super(message, entity, entityId, action, userId);
    }

    @Override
    public String getErrorCode() {
        return "not_found";
    }
}
