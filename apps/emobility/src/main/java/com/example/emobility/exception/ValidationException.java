package com.example.emobility.exception;

import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.Entity;

// Malformed request, e.g. a missing ID.
public class ValidationException extends AccessException {

    public ValidationException(String message, Entity entity, Action action, String userId) {
        super(message, entity, null, action, userId);
    }

    @Override
    public String getErrorCode() {
        return "validation_error";
    }
}
