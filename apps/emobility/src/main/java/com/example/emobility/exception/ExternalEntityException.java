package com.example.emobility.exception;

import com.example.emobility.authz.model.Action;
import com.example.emobility.authz.model.Entity;

// Entity exists but was issued by another organization (roaming data) and cannot be managed locally.
public class ExternalEntityException extends AccessException {

    public ExternalEntityException(String message, Entity entity, String entityId, Action action, String userId) {
        super(message, entity, entityId, action, userId);
    }

    @Override
    public String getErrorCode() {
        return "external_entity";
    }
}
