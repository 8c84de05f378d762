package com.example.emobility.exception;

import lombok.Getter;

/**
 * Storage or infrastructure failure while authorizing. Never downgraded to a denial.
 */
@Getter
public class SystemException extends RuntimeException {

    private final String component;

    public SystemException(String component, String message, Throwable cause) {
        super(message, cause);
        this.component = component;
    }
}
