package com.example.litigationhold.exception;

import lombok.Getter;

/**
 * Exception for a missing credential or an unreachable service, detected before any processing starts
 */
@Getter
public class PreconditionFailedException extends RuntimeException {

    private final String serviceName;

    public PreconditionFailedException(String serviceName, String message) {
        super(String.format("[%s] %s", serviceName, message));
        this.serviceName = serviceName;
    }

    public PreconditionFailedException(String serviceName, String message, Exception cause) {
        super(String.format("[%s] %s", serviceName, message), cause);
        this.serviceName = serviceName;
    }
}
