package com.example.litigationhold.exception;

import lombok.Getter;

/**
 * Exception for an unusable license eligibility table
 */
@Getter
public class ConfigurationInvalidException extends RuntimeException {

    private final String source;

    public ConfigurationInvalidException(String source, String message) {
        super(String.format("Invalid license table %s: %s", source, message));
        this.source = source;
    }

    public ConfigurationInvalidException(String source, String message, Exception cause) {
        super(String.format("Invalid license table %s: %s", source, message), cause);
        this.source = source;
    }
}
