package com.example.litigationhold.exception;

import lombok.Getter;

/**
 * Exception for directory or mailbox service communication failures
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String serviceName;
    private final Integer httpStatusCode;
    private final String responseBody;

    public ExternalServiceException(String serviceName, String message) {
        super(String.format("[%s] %s", serviceName, message));
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    public ExternalServiceException(String serviceName, Exception cause) {
        super(String.format("[%s] %s", serviceName, cause.getMessage()), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    public ExternalServiceException(String serviceName, String message, Exception cause) {
        super(String.format("[%s] %s", serviceName, message), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    public ExternalServiceException(String serviceName, int httpStatusCode, String responseBody) {
        super(String.format("[%s] HTTP %d: %s", serviceName, httpStatusCode, responseBody));
        this.serviceName = serviceName;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
    }

    /**
     * 401 and 403 mean the configured credentials are not accepted
     */
    public boolean isAuthenticationFailure() {
        return httpStatusCode != null && (httpStatusCode == 401 || httpStatusCode == 403);
    }

    /**
     * I/O errors, timeouts, 429 and 5xx answers may succeed on a later attempt.
     * Any other 4xx answer will not.
     */
    public boolean isTransient() {
        return httpStatusCode == null || httpStatusCode == 429 || httpStatusCode >= 500;
    }
}
