package com.example.fieldtasks.exception;

import lombok.Getter;

/**
 * Exception for identity provider or notification channel failures
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

    public ExternalServiceException(String serviceName, int httpStatusCode, String responseBody) {
        super(String.format("[%s] HTTP %d: %s", serviceName, httpStatusCode, responseBody));
        this.serviceName = serviceName;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
    }
}
