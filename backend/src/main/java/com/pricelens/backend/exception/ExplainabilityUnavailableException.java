package com.pricelens.backend.exception;

public class ExplainabilityUnavailableException extends RuntimeException {
    public ExplainabilityUnavailableException(String message) {
        super(message);
    }

    public ExplainabilityUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
