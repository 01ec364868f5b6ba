package com.pricelens.backend.exception;

public class EvidenceFormatException extends RuntimeException {
    public EvidenceFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
