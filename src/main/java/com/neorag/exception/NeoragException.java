package com.neorag.exception;

/**
 * Base class for failures that are surfaced to the caller of a query.
 */
public class NeoragException extends RuntimeException {

    private final String code;

    public NeoragException(String code, String message) {
        super(message);
        this.code = code;
    }

    public NeoragException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
