package com.neorag.exception;

/**
 * Embedding or vector index lookup failed.
 */
public class RetrievalException extends NeoragException {

    public RetrievalException(String message, Throwable cause) {
        super("retrieval_failed", message, cause);
    }
}
