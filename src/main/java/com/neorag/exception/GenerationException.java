package com.neorag.exception;

/**
 * The language model did not produce an answer.
 */
public class GenerationException extends NeoragException {

    public GenerationException(String message, Throwable cause) {
        super("generation_failed", message, cause);
    }
}
