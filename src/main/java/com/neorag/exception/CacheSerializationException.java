package com.neorag.exception;

/**
 * A stored cache record could not be decoded. Never leaves the cache layer.
 */
public class CacheSerializationException extends NeoragException {

    public CacheSerializationException(String message) {
        super("cache_corrupt", message);
    }

    public CacheSerializationException(String message, Throwable cause) {
        super("cache_corrupt", message, cause);
    }
}
