package com.neorag.exception;

/**
 * A backend (Redis, Neo4j or Ollama) could not be reached.
 */
public class ConnectivityException extends NeoragException {

    private final String backend;

    public ConnectivityException(String backend, String message, Throwable cause) {
        super("backend_unavailable", backend + " unavailable: " + message, cause);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
