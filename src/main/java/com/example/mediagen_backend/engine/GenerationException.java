package com.example.mediagen_backend.engine;

/**
 * Provider call failed in a way that may succeed on a later attempt (network, timeout, 5xx).
 */
public class GenerationException extends Exception {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
