package com.example.mediagen_backend.engine;

/**
 * Provider rejected the request itself (invalid input, content policy). Retrying cannot help.
 */
public class PermanentGenerationException extends GenerationException {

    public PermanentGenerationException(String message) {
        super(message);
    }

    public PermanentGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
