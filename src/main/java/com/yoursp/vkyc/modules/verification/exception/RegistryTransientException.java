package com.yoursp.vkyc.modules.verification.exception;

/**
 * Thrown when the registry times out, errors, or its circuit breaker is open.
 * The only registry failure the pipeline retries.
 */
public class RegistryTransientException extends RuntimeException {

    public RegistryTransientException(String message) {
        super(message);
    }

    public RegistryTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
