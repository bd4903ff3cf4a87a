package com.tengen.gtp;

/**
 * Thrown when a command is submitted while the engine process is not running.
 */
public class EngineUnavailableException extends RuntimeException {
    public EngineUnavailableException(String message) {
        super(message);
    }

    public EngineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
