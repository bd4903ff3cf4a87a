package com.tengen.gtp;

/**
 * Thrown when a command that configures the engine is rejected. The engine and the
 * local game no longer agree, which is an internal fault rather than a user error.
 */
public class EngineStateException extends RuntimeException {

    private final GtpResponse response;

    public EngineStateException(GtpResponse response) {
        super("Engine rejected setup command '%s': %s".formatted(response.command(), response.payload()));
        this.response = response;
    }

    public GtpResponse getResponse() {
        return response;
    }
}
