package com.tengen.gtp;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A single GTP command line plus how its response is delivered.
 *
 * @param text         the command line, e.g. {@code "loadsgf game.sgf"}
 * @param mode         asynchronous or blocking delivery
 * @param continuation invoked exactly once with the response, on the dispatcher thread
 */
public record GtpCommand(String text, DeliveryMode mode, Consumer<GtpResponse> continuation) {

    private static final Consumer<GtpResponse> IGNORE = response -> { };

    public GtpCommand {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("GTP command text must not be empty");
        }
        if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("GTP command must be a single line: " + text);
        }
        Objects.requireNonNull(mode, "mode");
        continuation = continuation == null ? IGNORE : continuation;
    }

    public static GtpCommand blocking(String text) {
        return new GtpCommand(text, DeliveryMode.BLOCK_UNTIL_DONE, IGNORE);
    }

    public static GtpCommand async(String text) {
        return new GtpCommand(text, DeliveryMode.ASYNC, IGNORE);
    }

    public static GtpCommand async(String text, Consumer<GtpResponse> continuation) {
        return new GtpCommand(text, DeliveryMode.ASYNC, continuation);
    }

    /** The first word of the command, used for logging and metrics tags. */
    public String verb() {
        String trimmed = text.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }

    @Override
    public String toString() {
        return "GtpCommand(" + text + ", " + mode + ")";
    }
}
