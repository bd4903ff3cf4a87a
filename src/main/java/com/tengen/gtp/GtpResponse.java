package com.tengen.gtp;

import java.util.Arrays;
import java.util.List;

/**
 * The engine's answer to one command.
 *
 * @param command the command text this response answers
 * @param success {@code true} for a {@code =} response, {@code false} for {@code ?} or a broken stream
 * @param payload the response text after the status token and optional id, stripped
 */
public record GtpResponse(String command, boolean success, String payload) {

    /**
     * Parses a raw response block (all lines up to, not including, the terminating empty line).
     * Text that starts with neither {@code =} nor {@code ?} is treated as a failure.
     */
    public static GtpResponse parse(String command, String raw) {
        if (raw == null || raw.isEmpty()) {
            return new GtpResponse(command, false, "Empty response");
        }
        char status = raw.charAt(0);
        if (status != '=' && status != '?') {
            return new GtpResponse(command, false, raw.strip());
        }
        int index = 1;
        while (index < raw.length() && Character.isDigit(raw.charAt(index))) {
            index++;
        }
        return new GtpResponse(command, status == '=', raw.substring(index).strip());
    }

    /** A failure synthesised by the client when the engine stream broke. */
    public static GtpResponse transportFailure(String command, String reason) {
        return new GtpResponse(command, false, reason);
    }

    public List<String> payloadLines() {
        if (payload.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(payload.split("\\R"));
    }
}
