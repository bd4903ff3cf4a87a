package com.tengen.gtp;

import java.time.Instant;

/**
 * One command/response pair in the GTP log. The response fields are {@code null}
 * while the command is still in flight.
 */
public record GtpLogItem(String command, Instant sentAt, Boolean success, String response, Instant receivedAt) {

    static GtpLogItem sent(String command) {
        return new GtpLogItem(command, Instant.now(), null, null, null);
    }

    GtpLogItem answered(GtpResponse response) {
        return new GtpLogItem(command, sentAt, response.success(), response.payload(), Instant.now());
    }

    public boolean hasResponse() {
        return success != null;
    }
}
