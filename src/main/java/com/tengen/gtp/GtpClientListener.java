package com.tengen.gtp;

/**
 * Observer of the traffic on a {@link GtpClient}. Callbacks run on the client's
 * dispatcher thread and must not block.
 */
public interface GtpClientListener {

    default void commandSent(GtpCommand command) {
    }

    /**
     * @param elapsedNanos time between writing the command and dispatching the response
     */
    default void responseReceived(GtpCommand command, GtpResponse response, long elapsedNanos) {
    }
}
