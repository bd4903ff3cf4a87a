package com.tengen.gtp;

import java.io.IOException;

/**
 * The byte stream pair that connects the client to an engine.
 */
public interface GtpTransport extends AutoCloseable {

    boolean isAlive();

    /** Writes one command line and flushes. */
    void send(String commandLine) throws IOException;

    /**
     * Reads one response block: all lines up to the next empty line, joined with {@code \n}.
     *
     * @throws IOException if the stream ends or breaks before a complete response arrived
     */
    String receive() throws IOException;

    @Override
    void close();
}
