package com.tengen.gtp;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;

/**
 * GTP framing over a plain input/output stream pair.
 */
public class StreamGtpTransport implements GtpTransport {

    private final BufferedReader reader;
    private final BufferedWriter writer;
    private volatile boolean closed;

    public StreamGtpTransport(InputStream fromEngine, OutputStream toEngine) {
        this.reader = new BufferedReader(new InputStreamReader(fromEngine, StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(toEngine, StandardCharsets.UTF_8));
    }

    @Override
    public boolean isAlive() {
        return !closed;
    }

    @Override
    public void send(String commandLine) throws IOException {
        writer.write(commandLine);
        writer.write('\n');
        writer.flush();
    }

    @Override
    public String receive() throws IOException {
        var block = new StringBuilder();
        String line;
        // GTP engines may emit blank lines before the status line; skip them
        while ((line = reader.readLine()) != null && line.isEmpty() && block.length() == 0) {
            // skip
        }
        while (line != null && !line.isEmpty()) {
            if (block.length() > 0) {
                block.append('\n');
            }
            block.append(line.replace("\r", ""));
            line = reader.readLine();
        }
        if (line == null) {
            closed = true;
            throw new EOFException("Engine closed its output stream");
        }
        return block.toString();
    }

    @Override
    public void close() {
        closed = true;
        try {
            writer.close();
        } catch (IOException e) {
            // stream already broken; nothing left to flush
        }
        try {
            reader.close();
        } catch (IOException e) {
            // same as above
        }
    }
}
