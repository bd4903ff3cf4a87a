package com.tengen.gtp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * The engine executable running as a child process, with its stdin/stdout used as the
 * GTP transport. The process runs in the configured working directory, which is where
 * files referenced by {@code loadsgf} are resolved.
 * <p>
 * A process that fails to start is not an error at construction time; the transport
 * simply reports itself as not alive.
 */
public class GtpEngineProcess implements GtpTransport {

    private static final Logger log = LoggerFactory.getLogger(GtpEngineProcess.class);

    private final List<String> command;
    private final Path workingDirectory;

    private volatile Process process;
    private volatile StreamGtpTransport streams;

    public GtpEngineProcess(List<String> command, Path workingDirectory) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Engine command must not be empty");
        }
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
    }

    /**
     * Starts the engine. Start failures are logged and leave the transport not alive.
     *
     * @return whether the process is running afterwards
     */
    public synchronized boolean start() {
        if (isAlive()) {
            return true;
        }
        try {
            Files.createDirectories(workingDirectory);
            var builder = new ProcessBuilder(command).directory(workingDirectory.toFile());
            Process started = builder.start();
            streams = new StreamGtpTransport(started.getInputStream(), started.getOutputStream());
            process = started;
            drainStderr(started);
            log.info("Started GTP engine {} (pid {}) in {}", command, started.pid(), workingDirectory);
            return true;
        } catch (IOException e) {
            log.error("Failed to start GTP engine {}: {}", command, e.getMessage());
            return false;
        }
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    public List<String> command() {
        return command;
    }

    @Override
    public boolean isAlive() {
        Process current = process;
        StreamGtpTransport currentStreams = streams;
        return current != null && current.isAlive() && currentStreams != null && currentStreams.isAlive();
    }

    @Override
    public void send(String commandLine) throws IOException {
        requireStreams().send(commandLine);
    }

    @Override
    public String receive() throws IOException {
        return requireStreams().receive();
    }

    @Override
    public synchronized void close() {
        if (streams != null) {
            streams.close();
        }
        Process current = process;
        if (current == null) {
            return;
        }
        current.destroy();
        try {
            if (!current.waitFor(2, TimeUnit.SECONDS)) {
                log.warn("GTP engine did not exit, killing it");
                current.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.destroyForcibly();
        }
        log.info("GTP engine stopped (exit code {})", current.isAlive() ? "n/a" : current.exitValue());
    }

    private StreamGtpTransport requireStreams() throws IOException {
        StreamGtpTransport current = streams;
        if (current == null) {
            throw new IOException("GTP engine process has not been started");
        }
        return current;
    }

    private void drainStderr(Process started) {
        Thread drainer = new Thread(() -> {
            try (var reader = new BufferedReader(
                    new InputStreamReader(started.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("[engine] {}", line);
                }
            } catch (IOException e) {
                log.debug("Engine stderr closed: {}", e.getMessage());
            }
        }, "gtp-engine-stderr");
        drainer.setDaemon(true);
        drainer.start();
    }
}
