package com.tengen.gtp;

import com.tengen.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ordered command channel to a GTP engine.
 * <p>
 * Commands from any thread are appended to a single FIFO. One dispatcher thread writes
 * the head command, reads its response, and hands the response to the command's
 * continuation before moving on, so continuations observe responses in submission order
 * and at most one command is in flight.
 * <p>
 * If the engine stream breaks, every command still queued is answered with a failure
 * response and later submissions fail with {@link EngineUnavailableException}.
 */
public class GtpClient {

    private static final Logger log = LoggerFactory.getLogger(GtpClient.class);

    static final String DISPATCHER_THREAD_NAME = "gtp-client";

    public enum State { IDLE, WRITING, AWAITING_RESPONSE }

    /**
     * An in-flight command and the future its submitter may wait on. Lives from
     * submission until the response has been dispatched.
     */
    record PendingCommand(GtpCommand command, CompletableFuture<GtpResponse> completion) {}

    private final GtpTransport transport;
    private final ExecutorService dispatcher;
    private final List<GtpClientListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private final Deque<PendingCommand> pending = new ArrayDeque<>();
    private volatile State state = State.IDLE;
    private volatile boolean engineLost;
    private volatile Thread dispatcherThread;

    public GtpClient(GtpTransport transport) {
        this.transport = transport;
        this.dispatcher = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, DISPATCHER_THREAD_NAME);
            thread.setDaemon(true);
            dispatcherThread = thread;
            return thread;
        });
    }

    public void addListener(GtpClientListener listener) {
        listeners.add(listener);
    }

    public void removeListener(GtpClientListener listener) {
        listeners.remove(listener);
    }

    public boolean isEngineAvailable() {
        return !engineLost && transport.isAlive();
    }

    public State state() {
        return state;
    }

    /** Commands submitted and not yet answered, including the one in flight. */
    public int queueLength() {
        synchronized (lock) {
            return pending.size();
        }
    }

    /**
     * Queues a command for the engine.
     * <p>
     * For {@link DeliveryMode#BLOCK_UNTIL_DONE} this call returns only after the response
     * has been handed to the continuation, and the returned future is already complete.
     * For {@link DeliveryMode#ASYNC} the future completes after the continuation has run.
     *
     * @throws EngineUnavailableException if the engine process is not running
     * @throws IllegalStateException      for a blocking submit from the dispatcher thread
     */
    public CompletableFuture<GtpResponse> submit(GtpCommand command) {
        if (command.mode() == DeliveryMode.BLOCK_UNTIL_DONE && isDispatcherThread()) {
            throw new IllegalStateException(
                    "Blocking submit of '" + command.text() + "' from the GTP dispatcher thread would deadlock");
        }
        var record = new PendingCommand(command, new CompletableFuture<>());
        synchronized (lock) {
            if (!isEngineAvailable()) {
                throw new EngineUnavailableException(
                        "GTP engine is not running, cannot submit '" + command.text() + "'");
            }
            boolean wasEmpty = pending.isEmpty();
            pending.addLast(record);
            if (wasEmpty) {
                dispatcher.execute(this::drain);
            }
        }
        log.debug("Queued GTP command: {}", command.text());

        if (command.mode() == DeliveryMode.BLOCK_UNTIL_DONE) {
            await(record);
        }
        return record.completion();
    }

    /** Submits in blocking mode and returns the response. */
    public GtpResponse submitAndWait(String commandText) {
        return submit(GtpCommand.blocking(commandText)).join();
    }

    /**
     * Submits in blocking mode and requires a success response.
     *
     * @throws EngineStateException if the engine answers with a failure
     */
    public GtpResponse submitChecked(String commandText) {
        GtpResponse response = submitAndWait(commandText);
        if (!response.success()) {
            throw new EngineStateException(response);
        }
        return response;
    }

    /**
     * Asks the engine to quit, waits briefly for the answer, then closes the transport
     * and stops the dispatcher.
     */
    public void shutdown() {
        if (isEngineAvailable()) {
            try {
                submit(GtpCommand.async("quit")).get(2, TimeUnit.SECONDS);
            } catch (EngineUnavailableException | ExecutionException | TimeoutException e) {
                log.warn("Engine did not acknowledge quit: {}", e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        transport.close();
        dispatcher.shutdownNow();
    }

    boolean isDispatcherThread() {
        return Thread.currentThread() == dispatcherThread;
    }

    private void await(PendingCommand record) {
        try {
            record.completion().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for '" + record.command().text() + "'", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Response dispatch failed for '" + record.command().text() + "'",
                    e.getCause());
        }
    }

    private void drain() {
        while (true) {
            PendingCommand head;
            synchronized (lock) {
                head = pending.peekFirst();
                if (head == null) {
                    state = State.IDLE;
                    return;
                }
            }
            GtpCommand command = head.command();
            MdcContext.setCommand(command.verb());
            try {
                GtpResponse response;
                long started = System.nanoTime();
                try {
                    state = State.WRITING;
                    notifySent(command);
                    log.debug("GTP >> {}", command.text());
                    transport.send(command.text());
                    state = State.AWAITING_RESPONSE;
                    String raw = transport.receive();
                    log.debug("GTP << {}", raw);
                    response = GtpResponse.parse(command.text(), raw);
                } catch (IOException e) {
                    failAll(e);
                    return;
                }
                synchronized (lock) {
                    pending.removeFirst();
                }
                state = State.IDLE;
                dispatch(head, response, System.nanoTime() - started);
            } finally {
                MdcContext.clearCommand();
            }
        }
    }

    private void failAll(IOException cause) {
        List<PendingCommand> failed;
        synchronized (lock) {
            engineLost = true;
            failed = new ArrayList<>(pending);
            pending.clear();
            state = State.IDLE;
        }
        log.error("Lost connection to GTP engine, failing {} pending command(s): {}",
                failed.size(), cause.getMessage());
        for (PendingCommand record : failed) {
            String reason = "Engine I/O failure: " + cause.getMessage();
            dispatch(record, GtpResponse.transportFailure(record.command().text(), reason), 0L);
        }
    }

    private void dispatch(PendingCommand record, GtpResponse response, long elapsedNanos) {
        for (GtpClientListener listener : listeners) {
            try {
                listener.responseReceived(record.command(), response, elapsedNanos);
            } catch (RuntimeException e) {
                log.warn("GTP listener failed on response to '{}': {}", record.command().text(), e.getMessage(), e);
            }
        }
        try {
            record.command().continuation().accept(response);
        } catch (RuntimeException e) {
            log.error("Continuation for '{}' threw: {}", record.command().text(), e.getMessage(), e);
        } finally {
            record.completion().complete(response);
        }
    }

    private void notifySent(GtpCommand command) {
        for (GtpClientListener listener : listeners) {
            try {
                listener.commandSent(command);
            } catch (RuntimeException e) {
                log.warn("GTP listener failed on command '{}': {}", command.text(), e.getMessage(), e);
            }
        }
    }
}
