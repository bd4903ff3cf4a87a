package com.tengen.core.model;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owner of the current game. The game is swapped as a whole, never rebuilt in place,
 * so readers see either the previous game or the new one.
 * <p>
 * Operations that drive the engine through several dependent commands (new game, load,
 * save) run inside {@link #exclusively}, so one operation never observes engine state
 * left half-way by another.
 */
@Component
public class GameHandle {

    private final AtomicReference<GoGame> current = new AtomicReference<>();
    private final ReentrantLock operationLock = new ReentrantLock();

    /**
     * A game operation that may fail with a checked exception.
     */
    @FunctionalInterface
    public interface Operation<T, E extends Exception> {
        T run() throws E;
    }

    /** @return the current game, or {@code null} before the first game has been created */
    public GoGame current() {
        return current.get();
    }

    /** @return the game that was replaced, or {@code null} */
    public GoGame replace(GoGame game) {
        return current.getAndSet(game);
    }

    /**
     * Runs {@code operation} while no other game operation runs. Reentrant: a load may
     * create its game from inside its own operation.
     */
    public <T, E extends Exception> T exclusively(Operation<T, E> operation) throws E {
        operationLock.lock();
        try {
            return operation.run();
        } finally {
            operationLock.unlock();
        }
    }

    /** @return whether the calling thread is inside {@link #exclusively} */
    public boolean isHeldByCurrentThread() {
        return operationLock.isHeldByCurrentThread();
    }
}
