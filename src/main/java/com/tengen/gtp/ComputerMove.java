package com.tengen.gtp;

import com.tengen.core.model.GoColor;
import com.tengen.core.model.GoMove;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle for a move the engine is generating. Completes once the engine's answer has
 * been applied to the game, or exceptionally if the engine failed or the answer could
 * not be applied.
 */
public record ComputerMove(GoColor color, CompletableFuture<GoMove> completion) {

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * @throws TimeoutException     if the engine has not answered within {@code timeout}
     * @throws ExecutionException   if the move failed
     * @throws InterruptedException if the waiting thread was interrupted
     */
    public GoMove await(Duration timeout) throws InterruptedException, ExecutionException, TimeoutException {
        return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
