package com.tengen.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GameHandleTest {

    private final GameHandle handle = new GameHandle();

    @Test
    @DisplayName("replace returns the previous game")
    void replace() {
        var first = new GoGame(GoBoardSize.SIZE_9, GoGameRules.DEFAULT, GoGameType.HUMAN_VS_HUMAN,
                new GoPlayer("a", GoColor.BLACK, true), new GoPlayer("b", GoColor.WHITE, true));

        assertNull(handle.replace(first));
        assertSame(first, handle.current());
    }

    @Test
    @DisplayName("exclusive operations are reentrant")
    void reentrant() {
        int result = handle.exclusively(() -> handle.exclusively(() -> {
            assertTrue(handle.isHeldByCurrentThread());
            return 42;
        }));

        assertEquals(42, result);
        assertFalse(handle.isHeldByCurrentThread());
    }

    @Test
    @DisplayName("checked exceptions pass through and release the lock")
    void checkedException() {
        assertThrows(IOException.class, () -> handle.exclusively(() -> {
            throw new IOException("disk full");
        }));
        assertFalse(handle.isHeldByCurrentThread());
    }

    @Test
    @DisplayName("a second operation waits until the first has finished")
    void exclusion() throws Exception {
        var firstStarted = new CountDownLatch(1);
        var finishFirst = new CountDownLatch(1);
        ExecutorService threads = Executors.newFixedThreadPool(2);
        try {
            Future<String> first = threads.submit(() -> handle.exclusively(() -> {
                firstStarted.countDown();
                assertTrue(finishFirst.await(5, TimeUnit.SECONDS));
                return "first";
            }));
            assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
            Future<String> second = threads.submit(() -> handle.exclusively(() -> "second"));

            Thread.sleep(100);
            assertFalse(second.isDone());

            finishFirst.countDown();
            assertEquals("first", first.get(5, TimeUnit.SECONDS));
            assertEquals("second", second.get(5, TimeUnit.SECONDS));
        } finally {
            threads.shutdownNow();
        }
    }
}
