package com.tengen.gtp;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class GtpClientTest {

    private ScriptedGtpTransport engine;
    private GtpClient client;

    @BeforeEach
    void setUp() {
        engine = new ScriptedGtpTransport().answer("echo", text -> "= " + text);
        client = new GtpClient(engine);
    }

    @AfterEach
    void tearDown() {
        client.shutdown();
    }

    static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not reached within 5s");
            }
            Thread.sleep(5);
        }
    }

    @Nested
    @DisplayName("ordering")
    class Ordering {

        @Test
        @DisplayName("continuations observe responses in submission order")
        void inOrder() {
            List<String> received = Collections.synchronizedList(new ArrayList<>());
            var futures = new ArrayList<CompletableFuture<GtpResponse>>();
            for (int i = 0; i < 20; i++) {
                futures.add(client.submit(GtpCommand.async("echo " + i, r -> received.add(r.payload()))));
            }
            futures.forEach(CompletableFuture::join);

            var expected = new ArrayList<String>();
            for (int i = 0; i < 20; i++) {
                expected.add("echo " + i);
            }
            assertEquals(expected, received);
        }

        @Test
        @DisplayName("concurrent submitters each get their own response, in the order the engine saw them")
        void concurrentSubmitters() throws Exception {
            List<String> received = Collections.synchronizedList(new ArrayList<>());
            ExecutorService submitters = Executors.newFixedThreadPool(4);
            try {
                var tasks = new ArrayList<Future<List<CompletableFuture<GtpResponse>>>>();
                for (int t = 0; t < 4; t++) {
                    int thread = t;
                    tasks.add(submitters.submit(() -> {
                        var mine = new ArrayList<CompletableFuture<GtpResponse>>();
                        for (int i = 0; i < 50; i++) {
                            String text = "echo t" + thread + "-" + i;
                            mine.add(client.submit(GtpCommand.async(text, r -> received.add(r.payload()))));
                        }
                        return mine;
                    }));
                }
                for (var task : tasks) {
                    for (var future : task.get(5, TimeUnit.SECONDS)) {
                        assertTrue(future.get(5, TimeUnit.SECONDS).payload().startsWith("echo t"));
                    }
                }
            } finally {
                submitters.shutdownNow();
            }

            assertEquals(200, received.size());
            assertEquals(engine.sent(), received);
            for (int t = 0; t < 4; t++) {
                String prefix = "echo t" + t + "-";
                var ofThread = received.stream().filter(s -> s.startsWith(prefix)).toList();
                for (int i = 0; i < ofThread.size(); i++) {
                    assertEquals(prefix + i, ofThread.get(i));
                }
            }
        }

        @Test
        @DisplayName("at most one command is in flight")
        void noPipelining() throws Exception {
            var release = new CountDownLatch(1);
            engine.gate("slow", release);

            client.submit(GtpCommand.async("slow"));
            client.submit(GtpCommand.async("echo after"));
            waitUntil(() -> client.state() == GtpClient.State.AWAITING_RESPONSE);

            assertEquals(List.of("slow"), engine.sent());
            assertEquals(2, client.queueLength());

            release.countDown();
            waitUntil(() -> client.queueLength() == 0);
            assertEquals(List.of("slow", "echo after"), engine.sent());
        }
    }

    @Nested
    @DisplayName("delivery modes")
    class DeliveryModes {

        @Test
        @DisplayName("blocking submit returns after the continuation ran")
        void blockingRunsContinuationFirst() {
            var continuationRan = new AtomicBoolean();
            var future = client.submit(new GtpCommand("echo hi", DeliveryMode.BLOCK_UNTIL_DONE,
                    r -> continuationRan.set(true)));

            assertTrue(future.isDone());
            assertTrue(continuationRan.get());
            assertEquals("echo hi", future.join().payload());
            assertEquals(GtpClient.State.IDLE, client.state());
        }

        @Test
        @DisplayName("continuations run on the dispatcher thread")
        void continuationThread() {
            var threadName = new AtomicReference<String>();
            client.submit(GtpCommand.async("echo x", r -> threadName.set(Thread.currentThread().getName()))).join();

            assertEquals(GtpClient.DISPATCHER_THREAD_NAME, threadName.get());
        }

        @Test
        @DisplayName("blocking submit from inside a continuation is rejected")
        void blockingFromDispatcherRejected() {
            var error = new AtomicReference<Throwable>();
            client.submit(GtpCommand.async("echo outer", r -> {
                try {
                    client.submitAndWait("echo inner");
                } catch (RuntimeException e) {
                    error.set(e);
                }
            })).join();

            assertInstanceOf(IllegalStateException.class, error.get());
        }

        @Test
        @DisplayName("async submit from inside a continuation is allowed")
        void asyncFromDispatcherAllowed() {
            var inner = new AtomicReference<CompletableFuture<GtpResponse>>();
            client.submit(GtpCommand.async("echo outer",
                    r -> inner.set(client.submit(GtpCommand.async("echo inner"))))).join();

            assertEquals("echo inner", inner.get().join().payload());
        }

        @Test
        @DisplayName("a throwing continuation does not stop the dispatcher")
        void throwingContinuation() {
            var first = client.submit(GtpCommand.async("echo 1", r -> {
                throw new IllegalStateException("boom");
            }));

            assertEquals("echo 2", client.submitAndWait("echo 2").payload());
            assertTrue(first.isDone());
        }

        @Test
        @DisplayName("submitChecked throws EngineStateException on a failure response")
        void submitChecked() {
            engine.fail("komi", "invalid komi");

            var e = assertThrows(EngineStateException.class, () -> client.submitChecked("komi abc"));
            assertEquals("invalid komi", e.getResponse().payload());
        }
    }

    @Nested
    @DisplayName("engine availability")
    class Availability {

        @Test
        @DisplayName("submit fails immediately when the engine is not running")
        void engineNotRunning() {
            engine.die();

            assertFalse(client.isEngineAvailable());
            assertThrows(EngineUnavailableException.class, () -> client.submitAndWait("echo x"));
            assertThrows(EngineUnavailableException.class, () -> client.submit(GtpCommand.async("echo x")));
            assertEquals(List.of(), engine.sent());
        }

        @Test
        @DisplayName("a broken stream answers the in-flight and every queued command with a failure")
        void brokenStreamReleasesEveryone() throws Exception {
            var release = new CountDownLatch(1);
            engine.gate("slow", release).breakOn("slow");

            var inFlight = client.submit(GtpCommand.async("slow"));
            var queued = client.submit(GtpCommand.async("echo queued"));
            var blocked = CompletableFuture.supplyAsync(() -> client.submitAndWait("echo blocked"));
            waitUntil(() -> client.queueLength() == 3);

            release.countDown();

            GtpResponse blockedResponse = blocked.get(5, TimeUnit.SECONDS);
            assertFalse(blockedResponse.success());
            assertTrue(blockedResponse.payload().contains("Broken pipe"));
            assertFalse(inFlight.get(5, TimeUnit.SECONDS).success());
            assertFalse(queued.get(5, TimeUnit.SECONDS).success());

            assertFalse(client.isEngineAvailable());
            assertThrows(EngineUnavailableException.class, () -> client.submitAndWait("echo later"));
        }
    }

    @Nested
    @DisplayName("listeners")
    class Listeners {

        @Test
        @DisplayName("listeners see every command and response")
        void listenerNotified() {
            List<String> events = Collections.synchronizedList(new ArrayList<>());
            client.addListener(new GtpClientListener() {
                @Override
                public void commandSent(GtpCommand command) {
                    events.add("sent " + command.text());
                }

                @Override
                public void responseReceived(GtpCommand command, GtpResponse response, long elapsedNanos) {
                    events.add("received " + response.payload());
                }
            });

            client.submitAndWait("echo a");
            client.submitAndWait("echo b");

            assertEquals(List.of("sent echo a", "received echo a", "sent echo b", "received echo b"), events);
        }

        @Test
        @DisplayName("a throwing listener does not affect delivery")
        void throwingListener() {
            client.addListener(new GtpClientListener() {
                @Override
                public void commandSent(GtpCommand command) {
                    throw new IllegalStateException("listener broken");
                }
            });

            assertEquals("echo ok", client.submitAndWait("echo ok").payload());
        }
    }
}
