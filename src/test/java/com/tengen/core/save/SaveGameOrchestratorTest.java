package com.tengen.core.save;

import com.tengen.core.events.EventBus;
import com.tengen.core.events.GameEvent;
import com.tengen.core.load.StagingArea;
import com.tengen.core.metrics.TengenMetrics;
import com.tengen.core.model.GameHandle;
import com.tengen.core.model.GoBoardSize;
import com.tengen.core.model.GoColor;
import com.tengen.core.model.GoGame;
import com.tengen.core.model.GoGameRules;
import com.tengen.core.model.GoGameType;
import com.tengen.core.model.GoPlayer;
import com.tengen.core.model.Vertex;
import com.tengen.gtp.EngineProperties;
import com.tengen.gtp.EngineUnavailableException;
import com.tengen.gtp.GtpClient;
import com.tengen.gtp.ScriptedGtpTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SaveGameOrchestratorTest {

    private static final String SGF = "(;GM[1]SZ[9]KM[6.5];B[cg])";

    @TempDir
    Path tempDir;

    private ScriptedGtpTransport engine;
    private GtpClient client;
    private GameHandle gameHandle;
    private EventBus eventBus;
    private StagingArea stagingArea;
    private SimpleMeterRegistry registry;
    private SaveGameOrchestrator orchestrator;
    private GoGame game;

    @BeforeEach
    void setUp() {
        var properties = new EngineProperties();
        properties.setWorkingDirectory(tempDir.resolve("engine").toString());
        properties.setStagingFileName("tengen-game.sgf");
        stagingArea = new StagingArea(properties);

        engine = new ScriptedGtpTransport().answer("savesgf", command -> {
            writeStaged(SGF);
            return "=";
        });
        client = new GtpClient(engine);
        gameHandle = new GameHandle();
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        orchestrator = new SaveGameOrchestrator(client, gameHandle, stagingArea, eventBus,
                new TengenMetrics(registry));

        game = new GoGame(GoBoardSize.SIZE_9, GoGameRules.DEFAULT, GoGameType.HUMAN_VS_HUMAN,
                new GoPlayer("Black", GoColor.BLACK, true), new GoPlayer("White", GoColor.WHITE, true));
        game.play(new Vertex(3, 3));
        gameHandle.replace(game);
    }

    @AfterEach
    void tearDown() {
        client.shutdown();
    }

    private void writeStaged(String content) {
        try {
            Files.writeString(stagingArea.stagedPath(), content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private double saves(String outcome) {
        var counter = registry.find("tengen.save.results").tag("outcome", outcome).counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Nested
    @DisplayName("Successful save")
    class Success {

        @Test
        @DisplayName("the engine writes the staging name and the file ends up at the target")
        void movesToTarget() throws Exception {
            Path target = tempDir.resolve("archive").resolve("game.sgf");

            Path saved = orchestrator.save(target);

            assertEquals(target, saved);
            assertEquals(List.of("savesgf tengen-game.sgf"), engine.sent());
            assertEquals(SGF, Files.readString(target));
            assertFalse(Files.exists(stagingArea.stagedPath()));
            assertEquals(1.0, saves("success"));
        }

        @Test
        @DisplayName("an existing file of the same name is replaced")
        void replacesExisting() throws Exception {
            Path target = Files.writeString(tempDir.resolve("game.sgf"), "old");

            orchestrator.save(target);

            assertEquals(SGF, Files.readString(target));
        }

        @Test
        @DisplayName("publishes a saved event with the file and the move count")
        void publishesEvent() throws Exception {
            List<GameEvent> events = new ArrayList<>();
            eventBus.subscribe(GameEvent.SAVED, events::add);
            Path target = tempDir.resolve("game.sgf");

            orchestrator.save(target);

            assertEquals(1, events.size());
            assertEquals(game.id(), events.get(0).gameId());
            assertEquals(target.toString(), events.get(0).payload().get("file"));
            assertEquals(1, events.get(0).payload().get("moves"));
        }
    }

    @Nested
    @DisplayName("Failed save")
    class Failures {

        @Test
        @DisplayName("there is no game to save")
        void noGame() {
            gameHandle.replace(null);

            SaveFailure failure = assertThrows(SaveFailure.class,
                    () -> orchestrator.save(tempDir.resolve("game.sgf")));

            assertEquals("There is no game to save.", failure.getMessage());
            assertTrue(engine.sent().isEmpty());
            assertEquals(1.0, saves("failure"));
        }

        @Test
        @DisplayName("the engine refuses and whatever it wrote is removed")
        void engineRefuses() throws Exception {
            engine.answer("savesgf", command -> {
                writeStaged("partial");
                return "? cannot open file";
            });
            Path target = Files.writeString(tempDir.resolve("game.sgf"), "old");

            SaveFailure failure = assertThrows(SaveFailure.class, () -> orchestrator.save(target));

            assertEquals("The engine could not save the game: cannot open file", failure.getMessage());
            assertEquals("old", Files.readString(target));
            assertFalse(Files.exists(stagingArea.stagedPath()));
        }

        @Test
        @DisplayName("a leftover staging file is not mistaken for the saved game")
        void leftoverStagingFile() throws Exception {
            Files.createDirectories(tempDir.resolve("engine"));
            writeStaged("stale");
            engine.succeed("savesgf", "");

            SaveFailure failure = assertThrows(SaveFailure.class,
                    () -> orchestrator.save(tempDir.resolve("game.sgf")));

            assertTrue(failure.getMessage().startsWith("Could not write"), failure.getMessage());
            assertFalse(Files.exists(tempDir.resolve("game.sgf")));
        }

        @Test
        @DisplayName("the staging file itself is not a valid destination")
        void targetIsStagedFile() {
            SaveFailure failure = assertThrows(SaveFailure.class,
                    () -> orchestrator.save(stagingArea.stagedPath()));

            assertTrue(failure.getMessage().contains("Cannot use the staging file itself"), failure.getMessage());
            assertFalse(Files.exists(stagingArea.stagedPath()));
        }

        @Test
        @DisplayName("an engine that is not running propagates")
        void engineNotRunning() {
            engine.die();

            assertThrows(EngineUnavailableException.class, () -> orchestrator.save(tempDir.resolve("game.sgf")));
            assertTrue(engine.sent().isEmpty());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("a save waits while another game operation holds the game")
        void waitsForRunningOperation() throws Exception {
            var holding = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            ExecutorService threads = Executors.newFixedThreadPool(2);
            try {
                Future<?> operation = threads.submit(() -> gameHandle.exclusively(() -> {
                    holding.countDown();
                    return release.await(5, TimeUnit.SECONDS);
                }));
                assertTrue(holding.await(5, TimeUnit.SECONDS));
                Future<Path> save = threads.submit(() -> orchestrator.save(tempDir.resolve("game.sgf")));

                Thread.sleep(100);
                assertFalse(save.isDone());
                assertTrue(engine.sent().isEmpty());

                release.countDown();
                operation.get(5, TimeUnit.SECONDS);
                assertEquals(tempDir.resolve("game.sgf"), save.get(5, TimeUnit.SECONDS));
                assertEquals(List.of("savesgf tengen-game.sgf"), engine.sent());
            } finally {
                threads.shutdownNow();
            }
        }
    }
}
