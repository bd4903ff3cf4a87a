package com.tengen.core.newgame;

import com.tengen.core.events.EventBus;
import com.tengen.core.events.GameEvent;
import com.tengen.core.model.GameHandle;
import com.tengen.core.model.GoBoardSize;
import com.tengen.core.model.GoColor;
import com.tengen.core.model.GoGame;
import com.tengen.core.model.GoGameRules;
import com.tengen.core.model.GoGameType;
import com.tengen.core.model.GoMove;
import com.tengen.core.model.GoPlayer;
import com.tengen.gtp.ComputerMoveTrigger;
import com.tengen.gtp.EngineProperties;
import com.tengen.gtp.EngineSession;
import com.tengen.gtp.EngineStateException;
import com.tengen.gtp.GtpClient;
import com.tengen.gtp.ScriptedGtpTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NewGameOrchestratorTest {

    private ScriptedGtpTransport engine;
    private GtpClient client;
    private GameHandle gameHandle;
    private EventBus eventBus;
    private EngineProperties engineProperties;
    private NewGameSettings settings;
    private NewGameOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        engine = new ScriptedGtpTransport();
        client = new GtpClient(engine);
        gameHandle = new GameHandle();
        eventBus = new EventBus();
        engineProperties = new EngineProperties();
        settings = new NewGameSettings();
        orchestrator = new NewGameOrchestrator(client, gameHandle, eventBus,
                new EngineSession(client, engineProperties), new ComputerMoveTrigger(client));
    }

    @AfterEach
    void tearDown() {
        client.shutdown();
    }

    @Nested
    @DisplayName("engine setup")
    class EngineSetup {

        @Test
        @DisplayName("pushes rules, board, handicap and komi in a fixed order")
        void commandSequence() {
            engineProperties.setApplyProfile(false);
            settings.setBoardSize(9);
            settings.setHandicap(2);
            settings.setKomi(0.5);
            settings.setScoringSystem(GoGameRules.ScoringSystem.TERRITORY_SCORING);
            settings.setKoRule(GoGameRules.KoRule.SUPERKO_POSITIONAL);

            orchestrator.createGame(NewGameRequest.from(settings).triggerComputerPlayer(false).build());

            assertEquals(List.of(
                    "go_param_rules ko_rule pos_superko",
                    "go_param_rules japanese_scoring 1",
                    "go_param_rules extra_handicap_komi 0",
                    "clear_board",
                    "boardsize 9",
                    "set_free_handicap C3 G7",
                    "komi 0.5"), engine.sent());
        }

        @Test
        @DisplayName("no handicap means no set_free_handicap")
        void noHandicap() {
            orchestrator.createGame(NewGameRequest.from(settings).build());

            assertTrue(engine.sent("set_free_handicap").isEmpty());
            assertEquals(List.of("komi 7.5"), engine.sent("komi"));
        }

        @Test
        @DisplayName("setup flags skip the corresponding engine commands")
        void flags() {
            orchestrator.createGame(NewGameRequest.from(settings)
                    .setupGtpBoard(false)
                    .setupGtpHandicapAndKomi(false)
                    .setupComputerPlayer(false)
                    .build());

            assertEquals(3, engine.sent().size());
            assertEquals(3, engine.sent("go_param_rules").size());
        }

        @Test
        @DisplayName("local-only requests do not talk to the engine")
        void localOnly() {
            engine.die();

            NewGameResult result = orchestrator.createGame(NewGameRequest.from(settings).localOnly().build());

            assertSame(result.game(), gameHandle.current());
            assertTrue(engine.sent().isEmpty());
        }

        @Test
        @DisplayName("a rejected komi is an engine state fault")
        void failingKomi() {
            engine.fail("komi", "invalid komi");

            assertThrows(EngineStateException.class,
                    () -> orchestrator.createGame(NewGameRequest.from(settings).build()));
        }

        @Test
        @DisplayName("the computer player profile is applied when requested")
        void profileApplied() {
            orchestrator.createGame(NewGameRequest.from(settings).build());

            assertEquals(List.of("uct_max_memory 32000000"), engine.sent("uct_max_memory"));
        }
    }

    @Nested
    @DisplayName("local game")
    class LocalGame {

        @Test
        @DisplayName("computer plays white in the default computer vs human game")
        void players() {
            GoGame game = orchestrator.createGame(NewGameRequest.from(settings).build()).game();

            assertTrue(game.playerBlack().human());
            assertTrue(game.playerWhite().isComputer());
            assertEquals("Fuego", game.playerWhite().name());
            assertEquals(19, game.boardSize().dimension());
            assertEquals(7.5, game.komi());
        }

        @Test
        @DisplayName("a prefabricated game is installed as is")
        void prefabricated() {
            var prefab = new GoGame(GoBoardSize.SIZE_13, GoGameRules.DEFAULT, GoGameType.HUMAN_VS_HUMAN,
                    new GoPlayer("a", GoColor.BLACK, true), new GoPlayer("b", GoColor.WHITE, true));

            NewGameResult result = orchestrator.createGame(NewGameRequest.from(settings)
                    .prefabricatedGame(prefab).build());

            assertSame(prefab, result.game());
            assertSame(prefab, gameHandle.current());
            assertEquals(List.of("boardsize 13"), engine.sent("boardsize"));
        }

        @Test
        @DisplayName("publishes willCreate with the old game and didCreate with the new one")
        void events() {
            GoGame first = orchestrator.createGame(NewGameRequest.from(settings).localOnly().build()).game();
            List<GameEvent> events = new ArrayList<>();
            eventBus.subscribeAll(events::add);

            GoGame second = orchestrator.createGame(NewGameRequest.from(settings).localOnly().build()).game();

            assertEquals(2, events.size());
            assertEquals(GameEvent.WILL_CREATE, events.get(0).eventType());
            assertEquals(first.id(), events.get(0).gameId());
            assertEquals(GameEvent.DID_CREATE, events.get(1).eventType());
            assertEquals(second.id(), events.get(1).gameId());
            assertEquals(19, events.get(1).payload().get("boardSize"));
        }
    }

    @Nested
    @DisplayName("computer player")
    class ComputerPlayer {

        @Test
        @DisplayName("triggers genmove when the computer plays black")
        void computerMovesFirst() throws Exception {
            settings.setComputerPlaysWhite(false);
            engine.succeed("genmove B", "Q16");

            NewGameResult result = orchestrator.createGame(NewGameRequest.from(settings).build());

            assertNotNull(result.computerMove());
            GoMove move = result.computerMove().await(Duration.ofSeconds(5));
            assertEquals(GoColor.BLACK, move.color());
            assertEquals(GoColor.WHITE, result.game().currentColorToMove());
        }

        @Test
        @DisplayName("does not trigger when a human is to move")
        void humanMovesFirst() {
            NewGameResult result = orchestrator.createGame(NewGameRequest.from(settings).build());

            assertNull(result.computerMove());
            assertTrue(engine.sent("genmove").isEmpty());
        }
    }
}
