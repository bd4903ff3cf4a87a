package com.tengen.gtp;

import com.tengen.core.model.GoBoardSize;
import com.tengen.core.model.GoColor;
import com.tengen.core.model.GoGame;
import com.tengen.core.model.GoGameRules;
import com.tengen.core.model.GoGameType;
import com.tengen.core.model.GoPlayer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EngineSessionTest {

    private ScriptedGtpTransport engine;
    private GtpClient client;
    private EngineProperties properties;
    private EngineSession session;

    @BeforeEach
    void setUp() {
        engine = new ScriptedGtpTransport();
        client = new GtpClient(engine);
        properties = new EngineProperties();
        session = new EngineSession(client, properties);
    }

    @AfterEach
    void tearDown() {
        client.shutdown();
    }

    private static GoGame game(GoGameType type) {
        return new GoGame(GoBoardSize.SIZE_9, GoGameRules.DEFAULT, type,
                new GoPlayer("b", GoColor.BLACK, true), new GoPlayer("w", GoColor.WHITE, type == GoGameType.HUMAN_VS_HUMAN));
    }

    @Test
    @DisplayName("setupComputerPlayer sends the profile commands in order")
    void appliesProfile() {
        EngineProfile applied = session.setupComputerPlayer(game(GoGameType.COMPUTER_VS_HUMAN));

        assertEquals(applied.gtpCommands(), engine.sent());
        assertTrue(applied.pondering());
    }

    @Test
    @DisplayName("human vs human games use the fallback profile")
    void humanVsHumanProfile() {
        EngineProfile applied = session.setupComputerPlayer(game(GoGameType.HUMAN_VS_HUMAN));

        assertFalse(applied.pondering());
        assertTrue(engine.sent().contains("uct_param_player ponder 0"));
    }

    @Test
    @DisplayName("a rejected profile command raises EngineStateException")
    void rejectedProfileCommand() {
        engine.fail("uct_param_search", "unknown command");

        assertThrows(EngineStateException.class,
                () -> session.setupComputerPlayer(game(GoGameType.COMPUTER_VS_HUMAN)));
    }

    @Test
    @DisplayName("profile setup can be disabled")
    void disabledProfile() {
        properties.setApplyProfile(false);

        assertNull(session.setupComputerPlayer(game(GoGameType.COMPUTER_VS_HUMAN)));
        assertEquals(List.of(), engine.sent());
    }

    @Test
    @DisplayName("pondering commands are queued before later blocking commands")
    void ponderingOrder() {
        session.stopPondering();
        client.submitAndWait("loadsgf game.sgf");
        session.restorePondering(game(GoGameType.COMPUTER_VS_HUMAN));
        client.submitAndWait("showboard");

        assertEquals(List.of("uct_param_player ponder 0", "loadsgf game.sgf",
                "uct_param_player ponder 1", "showboard"), engine.sent());
    }

    @Test
    @DisplayName("pondering is not restored for human vs human games")
    void noPonderingForHumans() {
        session.restorePondering(game(GoGameType.HUMAN_VS_HUMAN));
        client.submitAndWait("showboard");

        assertEquals(List.of("showboard"), engine.sent());
    }
}
