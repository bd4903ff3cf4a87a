package com.tengen.core.newgame;

import com.tengen.core.events.EventBus;
import com.tengen.core.events.GameEvent;
import com.tengen.core.model.GameHandle;
import com.tengen.core.model.GoColor;
import com.tengen.core.model.GoGame;
import com.tengen.core.model.GoGameRules;
import com.tengen.core.model.GoGameType;
import com.tengen.core.model.GoPlayer;
import com.tengen.core.model.HandicapLayout;
import com.tengen.core.model.Vertex;
import com.tengen.gtp.ComputerMove;
import com.tengen.gtp.ComputerMoveTrigger;
import com.tengen.gtp.EngineSession;
import com.tengen.gtp.GtpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Creates a game, installs it as the current game and mirrors its configuration into
 * the engine.
 * <p>
 * Every engine command issued here is blocking and checked. A rejected command means
 * engine and local game disagree and surfaces as
 * {@link com.tengen.gtp.EngineStateException}.
 */
@Service
public class NewGameOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(NewGameOrchestrator.class);

    private final GtpClient client;
    private final GameHandle gameHandle;
    private final EventBus eventBus;
    private final EngineSession engineSession;
    private final ComputerMoveTrigger computerMoveTrigger;

    public NewGameOrchestrator(GtpClient client, GameHandle gameHandle, EventBus eventBus,
                               EngineSession engineSession, ComputerMoveTrigger computerMoveTrigger) {
        this.client = client;
        this.gameHandle = gameHandle;
        this.eventBus = eventBus;
        this.engineSession = engineSession;
        this.computerMoveTrigger = computerMoveTrigger;
    }

    public NewGameResult createGame(NewGameRequest request) {
        return gameHandle.exclusively(() -> create(request));
    }

    private NewGameResult create(NewGameRequest request) {
        GoGame previous = gameHandle.current();
        eventBus.publish(GameEvent.of(GameEvent.WILL_CREATE, previous == null ? null : previous.id(), Map.of()));

        GoGame game = request.prefabricatedGame() != null ? request.prefabricatedGame() : buildGame(request);
        gameHandle.replace(game);
        log.info("Created game {}", game);
        eventBus.publish(GameEvent.of(GameEvent.DID_CREATE, game.id(), describe(game)));

        if (request.setupGtpRules()) {
            setupRules(game.rules());
        }
        if (request.setupGtpBoard()) {
            client.submitChecked("clear_board");
            client.submitChecked("boardsize " + game.boardSize().dimension());
        }
        if (request.setupGtpHandicapAndKomi()) {
            setupHandicapAndKomi(game);
        }
        if (request.setupComputerPlayer()) {
            engineSession.setupComputerPlayer(game);
        }

        ComputerMove computerMove = null;
        if (request.triggerComputerPlayer() && game.isComputerPlayersTurn()) {
            computerMove = computerMoveTrigger.trigger(game);
        }
        return new NewGameResult(game, computerMove);
    }

    private GoGame buildGame(NewGameRequest request) {
        boolean blackHuman;
        boolean whiteHuman;
        if (request.gameType() == GoGameType.HUMAN_VS_HUMAN) {
            blackHuman = true;
            whiteHuman = true;
        } else if (request.gameType() == GoGameType.COMPUTER_VS_COMPUTER) {
            blackHuman = false;
            whiteHuman = false;
        } else {
            blackHuman = request.computerPlaysWhite();
            whiteHuman = !request.computerPlaysWhite();
        }
        var black = new GoPlayer(nameFor(request, blackHuman), GoColor.BLACK, blackHuman);
        var white = new GoPlayer(nameFor(request, whiteHuman), GoColor.WHITE, whiteHuman);

        var game = new GoGame(request.boardSize(), request.rules(), request.gameType(), black, white);
        game.setHandicapPoints(HandicapLayout.verticesFor(request.handicap(), request.boardSize()));
        game.setKomi(request.komi());
        return game;
    }

    private static String nameFor(NewGameRequest request, boolean human) {
        return human ? request.humanPlayerName() : request.computerPlayerName();
    }

    private void setupRules(GoGameRules rules) {
        client.submitChecked("go_param_rules ko_rule " + rules.koRule().gtpName());
        client.submitChecked("go_param_rules japanese_scoring " + rules.scoringSystem().japaneseScoring());
        client.submitChecked("go_param_rules extra_handicap_komi " + rules.scoringSystem().handicapCompensation());
    }

    private void setupHandicapAndKomi(GoGame game) {
        List<Vertex> handicap = game.handicapPoints();
        // the engine only accepts free handicap with at least two stones
        if (handicap.size() >= 2) {
            client.submitChecked("set_free_handicap " + HandicapLayout.toGtp(handicap));
        }
        client.submitChecked(String.format(Locale.ROOT, "komi %.1f", game.komi()));
    }

    private static Map<String, Object> describe(GoGame game) {
        var payload = new HashMap<String, Object>();
        payload.put("boardSize", game.boardSize().dimension());
        payload.put("handicap", game.handicapPoints().size());
        payload.put("komi", game.komi());
        payload.put("type", game.type().name());
        return payload;
    }
}
