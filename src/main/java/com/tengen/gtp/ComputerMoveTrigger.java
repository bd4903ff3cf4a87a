package com.tengen.gtp;

import com.tengen.core.model.GoColor;
import com.tengen.core.model.GoGame;
import com.tengen.core.model.GoMove;
import com.tengen.core.model.Vertex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Asks the engine to generate a move for the player to move and applies the answer.
 */
@Service
public class ComputerMoveTrigger {

    private static final Logger log = LoggerFactory.getLogger(ComputerMoveTrigger.class);

    private final GtpClient client;

    public ComputerMoveTrigger(GtpClient client) {
        this.client = client;
    }

    /**
     * Submits {@code genmove} for the color to move in {@code game}. The answer is applied
     * on the client's dispatcher thread; the returned handle completes afterwards.
     *
     * @throws EngineUnavailableException if the engine is not running
     */
    public ComputerMove trigger(GoGame game) {
        GoColor color = game.currentColorToMove();
        var completion = new CompletableFuture<GoMove>();
        log.info("Computer player generates move for {} in game {}", color, game.id());
        client.submit(GtpCommand.async("genmove " + color.gtpLetter(),
                response -> apply(game, color, response, completion)));
        return new ComputerMove(color, completion);
    }

    private void apply(GoGame game, GoColor color, GtpResponse response, CompletableFuture<GoMove> completion) {
        if (!response.success()) {
            completion.completeExceptionally(new EngineStateException(response));
            return;
        }
        try {
            if (game.currentColorToMove() != color) {
                throw new IllegalStateException(
                        "Game moved on while the engine was thinking; expected " + color + " to move");
            }
            String answer = response.payload().trim();
            if (answer.equalsIgnoreCase("pass")) {
                game.pass();
            } else if (answer.equalsIgnoreCase("resign")) {
                game.resign();
            } else {
                game.play(Vertex.parse(answer, game.boardSize().dimension()));
            }
            GoMove move = game.lastMove();
            log.info("Computer played {} {}", color, answer);
            completion.complete(move);
        } catch (RuntimeException e) {
            log.error("Could not apply computer move '{}': {}", response.payload(), e.getMessage());
            completion.completeExceptionally(e);
        }
    }
}
