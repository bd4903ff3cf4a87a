package com.tengen.core.load;

import com.tengen.core.model.GoGame;
import com.tengen.gtp.ComputerMove;

/**
 * Outcome of one load attempt. After a failure {@code game} is the fallback default game.
 *
 * @param stage         the stage reached on success ({@link LoadStage#COMPLETE}) or the stage that failed
 * @param movesReplayed moves applied to the loaded game; 0 after a failure
 * @param computerMove  the engine move in progress if the computer is to move, otherwise {@code null}
 */
public record LoadResult(
    boolean success,
    LoadStage stage,
    String failureTitle,
    String failureMessage,
    GoGame game,
    int movesReplayed,
    ComputerMove computerMove
) {

    static LoadResult loaded(GoGame game, int movesReplayed, ComputerMove computerMove) {
        return new LoadResult(true, LoadStage.COMPLETE, "", "", game, movesReplayed, computerMove);
    }

    static LoadResult failed(LoadStage stage, String message, GoGame fallback) {
        return new LoadResult(false, stage, LoadFailure.TITLE, message, fallback, 0, null);
    }
}
