package com.tengen.core.newgame;

import com.tengen.core.model.GoGame;
import com.tengen.gtp.ComputerMove;

/**
 * @param game         the game now installed in the {@link com.tengen.core.model.GameHandle}
 * @param computerMove the move the engine is generating, or {@code null} if the computer was not triggered
 */
public record NewGameResult(GoGame game, ComputerMove computerMove) {}
