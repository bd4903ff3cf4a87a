package com.tengen.core.newgame;

import com.tengen.core.model.GoGameRules;
import com.tengen.core.model.GoGameType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Defaults for a new game. Also used to fabricate the fallback game when loading fails.
 */
@Component
@ConfigurationProperties(prefix = "tengen.new-game")
public class NewGameSettings {

    private int boardSize = 19;
    private int handicap = 0;
    private double komi = 7.5;
    private GoGameType gameType = GoGameType.COMPUTER_VS_HUMAN;
    private boolean computerPlaysWhite = true;
    private GoGameRules.KoRule koRule = GoGameRules.KoRule.SIMPLE;
    private GoGameRules.ScoringSystem scoringSystem = GoGameRules.ScoringSystem.AREA_SCORING;
    private String humanPlayerName = "Human player";
    private String computerPlayerName = "Fuego";

    public int getBoardSize() { return boardSize; }
    public void setBoardSize(int boardSize) { this.boardSize = boardSize; }
    public int getHandicap() { return handicap; }
    public void setHandicap(int handicap) { this.handicap = handicap; }
    public double getKomi() { return komi; }
    public void setKomi(double komi) { this.komi = komi; }
    public GoGameType getGameType() { return gameType; }
    public void setGameType(GoGameType gameType) { this.gameType = gameType; }
    public boolean isComputerPlaysWhite() { return computerPlaysWhite; }
    public void setComputerPlaysWhite(boolean computerPlaysWhite) { this.computerPlaysWhite = computerPlaysWhite; }
    public GoGameRules.KoRule getKoRule() { return koRule; }
    public void setKoRule(GoGameRules.KoRule koRule) { this.koRule = koRule; }
    public GoGameRules.ScoringSystem getScoringSystem() { return scoringSystem; }
    public void setScoringSystem(GoGameRules.ScoringSystem scoringSystem) { this.scoringSystem = scoringSystem; }
    public String getHumanPlayerName() { return humanPlayerName; }
    public void setHumanPlayerName(String humanPlayerName) { this.humanPlayerName = humanPlayerName; }
    public String getComputerPlayerName() { return computerPlayerName; }
    public void setComputerPlayerName(String computerPlayerName) { this.computerPlayerName = computerPlayerName; }

    public GoGameRules rules() {
        return new GoGameRules(koRule, scoringSystem);
    }
}
