package com.tengen.core.newgame;

import com.tengen.core.model.GoBoardSize;
import com.tengen.core.model.GoGame;
import com.tengen.core.model.GoGameRules;
import com.tengen.core.model.GoGameType;

import java.util.Objects;

/**
 * Everything needed to create a game, plus which parts of the setup are mirrored into
 * the engine. Built from {@link NewGameSettings} and adjusted per call site.
 */
public final class NewGameRequest {

    private final GoBoardSize boardSize;
    private final int handicap;
    private final double komi;
    private final GoGameType gameType;
    private final boolean computerPlaysWhite;
    private final GoGameRules rules;
    private final String humanPlayerName;
    private final String computerPlayerName;
    private final GoGame prefabricatedGame;
    private final boolean setupGtpRules;
    private final boolean setupGtpBoard;
    private final boolean setupGtpHandicapAndKomi;
    private final boolean setupComputerPlayer;
    private final boolean triggerComputerPlayer;

    private NewGameRequest(Builder builder) {
        this.boardSize = Objects.requireNonNull(builder.boardSize, "boardSize");
        this.handicap = builder.handicap;
        this.komi = builder.komi;
        this.gameType = Objects.requireNonNull(builder.gameType, "gameType");
        this.computerPlaysWhite = builder.computerPlaysWhite;
        this.rules = Objects.requireNonNull(builder.rules, "rules");
        this.humanPlayerName = builder.humanPlayerName;
        this.computerPlayerName = builder.computerPlayerName;
        this.prefabricatedGame = builder.prefabricatedGame;
        this.setupGtpRules = builder.setupGtpRules;
        this.setupGtpBoard = builder.setupGtpBoard;
        this.setupGtpHandicapAndKomi = builder.setupGtpHandicapAndKomi;
        this.setupComputerPlayer = builder.setupComputerPlayer;
        this.triggerComputerPlayer = builder.triggerComputerPlayer;
    }

    /**
     * A request for a brand new game with every engine setup step enabled.
     *
     * @throws IllegalArgumentException if the configured board size is not supported
     */
    public static Builder from(NewGameSettings settings) {
        return new Builder()
                .boardSize(GoBoardSize.of(settings.getBoardSize()))
                .handicap(settings.getHandicap())
                .komi(settings.getKomi())
                .gameType(settings.getGameType())
                .computerPlaysWhite(settings.isComputerPlaysWhite())
                .rules(settings.rules())
                .humanPlayerName(settings.getHumanPlayerName())
                .computerPlayerName(settings.getComputerPlayerName());
    }

    public GoBoardSize boardSize() { return boardSize; }
    public int handicap() { return handicap; }
    public double komi() { return komi; }
    public GoGameType gameType() { return gameType; }
    public boolean computerPlaysWhite() { return computerPlaysWhite; }
    public GoGameRules rules() { return rules; }
    public String humanPlayerName() { return humanPlayerName; }
    public String computerPlayerName() { return computerPlayerName; }
    public GoGame prefabricatedGame() { return prefabricatedGame; }
    public boolean setupGtpRules() { return setupGtpRules; }
    public boolean setupGtpBoard() { return setupGtpBoard; }
    public boolean setupGtpHandicapAndKomi() { return setupGtpHandicapAndKomi; }
    public boolean setupComputerPlayer() { return setupComputerPlayer; }
    public boolean triggerComputerPlayer() { return triggerComputerPlayer; }

    public static final class Builder {
        private GoBoardSize boardSize = GoBoardSize.DEFAULT;
        private int handicap;
        private double komi;
        private GoGameType gameType = GoGameType.COMPUTER_VS_HUMAN;
        private boolean computerPlaysWhite = true;
        private GoGameRules rules = GoGameRules.DEFAULT;
        private String humanPlayerName = "Human player";
        private String computerPlayerName = "Computer";
        private GoGame prefabricatedGame;
        private boolean setupGtpRules = true;
        private boolean setupGtpBoard = true;
        private boolean setupGtpHandicapAndKomi = true;
        private boolean setupComputerPlayer = true;
        private boolean triggerComputerPlayer = true;

        public Builder boardSize(GoBoardSize boardSize) { this.boardSize = boardSize; return this; }
        public Builder handicap(int handicap) { this.handicap = handicap; return this; }
        public Builder komi(double komi) { this.komi = komi; return this; }
        public Builder gameType(GoGameType gameType) { this.gameType = gameType; return this; }
        public Builder computerPlaysWhite(boolean computerPlaysWhite) { this.computerPlaysWhite = computerPlaysWhite; return this; }
        public Builder rules(GoGameRules rules) { this.rules = rules; return this; }
        public Builder humanPlayerName(String humanPlayerName) { this.humanPlayerName = humanPlayerName; return this; }
        public Builder computerPlayerName(String computerPlayerName) { this.computerPlayerName = computerPlayerName; return this; }
        public Builder prefabricatedGame(GoGame prefabricatedGame) { this.prefabricatedGame = prefabricatedGame; return this; }
        public Builder setupGtpRules(boolean setupGtpRules) { this.setupGtpRules = setupGtpRules; return this; }
        public Builder setupGtpBoard(boolean setupGtpBoard) { this.setupGtpBoard = setupGtpBoard; return this; }
        public Builder setupGtpHandicapAndKomi(boolean value) { this.setupGtpHandicapAndKomi = value; return this; }
        public Builder setupComputerPlayer(boolean setupComputerPlayer) { this.setupComputerPlayer = setupComputerPlayer; return this; }
        public Builder triggerComputerPlayer(boolean triggerComputerPlayer) { this.triggerComputerPlayer = triggerComputerPlayer; return this; }

        /** Disables every step that talks to the engine. */
        public Builder localOnly() {
            return setupGtpRules(false).setupGtpBoard(false).setupGtpHandicapAndKomi(false)
                    .setupComputerPlayer(false).triggerComputerPlayer(false);
        }

        public NewGameRequest build() {
            return new NewGameRequest(this);
        }
    }
}
