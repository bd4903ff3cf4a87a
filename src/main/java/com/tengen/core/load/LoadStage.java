package com.tengen.core.load;

/**
 * Steps of a load attempt, in order. Each step is entered only after the previous
 * engine call succeeded.
 */
public enum LoadStage {
    STAGE("Preparing file", "The file could not be found or could not be copied for the engine."),
    ENGINE_LOAD("Loading game", "The file is not a valid save file."),
    RECOVER_BOARD_SIZE("Reading board size", "The board size of the game could not be determined."),
    RECOVER_KOMI("Reading komi", "The komi of the game could not be determined."),
    RECOVER_HANDICAP("Reading handicap", "The handicap of the game could not be determined."),
    RECOVER_MOVES("Reading moves", "The moves of the game could not be determined."),
    MATERIALIZE("Setting up game", "The game could not be set up."),
    REPLAY("Replaying moves", "The game contains an invalid move."),
    COMPLETE("Game loaded", "");

    private final String progressLabel;
    private final String defaultFailureMessage;

    LoadStage(String progressLabel, String defaultFailureMessage) {
        this.progressLabel = progressLabel;
        this.defaultFailureMessage = defaultFailureMessage;
    }

    public String progressLabel() {
        return progressLabel;
    }

    public String defaultFailureMessage() {
        return defaultFailureMessage;
    }
}
