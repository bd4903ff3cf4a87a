package com.tengen.core.load;

/**
 * A load step failed in a way the user should be told about. Always recovered by
 * installing a default game.
 */
public class LoadFailure extends Exception {

    public static final String TITLE = "Failed to load game";

    private final LoadStage stage;

    public LoadFailure(LoadStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public LoadFailure(LoadStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    /** A failure with the stage's standard user-facing message. */
    public static LoadFailure at(LoadStage stage) {
        return new LoadFailure(stage, stage.defaultFailureMessage());
    }

    public LoadStage getStage() {
        return stage;
    }
}
