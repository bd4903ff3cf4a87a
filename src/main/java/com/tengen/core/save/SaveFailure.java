package com.tengen.core.save;

/**
 * The game could not be written to the requested file. The current game is unaffected.
 */
public class SaveFailure extends Exception {

    public static final String TITLE = "Failed to save game";

    public SaveFailure(String message) {
        super(message);
    }

    public SaveFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
