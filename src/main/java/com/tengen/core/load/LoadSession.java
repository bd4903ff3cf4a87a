package com.tengen.core.load;

import com.tengen.core.model.GoBoardSize;

import java.nio.file.Path;
import java.util.UUID;

/**
 * State of one load attempt. Every recovered value is written exactly once, and reading
 * a value that has not been recovered yet is a programming error.
 */
public class LoadSession {

    private final String id = UUID.randomUUID().toString().substring(0, 8);
    private final Path sourceFile;

    private LoadStage stage = LoadStage.STAGE;
    private Path stagedFile;
    private boolean stagedFileReleased;
    private GoBoardSize boardSize;
    private String komiText;
    private String handicapText;
    private String movesText;
    private boolean failed;

    public LoadSession(Path sourceFile) {
        this.sourceFile = sourceFile;
    }

    public String id() { return id; }
    public Path sourceFile() { return sourceFile; }
    public LoadStage stage() { return stage; }
    public boolean hasStagedFile() { return stagedFile != null; }
    public boolean isStagedFileReleased() { return stagedFileReleased; }
    public boolean isFailed() { return failed; }

    /**
     * @throws IllegalStateException if {@code next} does not come after the current stage
     */
    void advanceTo(LoadStage next) {
        if (next.ordinal() <= stage.ordinal()) {
            throw new IllegalStateException("Cannot go from " + stage + " back to " + next);
        }
        stage = next;
    }

    public Path stagedFile() { return read(stagedFile, "staged file"); }
    public GoBoardSize boardSize() { return read(boardSize, "board size"); }
    public String komiText() { return read(komiText, "komi"); }
    public String handicapText() { return read(handicapText, "handicap"); }
    public String movesText() { return read(movesText, "move list"); }

    void setStagedFile(Path value) { stagedFile = writeOnce(stagedFile, value, "staged file"); }
    void setBoardSize(GoBoardSize value) { boardSize = writeOnce(boardSize, value, "board size"); }
    void setKomiText(String value) { komiText = writeOnce(komiText, value, "komi"); }
    void setHandicapText(String value) { handicapText = writeOnce(handicapText, value, "handicap"); }
    void setMovesText(String value) { movesText = writeOnce(movesText, value, "move list"); }

    void markStagedFileReleased() {
        if (stagedFileReleased) {
            throw new IllegalStateException("Staged file was already released");
        }
        stagedFileReleased = true;
    }

    /**
     * Latches the failed flag.
     *
     * @throws IllegalStateException if the attempt has already failed
     */
    void markFailed() {
        if (failed) {
            throw new IllegalStateException("Load " + id + " has already failed");
        }
        failed = true;
    }

    private static <T> T writeOnce(T current, T value, String field) {
        if (current != null) {
            throw new IllegalStateException("The " + field + " has already been recovered");
        }
        if (value == null) {
            throw new IllegalArgumentException("The " + field + " must not be null");
        }
        return value;
    }

    private static <T> T read(T value, String field) {
        if (value == null) {
            throw new IllegalStateException("The " + field + " has not been recovered yet");
        }
        return value;
    }
}
