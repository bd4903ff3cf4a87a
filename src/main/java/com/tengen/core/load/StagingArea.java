package com.tengen.core.load;

import com.tengen.gtp.EngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Moves save files between their user-visible location and the engine's working
 * directory, where they live under a fixed name that is safe to pass as a GTP argument.
 */
@Component
public class StagingArea {

    private static final Logger log = LoggerFactory.getLogger(StagingArea.class);

    private final Path directory;
    private final String fileName;

    public StagingArea(EngineProperties properties) {
        this(properties.workingDirectoryPath(), properties.getStagingFileName());
    }

    StagingArea(Path directory, String fileName) {
        if (fileName.isBlank() || fileName.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Staging file name must be a single token: '" + fileName + "'");
        }
        this.directory = directory;
        this.fileName = fileName;
    }

    /** The name the engine resolves relative to its working directory. */
    public String stagedName() {
        return fileName;
    }

    public Path stagedPath() {
        return directory.resolve(fileName);
    }

    /**
     * @return the staged copy
     * @throws IOException if the source is missing, is the staged file itself, or cannot be copied
     */
    public Path stage(Path source) throws IOException {
        rejectStagedPath(source);
        Files.createDirectories(directory);
        Path target = stagedPath();
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Staged {} as {}", source, target);
        return target;
    }

    /**
     * Creates the staging directory and removes a leftover staged file, so the engine
     * can write a fresh one.
     *
     * @return the path the engine will write to
     */
    public Path prepare() throws IOException {
        Files.createDirectories(directory);
        Path staged = stagedPath();
        Files.deleteIfExists(staged);
        return staged;
    }

    /**
     * Moves the file the engine wrote to {@code target}, replacing an existing file.
     *
     * @throws IOException if the engine wrote nothing or the move fails
     */
    public Path unstage(Path target) throws IOException {
        rejectStagedPath(target);
        Path staged = stagedPath();
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Moved staged file {} to {}", staged, target);
        return target;
    }

    /**
     * The staged file is deleted after every operation, so it can never stand in for a
     * user's file.
     */
    private void rejectStagedPath(Path file) throws IOException {
        Path staged = stagedPath().toAbsolutePath().normalize();
        Path candidate = file.toAbsolutePath().normalize();
        boolean same = candidate.equals(staged)
                || (Files.exists(candidate) && Files.exists(staged) && Files.isSameFile(candidate, staged));
        if (same) {
            throw new IOException("Cannot use the staging file itself: " + file);
        }
    }

    /**
     * Deletes the staged copy. Failure to delete is logged, not thrown, so it never
     * masks the outcome of the load.
     */
    public void release(Path staged) {
        try {
            Files.deleteIfExists(staged);
            log.debug("Released staged file {}", staged);
        } catch (IOException e) {
            log.warn("Could not delete staged file {}: {}", staged, e.getMessage());
        }
    }
}
