package com.tengen.core.save;

import com.tengen.core.events.EventBus;
import com.tengen.core.events.GameEvent;
import com.tengen.core.load.StagingArea;
import com.tengen.core.metrics.TengenMetrics;
import com.tengen.core.model.GameHandle;
import com.tengen.core.model.GoGame;
import com.tengen.gtp.GtpClient;
import com.tengen.gtp.GtpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Saves the current game as SGF.
 * <p>
 * The engine writes the file into its working directory under the staging name; the
 * file is then moved to its destination, replacing an existing file of that name.
 * The staging file never outlives the attempt.
 */
@Service
public class SaveGameOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SaveGameOrchestrator.class);

    private final GtpClient client;
    private final GameHandle gameHandle;
    private final StagingArea stagingArea;
    private final EventBus eventBus;
    private final TengenMetrics metrics;

    public SaveGameOrchestrator(GtpClient client,
                                GameHandle gameHandle,
                                StagingArea stagingArea,
                                EventBus eventBus,
                                @Autowired(required = false) TengenMetrics metrics) {
        this.client = client;
        this.gameHandle = gameHandle;
        this.stagingArea = stagingArea;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Saves the current game to {@code target}.
     *
     * @return the file written
     * @throws SaveFailure if there is no game, the engine cannot save it, or the file
     *                     cannot be moved into place
     * @throws com.tengen.gtp.EngineUnavailableException if the engine is not running
     */
    public Path save(Path target) throws SaveFailure {
        try {
            Path saved = gameHandle.exclusively(() -> attempt(target));
            record(true);
            return saved;
        } catch (SaveFailure e) {
            log.warn("Save to {} failed: {}", target, e.getMessage());
            record(false);
            throw e;
        }
    }

    private Path attempt(Path target) throws SaveFailure {
        GoGame game = gameHandle.current();
        if (game == null) {
            throw new SaveFailure("There is no game to save.");
        }
        Path staged;
        try {
            staged = stagingArea.prepare();
        } catch (IOException e) {
            throw new SaveFailure("Could not prepare the staging directory: " + e.getMessage(), e);
        }
        try {
            GtpResponse response = client.submitAndWait("savesgf " + stagingArea.stagedName());
            if (!response.success()) {
                throw new SaveFailure("The engine could not save the game: " + response.payload());
            }
            try {
                stagingArea.unstage(target);
            } catch (IOException e) {
                throw new SaveFailure("Could not write " + target + ": " + e.getMessage(), e);
            }
        } finally {
            stagingArea.release(staged);
        }

        log.info("Saved game {} to {}", game.id(), target);
        eventBus.publish(GameEvent.of(GameEvent.SAVED, game.id(), Map.of(
                "file", target.toString(),
                "moves", game.moves().size())));
        return target;
    }

    private void record(boolean success) {
        if (metrics != null) {
            metrics.recordSaveResult(success);
        }
    }
}
