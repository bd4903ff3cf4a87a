package com.tengen.core.load;

import com.tengen.core.events.EventBus;
import com.tengen.core.events.GameEvent;
import com.tengen.core.logging.MdcContext;
import com.tengen.core.metrics.TengenMetrics;
import com.tengen.core.model.GameHandle;
import com.tengen.core.model.GoBoardSize;
import com.tengen.core.model.GoGame;
import com.tengen.core.model.MoveCheck;
import com.tengen.core.model.Vertex;
import com.tengen.core.newgame.NewGameOrchestrator;
import com.tengen.core.newgame.NewGameRequest;
import com.tengen.core.newgame.NewGameSettings;
import com.tengen.gtp.ComputerMove;
import com.tengen.gtp.ComputerMoveTrigger;
import com.tengen.gtp.EngineSession;
import com.tengen.gtp.EngineStateException;
import com.tengen.gtp.EngineUnavailableException;
import com.tengen.gtp.GtpClient;
import com.tengen.gtp.GtpResponse;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Loads a saved game through the engine.
 * <p>
 * The engine parses the file; the game is then rebuilt locally from what the engine
 * reports (board size, komi, handicap, moves) and every recovered move is checked
 * against the local rules before it is played. Any failure along the way ends in the
 * same place: a fresh default game is installed, the user gets one message, and the
 * staged file is removed.
 * <p>
 * An {@link EngineStateException} is not recovered. It means the engine rejected a
 * configuration command and propagates once the staged file has been released.
 */
@Service
public class LoadGameOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(LoadGameOrchestrator.class);

    static final int MAX_REPLAY_PROGRESS_STEPS = 10;
    private static final int FIXED_PROGRESS_STEPS = LoadStage.REPLAY.ordinal();
    private static final Pattern KOMI = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    private final GtpClient client;
    private final GameHandle gameHandle;
    private final EngineSession engineSession;
    private final NewGameOrchestrator newGameOrchestrator;
    private final NewGameSettings newGameSettings;
    private final ComputerMoveTrigger computerMoveTrigger;
    private final StagingArea stagingArea;
    private final EventBus eventBus;
    private final TengenMetrics metrics;
    private final ExecutorService loadWorker = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "load-worker");
        thread.setDaemon(true);
        return thread;
    });

    public LoadGameOrchestrator(GtpClient client,
                                GameHandle gameHandle,
                                EngineSession engineSession,
                                NewGameOrchestrator newGameOrchestrator,
                                NewGameSettings newGameSettings,
                                ComputerMoveTrigger computerMoveTrigger,
                                StagingArea stagingArea,
                                EventBus eventBus,
                                @Autowired(required = false) TengenMetrics metrics) {
        this.client = client;
        this.gameHandle = gameHandle;
        this.engineSession = engineSession;
        this.newGameOrchestrator = newGameOrchestrator;
        this.newGameSettings = newGameSettings;
        this.computerMoveTrigger = computerMoveTrigger;
        this.stagingArea = stagingArea;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Loads {@code file} on the calling thread, logging failures only.
     */
    public LoadResult load(Path file) {
        return load(file, LoadProgressListener.NONE,
                (title, message) -> log.debug("No failure reporter attached for: {}", message));
    }

    /**
     * Runs the whole load attempt on a dedicated worker thread.
     */
    public CompletableFuture<LoadResult> loadAsync(Path file, LoadProgressListener progress,
                                                   LoadFailureReporter reporter) {
        return CompletableFuture.supplyAsync(() -> load(file, progress, reporter), loadWorker);
    }

    /**
     * Loads {@code file} on the calling thread. Waits while another game operation runs;
     * the staged file and the engine position belong to one attempt at a time.
     *
     * @throws EngineStateException if the engine rejected a configuration command
     */
    public LoadResult load(Path file, LoadProgressListener progress, LoadFailureReporter reporter) {
        return gameHandle.exclusively(() -> attempt(file, progress, reporter));
    }

    private LoadResult attempt(Path file, LoadProgressListener progress, LoadFailureReporter reporter) {
        var session = new LoadSession(file);
        var tracker = new ProgressTracker(progress);
        MdcContext.setLoad(session.id());
        log.info("Loading game from {}", file);
        try {
            LoadResult result;
            try {
                result = runChain(session, tracker);
            } catch (LoadFailure failure) {
                result = recover(session, failure, reporter);
            } catch (EngineUnavailableException e) {
                result = recover(session, new LoadFailure(session.stage(),
                        "The engine is not running: " + e.getMessage(), e), reporter);
            }
            tracker.complete(result.success() ? LoadStage.COMPLETE.progressLabel() : LoadFailure.TITLE);
            record(result);
            return result;
        } catch (EngineStateException e) {
            log.error("Engine rejected setup during load at {}: {}", session.stage(), e.getMessage());
            if (metrics != null) {
                metrics.recordLoadResult(false, session.stage().name());
            }
            throw e;
        } finally {
            releaseStagedFile(session);
            MdcContext.clearLoad();
        }
    }

    @PreDestroy
    void shutdown() {
        loadWorker.shutdown();
        try {
            if (!loadWorker.awaitTermination(5, TimeUnit.SECONDS)) {
                loadWorker.shutdownNow();
            }
        } catch (InterruptedException e) {
            loadWorker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private LoadResult runChain(LoadSession session, ProgressTracker tracker) throws LoadFailure {
        enter(session, LoadStage.STAGE, tracker);
        try {
            session.setStagedFile(stagingArea.stage(session.sourceFile()));
        } catch (IOException e) {
            throw new LoadFailure(LoadStage.STAGE, LoadStage.STAGE.defaultFailureMessage(), e);
        }

        enter(session, LoadStage.ENGINE_LOAD, tracker);
        engineSession.stopPondering();
        GtpResponse loaded = client.submitAndWait("loadsgf " + stagingArea.stagedName());
        if (!loaded.success()) {
            log.warn("Engine refused to load {}: {}", session.sourceFile(), loaded.payload());
            throw LoadFailure.at(LoadStage.ENGINE_LOAD);
        }
        releaseStagedFile(session);

        enter(session, LoadStage.RECOVER_BOARD_SIZE, tracker);
        int dimension = countBoardRows(query("showboard", LoadStage.RECOVER_BOARD_SIZE));
        if (!GoBoardSize.isSupported(dimension)) {
            throw new LoadFailure(LoadStage.RECOVER_BOARD_SIZE,
                    "The board size is not supported: " + dimension);
        }
        session.setBoardSize(GoBoardSize.of(dimension));

        enter(session, LoadStage.RECOVER_KOMI, tracker);
        session.setKomiText(query("get_komi", LoadStage.RECOVER_KOMI).payload());

        enter(session, LoadStage.RECOVER_HANDICAP, tracker);
        session.setHandicapText(query("list_handicap", LoadStage.RECOVER_HANDICAP).payload());

        enter(session, LoadStage.RECOVER_MOVES, tracker);
        session.setMovesText(query("list_moves", LoadStage.RECOVER_MOVES).payload());

        enter(session, LoadStage.MATERIALIZE, tracker);
        GoGame game = materialize(session);

        enter(session, LoadStage.REPLAY, tracker);
        List<String> moves = MoveListParser.split(session.movesText());
        ReplayFailure replayFailure = replay(game, moves, tracker);
        if (replayFailure != null) {
            log.warn("Replay stopped at move {}: {}", replayFailure.moveNumber(), replayFailure.message());
            throw new LoadFailure(LoadStage.REPLAY, replayFailure.message());
        }

        enter(session, LoadStage.COMPLETE, tracker);
        return complete(session, game, moves.size());
    }

    private void enter(LoadSession session, LoadStage stage, ProgressTracker tracker) {
        if (stage != LoadStage.STAGE) {
            session.advanceTo(stage);
        }
        MdcContext.setStage(session.id(), stage.name());
        if (stage.ordinal() < LoadStage.REPLAY.ordinal()) {
            tracker.step(stage.progressLabel());
        }
        log.debug("Load stage {}", stage);
    }

    private GtpResponse query(String command, LoadStage stage) throws LoadFailure {
        GtpResponse response = client.submitAndWait(command);
        if (!response.success()) {
            log.warn("Engine could not answer {}: {}", command, response.payload());
            throw LoadFailure.at(stage);
        }
        return response;
    }

    /**
     * Counts the board rows in a {@code showboard} diagram. Row lines start with the
     * row number; header and footer lines start with column letters.
     */
    static int countBoardRows(GtpResponse showboard) {
        int rows = 0;
        for (String line : showboard.payloadLines()) {
            String trimmed = line.stripLeading();
            if (!trimmed.isEmpty() && Character.isDigit(trimmed.charAt(0))) {
                rows++;
            }
        }
        return rows;
    }

    private GoGame materialize(LoadSession session) throws LoadFailure {
        double komi;
        List<Vertex> handicap;
        try {
            komi = parseKomi(session.komiText());
            handicap = parseHandicap(session.handicapText(), session.boardSize());
        } catch (IllegalArgumentException e) {
            throw new LoadFailure(LoadStage.MATERIALIZE, LoadStage.MATERIALIZE.defaultFailureMessage()
                    + " " + e.getMessage(), e);
        }

        NewGameRequest request = NewGameRequest.from(newGameSettings)
                .boardSize(session.boardSize())
                .handicap(0)
                .komi(komi)
                .setupGtpBoard(false)
                .setupGtpHandicapAndKomi(false)
                .setupComputerPlayer(false)
                .triggerComputerPlayer(false)
                .build();
        GoGame game = newGameOrchestrator.createGame(request).game();
        game.setHandicapPoints(handicap);
        game.setKomi(komi);
        log.info("Recovered {}x{} game, komi {}, {} handicap stone(s)",
                session.boardSize().dimension(), session.boardSize().dimension(), komi, handicap.size());
        return game;
    }

    static double parseKomi(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        String trimmed = text.trim();
        if (!KOMI.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Invalid komi: " + text);
        }
        double komi = Double.parseDouble(trimmed);
        if (!Double.isFinite(komi)) {
            throw new IllegalArgumentException("Invalid komi: " + text);
        }
        return komi;
    }

    static List<Vertex> parseHandicap(String text, GoBoardSize boardSize) {
        var points = new ArrayList<Vertex>();
        if (text == null || text.isBlank()) {
            return points;
        }
        for (String token : text.trim().split("\\s+")) {
            points.add(Vertex.parse(token, boardSize.dimension()));
        }
        return points;
    }

    /**
     * Plays the recovered moves into {@code game}.
     *
     * @return the first failure, or {@code null} if every move was replayed
     */
    private ReplayFailure replay(GoGame game, List<String> moves, ProgressTracker tracker) {
        int movesPerStep = Math.max(1, (moves.size() + MAX_REPLAY_PROGRESS_STEPS - 1) / MAX_REPLAY_PROGRESS_STEPS);
        int dimension = game.boardSize().dimension();
        for (int index = 0; index < moves.size(); index++) {
            int moveNumber = index + 1;
            String text = moves.get(index);
            MoveRecord move;
            try {
                move = MoveListParser.parse(text, dimension);
            } catch (IllegalArgumentException e) {
                return ReplayFailure.invalidMove(moveNumber, text, e.getMessage());
            }

            try {
                ReplayFailure failure = replayOne(game, moveNumber, move);
                if (failure != null) {
                    return failure;
                }
            } catch (RuntimeException e) {
                log.error("Rules engine failed on move {} ({}): {}", moveNumber, text, e.getMessage(), e);
                return ReplayFailure.invalidMove(moveNumber, text, e.getMessage());
            }

            if (moveNumber % movesPerStep == 0) {
                tracker.replayStep(LoadStage.REPLAY.progressLabel());
            }
        }
        return null;
    }

    private ReplayFailure replayOne(GoGame game, int moveNumber, MoveRecord move) {
        if (game.state() == GoGame.State.HAS_ENDED) {
            // a game ended by two passes continues if the record has more moves
            if (game.endReason() != GoGame.EndReason.TWO_PASSES) {
                return ReplayFailure.illegalMove(moveNumber, move.color(), move.target(),
                        MoveCheck.IllegalReason.GAME_HAS_ENDED.description());
            }
            game.revertEndedToInProgress();
        }
        if (move.color() != game.currentColorToMove()) {
            return ReplayFailure.illegalMove(moveNumber, move.color(), move.target(),
                    MoveCheck.IllegalReason.WRONG_COLOR.description());
        }
        switch (move.kind()) {
            case PASS -> game.pass();
            case RESIGN -> game.resign();
            case PLAY -> {
                MoveCheck check = game.isLegalMove(move.vertex(), move.color());
                if (!check.legal()) {
                    return ReplayFailure.illegalMove(moveNumber, move.color(), move.target(),
                            check.reason().description());
                }
                game.play(move.vertex());
            }
        }
        return null;
    }

    private LoadResult complete(LoadSession session, GoGame game, int movesReplayed) {
        eventBus.publish(GameEvent.of(GameEvent.LOADED, game.id(), Map.of(
                "file", session.sourceFile().getFileName().toString(),
                "boardSize", game.boardSize().dimension(),
                "moves", movesReplayed)));
        engineSession.setupComputerPlayer(game);
        engineSession.restorePondering(game);

        ComputerMove computerMove = null;
        if (game.isComputerPlayersTurn()) {
            computerMove = computerMoveTrigger.trigger(game);
        }
        log.info("Loaded {} with {} move(s)", session.sourceFile(), movesReplayed);
        return LoadResult.loaded(game, movesReplayed, computerMove);
    }

    /**
     * The single failure path. Installs a default game, mirroring it into the engine
     * only if the engine is still reachable, and reports the failure once.
     */
    private LoadResult recover(LoadSession session, LoadFailure failure, LoadFailureReporter reporter) {
        session.markFailed();
        if (failure.getCause() != null && !(failure.getCause() instanceof IOException)) {
            log.warn("Load failed at {}: {}", failure.getStage(), failure.getMessage(), failure.getCause());
        } else {
            log.warn("Load failed at {}: {}", failure.getStage(), failure.getMessage());
        }
        releaseStagedFile(session);

        GoGame fallback = installDefaultGame();
        try {
            reporter.report(LoadFailure.TITLE, failure.getMessage());
        } catch (RuntimeException e) {
            log.warn("Failure reporter threw: {}", e.getMessage(), e);
        }
        return LoadResult.failed(failure.getStage(), failure.getMessage(), fallback);
    }

    private GoGame installDefaultGame() {
        boolean engineAvailable = client.isEngineAvailable();
        NewGameRequest.Builder request = NewGameRequest.from(newGameSettings).triggerComputerPlayer(false);
        if (!engineAvailable) {
            request.localOnly();
        }
        try {
            GoGame game = newGameOrchestrator.createGame(request.build()).game();
            if (engineAvailable) {
                engineSession.restorePondering(game);
            }
            return game;
        } catch (EngineUnavailableException e) {
            log.warn("Engine went away while installing the default game: {}", e.getMessage());
            return newGameOrchestrator.createGame(
                    NewGameRequest.from(newGameSettings).localOnly().build()).game();
        }
    }

    private void releaseStagedFile(LoadSession session) {
        if (session.hasStagedFile() && !session.isStagedFileReleased()) {
            stagingArea.release(session.stagedFile());
            session.markStagedFileReleased();
        }
    }

    private void record(LoadResult result) {
        if (metrics == null) {
            return;
        }
        metrics.recordLoadResult(result.success(), result.stage().name());
        if (result.success()) {
            metrics.recordReplayedMoves(result.movesReplayed());
        }
    }

    /**
     * Turns stage transitions and replay batches into a monotonic fraction.
     */
    static final class ProgressTracker {
        private static final int TOTAL_STEPS = FIXED_PROGRESS_STEPS + MAX_REPLAY_PROGRESS_STEPS + 1;

        private final LoadProgressListener listener;
        private int stepsDone;
        private int replaySteps;

        ProgressTracker(LoadProgressListener listener) {
            this.listener = listener;
        }

        void step(String label) {
            stepsDone++;
            report(label);
        }

        void replayStep(String label) {
            if (replaySteps < MAX_REPLAY_PROGRESS_STEPS) {
                replaySteps++;
                step(label);
            }
        }

        void complete(String label) {
            stepsDone = TOTAL_STEPS;
            report(label);
        }

        private void report(String label) {
            try {
                listener.progress(Math.min(1.0, (double) stepsDone / TOTAL_STEPS), label);
            } catch (RuntimeException e) {
                log.warn("Progress listener threw: {}", e.getMessage(), e);
            }
        }
    }
}
