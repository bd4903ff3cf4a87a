package com.tengen.dispatch.cli;

import com.tengen.core.model.GoBoardSize;
import com.tengen.core.model.GoGameType;
import com.tengen.core.newgame.NewGameOrchestrator;
import com.tengen.core.newgame.NewGameRequest;
import com.tengen.core.newgame.NewGameResult;
import com.tengen.core.newgame.NewGameSettings;
import com.tengen.core.save.SaveFailure;
import com.tengen.core.save.SaveGameOrchestrator;
import com.tengen.gtp.EngineStateException;
import com.tengen.gtp.EngineUnavailableException;
import com.tengen.gtp.GtpLogModel;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: tengen new
 * <p>
 * Starts a new game with the configured defaults, optionally overridden.
 */
@Command(name = "new", mixinStandardHelpOptions = true, description = "Start a new game")
@Component
public class NewCommand implements Runnable {

    @Option(names = {"--size", "-s"}, description = "Board size: 7, 9, 11, 13, 15, 17 or 19")
    private Integer boardSize;

    @Option(names = {"--handicap"}, description = "Number of handicap stones (0 or 2-9)")
    private Integer handicap;

    @Option(names = {"--komi", "-k"}, description = "Komi")
    private Double komi;

    @Option(names = {"--type", "-t"},
            description = "Game type: HUMAN_VS_HUMAN, COMPUTER_VS_HUMAN, COMPUTER_VS_COMPUTER")
    private GoGameType gameType;

    @Option(names = {"--move-timeout"}, description = "Seconds to wait for the computer's first move",
            defaultValue = "60")
    private long moveTimeoutSeconds;

    @Option(names = {"--save"}, description = "Save the game to this SGF file once it is set up")
    private Path saveTo;

    @Option(names = {"--log"}, description = "Print the GTP traffic afterwards")
    private boolean showLog;

    private final NewGameOrchestrator newGameOrchestrator;
    private final NewGameSettings settings;
    private final SaveGameOrchestrator saveGameOrchestrator;
    private final GtpLogModel gtpLog;

    public NewCommand(NewGameOrchestrator newGameOrchestrator, NewGameSettings settings,
                      SaveGameOrchestrator saveGameOrchestrator, GtpLogModel gtpLog) {
        this.newGameOrchestrator = newGameOrchestrator;
        this.settings = settings;
        this.saveGameOrchestrator = saveGameOrchestrator;
        this.gtpLog = gtpLog;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            startGame();
        } finally {
            if (showLog) {
                ConsoleOutput.gtpLog(gtpLog.items());
            }
        }
    }

    private void startGame() {

        NewGameRequest request;
        try {
            var builder = NewGameRequest.from(settings);
            if (boardSize != null) {
                builder.boardSize(GoBoardSize.of(boardSize));
            }
            if (handicap != null) {
                builder.handicap(handicap);
            }
            if (komi != null) {
                builder.komi(komi);
            }
            if (gameType != null) {
                builder.gameType(gameType);
            }
            request = builder.build();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        NewGameResult result;
        try {
            result = newGameOrchestrator.createGame(request);
        } catch (EngineUnavailableException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        } catch (EngineStateException e) {
            ConsoleOutput.error("Engine is out of sync: " + e.getMessage());
            return;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid game setup: " + e.getMessage());
            return;
        }

        ConsoleOutput.success("New game started");
        if (result.computerMove() != null) {
            try {
                ConsoleOutput.move(result.computerMove().await(Duration.ofSeconds(moveTimeoutSeconds)));
            } catch (TimeoutException e) {
                ConsoleOutput.error("Computer did not move within " + moveTimeoutSeconds + "s");
            } catch (ExecutionException e) {
                ConsoleOutput.error("Computer move failed: " + e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ConsoleOutput.error("Interrupted while waiting for the computer");
            }
        }
        ConsoleOutput.game(result.game());

        if (saveTo != null) {
            try {
                ConsoleOutput.success("Saved " + saveGameOrchestrator.save(saveTo));
            } catch (SaveFailure e) {
                ConsoleOutput.error(SaveFailure.TITLE + ": " + e.getMessage());
            } catch (EngineUnavailableException e) {
                ConsoleOutput.error(e.getMessage());
            }
        }
    }
}
