package com.tengen.dispatch.cli;

import com.tengen.core.load.LoadGameOrchestrator;
import com.tengen.core.load.LoadResult;
import com.tengen.gtp.EngineStateException;
import com.tengen.gtp.GtpLogModel;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: tengen load &lt;file&gt;
 * <p>
 * Loads an SGF file through the engine and prints the resulting position. A file that
 * cannot be loaded leaves a fresh default game behind.
 */
@Command(name = "load", mixinStandardHelpOptions = true, description = "Load a saved game (SGF)")
@Component
public class LoadCommand implements Runnable {

    @Parameters(index = "0", description = "Path to the .sgf file")
    private Path file;

    @Option(names = {"--quiet", "-q"}, description = "Do not print progress")
    private boolean quiet;

    @Option(names = {"--move-timeout"}, description = "Seconds to wait for the computer's move",
            defaultValue = "60")
    private long moveTimeoutSeconds;

    @Option(names = {"--log"}, description = "Print the GTP traffic afterwards")
    private boolean showLog;

    private final LoadGameOrchestrator loadGameOrchestrator;
    private final GtpLogModel gtpLog;

    public LoadCommand(LoadGameOrchestrator loadGameOrchestrator, GtpLogModel gtpLog) {
        this.loadGameOrchestrator = loadGameOrchestrator;
        this.gtpLog = gtpLog;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            load();
        } finally {
            if (showLog) {
                ConsoleOutput.gtpLog(gtpLog.items());
            }
        }
    }

    private void load() {
        ConsoleOutput.info("Loading " + file);

        LoadResult result;
        try {
            result = loadGameOrchestrator.loadAsync(file,
                    (fraction, label) -> {
                        if (!quiet) {
                            ConsoleOutput.progress(fraction, label);
                        }
                    },
                    (title, message) -> ConsoleOutput.error(title + ": " + message)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted while loading");
            return;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof EngineStateException) {
                ConsoleOutput.error("Engine is out of sync: " + e.getCause().getMessage());
                return;
            }
            ConsoleOutput.error("Load failed: " + e.getCause().getMessage());
            return;
        }

        if (result.success()) {
            ConsoleOutput.success("Loaded " + file.getFileName() + " (" + result.movesReplayed() + " moves)");
        } else {
            ConsoleOutput.info("Started a new game instead");
        }
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
    }
}
