package com.tengen.dispatch.cli;

import com.tengen.core.load.LoadGameOrchestrator;
import com.tengen.core.load.LoadProgressListener;
import com.tengen.core.load.LoadResult;
import com.tengen.core.save.SaveFailure;
import com.tengen.core.save.SaveGameOrchestrator;
import com.tengen.gtp.EngineStateException;
import com.tengen.gtp.EngineUnavailableException;
import com.tengen.gtp.GtpLogModel;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * CLI command: tengen save &lt;file&gt; [--from &lt;sgf&gt;]
 * <p>
 * Writes the current game through the engine's {@code savesgf}. With {@code --from}
 * the game is first loaded from another file, which normalises it through the engine.
 */
@Command(name = "save", mixinStandardHelpOptions = true, description = "Save the game as SGF")
@Component
public class SaveCommand implements Runnable {

    @Parameters(index = "0", description = "Destination .sgf file; an existing file is replaced")
    private Path target;

    @Option(names = {"--from"}, description = "Load this .sgf file first")
    private Path source;

    @Option(names = {"--log"}, description = "Print the GTP traffic afterwards")
    private boolean showLog;

    private final SaveGameOrchestrator saveGameOrchestrator;
    private final LoadGameOrchestrator loadGameOrchestrator;
    private final GtpLogModel gtpLog;

    public SaveCommand(SaveGameOrchestrator saveGameOrchestrator, LoadGameOrchestrator loadGameOrchestrator,
                       GtpLogModel gtpLog) {
        this.saveGameOrchestrator = saveGameOrchestrator;
        this.loadGameOrchestrator = loadGameOrchestrator;
        this.gtpLog = gtpLog;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            save();
        } finally {
            if (showLog) {
                ConsoleOutput.gtpLog(gtpLog.items());
            }
        }
    }

    private void save() {
        try {
            if (source != null) {
                ConsoleOutput.info("Loading " + source);
                LoadResult loaded = loadGameOrchestrator.load(source, LoadProgressListener.NONE,
                        (title, message) -> ConsoleOutput.error(title + ": " + message));
                if (!loaded.success()) {
                    ConsoleOutput.error("Nothing saved");
                    return;
                }
            }
            Path saved = saveGameOrchestrator.save(target);
            ConsoleOutput.success("Saved " + saved);
        } catch (SaveFailure e) {
            ConsoleOutput.error(SaveFailure.TITLE + ": " + e.getMessage());
        } catch (EngineUnavailableException e) {
            ConsoleOutput.error(e.getMessage());
        } catch (EngineStateException e) {
            ConsoleOutput.error("Engine is out of sync: " + e.getMessage());
        }
    }
}
