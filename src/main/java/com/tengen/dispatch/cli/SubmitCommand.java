package com.tengen.dispatch.cli;

import com.tengen.gtp.EngineUnavailableException;
import com.tengen.gtp.GtpClient;
import com.tengen.gtp.GtpLogModel;
import com.tengen.gtp.GtpResponse;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: tengen gtp &lt;command...&gt;
 * <p>
 * Sends one raw GTP command to the engine and prints the response.
 */
@Command(name = "gtp", mixinStandardHelpOptions = true, description = "Send a raw GTP command to the engine")
@Component
public class SubmitCommand implements Runnable {

    @Parameters(arity = "1..*", description = "Command verb and arguments, e.g. showboard")
    private String[] words;

    @Option(names = {"--log"}, description = "Print the GTP traffic afterwards")
    private boolean showLog;

    private final GtpClient client;
    private final GtpLogModel gtpLog;

    public SubmitCommand(GtpClient client, GtpLogModel gtpLog) {
        this.client = client;
        this.gtpLog = gtpLog;
    }

    @Override
    public void run() {
        String command = String.join(" ", words);
        try {
            GtpResponse response = client.submitAndWait(command);
            ConsoleOutput.gtp(response.success(), response.payload());
        } catch (EngineUnavailableException e) {
            ConsoleOutput.error(e.getMessage());
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid command: " + e.getMessage());
        }
        if (showLog) {
            ConsoleOutput.gtpLog(gtpLog.items());
        }
    }
}
