package com.tengen.core.health;

import com.tengen.gtp.EngineUnavailableException;
import com.tengen.gtp.GtpClient;
import com.tengen.gtp.GtpEngineProcess;
import com.tengen.gtp.GtpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final GtpClient client;
    private final GtpEngineProcess engineProcess;

    public HealthCheckService(
            @Autowired(required = false) GtpClient client,
            @Autowired(required = false) GtpEngineProcess engineProcess) {
        this.client = client;
        this.engineProcess = engineProcess;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkProcess());
        results.add(checkProtocol());
        return results;
    }

    private HealthStatus checkProcess() {
        if (engineProcess == null) {
            return new HealthStatus("engine", HealthStatus.Status.DOWN,
                    "No engine process configured", Map.of());
        }
        var metadata = Map.of(
                "command", String.join(" ", engineProcess.command()),
                "workingDirectory", engineProcess.workingDirectory().toString());
        if (engineProcess.isAlive()) {
            return new HealthStatus("engine", HealthStatus.Status.UP, "Engine process running", metadata);
        }
        return new HealthStatus("engine", HealthStatus.Status.DOWN, "Engine process not running", metadata);
    }

    /**
     * Asks the engine for its name. A process that is alive but rejects the command is degraded.
     */
    private HealthStatus checkProtocol() {
        if (client == null) {
            return new HealthStatus("gtp", HealthStatus.Status.DOWN,
                    "No GTP client configured", Map.of());
        }
        try {
            GtpResponse name = client.submitAndWait("name");
            if (name.success()) {
                return new HealthStatus("gtp", HealthStatus.Status.UP,
                        "Engine answers as " + name.payload(), Map.of("queueState", client.state().name()));
            }
            return new HealthStatus("gtp", HealthStatus.Status.DEGRADED,
                    "Engine rejected 'name': " + name.payload(), Map.of());
        } catch (EngineUnavailableException e) {
            log.warn("GTP health check failed: {}", e.getMessage());
            return new HealthStatus("gtp", HealthStatus.Status.DOWN, e.getMessage(), Map.of());
        }
    }
}
