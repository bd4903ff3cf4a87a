package com.tengen.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for engine traffic and game loading.
 */
@Service
public class TengenMetrics {

    private final MeterRegistry registry;

    public TengenMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one command round trip.
     *
     * @param verb    first word of the command, e.g. {@code loadsgf}
     * @param success whether the engine answered with {@code =}
     */
    public void recordCommand(String verb, boolean success, long nanos) {
        Timer.builder("tengen.gtp.commands")
                .description("GTP command round trips")
                .tag("verb", verb)
                .tag("status", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofNanos(nanos));
    }

    public void recordLoadResult(boolean success, String stage) {
        Counter.builder("tengen.load.results")
                .description("Game load attempts by outcome and the stage they reached")
                .tag("outcome", success ? "success" : "failure")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordSaveResult(boolean success) {
        Counter.builder("tengen.save.results")
                .description("Game save attempts by outcome")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordReplayedMoves(int count) {
        DistributionSummary.builder("tengen.load.replayed_moves")
                .description("Moves replayed per successful load")
                .register(registry)
                .record(count);
    }
}
