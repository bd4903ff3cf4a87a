package com.tengen.gtp;

import com.tengen.core.metrics.TengenMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

    @Bean(destroyMethod = "close")
    public GtpEngineProcess gtpEngineProcess(EngineProperties properties) {
        var process = new GtpEngineProcess(properties.getCommand(), properties.workingDirectoryPath());
        process.start();
        return process;
    }

    @Bean
    public GtpLogModel gtpLogModel(EngineProperties properties) {
        return new GtpLogModel(properties.getLogSize());
    }

    /**
     * The single command channel to the engine. Traffic is mirrored into the GTP log
     * and, when metrics are enabled, into {@code tengen.gtp.commands}.
     */
    @Bean(destroyMethod = "shutdown")
    public GtpClient gtpClient(GtpEngineProcess process, GtpLogModel gtpLog,
                               @Autowired(required = false) TengenMetrics metrics) {
        var client = new GtpClient(process);
        client.addListener(gtpLog);
        if (metrics != null) {
            client.addListener(new GtpClientListener() {
                @Override
                public void responseReceived(GtpCommand command, GtpResponse response, long elapsedNanos) {
                    metrics.recordCommand(command.verb(), response.success(), elapsedNanos);
                }
            });
        }
        return client;
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
