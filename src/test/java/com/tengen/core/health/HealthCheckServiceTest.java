package com.tengen.core.health;

import com.tengen.gtp.EngineUnavailableException;
import com.tengen.gtp.GtpClient;
import com.tengen.gtp.GtpEngineProcess;
import com.tengen.gtp.GtpResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private static GtpEngineProcess process(boolean alive) {
        GtpEngineProcess process = mock(GtpEngineProcess.class);
        when(process.isAlive()).thenReturn(alive);
        when(process.command()).thenReturn(List.of("fuego"));
        when(process.workingDirectory()).thenReturn(Path.of("/tmp/tengen"));
        return process;
    }

    @Test
    @DisplayName("running engine that answers is UP")
    void allUp() {
        GtpClient client = mock(GtpClient.class);
        when(client.submitAndWait("name")).thenReturn(GtpResponse.parse("name", "= Fuego"));
        when(client.state()).thenReturn(GtpClient.State.IDLE);

        var checks = new HealthCheckService(client, process(true)).checkAll();

        assertEquals(2, checks.size());
        assertEquals(HealthStatus.Status.UP, checks.get(0).status());
        assertEquals("fuego", checks.get(0).metadata().get("command"));
        assertEquals(HealthStatus.Status.UP, checks.get(1).status());
        assertEquals("Engine answers as Fuego", checks.get(1).detail());
    }

    @Test
    @DisplayName("engine that is not running is DOWN")
    void down() {
        GtpClient client = mock(GtpClient.class);
        when(client.submitAndWait("name")).thenThrow(new EngineUnavailableException("GTP engine is not running"));

        var checks = new HealthCheckService(client, process(false)).checkAll();

        assertEquals(HealthStatus.Status.DOWN, checks.get(0).status());
        assertEquals(HealthStatus.Status.DOWN, checks.get(1).status());
    }

    @Test
    @DisplayName("engine rejecting 'name' is DEGRADED")
    void degraded() {
        GtpClient client = mock(GtpClient.class);
        when(client.submitAndWait("name")).thenReturn(GtpResponse.parse("name", "? unknown command"));

        var checks = new HealthCheckService(client, process(true)).checkAll();

        assertEquals(HealthStatus.Status.DEGRADED, checks.get(1).status());
    }

    @Test
    @DisplayName("missing beans are reported as DOWN")
    void missingBeans() {
        var checks = new HealthCheckService(null, null).checkAll();

        assertTrue(checks.stream().allMatch(c -> c.status() == HealthStatus.Status.DOWN));
    }
}
