package io.netwatch.discovery.schedule;

import io.netwatch.discovery.TestDatabases;
import io.netwatch.discovery.probe.ProbeResult;
import io.netwatch.registry.model.LatencyMeasurement;
import io.netwatch.registry.service.LatencyService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LatencyMonitorTest {

    private LatencyService latency;
    private LatencyMonitor monitor;

    @BeforeEach
    void setUp() {
        latency = new LatencyService(TestDatabases.newDatabase());
        monitor = new LatencyMonitor(
            ip -> ip.endsWith(".1") ? ProbeResult.reachable(12) : ProbeResult.unreachable(),
            latency);
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
    }

    @Test
    void measuresOnlyEnabledAddresses() {
        latency.enable("192.168.1.1");
        latency.enable("192.168.1.2");
        latency.enable("192.168.1.3");
        latency.disable("192.168.1.3");

        assertEquals(2, monitor.runCycle());

        List<LatencyMeasurement> up = latency.getMeasurements("192.168.1.1", 1);
        assertEquals(1, up.size());
        assertEquals(12.0, up.get(0).getLatencyMs());
        assertFalse(up.get(0).isPacketLoss());

        List<LatencyMeasurement> down = latency.getMeasurements("192.168.1.2", 1);
        assertTrue(down.get(0).isPacketLoss());
        assertNull(down.get(0).getLatencyMs());
        assertTrue(latency.getMeasurements("192.168.1.3", 1).isEmpty());
    }

    @Test
    void nothingEnabled() {
        assertEquals(0, monitor.runCycle());
    }
}
