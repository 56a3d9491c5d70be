package io.netwatch.discovery.probe;

import io.netwatch.discovery.ScriptedCommandRunner;
import io.netwatch.discovery.exec.CommandResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class PingProberTest {

    private static final Duration TIMEOUT = Duration.ofMillis(2000);

    @Test
    void unixCommandUsesWholeSeconds() {
        PingProber prober = new PingProber(ScriptedCommandRunner.returning(0, "", ""), TIMEOUT, false);

        assertEquals(List.of("ping", "-c", "1", "-W", "2", "192.168.1.1"), prober.command("192.168.1.1"));
        assertEquals("1", new PingProber(null, Duration.ofMillis(300), false).command("10.0.0.1").get(4));
    }

    @Test
    void windowsCommandUsesMilliseconds() {
        PingProber prober = new PingProber(ScriptedCommandRunner.returning(0, "", ""), TIMEOUT, true);

        assertEquals(List.of("ping", "-n", "1", "-w", "2000", "192.168.1.1"), prober.command("192.168.1.1"));
    }

    @Test
    void latencyInOutputMeansReachableEvenOnNonZeroExit() {
        ScriptedCommandRunner runner = ScriptedCommandRunner.returning(1,
            "64 bytes from 192.168.1.1: icmp_seq=1 ttl=64 time=7.4 ms", "");

        ProbeResult result = new PingProber(runner, TIMEOUT, false).probe("192.168.1.1");

        assertTrue(result.isSuccess());
        assertEquals(7, result.getLatencyMs());
    }

    @Test
    void zeroExitWithoutLatencyIsUnreachable() {
        ProbeResult result = new PingProber(ScriptedCommandRunner.returning(0, "no answer", ""), TIMEOUT, false)
            .probe("192.168.1.1");

        assertFalse(result.isSuccess());
        assertEquals(ProbeFailure.UNREACHABLE, result.getFailure());
    }

    @Test
    void invalidAddressIsNotSpawned() {
        ScriptedCommandRunner runner = ScriptedCommandRunner.returning(0, "time=1 ms", "");

        ProbeResult result = new PingProber(runner, TIMEOUT, false).probe("192.168.1.999");

        assertEquals(ProbeFailure.UNREACHABLE, result.getFailure());
        assertTrue(runner.getCommands().isEmpty());
    }

    @Test
    void timeoutIsClassified() {
        ScriptedCommandRunner runner = new ScriptedCommandRunner(command -> {
            throw new TimeoutException("took too long");
        });

        ProbeResult result = new PingProber(runner, TIMEOUT, false).probe("192.168.1.1");

        assertFalse(result.isSuccess());
        assertEquals(ProbeFailure.TIMEOUT, result.getFailure());
    }

    @Test
    void missingBinaryIsClassified() {
        ScriptedCommandRunner runner = ScriptedCommandRunner.failingWith(
            new IOException("Cannot run program \"ping\": error=2, No such file or directory"));

        assertEquals(ProbeFailure.BINARY_MISSING, new PingProber(runner, TIMEOUT, false).probe("192.168.1.1").getFailure());
    }

    @Test
    void permissionProblemsAreClassified() {
        ScriptedCommandRunner spawnDenied = ScriptedCommandRunner.failingWith(
            new IOException("Cannot run program \"ping\": error=13, Permission denied"));
        ScriptedCommandRunner socketDenied = ScriptedCommandRunner.returning(2, "",
            "ping: socket: Operation not permitted");

        assertEquals(ProbeFailure.PERMISSION_DENIED, new PingProber(spawnDenied, TIMEOUT, false).probe("192.168.1.1").getFailure());
        assertEquals(ProbeFailure.PERMISSION_DENIED, new PingProber(socketDenied, TIMEOUT, false).probe("192.168.1.1").getFailure());
    }

    @Test
    void otherSpawnErrors() {
        ScriptedCommandRunner runner = ScriptedCommandRunner.failingWith(new IOException("error=24, Too many open files"));

        assertEquals(ProbeFailure.SPAWN_FAILED, new PingProber(runner, TIMEOUT, false).probe("192.168.1.1").getFailure());
    }

    @Test
    void interruptIsRestored() {
        ScriptedCommandRunner runner = new ScriptedCommandRunner(command -> {
            throw new InterruptedException();
        });

        ProbeResult result = new PingProber(runner, TIMEOUT, false).probe("192.168.1.1");

        assertFalse(result.isSuccess());
        assertTrue(Thread.interrupted());
    }

    @Test
    void processTimeoutIncludesGrace() {
        Duration[] seen = new Duration[1];
        PingProber prober = new PingProber((command, timeout) -> {
            seen[0] = timeout;
            return new CommandResult(1, "", "");
        }, TIMEOUT, false);

        prober.probe("192.168.1.1");

        assertEquals(Duration.ofMillis(2000 + PingProber.PROCESS_GRACE_MS), seen[0]);
    }
}
