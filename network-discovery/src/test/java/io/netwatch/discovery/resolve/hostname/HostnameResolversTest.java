package io.netwatch.discovery.resolve.hostname;

import io.netwatch.discovery.ScriptedCommandRunner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class HostnameResolversTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    @Test
    void reverseDnsRejectsNonAnswers() {
        assertTrue(ReverseDns.accept("192.168.1.9", "192.168.1.9").isEmpty());
        assertTrue(ReverseDns.accept("192.168.1.9", "9.1.168.192.in-addr.arpa").isEmpty());
        assertTrue(ReverseDns.accept("192.168.1.9", " ").isEmpty());
        assertEquals(Optional.of("tv.lan"), ReverseDns.accept("192.168.1.9", "tv.lan"));
    }

    @Test
    void reverseDnsUsesLookup() throws Exception {
        assertEquals(Optional.of("tv.lan"), new ReverseDns(ip -> "tv.lan", TIMEOUT).resolve("192.168.1.9"));
        assertTrue(new ReverseDns(ip -> {
            throw new UnknownHostException(ip);
        }, TIMEOUT).resolve("192.168.1.9").isEmpty());
    }

    @Test
    void reverseDnsTimesOut() {
        ReverseDns slow = new ReverseDns(ip -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late.lan";
        }, Duration.ofMillis(50));

        assertThrows(TimeoutException.class, () -> slow.resolve("192.168.1.9"));
    }

    @Test
    void hungLookupsHoldAtMostTheFixedPool() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ReverseDns hung = new ReverseDns(ip -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }, Duration.ofMillis(20));

        try {
            for (int i = 0; i < ReverseDns.LOOKUP_THREADS * 3; i++) {
                String ip = "10.0.0." + i;
                assertThrows(TimeoutException.class, () -> hung.resolve(ip));
            }
            assertTrue(ReverseDns.lookupThreadCount() <= ReverseDns.LOOKUP_THREADS);
        } finally {
            release.countDown();
        }
    }

    @Test
    void getentTakesFirstName() throws Exception {
        Getent getent = new Getent(ScriptedCommandRunner.returning(0, "192.168.1.9     tv.lan tv\n", ""), TIMEOUT);

        assertEquals(Optional.of("tv.lan"), getent.resolve("192.168.1.9"));
        assertTrue(new Getent(ScriptedCommandRunner.returning(2, "", ""), TIMEOUT).resolve("192.168.1.9").isEmpty());
    }

    @Test
    void hostsFileLookup(@TempDir Path dir) throws Exception {
        Path hosts = dir.resolve("hosts");
        Files.write(hosts, ("127.0.0.1 localhost\n"
            + "# 192.168.1.9 commented.lan\n"
            + "192.168.1.90 other.lan\n"
            + "192.168.1.9\tnas.lan nas # storage\n").getBytes(StandardCharsets.UTF_8));

        HostsFile resolver = new HostsFile(hosts);

        assertEquals(Optional.of("nas.lan"), resolver.resolve("192.168.1.9"));
        assertTrue(resolver.resolve("192.168.1.10").isEmpty());
        assertTrue(new HostsFile(dir.resolve("missing")).resolve("192.168.1.9").isEmpty());
    }
}
