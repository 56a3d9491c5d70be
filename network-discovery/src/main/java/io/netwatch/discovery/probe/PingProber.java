package io.netwatch.discovery.probe;

import io.netwatch.discovery.exec.CommandResult;
import io.netwatch.discovery.exec.CommandRunner;
import io.netwatch.discovery.range.Ipv4;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Probes with the system {@code ping} binary, one echo request per call.
 * <p>
 * The exit status is not trusted: ping exits non-zero for plenty of reasons that still come
 * with a reply. A host is up exactly when a round trip time can be read from the output.
 */
public class PingProber implements Prober {

    private static final Logger logger = LoggerFactory.getLogger(PingProber.class);

    static final long PROCESS_GRACE_MS = 500;

    private final CommandRunner runner;
    private final Duration timeout;
    private final boolean windows;

    public PingProber(CommandRunner runner, Duration timeout) {
        this(runner, timeout, System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win"));
    }

    public PingProber(CommandRunner runner, Duration timeout, boolean windows) {
        this.runner = runner;
        this.timeout = timeout;
        this.windows = windows;
    }

    List<String> command(String ip) {
        if (windows) {
            return Arrays.asList("ping", "-n", "1", "-w", String.valueOf(timeout.toMillis()), ip);
        }
        long seconds = Math.max(1, timeout.toMillis() / 1000);
        return Arrays.asList("ping", "-c", "1", "-W", String.valueOf(seconds), ip);
    }

    @Override
    public ProbeResult probe(String ip) {
        if (!Ipv4.isValid(ip)) {
            logger.debug("Not probing invalid address {}", ip);
            return ProbeResult.unreachable();
        }

        try {
            CommandResult result = runner.run(command(ip), timeout.plusMillis(PROCESS_GRACE_MS));
            Integer latency = PingOutputParser.parseLatency(result.getStdout());
            if (latency != null) {
                return ProbeResult.reachable(latency);
            }
            if (isPermissionProblem(result.getStderr())) {
                logger.warn("Ping permission denied for {}. Raw socket access (NET_RAW) is required.", ip);
                return ProbeResult.failed(ProbeFailure.PERMISSION_DENIED);
            }
            return ProbeResult.unreachable();

        } catch (TimeoutException e) {
            logger.debug("Ping timeout for {} (host may be offline)", ip);
            return ProbeResult.failed(ProbeFailure.TIMEOUT);
        } catch (IOException e) {
            String message = String.valueOf(e.getMessage());
            if (isPermissionProblem(message) || message.contains("error=13,")) {
                logger.warn("Ping permission denied for {}: {}", ip, message);
                return ProbeResult.failed(ProbeFailure.PERMISSION_DENIED);
            }
            if (message.contains("error=2,") || message.contains("No such file")) {
                logger.error("Ping command not found, make sure ping is installed: {}", message);
                return ProbeResult.failed(ProbeFailure.BINARY_MISSING);
            }
            logger.error("Failed to start ping for {}", ip, e);
            return ProbeResult.failed(ProbeFailure.SPAWN_FAILED);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Ping for {} interrupted", ip);
            return ProbeResult.failed(ProbeFailure.TIMEOUT);
        }
    }

    private static boolean isPermissionProblem(String text) {
        return text != null && (text.contains("Permission denied") || text.contains("Operation not permitted"));
    }
}
