package io.netwatch.discovery.portscan;

import io.netwatch.discovery.exec.CommandResult;
import io.netwatch.discovery.exec.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class PortScanner {

    private static final Logger logger = LoggerFactory.getLogger(PortScanner.class);

    public static final String DEFAULT_PORT_RANGE = "1-10000";
    static final Duration HOST_TIMEOUT = Duration.ofMinutes(2);

    // "22/tcp   open   ssh"
    private static final Pattern OPEN_PORT = Pattern.compile("^\\s*(\\d+)/(tcp|udp)\\s+open\\b", Pattern.CASE_INSENSITIVE);

    private final CommandRunner runner;
    private final String portRange;

    public PortScanner(CommandRunner runner) {
        this(runner, DEFAULT_PORT_RANGE);
    }

    public PortScanner(CommandRunner runner, String portRange) {
        this.runner = runner;
        this.portRange = portRange;
    }

    public boolean isAvailable() {
        try {
            return runner.run(Arrays.asList("nmap", "--version"), Duration.ofSeconds(5)).isSuccess();
        } catch (IOException | TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Output of a failed run is still parsed; nmap reports partial results before some errors.
     */
    public List<OpenPort> scan(String ip) throws IOException, TimeoutException, InterruptedException {
        CommandResult result = runner.run(Arrays.asList("nmap", "-sT", "-Pn", "-p", portRange, ip), HOST_TIMEOUT);
        if (!result.isSuccess()) {
            logger.debug("nmap exited with {} for {}", result.getExitCode(), ip);
        }
        return parse(result.getStdout());
    }

    static List<OpenPort> parse(String output) {
        List<OpenPort> ports = new ArrayList<>();
        for (String line : output.split("\\R")) {
            Matcher matcher = OPEN_PORT.matcher(line);
            if (matcher.find()) {
                int port = Integer.parseInt(matcher.group(1));
                if (port > 0 && port <= 65535) {
                    ports.add(new OpenPort(port, matcher.group(2).toLowerCase(Locale.ROOT)));
                }
            }
        }
        ports.sort(Comparator.comparingInt(OpenPort::getPort));
        return ports;
    }
}
