package io.netwatch.discovery.resolve.hostname;

import io.netwatch.discovery.exec.CommandRunner;
import io.netwatch.discovery.resolve.Resolver;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * NetBIOS node status query: {@code nmblookup -A} on Unix, {@code nbtstat -A} on Windows.
 * The workstation name is the unique {@code <00>} entry; group entries carry the workgroup.
 */
public class Netbios implements Resolver {

    private static final Pattern NAME_ENTRY = Pattern.compile("^\\s*([A-Za-z0-9_-]+)\\s+<00>(.*)$");

    private final CommandRunner runner;
    private final Duration timeout;
    private final boolean windows;

    public Netbios(CommandRunner runner, Duration timeout, boolean windows) {
        this.runner = runner;
        this.timeout = timeout;
        this.windows = windows;
    }

    @Override
    public String name() {
        return windows ? "nbtstat" : "nmblookup";
    }

    @Override
    public Optional<String> resolve(String ip) throws Exception {
        List<String> command = windows ? Arrays.asList("nbtstat", "-A", ip) : Arrays.asList("nmblookup", "-A", ip);
        return parse(runner.run(command, timeout).getStdout());
    }

    static Optional<String> parse(String output) {
        for (String line : output.split("\\R")) {
            Matcher matcher = NAME_ENTRY.matcher(line);
            if (matcher.matches() && !matcher.group(2).toUpperCase(Locale.ROOT).contains("GROUP")) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }
}
