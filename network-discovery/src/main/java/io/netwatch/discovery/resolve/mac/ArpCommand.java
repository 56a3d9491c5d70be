package io.netwatch.discovery.resolve.mac;

import io.netwatch.discovery.exec.CommandRunner;
import io.netwatch.discovery.resolve.MacAddresses;
import io.netwatch.discovery.resolve.Resolver;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public class ArpCommand implements Resolver {

    private final CommandRunner runner;
    private final Duration timeout;
    private final boolean windows;

    public ArpCommand(CommandRunner runner, Duration timeout, boolean windows) {
        this.runner = runner;
        this.timeout = timeout;
        this.windows = windows;
    }

    @Override
    public String name() {
        return "arp";
    }

    @Override
    public Optional<String> resolve(String ip) throws Exception {
        List<String> command = windows ? Arrays.asList("arp", "-a", ip) : Arrays.asList("arp", "-n", ip);
        return MacAddresses.findIn(runner.run(command, timeout).getStdout());
    }
}
