package io.netwatch.discovery.resolve.mac;

import io.netwatch.discovery.exec.CommandRunner;
import io.netwatch.discovery.resolve.MacAddresses;
import io.netwatch.discovery.resolve.Resolver;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

public class NeighborGet implements Resolver {

    private final CommandRunner runner;
    private final Duration timeout;

    public NeighborGet(CommandRunner runner, Duration timeout) {
        this.runner = runner;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "ip neigh";
    }

    @Override
    public Optional<String> resolve(String ip) throws Exception {
        Optional<String> mac = MacAddresses.findIn(runner.run(Arrays.asList("ip", "neigh", "get", ip), timeout).getStdout());
        if (mac.isPresent()) {
            return mac;
        }
        return MacAddresses.findIn(runner.run(Arrays.asList("ip", "neigh", "show", ip), timeout).getStdout());
    }
}
