package io.netwatch.discovery.resolve.hostname;

import io.netwatch.discovery.exec.CommandRunner;
import io.netwatch.discovery.resolve.Resolver;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

public class Getent implements Resolver {

    private final CommandRunner runner;
    private final Duration timeout;

    public Getent(CommandRunner runner, Duration timeout) {
        this.runner = runner;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "getent hosts";
    }

    @Override
    public Optional<String> resolve(String ip) throws Exception {
        String[] parts = runner.run(Arrays.asList("getent", "hosts", ip), timeout).getStdout().trim().split("\\s+");
        if (parts.length >= 2) {
            return ReverseDns.accept(ip, parts[1]);
        }
        return Optional.empty();
    }
}
