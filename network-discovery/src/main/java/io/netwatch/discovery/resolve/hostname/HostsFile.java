package io.netwatch.discovery.resolve.hostname;

import io.netwatch.discovery.resolve.Resolver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

public class HostsFile implements Resolver {

    private final Path hostsFile;

    public HostsFile(Path hostsFile) {
        this.hostsFile = hostsFile;
    }

    @Override
    public String name() {
        return hostsFile.toString();
    }

    @Override
    public Optional<String> resolve(String ip) throws IOException {
        if (!Files.isReadable(hostsFile)) {
            return Optional.empty();
        }
        for (String line : Files.readAllLines(hostsFile, StandardCharsets.UTF_8)) {
            int comment = line.indexOf('#');
            String content = (comment >= 0 ? line.substring(0, comment) : line).trim();
            String[] parts = content.split("\\s+");
            if (parts.length >= 2 && parts[0].equals(ip)) {
                return Optional.of(parts[1]);
            }
        }
        return Optional.empty();
    }
}
