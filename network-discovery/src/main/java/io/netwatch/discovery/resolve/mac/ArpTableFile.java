package io.netwatch.discovery.resolve.mac;

import io.netwatch.discovery.resolve.MacAddresses;
import io.netwatch.discovery.resolve.Resolver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the kernel neighbour table exposed as {@code /proc/net/arp}:
 * <pre>
 * IP address       HW type     Flags       HW address            Mask     Device
 * 192.168.1.1      0x1         0x2         aa:bb:cc:dd:ee:ff     *        eth0
 * </pre>
 */
public class ArpTableFile implements Resolver {

    private final Path table;

    public ArpTableFile(Path table) {
        this.table = table;
    }

    @Override
    public String name() {
        return table.toString();
    }

    @Override
    public Optional<String> resolve(String ip) throws IOException {
        if (!Files.isReadable(table)) {
            return Optional.empty();
        }
        for (String line : Files.readAllLines(table, StandardCharsets.UTF_8)) {
            String[] columns = line.trim().split("\\s+");
            if (columns.length >= 4 && columns[0].equals(ip)) {
                return MacAddresses.normalize(columns[3]);
            }
        }
        return Optional.empty();
    }
}
