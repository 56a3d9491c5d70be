package io.netwatch.discovery.resolve.mac;

import io.netwatch.discovery.exec.CommandRunner;
import io.netwatch.discovery.resolve.MacAddresses;
import io.netwatch.discovery.resolve.Resolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;
import java.util.function.Supplier;

public class ArpScan implements Resolver {

    private static final Logger logger = LoggerFactory.getLogger(ArpScan.class);

    private final CommandRunner runner;
    private final Duration timeout;
    private final Supplier<Optional<String>> interfaceName;

    public ArpScan(CommandRunner runner, Duration timeout) {
        this(runner, timeout, ArpScan::primaryInterface);
    }

    public ArpScan(CommandRunner runner, Duration timeout, Supplier<Optional<String>> interfaceName) {
        this.runner = runner;
        this.timeout = timeout;
        this.interfaceName = interfaceName;
    }

    @Override
    public String name() {
        return "arp-scan";
    }

    @Override
    public Optional<String> resolve(String ip) throws Exception {
        Optional<String> iface = interfaceName.get();
        if (iface.isEmpty()) {
            return Optional.empty();
        }
        String output = runner.run(Arrays.asList("arp-scan", "-l", "-q", "-x", "-I", iface.get()), timeout).getStdout();
        for (String line : output.split("\\R")) {
            String[] columns = line.trim().split("\\s+");
            if (columns.length >= 2 && columns[0].equals(ip)) {
                return MacAddresses.findIn(line);
            }
        }
        return Optional.empty();
    }

    /**
     * First interface that is up, not loopback, not a container bridge and carries an IPv4 address.
     */
    static Optional<String> primaryInterface() {
        try {
            for (NetworkInterface nic : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                String name = nic.getName();
                if (name.startsWith("lo") || name.startsWith("docker") || name.startsWith("veth") || name.startsWith("br-")) {
                    continue;
                }
                if (!nic.isUp() || nic.isLoopback()) {
                    continue;
                }
                for (InetAddress address : Collections.list(nic.getInetAddresses())) {
                    if (address instanceof Inet4Address) {
                        return Optional.of(name);
                    }
                }
            }
        } catch (SocketException e) {
            logger.debug("Failed to list network interfaces: {}", e.getMessage());
        }
        return Optional.empty();
    }
}
