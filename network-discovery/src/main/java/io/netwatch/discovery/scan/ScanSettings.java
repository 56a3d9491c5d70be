package io.netwatch.discovery.scan;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

public class ScanSettings {

    public static final int DEFAULT_CONCURRENCY = 20;
    public static final long DEFAULT_PROBE_TIMEOUT_MS = 2000;
    public static final long DEFAULT_BATCH_DELAY_MS = 100;
    public static final long DEFAULT_RESOLVER_TIMEOUT_MS = 3000;
    /** Port scans are limited to this many online hosts per pass. */
    public static final int MAX_PORT_SCAN_HOSTS = 200;

    private int concurrency = DEFAULT_CONCURRENCY;
    private Duration probeTimeout = Duration.ofMillis(DEFAULT_PROBE_TIMEOUT_MS);
    private Duration batchDelay = Duration.ofMillis(DEFAULT_BATCH_DELAY_MS);
    private Duration resolverTimeout = Duration.ofMillis(DEFAULT_RESOLVER_TIMEOUT_MS);
    private boolean portScanEnabled = false;
    private Path hostsFile = Paths.get("/etc/hosts");
    private Path arpTable = Paths.get("/proc/net/arp");

    public static ScanSettings defaults() {
        return new ScanSettings();
    }

    public static ScanSettings fromSystemProperties() {
        ScanSettings settings = new ScanSettings();
        settings.setConcurrency(Integer.parseInt(System.getProperty("scan.concurrency", String.valueOf(DEFAULT_CONCURRENCY))));
        settings.setProbeTimeout(Duration.ofMillis(Long.parseLong(
            System.getProperty("scan.probe.timeout.ms", String.valueOf(DEFAULT_PROBE_TIMEOUT_MS)))));
        settings.setBatchDelay(Duration.ofMillis(Long.parseLong(
            System.getProperty("scan.batch.delay.ms", String.valueOf(DEFAULT_BATCH_DELAY_MS)))));
        settings.setResolverTimeout(Duration.ofMillis(Long.parseLong(
            System.getProperty("scan.resolver.timeout.ms", String.valueOf(DEFAULT_RESOLVER_TIMEOUT_MS)))));
        settings.setPortScanEnabled(Boolean.parseBoolean(System.getProperty("scan.portscan.enabled", "false")));
        settings.setHostsFile(Paths.get(System.getProperty("scan.hosts.file", "/etc/hosts")));
        settings.setArpTable(Paths.get(System.getProperty("scan.arp.table", "/proc/net/arp")));
        return settings;
    }

    public int getConcurrency() { return concurrency; }
    public void setConcurrency(int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("scan.concurrency must be >= 1, got " + concurrency);
        }
        this.concurrency = concurrency;
    }

    public Duration getProbeTimeout() { return probeTimeout; }
    public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }

    public Duration getBatchDelay() { return batchDelay; }
    public void setBatchDelay(Duration batchDelay) { this.batchDelay = batchDelay; }

    public Duration getResolverTimeout() { return resolverTimeout; }
    public void setResolverTimeout(Duration resolverTimeout) { this.resolverTimeout = resolverTimeout; }

    public boolean isPortScanEnabled() { return portScanEnabled; }
    public void setPortScanEnabled(boolean portScanEnabled) { this.portScanEnabled = portScanEnabled; }

    public Path getHostsFile() { return hostsFile; }
    public void setHostsFile(Path hostsFile) { this.hostsFile = hostsFile; }

    public Path getArpTable() { return arpTable; }
    public void setArpTable(Path arpTable) { this.arpTable = arpTable; }
}
