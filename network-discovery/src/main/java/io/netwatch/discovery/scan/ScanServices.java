package io.netwatch.discovery.scan;

import io.netwatch.discovery.exec.CommandRunner;
import io.netwatch.discovery.exec.ProcessCommandRunner;
import io.netwatch.discovery.portscan.PortScanner;
import io.netwatch.discovery.probe.PingProber;
import io.netwatch.discovery.resolve.Enricher;
import io.netwatch.discovery.resolve.Resolver;
import io.netwatch.discovery.resolve.ResolverChain;
import io.netwatch.discovery.resolve.hostname.Getent;
import io.netwatch.discovery.resolve.hostname.HostsFile;
import io.netwatch.discovery.resolve.hostname.Netbios;
import io.netwatch.discovery.resolve.hostname.ReverseDns;
import io.netwatch.discovery.resolve.mac.ArpCommand;
import io.netwatch.discovery.resolve.mac.ArpScan;
import io.netwatch.discovery.resolve.mac.ArpTableFile;
import io.netwatch.discovery.resolve.mac.NeighborGet;
import io.netwatch.discovery.resolve.vendor.VendorLookup;
import io.netwatch.registry.DatabaseManager;
import io.netwatch.registry.repository.DeviceRepository;
import io.netwatch.registry.repository.VendorRepository;
import io.netwatch.registry.service.DeviceReconciler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class ScanServices {

    private ScanServices() {
    }

    public static NetworkScanService create(DatabaseManager dbManager, ScanSettings settings) {
        CommandRunner runner = new ProcessCommandRunner();
        boolean windows = isWindows();

        Enricher enricher = new Enricher(
            macChain(runner, settings, windows),
            hostnameChain(runner, settings, windows),
            VendorLookup.withRegistry(new VendorRepository(dbManager)));
        PortScanner portScanner = settings.isPortScanEnabled() ? new PortScanner(runner) : null;

        return new NetworkScanService(
            new PingProber(runner, settings.getProbeTimeout(), windows),
            enricher,
            portScanner,
            new DeviceReconciler(dbManager),
            new DeviceRepository(dbManager),
            settings);
    }

    /** Neighbor table first, then the ARP cache, arp-scan and finally the arp command. */
    static ResolverChain macChain(CommandRunner runner, ScanSettings settings, boolean windows) {
        Duration timeout = settings.getResolverTimeout();
        List<Resolver> steps = new ArrayList<>();
        if (!windows) {
            steps.add(new NeighborGet(runner, timeout));
            steps.add(new ArpTableFile(settings.getArpTable()));
            steps.add(new ArpScan(runner, timeout));
        }
        steps.add(new ArpCommand(runner, timeout, windows));
        return new ResolverChain("MAC", steps);
    }

    static ResolverChain hostnameChain(CommandRunner runner, ScanSettings settings, boolean windows) {
        Duration timeout = settings.getResolverTimeout();
        List<Resolver> steps = new ArrayList<>();
        steps.add(new ReverseDns(timeout));
        if (!windows) {
            steps.add(new Getent(runner, timeout));
            steps.add(new HostsFile(settings.getHostsFile()));
        }
        steps.add(new Netbios(runner, timeout, windows));
        return new ResolverChain("hostname", steps);
    }

    static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }
}
