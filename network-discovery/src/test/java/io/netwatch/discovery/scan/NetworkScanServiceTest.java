package io.netwatch.discovery.scan;

import io.netwatch.discovery.ScriptedCommandRunner;
import io.netwatch.discovery.TestDatabases;
import io.netwatch.discovery.exec.CommandResult;
import io.netwatch.discovery.portscan.PortScanner;
import io.netwatch.discovery.probe.ProbeResult;
import io.netwatch.discovery.probe.Prober;
import io.netwatch.discovery.range.InvalidRangeException;
import io.netwatch.discovery.resolve.Enricher;
import io.netwatch.discovery.resolve.Resolver;
import io.netwatch.discovery.resolve.ResolverChain;
import io.netwatch.discovery.resolve.vendor.VendorLookup;
import io.netwatch.registry.DatabaseManager;
import io.netwatch.registry.RegistryException;
import io.netwatch.registry.model.DeviceRecord;
import io.netwatch.registry.model.DeviceStatus;
import io.netwatch.registry.model.ReconcileResult;
import io.netwatch.registry.model.ScanObservation;
import io.netwatch.registry.repository.DeviceRepository;
import io.netwatch.registry.repository.HistoryRepository;
import io.netwatch.registry.service.DeviceReconciler;
import org.json.JSONArray;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class NetworkScanServiceTest {

    private DatabaseManager db;
    private DeviceRepository devices;
    private ScanSettings settings;
    private final Set<String> up = ConcurrentHashMap.newKeySet();
    private final List<String> probed = new CopyOnWriteArrayList<>();
    private NetworkScanService service;

    @BeforeEach
    void setUp() {
        db = TestDatabases.newDatabase();
        devices = new DeviceRepository(db);
        settings = ScanSettings.defaults();
        settings.setBatchDelay(Duration.ZERO);
    }

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.close();
        }
    }

    private Prober scriptedProber() {
        return ip -> {
            probed.add(ip);
            return up.contains(ip) ? ProbeResult.reachable(3) : ProbeResult.unreachable();
        };
    }

    private static Resolver fixed(String value) {
        return new Resolver() {
            @Override
            public String name() {
                return "fixed";
            }

            @Override
            public Optional<String> resolve(String ip) {
                return Optional.ofNullable(value);
            }
        };
    }

    private static Enricher enricher(String mac, String hostname) {
        return new Enricher(
            new ResolverChain("MAC", List.of(fixed(mac))),
            new ResolverChain("hostname", List.of(fixed(hostname))),
            new VendorLookup(oui -> Optional.empty(), Map.of("b827eb", "Raspberry Pi")));
    }

    private NetworkScanService newService(Enricher enricher, DeviceReconciler reconciler, PortScanner portScanner) {
        service = new NetworkScanService(scriptedProber(), enricher, portScanner, reconciler, devices, settings);
        return service;
    }

    @Test
    void fullScanCountsAndEnriches() {
        up.add("192.168.1.1");
        up.add("192.168.1.3");
        NetworkScanService scanner = newService(enricher("b8:27:eb:00:00:01", "pi.lan"), new DeviceReconciler(db), null);

        ScanSummary summary = scanner.scanRange("192.168.1.1-5", ScanMode.FULL);

        assertEquals(5, summary.getScanned());
        assertEquals(2, summary.getFound());
        assertEquals(0, summary.getUpdated());
        assertEquals(2, summary.getOnline());
        assertEquals(3, summary.getOffline());
        assertEquals(0, summary.getFailed());
        assertEquals(2, devices.countAll());

        DeviceRecord pi = devices.findByIp("192.168.1.3").orElseThrow();
        assertEquals("b8:27:eb:00:00:01", pi.getMac());
        assertEquals("Raspberry Pi", pi.getVendor());
        assertEquals("pi.lan", pi.getHostname());
        assertEquals(Enricher.SOURCE, pi.getHostnameSource());
        assertEquals(Enricher.SOURCE, pi.getVendorSource());
    }

    @Test
    void quickScanKeepsIdentityFields() {
        up.add("192.168.1.1");
        newService(enricher("aa:bb:cc:00:00:01", "nas.lan"), new DeviceReconciler(db), null)
            .scanRange("192.168.1.1", ScanMode.FULL);
        service.close();

        up.clear();
        NetworkScanService quick = newService(enricher("ff:ff:ff:00:00:09", "wrong.lan"), new DeviceReconciler(db), null);
        ScanSummary first = quick.scanRange("192.168.1.1", ScanMode.QUICK);
        ScanSummary second = quick.scanRange("192.168.1.1", ScanMode.QUICK);

        assertEquals(1, first.getUpdated());
        assertEquals(1, second.getUpdated());
        DeviceRecord record = devices.findByIp("192.168.1.1").orElseThrow();
        assertEquals(DeviceStatus.OFFLINE, record.getStatus());
        assertEquals("aa:bb:cc:00:00:01", record.getMac());
        assertEquals("nas.lan", record.getHostname());
        assertEquals(3, record.getScanCount());
        assertEquals(3, new HistoryRepository(db).findByIp("192.168.1.1", 10).size());
    }

    @Test
    void invalidRangeProbesNothing() {
        NetworkScanService scanner = newService(enricher(null, null), new DeviceReconciler(db), null);

        assertThrows(InvalidRangeException.class, () -> scanner.scanRange("8.8.8.0/24", ScanMode.FULL));
        assertThrows(InvalidRangeException.class, () -> scanner.scanRange("10.0.0.0/20", ScanMode.QUICK));
        assertTrue(probed.isEmpty());
    }

    @Test
    void persistenceFailureDoesNotStopThePass() {
        up.addAll(List.of("192.168.1.1", "192.168.1.2", "192.168.1.3"));
        DeviceReconciler flaky = new DeviceReconciler(db) {
            @Override
            public ReconcileResult reconcile(ScanObservation observation) {
                if (observation.getIp().equals("192.168.1.2")) {
                    throw new RegistryException("Database operation failed", null);
                }
                return super.reconcile(observation);
            }
        };
        NetworkScanService scanner = newService(enricher(null, null), flaky, null);

        ScanFailedException e = assertThrows(ScanFailedException.class,
            () -> scanner.scanRange("192.168.1.1-3", ScanMode.QUICK));

        assertEquals(3, e.getSummary().getScanned());
        assertEquals(2, e.getSummary().getFound());
        assertEquals(1, e.getSummary().getFailed());
        assertTrue(e.getCause() instanceof RegistryException);
        assertTrue(devices.findByIp("192.168.1.1").isPresent());
        assertTrue(devices.findByIp("192.168.1.3").isPresent());
    }

    @Test
    void crashingProbeCountsAsOffline() {
        up.add("192.168.1.1");
        DeviceReconciler reconciler = new DeviceReconciler(db);
        reconciler.reconcile(ScanObservation.online("192.168.1.1", 2));
        service = new NetworkScanService(ip -> {
            throw new IllegalStateException("boom");
        }, enricher(null, null), null, reconciler, devices, settings);

        ScanSummary summary = service.refreshKnown(ScanMode.QUICK);

        assertEquals(1, summary.getOffline());
        assertEquals(DeviceStatus.OFFLINE, devices.findByIp("192.168.1.1").orElseThrow().getStatus());
    }

    @Test
    void refreshProbesOnlyKnownDevices() {
        DeviceReconciler reconciler = new DeviceReconciler(db);
        reconciler.reconcile(ScanObservation.online("10.0.0.5", 1));
        reconciler.reconcile(ScanObservation.online("10.0.0.9", 1));
        up.add("10.0.0.9");

        ScanSummary summary = newService(enricher(null, null), reconciler, null).refreshKnown(ScanMode.QUICK);

        assertEquals(new HashSet<>(List.of("10.0.0.5", "10.0.0.9")), new HashSet<>(probed));
        assertEquals(2, summary.getUpdated());
        assertEquals(1, summary.getOnline());
        assertEquals(DeviceStatus.OFFLINE, devices.findByIp("10.0.0.5").orElseThrow().getStatus());
    }

    @Test
    void batchesNeverExceedConcurrency() {
        settings.setConcurrency(3);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        service = new NetworkScanService(ip -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            return ProbeResult.unreachable();
        }, enricher(null, null), null, new DeviceReconciler(db), devices, settings);

        ScanSummary summary = service.scanRange("192.168.2.1-10", ScanMode.QUICK);

        assertEquals(10, summary.getScanned());
        assertTrue(maxInFlight.get() <= 3);
        assertEquals(0, devices.countAll());
    }

    @Test
    void fullScanStoresOpenPorts() {
        settings.setPortScanEnabled(true);
        up.add("192.168.1.1");
        ScriptedCommandRunner nmap = new ScriptedCommandRunner(command -> command.contains("--version")
            ? new CommandResult(0, "Nmap version 7.94", "")
            : new CommandResult(0, "22/tcp open ssh\n80/tcp open http\n", ""));
        NetworkScanService scanner = newService(enricher(null, null), new DeviceReconciler(db), new PortScanner(nmap));

        scanner.scanRange("192.168.1.1-2", ScanMode.FULL);

        DeviceRecord record = devices.findByIp("192.168.1.1").orElseThrow();
        JSONArray ports = record.extraInfoJson().getJSONArray("openPorts");
        assertEquals(2, ports.length());
        assertEquals(22, ports.getJSONObject(0).getInt("port"));
        assertTrue(record.extraInfoJson().has("lastPortScan"));
        // history holds the scan only, not the port merge
        assertEquals(1, new HistoryRepository(db).findByIp("192.168.1.1", 10).size());

        int commandsAfterFull = nmap.getCommands().size();
        scanner.scanRange("192.168.1.1", ScanMode.QUICK);
        assertEquals(commandsAfterFull, nmap.getCommands().size());
    }

    @Test
    void emptyRefresh() {
        ScanSummary summary = newService(enricher(null, null), new DeviceReconciler(db), null).refreshKnown(ScanMode.FULL);

        assertEquals(0, summary.getScanned());
        assertEquals(Collections.emptyList(), probed);
    }
}
