package io.netwatch.discovery.scan;

import io.netwatch.discovery.portscan.OpenPort;
import io.netwatch.discovery.portscan.PortScanner;
import io.netwatch.discovery.probe.ProbeResult;
import io.netwatch.discovery.probe.Prober;
import io.netwatch.discovery.range.RangeParser;
import io.netwatch.discovery.resolve.Enricher;
import io.netwatch.registry.RegistryException;
import io.netwatch.registry.model.ReconcileResult;
import io.netwatch.registry.model.ScanObservation;
import io.netwatch.registry.repository.DeviceRepository;
import io.netwatch.registry.service.DeviceReconciler;
import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scans address lists in fixed-size batches.
 * <p>
 * All probes of a batch run concurrently and the batch is fully reconciled before the next one
 * starts. A probe never aborts its siblings: failures come back as unreachable results. A result
 * that cannot be stored is counted and the pass goes on; the call then ends with a
 * {@link ScanFailedException} carrying the counters of the whole pass.
 */
public class NetworkScanService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(NetworkScanService.class);

    private final Prober prober;
    private final Enricher enricher;
    private final PortScanner portScanner;
    private final DeviceReconciler reconciler;
    private final DeviceRepository deviceRepository;
    private final ScanSettings settings;
    private final Clock clock;
    private final ExecutorService workers;

    public NetworkScanService(Prober prober, Enricher enricher, PortScanner portScanner,
                              DeviceReconciler reconciler, DeviceRepository deviceRepository, ScanSettings settings) {
        this(prober, enricher, portScanner, reconciler, deviceRepository, settings, Clock.systemDefaultZone());
    }

    /**
     * @param portScanner may be {@code null}, which disables open-port enrichment regardless of settings
     */
    public NetworkScanService(Prober prober, Enricher enricher, PortScanner portScanner,
                              DeviceReconciler reconciler, DeviceRepository deviceRepository,
                              ScanSettings settings, Clock clock) {
        this.prober = prober;
        this.enricher = enricher;
        this.portScanner = portScanner;
        this.reconciler = reconciler;
        this.deviceRepository = deviceRepository;
        this.settings = settings;
        this.clock = clock;

        AtomicInteger threadCounter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(settings.getConcurrency(), r -> {
            Thread t = new Thread(r, "scan-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Parses {@code range} and scans every address in it. A malformed or public range is rejected
     * with {@link io.netwatch.discovery.range.InvalidRangeException} before anything is probed.
     */
    public ScanSummary scanRange(String range, ScanMode mode) {
        List<String> addresses = RangeParser.parse(range);
        logger.info("Starting {} scan of {} ({} addresses)", mode, range, addresses.size());
        return runPass("scan of " + range, addresses, mode);
    }

    /**
     * Re-probes every address that already has a device record.
     */
    public ScanSummary refreshKnown(ScanMode mode) {
        List<String> addresses = deviceRepository.findAllIps();
        logger.info("Starting {} refresh of {} known devices", mode, addresses.size());
        return runPass("refresh", addresses, mode);
    }

    private ScanSummary runPass(String label, List<String> addresses, ScanMode mode) {
        long started = System.currentTimeMillis();
        PassCounters counters = new PassCounters();
        List<String> onlineHosts = Collections.synchronizedList(new ArrayList<>());
        int batchSize = settings.getConcurrency();

        for (int from = 0; from < addresses.size(); from += batchSize) {
            List<String> batch = addresses.subList(from, Math.min(from + batchSize, addresses.size()));

            CompletableFuture<?>[] futures = batch.stream()
                .map(ip -> CompletableFuture.supplyAsync(() -> observe(ip, mode), workers)
                    .handle((observation, error) -> {
                        if (error != null) {
                            logger.warn("Probe of {} failed unexpectedly, treating as unreachable", ip, error);
                            observation = ScanObservation.offline(ip);
                        }
                        record(observation, counters, onlineHosts);
                        return null;
                    }))
                .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(futures).join();

            boolean lastBatch = from + batchSize >= addresses.size();
            if (!lastBatch && !settings.getBatchDelay().isZero()) {
                pause();
            }
        }

        if (mode == ScanMode.FULL && settings.isPortScanEnabled()) {
            scanPorts(onlineHosts);
        }

        ScanSummary summary = counters.toSummary(System.currentTimeMillis() - started);
        if (summary.getFailed() > 0) {
            logger.warn("Finished {} with {} unsaved results: {}", label, summary.getFailed(), summary);
            throw new ScanFailedException(summary.getFailed() + " scan results could not be saved",
                summary, counters.firstFailure.get());
        }
        logger.info("Finished {}: {}", label, summary);
        return summary;
    }

    private ScanObservation observe(String ip, ScanMode mode) {
        ProbeResult result = prober.probe(ip);
        if (!result.isSuccess()) {
            return ScanObservation.offline(ip);
        }

        ScanObservation observation = ScanObservation.online(ip, result.getLatencyMs());
        if (mode == ScanMode.FULL) {
            enricher.enrich(observation);
        }
        return observation;
    }

    private void record(ScanObservation observation, PassCounters counters, List<String> onlineHosts) {
        counters.scanned.incrementAndGet();
        if (observation.isReachable()) {
            counters.online.incrementAndGet();
            onlineHosts.add(observation.getIp());
        } else {
            counters.offline.incrementAndGet();
        }

        try {
            ReconcileResult result = reconciler.reconcile(observation);
            if (result.getOutcome() == ReconcileResult.Outcome.CREATED) {
                counters.found.incrementAndGet();
            } else if (result.getOutcome() == ReconcileResult.Outcome.UPDATED) {
                counters.updated.incrementAndGet();
            }
        } catch (RegistryException e) {
            logger.warn("Failed to save scan result for {}", observation.getIp(), e);
            counters.failed.incrementAndGet();
            counters.firstFailure.compareAndSet(null, e);
        }
    }

    private void pause() {
        try {
            Thread.sleep(settings.getBatchDelay().toMillis());
        } catch (InterruptedException e) {
            // keep going; the remaining batches still get scanned
            Thread.currentThread().interrupt();
        }
    }

    private void scanPorts(List<String> onlineHosts) {
        if (portScanner == null || !portScanner.isAvailable()) {
            logger.warn("Port scanning enabled but nmap is not available");
            return;
        }

        List<String> targets;
        synchronized (onlineHosts) {
            targets = new ArrayList<>(onlineHosts.subList(0, Math.min(onlineHosts.size(), ScanSettings.MAX_PORT_SCAN_HOSTS)));
        }
        logger.info("Port scanning {} online hosts", targets.size());

        for (String ip : targets) {
            try {
                List<OpenPort> ports = portScanner.scan(ip);
                JSONArray openPorts = new JSONArray();
                for (OpenPort port : ports) {
                    openPorts.put(port.toJson());
                }
                JSONObject patch = new JSONObject()
                    .put("openPorts", openPorts)
                    .put("lastPortScan", LocalDateTime.now(clock).toString());
                reconciler.mergeExtraInfo(ip, patch);
                logger.debug("Found {} open ports on {}", ports.size(), ip);
            } catch (IOException | TimeoutException e) {
                logger.warn("Port scan of {} failed: {}", ip, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Port scanning interrupted, {} hosts left", targets.size() - targets.indexOf(ip));
                return;
            } catch (RegistryException e) {
                logger.warn("Failed to save open ports for {}", ip, e);
            }
        }
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static class PassCounters {
        final AtomicInteger scanned = new AtomicInteger();
        final AtomicInteger found = new AtomicInteger();
        final AtomicInteger updated = new AtomicInteger();
        final AtomicInteger online = new AtomicInteger();
        final AtomicInteger offline = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
        final AtomicReference<RegistryException> firstFailure = new AtomicReference<>();

        ScanSummary toSummary(long durationMs) {
            return new ScanSummary(scanned.get(), found.get(), updated.get(), online.get(),
                offline.get(), failed.get(), durationMs);
        }
    }
}
