package io.netwatch.runner;

import io.netwatch.discovery.exec.ProcessCommandRunner;
import io.netwatch.discovery.probe.PingProber;
import io.netwatch.discovery.scan.NetworkScanService;
import io.netwatch.discovery.scan.ScanServices;
import io.netwatch.discovery.scan.ScanSettings;
import io.netwatch.discovery.schedule.LatencyMonitor;
import io.netwatch.discovery.schedule.RefreshScheduler;
import io.netwatch.registry.DatabaseManager;
import io.netwatch.registry.RegistryException;
import io.netwatch.registry.service.AutoPurgeScheduler;
import io.netwatch.registry.service.LatencyService;
import io.netwatch.registry.service.RetentionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

public class ScanMain {

    private static final Logger logger = LoggerFactory.getLogger(ScanMain.class);

    public static void main(String[] args) {
        ScanSettings settings;
        DatabaseManager dbManager;
        try {
            settings = ScanSettings.fromSystemProperties();
            dbManager = new DatabaseManager();
        } catch (RegistryException | IllegalArgumentException e) {
            logger.error("Failed to start", e);
            System.exit(ScanCommands.FAILED);
            return;
        }

        if (args.length > 0 && "watch".equals(args[0])) {
            watch(dbManager, settings);
            return;
        }

        ScanCommands commands = new ScanCommands(dbManager, () -> ScanServices.create(dbManager, settings), System.out);
        System.exit(commands.execute(args));
    }

    /**
     * Runs the background refresh, latency monitor and auto purge until the process is stopped.
     */
    private static void watch(DatabaseManager dbManager, ScanSettings settings) {
        boolean refreshEnabled = Boolean.parseBoolean(System.getProperty("refresh.enabled", "true"));

        logger.info("=== netwatch ===");
        logger.info("Refresh enabled: {}", refreshEnabled);
        logger.info("Scan concurrency: {}", settings.getConcurrency());
        logger.info("Port scan enabled: {}", settings.isPortScanEnabled());
        logger.info("================");

        NetworkScanService scanService = ScanServices.create(dbManager, settings);
        RefreshScheduler refresh = RefreshScheduler.fromSystemProperties(scanService);
        LatencyMonitor latencyMonitor = new LatencyMonitor(
            new PingProber(new ProcessCommandRunner(), settings.getProbeTimeout()),
            new LatencyService(dbManager));
        AutoPurgeScheduler autoPurge = new AutoPurgeScheduler(new RetentionService(dbManager));

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down");
            refresh.stop();
            latencyMonitor.stop();
            autoPurge.stop();
            scanService.close();
            stopped.countDown();
        }, "shutdown"));

        if (refreshEnabled) {
            refresh.start();
        }
        latencyMonitor.start();
        autoPurge.start();
        logger.info("Running. Press Ctrl+C to stop.");

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
