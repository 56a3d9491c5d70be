package io.netwatch.discovery.schedule;

import io.netwatch.discovery.scan.NetworkScanService;
import io.netwatch.discovery.scan.ScanMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class RefreshScheduler {

    private static final Logger logger = LoggerFactory.getLogger(RefreshScheduler.class);

    public static final long DEFAULT_INTERVAL_MINUTES = 15;

    private final NetworkScanService scanService;
    private final ScanMode mode;
    private final Duration interval;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    public RefreshScheduler(NetworkScanService scanService, ScanMode mode, Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Refresh interval must be positive, got " + interval);
        }
        this.scanService = scanService;
        this.mode = mode;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "device-refresh");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Reads {@code refresh.interval.minutes} and {@code refresh.mode}.
     */
    public static RefreshScheduler fromSystemProperties(NetworkScanService scanService) {
        long minutes = Long.parseLong(System.getProperty("refresh.interval.minutes", String.valueOf(DEFAULT_INTERVAL_MINUTES)));
        ScanMode mode = ScanMode.fromValue(System.getProperty("refresh.mode", "quick"));
        return new RefreshScheduler(scanService, mode, Duration.ofMinutes(minutes));
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        logger.info("Starting device refresh (mode: {}, interval: {})", mode, interval);
        task = scheduler.scheduleAtFixedRate(this::runOnce, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Runs one refresh now unless one is already in progress.
     *
     * @return {@code false} when skipped
     */
    public boolean runOnce() {
        if (!running.compareAndSet(false, true)) {
            logger.info("Previous refresh still running, skipping");
            return false;
        }
        try {
            scanService.refreshKnown(mode);
        } catch (Exception e) {
            logger.error("Error in scheduled refresh", e);
        } finally {
            running.set(false);
        }
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    public synchronized void stop() {
        logger.info("Stopping device refresh");
        if (task != null) {
            task.cancel(false);
            task = null;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
