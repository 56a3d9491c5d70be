package io.netwatch.discovery.schedule;

import io.netwatch.discovery.probe.ProbeResult;
import io.netwatch.discovery.probe.Prober;
import io.netwatch.registry.service.LatencyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class LatencyMonitor {

    private static final Logger logger = LoggerFactory.getLogger(LatencyMonitor.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(15);
    private static final int MAX_PARALLEL_PINGS = 10;

    private final Prober prober;
    private final LatencyService latencyService;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService pingers;
    private ScheduledFuture<?> task;

    public LatencyMonitor(Prober prober, LatencyService latencyService) {
        this(prober, latencyService, DEFAULT_INTERVAL);
    }

    public LatencyMonitor(Prober prober, LatencyService latencyService, Duration interval) {
        this.prober = prober;
        this.latencyService = latencyService;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "latency-monitor");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger counter = new AtomicInteger();
        this.pingers = Executors.newFixedThreadPool(MAX_PARALLEL_PINGS, r -> {
            Thread t = new Thread(r, "latency-ping-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (task != null) {
            logger.warn("Latency monitor already started");
            return;
        }
        logger.info("Starting latency monitor (every {} seconds)", interval.getSeconds());
        task = scheduler.scheduleWithFixedDelay(() -> {
            try {
                runCycle();
            } catch (Exception e) {
                logger.error("Error in latency monitoring cycle", e);
            }
        }, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Measures all enabled addresses once.
     *
     * @return number of measurements stored
     */
    public int runCycle() {
        List<String> ips = latencyService.getEnabledIps();
        if (ips.isEmpty()) {
            return 0;
        }

        AtomicInteger stored = new AtomicInteger();
        CompletableFuture<?>[] futures = ips.stream()
            .map(ip -> CompletableFuture.runAsync(() -> {
                ProbeResult result = prober.probe(ip);
                Double latency = result.isSuccess() ? Double.valueOf(result.getLatencyMs()) : null;
                latencyService.record(ip, latency);
                stored.incrementAndGet();
            }, pingers).exceptionally(e -> {
                logger.error("Failed to measure latency of {}", ip, e);
                return null;
            }))
            .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(futures).join();

        logger.debug("Latency cycle completed for {} addresses", ips.size());
        return stored.get();
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isDone();
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            logger.info("Latency monitor stopped");
        }
        scheduler.shutdown();
        pingers.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            if (!pingers.awaitTermination(5, TimeUnit.SECONDS)) {
                pingers.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            pingers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
