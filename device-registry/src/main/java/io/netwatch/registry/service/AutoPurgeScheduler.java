package io.netwatch.registry.service;

import io.netwatch.registry.model.RetentionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

public class AutoPurgeScheduler {
    
    private static final Logger logger = LoggerFactory.getLogger(AutoPurgeScheduler.class);
    
    private final RetentionService retentionService;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;
    
    public AutoPurgeScheduler(RetentionService retentionService) {
        this.retentionService = retentionService;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "auto-purge");
            t.setDaemon(true);
            return t;
        });
    }
    
    public synchronized void start() {
        schedule(retentionService.getConfig());
    }
    
    /**
     * Persists the new policy and reschedules with it.
     */
    public synchronized void updateConfig(RetentionConfig config) {
        retentionService.saveConfig(config);
        schedule(config);
    }
    
    public synchronized boolean isScheduled() {
        return task != null && !task.isDone();
    }
    
    private void schedule(RetentionConfig config) {
        cancel();
        if (!config.isAutoPurgeEnabled()) {
            logger.info("Auto purge disabled");
            return;
        }
        
        long interval = config.getPurgeIntervalHours();
        logger.info("Starting auto purge (interval: {} hours)", interval);
        task = scheduler.scheduleAtFixedRate(() -> {
            try {
                retentionService.executePurge();
            } catch (Exception e) {
                logger.error("Error in scheduled purge", e);
            }
        }, interval, interval, TimeUnit.HOURS);
    }
    
    private void cancel() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }
    
    public synchronized void stop() {
        logger.info("Stopping auto purge");
        cancel();
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
