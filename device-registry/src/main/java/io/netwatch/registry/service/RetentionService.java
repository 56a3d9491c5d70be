package io.netwatch.registry.service;

import io.netwatch.registry.DatabaseManager;
import io.netwatch.registry.RegistryException;
import io.netwatch.registry.model.DatabaseStats;
import io.netwatch.registry.model.PurgeResult;
import io.netwatch.registry.model.RetentionConfig;
import io.netwatch.registry.repository.AppConfigRepository;
import io.netwatch.registry.repository.DeviceRepository;
import io.netwatch.registry.repository.HistoryRepository;
import io.netwatch.registry.repository.LatencyMonitoringRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Age-based purges, storage compaction and size diagnostics.
 * <p>
 * A retention of 0 days deletes every row the policy covers. Each purge is a set of whole-row
 * deletes by timestamp predicate inside one transaction, so running it during a scan only removes
 * rows, never part of one.
 */
public class RetentionService {
    
    private static final Logger logger = LoggerFactory.getLogger(RetentionService.class);
    
    static final String CONFIG_KEY = "retention";
    static final int COMPACT_THRESHOLD = 100;
    
    static final long DEVICE_ROW_BYTES = 200;
    static final long HISTORY_ROW_BYTES = 100;
    static final long LATENCY_ROW_BYTES = 50;
    
    private final DatabaseManager dbManager;
    private final DeviceRepository deviceRepository;
    private final HistoryRepository historyRepository;
    private final LatencyMonitoringRepository latencyRepository;
    private final AppConfigRepository configRepository;
    private final Clock clock;
    
    public RetentionService(DatabaseManager dbManager) {
        this(dbManager, Clock.systemDefaultZone());
    }
    
    public RetentionService(DatabaseManager dbManager, Clock clock) {
        this.dbManager = dbManager;
        this.deviceRepository = new DeviceRepository(dbManager);
        this.historyRepository = new HistoryRepository(dbManager);
        this.latencyRepository = new LatencyMonitoringRepository(dbManager);
        this.configRepository = new AppConfigRepository(dbManager);
        this.clock = clock;
    }
    
    public int purgeHistory(int retentionDays) {
        LocalDateTime cutoff = cutoff(retentionDays);
        int deleted = inTransaction("history", conn -> historyRepository.deleteObservedBefore(conn, cutoff));
        logger.info("Purged {} history entries (retention {} days)", deleted, retentionDays);
        return deleted;
    }
    
    /** Deletes devices not seen within the retention window, whatever their status. */
    public int purgeScans(int retentionDays) {
        LocalDateTime cutoff = cutoff(retentionDays);
        int deleted = inTransaction("scans", conn -> deviceRepository.deleteLastSeenBefore(conn, cutoff));
        logger.info("Purged {} devices (retention {} days)", deleted, retentionDays);
        return deleted;
    }
    
    public int purgeOfflineScans(int retentionDays) {
        LocalDateTime cutoff = cutoff(retentionDays);
        int deleted = inTransaction("offline devices", conn -> deviceRepository.deleteOfflineLastSeenBefore(conn, cutoff));
        logger.info("Purged {} offline devices (retention {} days)", deleted, retentionDays);
        return deleted;
    }
    
    public int purgeLatencyMeasurements(int retentionDays) {
        LocalDateTime cutoff = cutoff(retentionDays);
        int deleted = inTransaction("latency measurements", conn -> latencyRepository.deleteMeasuredBefore(conn, cutoff));
        logger.info("Purged {} latency measurements (retention {} days)", deleted, retentionDays);
        return deleted;
    }
    
    /**
     * Applies every policy of the stored configuration in one transaction, then compacts when
     * enough rows went away.
     */
    public PurgeResult executePurge() {
        RetentionConfig config = getConfig();
        LocalDateTime historyCutoff = cutoff(config.getHistoryRetentionDays());
        LocalDateTime offlineCutoff = cutoff(config.getOfflineRetentionDays());
        LocalDateTime scanCutoff = cutoff(config.getScanRetentionDays());
        LocalDateTime latencyCutoff = cutoff(config.getLatencyRetentionDays());
        
        PurgeResult result = inTransaction("all policies", conn -> new PurgeResult(
            historyRepository.deleteObservedBefore(conn, historyCutoff),
            deviceRepository.deleteOfflineLastSeenBefore(conn, offlineCutoff),
            deviceRepository.deleteLastSeenBefore(conn, scanCutoff),
            latencyRepository.deleteMeasuredBefore(conn, latencyCutoff)));
        
        logger.info("Purge complete: {} history, {} offline, {} scans, {} latency ({} total)",
            result.getHistoryDeleted(), result.getOfflineDeleted(), result.getScansDeleted(),
            result.getLatencyDeleted(), result.getTotalDeleted());
        
        if (result.getTotalDeleted() > COMPACT_THRESHOLD) {
            compact();
        }
        return result;
    }
    
    /**
     * Reclaims space after large deletes: {@code VACUUM ANALYZE} on PostgreSQL, {@code CHECKPOINT}
     * on H2. Other databases are left alone.
     */
    public void compact() {
        try (Connection conn = dbManager.getConnection();
             Statement stmt = conn.createStatement()) {
            
            String product = conn.getMetaData().getDatabaseProductName();
            if ("PostgreSQL".equalsIgnoreCase(product)) {
                stmt.execute("VACUUM ANALYZE");
            } else if ("H2".equalsIgnoreCase(product)) {
                stmt.execute("CHECKPOINT");
            } else {
                logger.warn("Compaction not supported on {}", product);
                return;
            }
            logger.info("Database compacted ({})", product);
            
        } catch (SQLException e) {
            logger.error("Failed to compact database", e);
            throw new RegistryException("Database operation failed", e);
        }
    }
    
    public DatabaseStats getDatabaseStats() {
        long devices = deviceRepository.countAll();
        long history = historyRepository.countAll();
        long latency = latencyRepository.countMeasurements();
        long approximateSize = devices * DEVICE_ROW_BYTES + history * HISTORY_ROW_BYTES + latency * LATENCY_ROW_BYTES;
        
        return new DatabaseStats(devices, history, latency,
            deviceRepository.findOldestFirstSeen().orElse(null),
            historyRepository.findOldestObservedAt().orElse(null),
            approximateSize);
    }
    
    public RetentionConfig getConfig() {
        return configRepository.get(CONFIG_KEY)
            .map(RetentionConfig::fromJson)
            .orElseGet(RetentionConfig::new);
    }
    
    public void saveConfig(RetentionConfig config) {
        configRepository.set(CONFIG_KEY, config.toJson(), LocalDateTime.now(clock));
        logger.info("Retention config saved: {}", config.toJson());
    }
    
    private LocalDateTime cutoff(int retentionDays) {
        if (retentionDays < 0) {
            throw new IllegalArgumentException("Retention days must be >= 0, got " + retentionDays);
        }
        return retentionDays == 0 ? null : LocalDateTime.now(clock).minusDays(retentionDays);
    }
    
    private <T> T inTransaction(String what, SqlWork<T> work) {
        try (Connection conn = dbManager.getConnection()) {
            conn.setAutoCommit(false);
            
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
            
        } catch (SQLException e) {
            logger.error("Failed to purge {}", what, e);
            throw new RegistryException("Database operation failed", e);
        }
    }
    
    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }
}
