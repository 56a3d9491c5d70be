package io.netwatch.registry.service;

import io.netwatch.registry.DatabaseManager;
import io.netwatch.registry.RegistryException;
import io.netwatch.registry.model.DeviceRecord;
import io.netwatch.registry.model.DeviceStatus;
import io.netwatch.registry.model.HistoryEntry;
import io.netwatch.registry.model.ReconcileResult;
import io.netwatch.registry.model.ScanObservation;
import io.netwatch.registry.repository.DeviceRepository;
import io.netwatch.registry.repository.HistoryRepository;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * The only write path for device rows. Every call holds the address lock and runs in one
 * transaction; the device write and its history row commit together.
 * <p>
 * {@code lastSeen} moves only on a status transition: to online from anything else, or from online
 * to offline.
 */
public class DeviceReconciler {
    
    private static final Logger logger = LoggerFactory.getLogger(DeviceReconciler.class);
    
    // Shared by every reconciler in the process, so a scan and a forget on one address queue up.
    private static final KeyedLocks ADDRESS_LOCKS = new KeyedLocks();
    
    private static final String UNIQUE_VIOLATION = "23505";
    
    private final DatabaseManager dbManager;
    private final DeviceRepository deviceRepository;
    private final HistoryRepository historyRepository;
    private final Clock clock;
    private final KeyedLocks locks;
    
    public DeviceReconciler(DatabaseManager dbManager) {
        this(dbManager, Clock.systemDefaultZone());
    }
    
    public DeviceReconciler(DatabaseManager dbManager, Clock clock) {
        this(dbManager, clock, ADDRESS_LOCKS);
    }
    
    DeviceReconciler(DatabaseManager dbManager, Clock clock, KeyedLocks locks) {
        this.dbManager = dbManager;
        this.deviceRepository = new DeviceRepository(dbManager);
        this.historyRepository = new HistoryRepository(dbManager);
        this.clock = clock;
        this.locks = locks;
    }
    
    public ReconcileResult reconcile(ScanObservation observation) {
        return locks.withLock(observation.getIp(), () -> inTransaction(observation.getIp(), conn -> apply(conn, observation)));
    }
    
    private ReconcileResult apply(Connection conn, ScanObservation observation) throws SQLException {
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<DeviceRecord> existing = deviceRepository.findByIpForUpdate(conn, observation.getIp());
        DeviceStatus newStatus = observation.isReachable() ? DeviceStatus.ONLINE : DeviceStatus.OFFLINE;
        Integer latency = observation.isReachable() ? observation.getPingLatencyMs() : null;
        
        if (existing.isEmpty()) {
            if (!observation.isReachable()) {
                logger.debug("No record for unreachable {}, nothing written", observation.getIp());
                return ReconcileResult.ignored();
            }
            
            // Another writer, possibly in another process, may insert the same address first.
            Savepoint beforeInsert = conn.setSavepoint();
            try {
                return create(conn, observation, newStatus, latency, now);
            } catch (SQLException e) {
                if (!UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    throw e;
                }
                conn.rollback(beforeInsert);
                existing = deviceRepository.findByIpForUpdate(conn, observation.getIp());
                if (existing.isEmpty()) {
                    throw e;
                }
                logger.debug("{} was created concurrently, applying as an update", observation.getIp());
            }
        }
        
        DeviceRecord previous = existing.get();
        DeviceRecord updated = previous.copy();
        mergeEnrichment(updated, observation);
        updated.setStatus(newStatus);
        updated.setPingLatencyMs(latency);
        updated.setScanCount(previous.getScanCount() + 1);
        
        if (isTransition(previous.getStatus(), newStatus)) {
            updated.setLastSeen(now);
            logger.info("Device {} went {} -> {}", updated.getIp(), previous.getStatus().value(), newStatus.value());
        }
        
        deviceRepository.update(conn, updated);
        historyRepository.insert(conn, new HistoryEntry(updated.getIp(), newStatus, latency, now));
        return new ReconcileResult(ReconcileResult.Outcome.UPDATED, previous.getStatus(), updated);
    }
    
    private ReconcileResult create(Connection conn, ScanObservation observation, DeviceStatus status,
                                   Integer latency, LocalDateTime now) throws SQLException {
        DeviceRecord created = new DeviceRecord(observation.getIp());
        mergeEnrichment(created, observation);
        created.setStatus(status);
        created.setPingLatencyMs(latency);
        created.setFirstSeen(now);
        created.setLastSeen(now);
        created.setScanCount(1);
        deviceRepository.insert(conn, created);
        historyRepository.insert(conn, new HistoryEntry(created.getIp(), status, latency, now));
        
        logger.info("New device discovered: {} (mac={}, hostname={})", created.getIp(), created.getMac(), created.getHostname());
        return new ReconcileResult(ReconcileResult.Outcome.CREATED, null, created);
    }
    
    static boolean isTransition(DeviceStatus from, DeviceStatus to) {
        if (to == DeviceStatus.ONLINE) {
            return from != DeviceStatus.ONLINE;
        }
        return from == DeviceStatus.ONLINE && to == DeviceStatus.OFFLINE;
    }
    
    // A blank value never replaces a known one; the source tag follows its value.
    private static void mergeEnrichment(DeviceRecord target, ScanObservation observation) {
        if (hasText(observation.getMac())) {
            target.setMac(observation.getMac());
        }
        if (hasText(observation.getHostname())) {
            target.setHostname(observation.getHostname());
            target.setHostnameSource(observation.getHostnameSource());
        }
        if (hasText(observation.getVendor())) {
            target.setVendor(observation.getVendor());
            target.setVendorSource(observation.getVendorSource());
        }
    }
    
    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
    
    /**
     * Shallow-merges the given keys into the device's extra info. Does not count as a scan and
     * writes no history.
     *
     * @return false when the address has no record
     */
    public boolean mergeExtraInfo(String ip, JSONObject patch) {
        return locks.withLock(ip, () -> inTransaction(ip, conn -> {
            Optional<DeviceRecord> existing = deviceRepository.findByIpForUpdate(conn, ip);
            if (existing.isEmpty()) {
                return false;
            }
            DeviceRecord record = existing.get();
            JSONObject merged = record.extraInfoJson();
            for (String key : patch.keySet()) {
                merged.put(key, patch.get(key));
            }
            record.setExtraInfo(merged.toString());
            deviceRepository.update(conn, record);
            return true;
        }));
    }
    
    /**
     * Removes one device on user request. History rows are left to retention.
     */
    public boolean forget(String ip) {
        return locks.withLock(ip, () -> inTransaction(ip, conn -> {
            boolean deleted = deviceRepository.delete(conn, ip);
            if (deleted) {
                logger.info("Device {} removed", ip);
            }
            return deleted;
        }));
    }
    
    private <T> T inTransaction(String ip, SqlWork<T> work) {
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
            logger.error("Failed to reconcile device {}", ip, e);
            throw new RegistryException("Database operation failed", e);
        }
    }
    
    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }
}
