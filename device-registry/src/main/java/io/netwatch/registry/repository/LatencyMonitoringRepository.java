package io.netwatch.registry.repository;

import io.netwatch.registry.DatabaseManager;
import io.netwatch.registry.RegistryException;
import io.netwatch.registry.model.LatencyMeasurement;
import io.netwatch.registry.model.LatencyMonitoringToggle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.LocalDateTime;
import java.util.*;

public class LatencyMonitoringRepository {
    
    private static final Logger logger = LoggerFactory.getLogger(LatencyMonitoringRepository.class);
    
    private final DatabaseManager dbManager;
    
    public LatencyMonitoringRepository(DatabaseManager dbManager) {
        this.dbManager = dbManager;
    }
    
    /**
     * Creates the toggle on first use, otherwise flips the existing one.
     */
    public void setEnabled(String ip, boolean enabled, LocalDateTime now) {
        try (Connection conn = dbManager.getConnection()) {
            conn.setAutoCommit(false);
            
            try {
                String lockSql = "SELECT id FROM latency_monitoring WHERE ip = ? FOR UPDATE";
                boolean exists;
                try (PreparedStatement stmt = conn.prepareStatement(lockSql)) {
                    stmt.setString(1, ip);
                    try (ResultSet rs = stmt.executeQuery()) {
                        exists = rs.next();
                    }
                }
                
                if (exists) {
                    String sql = "UPDATE latency_monitoring SET enabled = ?, updated_at = ? WHERE ip = ?";
                    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                        stmt.setBoolean(1, enabled);
                        stmt.setTimestamp(2, Timestamp.valueOf(now));
                        stmt.setString(3, ip);
                        stmt.executeUpdate();
                    }
                } else {
                    String sql = "INSERT INTO latency_monitoring (ip, enabled, created_at, updated_at) VALUES (?, ?, ?, ?)";
                    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                        stmt.setString(1, ip);
                        stmt.setBoolean(2, enabled);
                        stmt.setTimestamp(3, Timestamp.valueOf(now));
                        stmt.setTimestamp(4, Timestamp.valueOf(now));
                        stmt.executeUpdate();
                    }
                }
                
                conn.commit();
                logger.info("Latency monitoring {} for {}", enabled ? "enabled" : "disabled", ip);
                
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
            
        } catch (SQLException e) {
            logger.error("Failed to toggle latency monitoring for {}", ip, e);
            throw new RegistryException("Database operation failed", e);
        }
    }
    
    public Optional<LatencyMonitoringToggle> findByIp(String ip) {
        String sql = "SELECT * FROM latency_monitoring WHERE ip = ?";
        
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            
            stmt.setString(1, ip);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToToggle(rs));
                }
            }
            
        } catch (SQLException e) {
            logger.error("Failed to read latency toggle for {}", ip, e);
            throw new RegistryException("Database operation failed", e);
        }
        
        return Optional.empty();
    }
    
    public boolean isEnabled(String ip) {
        return findByIp(ip).map(LatencyMonitoringToggle::isEnabled).orElse(false);
    }
    
    public List<String> findEnabledIps() {
        String sql = "SELECT ip FROM latency_monitoring WHERE enabled = TRUE ORDER BY ip";
        List<String> ips = new ArrayList<>();
        
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            
            while (rs.next()) {
                ips.add(rs.getString("ip"));
            }
            
        } catch (SQLException e) {
            logger.error("Failed to list monitored addresses", e);
            throw new RegistryException("Database operation failed", e);
        }
        
        return ips;
    }
    
    /**
     * Enabled flag for each requested address; addresses without a toggle map to {@code false}.
     */
    public Map<String, Boolean> findStatusBatch(Collection<String> ips) {
        Map<String, Boolean> result = new LinkedHashMap<>();
        for (String ip : ips) {
            result.put(ip, false);
        }
        if (ips.isEmpty()) {
            return result;
        }
        
        String placeholders = String.join(", ", Collections.nCopies(ips.size(), "?"));
        String sql = "SELECT ip, enabled FROM latency_monitoring WHERE ip IN (" + placeholders + ")";
        
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            
            int index = 1;
            for (String ip : ips) {
                stmt.setString(index++, ip);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.put(rs.getString("ip"), rs.getBoolean("enabled"));
                }
            }
            
        } catch (SQLException e) {
            logger.error("Failed to read latency toggles", e);
            throw new RegistryException("Database operation failed", e);
        }
        
        return result;
    }
    
    public void insertMeasurement(LatencyMeasurement measurement) {
        String sql = "INSERT INTO latency_measurements (ip, latency, packet_loss, measured_at) VALUES (?, ?, ?, ?)";
        
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            
            stmt.setString(1, measurement.getIp());
            if (measurement.getLatencyMs() != null) {
                stmt.setDouble(2, measurement.getLatencyMs());
            } else {
                stmt.setNull(2, Types.DOUBLE);
            }
            stmt.setBoolean(3, measurement.isPacketLoss());
            stmt.setTimestamp(4, Timestamp.valueOf(measurement.getMeasuredAt()));
            stmt.executeUpdate();
            
            try (ResultSet generatedKeys = stmt.getGeneratedKeys()) {
                if (generatedKeys.next()) {
                    measurement.setId(generatedKeys.getLong(1));
                }
            }
            
        } catch (SQLException e) {
            logger.error("Failed to store latency measurement for {}", measurement.getIp(), e);
            throw new RegistryException("Database operation failed", e);
        }
    }
    
    /** Oldest first; a {@code null} lower bound returns every sample of the address. */
    public List<LatencyMeasurement> findMeasurementsSince(String ip, LocalDateTime since) {
        String sql = since == null
            ? "SELECT * FROM latency_measurements WHERE ip = ? ORDER BY measured_at, id"
            : "SELECT * FROM latency_measurements WHERE ip = ? AND measured_at >= ? ORDER BY measured_at, id";
        List<LatencyMeasurement> measurements = new ArrayList<>();
        
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            
            stmt.setString(1, ip);
            if (since != null) {
                stmt.setTimestamp(2, Timestamp.valueOf(since));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    double latency = rs.getDouble("latency");
                    Double latencyMs = rs.wasNull() ? null : latency;
                    LatencyMeasurement m = new LatencyMeasurement(
                        rs.getString("ip"),
                        latencyMs,
                        rs.getBoolean("packet_loss"),
                        rs.getTimestamp("measured_at").toLocalDateTime());
                    m.setId(rs.getLong("id"));
                    measurements.add(m);
                }
            }
            
        } catch (SQLException e) {
            logger.error("Failed to read latency measurements for {}", ip, e);
            throw new RegistryException("Database operation failed", e);
        }
        
        return measurements;
    }
    
    /** A {@code null} cutoff deletes every sample. */
    public int deleteMeasuredBefore(Connection conn, LocalDateTime cutoff) throws SQLException {
        if (cutoff == null) {
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM latency_measurements")) {
                return stmt.executeUpdate();
            }
        }
        try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM latency_measurements WHERE measured_at < ?")) {
            stmt.setTimestamp(1, Timestamp.valueOf(cutoff));
            return stmt.executeUpdate();
        }
    }
    
    public long countMeasurements() {
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM latency_measurements");
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            logger.error("Failed to count latency measurements", e);
            throw new RegistryException("Database operation failed", e);
        }
    }
    
    private LatencyMonitoringToggle mapResultSetToToggle(ResultSet rs) throws SQLException {
        LatencyMonitoringToggle toggle = new LatencyMonitoringToggle();
        toggle.setId(rs.getLong("id"));
        toggle.setIp(rs.getString("ip"));
        toggle.setEnabled(rs.getBoolean("enabled"));
        toggle.setCreatedAt(rs.getTimestamp("created_at").toLocalDateTime());
        toggle.setUpdatedAt(rs.getTimestamp("updated_at").toLocalDateTime());
        return toggle;
    }
}
