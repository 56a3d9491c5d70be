package io.netwatch.registry.repository;

import io.netwatch.registry.DatabaseManager;
import io.netwatch.registry.RegistryException;
import io.netwatch.registry.model.DeviceStatus;
import io.netwatch.registry.model.HistoryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class HistoryRepository {
    
    private static final Logger logger = LoggerFactory.getLogger(HistoryRepository.class);
    
    private final DatabaseManager dbManager;
    
    public HistoryRepository(DatabaseManager dbManager) {
        this.dbManager = dbManager;
    }
    
    public void insert(Connection conn, HistoryEntry entry) throws SQLException {
        String sql = "INSERT INTO device_history (ip, status, ping_latency, observed_at) VALUES (?, ?, ?, ?)";
        
        try (PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, entry.getIp());
            stmt.setString(2, entry.getStatus().value());
            if (entry.getPingLatencyMs() != null) {
                stmt.setInt(3, entry.getPingLatencyMs());
            } else {
                stmt.setNull(3, Types.INTEGER);
            }
            stmt.setTimestamp(4, Timestamp.valueOf(entry.getObservedAt()));
            stmt.executeUpdate();
            
            try (ResultSet generatedKeys = stmt.getGeneratedKeys()) {
                if (generatedKeys.next()) {
                    entry.setId(generatedKeys.getLong(1));
                }
            }
        }
    }
    
    /** Newest first. */
    public List<HistoryEntry> findByIp(String ip, int limit) {
        String sql = "SELECT * FROM device_history WHERE ip = ? ORDER BY observed_at DESC, id DESC FETCH FIRST ? ROWS ONLY";
        List<HistoryEntry> entries = new ArrayList<>();
        
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            
            stmt.setString(1, ip);
            stmt.setInt(2, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    entries.add(mapResultSetToEntry(rs));
                }
            }
            
        } catch (SQLException e) {
            logger.error("Failed to read history for {}", ip, e);
            throw new RegistryException("Database operation failed", e);
        }
        
        return entries;
    }
    
    /** Oldest first. */
    public List<HistoryEntry> findSince(LocalDateTime since) {
        String sql = "SELECT * FROM device_history WHERE observed_at >= ? ORDER BY observed_at, id";
        List<HistoryEntry> entries = new ArrayList<>();
        
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            
            stmt.setTimestamp(1, Timestamp.valueOf(since));
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    entries.add(mapResultSetToEntry(rs));
                }
            }
            
        } catch (SQLException e) {
            logger.error("Failed to read history since {}", since, e);
            throw new RegistryException("Database operation failed", e);
        }
        
        return entries;
    }
    
    /** A {@code null} cutoff deletes every row. */
    public int deleteObservedBefore(Connection conn, LocalDateTime cutoff) throws SQLException {
        if (cutoff == null) {
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM device_history")) {
                return stmt.executeUpdate();
            }
        }
        try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM device_history WHERE observed_at < ?")) {
            stmt.setTimestamp(1, Timestamp.valueOf(cutoff));
            return stmt.executeUpdate();
        }
    }
    
    public long countAll() {
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM device_history");
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            logger.error("Failed to count history rows", e);
            throw new RegistryException("Database operation failed", e);
        }
    }
    
    public Optional<LocalDateTime> findOldestObservedAt() {
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT MIN(observed_at) FROM device_history");
             ResultSet rs = stmt.executeQuery()) {
            if (rs.next() && rs.getTimestamp(1) != null) {
                return Optional.of(rs.getTimestamp(1).toLocalDateTime());
            }
            return Optional.empty();
        } catch (SQLException e) {
            logger.error("Failed to read oldest history row", e);
            throw new RegistryException("Database operation failed", e);
        }
    }
    
    private HistoryEntry mapResultSetToEntry(ResultSet rs) throws SQLException {
        int latency = rs.getInt("ping_latency");
        Integer pingLatency = rs.wasNull() ? null : latency;
        HistoryEntry entry = new HistoryEntry(
            rs.getString("ip"),
            DeviceStatus.fromValue(rs.getString("status")),
            pingLatency,
            rs.getTimestamp("observed_at").toLocalDateTime());
        entry.setId(rs.getLong("id"));
        return entry;
    }
}
