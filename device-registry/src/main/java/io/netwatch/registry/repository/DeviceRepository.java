package io.netwatch.registry.repository;

import io.netwatch.registry.DatabaseManager;
import io.netwatch.registry.RegistryException;
import io.netwatch.registry.model.DeviceRecord;
import io.netwatch.registry.model.DeviceStatus;
import io.netwatch.registry.query.DeviceQuery;
import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public class DeviceRepository {
    
    private static final Logger logger = LoggerFactory.getLogger(DeviceRepository.class);
    
    private final DatabaseManager dbManager;
    
    public DeviceRepository(DatabaseManager dbManager) {
        this.dbManager = dbManager;
    }
    
    public DeviceRecord insert(Connection conn, DeviceRecord device) throws SQLException {
        String sql = "INSERT INTO devices (ip, mac, hostname, vendor, hostname_source, vendor_source, status, "
            + "ping_latency, first_seen, last_seen, scan_count, extra_info, extra_search) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        
        try (PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, device.getIp());
            bindColumns(stmt, 2, device);
            
            int affectedRows = stmt.executeUpdate();
            if (affectedRows == 0) {
                throw new SQLException("Creating device failed, no rows affected.");
            }
            
            try (ResultSet generatedKeys = stmt.getGeneratedKeys()) {
                if (generatedKeys.next()) {
                    device.setId(generatedKeys.getLong(1));
                } else {
                    throw new SQLException("Creating device failed, no ID obtained.");
                }
            }
        }
        
        logger.debug("Device {} inserted with ID: {}", device.getIp(), device.getId());
        return device;
    }
    
    public void update(Connection conn, DeviceRecord device) throws SQLException {
        String sql = "UPDATE devices SET mac = ?, hostname = ?, vendor = ?, hostname_source = ?, vendor_source = ?, "
            + "status = ?, ping_latency = ?, first_seen = ?, last_seen = ?, scan_count = ?, extra_info = ?, extra_search = ? "
            + "WHERE ip = ?";
        
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            int next = bindColumns(stmt, 1, device);
            stmt.setString(next, device.getIp());
            
            int affectedRows = stmt.executeUpdate();
            if (affectedRows == 0) {
                throw new SQLException("Updating device " + device.getIp() + " failed, no rows affected.");
            }
        }
        logger.debug("Device {} updated (status={}, scanCount={})", device.getIp(), device.getStatus().value(), device.getScanCount());
    }
    
    private int bindColumns(PreparedStatement stmt, int index, DeviceRecord device) throws SQLException {
        stmt.setString(index++, device.getMac());
        stmt.setString(index++, device.getHostname());
        stmt.setString(index++, device.getVendor());
        stmt.setString(index++, device.getHostnameSource());
        stmt.setString(index++, device.getVendorSource());
        stmt.setString(index++, device.getStatus().value());
        if (device.getPingLatencyMs() != null) {
            stmt.setInt(index++, device.getPingLatencyMs());
        } else {
            stmt.setNull(index++, Types.INTEGER);
        }
        stmt.setTimestamp(index++, Timestamp.valueOf(device.getFirstSeen()));
        stmt.setTimestamp(index++, Timestamp.valueOf(device.getLastSeen()));
        stmt.setInt(index++, device.getScanCount());
        stmt.setString(index++, device.getExtraInfo());
        stmt.setString(index++, searchableText(device.getExtraInfo()));
        return index;
    }
    
    public Optional<DeviceRecord> findByIp(String ip) {
        try (Connection conn = dbManager.getConnection()) {
            return findByIp(conn, ip, false);
        } catch (SQLException e) {
            logger.error("Failed to find device by IP: {}", ip, e);
            throw new RegistryException("Database operation failed", e);
        }
    }
    
    /**
     * Reads the row and locks it until the caller's transaction ends.
     */
    public Optional<DeviceRecord> findByIpForUpdate(Connection conn, String ip) throws SQLException {
        return findByIp(conn, ip, true);
    }
    
    private Optional<DeviceRecord> findByIp(Connection conn, String ip, boolean forUpdate) throws SQLException {
        String sql = "SELECT * FROM devices WHERE ip = ?" + (forUpdate ? " FOR UPDATE" : "");
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, ip);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToDevice(rs));
                }
            }
        }
        return Optional.empty();
    }
    
    public boolean delete(Connection conn, String ip) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM devices WHERE ip = ?")) {
            stmt.setString(1, ip);
            return stmt.executeUpdate() > 0;
        }
    }
    
    /** Every known address, in insertion order. */
    public List<String> findAllIps() {
        String sql = "SELECT ip FROM devices ORDER BY id";
        List<String> ips = new ArrayList<>();
        
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            
            while (rs.next()) {
                ips.add(rs.getString("ip"));
            }
            
        } catch (SQLException e) {
            logger.error("Failed to list device IPs", e);
            throw new RegistryException("Database operation failed", e);
        }
        
        return ips;
    }
    
    /**
     * Filtered, ordered and paginated by the database. Only valid for non-derived sort fields.
     */
    public List<DeviceRecord> findPage(DeviceQuery query) {
        if (query.getSortBy().isDerived()) {
            throw new IllegalArgumentException("Sort field " + query.getSortBy() + " must be sorted in memory");
        }
        WhereClause where = WhereClause.of(query);
        StringBuilder sql = new StringBuilder("SELECT * FROM devices").append(where.sql);
        sql.append(" ORDER BY ").append(query.getSortBy().column()).append(' ').append(query.getSortOrder().name())
            .append(", id ASC");
        
        List<Object> params = new ArrayList<>(where.params);
        if (query.getOffset() != null || query.getLimit() != null) {
            sql.append(" OFFSET ? ROWS");
            params.add(query.getOffset() != null ? query.getOffset() : 0);
            if (query.getLimit() != null) {
                sql.append(" FETCH NEXT ? ROWS ONLY");
                params.add(query.getLimit());
            }
        }
        return queryDevices(sql.toString(), params);
    }
    
    /**
     * Every row matching the filters, unordered apart from insertion order and never paginated.
     */
    public List<DeviceRecord> findMatching(DeviceQuery query) {
        WhereClause where = WhereClause.of(query);
        return queryDevices("SELECT * FROM devices" + where.sql + " ORDER BY id", where.params);
    }
    
    public int count(DeviceQuery query) {
        WhereClause where = WhereClause.of(query);
        String sql = "SELECT COUNT(*) FROM devices" + where.sql;
        
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            
            bind(stmt, where.params);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
            
        } catch (SQLException e) {
            logger.error("Failed to count devices", e);
            throw new RegistryException("Database operation failed", e);
        }
    }
    
    private List<DeviceRecord> queryDevices(String sql, List<Object> params) {
        List<DeviceRecord> devices = new ArrayList<>();
        
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            
            bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    devices.add(mapResultSetToDevice(rs));
                }
            }
            
        } catch (SQLException e) {
            logger.error("Failed to query devices", e);
            throw new RegistryException("Database operation failed", e);
        }
        
        return devices;
    }
    
    public Map<DeviceStatus, Integer> countByStatus() {
        String sql = "SELECT status, COUNT(*) AS cnt FROM devices GROUP BY status";
        Map<DeviceStatus, Integer> counts = new EnumMap<>(DeviceStatus.class);
        for (DeviceStatus status : DeviceStatus.values()) {
            counts.put(status, 0);
        }
        
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            
            while (rs.next()) {
                counts.put(DeviceStatus.fromValue(rs.getString("status")), rs.getInt("cnt"));
            }
            
        } catch (SQLException e) {
            logger.error("Failed to count devices by status", e);
            throw new RegistryException("Database operation failed", e);
        }
        
        return counts;
    }
    
    public Optional<LocalDateTime> findLatestLastSeen() {
        return selectTimestamp("SELECT MAX(last_seen) FROM devices");
    }
    
    public Optional<LocalDateTime> findOldestFirstSeen() {
        return selectTimestamp("SELECT MIN(first_seen) FROM devices");
    }
    
    private Optional<LocalDateTime> selectTimestamp(String sql) {
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            
            if (rs.next()) {
                Timestamp ts = rs.getTimestamp(1);
                if (ts != null) {
                    return Optional.of(ts.toLocalDateTime());
                }
            }
            return Optional.empty();
            
        } catch (SQLException e) {
            logger.error("Failed to read device timestamp aggregate", e);
            throw new RegistryException("Database operation failed", e);
        }
    }
    
    public long countAll() {
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM devices");
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            logger.error("Failed to count devices", e);
            throw new RegistryException("Database operation failed", e);
        }
    }
    
    /**
     * Deletes rows whose last_seen is before the cutoff; a {@code null} cutoff deletes every row.
     */
    public int deleteLastSeenBefore(Connection conn, LocalDateTime cutoff) throws SQLException {
        if (cutoff == null) {
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM devices")) {
                return stmt.executeUpdate();
            }
        }
        try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM devices WHERE last_seen < ?")) {
            stmt.setTimestamp(1, Timestamp.valueOf(cutoff));
            return stmt.executeUpdate();
        }
    }
    
    /**
     * Same as {@link #deleteLastSeenBefore} restricted to offline rows.
     */
    public int deleteOfflineLastSeenBefore(Connection conn, LocalDateTime cutoff) throws SQLException {
        String sql = cutoff == null
            ? "DELETE FROM devices WHERE status = ?"
            : "DELETE FROM devices WHERE status = ? AND last_seen < ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, DeviceStatus.OFFLINE.value());
            if (cutoff != null) {
                stmt.setTimestamp(2, Timestamp.valueOf(cutoff));
            }
            return stmt.executeUpdate();
        }
    }
    
    private DeviceRecord mapResultSetToDevice(ResultSet rs) throws SQLException {
        DeviceRecord device = new DeviceRecord(rs.getString("ip"));
        device.setId(rs.getLong("id"));
        device.setMac(rs.getString("mac"));
        device.setHostname(rs.getString("hostname"));
        device.setVendor(rs.getString("vendor"));
        device.setHostnameSource(rs.getString("hostname_source"));
        device.setVendorSource(rs.getString("vendor_source"));
        device.setStatus(DeviceStatus.fromValue(rs.getString("status")));
        
        int latency = rs.getInt("ping_latency");
        device.setPingLatencyMs(rs.wasNull() ? null : latency);
        
        Timestamp firstSeen = rs.getTimestamp("first_seen");
        if (firstSeen != null) {
            device.setFirstSeen(firstSeen.toLocalDateTime());
        }
        
        Timestamp lastSeen = rs.getTimestamp("last_seen");
        if (lastSeen != null) {
            device.setLastSeen(lastSeen.toLocalDateTime());
        }
        
        device.setScanCount(rs.getInt("scan_count"));
        device.setExtraInfo(rs.getString("extra_info"));
        return device;
    }
    
    private static void bind(PreparedStatement stmt, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object param = params.get(i);
            if (param instanceof LocalDateTime) {
                stmt.setTimestamp(i + 1, Timestamp.valueOf((LocalDateTime) param));
            } else {
                stmt.setObject(i + 1, param);
            }
        }
    }
    
    /**
     * Leaf values of the extra info document, lower-cased and space separated, so that
     * free-text search can reach nested fields such as open port numbers.
     */
    static String searchableText(String extraInfo) {
        if (extraInfo == null || extraInfo.isBlank()) {
            return null;
        }
        StringBuilder out = new StringBuilder();
        collectLeaves(new JSONObject(extraInfo), out);
        return out.length() == 0 ? null : out.toString().trim().toLowerCase(Locale.ROOT);
    }
    
    private static void collectLeaves(Object node, StringBuilder out) {
        if (node instanceof JSONObject) {
            JSONObject obj = (JSONObject) node;
            for (String key : obj.keySet()) {
                collectLeaves(obj.get(key), out);
            }
        } else if (node instanceof JSONArray) {
            for (Object item : (JSONArray) node) {
                collectLeaves(item, out);
            }
        } else if (node != null && node != JSONObject.NULL) {
            out.append(node).append(' ');
        }
    }
    
    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
    
    private static final class WhereClause {
        private final String sql;
        private final List<Object> params;
        
        private WhereClause(String sql, List<Object> params) {
            this.sql = sql;
            this.params = params;
        }
        
        static WhereClause of(DeviceQuery query) {
            List<String> conditions = new ArrayList<>();
            List<Object> params = new ArrayList<>();
            
            if (query.getStatus() != null) {
                conditions.add("status = ?");
                params.add(query.getStatus().value());
            }
            
            if (query.getIpPrefix() != null && !query.getIpPrefix().isBlank()) {
                conditions.add("ip LIKE ? ESCAPE '\\'");
                params.add(escapeLike(query.getIpPrefix().trim()) + "%");
            }
            
            if (query.getSearch() != null && !query.getSearch().isBlank()) {
                String pattern = "%" + escapeLike(query.getSearch().trim().toLowerCase(Locale.ROOT)) + "%";
                conditions.add("(LOWER(ip) LIKE ? ESCAPE '\\'"
                    + " OR LOWER(COALESCE(mac, '')) LIKE ? ESCAPE '\\'"
                    + " OR LOWER(COALESCE(hostname, '')) LIKE ? ESCAPE '\\'"
                    + " OR LOWER(COALESCE(vendor, '')) LIKE ? ESCAPE '\\'"
                    + " OR COALESCE(extra_search, '') LIKE ? ESCAPE '\\')");
                for (int i = 0; i < 5; i++) {
                    params.add(pattern);
                }
            }
            
            if (query.getLastSeenFrom() != null) {
                conditions.add("last_seen >= ?");
                params.add(query.getLastSeenFrom());
            }
            
            if (query.getLastSeenTo() != null) {
                conditions.add("last_seen <= ?");
                params.add(query.getLastSeenTo());
            }
            
            String sql = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
            return new WhereClause(sql, params);
        }
    }
}
