package io.netwatch.registry.repository;

import io.netwatch.registry.DatabaseManager;
import io.netwatch.registry.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.LocalDateTime;
import java.util.Optional;

public class AppConfigRepository {
    
    private static final Logger logger = LoggerFactory.getLogger(AppConfigRepository.class);
    
    private final DatabaseManager dbManager;
    
    public AppConfigRepository(DatabaseManager dbManager) {
        this.dbManager = dbManager;
    }
    
    public Optional<String> get(String key) {
        String sql = "SELECT config_value FROM app_config WHERE config_key = ?";
        
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString("config_value"));
                }
            }
            
        } catch (SQLException e) {
            logger.error("Failed to read config key {}", key, e);
            throw new RegistryException("Database operation failed", e);
        }
        
        return Optional.empty();
    }
    
    public void set(String key, String value, LocalDateTime now) {
        try (Connection conn = dbManager.getConnection()) {
            conn.setAutoCommit(false);
            
            try {
                int updated;
                try (PreparedStatement stmt = conn.prepareStatement(
                        "UPDATE app_config SET config_value = ?, updated_at = ? WHERE config_key = ?")) {
                    stmt.setString(1, value);
                    stmt.setTimestamp(2, Timestamp.valueOf(now));
                    stmt.setString(3, key);
                    updated = stmt.executeUpdate();
                }
                
                if (updated == 0) {
                    try (PreparedStatement stmt = conn.prepareStatement(
                            "INSERT INTO app_config (config_key, config_value, updated_at) VALUES (?, ?, ?)")) {
                        stmt.setString(1, key);
                        stmt.setString(2, value);
                        stmt.setTimestamp(3, Timestamp.valueOf(now));
                        stmt.executeUpdate();
                    }
                }
                
                conn.commit();
                logger.debug("Config key {} saved", key);
                
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
            
        } catch (SQLException e) {
            logger.error("Failed to save config key {}", key, e);
            throw new RegistryException("Database operation failed", e);
        }
    }
}
