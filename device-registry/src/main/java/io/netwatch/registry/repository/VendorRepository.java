package io.netwatch.registry.repository;

import io.netwatch.registry.DatabaseManager;
import io.netwatch.registry.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.Map;
import java.util.Optional;

public class VendorRepository {
    
    private static final Logger logger = LoggerFactory.getLogger(VendorRepository.class);
    
    private final DatabaseManager dbManager;
    
    public VendorRepository(DatabaseManager dbManager) {
        this.dbManager = dbManager;
    }
    
    public Optional<String> findVendor(String oui) {
        String sql = "SELECT vendor FROM mac_vendors WHERE oui = ?";
        
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            
            stmt.setString(1, oui);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getString("vendor"));
                }
            }
            
        } catch (SQLException e) {
            logger.error("Failed to look up vendor for OUI {}", oui, e);
            throw new RegistryException("Database operation failed", e);
        }
        
        return Optional.empty();
    }
    
    /**
     * Swaps the whole table for the given mapping in one transaction.
     */
    public int replaceAll(Map<String, String> vendorsByOui) {
        try (Connection conn = dbManager.getConnection()) {
            conn.setAutoCommit(false);
            
            try {
                try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM mac_vendors")) {
                    stmt.executeUpdate();
                }
                
                try (PreparedStatement stmt = conn.prepareStatement("INSERT INTO mac_vendors (oui, vendor) VALUES (?, ?)")) {
                    int pending = 0;
                    for (Map.Entry<String, String> entry : vendorsByOui.entrySet()) {
                        stmt.setString(1, entry.getKey());
                        stmt.setString(2, entry.getValue());
                        stmt.addBatch();
                        if (++pending == 500) {
                            stmt.executeBatch();
                            pending = 0;
                        }
                    }
                    if (pending > 0) {
                        stmt.executeBatch();
                    }
                }
                
                conn.commit();
                logger.info("Vendor table replaced with {} entries", vendorsByOui.size());
                return vendorsByOui.size();
                
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
            
        } catch (SQLException e) {
            logger.error("Failed to replace vendor table", e);
            throw new RegistryException("Database operation failed", e);
        }
    }
    
    public long count() {
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM mac_vendors");
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            logger.error("Failed to count vendor entries", e);
            throw new RegistryException("Database operation failed", e);
        }
    }
}
