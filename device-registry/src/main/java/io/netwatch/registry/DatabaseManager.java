package io.netwatch.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class DatabaseManager {
    
    private static final Logger logger = LoggerFactory.getLogger(DatabaseManager.class);
    
    private final String url;
    private final String user;
    private final String password;
    
    /**
     * Configuration via system properties with defaults.
     */
    public DatabaseManager() {
        this(System.getProperty("db.url", "jdbc:postgresql://localhost:5432/netwatch"),
             System.getProperty("db.user", "postgres"),
             System.getProperty("db.password", "postgres"));
    }
    
    public DatabaseManager(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
        initializeDatabase();
    }
    
    private void initializeDatabase() {
        try (Connection testConn = DriverManager.getConnection(url, user, password)) {
            logger.info("Connected to database: {} ({})", url, testConn.getMetaData().getDatabaseProductName());
            createSchema(testConn);
        } catch (SQLException e) {
            logger.error("Failed to initialize database", e);
            throw new RegistryException("Database initialization failed", e);
        }
    }
    
    private void createSchema(Connection conn) throws SQLException {
        String schema = readSchema();
        // Strip "--" comments line by line, then split on semicolons
        StringBuilder cleanedSchema = new StringBuilder();
        for (String line : schema.split("\n")) {
            int commentIndex = line.indexOf("--");
            if (commentIndex >= 0) {
                line = line.substring(0, commentIndex);
            }
            if (!line.trim().isEmpty()) {
                cleanedSchema.append(line).append("\n");
            }
        }
        String[] statements = cleanedSchema.toString().split(";");
        
        try (Statement stmt = conn.createStatement()) {
            int executedCount = 0;
            for (String statement : statements) {
                String trimmed = statement.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                
                logger.debug("Executing SQL statement {}", executedCount + 1);
                try {
                    stmt.execute(trimmed);
                    executedCount++;
                } catch (SQLException e) {
                    String errorMsg = String.valueOf(e.getMessage());
                    boolean isIgnorable = errorMsg.contains("already exists") || errorMsg.contains("duplicate");
                    if (!isIgnorable) {
                        logger.error("Failed to execute SQL statement: {}", trimmed.substring(0, Math.min(100, trimmed.length())));
                        throw e;
                    }
                    logger.debug("Ignoring expected SQL message: {}", errorMsg);
                }
            }
            logger.info("Database schema ready. Executed {} statements.", executedCount);
        }
    }
    
    private String readSchema() {
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql")) {
            if (schemaStream == null) {
                throw new RegistryException("Schema file not found");
            }
            return new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (java.io.IOException e) {
            throw new RegistryException("Schema file could not be read", e);
        }
    }
    
    /**
     * Get a new database connection for each request.
     * This allows concurrent access from multiple threads.
     * Connections should be closed by the caller using try-with-resources.
     */
    public Connection getConnection() {
        try {
            return DriverManager.getConnection(url, user, password);
        } catch (SQLException e) {
            logger.error("Failed to get database connection", e);
            throw new RegistryException("Database connection failed", e);
        }
    }
    
    public String getUrl() {
        return url;
    }
}
