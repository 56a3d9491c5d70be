package io.netwatch.registry;

import java.util.UUID;

/**
 * Fresh in-memory H2 databases in PostgreSQL mode, one per call.
 */
public final class TestDatabases {

    private TestDatabases() {
    }

    public static DatabaseManager newDatabase() {
        String name = "registry_" + UUID.randomUUID().toString().replace("-", "");
        return new DatabaseManager(
            "jdbc:h2:mem:" + name + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE;LOCK_TIMEOUT=10000",
            "sa", "");
    }
}
