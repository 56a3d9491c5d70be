package io.netwatch.registry.query;

import java.util.Locale;

/**
 * Sortable device columns.
 * <p>
 * Fields flagged {@code derived} cannot be ordered by the database the way the dashboard
 * needs (numeric IPv4 order, empty values last in both directions). Queries on those fields
 * fetch the whole filtered set, sort it in memory and only then apply offset/limit.
 */
public enum SortField {
    IP("ip", true),
    LAST_SEEN("last_seen", false),
    FIRST_SEEN("first_seen", false),
    STATUS("status", false),
    PING_LATENCY("ping_latency", false),
    SCAN_COUNT("scan_count", false),
    HOSTNAME("hostname", true),
    MAC("mac", true),
    VENDOR("vendor", true);

    private final String column;
    private final boolean derived;

    SortField(String column, boolean derived) {
        this.column = column;
        this.derived = derived;
    }

    public String column() {
        return column;
    }

    public boolean isDerived() {
        return derived;
    }

    /** Accepts both the column name ("last_seen") and the constant name ("LAST_SEEN"). */
    public static SortField fromValue(String value) {
        if (value == null || value.isBlank()) {
            return LAST_SEEN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SortField field : values()) {
            if (field.column.equals(normalized) || field.name().equalsIgnoreCase(normalized)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unsupported sort field: " + value);
    }
}
