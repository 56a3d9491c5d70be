package io.netwatch.registry.query;

public enum SortOrder {
    ASC,
    DESC;

    public static SortOrder fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DESC;
        }
        return SortOrder.valueOf(value.trim().toUpperCase(java.util.Locale.ROOT));
    }
}
