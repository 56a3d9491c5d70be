package io.netwatch.discovery.scan;

import java.util.Locale;

public enum ScanMode {
    /** Probe plus MAC, vendor and host name resolution for every reachable host. */
    FULL,
    /** Probe only; known identity fields are carried forward untouched. */
    QUICK;

    public static ScanMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return QUICK;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
