package io.netwatch.registry.model;

import org.json.JSONObject;

public class RetentionConfig {

    public static final int DEFAULT_HISTORY_DAYS = 30;
    public static final int DEFAULT_SCAN_DAYS = 90;
    public static final int DEFAULT_OFFLINE_DAYS = 7;
    public static final int DEFAULT_LATENCY_DAYS = 30;
    public static final int DEFAULT_PURGE_INTERVAL_HOURS = 24;

    private int historyRetentionDays = DEFAULT_HISTORY_DAYS;
    private int scanRetentionDays = DEFAULT_SCAN_DAYS;
    private int offlineRetentionDays = DEFAULT_OFFLINE_DAYS;
    private int latencyRetentionDays = DEFAULT_LATENCY_DAYS;
    private boolean autoPurgeEnabled = true;
    private int purgeIntervalHours = DEFAULT_PURGE_INTERVAL_HOURS;

    public RetentionConfig() {}

    /** Missing keys keep their defaults. */
    public static RetentionConfig fromJson(String json) {
        RetentionConfig config = new RetentionConfig();
        if (json == null || json.isBlank()) {
            return config;
        }
        JSONObject obj = new JSONObject(json);
        config.setHistoryRetentionDays(obj.optInt("historyRetentionDays", config.historyRetentionDays));
        config.setScanRetentionDays(obj.optInt("scanRetentionDays", config.scanRetentionDays));
        config.setOfflineRetentionDays(obj.optInt("offlineRetentionDays", config.offlineRetentionDays));
        config.setLatencyRetentionDays(obj.optInt("latencyRetentionDays", config.latencyRetentionDays));
        config.setAutoPurgeEnabled(obj.optBoolean("autoPurgeEnabled", config.autoPurgeEnabled));
        config.setPurgeIntervalHours(obj.optInt("purgeIntervalHours", config.purgeIntervalHours));
        return config;
    }

    public String toJson() {
        return new JSONObject()
            .put("historyRetentionDays", historyRetentionDays)
            .put("scanRetentionDays", scanRetentionDays)
            .put("offlineRetentionDays", offlineRetentionDays)
            .put("latencyRetentionDays", latencyRetentionDays)
            .put("autoPurgeEnabled", autoPurgeEnabled)
            .put("purgeIntervalHours", purgeIntervalHours)
            .toString();
    }

    private static int requireDays(String name, int days) {
        if (days < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, got " + days);
        }
        return days;
    }

    public int getHistoryRetentionDays() { return historyRetentionDays; }
    public void setHistoryRetentionDays(int days) { this.historyRetentionDays = requireDays("historyRetentionDays", days); }

    public int getScanRetentionDays() { return scanRetentionDays; }
    public void setScanRetentionDays(int days) { this.scanRetentionDays = requireDays("scanRetentionDays", days); }

    public int getOfflineRetentionDays() { return offlineRetentionDays; }
    public void setOfflineRetentionDays(int days) { this.offlineRetentionDays = requireDays("offlineRetentionDays", days); }

    public int getLatencyRetentionDays() { return latencyRetentionDays; }
    public void setLatencyRetentionDays(int days) { this.latencyRetentionDays = requireDays("latencyRetentionDays", days); }

    public boolean isAutoPurgeEnabled() { return autoPurgeEnabled; }
    public void setAutoPurgeEnabled(boolean autoPurgeEnabled) { this.autoPurgeEnabled = autoPurgeEnabled; }

    public int getPurgeIntervalHours() { return purgeIntervalHours; }
    public void setPurgeIntervalHours(int hours) {
        if (hours < 1) {
            throw new IllegalArgumentException("purgeIntervalHours must be >= 1, got " + hours);
        }
        this.purgeIntervalHours = hours;
    }
}
