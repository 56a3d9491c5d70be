package io.netwatch.registry.model;

public class PurgeResult {
    private final int historyDeleted;
    private final int offlineDeleted;
    private final int scansDeleted;
    private final int latencyDeleted;

    public PurgeResult(int historyDeleted, int offlineDeleted, int scansDeleted, int latencyDeleted) {
        this.historyDeleted = historyDeleted;
        this.offlineDeleted = offlineDeleted;
        this.scansDeleted = scansDeleted;
        this.latencyDeleted = latencyDeleted;
    }

    public int getHistoryDeleted() { return historyDeleted; }
    public int getOfflineDeleted() { return offlineDeleted; }
    public int getScansDeleted() { return scansDeleted; }
    public int getLatencyDeleted() { return latencyDeleted; }

    public int getTotalDeleted() {
        return historyDeleted + offlineDeleted + scansDeleted + latencyDeleted;
    }
}
