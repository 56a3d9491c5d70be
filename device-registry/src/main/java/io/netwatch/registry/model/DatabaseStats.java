package io.netwatch.registry.model;

import java.time.LocalDateTime;

public class DatabaseStats {
    private final long devicesCount;
    private final long historyCount;
    private final long latencyCount;
    private final LocalDateTime oldestDevice;
    private final LocalDateTime oldestHistory;
    private final long approximateSizeBytes;

    public DatabaseStats(long devicesCount, long historyCount, long latencyCount,
                         LocalDateTime oldestDevice, LocalDateTime oldestHistory, long approximateSizeBytes) {
        this.devicesCount = devicesCount;
        this.historyCount = historyCount;
        this.latencyCount = latencyCount;
        this.oldestDevice = oldestDevice;
        this.oldestHistory = oldestHistory;
        this.approximateSizeBytes = approximateSizeBytes;
    }

    public long getDevicesCount() { return devicesCount; }
    public long getHistoryCount() { return historyCount; }
    public long getLatencyCount() { return latencyCount; }
    public LocalDateTime getOldestDevice() { return oldestDevice; }
    public LocalDateTime getOldestHistory() { return oldestHistory; }
    public long getApproximateSizeBytes() { return approximateSizeBytes; }
}
