package io.netwatch.registry.model;

import java.time.LocalDateTime;

public class DeviceStats {
    private final int total;
    private final int online;
    private final int offline;
    private final int unknown;
    private final LocalDateTime lastScan;

    public DeviceStats(int total, int online, int offline, int unknown, LocalDateTime lastScan) {
        this.total = total;
        this.online = online;
        this.offline = offline;
        this.unknown = unknown;
        this.lastScan = lastScan;
    }

    public int getTotal() { return total; }
    public int getOnline() { return online; }
    public int getOffline() { return offline; }
    public int getUnknown() { return unknown; }
    public LocalDateTime getLastScan() { return lastScan; }
}
