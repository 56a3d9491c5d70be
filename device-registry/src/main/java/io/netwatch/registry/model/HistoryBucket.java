package io.netwatch.registry.model;

import java.time.LocalDateTime;

public class HistoryBucket {
    private final LocalDateTime start;
    private final int total;
    private final int online;
    private final int offline;

    public HistoryBucket(LocalDateTime start, int total, int online, int offline) {
        this.start = start;
        this.total = total;
        this.online = online;
        this.offline = offline;
    }

    public LocalDateTime getStart() { return start; }
    public int getTotal() { return total; }
    public int getOnline() { return online; }
    public int getOffline() { return offline; }
}
