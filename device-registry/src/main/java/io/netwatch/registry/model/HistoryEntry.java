package io.netwatch.registry.model;

import java.time.LocalDateTime;

public class HistoryEntry {
    private long id;
    private String ip;
    private DeviceStatus status;
    private Integer pingLatencyMs;
    private LocalDateTime observedAt;

    public HistoryEntry(String ip, DeviceStatus status, Integer pingLatencyMs, LocalDateTime observedAt) {
        this.ip = ip;
        this.status = status;
        this.pingLatencyMs = pingLatencyMs;
        this.observedAt = observedAt;
    }

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }
    public String getIp() { return ip; }
    public DeviceStatus getStatus() { return status; }
    public Integer getPingLatencyMs() { return pingLatencyMs; }
    public LocalDateTime getObservedAt() { return observedAt; }
}
