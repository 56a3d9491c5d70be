package io.netwatch.registry.model;

import java.time.LocalDateTime;

public class LatencyMeasurement {
    private long id;
    private String ip;
    private Double latencyMs;
    private boolean packetLoss;
    private LocalDateTime measuredAt;

    public LatencyMeasurement(String ip, Double latencyMs, boolean packetLoss, LocalDateTime measuredAt) {
        this.ip = ip;
        this.latencyMs = latencyMs;
        this.packetLoss = packetLoss;
        this.measuredAt = measuredAt;
    }

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }
    public String getIp() { return ip; }
    /** {@code null} when the sample was lost. */
    public Double getLatencyMs() { return latencyMs; }
    public boolean isPacketLoss() { return packetLoss; }
    public LocalDateTime getMeasuredAt() { return measuredAt; }
}
