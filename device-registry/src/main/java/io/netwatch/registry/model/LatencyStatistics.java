package io.netwatch.registry.model;

public class LatencyStatistics {
    private final Double avg1h;
    private final Double avg24h;
    private final Double min;
    private final Double max;
    private final double packetLossPercent;
    private final int totalMeasurements;

    public LatencyStatistics(Double avg1h, Double avg24h, Double min, Double max,
                             double packetLossPercent, int totalMeasurements) {
        this.avg1h = avg1h;
        this.avg24h = avg24h;
        this.min = min;
        this.max = max;
        this.packetLossPercent = packetLossPercent;
        this.totalMeasurements = totalMeasurements;
    }

    public Double getAvg1h() { return avg1h; }
    public Double getAvg24h() { return avg24h; }
    public Double getMin() { return min; }
    public Double getMax() { return max; }
    public double getPacketLossPercent() { return packetLossPercent; }
    public int getTotalMeasurements() { return totalMeasurements; }
}
