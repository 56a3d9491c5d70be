package io.netwatch.discovery.probe;

public class ProbeResult {
    private final boolean success;
    private final Integer latencyMs;
    private final ProbeFailure failure;

    private ProbeResult(boolean success, Integer latencyMs, ProbeFailure failure) {
        this.success = success;
        this.latencyMs = latencyMs;
        this.failure = failure;
    }

    public static ProbeResult reachable(int latencyMs) {
        return new ProbeResult(true, latencyMs, ProbeFailure.NONE);
    }

    public static ProbeResult unreachable() {
        return new ProbeResult(false, null, ProbeFailure.UNREACHABLE);
    }

    public static ProbeResult failed(ProbeFailure failure) {
        return new ProbeResult(false, null, failure);
    }

    public boolean isSuccess() { return success; }
    public Integer getLatencyMs() { return latencyMs; }
    public ProbeFailure getFailure() { return failure; }

    @Override
    public String toString() {
        return success ? "reachable(" + latencyMs + " ms)" : "unreachable(" + failure + ")";
    }
}
