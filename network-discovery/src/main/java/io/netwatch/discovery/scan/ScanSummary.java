package io.netwatch.discovery.scan;

public class ScanSummary {
    private final int scanned;
    private final int found;
    private final int updated;
    private final int online;
    private final int offline;
    private final int failed;
    private final long durationMs;

    public ScanSummary(int scanned, int found, int updated, int online, int offline, int failed, long durationMs) {
        this.scanned = scanned;
        this.found = found;
        this.updated = updated;
        this.online = online;
        this.offline = offline;
        this.failed = failed;
        this.durationMs = durationMs;
    }

    public int getScanned() { return scanned; }
    public int getFound() { return found; }
    public int getUpdated() { return updated; }
    public int getOnline() { return online; }
    public int getOffline() { return offline; }
    /** Addresses whose result could not be persisted. */
    public int getFailed() { return failed; }
    public long getDurationMs() { return durationMs; }

    @Override
    public String toString() {
        return scanned + " scanned, " + found + " found, " + updated + " updated, " + online + " online, "
            + offline + " offline, " + failed + " failed in " + durationMs + "ms";
    }
}
