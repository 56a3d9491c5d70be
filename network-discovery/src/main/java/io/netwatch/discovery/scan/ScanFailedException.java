package io.netwatch.discovery.scan;

public class ScanFailedException extends RuntimeException {

    private final ScanSummary summary;

    public ScanFailedException(String message, ScanSummary summary, Throwable cause) {
        super(message, cause);
        this.summary = summary;
    }

    /** Counters of the whole pass, failures included. */
    public ScanSummary getSummary() {
        return summary;
    }
}
