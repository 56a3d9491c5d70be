package io.netwatch.registry.model;

public class ReconcileResult {

    public enum Outcome {
        CREATED,
        UPDATED,
        IGNORED
    }

    private final Outcome outcome;
    private final DeviceStatus previousStatus;
    private final DeviceRecord record;

    public ReconcileResult(Outcome outcome, DeviceStatus previousStatus, DeviceRecord record) {
        this.outcome = outcome;
        this.previousStatus = previousStatus;
        this.record = record;
    }

    public static ReconcileResult ignored() {
        return new ReconcileResult(Outcome.IGNORED, null, null);
    }

    public Outcome getOutcome() { return outcome; }
    public DeviceStatus getPreviousStatus() { return previousStatus; }
    /** Row as persisted, {@code null} when {@link Outcome#IGNORED}. */
    public DeviceRecord getRecord() { return record; }
}
