package io.netwatch.registry.model;

public enum DeviceStatus {
    ONLINE("online"),
    OFFLINE("offline"),
    UNKNOWN("unknown");

    private final String value;

    DeviceStatus(String value) {
        this.value = value;
    }

    /** Column value as stored in the database. */
    public String value() {
        return value;
    }

    public static DeviceStatus fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (DeviceStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown device status: " + value);
    }
}
