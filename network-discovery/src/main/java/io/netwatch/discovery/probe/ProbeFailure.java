package io.netwatch.discovery.probe;

public enum ProbeFailure {
    NONE,
    /** The tool ran but reported no round trip. */
    UNREACHABLE,
    TIMEOUT,
    PERMISSION_DENIED,
    BINARY_MISSING,
    SPAWN_FAILED
}
