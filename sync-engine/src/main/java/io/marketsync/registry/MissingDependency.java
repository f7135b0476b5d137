package io.marketsync.registry;

/**
 * A direct dependency that is not usable yet, and why.
 */
public record MissingDependency(String name, Reason reason, String detail) {
    public enum Reason {
        NOT_REGISTERED,
        NO_DATA,
        PROBE_FAILED
    }

    @Override
    public String toString() {
        return detail == null ? name + ": " + reason : name + ": " + reason + " (" + detail + ")";
    }
}
