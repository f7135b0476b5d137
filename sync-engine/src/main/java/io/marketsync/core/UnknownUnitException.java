package io.marketsync.core;

public class UnknownUnitException extends SyncException {
    private final String unitName;

    public UnknownUnitException(String unitName) {
        super("Unknown unit: " + unitName);
        this.unitName = unitName;
    }

    public String unitName() { return unitName; }
}
