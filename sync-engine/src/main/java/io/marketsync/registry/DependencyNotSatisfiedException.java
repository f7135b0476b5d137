package io.marketsync.registry;

import io.marketsync.core.SyncException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a unit is submitted before its direct dependencies have data. Recoverable: run the
 * missing dependencies and submit again, or submit with dependency auto-resolution.
 */
public class DependencyNotSatisfiedException extends SyncException {
    private final String unitName;
    private final List<MissingDependency> missing;

    public DependencyNotSatisfiedException(String unitName, List<MissingDependency> missing) {
        super("Unit '" + unitName + "' dependencies not satisfied: "
                + missing.stream().map(MissingDependency::toString).collect(Collectors.joining("; ")));
        this.unitName = unitName;
        this.missing = List.copyOf(missing);
    }

    public String unitName() { return unitName; }
    public List<MissingDependency> missing() { return missing; }
}
