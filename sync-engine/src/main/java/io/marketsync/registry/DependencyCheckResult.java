package io.marketsync.registry;

import java.util.List;

public record DependencyCheckResult(boolean satisfied, List<MissingDependency> missing, List<String> optionalDependencies) {
    public DependencyCheckResult {
        missing = List.copyOf(missing);
        optionalDependencies = List.copyOf(optionalDependencies);
    }

    public static DependencyCheckResult satisfied(List<String> optionalDependencies) {
        return new DependencyCheckResult(true, List.of(), optionalDependencies);
    }

    public boolean hasUnregistered() {
        return missing.stream().anyMatch(m -> m.reason() == MissingDependency.Reason.NOT_REGISTERED);
    }
}
