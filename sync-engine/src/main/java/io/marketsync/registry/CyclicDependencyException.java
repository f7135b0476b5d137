package io.marketsync.registry;

import io.marketsync.core.SyncException;

import java.util.List;

/**
 * A dependency cycle was found. {@link #cycle()} is the full path, first and last element equal.
 */
public class CyclicDependencyException extends SyncException {
    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("Cyclic dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() { return cycle; }
}
