package io.marketsync.registry;

import io.marketsync.core.UnitDescriptor;
import io.marketsync.core.UnknownUnitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Holds every registered unit and resolves dependencies between them.
 *
 * <p>Units are registered once at process start. Reads go against an immutable snapshot and take
 * no lock; registration is serialized and swaps in a new snapshot only after the extended graph
 * has been verified acyclic.
 */
public class PluginRegistry {
    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    private volatile Snapshot snapshot = new Snapshot(Map.of(), new DependencyGraph(Map.of()));

    private record Snapshot(Map<String, UnitDescriptor> units, DependencyGraph graph) {}

    /**
     * @throws IllegalArgumentException if a unit with the same name is already registered
     * @throws CyclicDependencyException if the unit closes a cycle; the registry is left unchanged
     */
    public synchronized void register(UnitDescriptor unit) {
        Snapshot cur = snapshot;
        if (cur.units.containsKey(unit.name())) {
            throw new IllegalArgumentException("Unit already registered: " + unit.name());
        }
        Map<String, UnitDescriptor> units = new LinkedHashMap<>(cur.units);
        units.put(unit.name(), unit);
        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (UnitDescriptor u : units.values()) edges.put(u.name(), u.dependencies());
        DependencyGraph graph = new DependencyGraph(edges);
        graph.verifyAcyclic();
        snapshot = new Snapshot(units, graph);
        log.info("Registered unit {} deps={} cadence={} rateLimit={}/min",
                unit.name(), unit.dependencies(), unit.cadence(), unit.rateLimitPerMinute());
    }

    public Optional<UnitDescriptor> find(String name) {
        return Optional.ofNullable(snapshot.units.get(name));
    }

    public UnitDescriptor unit(String name) {
        UnitDescriptor u = snapshot.units.get(name);
        if (u == null) throw new UnknownUnitException(name);
        return u;
    }

    /** All units in declaration order. */
    public List<UnitDescriptor> units() {
        return List.copyOf(snapshot.units.values());
    }

    public List<UnitDescriptor> enabledUnits() {
        List<UnitDescriptor> out = new ArrayList<>();
        for (UnitDescriptor u : snapshot.units.values()) {
            if (u.isEnabled()) out.add(u);
        }
        return out;
    }

    public List<String> dependenciesOf(String name) {
        return unit(name).dependencies();
    }

    public List<String> reverseDependenciesOf(String name) {
        Snapshot s = snapshot;
        if (!s.units.containsKey(name)) throw new UnknownUnitException(name);
        return s.graph.reverseDependenciesOf(name);
    }

    public Map<String, List<String>> dependencyGraph() {
        return snapshot.graph.asMap();
    }

    /**
     * Checks the direct dependencies of a unit: each must be registered and report some data.
     */
    public DependencyCheckResult checkDependencies(String name) {
        UnitDescriptor unit = unit(name);
        if (unit.dependencies().isEmpty()) {
            return DependencyCheckResult.satisfied(unit.optionalDependencies());
        }
        List<MissingDependency> missing = new ArrayList<>();
        for (String depName : unit.dependencies()) {
            UnitDescriptor dep = snapshot.units.get(depName);
            if (dep == null) {
                missing.add(new MissingDependency(depName, MissingDependency.Reason.NOT_REGISTERED, null));
                continue;
            }
            try {
                if (!dep.probe().hasAnyData()) {
                    missing.add(new MissingDependency(depName, MissingDependency.Reason.NO_DATA, null));
                }
            } catch (Exception e) {
                log.warn("Data probe failed for dependency {} of {}: {}", depName, name, e.toString());
                missing.add(new MissingDependency(depName, MissingDependency.Reason.PROBE_FAILED, e.getMessage()));
            }
        }
        return new DependencyCheckResult(missing.isEmpty(), missing, unit.optionalDependencies());
    }

    /**
     * Execution order over the given units and all their transitive dependencies.
     *
     * @throws CyclicDependencyException if a cycle is reachable from {@code names}
     */
    public List<String> topologicalOrder(Collection<String> names) {
        return snapshot.graph.topologicalOrder(names);
    }

    /**
     * Like {@link #topologicalOrder(Collection)}, optionally pulling in the registered optional
     * dependencies of every unit in the plan.
     */
    public List<String> executionPlan(Collection<String> names, boolean includeOptional) {
        List<String> ordered = topologicalOrder(names);
        if (!includeOptional) return ordered;
        Snapshot s = snapshot;
        Set<String> all = new LinkedHashSet<>(ordered);
        for (String n : ordered) {
            for (String opt : s.units.get(n).optionalDependencies()) {
                if (s.units.containsKey(opt)) all.add(opt);
            }
        }
        if (all.size() == ordered.size()) return ordered;
        return s.graph.topologicalOrder(all);
    }

    public void setEnabled(String name, boolean enabled) {
        unit(name).setEnabled(enabled);
        log.info("Unit {} enabled={}", name, enabled);
    }

    public void setFullScan(String name, boolean fullScan) {
        unit(name).setFullScan(fullScan);
        log.info("Unit {} fullScan={}", name, fullScan);
    }
}
