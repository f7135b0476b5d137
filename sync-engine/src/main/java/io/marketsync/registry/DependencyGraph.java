package io.marketsync.registry;

import io.marketsync.core.UnknownUnitException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Directed graph over unit names, derived from their dependency lists. Iteration order of the
 * backing map is the declaration order and is used to break ties, so every ordering is
 * deterministic.
 */
public final class DependencyGraph {
    private enum Color { WHITE, GRAY, BLACK }

    private final Map<String, List<String>> edges;
    private final Map<String, Integer> declarationIndex = new HashMap<>();

    public DependencyGraph(Map<String, List<String>> edges) {
        this.edges = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : edges.entrySet()) {
            this.edges.put(e.getKey(), List.copyOf(e.getValue()));
            declarationIndex.put(e.getKey(), declarationIndex.size());
        }
    }

    public boolean contains(String name) { return edges.containsKey(name); }

    public List<String> dependenciesOf(String name) {
        List<String> deps = edges.get(name);
        if (deps == null) throw new UnknownUnitException(name);
        return deps;
    }

    /** Units that list {@code name} as a direct dependency, in declaration order. */
    public List<String> reverseDependenciesOf(String name) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : edges.entrySet()) {
            if (e.getValue().contains(name)) out.add(e.getKey());
        }
        return out;
    }

    /**
     * Orders the given units and their transitive dependencies so that every unit comes after all
     * of its dependencies. Dependencies that are not part of the graph are left out; they are
     * reported by dependency checks, not by ordering.
     *
     * @throws CyclicDependencyException if a cycle is reachable from {@code names}
     * @throws UnknownUnitException if a requested name is not in the graph
     */
    public List<String> topologicalOrder(Collection<String> names) {
        List<String> roots = new ArrayList<>(names.size());
        for (String n : names) {
            if (!edges.containsKey(n)) throw new UnknownUnitException(n);
            if (!roots.contains(n)) roots.add(n);
        }
        roots.sort(byDeclaration());

        Map<String, Color> colors = new HashMap<>();
        Deque<String> path = new ArrayDeque<>();
        List<String> out = new ArrayList<>();
        for (String root : roots) {
            visit(root, colors, path, out);
        }
        return out;
    }

    /** Ordering of the whole graph. */
    public List<String> topologicalOrder() {
        return topologicalOrder(edges.keySet());
    }

    /** Throws if the graph contains any cycle. */
    public void verifyAcyclic() {
        topologicalOrder();
    }

    private void visit(String node, Map<String, Color> colors, Deque<String> path, List<String> out) {
        Color c = colors.getOrDefault(node, Color.WHITE);
        if (c == Color.BLACK) return;
        if (c == Color.GRAY) throw new CyclicDependencyException(cyclePath(path, node));
        colors.put(node, Color.GRAY);
        path.addLast(node);
        List<String> deps = new ArrayList<>();
        for (String d : edges.get(node)) {
            if (edges.containsKey(d)) deps.add(d);
        }
        deps.sort(byDeclaration());
        for (String d : deps) {
            visit(d, colors, path, out);
        }
        path.removeLast();
        colors.put(node, Color.BLACK);
        out.add(node);
    }

    private static List<String> cyclePath(Deque<String> path, String repeated) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String p : path) {
            if (p.equals(repeated)) inCycle = true;
            if (inCycle) cycle.add(p);
        }
        cycle.add(repeated);
        return cycle;
    }

    private Comparator<String> byDeclaration() {
        return Comparator.comparingInt(declarationIndex::get);
    }

    public Map<String, List<String>> asMap() {
        return new LinkedHashMap<>(edges);
    }
}
