package io.marketsync.registry;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DependencyGraphTest {

    @Test
    void cycle_path_starts_and_ends_at_the_repeated_unit() {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        edges.put("root", List.of("a"));
        edges.put("a", List.of("b"));
        edges.put("b", List.of("c"));
        edges.put("c", List.of("a"));
        DependencyGraph g = new DependencyGraph(edges);

        CyclicDependencyException e = assertThrows(CyclicDependencyException.class, g::verifyAcyclic);
        assertEquals(List.of("a", "b", "c", "a"), e.cycle());
        assertTrue(e.getMessage().contains("a -> b -> c -> a"));
    }

    @Test
    void whole_graph_order_covers_every_unit_once() {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        edges.put("x", List.of("y", "z"));
        edges.put("y", List.of("z"));
        edges.put("z", List.of());
        edges.put("w", List.of());
        List<String> order = new DependencyGraph(edges).topologicalOrder();

        assertEquals(List.of("z", "y", "x", "w"), order);
    }
}
