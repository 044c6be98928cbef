package com.strata.rules.service.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CycleFinderTest {

    @Test
    @DisplayName("Should rotate cycles to start at the smallest path")
    void shouldRotateCycles() {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        edges.put("c", List.of("a"));
        edges.put("a", List.of("b"));
        edges.put("b", List.of("c"));

        List<List<String>> cycles = CycleFinder.findCycles(edges);

        assertThat(cycles).containsExactly(List.of("a", "b", "c"));
        assertThat(CycleFinder.describe(cycles.get(0))).isEqualTo("a -> b -> c -> a");
    }

    @Test
    @DisplayName("Should find independent cycles and ignore acyclic parts")
    void shouldFindIndependentCycles() {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        edges.put("x", List.of("y"));
        edges.put("y", List.of("x"));
        edges.put("p", List.of("q", "missing"));
        edges.put("q", List.of());
        edges.put("s", List.of("s"));

        assertThat(CycleFinder.findCycles(edges)).containsExactly(List.of("s"), List.of("x", "y"));
    }

    @Test
    @DisplayName("Should walk very long paths iteratively")
    void shouldHandleLongPaths() {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        int n = 50_000;
        for (int i = 0; i < n; i++) {
            edges.put("n" + i, List.of("n" + (i + 1)));
        }
        edges.put("n" + n, List.of("n0"));

        List<List<String>> cycles = CycleFinder.findCycles(edges);

        assertThat(cycles).hasSize(1);
        assertThat(cycles.get(0)).hasSize(n + 1).first().isEqualTo("n0");
    }
}
