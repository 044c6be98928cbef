package com.strata.rules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Structural overview of a loaded rule set.
 *
 * @param totalFiles               number of rules
 * @param totalDirectories         distinct directories containing rules, excluding the root
 * @param dependencyCount          rules with at least one reference resolving to another rule
 * @param inheritanceRelationships rules with a resolved parent
 * @param maxDirectoryDepth        deepest directory nesting of any rule path
 * @param referenceCycles          cycles in the reference graph
 * @param inheritanceStatistics    resolved edges per inheritance type; types without edges are absent
 */
public record HierarchyInfo(
        @JsonProperty("total_files") int totalFiles,
        @JsonProperty("total_directories") int totalDirectories,
        @JsonProperty("dependency_count") int dependencyCount,
        @JsonProperty("inheritance_relationships") int inheritanceRelationships,
        @JsonProperty("max_depth") int maxDirectoryDepth,
        @JsonProperty("circular_dependencies") List<List<String>> referenceCycles,
        @JsonProperty("inheritance_statistics") Map<InheritanceType, Integer> inheritanceStatistics
) {
    public HierarchyInfo {
        referenceCycles = referenceCycles == null
                ? List.of() : referenceCycles.stream().map(List::copyOf).toList();
        inheritanceStatistics = inheritanceStatistics == null || inheritanceStatistics.isEmpty()
                ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(inheritanceStatistics));
    }
}
