/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.benchmark;

import com.strata.rules.api.model.CompositionResult;
import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.api.model.ValidationReport;
import com.strata.rules.infra.cache.CacheConfig;
import com.strata.rules.service.RuleOrchestrator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Composition throughput over a generated rule tree.
 * <p>
 * Rules are laid out as {@code index.md} per directory, {@code depth} directories deep
 * and {@code fanOut} wide, with leaf rules in the deepest directories. Each leaf chain is
 * therefore {@code depth + 2} rules long and crosses every inheritance mode.
 * <p>
 * CACHE SCENARIOS:
 * - COLD: cache cleared before every iteration, every first composition folds the chain
 * - WARM: every leaf composed once before the iteration, compositions are cache hits
 * <p>
 * USAGE:
 * mvn clean package -pl strata-benchmarks -am -DskipTests
 * java -cp strata-benchmarks/target/classes:... com.strata.rules.benchmark.CompositionBenchmark
 * <p>
 * CONFIGURATION:
 * -Dbench.quick : fewer, shorter iterations
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g", "-XX:+UseG1GC"})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 10, time = 3)
public class CompositionBenchmark {

    private static final boolean QUICK_MODE = Boolean.getBoolean("bench.quick");
    private static final Tracer NOOP_TRACER = OpenTelemetry.noop().getTracer("noop");
    private static final String[] MODES = {"full", "content", "metadata", "variables"};

    @Param({"3", "6"})
    private int depth;

    @Param({"4"})
    private int fanOut;

    @Param({"COLD", "WARM"})
    private String cacheScenario;

    private RuleOrchestrator orchestrator;
    private Map<String, ParsedRule> rules;
    private List<String> leaves;
    private final AtomicInteger leafIndex = new AtomicInteger();

    @Setup(Level.Trial)
    public void setupTrial() {
        java.util.logging.Logger.getLogger("com.strata.rules").setLevel(java.util.logging.Level.WARNING);

        orchestrator = RuleOrchestrator.builder()
                .tracer(NOOP_TRACER)
                .cacheConfig(CacheConfig.builder().maxSize(100_000).build())
                .build();

        Map<String, String> documents = new LinkedHashMap<>();
        leaves = new ArrayList<>();
        generate("", 0, new Random(42), documents);
        rules = orchestrator.loadHierarchy(documents);

        System.out.printf("Generated %d rules, %d leaves, chain length %d%n",
                rules.size(), leaves.size(), depth + 2);
    }

    @Setup(Level.Iteration)
    public void setupIteration() {
        leafIndex.set(0);
        orchestrator.clearCache();
        if ("WARM".equals(cacheScenario)) {
            for (String leaf : leaves) {
                orchestrator.composeRule(leaf, rules);
            }
        }
    }

    @TearDown(Level.Trial)
    public void teardownTrial() {
        System.out.println(orchestrator.cacheStatus().format());
    }

    @Benchmark
    public CompositionResult composeLeaf() {
        String leaf = leaves.get(leafIndex.getAndIncrement() % leaves.size());
        return orchestrator.composeRule(leaf, rules);
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public void validateHierarchy(Blackhole bh) {
        ValidationReport report = orchestrator.validateHierarchy(rules);
        bh.consume(report);
    }

    private void generate(String dir, int level, Random rand, Map<String, String> documents) {
        String prefix = dir.isEmpty() ? "" : dir + "/";
        documents.put(prefix + "index.md", String.format("""
                ---
                inherit_mode: %s
                level_%d: value_%d
                ---
                # Guidelines
                Level %d guidance for %s.

                # Level %d
                Details %d.
                """, MODES[level % MODES.length], level, rand.nextInt(1000),
                level, dir.isEmpty() ? "root" : dir, level, rand.nextInt(1000)));

        if (level == depth) {
            for (int i = 0; i < fanOut; i++) {
                String leaf = prefix + "leaf_" + i + ".md";
                documents.put(leaf, String.format("""
                        ---
                        inherit_sections: [guidelines, level_%d]
                        owner: team_%d
                        ---
                        # Leaf
                        Leaf %d of %s.
                        """, level, rand.nextInt(50), i, dir));
                leaves.add(leaf);
            }
            return;
        }
        for (int i = 0; i < fanOut; i++) {
            generate(prefix + "d" + level + "_" + i, level + 1, rand, documents);
        }
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
                .include(CompositionBenchmark.class.getSimpleName())
                .warmupIterations(QUICK_MODE ? 2 : 5)
                .measurementIterations(QUICK_MODE ? 3 : 10)
                .build();
        new Runner(options).run();
    }
}
