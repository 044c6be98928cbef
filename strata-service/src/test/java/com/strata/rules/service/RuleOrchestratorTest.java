package com.strata.rules.service;

import com.strata.rules.api.RuleSource;
import com.strata.rules.api.exceptions.RuleSourceException;
import com.strata.rules.api.model.CacheStatus;
import com.strata.rules.api.model.CompositionResult;
import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.api.model.ValidationReport;
import com.strata.rules.infra.cache.InMemoryCacheStore;
import com.strata.rules.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleOrchestratorTest {

    private InMemoryMetricsRegistry metrics;
    private RuleOrchestrator orchestrator;
    private Map<String, ParsedRule> rules;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryMetricsRegistry();
        orchestrator = RuleOrchestrator.builder()
                .metrics(metrics)
                .tracer(OpenTelemetry.noop().getTracer("test"))
                .cacheStore(InMemoryCacheStore.<CompositionResult>builder().maxSize(100).build())
                .build();

        Map<String, String> docs = new LinkedHashMap<>();
        docs.put("index.md", "---\nteam: platform\n---\n# Style\nUse tabs.");
        docs.put("team/coder.md", "# Review\nBe kind.");
        rules = orchestrator.loadHierarchy(docs);
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("Should parse documents and publish the rule set size")
        void shouldParseDocuments() {
            assertThat(rules).containsOnlyKeys("index.md", "team/coder.md");
            assertThat(metrics.getGaugeValue("rule_set_size")).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should wrap source failures in RuleSourceException")
        void shouldWrapSourceFailures() {
            RuleSource broken = () -> {
                throw new IOException("disk gone");
            };

            assertThatThrownBy(() -> orchestrator.loadHierarchy(broken))
                    .isInstanceOf(RuleSourceException.class)
                    .hasMessageStartingWith("Cannot load rules from")
                    .hasCauseInstanceOf(IOException.class);
        }
    }

    @Nested
    @DisplayName("Composition")
    class Composition {

        @Test
        @DisplayName("Should count compositions, failures and cache accesses")
        void shouldRecordCompositionMetrics() {
            CompositionResult first = orchestrator.composeRule("team/coder.md", rules);
            CompositionResult second = orchestrator.composeRule("team/coder.md", rules);
            CompositionResult missing = orchestrator.composeRule("ghost.md", rules);

            assertThat(first.success()).isTrue();
            assertThat(second).isEqualTo(first);
            assertThat(missing.success()).isFalse();

            assertThat(metrics.getCounterValue("rule_compositions_total")).isEqualTo(3L);
            assertThat(metrics.getCounterValue("rule_composition_failures_total")).isEqualTo(1L);
            assertThat(metrics.getCounterValue("rule_conflicts_total")).isZero();

            CacheStatus status = orchestrator.cacheStatus();
            assertThat(status.hits()).isEqualTo(1);
            assertThat(status.misses()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should render composed Markdown in the rule's own format")
        void shouldRenderComposedContent() {
            String text = orchestrator.composeRuleContent("team/coder.md", rules);

            assertThat(text).isEqualTo("""
                    # Variables

                    - team: platform

                    # Style

                    Use tabs.

                    # Review

                    Be kind.
                    """);
        }

        @Test
        @DisplayName("Should render nothing for unknown rules")
        void shouldRenderNothingForUnknownRule() {
            assertThat(orchestrator.composeRuleContent("ghost.md", rules)).isEmpty();
        }

        @Test
        @DisplayName("Should recompose after a cache clear")
        void shouldRecomposeAfterClear() {
            orchestrator.composeRule("team/coder.md", rules);
            orchestrator.clearCache();
            orchestrator.composeRule("team/coder.md", rules);

            assertThat(orchestrator.cacheStatus().hits()).isZero();
        }
    }

    @Test
    @DisplayName("Should resolve the inheritance chain root first")
    void shouldResolveChain() {
        assertThat(orchestrator.resolveInheritanceChain("team/coder.md", rules).paths())
                .containsExactly("index.md", "team/coder.md");
    }

    @Test
    @DisplayName("Should time validation and report a valid hierarchy")
    void shouldValidate() {
        ValidationReport report = orchestrator.validateHierarchy(rules);

        assertThat(report.valid()).isTrue();
        assertThat(report.errors()).isEmpty();
        assertThat(metrics.getTimerRecordings("hierarchy_validation")).hasSize(1);
    }

    @Test
    @DisplayName("Should summarise the hierarchy")
    void shouldSummariseHierarchy() {
        assertThat(orchestrator.hierarchyInfo(rules).inheritanceRelationships()).isEqualTo(1);
        assertThat(orchestrator.resolveDependencies("team/coder.md", rules)).containsExactly("team/coder.md");
    }
}
