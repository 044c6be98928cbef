package com.strata.rules.service.validation;

import com.strata.rules.api.model.CompositionResult;
import com.strata.rules.api.model.ConflictKind;
import com.strata.rules.api.model.InheritanceType;
import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.api.model.ValidationReport;
import com.strata.rules.compiler.parser.RuleParser;
import com.strata.rules.compiler.resolution.InheritanceResolver;
import com.strata.rules.composition.CompositionEngine;
import com.strata.rules.infra.cache.InMemoryCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HierarchyValidatorTest {

    private final RuleParser parser = new RuleParser();
    private HierarchyValidator validator;
    private Map<String, String> docs;

    @BeforeEach
    void setUp() {
        InheritanceResolver resolver = new InheritanceResolver();
        validator = new HierarchyValidator(resolver,
                new CompositionEngine(resolver, InMemoryCacheStore.<CompositionResult>builder().maxSize(2000).build()));
        docs = new LinkedHashMap<>();
    }

    private void doc(String path, String frontMatter, String body) {
        docs.put(path, frontMatter.isEmpty() ? body : "---\n" + frontMatter + "\n---\n" + body);
    }

    private ValidationReport validate() {
        Map<String, ParsedRule> rules = parser.parseAll(docs);
        return validator.validate(rules);
    }

    @Test
    @DisplayName("Should report a three-rule cycle exactly once")
    void shouldReportCycleOnce() {
        doc("a.md", "inherit: b.md", "# S\na");
        doc("b.md", "inherit: c.md", "# S\nb");
        doc("c.md", "inherit: a.md", "# S\nc");

        ValidationReport report = validate();

        assertThat(report.valid()).isFalse();
        assertThat(report.circularDependencies()).containsExactly(List.of("a.md", "b.md", "c.md"));
        assertThat(report.errors()).contains("Circular inheritance: a.md -> b.md -> c.md -> a.md");
        assertThat(report.errors()).filteredOn(e -> e.startsWith("Composition failed for")).hasSize(3);
        assertThat(report.ruleConflicts().get("a.md"))
                .extracting(c -> c.kind()).containsExactly(ConflictKind.CIRCULAR_INHERITANCE);
        assertThat(report.orphanedRules()).isEmpty();
    }

    @Test
    @DisplayName("Should treat rules hanging off a cycle as failed but not as cycle members")
    void shouldHandleTailIntoCycle() {
        doc("a.md", "inherit: b.md", "x");
        doc("b.md", "inherit: a.md", "y");
        doc("tail.md", "inherit: a.md", "z");

        ValidationReport report = validate();

        assertThat(report.circularDependencies()).containsExactly(List.of("a.md", "b.md"));
        assertThat(report.errors()).anyMatch(e -> e.startsWith("Composition failed for tail.md"));
        assertThat(report.statistics().maxDepth()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should accept a flat rule set without inheritance")
    void shouldAcceptFlatRuleSet() {
        for (int i = 0; i < 10; i++) {
            doc("rules/r" + i + ".md", "", "# Rule\nnumber " + i);
        }

        ValidationReport report = validate();

        assertThat(report.valid()).isTrue();
        assertThat(report.circularDependencies()).isEmpty();
        assertThat(report.orphanedRules()).isEmpty();
        assertThat(report.errors()).isEmpty();
        assertThat(report.statistics().totalRules()).isEqualTo(10);
        assertThat(report.statistics().rulesWithInheritance()).isZero();
        assertThat(report.statistics().maxDepth()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should report orphans as warnings without invalidating the hierarchy")
    void shouldReportOrphans() {
        doc("child.md", "inherit: ghost.md", "body");
        doc("self.md", "inherit: self.md", "body");

        ValidationReport report = validate();

        assertThat(report.valid()).isTrue();
        assertThat(report.orphanedRules()).containsExactly("child.md");
        assertThat(report.warnings()).contains("Missing parent rule for child.md: ghost.md");
    }

    @Test
    @DisplayName("Should aggregate conflicts and statistics")
    void shouldAggregateConflictsAndStatistics() {
        doc("base.md", "", "# Intro\nX");
        doc("child.md", "inherit: base.md", "# Intro\nY");
        doc("grand.md", "inherit: child.md\ninherit_mode: content", "# Extra\nZ");

        ValidationReport report = validate();

        assertThat(report.valid()).isTrue();
        assertThat(report.statistics().rulesWithInheritance()).isEqualTo(2);
        assertThat(report.statistics().maxDepth()).isEqualTo(3);
        assertThat(report.statistics().totalConflicts()).isEqualTo(2);
        assertThat(report.statistics().inheritanceTypes())
                .containsEntry(InheritanceType.FULL, 1)
                .containsEntry(InheritanceType.CONTENT, 1);
        assertThat(report.ruleConflicts()).containsOnlyKeys("child.md", "grand.md");
    }

    @Test
    @DisplayName("Should warn about rules with type mismatches")
    void shouldWarnAboutTypeMismatch() {
        doc("base.md", "type: agent", "# Intro\nX");
        doc("child.md", "inherit: base.md\ntype: workflow", "# Steps\n1");

        ValidationReport report = validate();

        assertThat(report.valid()).isTrue();
        assertThat(report.warnings()).containsExactly("Inheritance conflicts in child.md");
    }

    @Test
    @DisplayName("Should handle an empty rule set")
    void shouldHandleEmptyRuleSet() {
        ValidationReport report = validate();

        assertThat(report.valid()).isTrue();
        assertThat(report.statistics().totalRules()).isZero();
        assertThat(report.statistics().maxDepth()).isZero();
    }

    @Test
    @DisplayName("Should validate long chains without recursion limits")
    void shouldHandleLongChains() {
        doc("r0.md", "", "root");
        for (int i = 1; i < 1000; i++) {
            doc("r" + i + ".md", "inherit: r" + (i - 1) + ".md", "body " + i);
        }

        ValidationReport report = validate();

        assertThat(report.valid()).isTrue();
        assertThat(report.statistics().maxDepth()).isEqualTo(1000);
        assertThat(report.statistics().rulesWithInheritance()).isEqualTo(999);
    }
}
