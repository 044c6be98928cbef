package com.strata.rules.service.analysis;

import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.compiler.parser.RuleParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DependencyResolverTest {

    private final RuleParser parser = new RuleParser();
    private final DependencyResolver resolver = new DependencyResolver();

    private Map<String, ParsedRule> rules(String... pathAndContent) {
        Map<String, String> docs = new LinkedHashMap<>();
        for (int i = 0; i < pathAndContent.length; i += 2) {
            docs.put(pathAndContent[i], pathAndContent[i + 1]);
        }
        return parser.parseAll(docs);
    }

    @Test
    @DisplayName("Should order dependencies before dependents")
    void shouldOrderDependenciesFirst() {
        Map<String, ParsedRule> rules = rules(
                "app.md", "See [lib](mdc:lib.md) and @import \"agents/util.md\"",
                "lib.md", "depends_on: [core.md]",
                "core.md", "plain",
                "agents/util.md", "Uses [core](../core.md) and [web](https://example.com)");

        assertThat(resolver.resolve("app.md", rules))
                .containsExactly("core.md", "lib.md", "agents/util.md", "app.md");
    }

    @Test
    @DisplayName("Should ignore references to unknown rules")
    void shouldIgnoreUnknownReferences() {
        Map<String, ParsedRule> rules = rules("app.md", "include: nowhere.md");

        assertThat(resolver.resolve("app.md", rules)).containsExactly("app.md");
    }

    @Test
    @DisplayName("Should return only the rule itself on a reference cycle")
    void shouldStopOnCycle() {
        Map<String, ParsedRule> rules = rules(
                "a.md", "[b](b.md)",
                "b.md", "[c](c.md)",
                "c.md", "[a](a.md)");

        assertThat(resolver.resolve("a.md", rules)).containsExactly("a.md");
    }

    @Test
    @DisplayName("Should return nothing for unknown rules")
    void shouldHandleUnknownRule() {
        assertThat(resolver.resolve("ghost.md", rules("a.md", "x"))).isEmpty();
    }
}
