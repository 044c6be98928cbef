package com.strata.rules.compiler.parser;

import com.strata.rules.api.model.MetadataValue;
import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.api.model.RuleFormat;
import com.strata.rules.api.model.RuleType;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class RuleParserTest {

    private final RuleParser parser = new RuleParser();

    @Nested
    @DisplayName("Markdown documents")
    class Markdown {

        @Test
        @DisplayName("Should split front matter and heading sections")
        void shouldSplitFrontMatterAndSections() {
            String doc = """
                    ---
                    inherit: base.mdc
                    priority: 5
                    tags: [review, style]
                    ---
                    Intro text.

                    # Guidelines
                    Be precise.

                    ## Code Style
                    Use tabs.

                    ```md
                    # not a heading
                    ```

                    # Guidelines
                    Keep it short.
                    """;

            ParsedRule rule = parser.parse("agents/coder.mdc", doc);

            assertThat(rule.format()).isEqualTo(RuleFormat.MDC);
            assertThat(rule.sections()).containsExactly(
                    entry("content", "Intro text."),
                    entry("guidelines", "Be precise.\n\nKeep it short."),
                    entry("code_style", "Use tabs.\n\n```md\n# not a heading\n```"));
            assertThat(rule.metadata())
                    .containsEntry("inherit", MetadataValue.text("base.mdc"))
                    .containsEntry("priority", MetadataValue.number(5))
                    .containsEntry("tags", MetadataValue.list(List.of("review", "style")));
            assertThat(rule.parseWarnings()).isEmpty();
        }

        @Test
        @DisplayName("Should yield a single content section when there are no headings")
        void shouldYieldContentSectionWithoutHeadings() {
            ParsedRule rule = parser.parse("notes.md", "Just some text.\nOn two lines.\n");

            assertThat(rule.sections()).containsExactly(entry("content", "Just some text.\nOn two lines."));
            assertThat(rule.metadata()).isEmpty();
        }

        @Test
        @DisplayName("Should omit the implicit section when text starts with a heading")
        void shouldOmitBlankImplicitSection() {
            ParsedRule rule = parser.parse("notes.md", "# Title\nBody\n");

            assertThat(rule.sections()).containsOnlyKeys("title");
        }

        @Test
        @DisplayName("Should flag entries of a variables mapping and flatten other mappings")
        void shouldFlagVariablesAndFlattenMappings() {
            String doc = """
                    ---
                    variables:
                      team: platform
                      replicas: 3
                    owner:
                      name: dana
                      active: true
                    ---
                    Body
                    """;

            ParsedRule rule = parser.parse("project/service.md", doc);

            assertThat(rule.metadata())
                    .containsEntry("team", MetadataValue.text("platform"))
                    .containsEntry("replicas", MetadataValue.number(3))
                    .containsEntry("owner.name", MetadataValue.text("dana"))
                    .containsEntry("owner.active", MetadataValue.text("true"))
                    .doesNotContainKey("variables");
            assertThat(rule.variableKeys()).containsExactly("team", "replicas");
            assertThat(rule.isVariable("owner.name")).isFalse();
        }

        @Test
        @DisplayName("Should normalise CRLF line endings")
        void shouldNormaliseLineEndings() {
            ParsedRule rule = parser.parse("a.md", "---\r\ntype: agent\r\n---\r\n# One\r\nText\r\n");

            assertThat(rule.ruleType()).isEqualTo(RuleType.AGENT);
            assertThat(rule.sections()).containsExactly(entry("one", "Text"));
            assertThat(rule.rawContent()).contains("\r\n");
        }
    }

    @Nested
    @DisplayName("Leniency")
    class Leniency {

        @Test
        @DisplayName("Should fall back to raw content on malformed front matter")
        void shouldFallBackOnMalformedFrontMatter() {
            String doc = "---\ntags: [a, b\n---\n# Heading\nBody\n";

            ParsedRule rule = parser.parse("broken.mdc", doc);

            assertThat(rule.sections()).containsExactly(entry("content", doc));
            assertThat(rule.metadata()).isEmpty();
            assertThat(rule.parseWarnings()).hasSize(1);
            assertThat(rule.parseWarnings().get(0)).contains("broken.mdc");
        }

        @Test
        @DisplayName("Should fall back on an unterminated front matter block")
        void shouldFallBackOnUnterminatedFrontMatter() {
            ParsedRule rule = parser.parse("open.md", "---\ninherit: base.md\n# Heading\n");

            assertThat(rule.sections()).containsOnlyKeys("content");
            assertThat(rule.parseWarnings()).singleElement(InstanceOfAssertFactories.STRING).contains("Unterminated front matter");
        }

        @Test
        @DisplayName("Should fall back when front matter is not a mapping")
        void shouldFallBackOnScalarFrontMatter() {
            ParsedRule rule = parser.parse("scalar.md", "---\njust words\n---\nBody\n");

            assertThat(rule.sections()).containsOnlyKeys("content");
            assertThat(rule.parseWarnings()).hasSize(1);
        }

        @Test
        @DisplayName("Should fall back on invalid JSON and a non-object root")
        void shouldFallBackOnInvalidStructuredDocuments() {
            ParsedRule invalid = parser.parse("rules/bad.json", "{\"sections\": ");
            ParsedRule array = parser.parse("rules/list.json", "[1, 2, 3]");

            assertThat(invalid.sections()).containsExactly(entry("content", "{\"sections\": "));
            assertThat(invalid.parseWarnings()).hasSize(1);
            assertThat(array.sections()).containsExactly(entry("content", "[1, 2, 3]"));
            assertThat(array.parseWarnings()).singleElement(InstanceOfAssertFactories.STRING).contains("mapping");
        }

        @Test
        @DisplayName("Should treat null content as empty")
        void shouldTreatNullAsEmpty() {
            ParsedRule rule = parser.parse("empty.md", null);

            assertThat(rule.rawContent()).isEmpty();
            assertThat(rule.sections()).containsExactly(entry("content", ""));
            assertThat(rule.parseWarnings()).isEmpty();
        }

        @Test
        @DisplayName("Should never abort a batch because of one bad document")
        void shouldParseBatchWithBadDocument() {
            Map<String, String> docs = new LinkedHashMap<>();
            docs.put("good.md", "# A\nx");
            docs.put("bad.json", "not json");
            docs.put("also-good.txt", "plain");

            Map<String, ParsedRule> rules = parser.parseAll(docs);

            assertThat(rules).containsOnlyKeys("good.md", "bad.json", "also-good.txt");
            assertThat(rules.get("bad.json").parseWarnings()).hasSize(1);
            assertThat(rules.get("also-good.txt").sections()).containsExactly(entry("content", "plain"));
        }
    }

    @Nested
    @DisplayName("Structured documents")
    class Structured {

        @Test
        @DisplayName("Should read sections, metadata and variables from JSON")
        void shouldParseJson() {
            String doc = """
                    {
                      "metadata": {"inherit": "base.json", "type": "context"},
                      "variables": {"region": "eu", "replicas": 3},
                      "sections": {"intro": "Hello", "steps": ["a", "b"]},
                      "priority": 2,
                      "enabled": true,
                      "limits": {"cpu": 1}
                    }
                    """;

            ParsedRule rule = parser.parse("deploy/app.json", doc);

            assertThat(rule.format()).isEqualTo(RuleFormat.JSON);
            assertThat(rule.sections()).containsExactly(
                    entry("intro", "Hello"),
                    entry("steps", "[\"a\",\"b\"]"),
                    entry("limits", "{\"cpu\":1}"));
            assertThat(rule.metadata())
                    .containsEntry("inherit", MetadataValue.text("base.json"))
                    .containsEntry("region", MetadataValue.text("eu"))
                    .containsEntry("replicas", MetadataValue.number(3))
                    .containsEntry("priority", MetadataValue.number(2))
                    .containsEntry("enabled", MetadataValue.text("true"));
            assertThat(rule.variableKeys()).containsExactly("region", "replicas");
            assertThat(rule.ruleType()).isEqualTo(RuleType.CONTEXT);
            assertThat(rule.typeDeclared()).isTrue();
        }

        @Test
        @DisplayName("Should read YAML documents")
        void shouldParseYaml() {
            String doc = """
                    inherit: base.yaml
                    inherit_sections: [intro]
                    sections:
                      intro: Welcome
                      rules: |
                        one
                        two
                    """;

            ParsedRule rule = parser.parse("agents/helper.yml", doc);

            assertThat(rule.format()).isEqualTo(RuleFormat.YAML);
            assertThat(rule.sections()).containsExactly(entry("intro", "Welcome"), entry("rules", "one\ntwo\n"));
            assertThat(rule.metadataList("inherit_sections")).containsExactly("intro");
            assertThat(rule.ruleType()).isEqualTo(RuleType.AGENT);
        }
    }

    @Nested
    @DisplayName("Rule type")
    class Types {

        @Test
        @DisplayName("Should prefer a declared type over the path")
        void shouldPreferDeclaredType() {
            ParsedRule rule = parser.parse("workflows/review.md", "---\ntype: Agent\n---\nx");

            assertThat(rule.ruleType()).isEqualTo(RuleType.AGENT);
            assertThat(rule.typeDeclared()).isTrue();
        }

        @Test
        @DisplayName("Should infer the type from the path when undeclared or unknown")
        void shouldInferTypeFromPath() {
            assertThat(parser.parse("workflows/review.md", "x").ruleType()).isEqualTo(RuleType.WORKFLOW);
            assertThat(parser.parse("agents/essential.md", "x").ruleType()).isEqualTo(RuleType.CORE);
            assertThat(parser.parse("project/setup.md", "x").ruleType()).isEqualTo(RuleType.PROJECT);
            assertThat(parser.parse("shared/context.md", "x").ruleType()).isEqualTo(RuleType.CONTEXT);
            assertThat(parser.parse("misc/notes.md", "x").ruleType()).isEqualTo(RuleType.GENERAL);

            ParsedRule unknown = parser.parse("agents/bot.md", "---\ntype: robot\n---\nx");
            assertThat(unknown.ruleType()).isEqualTo(RuleType.AGENT);
            assertThat(unknown.typeDeclared()).isFalse();
        }
    }

    @Test
    @DisplayName("Should extract references in first-seen order without duplicates")
    void shouldExtractReferences() {
        String doc = """
                See [style](mdc:rules/style.mdc), [docs](https://example.com) and [local](./other.md#part).
                Again [style](mdc:rules/style.mdc) and [top](#top).
                @import "shared/common.mdc"
                include: "extra.mdc"
                depends_on: [a.mdc, 'b.mdc']
                """;

        ParsedRule rule = parser.parse("refs.md", doc);

        assertThat(rule.references()).containsExactly(
                "rules/style.mdc", "./other.md", "shared/common.mdc", "extra.mdc", "a.mdc", "b.mdc");
    }

    @Test
    @DisplayName("Should pick up block-style dependency lists from front matter")
    void shouldReadDependencyListsFromMetadata() {
        String doc = """
                ---
                depends_on:
                  - core/base.mdc
                  - core/style.mdc
                ---
                Body
                """;

        assertThat(parser.parse("deps.mdc", doc).references()).containsExactly("core/base.mdc", "core/style.mdc");
    }

    @Test
    @DisplayName("Should compute a checksum over the raw content")
    void shouldComputeChecksum() {
        ParsedRule first = parser.parse("a.md", "# A\none");
        ParsedRule same = parser.parse("b.md", "# A\none");
        ParsedRule changed = parser.parse("a.md", "# A\ntwo");

        assertThat(first.checksum()).hasSize(64).isEqualTo(same.checksum());
        assertThat(changed.checksum()).isNotEqualTo(first.checksum());
    }
}
