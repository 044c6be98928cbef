package com.strata.rules.composition.render;

import com.strata.rules.api.model.CompositionResult;
import com.strata.rules.api.model.MetadataValue;
import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.api.model.RuleFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ComposedContentRendererTest {

    private final ComposedContentRenderer renderer = new ComposedContentRenderer();

    private static CompositionResult result() {
        Map<String, String> sections = new LinkedHashMap<>();
        sections.put("content", "Preamble.");
        sections.put("code_style", "Use tabs.");
        sections.put("review", "Be kind.");
        Map<String, MetadataValue> metadata = new LinkedHashMap<>();
        metadata.put(ParsedRule.KEY_INHERIT, MetadataValue.text("base.mdc"));
        metadata.put("team", MetadataValue.text("platform"));
        metadata.put("priority", MetadataValue.number(2));
        metadata.put("tags", MetadataValue.list(List.of("a", "b")));
        return new CompositionResult("agents/coder.mdc", true, sections, metadata, null, null, null, null);
    }

    @Test
    @DisplayName("Should render Markdown with a variables block and title-cased headings")
    void shouldRenderMarkdown() {
        String text = renderer.render(result(), RuleFormat.MDC);

        assertThat(text).isEqualTo("""
                # Variables

                - team: platform
                - priority: 2
                - tags: a, b

                Preamble.

                # Code Style

                Use tabs.

                # Review

                Be kind.
                """);
    }

    @Test
    @DisplayName("Should render JSON with metadata and sections")
    void shouldRenderJson() {
        String json = renderer.render(result(), RuleFormat.JSON);

        assertThat(json)
                .contains("\"metadata\"", "\"team\" : \"platform\"", "\"priority\" : 2", "\"code_style\" : \"Use tabs.\"")
                .doesNotContain("inherit");
    }

    @Test
    @DisplayName("Should render YAML with metadata and sections")
    void shouldRenderYaml() {
        String yaml = renderer.render(result(), RuleFormat.YAML);

        assertThat(yaml).startsWith("metadata:").contains("team: platform", "sections:", "code_style: Use tabs.");
    }

    @Test
    @DisplayName("Should join plain text sections with blank lines")
    void shouldRenderText() {
        assertThat(renderer.render(result(), RuleFormat.TXT)).isEqualTo("Preamble.\n\nUse tabs.\n\nBe kind.");
    }

    @Test
    @DisplayName("Should render an empty composition as empty Markdown")
    void shouldRenderEmpty() {
        assertThat(renderer.render(CompositionResult.notFound("x.md"), RuleFormat.MD)).isEmpty();
    }

    @Test
    @DisplayName("Should title-case snake case names")
    void shouldTitleCase() {
        assertThat(ComposedContentRenderer.titleCase("code_style")).isEqualTo("Code Style");
        assertThat(ComposedContentRenderer.titleCase("_private__name")).isEqualTo("Private Name");
    }
}
