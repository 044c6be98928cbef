package com.strata.rules.service.management;

import com.strata.rules.api.IRuleOrchestrator;
import com.strata.rules.api.RuleSource;
import com.strata.rules.api.exceptions.RuleSourceException;
import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.compiler.parser.RuleParser;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RuleHierarchyManagerTest {

    @Mock
    private RuleSource source;

    @Mock
    private IRuleOrchestrator orchestrator;

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    private final RuleParser parser = new RuleParser();

    @BeforeEach
    void setUp() {
        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(scope);
    }

    private Map<String, ParsedRule> snapshot(String... pathAndContent) {
        Map<String, String> docs = new LinkedHashMap<>();
        for (int i = 0; i < pathAndContent.length; i += 2) {
            docs.put(pathAndContent[i], pathAndContent[i + 1]);
        }
        return parser.parseAll(docs);
    }

    @Test
    void shouldLoadRulesOnInitialization() {
        Map<String, ParsedRule> rules = snapshot("index.md", "root", "a.md", "leaf");
        when(orchestrator.loadHierarchy(source)).thenReturn(rules);

        RuleHierarchyManager manager = new RuleHierarchyManager(source, orchestrator, tracer);

        assertThat(manager.getRules()).isSameAs(rules);
        verify(orchestrator, never()).invalidate(anyString());
        verify(span).end();
    }

    @Test
    void shouldFailFastIfInitialLoadFails() {
        when(orchestrator.loadHierarchy(source))
                .thenThrow(new RuleSourceException("Cannot load rules", new IOException("gone")));

        assertThatThrownBy(() -> new RuleHierarchyManager(source, orchestrator, tracer))
                .isInstanceOf(RuleSourceException.class);
        verify(span).recordException(any(RuleSourceException.class));
        verify(span).end();
    }

    @Test
    void shouldInvalidateChangedAndRemovedRulesOnReload() {
        Map<String, ParsedRule> first = snapshot("index.md", "root", "a.md", "leaf", "b.md", "other");
        Map<String, ParsedRule> second = snapshot("index.md", "root", "a.md", "leaf v2", "c.md", "new");
        when(orchestrator.loadHierarchy(source)).thenReturn(first, second);

        RuleHierarchyManager manager = new RuleHierarchyManager(source, orchestrator, tracer);
        Map<String, ParsedRule> reloaded = manager.reload();

        assertThat(reloaded).isSameAs(second);
        assertThat(manager.getRules()).containsOnlyKeys("index.md", "a.md", "c.md");
        verify(orchestrator).invalidate("a.md");
        verify(orchestrator).invalidate("b.md");
        verify(orchestrator, never()).invalidate("index.md");
    }

    @Test
    void shouldKeepPreviousSnapshotWhenReloadFails() {
        Map<String, ParsedRule> first = snapshot("index.md", "root");
        when(orchestrator.loadHierarchy(source))
                .thenReturn(first)
                .thenThrow(new RuleSourceException("Cannot load rules", new IOException("gone")));

        RuleHierarchyManager manager = new RuleHierarchyManager(source, orchestrator, tracer);

        assertThatThrownBy(manager::reload).isInstanceOf(RuleSourceException.class);
        assertThat(manager.getRules()).isSameAs(first);
        verify(orchestrator, never()).invalidate(anyString());
    }

    @Test
    void shouldComposeAndValidateAgainstActiveSnapshot() {
        Map<String, ParsedRule> rules = snapshot("index.md", "root");
        when(orchestrator.loadHierarchy(source)).thenReturn(rules);

        RuleHierarchyManager manager = new RuleHierarchyManager(source, orchestrator, tracer);
        manager.composeRule("index.md");
        manager.validate();

        verify(orchestrator).composeRule("index.md", rules);
        verify(orchestrator).validateHierarchy(rules);
    }
}
