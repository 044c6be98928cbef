/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.service.management;

import com.strata.rules.api.IRuleOrchestrator;
import com.strata.rules.api.RuleSource;
import com.strata.rules.api.exceptions.RuleSourceException;
import com.strata.rules.api.model.CompositionResult;
import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.api.model.ValidationReport;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds the active rule set loaded from a {@link RuleSource}.
 *
 * <p>The rule set is an immutable snapshot swapped atomically on {@link #reload()}.
 * Callers composing or validating concurrently always see one consistent snapshot and
 * never block on a reload. After a successful reload the cached compositions of rules
 * that changed or disappeared are invalidated; a failed reload leaves the previous
 * snapshot active.
 */
public class RuleHierarchyManager {

    private static final Logger logger = Logger.getLogger(RuleHierarchyManager.class.getName());

    private final RuleSource source;
    private final IRuleOrchestrator orchestrator;
    private final Tracer tracer;

    private final AtomicReference<Map<String, ParsedRule>> activeRules = new AtomicReference<>(Map.of());

    /**
     * Loads the initial snapshot.
     *
     * @throws RuleSourceException if the source cannot be read
     */
    public RuleHierarchyManager(RuleSource source, IRuleOrchestrator orchestrator, Tracer tracer) {
        this.source = Objects.requireNonNull(source, "source");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        reload();
    }

    public Map<String, ParsedRule> getRules() {
        return activeRules.get();
    }

    public CompositionResult composeRule(String path) {
        return orchestrator.composeRule(path, activeRules.get());
    }

    public ValidationReport validate() {
        return orchestrator.validateHierarchy(activeRules.get());
    }

    /**
     * Reloads every document from the source and swaps in the new snapshot.
     *
     * @return the new snapshot
     * @throws RuleSourceException if the source cannot be read; the old snapshot stays active
     */
    public Map<String, ParsedRule> reload() {
        Span span = tracer.spanBuilder("reload-hierarchy").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("source", source.describe());
            Map<String, ParsedRule> previous = activeRules.get();
            Map<String, ParsedRule> next = orchestrator.loadHierarchy(source);

            int invalidated = 0;
            for (Map.Entry<String, ParsedRule> old : previous.entrySet()) {
                ParsedRule replacement = next.get(old.getKey());
                if (replacement == null || !replacement.checksum().equals(old.getValue().checksum())) {
                    orchestrator.invalidate(old.getKey());
                    invalidated++;
                }
            }
            activeRules.set(next);

            span.setAttribute("ruleCount", next.size());
            span.setAttribute("invalidated", invalidated);
            logger.info(String.format("Swapped to new rule snapshot from %s: %d rules, %d changed or removed",
                    source.describe(), next.size(), invalidated));
            return next;
        } catch (RuntimeException e) {
            span.recordException(e);
            logger.log(Level.SEVERE, String.format("Failed to reload rules from %s. Previous snapshot (%d rules) remains active.",
                    source.describe(), activeRules.get().size()), e);
            throw e;
        } finally {
            span.end();
        }
    }
}
