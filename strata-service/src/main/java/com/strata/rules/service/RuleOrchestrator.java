/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.service;

import com.strata.rules.api.ICompositionEngine;
import com.strata.rules.api.IHierarchyValidator;
import com.strata.rules.api.IInheritanceResolver;
import com.strata.rules.api.IRuleOrchestrator;
import com.strata.rules.api.IRuleParser;
import com.strata.rules.api.RuleSource;
import com.strata.rules.api.exceptions.RuleSourceException;
import com.strata.rules.api.model.CacheStatus;
import com.strata.rules.api.model.CompositionResult;
import com.strata.rules.api.model.HierarchyInfo;
import com.strata.rules.api.model.InheritanceChain;
import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.api.model.ValidationReport;
import com.strata.rules.compiler.parser.RuleParser;
import com.strata.rules.compiler.resolution.InheritanceResolver;
import com.strata.rules.composition.CompositionEngine;
import com.strata.rules.composition.render.ComposedContentRenderer;
import com.strata.rules.infra.cache.CacheConfig;
import com.strata.rules.infra.cache.CacheFactory;
import com.strata.rules.infra.cache.CacheStore;
import com.strata.rules.infra.metrics.Counter;
import com.strata.rules.infra.metrics.Gauge;
import com.strata.rules.infra.metrics.MetricsRegistry;
import com.strata.rules.infra.metrics.Timer;
import com.strata.rules.service.analysis.DependencyResolver;
import com.strata.rules.service.analysis.HierarchyInfoBuilder;
import com.strata.rules.service.validation.HierarchyValidator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for hosts: wires parser, resolver, composition engine and validator,
 * and adds tracing and metrics around each operation.
 *
 * <p><b>Thread safety:</b> all operations may be called concurrently. Rule maps are
 * treated as immutable snapshots; the composition cache is the only shared mutable
 * state and is thread-safe.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RuleOrchestrator orchestrator = RuleOrchestrator.builder()
 *         .tracer(openTelemetry.getTracer("strata"))
 *         .cacheConfig(CacheConfig.forProduction())
 *         .build();
 *
 * Map<String, ParsedRule> rules = orchestrator.loadHierarchy(new FileSystemRuleSource(rulesDir));
 * CompositionResult result = orchestrator.composeRule("agents/coder.mdc", rules);
 * ValidationReport report = orchestrator.validateHierarchy(rules);
 * }</pre>
 */
public class RuleOrchestrator implements IRuleOrchestrator {

    private static final Logger logger = Logger.getLogger(RuleOrchestrator.class.getName());

    private final IRuleParser parser;
    private final IInheritanceResolver resolver;
    private final ICompositionEngine engine;
    private final IHierarchyValidator validator;
    private final ComposedContentRenderer renderer;
    private final DependencyResolver dependencyResolver;
    private final HierarchyInfoBuilder hierarchyInfoBuilder;
    private final Tracer tracer;

    private final Counter compositions;
    private final Counter compositionFailures;
    private final Counter conflicts;
    private final Gauge ruleSetSize;
    private final Timer validationTimer;

    private RuleOrchestrator(Builder builder) {
        this.parser = builder.parser;
        this.resolver = builder.resolver;
        if (builder.engine != null) {
            this.engine = builder.engine;
        } else {
            CacheStore<CompositionResult> cache = builder.cacheStore != null
                    ? builder.cacheStore
                    : CacheFactory.create(builder.cacheConfig);
            this.engine = new CompositionEngine(resolver, cache);
        }
        this.validator = new HierarchyValidator(resolver, engine);
        this.renderer = new ComposedContentRenderer();
        this.dependencyResolver = new DependencyResolver();
        this.hierarchyInfoBuilder = new HierarchyInfoBuilder(resolver);
        this.tracer = builder.tracer;

        MetricsRegistry metrics = builder.metrics;
        this.compositions = metrics.counter("rule_compositions_total");
        this.compositionFailures = metrics.counter("rule_composition_failures_total");
        this.conflicts = metrics.counter("rule_conflicts_total");
        this.ruleSetSize = metrics.gauge("rule_set_size");
        this.validationTimer = metrics.timer("hierarchy_validation");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Map<String, ParsedRule> loadHierarchy(Map<String, String> rawDocuments) {
        Objects.requireNonNull(rawDocuments, "rawDocuments");
        Span span = tracer.spanBuilder("load-hierarchy").startSpan();
        try (Scope scope = span.makeCurrent()) {
            Map<String, ParsedRule> rules = parser.parseAll(rawDocuments);
            long degraded = rules.values().stream().filter(rule -> !rule.parseWarnings().isEmpty()).count();

            span.setAttribute("ruleCount", rules.size());
            span.setAttribute("parseWarnings", degraded);
            ruleSetSize.set(rules.size());
            logger.info(String.format("Loaded rule hierarchy: %d rules (%d with parse warnings)",
                    rules.size(), degraded));
            return rules;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public Map<String, ParsedRule> loadHierarchy(RuleSource source) {
        Objects.requireNonNull(source, "source");
        Map<String, String> documents;
        try {
            documents = source.loadDocuments();
        } catch (IOException e) {
            throw new RuleSourceException("Cannot load rules from " + source.describe(), e);
        }
        return loadHierarchy(documents);
    }

    @Override
    public CompositionResult composeRule(String path, Map<String, ParsedRule> allRules) {
        Span span = tracer.spanBuilder("compose-rule").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("rulePath", path);
            CompositionResult result = engine.compose(path, allRules);

            compositions.increment();
            if (!result.success()) {
                compositionFailures.increment();
            }
            conflicts.increment(result.conflicts().size());

            span.setAttribute("success", result.success());
            span.setAttribute("conflicts", result.conflicts().size());
            span.setAttribute("chainLength", result.sourceRules().size());
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public String composeRuleContent(String path, Map<String, ParsedRule> allRules) {
        CompositionResult result = composeRule(path, allRules);
        ParsedRule rule = allRules.get(path);
        if (!result.success() || rule == null) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Nothing to render for " + path + ": " + result.warnings());
            }
            return "";
        }
        return renderer.render(result, rule.format());
    }

    @Override
    public InheritanceChain resolveInheritanceChain(String path, Map<String, ParsedRule> allRules) {
        Span span = tracer.spanBuilder("resolve-inheritance-chain").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("rulePath", path);
            InheritanceChain chain = resolver.buildChain(path, allRules);
            span.setAttribute("chainLength", chain.size());
            span.setAttribute("truncated", chain.isTruncated());
            return chain;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public ValidationReport validateHierarchy(Map<String, ParsedRule> allRules) {
        Span span = tracer.spanBuilder("validate-hierarchy").startSpan();
        try (Scope scope = span.makeCurrent()) {
            ValidationReport report = validationTimer.record(() -> validator.validate(allRules));

            span.setAttribute("valid", report.valid());
            span.setAttribute("errors", report.errors().size());
            span.setAttribute("warnings", report.warnings().size());
            span.setAttribute("cycles", report.circularDependencies().size());
            if (!report.valid()) {
                logger.warning(report.summary());
            } else if (logger.isLoggable(Level.FINE)) {
                logger.fine(report.summary());
            }
            return report;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public List<String> resolveDependencies(String path, Map<String, ParsedRule> allRules) {
        return dependencyResolver.resolve(path, allRules);
    }

    @Override
    public HierarchyInfo hierarchyInfo(Map<String, ParsedRule> allRules) {
        return hierarchyInfoBuilder.build(allRules);
    }

    @Override
    public CacheStatus cacheStatus() {
        return engine.cacheStatus();
    }

    @Override
    public void invalidate(String path) {
        engine.invalidate(path);
    }

    @Override
    public void clearCache() {
        engine.clearCache();
    }

    public static class Builder {
        private IRuleParser parser = new RuleParser();
        private IInheritanceResolver resolver = new InheritanceResolver();
        private ICompositionEngine engine;
        private CacheConfig cacheConfig;
        private CacheStore<CompositionResult> cacheStore;
        private Tracer tracer;
        private MetricsRegistry metrics;

        public Builder parser(IRuleParser parser) {
            this.parser = Objects.requireNonNull(parser, "parser");
            return this;
        }

        public Builder resolver(IInheritanceResolver resolver) {
            this.resolver = Objects.requireNonNull(resolver, "resolver");
            return this;
        }

        /**
         * Uses a pre-built engine. Takes precedence over {@link #cacheConfig(CacheConfig)}.
         */
        public Builder engine(ICompositionEngine engine) {
            this.engine = Objects.requireNonNull(engine, "engine");
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig");
            return this;
        }

        /**
         * Builds the engine around an existing cache store instead of one from the cache config.
         */
        public Builder cacheStore(CacheStore<CompositionResult> cacheStore) {
            this.cacheStore = Objects.requireNonNull(cacheStore, "cacheStore");
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = Objects.requireNonNull(tracer, "tracer");
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics");
            return this;
        }

        public RuleOrchestrator build() {
            if (cacheConfig == null) {
                cacheConfig = CacheConfig.loadDefault();
            }
            if (tracer == null) {
                tracer = OpenTelemetry.noop().getTracer("strata-rule-engine");
            }
            if (metrics == null) {
                metrics = MetricsRegistry.getInstance();
            }
            return new RuleOrchestrator(this);
        }
    }
}
