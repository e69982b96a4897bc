/*
 * Copyright (c) 2025 SmartLists Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.smartlists.ruleengine.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartlists.ruleengine.api.IRuleCompiler;
import com.smartlists.ruleengine.api.exceptions.RuleDefinitionException;
import com.smartlists.ruleengine.api.model.ListLimits;
import com.smartlists.ruleengine.api.model.SmartListDefinition;
import com.smartlists.ruleengine.api.model.SmartListDefinition.ExpressionDefinition;
import com.smartlists.ruleengine.api.model.SmartListDefinition.ExpressionSetDefinition;
import com.smartlists.ruleengine.api.model.SmartListDefinition.OrderDefinition;
import com.smartlists.ruleengine.infra.config.EngineConfig;
import com.smartlists.ruleengine.registry.FieldRegistry;
import com.smartlists.ruleengine.runtime.model.CompiledExpression;
import com.smartlists.ruleengine.runtime.model.CompiledListDefinition;
import com.smartlists.ruleengine.runtime.model.ExpressionOptions;
import com.smartlists.ruleengine.runtime.model.ExpressionSet;
import com.smartlists.ruleengine.runtime.model.FieldMetadata;
import com.smartlists.ruleengine.runtime.model.Operator;
import com.smartlists.ruleengine.runtime.model.RuleGroups;
import com.smartlists.ruleengine.runtime.model.SimilarityField;
import com.smartlists.ruleengine.runtime.model.SortDirection;
import com.smartlists.ruleengine.runtime.model.SortField;
import com.smartlists.ruleengine.runtime.model.SortSpec;
import com.smartlists.ruleengine.runtime.model.TargetValue;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Validates list definitions against the {@link FieldRegistry} and compiles them into
 * {@link CompiledListDefinition}s.
 *
 * <h2>Compilation</h2>
 * <ol>
 *   <li>Structural limits: set and rule counts, field and value lengths</li>
 *   <li>Field lookup and operator admissibility</li>
 *   <li>Target parsing into typed {@link TargetValue}s</li>
 *   <li>Extraction masks from the field group plus rule options</li>
 *   <li>Sort keys, similarity fields and size limits</li>
 * </ol>
 *
 * <p>Any violation raises {@link RuleDefinitionException} naming the offending set and
 * rule; a definition either compiles completely or not at all.
 *
 * <p>Thread-safe: instances hold no mutable state.
 */
public class RuleCompiler implements IRuleCompiler {
    private static final Logger logger = LoggerFactory.getLogger(RuleCompiler.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final Tracer tracer;
    private final EngineConfig config;
    private final FieldRegistry registry;

    public RuleCompiler() {
        this(OpenTelemetry.noop().getTracer("smartlists-compiler"), EngineConfig.defaults(), FieldRegistry.standard());
    }

    public RuleCompiler(Tracer tracer) {
        this(tracer, EngineConfig.defaults(), FieldRegistry.standard());
    }

    public RuleCompiler(Tracer tracer, EngineConfig config, FieldRegistry registry) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public CompiledListDefinition compile(Path definitionPath) throws IOException {
        Objects.requireNonNull(definitionPath, "definitionPath must not be null");
        String content = Files.readString(definitionPath);
        return compileJson(content);
    }

    @Override
    public CompiledListDefinition compileJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        SmartListDefinition definition;
        try {
            definition = objectMapper.readValue(json, SmartListDefinition.class);
        } catch (JsonProcessingException e) {
            throw new RuleDefinitionException("Malformed list definition JSON: " + e.getOriginalMessage(), e);
        }
        if (definition == null) {
            throw new RuleDefinitionException("List definition cannot be empty");
        }
        return compile(definition);
    }

    @Override
    public CompiledListDefinition compile(SmartListDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");

        Span span = tracer.spanBuilder("compile-list").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            if (definition.name() != null) {
                span.setAttribute("listName", definition.name());
            }

            RuleGroups groups = compileGroups(definition.expressionSets());
            SortSpec sortSpec = compileOrder(definition.order());
            List<SimilarityField> similarityFields = compileSimilarityFields(definition.similarityComparisonFields());
            Set<String> mediaTypes = compileMediaTypes(definition.mediaTypes());
            ListLimits limits = compileLimits(definition);

            span.setAttribute("expressionSetCount", groups.size());
            span.setAttribute("expressionCount", groups.allExpressions().size());
            span.setAttribute("usesExpensiveFields", groups.usesExpensiveFields());

            CompiledListDefinition compiled = new CompiledListDefinition(
                    definition.name(),
                    groups,
                    sortSpec,
                    limits,
                    blankToNull(definition.userId()),
                    mediaTypes,
                    similarityFields,
                    definition.includeExtrasOrDefault());

            long elapsed = System.nanoTime() - startTime;
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(elapsed));
            logger.debug("Compiled list '{}': {} sets, {} rules, expensive={} in {} us",
                    definition.name(), groups.size(), groups.allExpressions().size(),
                    groups.usesExpensiveFields(), TimeUnit.NANOSECONDS.toMicros(elapsed));
            return compiled;
        } catch (RuleDefinitionException e) {
            span.recordException(e);
            logger.debug("Rejected list '{}': {}", definition.name(), e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // RULES
    // ════════════════════════════════════════════════════════════════════════════════

    private RuleGroups compileGroups(List<ExpressionSetDefinition> setDefinitions) {
        if (setDefinitions == null || setDefinitions.isEmpty()) {
            // No groups: the list matches nothing.
            return RuleGroups.empty();
        }
        if (setDefinitions.size() > InputLimits.MAX_EXPRESSION_SETS) {
            throw new RuleDefinitionException("Too many expression sets: " + setDefinitions.size()
                    + " (maximum " + InputLimits.MAX_EXPRESSION_SETS + ")");
        }

        List<ExpressionSet> sets = new ArrayList<>(setDefinitions.size());
        for (int setIndex = 0; setIndex < setDefinitions.size(); setIndex++) {
            ExpressionSetDefinition setDefinition = setDefinitions.get(setIndex);
            if (setDefinition == null) {
                throw new RuleDefinitionException("Expression set " + (setIndex + 1) + " is null");
            }
            List<ExpressionDefinition> rules = setDefinition.expressions() != null
                    ? setDefinition.expressions() : List.of();
            if (rules.size() > InputLimits.MAX_EXPRESSIONS_PER_SET) {
                throw new RuleDefinitionException("Expression set " + (setIndex + 1) + " has too many rules: "
                        + rules.size() + " (maximum " + InputLimits.MAX_EXPRESSIONS_PER_SET + ")");
            }

            List<CompiledExpression> compiled = new ArrayList<>(rules.size());
            for (int ruleIndex = 0; ruleIndex < rules.size(); ruleIndex++) {
                compiled.add(compileExpression(rules.get(ruleIndex), setIndex, ruleIndex));
            }
            Integer groupMax = setDefinition.maxItems() != null && setDefinition.maxItems() > 0
                    ? setDefinition.maxItems() : null;
            sets.add(new ExpressionSet(compiled, groupMax));
        }
        return new RuleGroups(sets);
    }

    private CompiledExpression compileExpression(ExpressionDefinition rule, int setIndex, int ruleIndex) {
        String location = "set " + (setIndex + 1) + ", rule " + (ruleIndex + 1);
        if (rule == null) {
            throw new RuleDefinitionException("Rule at " + location + " is null");
        }

        FieldMetadata field = resolveField(rule.field(), location);
        Operator operator = resolveOperator(rule.operator(), field, location);

        String raw = rule.value();
        if (raw != null && operator != Operator.MATCH_REGEX && raw.length() > InputLimits.MAX_STRING_VALUE_LENGTH) {
            throw new RuleDefinitionException("Rule at " + location + " has a value longer than "
                    + InputLimits.MAX_STRING_VALUE_LENGTH + " characters");
        }
        TargetValue target = TargetValueParser.parse(field, operator, raw, location);
        ExpressionOptions options = compileOptions(rule, field, location);
        int mask = field.extractionGroup() | options.extraExtractionMask();

        return new CompiledExpression(field, operator, raw, target, options, mask, setIndex, ruleIndex);
    }

    private FieldMetadata resolveField(String name, String location) {
        if (name == null || name.isBlank()) {
            throw new RuleDefinitionException("Rule at " + location + " has null field");
        }
        String trimmed = name.trim();
        if (trimmed.length() > InputLimits.MAX_FIELD_NAME_LENGTH) {
            throw new RuleDefinitionException("Rule at " + location + " has a field name longer than "
                    + InputLimits.MAX_FIELD_NAME_LENGTH + " characters");
        }
        if (!InputLimits.FIELD_NAME.matcher(trimmed).matches()) {
            throw new RuleDefinitionException("Rule at " + location + " has invalid field name: " + trimmed);
        }
        return registry.lookup(trimmed)
                .orElseThrow(() -> new RuleDefinitionException(
                        "Rule at " + location + " has unknown field: " + trimmed));
    }

    private Operator resolveOperator(String text, FieldMetadata field, String location) {
        if (text == null || text.isBlank()) {
            throw new RuleDefinitionException("Rule at " + location + " has null operator");
        }
        if (text.length() > InputLimits.MAX_OPERATOR_LENGTH) {
            throw new RuleDefinitionException("Rule at " + location + " has an operator longer than "
                    + InputLimits.MAX_OPERATOR_LENGTH + " characters");
        }
        Operator operator = Operator.fromString(text);
        if (operator == null) {
            throw new RuleDefinitionException("Rule at " + location + " has unknown operator: " + text);
        }
        if (!field.allows(operator)) {
            throw new RuleDefinitionException("Rule at " + location + ": operator " + operator.id()
                    + " is not allowed for field " + field.name());
        }
        return operator;
    }

    /**
     * Options only take effect on the fields they are meant for; elsewhere they are ignored.
     */
    private ExpressionOptions compileOptions(ExpressionDefinition rule, FieldMetadata field, String location) {
        String name = field.name();

        int depth = 0;
        if (rule.collectionSearchDepth() != null) {
            depth = rule.collectionSearchDepth();
            if (depth < 0 || depth > ExpressionOptions.MAX_COLLECTION_SEARCH_DEPTH) {
                throw new RuleDefinitionException("Rule at " + location + " has collection search depth " + depth
                        + " outside 0.." + ExpressionOptions.MAX_COLLECTION_SEARCH_DEPTH);
            }
        }

        return new ExpressionOptions(
                isTrue(rule.includeParentSeriesTags()) && name.equalsIgnoreCase("Tags"),
                isTrue(rule.includeParentSeriesStudios()) && name.equalsIgnoreCase("Studios"),
                isTrue(rule.includeParentSeriesGenres()) && name.equalsIgnoreCase("Genres"),
                isTrue(rule.onlyDefaultAudioLanguage()) && name.equalsIgnoreCase("AudioLanguages"),
                rule.includeUnwatchedSeries() == null || rule.includeUnwatchedSeries(),
                name.equalsIgnoreCase("Collections") ? depth : 0,
                field.userSpecific() ? blankToNull(rule.userId()) : null);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // LIST SETTINGS
    // ════════════════════════════════════════════════════════════════════════════════

    private SortSpec compileOrder(List<OrderDefinition> order) {
        if (order == null || order.isEmpty()) {
            return SortSpec.none();
        }
        if (order.size() > SortSpec.MAX_KEYS) {
            throw new RuleDefinitionException("At most " + SortSpec.MAX_KEYS + " sort keys are supported, got "
                    + order.size());
        }

        List<SortSpec.SortKey> keys = new ArrayList<>(order.size());
        for (OrderDefinition key : order) {
            if (key == null || key.field() == null) {
                throw new RuleDefinitionException("Sort key has null field");
            }
            SortField field = SortField.fromString(key.field());
            if (field == null) {
                throw new RuleDefinitionException("Unknown sort field: " + key.field());
            }
            SortDirection direction = null;
            if (key.direction() != null && !key.direction().isBlank()) {
                direction = SortDirection.fromString(key.direction());
                if (direction == null) {
                    throw new RuleDefinitionException("Unknown sort direction: " + key.direction());
                }
            }
            boolean aggregate = isTrue(key.useChildAggregation());
            if (aggregate && !field.isChildAggregatable()) {
                throw new RuleDefinitionException("Child aggregation is not supported for sort field " + field.id());
            }
            keys.add(new SortSpec.SortKey(field, direction, aggregate));
        }
        return new SortSpec(keys);
    }

    private List<SimilarityField> compileSimilarityFields(List<String> names) {
        if (names == null || names.isEmpty()) {
            return SimilarityField.DEFAULTS;
        }
        Set<SimilarityField> fields = new LinkedHashSet<>();
        for (String name : names) {
            SimilarityField field = SimilarityField.fromString(name);
            if (field == null) {
                throw new RuleDefinitionException("Unknown similarity comparison field: " + name);
            }
            fields.add(field);
        }
        return List.copyOf(fields);
    }

    private Set<String> compileMediaTypes(List<String> types) {
        if (types == null) {
            return Set.of();
        }
        if (types.size() > InputLimits.MAX_MEDIA_TYPES) {
            throw new RuleDefinitionException("Too many media types: " + types.size()
                    + " (maximum " + InputLimits.MAX_MEDIA_TYPES + ")");
        }
        Set<String> result = new LinkedHashSet<>();
        for (String type : types) {
            if (type != null && !type.isBlank()) {
                result.add(type.trim().toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }

    private ListLimits compileLimits(SmartListDefinition definition) {
        int maxItems = definition.maxItems() != null ? definition.maxItems() : config.getDefaultMaxItems();
        int playtime = definition.maxPlaytimeMinutes() != null
                ? definition.maxPlaytimeMinutes() : config.getDefaultMaxPlaytimeMinutes();
        return new ListLimits(
                null,
                maxItems > 0 ? maxItems : null,
                playtime > 0 ? playtime : null);
    }

    private static boolean isTrue(Boolean value) {
        return value != null && value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
