package com.smartlists.ruleengine.runtime.model;

import com.smartlists.ruleengine.api.model.ListLimits;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Output of the rule compiler: everything a run needs apart from candidates and
 * host lookups.
 */
public record CompiledListDefinition(
        String name,
        RuleGroups ruleGroups,
        SortSpec sortSpec,
        ListLimits limits,
        String userId,
        Set<String> mediaTypes,
        List<SimilarityField> similarityFields,
        boolean includeExtras
) {

    public CompiledListDefinition {
        Objects.requireNonNull(ruleGroups, "ruleGroups must not be null");
        sortSpec = sortSpec != null ? sortSpec : SortSpec.none();
        limits = limits != null ? limits : ListLimits.unlimited();
        mediaTypes = mediaTypes != null ? Set.copyOf(mediaTypes) : Set.of();
        similarityFields = similarityFields != null ? List.copyOf(similarityFields) : SimilarityField.DEFAULTS;
    }

    /**
     * Builds the run context this definition asks for, starting from the given builder
     * (which carries the clock and seed).
     */
    public EvaluationContext toContext(EvaluationContext.Builder builder) {
        return builder.userId(userId)
                .mediaTypes(mediaTypes)
                .includeExtras(includeExtras)
                .similarityFields(similarityFields)
                .build();
    }
}
