package com.smartlists.ruleengine.runtime.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one filterable attribute.
 *
 * @param name             stable identifier, unique case-insensitively
 * @param displayLabel     human readable label
 * @param valueType        shape of the extracted value
 * @param category         UI grouping
 * @param extractionGroup  bitset of {@link ExtractionGroup} bits the value needs
 * @param allowedOperators operators valid for this field, in display order
 * @param userSpecific     value depends on a viewing user
 * @param personField      value comes from a role-based person lookup
 */
public record FieldMetadata(
        String name,
        String displayLabel,
        FieldValueType valueType,
        FieldCategory category,
        int extractionGroup,
        List<Operator> allowedOperators,
        boolean userSpecific,
        boolean personField
) {

    public FieldMetadata {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(valueType, "valueType must not be null");
        Objects.requireNonNull(allowedOperators, "allowedOperators must not be null");
        if (allowedOperators.isEmpty()) {
            throw new IllegalArgumentException("Field " + name + " must allow at least one operator");
        }
        allowedOperators = List.copyOf(allowedOperators);
    }

    public boolean allows(Operator operator) {
        return allowedOperators.contains(operator);
    }

    /**
     * True iff at least one extraction bit lies outside the cheap subset.
     */
    public boolean isExpensive() {
        return ExtractionGroup.isExpensive(extractionGroup);
    }
}
