package com.openforge.cortex.recovery;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * What a recovery call is looking for: one function name and the field sets its
 * arguments may take, tried in declaration order.
 */
public record RecoveryTarget(String functionName, List<FieldSet> fieldSets) {

    public RecoveryTarget {
        if (functionName == null || functionName.isBlank()) {
            throw new IllegalArgumentException("RecoveryTarget function name must not be blank");
        }
        if (fieldSets == null || fieldSets.isEmpty()) {
            throw new IllegalArgumentException("RecoveryTarget needs at least one field set");
        }
        fieldSets = List.copyOf(fieldSets);
    }

    public static RecoveryTarget of(String functionName, FieldSet... fieldSets) {
        return new RecoveryTarget(functionName, List.of(fieldSets));
    }

    public Optional<RecoveredArguments> validate(ObjectNode candidate) {
        for (FieldSet fieldSet : fieldSets) {
            Optional<ObjectNode> normalized = fieldSet.normalize(candidate);
            if (normalized.isPresent()) {
                return Optional.of(new RecoveredArguments(normalized.get(), fieldSet.label()));
            }
        }
        return Optional.empty();
    }

    public List<String> markerFields() {
        return fieldSets.stream()
                .map(FieldSet::markerField)
                .flatMap(Optional::stream)
                .distinct()
                .toList();
    }
}
