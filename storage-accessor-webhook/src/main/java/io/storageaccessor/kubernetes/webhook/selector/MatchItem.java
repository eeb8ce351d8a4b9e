/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.selector;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.storageaccessor.kubernetes.api.v1alpha1.accessorspec.FieldExpression;
import io.storageaccessor.kubernetes.api.v1alpha1.accessorspec.MatchExpression;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A single key, operator and values test, common to label and field expressions.
 *
 * @param key label key or field name
 * @param operator the operator as authored
 * @param values the values to test against
 */
public record MatchItem(@Nullable String key, @Nullable String operator, List<String> values) {

    public MatchItem {
        values = values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }

    static MatchItem of(MatchExpression expression) {
        return new MatchItem(expression.getKey(), expression.getOperator(), expression.getValues());
    }

    static MatchItem of(FieldExpression expression) {
        return new MatchItem(expression.getField(), expression.getOperator(), expression.getValues());
    }

    /**
     * An item with no values, whose key the target lacks, or whose operator is unknown cannot veto its group.
     *
     * @param lookup attributes of the target
     * @return false only if the item applies to the target and the target fails it
     */
    boolean vacuousOrSatisfied(AttributeLookup lookup) {
        if (values.isEmpty()) {
            return true;
        }
        Optional<String> actual = lookup.valueOf(key);
        if (actual.isEmpty()) {
            return true;
        }
        return MatchOperator.parse(operator)
                .map(op -> op.test(values, actual.get()))
                .orElse(true);
    }
}
