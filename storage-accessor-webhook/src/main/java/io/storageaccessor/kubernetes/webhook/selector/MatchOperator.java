/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.selector;

import java.util.Collection;
import java.util.Optional;

import edu.umd.cs.findbugs.annotations.Nullable;

public enum MatchOperator {

    IN("In") {
        @Override
        boolean test(Collection<String> values, String actual) {
            return values.contains(WILDCARD) || values.contains(actual);
        }
    },
    NOT_IN("NotIn") {
        @Override
        boolean test(Collection<String> values, String actual) {
            return !values.contains(WILDCARD) && !values.contains(actual);
        }
    };

    /**
     * A value that stands for every possible value of a key.
     */
    public static final String WILDCARD = "*";

    private final String value;

    MatchOperator(String value) {
        this.value = value;
    }

    abstract boolean test(Collection<String> values, String actual);

    /**
     * @param operator operator as written in an Accessor
     * @return the operator, or empty if it is not one this webhook understands
     */
    public static Optional<MatchOperator> parse(@Nullable String operator) {
        for (MatchOperator candidate : values()) {
            if (candidate.value.equals(operator)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
