/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.selector;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class MatchOperatorTest {

    @ParameterizedTest
    @CsvSource({ "In, IN", "NotIn, NOT_IN" })
    void shouldParseKnownOperators(String operator, MatchOperator expected) {
        assertThat(MatchOperator.parse(operator)).contains(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "in", "notin", "Exists", "DoesNotExist", " In" })
    void shouldNotParseOtherOperators(String operator) {
        assertThat(MatchOperator.parse(operator)).isEmpty();
    }
}
