/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.selector;

import java.util.List;

import io.storageaccessor.kubernetes.api.v1alpha1.accessorspec.FieldRuleGroup;

/**
 * Evaluates field rule groups. Expressions naming a field outside {@link SelectorField} behave as if the
 * target lacked the field, so they never veto a group.
 */
public final class FieldSelectorEvaluator {

    private FieldSelectorEvaluator() {
    }

    public static boolean matches(List<FieldRuleGroup> selector, AttributeLookup fields) {
        List<List<MatchItem>> groups = selector.stream()
                .map(group -> group.getFieldExpressions().stream().map(MatchItem::of).toList())
                .toList();
        return SelectorMatcher.matches(groups, fields);
    }
}
