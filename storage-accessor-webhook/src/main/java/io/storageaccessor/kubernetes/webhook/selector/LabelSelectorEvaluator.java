/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.selector;

import java.util.List;

import io.storageaccessor.kubernetes.api.v1alpha1.accessorspec.LabelRuleGroup;

public final class LabelSelectorEvaluator {

    private LabelSelectorEvaluator() {
    }

    public static boolean matches(List<LabelRuleGroup> selector, AttributeLookup labels) {
        List<List<MatchItem>> groups = selector.stream()
                .map(group -> group.getMatchExpressions().stream().map(MatchItem::of).toList())
                .toList();
        return SelectorMatcher.matches(groups, labels);
    }
}
