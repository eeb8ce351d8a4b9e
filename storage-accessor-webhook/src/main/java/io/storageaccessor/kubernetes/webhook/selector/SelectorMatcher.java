/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.selector;

import java.util.List;

/**
 * Evaluates a selector, a disjunction of rule groups each of which is a conjunction of {@link MatchItem}s.
 * <p>
 * A selector with no groups imposes no restriction and always matches. Otherwise a target matches
 * if at least one group holds, and a group holds if none of its items vetoes it
 * (see {@link MatchItem#vacuousOrSatisfied(AttributeLookup)}), so a group with no items always holds.
 * Evaluation never throws, malformed items are inert.
 */
public final class SelectorMatcher {

    private SelectorMatcher() {
    }

    public static boolean matches(List<List<MatchItem>> groups, AttributeLookup lookup) {
        return groups.isEmpty() || groups.stream().anyMatch(group -> groupHolds(group, lookup));
    }

    static boolean groupHolds(List<MatchItem> group, AttributeLookup lookup) {
        return group.stream().allMatch(item -> item.vacuousOrSatisfied(lookup));
    }
}
