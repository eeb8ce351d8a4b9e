/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.selector;

import io.storageaccessor.kubernetes.api.v1alpha1.accessorspec.ScopeSelector;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Evaluates both halves of a {@link ScopeSelector}; the field rules and the label rules must each match.
 */
public final class ScopeSelectorEvaluator {

    private ScopeSelectorEvaluator() {
    }

    /**
     * @param selector selector, null meaning unrestricted
     * @param target the namespace or workspace being tested
     * @return true if the target satisfies the selector
     */
    public static boolean matches(@Nullable ScopeSelector selector, SelectorTarget target) {
        if (selector == null) {
            return true;
        }
        return FieldSelectorEvaluator.matches(selector.getFieldSelector(), target.fieldLookup())
                && LabelSelectorEvaluator.matches(selector.getLabelSelector(), target.labelLookup());
    }
}
