/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.selector;

import java.util.Map;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceStatus;

import io.storageaccessor.kubernetes.api.tenant.v1alpha1.Workspace;
import io.storageaccessor.kubernetes.api.tenant.v1alpha1.WorkspaceStatus;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The attributes of a namespace or workspace that selectors can test.
 *
 * @param name object name
 * @param status object phase, if it reports one
 * @param labels object labels
 */
public record SelectorTarget(String name, @Nullable String status, Map<String, String> labels) {

    public SelectorTarget {
        labels = labels == null ? Map.of() : labels;
    }

    public static SelectorTarget of(Namespace namespace) {
        return new SelectorTarget(namespace.getMetadata().getName(),
                Optional.ofNullable(namespace.getStatus()).map(NamespaceStatus::getPhase).orElse(null),
                namespace.getMetadata().getLabels());
    }

    public static SelectorTarget of(Workspace workspace) {
        return new SelectorTarget(workspace.getMetadata().getName(),
                Optional.ofNullable(workspace.getStatus()).map(WorkspaceStatus::getPhase).orElse(null),
                workspace.getMetadata().getLabels());
    }

    public AttributeLookup labelLookup() {
        return AttributeLookup.ofLabels(labels);
    }

    public AttributeLookup fieldLookup() {
        return key -> SelectorField.forName(key).flatMap(field -> field.valueOf(this));
    }
}
