/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook;

import java.util.LinkedHashMap;
import java.util.Map;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimBuilder;

import io.storageaccessor.kubernetes.api.tenant.v1alpha1.Workspace;
import io.storageaccessor.kubernetes.api.v1alpha1.Accessor;
import io.storageaccessor.kubernetes.api.v1alpha1.AccessorSpec;
import io.storageaccessor.kubernetes.api.v1alpha1.accessorspec.ScopeSelector;

import edu.umd.cs.findbugs.annotations.Nullable;

public class Fixtures {

    private Fixtures() {
    }

    public static Namespace namespace(String name, Map<String, String> labels) {
        // @formatter:off
        return new NamespaceBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withLabels(labels)
                .endMetadata()
                .withNewStatus()
                    .withPhase("Active")
                .endStatus()
                .build();
        // @formatter:on
    }

    public static Namespace namespaceInWorkspace(String name, String workspace) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(Workspace.WORKSPACE_LABEL, workspace);
        return namespace(name, labels);
    }

    public static Workspace workspace(String name) {
        return new Workspace(name, Map.of());
    }

    public static Accessor accessor(String name,
                                    String storageClassName,
                                    @Nullable ScopeSelector namespaceSelector,
                                    @Nullable ScopeSelector workspaceSelector) {
        return new Accessor(name, new AccessorSpec(storageClassName, namespaceSelector, workspaceSelector));
    }

    public static PersistentVolumeClaim claim(String name, String namespace, @Nullable String storageClassName) {
        // @formatter:off
        return new PersistentVolumeClaimBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                .endMetadata()
                .withNewSpec()
                    .withStorageClassName(storageClassName)
                    .addToAccessModes("ReadWriteOnce")
                .endSpec()
                .build();
        // @formatter:on
    }
}
