/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.resolver;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.client.KubernetesClient;

import io.storageaccessor.kubernetes.api.tenant.v1alpha1.Workspace;
import io.storageaccessor.kubernetes.api.v1alpha1.Accessor;

/**
 * {@link ClusterLookup} that asks the Kube API server on every call.
 */
public class KubernetesClusterLookup implements ClusterLookup {

    private final KubernetesClient client;

    public KubernetesClusterLookup(KubernetesClient client) {
        this.client = Objects.requireNonNull(client);
    }

    @Override
    public List<Accessor> listAccessors() {
        return client.resources(Accessor.class).list().getItems();
    }

    @Override
    public Optional<Namespace> getNamespace(String name) {
        return Optional.ofNullable(client.namespaces().withName(name).get());
    }

    @Override
    public Optional<Workspace> getWorkspace(String name) {
        return Optional.ofNullable(client.resources(Workspace.class).withName(name).get());
    }
}
