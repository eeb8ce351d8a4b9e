/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.resolver;

import java.util.List;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.Namespace;

import io.storageaccessor.kubernetes.api.tenant.v1alpha1.Workspace;
import io.storageaccessor.kubernetes.api.v1alpha1.Accessor;

/**
 * Read access to the cluster state that admission decisions depend on.
 * Implementations must be safe for concurrent use, and signal transport failures with unchecked exceptions.
 */
public interface ClusterLookup {

    List<Accessor> listAccessors();

    Optional<Namespace> getNamespace(String name);

    Optional<Workspace> getWorkspace(String name);
}
