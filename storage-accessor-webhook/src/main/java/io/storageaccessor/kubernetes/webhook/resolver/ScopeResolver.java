/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.resolver;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import io.fabric8.kubernetes.api.model.Namespace;

import io.storageaccessor.kubernetes.api.tenant.v1alpha1.Workspace;

/**
 * Looks up namespaces and workspaces by name, without retrying or caching.
 */
public class ScopeResolver {

    private final ClusterLookup clusterLookup;

    public ScopeResolver(ClusterLookup clusterLookup) {
        this.clusterLookup = Objects.requireNonNull(clusterLookup);
    }

    /**
     * @param name namespace name
     * @return the namespace
     * @throws ScopeNotFoundException if there is no such namespace
     * @throws ScopeResolutionException if the lookup failed
     */
    public Namespace namespace(String name) {
        return resolve("namespace", name, () -> clusterLookup.getNamespace(name));
    }

    /**
     * @param name workspace name
     * @return the workspace
     * @throws ScopeNotFoundException if there is no such workspace
     * @throws ScopeResolutionException if the lookup failed
     */
    public Workspace workspace(String name) {
        return resolve("workspace", name, () -> clusterLookup.getWorkspace(name));
    }

    private static <T> T resolve(String kind, String name, Supplier<Optional<T>> lookup) {
        Optional<T> found;
        try {
            found = lookup.get();
        }
        catch (RuntimeException e) {
            throw new ScopeResolutionException("failed to get " + kind + " " + name + ": " + e.getMessage(), e);
        }
        return found.orElseThrow(() -> new ScopeNotFoundException(kind + " " + name + " not found"));
    }
}
