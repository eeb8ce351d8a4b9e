/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.resolver;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.storageaccessor.kubernetes.api.v1alpha1.Accessor;
import io.storageaccessor.kubernetes.api.v1alpha1.AccessorSpec;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Finds the Accessors that govern a storage class. Accessors are listed afresh for every call.
 */
public class PolicyResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(PolicyResolver.class);

    private final ClusterLookup clusterLookup;

    public PolicyResolver(ClusterLookup clusterLookup) {
        this.clusterLookup = Objects.requireNonNull(clusterLookup);
    }

    /**
     * @param storageClassName storage class name
     * @return the Accessors whose {@code spec.storageClassName} equals the given name, in the order the cluster listed them
     * @throws PolicyResolutionException if the Accessors cannot be listed or read
     */
    public List<Accessor> policiesFor(String storageClassName) {
        List<Accessor> all;
        List<Accessor> applicable;
        try {
            all = clusterLookup.listAccessors();
            applicable = all.stream()
                    .filter(accessor -> storageClassName.equals(storageClassOf(accessor)))
                    .toList();
        }
        catch (RuntimeException e) {
            throw new PolicyResolutionException("failed to list Accessors for storage class " + storageClassName + ": " + e.getMessage(), e);
        }
        LOGGER.atDebug()
                .setMessage("{} of {} Accessors apply to storage class {}")
                .addArgument(applicable::size)
                .addArgument(all::size)
                .addArgument(storageClassName)
                .log();
        return applicable;
    }

    @Nullable
    private static String storageClassOf(Accessor accessor) {
        AccessorSpec spec = accessor.getSpec();
        return spec == null ? null : spec.getStorageClassName();
    }
}
