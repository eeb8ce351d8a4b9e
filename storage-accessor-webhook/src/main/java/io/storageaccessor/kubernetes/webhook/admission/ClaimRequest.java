/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.admission;

import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimSpec;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The facts about a claim that an authorization decision depends on.
 *
 * @param resourceKind kind of the claim, normally {@code PersistentVolumeClaim}
 * @param name claim name
 * @param namespace namespace the claim is being created in
 * @param operation admission operation, such as {@code CREATE}
 * @param storageClassName storage class the claim asks for, if any
 */
public record ClaimRequest(String resourceKind,
                           String name,
                           String namespace,
                           String operation,
                           @Nullable String storageClassName) {

    /**
     * Annotation that named the storage class before {@code spec.storageClassName} existed.
     */
    public static final String BETA_STORAGE_CLASS_ANNOTATION = "volume.beta.kubernetes.io/storage-class";

    public ClaimRequest {
        Objects.requireNonNull(resourceKind);
        Objects.requireNonNull(name);
        Objects.requireNonNull(namespace);
        Objects.requireNonNull(operation);
    }

    /**
     * @param claim decoded claim
     * @param requestName object name carried by the admission request, used when the claim itself has none
     * @param requestNamespace namespace carried by the admission request, used when the claim itself has none
     * @param operation admission operation
     * @return claim request
     */
    static ClaimRequest of(PersistentVolumeClaim claim,
                           @Nullable String requestName,
                           @Nullable String requestNamespace,
                           String operation) {
        ObjectMeta metadata = Optional.ofNullable(claim.getMetadata()).orElseGet(ObjectMeta::new);
        String name = firstNonEmpty(metadata.getName(), requestName, metadata.getGenerateName());
        String namespace = firstNonEmpty(metadata.getNamespace(), requestNamespace, "");
        return new ClaimRequest(claim.getKind(), name, namespace, operation, storageClassOf(claim));
    }

    @Nullable
    private static String storageClassOf(PersistentVolumeClaim claim) {
        String fromSpec = Optional.ofNullable(claim.getSpec()).map(PersistentVolumeClaimSpec::getStorageClassName).orElse(null);
        if (fromSpec != null) {
            return fromSpec;
        }
        return Optional.ofNullable(claim.getMetadata())
                .map(ObjectMeta::getAnnotations)
                .map(annotations -> annotations.get(BETA_STORAGE_CLASS_ANNOTATION))
                .orElse(null);
    }

    private static String firstNonEmpty(@Nullable String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isEmpty()) {
                return candidate;
            }
        }
        return "";
    }

    /**
     * @return a description of the claim for use in denial messages
     */
    String describe() {
        return resourceKind + " " + name + " (" + operation + ") in namespace " + namespace;
    }
}
