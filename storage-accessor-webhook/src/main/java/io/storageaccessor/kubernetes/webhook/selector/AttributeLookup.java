/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.selector;

import java.util.Map;
import java.util.Optional;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Resolves a key to the value an object carries for it. An empty result means the object has no such key.
 */
@FunctionalInterface
public interface AttributeLookup {

    Optional<String> valueOf(@Nullable String key);

    static AttributeLookup ofLabels(@Nullable Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return key -> Optional.empty();
        }
        return key -> key == null ? Optional.empty() : Optional.ofNullable(labels.get(key));
    }
}
