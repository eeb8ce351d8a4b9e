/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.resolver;

/**
 * A namespace or workspace does not exist.
 */
public class ScopeNotFoundException extends ScopeResolutionException {

    public ScopeNotFoundException(String message) {
        super(message);
    }
}
