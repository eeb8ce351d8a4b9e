/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.resolver;

/**
 * A namespace or workspace could not be looked up.
 */
public class ScopeResolutionException extends RuntimeException {

    public ScopeResolutionException(String message) {
        super(message);
    }

    public ScopeResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
