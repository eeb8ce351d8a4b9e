/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.resolver;

/**
 * The Accessors governing a storage class could not be determined.
 */
public class PolicyResolutionException extends RuntimeException {

    public PolicyResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
