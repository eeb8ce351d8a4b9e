/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook;

/**
 * The webhook's environment does not describe a usable configuration.
 */
public class WebhookConfigurationException extends RuntimeException {

    public WebhookConfigurationException(String message) {
        super(message);
    }

    public WebhookConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
