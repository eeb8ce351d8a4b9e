/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.http;

/**
 * An HTTP request that cannot be interpreted as a supported AdmissionReview. The caller receives
 * a client error rather than an admission decision.
 */
public class BadAdmissionReviewException extends Exception {

    public BadAdmissionReviewException(String message) {
        super(message);
    }
}
