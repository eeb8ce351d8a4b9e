/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.http;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

import io.fabric8.kubernetes.api.model.admission.v1.AdmissionRequest;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The request half of an AdmissionReview. The embedded object is kept as sent so that a claim which
 * fails to decode can be denied, rather than rejecting the whole review.
 *
 * @param version dialect the review was written in
 * @param request the request, without its embedded objects
 * @param object the embedded object, if any
 */
record DecodedReview(AdmissionReviewVersion version, AdmissionRequest request, @Nullable JsonNode object) {

    DecodedReview {
        Objects.requireNonNull(version);
        Objects.requireNonNull(request);
    }
}
