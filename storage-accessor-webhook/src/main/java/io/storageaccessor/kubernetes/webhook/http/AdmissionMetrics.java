/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.http;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import io.storageaccessor.kubernetes.webhook.admission.AdmissionOutcome;

/**
 * Counts admission decisions, and requests rejected before a decision could be made.
 */
public class AdmissionMetrics {

    static final String DECISIONS_METRIC_NAME = "storage_accessor_admission_decisions";
    static final String REJECTIONS_METRIC_NAME = "storage_accessor_admission_rejections";

    private final Counter allowed;
    private final Counter denied;
    private final Counter badRequests;
    private final Counter internalErrors;

    public AdmissionMetrics(MeterRegistry registry) {
        allowed = decisionCounter(registry, "allowed");
        denied = decisionCounter(registry, "denied");
        badRequests = rejectionCounter(registry, "bad_request");
        internalErrors = rejectionCounter(registry, "internal_error");
    }

    private static Counter decisionCounter(MeterRegistry registry, String decision) {
        return Counter.builder(DECISIONS_METRIC_NAME)
                .description("Admission decisions made for PersistentVolumeClaim requests")
                .tag("decision", decision)
                .register(registry);
    }

    private static Counter rejectionCounter(MeterRegistry registry, String reason) {
        return Counter.builder(REJECTIONS_METRIC_NAME)
                .description("AdmissionReview requests answered with an HTTP error")
                .tag("reason", reason)
                .register(registry);
    }

    void decided(AdmissionOutcome outcome) {
        (outcome.allowed() ? allowed : denied).increment();
    }

    void badRequest() {
        badRequests.increment();
    }

    void internalError() {
        internalErrors.increment();
    }
}
