/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.http;

import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.fabric8.kubernetes.api.model.StatusBuilder;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionRequest;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionResponseBuilder;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionReview;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionReviewBuilder;

import io.storageaccessor.kubernetes.webhook.admission.AdmissionOutcome;

/**
 * The AdmissionReview dialects this webhook speaks, each knowing how to decode its requests and
 * encode its responses.
 */
public enum AdmissionReviewVersion {

    V1("admission.k8s.io/v1", "AdmissionReview") {
        @Override
        DecodedReview decode(ObjectNode envelope, ObjectMapper mapper) throws BadAdmissionReviewException {
            JsonNode requestNode = envelope.get("request");
            if (requestNode == null || !requestNode.isObject()) {
                throw new BadAdmissionReviewException(this + " has no request");
            }
            ObjectNode requestFields = ((ObjectNode) requestNode).deepCopy();
            JsonNode object = requestFields.remove("object");
            requestFields.remove("oldObject");
            requestFields.remove("options");
            AdmissionRequest request;
            try {
                request = mapper.treeToValue(requestFields, AdmissionRequest.class);
            }
            catch (JsonProcessingException | IllegalArgumentException e) {
                throw new BadAdmissionReviewException(this + " request is malformed: " + e.getMessage());
            }
            if (request.getUid() == null || request.getUid().isEmpty()) {
                throw new BadAdmissionReviewException(this + " request has no uid");
            }
            if (request.getOperation() == null || request.getOperation().isEmpty()) {
                throw new BadAdmissionReviewException(this + " request has no operation");
            }
            return new DecodedReview(this, request, object);
        }

        @Override
        byte[] encode(String uid, AdmissionOutcome outcome, ObjectMapper mapper) throws JsonProcessingException {
            AdmissionResponseBuilder response = new AdmissionResponseBuilder()
                    .withUid(uid)
                    .withAllowed(outcome.allowed());
            if (!outcome.allowed()) {
                response.withStatus(new StatusBuilder()
                        .withCode(FORBIDDEN)
                        .withReason("Forbidden")
                        .withMessage(outcome.message())
                        .build());
            }
            AdmissionReview review = new AdmissionReviewBuilder()
                    .withApiVersion(apiVersion())
                    .withKind(kind())
                    .withResponse(response.build())
                    .build();
            return mapper.writeValueAsBytes(review);
        }
    };

    private static final int FORBIDDEN = 403;

    private final String apiVersion;
    private final String kind;

    AdmissionReviewVersion(String apiVersion, String kind) {
        this.apiVersion = apiVersion;
        this.kind = kind;
    }

    public String apiVersion() {
        return apiVersion;
    }

    public String kind() {
        return kind;
    }

    abstract DecodedReview decode(ObjectNode envelope, ObjectMapper mapper) throws BadAdmissionReviewException;

    abstract byte[] encode(String uid, AdmissionOutcome outcome, ObjectMapper mapper) throws JsonProcessingException;

    /**
     * @param envelope the review as sent
     * @return the dialect named by the envelope's {@code apiVersion} and {@code kind}, or empty if it is not supported
     */
    static Optional<AdmissionReviewVersion> of(JsonNode envelope) {
        String apiVersion = envelope.path("apiVersion").asText("");
        String kind = envelope.path("kind").asText("");
        for (AdmissionReviewVersion version : values()) {
            if (version.apiVersion.equals(apiVersion) && version.kind.equals(kind)) {
                return Optional.of(version);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return apiVersion + " " + kind;
    }
}
