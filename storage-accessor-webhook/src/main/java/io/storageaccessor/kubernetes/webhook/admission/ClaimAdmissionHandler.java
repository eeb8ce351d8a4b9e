/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.admission;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionRequest;

import io.storageaccessor.kubernetes.api.v1alpha1.Accessor;
import io.storageaccessor.kubernetes.webhook.resolver.PolicyResolutionException;
import io.storageaccessor.kubernetes.webhook.resolver.PolicyResolver;
import io.storageaccessor.kubernetes.webhook.resolver.ScopeResolutionException;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Decides whether a PersistentVolumeClaim may be created.
 * <p>
 * Only {@code CREATE} is restricted, every other operation is allowed. A claim is allowed when no Accessor
 * governs its storage class, or when every Accessor governing it authorizes the claim. Any failure to decode
 * the claim or to resolve the cluster state the decision depends on results in a denial carrying the
 * failure's message.
 */
public class ClaimAdmissionHandler {

    public static final String CREATE = "CREATE";

    private static final Logger LOGGER = LoggerFactory.getLogger(ClaimAdmissionHandler.class);
    private static final String CLAIM_KIND = HasMetadata.getKind(PersistentVolumeClaim.class);

    private final PolicyResolver policyResolver;
    private final AuthorizationValidator validator;
    private final ObjectMapper mapper;

    public ClaimAdmissionHandler(PolicyResolver policyResolver, AuthorizationValidator validator, ObjectMapper mapper) {
        this.policyResolver = Objects.requireNonNull(policyResolver);
        this.validator = Objects.requireNonNull(validator);
        this.mapper = Objects.requireNonNull(mapper);
    }

    /**
     * @param request the admission request, without its embedded object
     * @param rawObject the object embedded in the request, as sent
     * @return the outcome
     */
    public AdmissionOutcome decide(AdmissionRequest request, @Nullable JsonNode rawObject) {
        String operation = request.getOperation();
        if (!CREATE.equals(operation)) {
            LOGGER.debug("Allowing {} of {}/{}, only {} is restricted", operation, request.getNamespace(), request.getName(), CREATE);
            return AdmissionOutcome.allow();
        }

        PersistentVolumeClaim claim;
        try {
            claim = decodeClaim(rawObject);
        }
        catch (ClaimDecodingException e) {
            LOGGER.warn("Denying request {}: {}", request.getUid(), e.getMessage());
            return AdmissionOutcome.deny(e.getMessage());
        }

        ClaimRequest claimRequest = ClaimRequest.of(claim, request.getName(), request.getNamespace(), operation);
        AdmissionOutcome outcome = decide(claimRequest);
        if (outcome.allowed()) {
            LOGGER.debug("Allowing {}", claimRequest.describe());
        }
        else {
            LOGGER.info("Denying {}: {}", claimRequest.describe(), outcome.message());
        }
        return outcome;
    }

    AdmissionOutcome decide(ClaimRequest claim) {
        String storageClassName = claim.storageClassName();
        if (storageClassName == null || storageClassName.isEmpty()) {
            return AdmissionOutcome.allow();
        }
        try {
            List<Accessor> accessors = policyResolver.policiesFor(storageClassName);
            for (Accessor accessor : accessors) {
                AuthorizationResult result = validator.authorize(claim, accessor);
                if (!result.authorized()) {
                    return AdmissionOutcome.deny(result.reason());
                }
            }
            return AdmissionOutcome.allow();
        }
        catch (PolicyResolutionException | ScopeResolutionException e) {
            return AdmissionOutcome.deny(claim.describe() + " could not be authorized: " + e.getMessage());
        }
        catch (RuntimeException e) {
            LOGGER.atError()
                    .setMessage("Unexpected failure authorizing {}")
                    .addArgument(claim::describe)
                    .setCause(e)
                    .log();
            return AdmissionOutcome.deny(claim.describe() + " could not be authorized: " + e.getMessage());
        }
    }

    private PersistentVolumeClaim decodeClaim(@Nullable JsonNode rawObject) throws ClaimDecodingException {
        if (rawObject == null || rawObject.isNull() || rawObject.isMissingNode()) {
            throw new ClaimDecodingException("admission request carries no object to decode as a " + CLAIM_KIND);
        }
        PersistentVolumeClaim claim;
        try {
            claim = mapper.treeToValue(rawObject, PersistentVolumeClaim.class);
        }
        catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ClaimDecodingException("failed to decode object as a " + CLAIM_KIND + ": " + e.getMessage());
        }
        if (claim == null || !CLAIM_KIND.equals(claim.getKind())) {
            throw new ClaimDecodingException("expected a " + CLAIM_KIND + " but the object is a " + (claim == null ? null : claim.getKind()));
        }
        return claim;
    }

    private static class ClaimDecodingException extends Exception {
        ClaimDecodingException(String message) {
            super(message);
        }
    }
}
