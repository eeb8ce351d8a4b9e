/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.admission;

import java.util.Optional;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Whether one Accessor authorizes a claim.
 *
 * @param authorized true if the Accessor authorizes the claim
 * @param reason why it does not, null when authorized
 */
public record AuthorizationResult(boolean authorized, @Nullable String reason) {

    private static final AuthorizationResult AUTHORIZED = new AuthorizationResult(true, null);

    public AuthorizationResult {
        if (!authorized && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("a denial requires a reason");
        }
    }

    public static AuthorizationResult permitted() {
        return AUTHORIZED;
    }

    public static AuthorizationResult denied(String reason) {
        return new AuthorizationResult(false, reason);
    }

    public Optional<String> denialReason() {
        return Optional.ofNullable(reason);
    }
}
