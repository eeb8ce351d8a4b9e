/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.admission;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The decision returned to the API server for one admission request.
 *
 * @param allowed whether the claim may be created
 * @param message human readable explanation, always present on a denial
 */
public record AdmissionOutcome(boolean allowed, @Nullable String message) {

    private static final AdmissionOutcome ALLOWED = new AdmissionOutcome(true, null);

    public AdmissionOutcome {
        if (!allowed && (message == null || message.isBlank())) {
            throw new IllegalArgumentException("a denial requires a message");
        }
    }

    public static AdmissionOutcome allow() {
        return ALLOWED;
    }

    public static AdmissionOutcome deny(String message) {
        return new AdmissionOutcome(false, message);
    }
}
