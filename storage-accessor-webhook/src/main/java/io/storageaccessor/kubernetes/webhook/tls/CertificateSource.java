/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.tls;

/**
 * Supplies the certificate the webhook presents to the API server. It is consulted on every TLS handshake,
 * so a source that returns rotated material takes effect without restarting the server.
 * Implementations must be safe for concurrent use.
 */
@FunctionalInterface
public interface CertificateSource {

    /**
     * @return the certificate to present now
     * @throws CertificateLoadException if no certificate is available
     */
    ServerCertificate currentCertificate();
}
