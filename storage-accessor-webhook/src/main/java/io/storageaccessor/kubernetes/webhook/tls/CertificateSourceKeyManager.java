/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.tls;

import java.net.Socket;
import java.security.Principal;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Objects;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.X509ExtendedKeyManager;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A server side key manager that asks a {@link CertificateSource} for the key material on each handshake.
 */
public class CertificateSourceKeyManager extends X509ExtendedKeyManager {

    static final String ALIAS = "webhook";

    private final CertificateSource source;

    public CertificateSourceKeyManager(CertificateSource source) {
        this.source = Objects.requireNonNull(source);
    }

    @Override
    @Nullable
    public String[] getServerAliases(String keyType, @Nullable Principal[] issuers) {
        String alias = chooseAlias(keyType);
        return alias == null ? null : new String[]{ alias };
    }

    @Override
    @Nullable
    public String chooseServerAlias(String keyType, @Nullable Principal[] issuers, @Nullable Socket socket) {
        return chooseAlias(keyType);
    }

    @Override
    @Nullable
    public String chooseEngineServerAlias(String keyType, @Nullable Principal[] issuers, @Nullable SSLEngine engine) {
        return chooseAlias(keyType);
    }

    @Override
    @Nullable
    public X509Certificate[] getCertificateChain(String alias) {
        return ALIAS.equals(alias) ? source.currentCertificate().chainArray() : null;
    }

    @Override
    @Nullable
    public PrivateKey getPrivateKey(String alias) {
        return ALIAS.equals(alias) ? source.currentCertificate().privateKey() : null;
    }

    // server only
    @Override
    @Nullable
    public String[] getClientAliases(String keyType, @Nullable Principal[] issuers) {
        return null;
    }

    @Override
    @Nullable
    public String chooseClientAlias(String[] keyType, @Nullable Principal[] issuers, @Nullable Socket socket) {
        return null;
    }

    @Nullable
    private String chooseAlias(@Nullable String keyType) {
        String algorithm = source.currentCertificate().privateKey().getAlgorithm();
        return algorithm.equalsIgnoreCase(keyType) ? ALIAS : null;
    }
}
