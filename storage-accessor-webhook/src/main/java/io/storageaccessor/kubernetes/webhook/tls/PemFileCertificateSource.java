/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.tls;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Objects;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Reads a PEM certificate chain and PEM private key (PKCS#1 or PKCS#8) from files, such as those a
 * Kubernetes TLS Secret projects into a pod. The files are re-read whenever either modification time
 * changes. If re-reading fails, the previously loaded certificate continues to be served.
 */
public class PemFileCertificateSource implements CertificateSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(PemFileCertificateSource.class);

    private final Path certificateFile;
    private final Path keyFile;

    @Nullable
    private ServerCertificate current;
    @Nullable
    private FileTime certificateModified;
    @Nullable
    private FileTime keyModified;

    public PemFileCertificateSource(Path certificateFile, Path keyFile) {
        this.certificateFile = Objects.requireNonNull(certificateFile);
        this.keyFile = Objects.requireNonNull(keyFile);
    }

    @Override
    public synchronized ServerCertificate currentCertificate() {
        FileTime certTime;
        FileTime keyTime;
        try {
            certTime = Files.getLastModifiedTime(certificateFile);
            keyTime = Files.getLastModifiedTime(keyFile);
        }
        catch (IOException e) {
            return fallBack("Failed to stat certificate files", e);
        }
        if (current != null && certTime.equals(certificateModified) && keyTime.equals(keyModified)) {
            return current;
        }
        try {
            ServerCertificate loaded = load();
            boolean reload = current != null;
            current = loaded;
            certificateModified = certTime;
            keyModified = keyTime;
            LOGGER.atInfo()
                    .setMessage("{} server certificate {} (expires {})")
                    .addArgument(reload ? "Reloaded" : "Loaded")
                    .addArgument(() -> loaded.leaf().getSubjectX500Principal().getName())
                    .addArgument(() -> loaded.leaf().getNotAfter().toInstant())
                    .log();
            return loaded;
        }
        catch (CertificateLoadException e) {
            return fallBack("Failed to load certificate", e);
        }
    }

    private ServerCertificate fallBack(String message, Exception cause) {
        if (current == null) {
            throw cause instanceof CertificateLoadException cle ? cle
                    : new CertificateLoadException(message + " " + certificateFile + ", " + keyFile, cause);
        }
        LOGGER.warn("{} from {} and {}, continuing with the previous certificate", message, certificateFile, keyFile, cause);
        return current;
    }

    private ServerCertificate load() {
        return new ServerCertificate(readPrivateKey(keyFile), readCertificates(certificateFile));
    }

    static List<X509Certificate> readCertificates(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            List<X509Certificate> certificates = CertificateFactory.getInstance("X.509").generateCertificates(in).stream()
                    .filter(X509Certificate.class::isInstance)
                    .map(X509Certificate.class::cast)
                    .toList();
            if (certificates.isEmpty()) {
                throw new CertificateLoadException("no certificates found in " + file);
            }
            return certificates;
        }
        catch (IOException | CertificateException e) {
            throw new CertificateLoadException("failed to read certificates from " + file, e);
        }
    }

    static PrivateKey readPrivateKey(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.US_ASCII);
                PEMParser parser = new PEMParser(reader)) {
            Object parsed = parser.readObject();
            JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
            if (parsed instanceof PEMKeyPair keyPair) {
                return converter.getPrivateKey(keyPair.getPrivateKeyInfo());
            }
            else if (parsed instanceof PrivateKeyInfo keyInfo) {
                return converter.getPrivateKey(keyInfo);
            }
            throw new CertificateLoadException("no unencrypted private key found in " + file);
        }
        catch (IOException e) {
            throw new CertificateLoadException("failed to read private key from " + file, e);
        }
    }
}
