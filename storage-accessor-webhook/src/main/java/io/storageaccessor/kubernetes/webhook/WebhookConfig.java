/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Start-up configuration of the webhook, read once from environment variables.
 *
 * @param bindAddress address the HTTPS webhook endpoint listens on
 * @param managementBindAddress address the plain HTTP management endpoints listen on
 * @param webhookPath path the API server posts AdmissionReviews to
 * @param certificateFile PEM certificate chain presented by the webhook
 * @param keyFile PEM private key for the certificate
 * @param threads number of requests served concurrently
 */
public record WebhookConfig(HostPort bindAddress,
                            HostPort managementBindAddress,
                            String webhookPath,
                            Path certificateFile,
                            Path keyFile,
                            int threads) {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookConfig.class);

    static final String BIND_ADDRESS_VAR_NAME = "BIND_ADDRESS";
    static final String MANAGEMENT_BIND_ADDRESS_VAR_NAME = "MANAGEMENT_BIND_ADDRESS";
    static final String WEBHOOK_PATH_VAR_NAME = "WEBHOOK_PATH";
    static final String TLS_CERT_FILE_VAR_NAME = "TLS_CERT_FILE";
    static final String TLS_KEY_FILE_VAR_NAME = "TLS_KEY_FILE";
    static final String THREADS_VAR_NAME = "WEBHOOK_THREADS";

    static final int DEFAULT_WEBHOOK_PORT = 8443;
    static final int DEFAULT_MANAGEMENT_PORT = 8080;
    static final String DEFAULT_WEBHOOK_PATH = "/validate-persistentvolumeclaim";
    static final String DEFAULT_CERT_FILE = "/etc/webhook/certs/tls.crt";
    static final String DEFAULT_KEY_FILE = "/etc/webhook/certs/tls.key";
    static final int DEFAULT_THREADS = 8;

    public WebhookConfig {
        Objects.requireNonNull(bindAddress);
        Objects.requireNonNull(managementBindAddress);
        Objects.requireNonNull(certificateFile);
        Objects.requireNonNull(keyFile);
        if (webhookPath == null || !webhookPath.startsWith("/")) {
            throw new WebhookConfigurationException("webhook path must start with '/', got: " + webhookPath);
        }
        if (threads < 1) {
            throw new WebhookConfigurationException("thread count must be positive, got: " + threads);
        }
    }

    public static WebhookConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static WebhookConfig fromEnvironment(Map<String, String> env) {
        return new WebhookConfig(
                address(env, BIND_ADDRESS_VAR_NAME, DEFAULT_WEBHOOK_PORT),
                address(env, MANAGEMENT_BIND_ADDRESS_VAR_NAME, DEFAULT_MANAGEMENT_PORT),
                valueOrDefault(env, WEBHOOK_PATH_VAR_NAME, DEFAULT_WEBHOOK_PATH),
                Path.of(valueOrDefault(env, TLS_CERT_FILE_VAR_NAME, DEFAULT_CERT_FILE)),
                Path.of(valueOrDefault(env, TLS_KEY_FILE_VAR_NAME, DEFAULT_KEY_FILE)),
                threads(env));
    }

    private static String valueOrDefault(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static HostPort address(Map<String, String> env, String varName, int defaultPort) {
        final String bindAddress = env.getOrDefault(varName, "");
        if (bindAddress.contains(":")) {
            try {
                return HostPort.parse(bindAddress);
            }
            catch (IllegalArgumentException e) {
                throw new WebhookConfigurationException(varName + " is invalid: " + e.getMessage(), e);
            }
        }
        else if (!bindAddress.isEmpty()) {
            LOGGER.warn("{} env var is set but does not contain a port, assuming hostname only and binding to default port ({})",
                    varName,
                    defaultPort);
            return new HostPort(bindAddress, defaultPort);
        }
        else {
            return new HostPort("0.0.0.0", defaultPort);
        }
    }

    private static int threads(Map<String, String> env) {
        String value = valueOrDefault(env, THREADS_VAR_NAME, Integer.toString(DEFAULT_THREADS));
        try {
            return Integer.parseInt(value);
        }
        catch (NumberFormatException e) {
            throw new WebhookConfigurationException(THREADS_VAR_NAME + " must be an integer, got: " + value, e);
        }
    }
}
