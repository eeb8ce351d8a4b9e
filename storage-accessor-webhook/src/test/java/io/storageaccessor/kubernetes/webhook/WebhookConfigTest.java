/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook;

import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junitpioneer.jupiter.ClearEnvironmentVariable;
import org.junitpioneer.jupiter.SetEnvironmentVariable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookConfigTest {

    @Test
    void shouldApplyDefaults() {
        // When
        var config = WebhookConfig.fromEnvironment(Map.of());

        // Then
        assertThat(config.bindAddress()).isEqualTo(new HostPort("0.0.0.0", WebhookConfig.DEFAULT_WEBHOOK_PORT));
        assertThat(config.managementBindAddress()).isEqualTo(new HostPort("0.0.0.0", WebhookConfig.DEFAULT_MANAGEMENT_PORT));
        assertThat(config.webhookPath()).isEqualTo("/validate-persistentvolumeclaim");
        assertThat(config.certificateFile()).isEqualTo(Path.of("/etc/webhook/certs/tls.crt"));
        assertThat(config.keyFile()).isEqualTo(Path.of("/etc/webhook/certs/tls.key"));
        assertThat(config.threads()).isEqualTo(8);
    }

    @Test
    void shouldReadEveryVariable() {
        // Given
        // @formatter:off
        var env = Map.of(
                WebhookConfig.BIND_ADDRESS_VAR_NAME, "127.0.0.1:9443",
                WebhookConfig.MANAGEMENT_BIND_ADDRESS_VAR_NAME, "[::1]:9090",
                WebhookConfig.WEBHOOK_PATH_VAR_NAME, "/admit",
                WebhookConfig.TLS_CERT_FILE_VAR_NAME, "/certs/cert.pem",
                WebhookConfig.TLS_KEY_FILE_VAR_NAME, "/certs/key.pem",
                WebhookConfig.THREADS_VAR_NAME, "2");
        // @formatter:on

        // When
        var config = WebhookConfig.fromEnvironment(env);

        // Then
        assertThat(config).isEqualTo(new WebhookConfig(
                new HostPort("127.0.0.1", 9443),
                new HostPort("::1", 9090),
                "/admit",
                Path.of("/certs/cert.pem"),
                Path.of("/certs/key.pem"),
                2));
    }

    @Test
    void shouldBindHostOnlyAddressToDefaultPort() {
        // When
        var config = WebhookConfig.fromEnvironment(Map.of(WebhookConfig.BIND_ADDRESS_VAR_NAME, "webhook.local"));

        // Then
        assertThat(config.bindAddress()).isEqualTo(new HostPort("webhook.local", WebhookConfig.DEFAULT_WEBHOOK_PORT));
    }

    @Test
    void shouldTreatBlankValuesAsUnset() {
        // When
        var config = WebhookConfig.fromEnvironment(Map.of(WebhookConfig.WEBHOOK_PATH_VAR_NAME, " ", WebhookConfig.THREADS_VAR_NAME, ""));

        // Then
        assertThat(config.webhookPath()).isEqualTo(WebhookConfig.DEFAULT_WEBHOOK_PATH);
        assertThat(config.threads()).isEqualTo(WebhookConfig.DEFAULT_THREADS);
    }

    @Test
    void shouldRejectInvalidBindAddress() {
        var env = Map.of(WebhookConfig.BIND_ADDRESS_VAR_NAME, "localhost:https");

        assertThatThrownBy(() -> WebhookConfig.fromEnvironment(env))
                .isInstanceOf(WebhookConfigurationException.class)
                .hasMessageStartingWith("BIND_ADDRESS is invalid");
    }

    @ParameterizedTest
    @ValueSource(strings = { "0", "-4", "many" })
    void shouldRejectInvalidThreadCount(String threads) {
        var env = Map.of(WebhookConfig.THREADS_VAR_NAME, threads);

        assertThatThrownBy(() -> WebhookConfig.fromEnvironment(env))
                .isInstanceOf(WebhookConfigurationException.class);
    }

    @Test
    void shouldRejectRelativeWebhookPath() {
        var env = Map.of(WebhookConfig.WEBHOOK_PATH_VAR_NAME, "validate");

        assertThatThrownBy(() -> WebhookConfig.fromEnvironment(env))
                .isInstanceOf(WebhookConfigurationException.class)
                .hasMessageContaining("must start with '/'");
    }

    @Test
    @SetEnvironmentVariable(key = "BIND_ADDRESS", value = "127.0.0.1:18443")
    @SetEnvironmentVariable(key = "WEBHOOK_THREADS", value = "3")
    @ClearEnvironmentVariable(key = "WEBHOOK_PATH")
    void shouldReadProcessEnvironment() {
        // When
        var config = WebhookConfig.fromEnvironment();

        // Then
        assertThat(config.bindAddress()).isEqualTo(new HostPort("127.0.0.1", 18443));
        assertThat(config.threads()).isEqualTo(3);
        assertThat(config.webhookPath()).isEqualTo(WebhookConfig.DEFAULT_WEBHOOK_PATH);
    }
}
