/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook;

import java.io.IOException;
import java.util.Objects;
import java.util.Properties;
import java.util.function.IntSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpServer;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.prometheus.metrics.exporter.httpserver.MetricsHandler;

import io.storageaccessor.kubernetes.webhook.admission.AuthorizationValidator;
import io.storageaccessor.kubernetes.webhook.admission.ClaimAdmissionHandler;
import io.storageaccessor.kubernetes.webhook.http.AdmissionMetrics;
import io.storageaccessor.kubernetes.webhook.http.AdmissionReviewHandler;
import io.storageaccessor.kubernetes.webhook.http.WebhookServer;
import io.storageaccessor.kubernetes.webhook.management.UnsupportedHttpMethodFilter;
import io.storageaccessor.kubernetes.webhook.resolver.ClusterLookup;
import io.storageaccessor.kubernetes.webhook.resolver.KubernetesClusterLookup;
import io.storageaccessor.kubernetes.webhook.resolver.PolicyResolver;
import io.storageaccessor.kubernetes.webhook.resolver.ScopeResolver;
import io.storageaccessor.kubernetes.webhook.tls.CertificateSource;
import io.storageaccessor.kubernetes.webhook.tls.PemFileCertificateSource;

/**
 * The {@code main} method entrypoint for the webhook.
 */
public class WebhookMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookMain.class);
    static final String HTTP_PATH_LIVEZ = "/livez";
    static final String HTTP_PATH_METRICS = "/metrics";

    /**
     * Name of the build_info metric.  Note that the {@code .info} suffix is significant
     * to Micrometer and is used to indicate an 'info' metric to it.  The metric
     * name emitted by Prometheus will be called {@code storage_accessor_webhook_build_info}.
     */
    private static final String BUILD_INFO_METRIC_NAME = "storage_accessor_webhook_build.info";

    private final WebhookServer webhookServer;
    private final HttpServer managementServer;
    private final PrometheusMeterRegistry meterRegistry;

    @VisibleForTesting
    WebhookMain(WebhookConfig config,
                ClusterLookup clusterLookup,
                CertificateSource certificateSource,
                HttpServer managementServer)
            throws IOException {
        Objects.requireNonNull(config);
        this.managementServer = Objects.requireNonNull(managementServer);
        this.meterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        configurePrometheusMetrics();

        ObjectMapper mapper = new ObjectMapper();
        var claimAdmissionHandler = new ClaimAdmissionHandler(
                new PolicyResolver(clusterLookup),
                new AuthorizationValidator(new ScopeResolver(clusterLookup)),
                mapper);
        var admissionReviewHandler = new AdmissionReviewHandler(claimAdmissionHandler, mapper, new AdmissionMetrics(meterRegistry));
        this.webhookServer = WebhookServer.create(config, certificateSource, admissionReviewHandler);
    }

    public static void main(String[] args) {
        try {
            WebhookConfig config = WebhookConfig.fromEnvironment();
            KubernetesClient client = new KubernetesClientBuilder().build();
            CertificateSource certificateSource = new PemFileCertificateSource(config.certificateFile(), config.keyFile());
            // fail fast on missing or unreadable key material
            certificateSource.currentCertificate();
            WebhookMain webhookMain = new WebhookMain(config, new KubernetesClusterLookup(client), certificateSource, createHttpServer(config));
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                webhookMain.stop();
                client.close();
            }, "webhook-shutdown"));
            webhookMain.start();
        }
        catch (Exception e) {
            LOGGER.error("Webhook has thrown exception during startup. Will now exit.", e);
            System.exit(1);
        }
    }

    /**
     * Starts the webhook and management servers and returns once both are listening.
     */
    void start() {
        addHttpGetHandler("/", () -> 404);
        addHttpGetHandler(HTTP_PATH_LIVEZ, this::livezStatusCode);
        managementServer.start();
        webhookServer.start();
        BuildInfo buildInfo = BuildInfo.current();
        LOGGER.info("Webhook started (version: {})", buildInfo.version());
        buildInfoMetric(buildInfo);
    }

    void stop() {
        webhookServer.stop();
        managementServer.stop(0);
        meterRegistry.close();
        LOGGER.info("Webhook stopped.");
    }

    @VisibleForTesting
    WebhookServer webhookServer() {
        return webhookServer;
    }

    private void addHttpGetHandler(String path, IntSupplier statusCodeSupplier) {
        managementServer.createContext(path, exchange -> {
            try (exchange) {
                // note while the JDK docs advise exchange.getRequestBody().transferTo(OutputStream.nullOutputStream()); we explicitly don't do that!
                // As a denial-of-service protection we don't expect anything other than GET requests so there should be no input to read.
                exchange.sendResponseHeaders(statusCodeSupplier.getAsInt(), -1);
            }
        }).getFilters().add(UnsupportedHttpMethodFilter.GET_ONLY);
    }

    @VisibleForTesting
    int livezStatusCode() {
        int sc = webhookServer.isRunning() ? 200 : 503;
        (sc != 200 ? LOGGER.atWarn() : LOGGER.atDebug()).log("Responding {} to GET {}", sc, HTTP_PATH_LIVEZ);
        return sc;
    }

    private void configurePrometheusMetrics() {
        final HttpContext metricsContext = managementServer.createContext(HTTP_PATH_METRICS,
                new MetricsHandler(meterRegistry.getPrometheusRegistry()));
        metricsContext.getFilters().add(UnsupportedHttpMethodFilter.GET_ONLY);
    }

    @VisibleForTesting
    static HttpServer createHttpServer(WebhookConfig config) throws IOException {
        final Properties systemProps = System.getProperties();
        if (!systemProps.containsKey("sun.net.httpserver.maxReqTime")) {
            System.setProperty("sun.net.httpserver.maxReqTime", "60");
        }

        if (!systemProps.containsKey("sun.net.httpserver.maxRspTime")) {
            System.setProperty("sun.net.httpserver.maxRspTime", "120");
        }

        LOGGER.info("Starting management server on: {}", config.managementBindAddress());
        return HttpServer.create(config.managementBindAddress().toSocketAddress(), 0);
    }

    private void buildInfoMetric(BuildInfo buildInfo) {
        Gauge.builder(BUILD_INFO_METRIC_NAME, () -> 1.0)
                .description("Reports Storage Accessor webhook version information")
                .tag("version", buildInfo.version())
                .strongReference(true)
                .register(meterRegistry);
    }
}
