/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;

import org.assertj.core.api.ListAssert;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junitpioneer.jupiter.ClearSystemProperty;
import org.junitpioneer.jupiter.RestoreSystemProperties;
import org.junitpioneer.jupiter.SetSystemProperty;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import io.storageaccessor.kubernetes.webhook.management.UnsupportedHttpMethodFilter;
import io.storageaccessor.kubernetes.webhook.resolver.ClusterLookup;
import io.storageaccessor.kubernetes.webhook.tls.ServerCertificate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookMainTest {

    private static final WebhookConfig CONFIG = new WebhookConfig(
            new HostPort("localhost", 0),
            new HostPort("localhost", 0),
            WebhookConfig.DEFAULT_WEBHOOK_PATH,
            Path.of("unused.crt"),
            Path.of("unused.key"),
            1);

    private static final ServerCertificate CERTIFICATE = CertificateGenerator.generateServerCertificate("localhost");

    private WebhookMain webhookMain;

    @Mock
    ClusterLookup clusterLookup;

    @Mock
    HttpServer managementServer;

    @Mock
    HttpContext httpContext;

    @BeforeEach
    void setUp() throws IOException {
        when(managementServer.createContext(anyString(), any(HttpHandler.class))).thenReturn(httpContext);
        webhookMain = new WebhookMain(CONFIG, clusterLookup, () -> CERTIFICATE, managementServer);
    }

    @AfterEach
    void tearDown() {
        if (webhookMain != null) {
            webhookMain.stop();
        }
    }

    @Test
    void shouldStartHttpServers() {
        // Given

        // When
        webhookMain.start();

        // Then
        verify(managementServer).start();
        assertThat(webhookMain.webhookServer().isRunning()).isTrue();
    }

    @Test
    void shouldRegisterMetricsWithManagementServer() {
        // Given

        // When
        webhookMain.start();

        // Then
        verify(managementServer).createContext(eq(WebhookMain.HTTP_PATH_METRICS), any(HttpHandler.class));
    }

    @Test
    void shouldRegisterLivezWithManagementServer() {
        // Given

        // When
        webhookMain.start();

        // Then
        verify(managementServer).createContext(eq(WebhookMain.HTTP_PATH_LIVEZ), any(HttpHandler.class));
    }

    @Test
    void shouldRegisterUnsupportedMethodsFilterWithManagementServer() {
        // Given
        final ArrayList<Filter> filters = new ArrayList<>();
        when(httpContext.getFilters()).thenReturn(filters);

        // When
        webhookMain.start();

        // Then
        verify(managementServer).createContext(eq("/"), any(HttpHandler.class));
        ListAssert<Filter> filterListAssert = assertThat(filters).hasSize(2);
        filterListAssert.first()
                .isSameAs(UnsupportedHttpMethodFilter.GET_ONLY);
        filterListAssert.last()
                .isSameAs(UnsupportedHttpMethodFilter.GET_ONLY);
    }

    @Test
    void shouldRespondWith404ForRequestsManagementServer() throws IOException {
        shouldRespondWithStatusCode("/", 404);
    }

    @Test
    void shouldRespondWith200ForLivezWhileRunning() throws IOException {
        shouldRespondWithStatusCode(WebhookMain.HTTP_PATH_LIVEZ, 200);
    }

    @Test
    void shouldReportNotLiveOnceWebhookServerStops() {
        // Given
        webhookMain.start();

        // When
        webhookMain.webhookServer().stop();

        // Then
        assertThat(webhookMain.livezStatusCode()).isEqualTo(503);
    }

    private void shouldRespondWithStatusCode(
                                             String path,
                                             int statusCode)
            throws IOException {
        // Given
        final ArgumentCaptor<HttpHandler> captor = ArgumentCaptor.forClass(HttpHandler.class);
        when(managementServer.createContext(eq(path), captor.capture())).thenReturn(httpContext);
        webhookMain.start();
        final HttpExchange httpExchange = mock(HttpExchange.class);

        // When
        captor.getValue().handle(httpExchange);

        // Then
        verify(httpExchange).sendResponseHeaders(statusCode, -1);
    }

    @Test
    @RestoreSystemProperties
    @ClearSystemProperty(key = "sun.net.httpserver.maxReqTime")
    @ClearSystemProperty(key = "sun.net.httpserver.maxRspTime")
    void shouldApplyDefaultManagementServerTimeouts() throws IOException {
        // When
        HttpServer server = WebhookMain.createHttpServer(CONFIG);
        server.stop(0);

        // Then
        assertThat(System.getProperty("sun.net.httpserver.maxReqTime")).isEqualTo("60");
        assertThat(System.getProperty("sun.net.httpserver.maxRspTime")).isEqualTo("120");
    }

    @Test
    @RestoreSystemProperties
    @SetSystemProperty(key = "sun.net.httpserver.maxReqTime", value = "5")
    @SetSystemProperty(key = "sun.net.httpserver.maxRspTime", value = "10")
    void shouldKeepConfiguredManagementServerTimeouts() throws IOException {
        // When
        HttpServer server = WebhookMain.createHttpServer(CONFIG);
        server.stop(0);

        // Then
        assertThat(System.getProperty("sun.net.httpserver.maxReqTime")).isEqualTo("5");
        assertThat(System.getProperty("sun.net.httpserver.maxRspTime")).isEqualTo("10");
    }
}
