/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.http;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.security.GeneralSecurityException;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import javax.net.ssl.KeyManager;
import javax.net.ssl.SSLContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpsConfigurator;
import com.sun.net.httpserver.HttpsServer;

import io.storageaccessor.kubernetes.webhook.WebhookConfig;
import io.storageaccessor.kubernetes.webhook.management.UnsupportedHttpMethodFilter;
import io.storageaccessor.kubernetes.webhook.tls.CertificateSource;
import io.storageaccessor.kubernetes.webhook.tls.CertificateSourceKeyManager;

/**
 * The HTTPS server the API server sends AdmissionReviews to. The server certificate is obtained from a
 * {@link CertificateSource} during every handshake, the server itself holds no key material.
 */
public class WebhookServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookServer.class);

    private final HttpsServer server;
    private final ExecutorService executor;
    private final AtomicBoolean stopped = new AtomicBoolean();
    private volatile boolean running;

    private WebhookServer(HttpsServer server, ExecutorService executor) {
        this.server = server;
        this.executor = executor;
    }

    public static WebhookServer create(WebhookConfig config, CertificateSource certificateSource, HttpHandler admissionHandler) throws IOException {
        Objects.requireNonNull(config);
        Objects.requireNonNull(certificateSource);
        Objects.requireNonNull(admissionHandler);
        HttpsServer server = HttpsServer.create(config.bindAddress().toSocketAddress(), 0);
        server.setHttpsConfigurator(new HttpsConfigurator(sslContext(certificateSource)));
        server.createContext(config.webhookPath(), admissionHandler).getFilters().add(UnsupportedHttpMethodFilter.POST_ONLY);
        ExecutorService executor = Executors.newFixedThreadPool(config.threads(), new WorkerThreadFactory());
        server.setExecutor(executor);
        return new WebhookServer(server, executor);
    }

    private static SSLContext sslContext(CertificateSource certificateSource) {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(new KeyManager[]{ new CertificateSourceKeyManager(certificateSource) }, null, null);
            return context;
        }
        catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialise TLS", e);
        }
    }

    public void start() {
        server.start();
        running = true;
        LOGGER.info("Webhook server listening on {}", address());
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        running = false;
        server.stop(0);
        executor.shutdown();
        LOGGER.info("Webhook server stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return the address bound, with the actual port if the configured port was 0
     */
    public InetSocketAddress address() {
        return server.getAddress();
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "webhook-worker-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
