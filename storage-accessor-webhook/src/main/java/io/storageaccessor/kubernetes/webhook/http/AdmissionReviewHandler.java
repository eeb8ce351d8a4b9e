/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.http;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import io.storageaccessor.kubernetes.webhook.admission.AdmissionOutcome;
import io.storageaccessor.kubernetes.webhook.admission.ClaimAdmissionHandler;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Serves the validating webhook endpoint: decodes an AdmissionReview, obtains a decision from the
 * {@link ClaimAdmissionHandler} and writes the AdmissionReview response.
 * <p>
 * Requests that are not a well-formed JSON AdmissionReview of a supported version receive
 * {@code 400 Bad Request}. Failures inside the webhook receive {@code 500 Internal Server Error}.
 * Every decision, whether to allow or deny, is a {@code 200 OK}.
 */
public class AdmissionReviewHandler implements HttpHandler {

    static final String APPLICATION_JSON = "application/json";
    private static final String CONTENT_TYPE = "Content-Type";
    private static final Logger LOGGER = LoggerFactory.getLogger(AdmissionReviewHandler.class);

    private final ClaimAdmissionHandler claimAdmissionHandler;
    private final ObjectMapper mapper;
    private final AdmissionMetrics metrics;

    public AdmissionReviewHandler(ClaimAdmissionHandler claimAdmissionHandler, ObjectMapper mapper, AdmissionMetrics metrics) {
        this.claimAdmissionHandler = Objects.requireNonNull(claimAdmissionHandler);
        this.mapper = Objects.requireNonNull(mapper);
        this.metrics = Objects.requireNonNull(metrics);
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try (exchange) {
            byte[] response;
            try {
                response = review(exchange);
            }
            catch (BadAdmissionReviewException e) {
                LOGGER.warn("Rejecting AdmissionReview from {}: {}", exchange.getRemoteAddress(), e.getMessage());
                metrics.badRequest();
                sendText(exchange, 400, e.getMessage());
                return;
            }
            catch (IOException | RuntimeException e) {
                LOGGER.error("Failed to handle AdmissionReview from {}", exchange.getRemoteAddress(), e);
                metrics.internalError();
                sendText(exchange, 500, "internal error handling AdmissionReview");
                return;
            }
            exchange.getResponseHeaders().set(CONTENT_TYPE, APPLICATION_JSON);
            exchange.sendResponseHeaders(200, response.length);
            try (OutputStream body = exchange.getResponseBody()) {
                body.write(response);
            }
        }
    }

    private byte[] review(HttpExchange exchange) throws IOException, BadAdmissionReviewException {
        requireJson(exchange.getRequestHeaders().getFirst(CONTENT_TYPE));
        byte[] body = exchange.getRequestBody().readAllBytes();
        if (body.length == 0) {
            throw new BadAdmissionReviewException("request body is empty");
        }
        JsonNode envelope = parse(body);
        AdmissionReviewVersion version = AdmissionReviewVersion.of(envelope)
                .orElseThrow(() -> new BadAdmissionReviewException("unsupported AdmissionReview: apiVersion="
                        + envelope.path("apiVersion").asText("") + " kind=" + envelope.path("kind").asText("")));
        DecodedReview review = version.decode((ObjectNode) envelope, mapper);
        AdmissionOutcome outcome = claimAdmissionHandler.decide(review.request(), review.object());
        metrics.decided(outcome);
        return review.version().encode(review.request().getUid(), outcome, mapper);
    }

    private JsonNode parse(byte[] body) throws BadAdmissionReviewException {
        JsonNode envelope;
        try {
            envelope = mapper.readTree(body);
        }
        catch (JsonProcessingException e) {
            throw new BadAdmissionReviewException("request body is not well-formed JSON: " + e.getOriginalMessage());
        }
        catch (IOException e) {
            throw new BadAdmissionReviewException("request body could not be read as JSON: " + e.getMessage());
        }
        if (envelope == null || !envelope.isObject()) {
            throw new BadAdmissionReviewException("request body is not a JSON object");
        }
        return envelope;
    }

    private static void requireJson(@Nullable String contentType) throws BadAdmissionReviewException {
        if (contentType == null) {
            throw new BadAdmissionReviewException("missing " + CONTENT_TYPE + ", expected " + APPLICATION_JSON);
        }
        String mediaType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        if (!APPLICATION_JSON.equals(mediaType)) {
            throw new BadAdmissionReviewException("unsupported " + CONTENT_TYPE + " " + contentType + ", expected " + APPLICATION_JSON);
        }
    }

    private static void sendText(HttpExchange exchange, int statusCode, String message) throws IOException {
        if (exchange.getResponseCode() != -1) {
            // headers already sent, nothing more can be said to the client
            return;
        }
        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set(CONTENT_TYPE, "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream body = exchange.getResponseBody()) {
            body.write(bytes);
        }
    }
}
