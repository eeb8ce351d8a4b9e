/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.management;

import java.io.IOException;
import java.util.Objects;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;

/**
 * Rejects every HTTP request that does not use the single method an endpoint supports.
 * <p>
 * Rejected requests receive a <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/405">405 Method Not Allowed</a>
 * response naming the supported method in the <code>Allow</code> header. Requests using the supported method continue down the chain.
 */
public class UnsupportedHttpMethodFilter extends Filter {

    public static final Filter GET_ONLY = new UnsupportedHttpMethodFilter("GET");
    public static final Filter POST_ONLY = new UnsupportedHttpMethodFilter("POST");

    private final String allowedMethod;

    private UnsupportedHttpMethodFilter(String allowedMethod) {
        this.allowedMethod = Objects.requireNonNull(allowedMethod);
    }

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        final String requestMethod = exchange.getRequestMethod();
        if (allowedMethod.equalsIgnoreCase(requestMethod)) {
            chain.doFilter(exchange);
        }
        else {
            try (exchange) {
                // note while the JDK docs advise exchange.getRequestBody().transferTo(OutputStream.nullOutputStream()); we explicitly don't do that!
                // As a denial-of-service protection we don't read input we are going to reject.
                exchange.getResponseHeaders().add("Allow", allowedMethod);
                exchange.sendResponseHeaders(405, -1);
            }
        }
    }

    @Override
    public String description() {
        return "Rejects methods other than " + allowedMethod;
    }
}
