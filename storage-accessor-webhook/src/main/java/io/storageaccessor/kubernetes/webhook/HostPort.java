/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Represents a host port pair.
 *
 * @param host host name
 * @param port port number.
 */
public record HostPort(String host, int port) {
    private static final Pattern IPV6_WITH_PORT = Pattern.compile("^\\[(.+)]:(.+)$");
    private static final Pattern PORT_SEPARATOR = Pattern.compile(":");

    public HostPort {
        Objects.requireNonNull(host, "host cannot be null");
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    /**
     * Parses a host port pair from a string representation.
     * <p>
     * For the host part, symbolic hostname, FQDN, IPv4, and IPv6 forms are supported.  In the case of IPv6,
     * the notation specified by <a href="https://www.rfc-editor.org/rfc/rfc4038#section-5.1">rfc4038</a> must be used.
     * For the port part, it must be numeric.
     *
     * @param address stringified form of the host port, separated by colon (:).
     * @return a {@link HostPort}
     */
    public static HostPort parse(String address) {
        var exceptionText = "unexpected address formation '%s'. Valid formations are 'host:8443', 'host.example.com:8443', or '[::1]:8443'".formatted(address);

        if (address == null) {
            throw new IllegalArgumentException(exceptionText);
        }

        var ipv6Match = IPV6_WITH_PORT.matcher(address);
        if (ipv6Match.matches()) {
            return new HostPort(ipv6Match.group(1), parsePort(exceptionText, ipv6Match.group(2)));
        }
        var split = PORT_SEPARATOR.split(address);
        if (split.length != 2 || split[0].isBlank()) {
            throw new IllegalArgumentException(exceptionText);
        }
        return new HostPort(split[0], parsePort(exceptionText, split[1]));
    }

    private static int parsePort(String exceptionText, String group) {
        try {
            int port = Integer.parseInt(group);
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException(exceptionText);
            }
            return port;
        }
        catch (NumberFormatException nfe) {
            throw new IllegalArgumentException(exceptionText, nfe);
        }
    }
}
