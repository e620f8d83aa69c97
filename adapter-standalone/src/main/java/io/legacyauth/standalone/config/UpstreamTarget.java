package io.legacyauth.standalone.config;

import java.util.Objects;

/**
 * The single backend every request is forwarded to, given as {@code host:port}.
 *
 * <p>
 * IPv6 literals are written in brackets ({@code [::1]:8080}); the brackets are
 * kept in {@link #host()} so {@link #authority()} can be dropped straight into
 * a URI.
 *
 * @param host hostname, IPv4 literal, or bracketed IPv6 literal
 * @param port TCP port, 1..65535
 */
public record UpstreamTarget(String host, int port) {

    public UpstreamTarget {
        Objects.requireNonNull(host, "host must not be null");
        if (host.isBlank()) {
            throw new ConfigLoadException("Upstream host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new ConfigLoadException("Upstream port out of range (1-65535): " + port);
        }
    }

    /**
     * Parses a {@code host:port} string.
     *
     * @param value the configured value, surrounding whitespace ignored
     * @return the parsed target
     * @throws ConfigLoadException if the value is blank or not {@code host:port}
     */
    public static UpstreamTarget parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigLoadException("Missing required configuration: upstream (host:port)");
        }
        String trimmed = value.trim();
        if (trimmed.contains("://") || trimmed.contains("/")) {
            throw new ConfigLoadException("Upstream must be host:port without scheme or path: " + trimmed);
        }

        String host;
        String portText;
        if (trimmed.startsWith("[")) {
            int close = trimmed.indexOf(']');
            if (close < 0 || close + 1 >= trimmed.length() || trimmed.charAt(close + 1) != ':') {
                throw new ConfigLoadException("Malformed upstream, expected [ipv6]:port: " + trimmed);
            }
            host = trimmed.substring(0, close + 1);
            portText = trimmed.substring(close + 2);
        } else {
            int colon = trimmed.lastIndexOf(':');
            if (colon <= 0 || trimmed.indexOf(':') != colon) {
                throw new ConfigLoadException("Malformed upstream, expected host:port: " + trimmed);
            }
            host = trimmed.substring(0, colon);
            portText = trimmed.substring(colon + 1);
        }

        int port;
        try {
            port = Integer.parseInt(portText);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Malformed upstream port: " + trimmed, e);
        }
        return new UpstreamTarget(host, port);
    }

    /** {@code host:port}, suitable for the authority part of an http URI. */
    public String authority() {
        return host + ":" + port;
    }

    @Override
    public String toString() {
        return authority();
    }
}
