package com.sluice.model;

import java.util.Locale;
import java.util.Set;

public record ProxyEndpoint(String scheme, String host, int port) {

    private static final String DEFAULT_SCHEME = "http";
    private static final Set<String> SUPPORTED_SCHEMES = Set.of("http", "https");

    public ProxyEndpoint {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Proxy host is required");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Proxy port out of range: " + port);
        }
        scheme = scheme == null || scheme.isBlank() ? DEFAULT_SCHEME : scheme.toLowerCase(Locale.ROOT);
        if (!SUPPORTED_SCHEMES.contains(scheme)) {
            throw new IllegalArgumentException("Unsupported proxy scheme: " + scheme);
        }
        host = host.trim().toLowerCase(Locale.ROOT);
    }

    public static ProxyEndpoint of(String host, int port) {
        return new ProxyEndpoint(DEFAULT_SCHEME, host, port);
    }

    public static ProxyEndpoint parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Proxy address is empty");
        }
        String remaining = value.trim();
        String scheme = DEFAULT_SCHEME;
        int schemeEnd = remaining.indexOf("://");
        if (schemeEnd >= 0) {
            scheme = remaining.substring(0, schemeEnd);
            remaining = remaining.substring(schemeEnd + 3);
        }
        if (remaining.endsWith("/")) {
            remaining = remaining.substring(0, remaining.length() - 1);
        }
        int colon = remaining.lastIndexOf(':');
        if (colon <= 0 || colon == remaining.length() - 1) {
            throw new IllegalArgumentException("Proxy address must be host:port, got '" + value + "'");
        }
        String host = remaining.substring(0, colon);
        int port;
        try {
            port = Integer.parseInt(remaining.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid proxy port in '" + value + "'", e);
        }
        return new ProxyEndpoint(scheme, host, port);
    }

    public String address() {
        return host + ":" + port;
    }

    @Override
    public String toString() {
        return scheme + "://" + address();
    }
}
