/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.net;

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import io.netty.handler.codec.http.HttpMethod;

/**
 * A request to one backend.
 *
 * @param method HTTP method
 * @param uri absolute URI, including any query string
 * @param headers extra request headers
 * @param body request body, empty for none
 * @param timeout time allowed for the whole exchange, once a connection has been acquired
 */
public record TransportRequest(HttpMethod method, URI uri, Map<String, String> headers, byte[] body, Duration timeout) {

    public TransportRequest {
        Objects.requireNonNull(method);
        Objects.requireNonNull(uri);
        headers = Map.copyOf(headers);
        Objects.requireNonNull(body);
        Objects.requireNonNull(timeout);
        if (!uri.isAbsolute() || uri.getHost() == null) {
            throw new IllegalArgumentException("not an absolute URI with a host: " + uri);
        }
    }

    public static TransportRequest get(URI uri, Duration timeout) {
        return new TransportRequest(HttpMethod.GET, uri, Map.of(), new byte[0], timeout);
    }

    public static TransportRequest post(URI uri, String contentType, byte[] body, Duration timeout) {
        return new TransportRequest(HttpMethod.POST, uri, Map.of("Content-Type", contentType), body, timeout);
    }

    public TransportRequest withHeaders(Map<String, String> extraHeaders) {
        var merged = new HashMap<>(headers);
        merged.putAll(extraHeaders);
        return new TransportRequest(method, uri, merged, body, timeout);
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }
}
