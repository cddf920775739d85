/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.net;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A complete response of a backend.
 *
 * @param status HTTP status code
 * @param headers response headers, names in lower case
 * @param body response body, already decompressed if the backend used a content encoding
 */
public record TransportResponse(int status, Map<String, String> headers, byte[] body) {

    public TransportResponse {
        headers = Map.copyOf(headers);
    }

    @Nullable
    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "TransportResponse{status=" + status + ", bodyLength=" + body.length + "}";
    }
}
