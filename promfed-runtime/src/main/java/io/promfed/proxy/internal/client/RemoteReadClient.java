/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.client;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.handler.codec.http.HttpMethod;

import io.promfed.proxy.client.BackendResponseException;
import io.promfed.proxy.client.QueryClient;
import io.promfed.proxy.internal.Futures;
import io.promfed.proxy.internal.net.HttpTransport;
import io.promfed.proxy.internal.net.TransportRequest;
import io.promfed.proxy.internal.net.TransportResponse;
import io.promfed.proxy.internal.remote.RemoteReadCodec;
import io.promfed.proxy.model.LabelMatcher;
import io.promfed.proxy.model.LabelSet;
import io.promfed.proxy.model.QueryRange;
import io.promfed.proxy.model.QueryValue;

/**
 * Loads raw samples over the remote read protocol. Every other call goes through the query API.
 */
public class RemoteReadClient implements QueryClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteReadClient.class);

    public static final Duration REMOTE_READ_TIMEOUT = Duration.ofMinutes(2);
    static final String READ_PATH = "/api/v1/read";

    private final String target;
    private final URI readUri;
    private final HttpTransport transport;
    private final QueryClient queryApi;

    public RemoteReadClient(String target, URI baseUri, HttpTransport transport, QueryClient queryApi) {
        this.target = Objects.requireNonNull(target);
        String base = baseUri.toString();
        this.readUri = URI.create((base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + READ_PATH);
        this.transport = Objects.requireNonNull(transport);
        this.queryApi = Objects.requireNonNull(queryApi);
    }

    @Override
    public CompletionStage<QueryValue> getValue(Instant start, Instant end, List<LabelMatcher> matchers) {
        var request = new TransportRequest(HttpMethod.POST, readUri,
                Map.of("Content-Type", RemoteReadCodec.CONTENT_TYPE,
                        "Content-Encoding", RemoteReadCodec.CONTENT_ENCODING,
                        RemoteReadCodec.VERSION_HEADER, RemoteReadCodec.VERSION),
                RemoteReadCodec.encodeRequest(start, end, matchers),
                REMOTE_READ_TIMEOUT);
        LOGGER.debug("Sending remote read {} to {}", matchers, target);
        CompletableFuture<TransportResponse> exchange = transport.send(request);
        return Futures.propagateCancellation(exchange.thenApply(RemoteReadClient::decode), exchange);
    }

    private static QueryValue decode(TransportResponse response) {
        if (!response.isSuccess()) {
            String body = response.bodyAsString().strip();
            throw new BackendResponseException(response.status(), null,
                    "remote read failed with HTTP " + response.status() + (body.isEmpty() ? "" : ": " + body));
        }
        try {
            return RemoteReadCodec.decodeResponse(response.body());
        }
        catch (IOException e) {
            throw new BackendResponseException(response.status(), "cannot decode remote read response: " + e.getMessage(), e);
        }
    }

    @Override
    public CompletionStage<QueryValue> query(String query, Instant time) {
        return queryApi.query(query, time);
    }

    @Override
    public CompletionStage<QueryValue> queryRange(String query, QueryRange range) {
        return queryApi.queryRange(query, range);
    }

    @Override
    public CompletionStage<List<String>> labelValues(String label) {
        return queryApi.labelValues(label);
    }

    @Override
    public CompletionStage<List<LabelSet>> series(List<String> matchers, Instant start, Instant end) {
        return queryApi.series(matchers, start, end);
    }

    @Override
    public String toString() {
        return "RemoteReadClient{" + target + "}";
    }
}
