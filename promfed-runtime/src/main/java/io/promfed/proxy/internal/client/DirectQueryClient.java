/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.client;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.promfed.proxy.client.QueryClient;
import io.promfed.proxy.internal.Futures;
import io.promfed.proxy.internal.net.HttpTransport;
import io.promfed.proxy.internal.net.TransportRequest;
import io.promfed.proxy.internal.net.TransportResponse;
import io.promfed.proxy.model.LabelMatcher;
import io.promfed.proxy.model.LabelSet;
import io.promfed.proxy.model.PromDurations;
import io.promfed.proxy.model.QueryRange;
import io.promfed.proxy.model.QueryValue;
import io.promfed.proxy.model.Selectors;

/**
 * Talks to a single backend through the Prometheus HTTP query API.
 */
public class DirectQueryClient implements QueryClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(DirectQueryClient.class);

    static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

    private final String target;
    private final String baseUri;
    private final HttpTransport transport;
    private final Duration timeout;

    /**
     * @param target name of the backend in logs and errors
     * @param baseUri scheme, authority and path prefix of the backend
     * @param transport transport of the owning group
     * @param timeout timeout of each request
     */
    public DirectQueryClient(String target, URI baseUri, HttpTransport transport, Duration timeout) {
        this.target = Objects.requireNonNull(target);
        String base = baseUri.toString();
        this.baseUri = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.transport = Objects.requireNonNull(transport);
        this.timeout = Objects.requireNonNull(timeout);
    }

    /**
     * Selects the raw samples with a range selector covering {@code [start, end]}, evaluated at {@code end}.
     * <p>
     * The range is widened to the next whole second, so a sample stamped exactly at {@code start}
     * is kept by backends whose range selectors exclude their left bound.
     * </p>
     */
    @Override
    public CompletionStage<QueryValue> getValue(Instant start, Instant end, List<LabelMatcher> matchers) {
        Duration range = Duration.ofSeconds(Math.max(0, Duration.between(start, end).getSeconds()) + 1);
        return query(Selectors.toSelector(matchers) + "[" + PromDurations.format(range) + "]", end);
    }

    @Override
    public CompletionStage<QueryValue> query(String query, Instant time) {
        var form = new ArrayList<Map.Entry<String, String>>();
        form.add(Map.entry("query", query));
        form.add(Map.entry("time", seconds(time)));
        return post("/api/v1/query", form, PrometheusResponseParser::parseValue);
    }

    @Override
    public CompletionStage<QueryValue> queryRange(String query, QueryRange range) {
        var form = new ArrayList<Map.Entry<String, String>>();
        form.add(Map.entry("query", query));
        form.add(Map.entry("start", seconds(range.start())));
        form.add(Map.entry("end", seconds(range.end())));
        form.add(Map.entry("step", BigDecimal.valueOf(range.step().toMillis(), 3).toPlainString()));
        return post("/api/v1/query_range", form, PrometheusResponseParser::parseValue);
    }

    @Override
    public CompletionStage<List<String>> labelValues(String label) {
        URI uri = URI.create(baseUri + "/api/v1/label/" + URLEncoder.encode(label, StandardCharsets.UTF_8) + "/values");
        return send(TransportRequest.get(uri, timeout), PrometheusResponseParser::parseLabelValues);
    }

    @Override
    public CompletionStage<List<LabelSet>> series(List<String> matchers, Instant start, Instant end) {
        var form = new ArrayList<Map.Entry<String, String>>();
        for (String matcher : matchers) {
            form.add(Map.entry("match[]", matcher));
        }
        form.add(Map.entry("start", seconds(start)));
        form.add(Map.entry("end", seconds(end)));
        return post("/api/v1/series", form, PrometheusResponseParser::parseSeries);
    }

    private <T> CompletableFuture<T> post(String path, List<Map.Entry<String, String>> form, Function<TransportResponse, T> parser) {
        byte[] body = encodeForm(form).getBytes(StandardCharsets.UTF_8);
        return send(TransportRequest.post(URI.create(baseUri + path), FORM_CONTENT_TYPE, body, timeout), parser);
    }

    private <T> CompletableFuture<T> send(TransportRequest request, Function<TransportResponse, T> parser) {
        LOGGER.debug("Sending {} to {}", request, target);
        CompletableFuture<TransportResponse> exchange = transport.send(request);
        return Futures.propagateCancellation(exchange.thenApply(parser), exchange);
    }

    static String encodeForm(List<Map.Entry<String, String>> form) {
        var sb = new StringBuilder();
        for (Map.Entry<String, String> field : form) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(URLEncoder.encode(field.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(field.getValue(), StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    /**
     * Formats an instant as Unix seconds with millisecond precision.
     */
    static String seconds(Instant instant) {
        return BigDecimal.valueOf(instant.toEpochMilli(), 3).toPlainString();
    }

    @Override
    public String toString() {
        return "DirectQueryClient{" + target + "}";
    }
}
