/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.client;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.Test;

import io.netty.handler.codec.http.HttpMethod;

import io.promfed.proxy.client.BackendResponseException;
import io.promfed.proxy.internal.net.FakeTransport;
import io.promfed.proxy.internal.net.TransportRequest;
import io.promfed.proxy.internal.net.TransportResponse;
import io.promfed.proxy.model.LabelMatcher;
import io.promfed.proxy.model.LabelSet;
import io.promfed.proxy.model.Matrix;
import io.promfed.proxy.model.QueryRange;
import io.promfed.proxy.model.QueryValue;
import io.promfed.proxy.model.Sample;
import io.promfed.proxy.model.SamplePair;
import io.promfed.proxy.model.SampleStream;
import io.promfed.proxy.model.Scalar;
import io.promfed.proxy.model.StringValue;
import io.promfed.proxy.model.Vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectQueryClientTest {

    private static final URI BASE = URI.create("http://prom-1:9090/prometheus/");
    private static final Duration TIMEOUT = Duration.ofSeconds(30);
    private static final Instant NOW = Instant.ofEpochMilli(1_700_000_000_500L);

    private static final String VECTOR = """
            {"status":"success","data":{"resultType":"vector","result":[
              {"metric":{"__name__":"up","job":"api"},"value":[1700000000.5,"1"]}
            ]}}""";

    @Test
    void shouldPostInstantQuery() {
        var transport = FakeTransport.answering(FakeTransport.json(VECTOR));
        var client = new DirectQueryClient("prom-1:9090", BASE, transport, TIMEOUT);

        QueryValue value = client.query("up", NOW).toCompletableFuture().join();

        assertThat(value).isEqualTo(new Vector(List.of(new Sample(LabelSet.of("__name__", "up", "job", "api"), 1, 1_700_000_000_500L))));
        TransportRequest request = transport.lastRequest();
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.uri()).isEqualTo(URI.create("http://prom-1:9090/prometheus/api/v1/query"));
        assertThat(request.headers()).containsEntry("Content-Type", DirectQueryClient.FORM_CONTENT_TYPE);
        assertThat(request.timeout()).isEqualTo(TIMEOUT);
        assertThat(form(request)).containsExactly(Map.entry("query", "up"), Map.entry("time", "1700000000.500"));
    }

    @Test
    void shouldPostRangeQuery() {
        var transport = FakeTransport.answering(FakeTransport.json("""
                {"status":"success","data":{"resultType":"matrix","result":[
                  {"metric":{"job":"api"},"values":[[1700000000,"1"],[1700000015,"NaN"],[1700000030,"+Inf"]]}
                ]}}"""));
        var client = new DirectQueryClient("prom-1:9090", BASE, transport, TIMEOUT);
        var range = new QueryRange(Instant.ofEpochSecond(1_700_000_000L), Instant.ofEpochSecond(1_700_000_030L), Duration.ofSeconds(15));

        QueryValue value = client.queryRange("sum(rate(x[1m]))", range).toCompletableFuture().join();

        assertThat(value).isInstanceOfSatisfying(Matrix.class, matrix -> {
            assertThat(matrix.streams()).hasSize(1);
            SampleStream stream = matrix.streams().get(0);
            assertThat(stream.metric()).isEqualTo(LabelSet.of("job", "api"));
            assertThat(stream.values()).extracting(SamplePair::timestamp).containsExactly(1_700_000_000_000L, 1_700_000_015_000L, 1_700_000_030_000L);
            assertThat(stream.values().get(1).value()).isNaN();
            assertThat(stream.values().get(2).value()).isEqualTo(Double.POSITIVE_INFINITY);
        });
        TransportRequest request = transport.lastRequest();
        assertThat(request.uri().getPath()).isEqualTo("/prometheus/api/v1/query_range");
        assertThat(form(request)).containsExactly(
                Map.entry("query", "sum(rate(x[1m]))"),
                Map.entry("start", "1700000000.000"),
                Map.entry("end", "1700000030.000"),
                Map.entry("step", "15.000"));
    }

    @Test
    void shouldSelectRawSamplesWithRangeSelector() {
        var transport = FakeTransport.answering(FakeTransport.json("""
                {"status":"success","data":{"resultType":"matrix","result":[]}}"""));
        var client = new DirectQueryClient("prom-1:9090", BASE, transport, TIMEOUT);

        QueryValue value = client.getValue(NOW.minus(Duration.ofMinutes(5)), NOW,
                List.of(LabelMatcher.equal("__name__", "up"), LabelMatcher.regex("job", "api|web"))).toCompletableFuture().join();

        assertThat(value).isEqualTo(Matrix.EMPTY);
        assertThat(form(transport.lastRequest())).containsExactly(
                Map.entry("query", "{__name__=\"up\",job=~\"api|web\"}[5m1s]"),
                Map.entry("time", "1700000000.500"));
    }

    @Test
    void shouldWidenRangeToNextWholeSecond() {
        var transport = FakeTransport.answering(FakeTransport.json("""
                {"status":"success","data":{"resultType":"matrix","result":[]}}"""));
        var client = new DirectQueryClient("prom-1:9090", BASE, transport, TIMEOUT);
        var up = List.of(LabelMatcher.equal("__name__", "up"));

        client.getValue(NOW, NOW, up).toCompletableFuture().join();
        assertThat(form(transport.lastRequest())).contains(Map.entry("query", "{__name__=\"up\"}[1s]"));

        client.getValue(NOW.minusMillis(1500), NOW, up).toCompletableFuture().join();
        assertThat(form(transport.lastRequest())).contains(Map.entry("query", "{__name__=\"up\"}[2s]"));
    }

    @Test
    void shouldParseScalarAndString() {
        var transport = FakeTransport.answering(FakeTransport.json("""
                {"status":"success","data":{"resultType":"scalar","result":[1700000000.25,"42"]}}"""));
        var client = new DirectQueryClient("prom-1:9090", BASE, transport, TIMEOUT);

        assertThat(client.query("42", NOW).toCompletableFuture().join()).isEqualTo(new Scalar(42, 1_700_000_000_250L));

        transport.respondWith(request -> CompletableFuture.completedFuture(FakeTransport.json("""
                {"status":"success","data":{"resultType":"string","result":[1700000000,"hello"]}}""")));

        assertThat(client.query("\"hello\"", NOW).toCompletableFuture().join()).isEqualTo(new StringValue("hello", 1_700_000_000_000L));
    }

    @Test
    void shouldGetLabelValues() {
        var transport = FakeTransport.answering(FakeTransport.json("""
                {"status":"success","data":["api","web"]}"""));
        var client = new DirectQueryClient("prom-1:9090", BASE, transport, TIMEOUT);

        assertThat(client.labelValues("job").toCompletableFuture().join()).containsExactly("api", "web");
        TransportRequest request = transport.lastRequest();
        assertThat(request.method()).isEqualTo(HttpMethod.GET);
        assertThat(request.uri()).isEqualTo(URI.create("http://prom-1:9090/prometheus/api/v1/label/job/values"));
    }

    @Test
    void shouldPostSeriesSelectors() {
        var transport = FakeTransport.answering(FakeTransport.json("""
                {"status":"success","data":[{"__name__":"up","job":"api"},{"__name__":"up","job":"web"}]}"""));
        var client = new DirectQueryClient("prom-1:9090", BASE, transport, TIMEOUT);

        List<LabelSet> series = client.series(List.of("up", "process_start_time_seconds"), NOW.minusSeconds(60), NOW)
                .toCompletableFuture().join();

        assertThat(series).containsExactly(LabelSet.of("__name__", "up", "job", "api"), LabelSet.of("__name__", "up", "job", "web"));
        assertThat(form(transport.lastRequest())).containsExactly(
                Map.entry("match[]", "up"),
                Map.entry("match[]", "process_start_time_seconds"),
                Map.entry("start", "1699999940.500"),
                Map.entry("end", "1700000000.500"));
    }

    @Test
    void shouldSurfaceBackendError() {
        var transport = FakeTransport.answering(FakeTransport.json(400, """
                {"status":"error","errorType":"bad_data","error":"parse error at char 4"}"""));
        var client = new DirectQueryClient("prom-1:9090", BASE, transport, TIMEOUT);

        assertThatThrownBy(() -> client.query("up{", NOW).toCompletableFuture().join())
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOfSatisfying(BackendResponseException.class, e -> {
                    assertThat(e.statusCode()).isEqualTo(400);
                    assertThat(e.errorType()).isEqualTo("bad_data");
                    assertThat(e).hasMessage("parse error at char 4");
                });
    }

    @Test
    void shouldRejectResponseThatIsNotJson() {
        var transport = FakeTransport.answering(new TransportResponse(502, Map.of(), "Bad Gateway".getBytes(StandardCharsets.UTF_8)));
        var client = new DirectQueryClient("prom-1:9090", BASE, transport, TIMEOUT);

        assertThatThrownBy(() -> client.labelValues("job").toCompletableFuture().join())
                .cause()
                .isInstanceOfSatisfying(BackendResponseException.class, e -> assertThat(e.statusCode()).isEqualTo(502))
                .hasMessageContaining("Bad Gateway");
    }

    @Test
    void shouldRejectMalformedResult() {
        var transport = FakeTransport.answering(FakeTransport.json("""
                {"status":"success","data":{"resultType":"histogram","result":[]}}"""));
        var client = new DirectQueryClient("prom-1:9090", BASE, transport, TIMEOUT);

        assertThatThrownBy(() -> client.query("up", NOW).toCompletableFuture().join())
                .cause()
                .isInstanceOf(BackendResponseException.class)
                .hasMessageContaining("histogram");
    }

    @Test
    void shouldCancelExchangeWhenResultIsCancelled() {
        var exchange = new CompletableFuture<TransportResponse>();
        var transport = new FakeTransport(request -> exchange);
        var client = new DirectQueryClient("prom-1:9090", BASE, transport, TIMEOUT);

        client.query("up", NOW).toCompletableFuture().cancel(true);

        assertThat(exchange).isCancelled();
    }

    private static List<Map.Entry<String, String>> form(TransportRequest request) {
        var fields = new ArrayList<Map.Entry<String, String>>();
        for (String field : new String(request.body(), StandardCharsets.UTF_8).split("&")) {
            int eq = field.indexOf('=');
            fields.add(Map.entry(URLDecoder.decode(field.substring(0, eq), StandardCharsets.UTF_8),
                    URLDecoder.decode(field.substring(eq + 1), StandardCharsets.UTF_8)));
        }
        return fields;
    }
}
