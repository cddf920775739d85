/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.querier;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.promfed.proxy.client.BackendCallException;
import io.promfed.proxy.client.BackendResponseException;
import io.promfed.proxy.client.BackendTimeoutException;
import io.promfed.proxy.client.MergeException;
import io.promfed.proxy.client.NotReadyException;
import io.promfed.proxy.client.QueryClient;
import io.promfed.proxy.client.TargetCallException;
import io.promfed.proxy.internal.client.aggregator.QueryValueAggregator;
import io.promfed.proxy.model.LabelMatcher;
import io.promfed.proxy.model.LabelSet;
import io.promfed.proxy.model.Matrix;
import io.promfed.proxy.model.QueryValue;
import io.promfed.proxy.model.Sample;
import io.promfed.proxy.model.SamplePair;
import io.promfed.proxy.model.SampleStream;
import io.promfed.proxy.model.Scalar;
import io.promfed.proxy.model.Vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProxyQuerierTest {

    private static final Instant START = Instant.ofEpochSecond(1_700_000_000L);
    private static final Instant END = START.plusSeconds(3600);
    private static final LabelSet API = LabelSet.of("__name__", "up", "job", "api");
    private static final LabelSet WEB = LabelSet.of("__name__", "up", "job", "web");
    private static final List<LabelMatcher> UP = List.of(LabelMatcher.equal("__name__", "up"));

    @Mock
    private QueryClient client;

    @Test
    void shouldSelectLabelsOnlyWithoutHints() {
        when(client.series(List.of("{__name__=\"up\"}"), START, END)).thenReturn(CompletableFuture.completedFuture(List.of(WEB, API)));
        var querier = new ProxyQuerier(client, START, END, Duration.ofSeconds(5));

        SeriesSet set = querier.select(null, UP);

        assertThat(set).isInstanceOfSatisfying(ListSeriesSet.class,
                listSet -> assertThat(listSet.series()).allSatisfy(series -> assertThat(series.iterator().next()).isFalse()));
        assertThat(labelsOf(set)).containsExactly(API, WEB);
        verify(client).series(List.of("{__name__=\"up\"}"), START, END);
        verifyNoMoreInteractions(client);
    }

    @Test
    void shouldSelectSamplesForHintedRange() {
        Instant hintStart = END.minusSeconds(300);
        QueryValue matrix = new Matrix(List.of(
                new SampleStream(WEB, List.of(new SamplePair(2000, 2))),
                new SampleStream(API, List.of(new SamplePair(1000, 1), new SamplePair(2000, 2)))));
        when(client.getValue(hintStart, END, UP)).thenReturn(CompletableFuture.completedFuture(matrix));
        var querier = new ProxyQuerier(client, START, END, Duration.ofSeconds(5));

        SeriesSet set = querier.select(new SelectHints(hintStart, END), UP);

        assertThat(set.next()).isTrue();
        assertThat(set.at()).isEqualTo(new ListSeries(API, List.of(new SamplePair(1000, 1), new SamplePair(2000, 2))));
        assertThat(set.next()).isTrue();
        assertThat(set.at().labels()).isEqualTo(WEB);
        assertThat(set.next()).isFalse();
    }

    @Test
    void shouldConvertVectorToSingleSampleSeries() {
        SeriesSet set = ProxyQuerier.toSeriesSet(new Vector(List.of(new Sample(API, 1, 1000))));

        assertThat(set.next()).isTrue();
        assertThat(set.at()).isEqualTo(new ListSeries(API, List.of(new SamplePair(1000, 1))));
    }

    @Test
    void shouldKeepEarliestSampleLikeBackendMerge() {
        var vector = new Vector(List.of(new Sample(WEB, 2, 1000), new Sample(API, 1, 1000), new Sample(API, 10, 1000)));
        var matrix = (Matrix) QueryValueAggregator.MATRIX.aggregate(List.of(
                new Matrix(List.of(new SampleStream(API, List.of(new SamplePair(1000, 1))))),
                new Matrix(List.of(new SampleStream(API, List.of(new SamplePair(1000, 10)))))));

        SeriesSet set = ProxyQuerier.toSeriesSet(vector);

        assertThat(set.next()).isTrue();
        assertThat(set.at()).isEqualTo(new ListSeries(API, matrix.streams().get(0).values()));
        assertThat(set.next()).isTrue();
        assertThat(set.at()).isEqualTo(new ListSeries(WEB, List.of(new SamplePair(1000, 2))));
        assertThat(set.next()).isFalse();
    }

    @Test
    void shouldMergeDuplicateSeriesOfMatrix() {
        SeriesSet set = ProxyQuerier.toSeriesSet(new Matrix(List.of(
                new SampleStream(API, List.of(new SamplePair(3000, 3), new SamplePair(1000, 1))),
                new SampleStream(API, List.of(new SamplePair(2000, 2), new SamplePair(3000, 30))))));

        assertThat(set.next()).isTrue();
        assertThat(set.at()).isEqualTo(new ListSeries(API, List.of(new SamplePair(1000, 1), new SamplePair(2000, 2), new SamplePair(3000, 3))));
        assertThat(set.next()).isFalse();
    }

    @Test
    void shouldRejectScalarResult() {
        assertThatThrownBy(() -> ProxyQuerier.toSeriesSet(new Scalar(1, 1000)))
                .isInstanceOf(BackendResponseException.class)
                .hasMessageContaining("scalar");
    }

    @Test
    void shouldAnswerLabelValues() {
        when(client.labelValues("job")).thenReturn(CompletableFuture.completedFuture(List.of("api", "web")));

        assertThat(new ProxyQuerier(client, START, END, Duration.ofSeconds(5)).labelValues("job")).containsExactly("api", "web");
    }

    @Test
    void shouldCancelCallThatTimesOut() {
        var pending = new CompletableFuture<List<String>>();
        when(client.labelValues("job")).thenReturn(pending);
        var querier = new ProxyQuerier(client, START, END, Duration.ofMillis(50));

        assertThatThrownBy(() -> querier.labelValues("job"))
                .isInstanceOf(BackendTimeoutException.class)
                .hasMessageContaining("labelValues");
        assertThat(pending).isCancelled();
    }

    @Test
    void shouldCancelCallWhenInterrupted() {
        var pending = new CompletableFuture<List<String>>();
        when(client.labelValues("job")).thenReturn(pending);
        var querier = new ProxyQuerier(client, START, END, Duration.ofSeconds(30));

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> querier.labelValues("job"))
                    .isInstanceOf(CancellationException.class)
                    .hasCauseInstanceOf(InterruptedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
            assertThat(pending).isCancelled();
        }
        finally {
            Thread.interrupted();
        }
    }

    @Test
    void shouldThrowErrorRaisedByBackend() {
        var backendError = new BackendResponseException(422, "execution", "query processing would load too many samples");
        var failure = new TargetCallException("prom-1:9090", "label_values", backendError);
        when(client.labelValues("job")).thenReturn(CompletableFuture.failedFuture(new MergeException(List.of(failure), 0, 0, null)));
        var querier = new ProxyQuerier(client, START, END, Duration.ofSeconds(5));

        assertThatThrownBy(() -> querier.labelValues("job")).isSameAs(backendError);
    }

    @Test
    void shouldThrowNotReadyUnchanged() {
        var notReady = new NotReadyException("server group 'eu' has no targets yet");
        when(client.labelValues("job")).thenReturn(CompletableFuture.failedFuture(notReady));

        assertThatThrownBy(() -> new ProxyQuerier(client, START, END, Duration.ofSeconds(5)).labelValues("job")).isSameAs(notReady);
    }

    @Test
    void shouldWrapCheckedFailures() {
        when(client.labelValues("io")).thenReturn(CompletableFuture.failedFuture(new IOException("connection reset")));
        when(client.labelValues("other")).thenReturn(CompletableFuture.failedFuture(new Exception("opaque")));
        var querier = new ProxyQuerier(client, START, END, Duration.ofSeconds(5));

        assertThatThrownBy(() -> querier.labelValues("io"))
                .isInstanceOf(UncheckedIOException.class)
                .hasRootCauseMessage("connection reset");
        assertThatThrownBy(() -> querier.labelValues("other"))
                .isInstanceOf(BackendCallException.class)
                .hasMessage("opaque");
    }

    @Test
    void shouldNotListLabelNames() {
        var querier = new ProxyQuerier(client, START, END, Duration.ofSeconds(5));

        assertThatThrownBy(querier::labelNames).isInstanceOf(UnsupportedOperationException.class);
        querier.close();
        querier.close();
    }

    @Test
    void shouldBindQuerierToCurrentSnapshot() {
        SnapshotSource source = () -> client;
        when(client.labelValues("job")).thenReturn(CompletableFuture.completedFuture(List.of("api")));

        try (Querier querier = new ProxyQueryable(source, Duration.ofSeconds(5)).querier(START, END)) {
            assertThat(querier.labelValues("job")).containsExactly("api");
        }
    }

    @Test
    void shouldNotHandOutQuerierBeforeReady() {
        SnapshotSource source = () -> {
            throw new NotReadyException("server group 'eu' has no targets yet");
        };

        assertThatThrownBy(() -> new ProxyQueryable(source, Duration.ofSeconds(5)).querier(START, END)).isInstanceOf(NotReadyException.class);
    }

    private static List<LabelSet> labelsOf(SeriesSet set) {
        var labels = new ArrayList<LabelSet>();
        while (set.next()) {
            labels.add(set.at().labels());
        }
        return labels;
    }
}
