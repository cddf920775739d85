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
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.promfed.proxy.client.BackendCallException;
import io.promfed.proxy.client.BackendResponseException;
import io.promfed.proxy.client.BackendTimeoutException;
import io.promfed.proxy.client.QueryClient;
import io.promfed.proxy.internal.Futures;
import io.promfed.proxy.internal.client.aggregator.QueryValueAggregator;
import io.promfed.proxy.model.LabelMatcher;
import io.promfed.proxy.model.LabelSet;
import io.promfed.proxy.model.Matrix;
import io.promfed.proxy.model.QueryValue;
import io.promfed.proxy.model.Sample;
import io.promfed.proxy.model.SamplePair;
import io.promfed.proxy.model.SampleStream;
import io.promfed.proxy.model.Selectors;
import io.promfed.proxy.model.Vector;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Answers the query engine from one snapshot of the backends.
 * <p>
 * Calls block for at most the query timeout, after which the backend calls are cancelled.
 * Failures are rethrown as the error the backend or transport raised, without the layers of
 * context the client stack wraps them in.
 * </p>
 */
public class ProxyQuerier implements Querier {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProxyQuerier.class);

    private final QueryClient client;
    private final Instant start;
    private final Instant end;
    private final Duration timeout;

    public ProxyQuerier(QueryClient client, Instant start, Instant end, Duration timeout) {
        this.client = Objects.requireNonNull(client);
        this.start = Objects.requireNonNull(start);
        this.end = Objects.requireNonNull(end);
        this.timeout = Objects.requireNonNull(timeout);
    }

    @Override
    public SeriesSet select(@Nullable SelectHints hints, List<LabelMatcher> matchers) {
        long startNanos = System.nanoTime();
        try {
            if (hints == null) {
                // only the labels are needed
                List<LabelSet> series = await("series", client.series(List.of(Selectors.toSelector(matchers)), start, end));
                var result = new ArrayList<Series>(series.size());
                for (LabelSet labels : series) {
                    result.add(new ListSeries(labels, List.of()));
                }
                return new ListSeriesSet(result);
            }
            return toSeriesSet(await("getValue", client.getValue(hints.start(), hints.end(), matchers)));
        }
        finally {
            LOGGER.debug("select matchers={} hints={} took={}", matchers, hints, Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    @Override
    public List<String> labelValues(String name) {
        long startNanos = System.nanoTime();
        try {
            return await("labelValues", client.labelValues(name));
        }
        finally {
            LOGGER.debug("labelValues name={} took={}", name, Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    @Override
    public List<String> labelNames() {
        throw new UnsupportedOperationException("Not implemented");
    }

    @Override
    public void close() {
        // nothing is held between calls
    }

    static SeriesSet toSeriesSet(QueryValue value) {
        Matrix matrix;
        if (value instanceof Matrix m) {
            matrix = m;
        }
        else if (value instanceof Vector vector) {
            var streams = new ArrayList<SampleStream>(vector.samples().size());
            for (Sample sample : vector.samples()) {
                streams.add(new SampleStream(sample.metric(), List.of(new SamplePair(sample.timestamp(), sample.value()))));
            }
            matrix = new Matrix(streams);
        }
        else {
            throw new BackendResponseException(200, null, "expected a matrix or vector, got a " + value.type().wireName());
        }
        // same series and point merge as across backends
        var merged = (Matrix) QueryValueAggregator.MATRIX.aggregate(List.of(matrix));
        var result = new ArrayList<Series>(merged.streams().size());
        for (SampleStream stream : merged.streams()) {
            result.add(new ListSeries(stream.metric(), stream.values()));
        }
        return new ListSeriesSet(result);
    }

    private <T> T await(String call, CompletionStage<T> stage) {
        CompletableFuture<T> future = stage.toCompletableFuture();
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            throw new BackendTimeoutException(call + " did not complete within " + timeout);
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            var cancelled = new CancellationException(call + " was interrupted");
            cancelled.initCause(e);
            throw cancelled;
        }
        catch (ExecutionException e) {
            throw rethrow(Futures.rootCause(e));
        }
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        if (cause instanceof IOException ioException) {
            return new UncheckedIOException(ioException);
        }
        return new BackendCallException(String.valueOf(cause.getMessage()), cause);
    }
}
