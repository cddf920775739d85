/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.client;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import io.promfed.proxy.client.QueryClient;
import io.promfed.proxy.internal.Futures;
import io.promfed.proxy.model.LabelMatcher;
import io.promfed.proxy.model.LabelSet;
import io.promfed.proxy.model.Matrix;
import io.promfed.proxy.model.QueryRange;
import io.promfed.proxy.model.QueryValue;
import io.promfed.proxy.model.Sample;
import io.promfed.proxy.model.SampleStream;
import io.promfed.proxy.model.Selectors;
import io.promfed.proxy.model.Vector;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Makes a backend look as if all its series carried a fixed set of labels.
 * <p>
 * The injected labels override what the backend returns. Matchers on injected labels are answered
 * locally: a backend whose injected labels cannot match is not called at all, and the matchers
 * it can satisfy are not forwarded.
 * </p>
 */
public class LabelInjectingClient implements QueryClient {

    static final LabelMatcher ANY_SERIES = LabelMatcher.regex(LabelSet.METRIC_NAME_LABEL, ".+");

    private final QueryClient delegate;
    private final LabelSet labels;

    public LabelInjectingClient(QueryClient delegate, LabelSet labels) {
        this.delegate = Objects.requireNonNull(delegate);
        this.labels = Objects.requireNonNull(labels);
    }

    public LabelSet labels() {
        return labels;
    }

    @Override
    public CompletionStage<QueryValue> getValue(Instant start, Instant end, List<LabelMatcher> matchers) {
        List<LabelMatcher> forwarded = forwardedMatchers(matchers);
        if (forwarded == null) {
            return CompletableFuture.completedFuture(Matrix.EMPTY);
        }
        return inject(delegate.getValue(start, end, forwarded), this::injectValue);
    }

    @Override
    public CompletionStage<QueryValue> query(String query, Instant time) {
        return inject(delegate.query(query, time), this::injectValue);
    }

    @Override
    public CompletionStage<QueryValue> queryRange(String query, QueryRange range) {
        return inject(delegate.queryRange(query, range), this::injectValue);
    }

    @Override
    public CompletionStage<List<String>> labelValues(String label) {
        String injected = labels.get(label);
        if (injected != null) {
            return CompletableFuture.completedFuture(List.of(injected));
        }
        return delegate.labelValues(label);
    }

    @Override
    public CompletionStage<List<LabelSet>> series(List<String> matchers, Instant start, Instant end) {
        var forwarded = new ArrayList<String>(matchers.size());
        for (String selector : matchers) {
            Optional<List<LabelMatcher>> parsed = Selectors.parse(selector);
            if (parsed.isEmpty()) {
                forwarded.add(selector);
                continue;
            }
            List<LabelMatcher> remaining = forwardedMatchers(parsed.get());
            if (remaining != null) {
                forwarded.add(Selectors.toSelector(remaining));
            }
        }
        if (forwarded.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return inject(delegate.series(forwarded, start, end), series -> {
            var injected = new ArrayList<LabelSet>(series.size());
            for (LabelSet labelSet : series) {
                injected.add(labelSet.merge(labels));
            }
            return injected;
        });
    }

    /**
     * @return the matchers the backend has to evaluate, or null if the injected labels rule the backend out
     */
    @Nullable
    private List<LabelMatcher> forwardedMatchers(List<LabelMatcher> matchers) {
        if (labels.isEmpty()) {
            return matchers;
        }
        var forwarded = new ArrayList<LabelMatcher>(matchers.size());
        for (LabelMatcher matcher : matchers) {
            String injected = labels.get(matcher.name());
            if (injected == null) {
                forwarded.add(matcher);
            }
            else if (!matcher.matches(injected)) {
                return null;
            }
        }
        if (forwarded.isEmpty()) {
            forwarded.add(ANY_SERIES);
        }
        return forwarded;
    }

    private QueryValue injectValue(QueryValue value) {
        if (labels.isEmpty()) {
            return value;
        }
        if (value instanceof Matrix matrix) {
            var streams = new ArrayList<SampleStream>(matrix.streams().size());
            for (SampleStream stream : matrix.streams()) {
                streams.add(stream.withMetric(stream.metric().merge(labels)));
            }
            return new Matrix(streams);
        }
        if (value instanceof Vector vector) {
            var samples = new ArrayList<Sample>(vector.samples().size());
            for (Sample sample : vector.samples()) {
                samples.add(sample.withMetric(sample.metric().merge(labels)));
            }
            return new Vector(samples);
        }
        return value;
    }

    private static <T> CompletionStage<T> inject(CompletionStage<T> stage, Function<T, T> injector) {
        CompletableFuture<T> upstream = stage.toCompletableFuture();
        return Futures.propagateCancellation(upstream.thenApply(injector), upstream);
    }

    @Override
    public String toString() {
        return "LabelInjectingClient{labels=" + labels + ", delegate=" + delegate + "}";
    }
}
