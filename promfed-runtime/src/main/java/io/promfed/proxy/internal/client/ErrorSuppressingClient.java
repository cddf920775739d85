/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.client;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.promfed.proxy.client.MergeException;
import io.promfed.proxy.client.QueryClient;
import io.promfed.proxy.internal.Futures;
import io.promfed.proxy.model.LabelMatcher;
import io.promfed.proxy.model.LabelSet;
import io.promfed.proxy.model.QueryRange;
import io.promfed.proxy.model.QueryValue;

/**
 * Prefers partial data over failure: a merged call that failed on some, but not all,
 * backends answers with what the healthy backends returned.
 */
public class ErrorSuppressingClient implements QueryClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(ErrorSuppressingClient.class);

    private final QueryClient delegate;

    public ErrorSuppressingClient(QueryClient delegate) {
        this.delegate = Objects.requireNonNull(delegate);
    }

    @Override
    public CompletionStage<QueryValue> getValue(Instant start, Instant end, List<LabelMatcher> matchers) {
        return suppress(MergeClient.GET_VALUE, delegate.getValue(start, end, matchers));
    }

    @Override
    public CompletionStage<QueryValue> query(String query, Instant time) {
        return suppress(MergeClient.QUERY, delegate.query(query, time));
    }

    @Override
    public CompletionStage<QueryValue> queryRange(String query, QueryRange range) {
        return suppress(MergeClient.QUERY_RANGE, delegate.queryRange(query, range));
    }

    @Override
    public CompletionStage<List<String>> labelValues(String label) {
        return suppress(MergeClient.LABEL_VALUES, delegate.labelValues(label));
    }

    @Override
    public CompletionStage<List<LabelSet>> series(List<String> matchers, Instant start, Instant end) {
        return suppress(MergeClient.SERIES, delegate.series(matchers, start, end));
    }

    private static <T> CompletableFuture<T> suppress(String call, CompletionStage<T> stage) {
        CompletableFuture<T> upstream = stage.toCompletableFuture();
        var result = new CompletableFuture<T>();
        upstream.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable cause = Futures.unwrap(error);
            if (cause instanceof MergeException mergeException && mergeException.successes() > 0) {
                LOGGER.warn("Answering {} with partial data, {} backend(s) failed: {}", call, mergeException.failures().size(),
                        mergeException.getMessage());
                result.complete(mergeException.partialResult());
            }
            else {
                result.completeExceptionally(cause);
            }
        });
        return Futures.propagateCancellation(result, upstream);
    }

    @Override
    public String toString() {
        return "ErrorSuppressingClient{" + delegate + "}";
    }
}
