/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.client;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletionStage;

import io.promfed.proxy.model.LabelMatcher;
import io.promfed.proxy.model.LabelSet;
import io.promfed.proxy.model.QueryRange;
import io.promfed.proxy.model.QueryValue;

/**
 * Read access to one or more Prometheus-compatible backends.
 *
 * <p>Implementations compose: a leaf talks to a single backend, decorators add labels or
 * relax error handling, and a merge composite fans a call out to many clients.
 * All of them honour the same contract:</p>
 * <ul>
 *   <li>calls never block, results and failures are delivered through the returned stage</li>
 *   <li>cancelling the returned future cancels the work underneath it</li>
 *   <li>call-time failures are {@link BackendCallException}s</li>
 * </ul>
 */
public interface QueryClient {

    /**
     * Loads the raw samples of every series selected by {@code matchers} within {@code [start, end]}.
     *
     * @param start start of the range, inclusive
     * @param end end of the range, inclusive
     * @param matchers series selection
     * @return a {@link io.promfed.proxy.model.Matrix} (or a {@link io.promfed.proxy.model.Vector})
     */
    CompletionStage<QueryValue> getValue(Instant start, Instant end, List<LabelMatcher> matchers);

    /**
     * Evaluates an instant query.
     */
    CompletionStage<QueryValue> query(String query, Instant time);

    /**
     * Evaluates a range query.
     */
    CompletionStage<QueryValue> queryRange(String query, QueryRange range);

    /**
     * Lists the values of a label.
     */
    CompletionStage<List<String>> labelValues(String label);

    /**
     * Finds the series selected by any of the given selectors.
     *
     * @param matchers series selectors, e.g. {@code up{job="api"}}
     * @param start start of the range
     * @param end end of the range
     * @return label set of every matching series
     */
    CompletionStage<List<LabelSet>> series(List<String> matchers, Instant start, Instant end);
}
