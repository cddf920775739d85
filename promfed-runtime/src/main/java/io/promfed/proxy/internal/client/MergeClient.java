/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.client;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.promfed.proxy.client.MergeException;
import io.promfed.proxy.client.QueryClient;
import io.promfed.proxy.client.TargetCallException;
import io.promfed.proxy.internal.Futures;
import io.promfed.proxy.internal.client.aggregator.QueryValueAggregator;
import io.promfed.proxy.internal.client.aggregator.SortedUnionAggregator;
import io.promfed.proxy.internal.client.aggregator.ValueAggregator;
import io.promfed.proxy.metrics.CallStatus;
import io.promfed.proxy.metrics.ClientMetrics;
import io.promfed.proxy.model.LabelMatcher;
import io.promfed.proxy.model.LabelSet;
import io.promfed.proxy.model.QueryRange;
import io.promfed.proxy.model.QueryValue;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Fans every call out to a set of backends and merges their answers.
 *
 * <p>Members sharing a replica key form a replica group. Groups are called concurrently. Within a
 * group the replicas are tried one after the other, in member order, until one answers, so a
 * healthy group costs a single backend call. A group fails when all of its replicas failed.</p>
 *
 * <p>The merged call waits for every group. If more groups failed than the failure tolerance
 * allows, it fails with a {@link MergeException} carrying the failures and the merged answers of
 * the groups that succeeded.</p>
 */
public class MergeClient implements QueryClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(MergeClient.class);

    static final String GET_VALUE = "get_value";
    static final String QUERY = "query";
    static final String QUERY_RANGE = "query_range";
    static final String LABEL_VALUES = "label_values";
    static final String SERIES = "series";

    private final List<List<MergeMember>> replicaGroups;
    private final int failureTolerance;
    private final ClientMetrics metrics;

    /**
     * @param members backends, in order of precedence
     * @param failureTolerance number of failed replica groups a call tolerates
     * @param metrics receives the outcome of every backend call
     */
    public MergeClient(List<MergeMember> members, int failureTolerance, ClientMetrics metrics) {
        if (failureTolerance < 0) {
            throw new IllegalArgumentException("failure tolerance must not be negative, was " + failureTolerance);
        }
        this.replicaGroups = replicaGroups(members);
        this.failureTolerance = failureTolerance;
        this.metrics = Objects.requireNonNull(metrics);
    }

    private static List<List<MergeMember>> replicaGroups(List<MergeMember> members) {
        Map<Object, List<MergeMember>> groups = new LinkedHashMap<>();
        for (MergeMember member : members) {
            // members without a key are their own group
            Object key = member.replicaKey() != null ? member.replicaKey() : new Object();
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(member);
        }
        var result = new ArrayList<List<MergeMember>>(groups.size());
        for (List<MergeMember> group : groups.values()) {
            result.add(List.copyOf(group));
        }
        return List.copyOf(result);
    }

    /**
     * @return the replica groups, each in failover order
     */
    public List<List<MergeMember>> replicaGroups() {
        return replicaGroups;
    }

    @Override
    public CompletionStage<QueryValue> getValue(Instant start, Instant end, List<LabelMatcher> matchers) {
        return execute(GET_VALUE, client -> client.getValue(start, end, matchers), QueryValueAggregator.MATRIX);
    }

    @Override
    public CompletionStage<QueryValue> query(String query, Instant time) {
        return execute(QUERY, client -> client.query(query, time), QueryValueAggregator.VECTOR);
    }

    @Override
    public CompletionStage<QueryValue> queryRange(String query, QueryRange range) {
        return execute(QUERY_RANGE, client -> client.queryRange(query, range), QueryValueAggregator.MATRIX);
    }

    @Override
    public CompletionStage<List<String>> labelValues(String label) {
        return execute(LABEL_VALUES, client -> client.labelValues(label), SortedUnionAggregator.LABEL_VALUES);
    }

    @Override
    public CompletionStage<List<LabelSet>> series(List<String> matchers, Instant start, Instant end) {
        return execute(SERIES, client -> client.series(matchers, start, end), SortedUnionAggregator.SERIES);
    }

    private <T> CompletableFuture<T> execute(String call, Function<QueryClient, CompletionStage<T>> operation, ValueAggregator<T> aggregator) {
        if (replicaGroups.isEmpty()) {
            return CompletableFuture.completedFuture(aggregator.empty());
        }
        var context = new MergeContext<T>(call, replicaGroups.size());
        var result = new CompletableFuture<T>();
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                context.cancelInFlight();
            }
        });
        for (int group = 0; group < replicaGroups.size(); group++) {
            callReplica(context, result, operation, aggregator, group, 0, null);
        }
        return result;
    }

    private <T> void callReplica(MergeContext<T> context, CompletableFuture<T> result, Function<QueryClient, CompletionStage<T>> operation,
                                 ValueAggregator<T> aggregator, int group, int replica, @Nullable TargetCallException previousFailure) {
        MergeMember member = replicaGroups.get(group).get(replica);
        long startNanos = System.nanoTime();
        CompletableFuture<T> leaf = Futures.invoke(() -> operation.apply(member.client()));
        context.track(leaf);
        if (result.isCancelled()) {
            leaf.cancel(true);
        }
        leaf.whenComplete((value, error) -> {
            context.untrack(leaf);
            observe(member.target(), context.call(), error == null ? CallStatus.SUCCESS : CallStatus.ERROR, Duration.ofNanos(System.nanoTime() - startNanos));
            if (result.isDone()) {
                return;
            }
            if (error == null) {
                if (context.addResponse(group, value)) {
                    complete(context, result, aggregator);
                }
                return;
            }
            var failure = new TargetCallException(member.target(), context.call(), Futures.unwrap(error));
            if (previousFailure != null) {
                previousFailure.addSuppressed(failure);
            }
            TargetCallException groupFailure = previousFailure != null ? previousFailure : failure;
            if (replica + 1 < replicaGroups.get(group).size()) {
                LOGGER.debug("{} failed on {}, trying the next replica: {}", context.call(), member.target(), failure.getCause().getMessage());
                callReplica(context, result, operation, aggregator, group, replica + 1, groupFailure);
            }
            else if (context.addFailure(group, groupFailure)) {
                complete(context, result, aggregator);
            }
        });
    }

    private <T> void complete(MergeContext<T> context, CompletableFuture<T> result, ValueAggregator<T> aggregator) {
        List<T> responses = context.responses();
        List<TargetCallException> failures = context.failures();
        T merged;
        try {
            merged = aggregator.aggregate(responses);
        }
        catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }
        if (failures.size() > failureTolerance) {
            result.completeExceptionally(new MergeException(failures, responses.size(), failureTolerance, responses.isEmpty() ? null : merged));
        }
        else {
            if (!failures.isEmpty()) {
                LOGGER.debug("{} tolerated {} failed backend(s), first error: {}", context.call(), failures.size(), failures.get(0).getMessage());
            }
            result.complete(merged);
        }
    }

    private void observe(String target, String call, CallStatus status, Duration latency) {
        try {
            metrics.observe(target, call, status, latency);
        }
        catch (RuntimeException e) {
            LOGGER.warn("Metrics sink failed to record {} on {}", call, target, e);
        }
    }

    @Override
    public String toString() {
        return "MergeClient{replicaGroups=" + replicaGroups.size() + ", failureTolerance=" + failureTolerance + "}";
    }
}
