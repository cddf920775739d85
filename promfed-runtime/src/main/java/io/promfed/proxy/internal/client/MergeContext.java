/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.client;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import io.promfed.proxy.client.TargetCallException;

/**
 * Per call - collects the outcome of every replica group a merged call fans out to.
 * <p>
 * Outcomes are kept in group order, so that aggregation does not depend on which backend answered first.
 * </p>
 *
 * @param <T> result type of the call
 */
public class MergeContext<T> {

    private final String call;
    private final int expectedOutcomes;
    private final List<T> responses;
    private final List<TargetCallException> failures;
    private final boolean[] completed;
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
    private int outcomes;

    public MergeContext(String call, int expectedOutcomes) {
        this.call = call;
        this.expectedOutcomes = expectedOutcomes;
        this.responses = new ArrayList<>(expectedOutcomes);
        this.failures = new ArrayList<>(expectedOutcomes);
        this.completed = new boolean[expectedOutcomes];
        for (int i = 0; i < expectedOutcomes; i++) {
            responses.add(null);
            failures.add(null);
        }
    }

    public String call() {
        return call;
    }

    /**
     * @return true if this was the last outstanding outcome
     */
    public synchronized boolean addResponse(int group, T response) {
        responses.set(group, response);
        return complete(group);
    }

    /**
     * @return true if this was the last outstanding outcome
     */
    public synchronized boolean addFailure(int group, TargetCallException failure) {
        failures.set(group, failure);
        return complete(group);
    }

    private boolean complete(int group) {
        if (completed[group]) {
            throw new IllegalStateException("Received more than one outcome for replica group " + group);
        }
        completed[group] = true;
        outcomes++;
        return outcomes == expectedOutcomes;
    }

    public synchronized int remainingOutcomes() {
        return expectedOutcomes - outcomes;
    }

    public synchronized boolean isComplete() {
        return outcomes == expectedOutcomes;
    }

    /**
     * @return the successful responses, in group order
     */
    public synchronized List<T> responses() {
        var successful = new ArrayList<T>(expectedOutcomes);
        for (int i = 0; i < expectedOutcomes; i++) {
            if (completed[i] && failures.get(i) == null) {
                successful.add(responses.get(i));
            }
        }
        return successful;
    }

    /**
     * @return one failure per failed group, in group order
     */
    public synchronized List<TargetCallException> failures() {
        var failed = new ArrayList<TargetCallException>();
        for (TargetCallException failure : failures) {
            if (failure != null) {
                failed.add(failure);
            }
        }
        return failed;
    }

    void track(CompletableFuture<?> leaf) {
        inFlight.add(leaf);
    }

    void untrack(CompletableFuture<?> leaf) {
        inFlight.remove(leaf);
    }

    /**
     * Cancels every backend call still in flight.
     */
    void cancelInFlight() {
        for (CompletableFuture<?> leaf : List.copyOf(inFlight)) {
            leaf.cancel(true);
        }
    }
}
