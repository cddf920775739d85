/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.metrics;

import java.time.Duration;

/**
 * Receives the outcome of every backend call a merged call makes.
 * Implementations must be thread safe.
 */
@FunctionalInterface
public interface ClientMetrics {

    ClientMetrics NOOP = (target, call, status, latency) -> {
    };

    /**
     * @param target the backend that was called
     * @param call name of the operation, e.g. {@code query_range}
     * @param status outcome
     * @param latency time from issuing the call until it completed
     */
    void observe(String target, String call, CallStatus status, Duration latency);
}
