/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Evaluation range of a range query.
 */
public record QueryRange(Instant start, Instant end, Duration step) {

    public QueryRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(step, "step");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("range end " + end + " is before start " + start);
        }
        if (step.isNegative() || step.isZero()) {
            throw new IllegalArgumentException("range step must be positive, got " + step);
        }
    }
}
