/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.model;

import java.util.Objects;

/**
 * A series identity with a single point, the element of a {@link Vector}.
 */
public record Sample(LabelSet metric, double value, long timestamp) {

    public Sample {
        Objects.requireNonNull(metric, "metric");
    }

    public Sample withMetric(LabelSet newMetric) {
        return new Sample(newMetric, value, timestamp);
    }

    public SamplePair point() {
        return new SamplePair(timestamp, value);
    }
}
