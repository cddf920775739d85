/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.model;

import java.util.List;
import java.util.Objects;

/**
 * A series identity with its points in time order, the element of a {@link Matrix}.
 */
public record SampleStream(LabelSet metric, List<SamplePair> values) {

    public SampleStream {
        Objects.requireNonNull(metric, "metric");
        values = List.copyOf(values);
    }

    public SampleStream withMetric(LabelSet newMetric) {
        return new SampleStream(newMetric, values);
    }
}
