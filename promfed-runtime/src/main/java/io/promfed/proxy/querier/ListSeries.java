/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.querier;

import java.util.List;
import java.util.Objects;

import io.promfed.proxy.model.LabelSet;
import io.promfed.proxy.model.SamplePair;

/**
 * A series held in memory.
 *
 * @param labels labels of the series
 * @param samples samples in time order
 */
public record ListSeries(LabelSet labels, List<SamplePair> samples) implements Series {

    public ListSeries {
        Objects.requireNonNull(labels);
        samples = List.copyOf(samples);
    }

    @Override
    public SampleIterator iterator() {
        return new ListSampleIterator(samples);
    }

    private static final class ListSampleIterator implements SampleIterator {
        private final List<SamplePair> samples;
        private int position = -1;

        private ListSampleIterator(List<SamplePair> samples) {
            this.samples = samples;
        }

        @Override
        public boolean next() {
            if (position < samples.size()) {
                position++;
            }
            return position < samples.size();
        }

        @Override
        public boolean seek(long timestamp) {
            if (position < 0) {
                position = 0;
            }
            while (position < samples.size() && samples.get(position).timestamp() < timestamp) {
                position++;
            }
            return position < samples.size();
        }

        @Override
        public SamplePair at() {
            if (position < 0 || position >= samples.size()) {
                throw new IllegalStateException("iterator is not positioned on a sample");
            }
            return samples.get(position);
        }
    }
}
