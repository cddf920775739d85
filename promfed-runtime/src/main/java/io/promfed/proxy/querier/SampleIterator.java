/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.querier;

import io.promfed.proxy.model.SamplePair;

/**
 * Iterates the samples of one series in time order.
 */
public interface SampleIterator {

    /**
     * Advances to the next sample.
     *
     * @return false if there are no more samples
     */
    boolean next();

    /**
     * Advances to the first sample at or after {@code timestamp}. Never moves backwards:
     * if the current sample is already at or after {@code timestamp} it stays current.
     *
     * @return false if there is no such sample
     */
    boolean seek(long timestamp);

    /**
     * @return the current sample
     * @throws IllegalStateException if the iterator is not positioned on a sample
     */
    SamplePair at();
}
