/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.querier;

import java.util.List;

import io.promfed.proxy.model.LabelMatcher;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Access to the series of a fixed time range.
 */
public interface Querier extends AutoCloseable {

    /**
     * @param hints the range data is needed for, or null if only the labels of the selected series are needed
     * @param matchers series selection
     * @return the selected series
     */
    SeriesSet select(@Nullable SelectHints hints, List<LabelMatcher> matchers);

    List<String> labelValues(String name);

    List<String> labelNames();

    @Override
    void close();
}
