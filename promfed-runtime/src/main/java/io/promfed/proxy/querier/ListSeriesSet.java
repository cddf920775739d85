/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.querier;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A series set held in memory.
 */
public class ListSeriesSet implements SeriesSet {

    public static final ListSeriesSet EMPTY = new ListSeriesSet(List.of());

    private final List<Series> series;
    private int position = -1;

    /**
     * @param series the series, sorted by labels by this constructor
     */
    public ListSeriesSet(List<? extends Series> series) {
        var sorted = new ArrayList<Series>(series);
        sorted.sort(Comparator.comparing(Series::labels));
        this.series = List.copyOf(sorted);
    }

    @Override
    public boolean next() {
        if (position < series.size()) {
            position++;
        }
        return position < series.size();
    }

    @Override
    public Series at() {
        if (position < 0 || position >= series.size()) {
            throw new IllegalStateException("series set is not positioned on a series");
        }
        return series.get(position);
    }

    /**
     * @return every series, in label order
     */
    public List<Series> series() {
        return series;
    }
}
