/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.client.aggregator;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import io.promfed.proxy.model.LabelSet;

/**
 * Merges lists into their sorted union, without duplicates.
 *
 * @param <E> element type
 */
public class SortedUnionAggregator<E extends Comparable<? super E>> implements ValueAggregator<List<E>> {

    public static final SortedUnionAggregator<String> LABEL_VALUES = new SortedUnionAggregator<>();
    public static final SortedUnionAggregator<LabelSet> SERIES = new SortedUnionAggregator<>();

    @Override
    public List<E> empty() {
        return List.of();
    }

    @Override
    public List<E> aggregate(List<List<E>> responses) {
        var union = new TreeSet<E>();
        for (List<E> response : responses) {
            union.addAll(response);
        }
        return new ArrayList<>(union);
    }
}
