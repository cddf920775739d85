/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.client.aggregator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import io.promfed.proxy.client.BackendCallException;
import io.promfed.proxy.model.LabelSet;
import io.promfed.proxy.model.Matrix;
import io.promfed.proxy.model.QueryValue;
import io.promfed.proxy.model.Sample;
import io.promfed.proxy.model.SamplePair;
import io.promfed.proxy.model.SampleStream;
import io.promfed.proxy.model.Vector;

/**
 * Merges query results series by series.
 * <p>
 * Series with equal label sets are combined into one. Where more than one backend has a point at the same
 * timestamp, the point of the earliest backend wins. Series come out sorted by label set, points by time.
 * Scalars and strings cannot be combined, the first answer is used.
 * </p>
 */
public class QueryValueAggregator implements ValueAggregator<QueryValue> {

    public static final QueryValueAggregator MATRIX = new QueryValueAggregator(Matrix.EMPTY);
    public static final QueryValueAggregator VECTOR = new QueryValueAggregator(Vector.EMPTY);

    private final QueryValue empty;

    private QueryValueAggregator(QueryValue empty) {
        this.empty = empty;
    }

    @Override
    public QueryValue empty() {
        return empty;
    }

    @Override
    public QueryValue aggregate(List<QueryValue> responses) {
        if (responses.isEmpty()) {
            return empty;
        }
        QueryValue first = responses.get(0);
        for (QueryValue response : responses) {
            if (response.type() != first.type()) {
                throw new BackendCallException("cannot merge a " + first.type().wireName() + " result with a " + response.type().wireName() + " result");
            }
        }
        return switch (first.type()) {
            case MATRIX -> mergeMatrices(responses.stream().map(Matrix.class::cast).toList());
            case VECTOR -> mergeVectors(responses.stream().map(Vector.class::cast).toList());
            case SCALAR, STRING -> first;
        };
    }

    private static Matrix mergeMatrices(List<Matrix> matrices) {
        var series = new TreeMap<LabelSet, TreeMap<Long, Double>>();
        for (Matrix matrix : matrices) {
            for (SampleStream stream : matrix.streams()) {
                var points = series.computeIfAbsent(stream.metric(), labels -> new TreeMap<>());
                for (SamplePair point : stream.values()) {
                    points.putIfAbsent(point.timestamp(), point.value());
                }
            }
        }
        var streams = new ArrayList<SampleStream>(series.size());
        for (Map.Entry<LabelSet, TreeMap<Long, Double>> entry : series.entrySet()) {
            var points = new ArrayList<SamplePair>(entry.getValue().size());
            entry.getValue().forEach((timestamp, value) -> points.add(new SamplePair(timestamp, value)));
            streams.add(new SampleStream(entry.getKey(), points));
        }
        return new Matrix(streams);
    }

    private static Vector mergeVectors(List<Vector> vectors) {
        var samples = new TreeMap<LabelSet, Sample>();
        for (Vector vector : vectors) {
            for (Sample sample : vector.samples()) {
                samples.putIfAbsent(sample.metric(), sample);
            }
        }
        return new Vector(new ArrayList<>(samples.values()));
    }
}
