/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.client.aggregator;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.promfed.proxy.client.BackendCallException;
import io.promfed.proxy.model.LabelSet;
import io.promfed.proxy.model.Matrix;
import io.promfed.proxy.model.QueryValue;
import io.promfed.proxy.model.Sample;
import io.promfed.proxy.model.SamplePair;
import io.promfed.proxy.model.SampleStream;
import io.promfed.proxy.model.Scalar;
import io.promfed.proxy.model.Vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryValueAggregatorTest {

    private static final LabelSet API = LabelSet.of("__name__", "up", "job", "api");
    private static final LabelSet WEB = LabelSet.of("__name__", "up", "job", "web");

    @Test
    void shouldAnswerEmptyWithoutResponses() {
        assertThat(QueryValueAggregator.MATRIX.aggregate(List.of())).isEqualTo(Matrix.EMPTY);
        assertThat(QueryValueAggregator.VECTOR.aggregate(List.of())).isEqualTo(Vector.EMPTY);
        assertThat(QueryValueAggregator.MATRIX.empty()).isEqualTo(Matrix.EMPTY);
    }

    @Test
    void shouldFillGapsAcrossBackends() {
        var first = new Matrix(List.of(stream(API, point(1000, 1), point(3000, 3))));
        var second = new Matrix(List.of(stream(API, point(2000, 2), point(3000, 30)), stream(WEB, point(1000, 5))));

        QueryValue merged = QueryValueAggregator.MATRIX.aggregate(List.of(first, second));

        assertThat(merged).isEqualTo(new Matrix(List.of(
                stream(API, point(1000, 1), point(2000, 2), point(3000, 3)),
                stream(WEB, point(1000, 5)))));
    }

    @Test
    void shouldPreferEarlierBackendOnConflictingSamples() {
        var first = new Matrix(List.of(stream(API, point(1000, 1))));
        var second = new Matrix(List.of(stream(API, point(1000, 99))));

        assertThat(QueryValueAggregator.MATRIX.aggregate(List.of(second, first)))
                .isEqualTo(new Matrix(List.of(stream(API, point(1000, 99)))));
    }

    @Test
    void shouldMergeVectorsBySeries() {
        var first = new Vector(List.of(new Sample(WEB, 1, 1000)));
        var second = new Vector(List.of(new Sample(API, 2, 1000), new Sample(WEB, 7, 1000)));

        QueryValue merged = QueryValueAggregator.VECTOR.aggregate(List.of(first, second));

        assertThat(merged).isEqualTo(new Vector(List.of(new Sample(API, 2, 1000), new Sample(WEB, 1, 1000))));
    }

    @Test
    void shouldAnswerFirstScalar() {
        assertThat(QueryValueAggregator.VECTOR.aggregate(List.of(new Scalar(1, 1000), new Scalar(2, 1000)))).isEqualTo(new Scalar(1, 1000));
    }

    @Test
    void shouldRejectMixedResultTypes() {
        List<QueryValue> responses = List.of(Matrix.EMPTY, Vector.EMPTY);

        assertThatThrownBy(() -> QueryValueAggregator.MATRIX.aggregate(responses))
                .isInstanceOf(BackendCallException.class)
                .hasMessage("cannot merge a matrix result with a vector result");
    }

    @Test
    void shouldUnionSortedLabelValues() {
        assertThat(SortedUnionAggregator.LABEL_VALUES.aggregate(List.of(List.of("web", "api"), List.of("db", "api"))))
                .containsExactly("api", "db", "web");
        assertThat(SortedUnionAggregator.SERIES.aggregate(List.of(List.of(WEB), List.of(API, WEB)))).containsExactly(API, WEB);
    }

    private static SampleStream stream(LabelSet metric, SamplePair... points) {
        return new SampleStream(metric, List.of(points));
    }

    private static SamplePair point(long timestamp, double value) {
        return new SamplePair(timestamp, value);
    }
}
