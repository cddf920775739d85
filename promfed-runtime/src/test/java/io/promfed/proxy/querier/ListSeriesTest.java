/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.querier;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.promfed.proxy.model.LabelSet;
import io.promfed.proxy.model.SamplePair;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListSeriesTest {

    private final ListSeries series = new ListSeries(LabelSet.of("job", "api"),
            List.of(new SamplePair(1000, 1), new SamplePair(2000, 2), new SamplePair(3000, 3)));

    @Test
    void shouldIterateInOrder() {
        SampleIterator iterator = series.iterator();

        assertThatThrownBy(iterator::at).isInstanceOf(IllegalStateException.class);
        assertThat(iterator.next()).isTrue();
        assertThat(iterator.at()).isEqualTo(new SamplePair(1000, 1));
        assertThat(iterator.next()).isTrue();
        assertThat(iterator.next()).isTrue();
        assertThat(iterator.at()).isEqualTo(new SamplePair(3000, 3));
        assertThat(iterator.next()).isFalse();
        assertThat(iterator.next()).isFalse();
        assertThatThrownBy(iterator::at).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldSeekForwardOnly() {
        SampleIterator iterator = series.iterator();

        assertThat(iterator.seek(1500)).isTrue();
        assertThat(iterator.at().timestamp()).isEqualTo(2000);
        assertThat(iterator.seek(1000)).isTrue();
        assertThat(iterator.at().timestamp()).isEqualTo(2000);
        assertThat(iterator.seek(3000)).isTrue();
        assertThat(iterator.at().timestamp()).isEqualTo(3000);
        assertThat(iterator.seek(3001)).isFalse();
    }

    @Test
    void shouldHandOutIndependentIterators() {
        SampleIterator first = series.iterator();
        first.seek(3000);

        SampleIterator second = series.iterator();

        assertThat(second.next()).isTrue();
        assertThat(second.at().timestamp()).isEqualTo(1000);
    }

    @Test
    void shouldIterateSeriesSetInLabelOrder() {
        var web = new ListSeries(LabelSet.of("job", "web"), List.of());
        var set = new ListSeriesSet(List.of(web, series));

        assertThatThrownBy(set::at).isInstanceOf(IllegalStateException.class);
        assertThat(set.next()).isTrue();
        assertThat(set.at()).isSameAs(series);
        assertThat(set.next()).isTrue();
        assertThat(set.at()).isSameAs(web);
        assertThat(set.next()).isFalse();
        assertThat(ListSeriesSet.EMPTY.series()).isEmpty();
    }
}
