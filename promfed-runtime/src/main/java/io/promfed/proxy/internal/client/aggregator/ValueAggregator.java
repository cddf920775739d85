/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.client.aggregator;

import java.util.List;

/**
 * Merges the answers several backends gave to the same call.
 *
 * @param <T> result type of the call
 */
public interface ValueAggregator<T> {

    /**
     * @return the result of a call that reached no backend
     */
    T empty();

    /**
     * @param responses successful responses, in target order
     * @return the merged response
     */
    T aggregate(List<T> responses);
}
