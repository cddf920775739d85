/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.querier;

/**
 * Iterates series in label order.
 */
public interface SeriesSet {

    boolean next();

    Series at();
}
