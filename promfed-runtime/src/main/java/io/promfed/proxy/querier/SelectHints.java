/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.querier;

import java.time.Instant;
import java.util.Objects;

/**
 * Time range the query engine needs data for.
 */
public record SelectHints(Instant start, Instant end) {

    public SelectHints {
        Objects.requireNonNull(start);
        Objects.requireNonNull(end);
    }
}
