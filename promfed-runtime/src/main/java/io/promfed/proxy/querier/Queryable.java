/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.querier;

import java.time.Instant;

/**
 * Source of {@link Querier}s.
 */
@FunctionalInterface
public interface Queryable {

    /**
     * @param start start of the range the querier covers
     * @param end end of the range the querier covers
     */
    Querier querier(Instant start, Instant end);
}
