/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.querier;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Hands out queriers bound to the backends current when the query starts.
 */
public class ProxyQueryable implements Queryable {

    private final SnapshotSource source;
    private final Duration queryTimeout;

    /**
     * @param source the backends, usually a server group
     * @param queryTimeout maximum time any call of a querier may block
     */
    public ProxyQueryable(SnapshotSource source, Duration queryTimeout) {
        this.source = Objects.requireNonNull(source);
        this.queryTimeout = Objects.requireNonNull(queryTimeout);
    }

    /**
     * @throws io.promfed.proxy.client.NotReadyException if the backends are not known yet
     */
    @Override
    public Querier querier(Instant start, Instant end) {
        return new ProxyQuerier(source.snapshotClient(), start, end, queryTimeout);
    }
}
