/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.querier;

import io.promfed.proxy.client.NotReadyException;
import io.promfed.proxy.client.QueryClient;

/**
 * Supplies the client of the backends current at the time of the call.
 */
@FunctionalInterface
public interface SnapshotSource {

    /**
     * @return the client of the current snapshot
     * @throws NotReadyException if no snapshot has been published yet
     */
    QueryClient snapshotClient();
}
