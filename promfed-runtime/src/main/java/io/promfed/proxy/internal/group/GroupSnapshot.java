/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.group;

import java.util.List;
import java.util.Objects;

import io.promfed.proxy.client.QueryClient;

/**
 * Immutable view of a server group at one point in time. A query keeps using the snapshot it
 * started with, even when the group is reconciled while the query runs.
 *
 * @param targets addresses of the targets, in precedence order
 * @param client client fanning out to exactly those targets
 */
public record GroupSnapshot(List<String> targets, QueryClient client) {

    public GroupSnapshot {
        targets = List.copyOf(targets);
        Objects.requireNonNull(client);
    }
}
