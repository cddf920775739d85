/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.client;

import java.util.Objects;

import io.promfed.proxy.client.QueryClient;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * One backend of a {@link MergeClient}.
 *
 * @param target identifies the backend in errors and metrics
 * @param replicaKey members with equal keys hold the same data, null if the backend has no replicas
 * @param client client of the backend
 */
public record MergeMember(String target, @Nullable String replicaKey, QueryClient client) {

    public MergeMember {
        Objects.requireNonNull(target);
        Objects.requireNonNull(client);
    }
}
