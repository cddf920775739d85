/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.group;

import java.net.URI;
import java.util.Objects;

import io.promfed.proxy.model.LabelSet;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Where and how to reach one relabeled target.
 *
 * @param address the {@code host:port} of the target, also its identity within the group
 * @param baseUri scheme, address and path prefix
 * @param labels labels injected into everything the target returns
 * @param replicaKey identifies the replicas holding the same data as this target, null if it has none
 */
public record TargetEndpoint(String address, URI baseUri, LabelSet labels, @Nullable String replicaKey) {

    public TargetEndpoint {
        Objects.requireNonNull(address);
        Objects.requireNonNull(baseUri);
        Objects.requireNonNull(labels);
    }
}
