/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.discovery;

/**
 * Handle on an active discovery subscription.
 */
public interface DiscoverySubscription extends AutoCloseable {

    /**
     * Stops delivering updates. Calling it again has no effect.
     */
    void cancel();

    @Override
    default void close() {
        cancel();
    }
}
