/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.discovery;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import io.promfed.proxy.config.ConfigException;
import io.promfed.proxy.config.GroupConfig;

/**
 * A source of backend targets.
 * <p>
 * Each update maps job names to the complete current list of target groups of those jobs:
 * an update replaces everything previously delivered for the jobs it names.
 * Updates may be delivered from any thread, but never concurrently for one subscription.
 * </p>
 */
@FunctionalInterface
public interface TargetDiscovery {

    /**
     * @param config configuration holding the discovery rules
     * @param updates receives the target updates
     * @return the subscription
     * @throws ConfigException if the discovery rules cannot be used
     */
    DiscoverySubscription subscribe(GroupConfig config, Consumer<Map<String, List<TargetGroup>>> updates) throws ConfigException;
}
