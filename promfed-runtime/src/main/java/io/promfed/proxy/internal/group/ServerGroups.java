/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.group;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.MeterRegistry;

import io.promfed.proxy.client.QueryClient;
import io.promfed.proxy.config.ConfigException;
import io.promfed.proxy.config.GroupConfig;
import io.promfed.proxy.config.ProxyConfiguration;
import io.promfed.proxy.discovery.StaticDiscovery;
import io.promfed.proxy.internal.client.MergeClient;
import io.promfed.proxy.internal.client.MergeMember;
import io.promfed.proxy.internal.net.TransportFactory;
import io.promfed.proxy.metrics.ClientMetrics;
import io.promfed.proxy.metrics.MicrometerClientMetrics;
import io.promfed.proxy.querier.SnapshotSource;
import io.promfed.proxy.tag.VisibleForTesting;

/**
 * All server groups of a proxy configuration, queried as one: every call goes to every group,
 * and fails if any group fails.
 */
public class ServerGroups implements SnapshotSource, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerGroups.class);

    private final Function<String, ServerGroup> groupFactory;
    private Map<String, ServerGroup> groups = new LinkedHashMap<>();

    public ServerGroups(MeterRegistry registry) {
        this(name -> new ServerGroup(new StaticDiscovery(), TransportFactory.NETTY, new MicrometerClientMetrics(registry, name),
                ServerGroup.DEFAULT_DRAIN_DELAY));
    }

    @VisibleForTesting
    ServerGroups(Function<String, ServerGroup> groupFactory) {
        this.groupFactory = groupFactory;
    }

    /**
     * Reconfigures the groups named by the configuration, creating the new ones and shutting
     * down those no longer named.
     * <p>
     * If a group rejects its configuration, groups created by this call are shut down again and the
     * groups that are no longer named keep running. Groups reconfigured before the failing one keep
     * their new configuration.
     * </p>
     *
     * @throws ConfigException if a group rejects its configuration
     */
    public synchronized void applyConfig(ProxyConfiguration configuration) throws ConfigException {
        configuration.validate();
        var retained = new LinkedHashMap<String, ServerGroup>();
        var created = new ArrayList<ServerGroup>();
        try {
            for (GroupConfig groupConfig : configuration.serverGroups()) {
                ServerGroup group = groups.get(groupConfig.name());
                if (group == null) {
                    group = groupFactory.apply(groupConfig.name());
                    created.add(group);
                }
                group.applyConfig(groupConfig);
                retained.put(groupConfig.name(), group);
            }
        }
        catch (ConfigException | RuntimeException e) {
            created.forEach(ServerGroup::shutdown);
            throw e;
        }
        for (Map.Entry<String, ServerGroup> existing : groups.entrySet()) {
            if (!retained.containsKey(existing.getKey())) {
                LOGGER.info("Removing server group '{}'", existing.getKey());
                existing.getValue().shutdown();
            }
        }
        groups = retained;
    }

    public synchronized Optional<ServerGroup> group(String name) {
        return Optional.ofNullable(groups.get(name));
    }

    public synchronized List<String> groupNames() {
        return List.copyOf(groups.keySet());
    }

    /**
     * @return completes when every group currently configured is ready
     */
    public synchronized CompletionStage<Void> signalReady() {
        return CompletableFuture.allOf(groups.values().stream()
                .map(group -> group.signalReady().toCompletableFuture())
                .toArray(CompletableFuture[]::new));
    }

    /**
     * @return a client fanning out to the current snapshot of every group
     * @throws io.promfed.proxy.client.NotReadyException if a group is not ready
     */
    @Override
    public QueryClient snapshotClient() {
        Map<String, ServerGroup> current;
        synchronized (this) {
            current = new LinkedHashMap<>(groups);
        }
        var members = new ArrayList<MergeMember>(current.size());
        current.forEach((name, group) -> members.add(new MergeMember(name, null, group.snapshotClient())));
        // backend calls are recorded by the groups themselves
        return new MergeClient(members, 0, ClientMetrics.NOOP);
    }

    @Override
    public synchronized void close() {
        groups.values().forEach(ServerGroup::shutdown);
        groups = new LinkedHashMap<>();
    }
}
