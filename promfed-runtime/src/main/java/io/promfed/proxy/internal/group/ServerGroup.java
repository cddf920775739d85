/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.group;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.promfed.proxy.client.NotReadyException;
import io.promfed.proxy.client.QueryClient;
import io.promfed.proxy.config.ConfigException;
import io.promfed.proxy.config.GroupConfig;
import io.promfed.proxy.discovery.DiscoverySubscription;
import io.promfed.proxy.discovery.StaticDiscovery;
import io.promfed.proxy.discovery.TargetDiscovery;
import io.promfed.proxy.discovery.TargetGroup;
import io.promfed.proxy.internal.Futures;
import io.promfed.proxy.internal.client.ErrorSuppressingClient;
import io.promfed.proxy.internal.client.MergeClient;
import io.promfed.proxy.internal.client.MergeMember;
import io.promfed.proxy.internal.net.HttpTransport;
import io.promfed.proxy.internal.net.TransportFactory;
import io.promfed.proxy.metrics.ClientMetrics;
import io.promfed.proxy.model.LabelMatcher;
import io.promfed.proxy.model.LabelSet;
import io.promfed.proxy.model.QueryRange;
import io.promfed.proxy.model.QueryValue;
import io.promfed.proxy.querier.SnapshotSource;
import io.promfed.proxy.relabel.Relabeler;
import io.promfed.proxy.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A dynamically discovered pool of backends, queried as one.
 *
 * <p>Discovery updates are reconciled on a single background thread, strictly in arrival order:
 * targets are relabeled, de-duplicated by address and turned into clients, and the result is
 * published as a new immutable {@link GroupSnapshot}. Calls made on the group go to the snapshot
 * current when the call is made.</p>
 *
 * <p>Applying a configuration replaces the transport and the discovery subscription together.
 * A transport stays open while the published snapshot uses it. Once a snapshot built on a newer
 * transport replaces that snapshot, the old transport is closed after a drain delay, so that
 * queries still running against older snapshots can finish.</p>
 */
public class ServerGroup implements QueryClient, SnapshotSource, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerGroup.class);

    public static final Duration DEFAULT_DRAIN_DELAY = Duration.ofMinutes(2);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private static final AtomicInteger THREAD_IDS = new AtomicInteger();

    private final TargetDiscovery discovery;
    private final TransportFactory transportFactory;
    private final ClientMetrics metrics;
    private final Duration drainDelay;
    private final ScheduledExecutorService reconciler;

    private final AtomicReference<ActiveConfig> active = new AtomicReference<>();
    private final AtomicReference<GroupSnapshot> snapshot = new AtomicReference<>();
    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    private final AtomicBoolean shutdown = new AtomicBoolean();
    private final Set<HttpTransport> open = ConcurrentHashMap.newKeySet();
    private long generations;

    // written on the reconciler thread only
    private volatile @Nullable HttpTransport published;
    private long reconciledGeneration = -1;
    private final Map<String, List<TargetGroup>> jobs = new TreeMap<>();

    public ServerGroup(ClientMetrics metrics) {
        this(new StaticDiscovery(), TransportFactory.NETTY, metrics, DEFAULT_DRAIN_DELAY);
    }

    public ServerGroup(TargetDiscovery discovery, TransportFactory transportFactory, ClientMetrics metrics, Duration drainDelay) {
        this.discovery = Objects.requireNonNull(discovery);
        this.transportFactory = Objects.requireNonNull(transportFactory);
        this.metrics = Objects.requireNonNull(metrics);
        this.drainDelay = Objects.requireNonNull(drainDelay);
        this.reconciler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "server-group-reconciler-" + THREAD_IDS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Applies a configuration. On failure the previous configuration, transport and
     * discovery subscription stay in effect.
     *
     * @throws ConfigException if the configuration cannot be applied
     */
    public synchronized void applyConfig(GroupConfig config) throws ConfigException {
        if (shutdown.get()) {
            throw new IllegalStateException("server group '" + config.name() + "' has been shut down");
        }
        config.validate();
        HttpTransport transport = transportFactory.create(config.httpClient());
        open.add(transport);
        var candidate = new ActiveConfig(++generations, config, transport);
        try {
            candidate.subscription = discovery.subscribe(config, update -> enqueue(candidate, update));
        }
        catch (ConfigException | RuntimeException e) {
            candidate.supersede();
            closeTransport(transport);
            if (e instanceof ConfigException configException) {
                throw configException;
            }
            throw new ConfigException("server group '" + config.name() + "': cannot subscribe to discovery: " + e.getMessage(), e);
        }
        ActiveConfig previous = active.getAndSet(candidate);
        if (previous != null) {
            previous.supersede();
            previous.cancelSubscription();
            releaseIfUnpublished(previous.transport);
        }
        LOGGER.info("Applied configuration of server group '{}' (generation {})", config.name(), candidate.generation);
    }

    private void enqueue(ActiveConfig source, Map<String, List<TargetGroup>> update) {
        var copy = Map.copyOf(update);
        try {
            reconciler.execute(() -> reconcile(source, copy));
        }
        catch (RejectedExecutionException e) {
            LOGGER.debug("Server group '{}' is shut down, discarding discovery update", source.config.name());
        }
    }

    /**
     * Closes the transport of a superseded configuration unless the published snapshot still uses it.
     * Runs on the reconciler thread, after any reconciliation of that configuration already under way.
     */
    private void releaseIfUnpublished(HttpTransport transport) {
        try {
            reconciler.execute(() -> {
                if (transport != published) {
                    closeTransport(transport);
                }
            });
        }
        catch (RejectedExecutionException e) {
            closeTransport(transport);
        }
    }

    private void retire(HttpTransport transport) {
        try {
            reconciler.schedule(() -> closeTransport(transport), drainDelay.toNanos(), TimeUnit.NANOSECONDS);
        }
        catch (RejectedExecutionException e) {
            closeTransport(transport);
        }
    }

    private void closeTransport(HttpTransport transport) {
        if (open.remove(transport)) {
            transport.close();
        }
    }

    private void reconcile(ActiveConfig source, Map<String, List<TargetGroup>> update) {
        GroupConfig config = source.config;
        if (source.isSuperseded() || source.generation < reconciledGeneration || shutdown.get()) {
            LOGGER.debug("Ignoring discovery update of a superseded configuration of server group '{}'", config.name());
            return;
        }
        try {
            if (source.generation > reconciledGeneration) {
                jobs.clear();
                reconciledGeneration = source.generation;
            }
            update.forEach((job, groups) -> {
                if (groups.isEmpty()) {
                    jobs.remove(job);
                }
                else {
                    jobs.put(job, List.copyOf(groups));
                }
            });
            publish(config, source.transport, buildSnapshot(config, source.transport));
        }
        catch (RuntimeException e) {
            LOGGER.error("Reconciliation of server group '{}' failed, keeping the previous snapshot", config.name(), e);
        }
    }

    private GroupSnapshot buildSnapshot(GroupConfig config, HttpTransport transport) {
        var factory = new TargetClientFactory(config, transport);
        var members = new ArrayList<MergeMember>();
        var addresses = new HashSet<String>();
        for (Map.Entry<String, List<TargetGroup>> job : jobs.entrySet()) {
            for (TargetGroup group : job.getValue()) {
                for (LabelSet target : group.targets()) {
                    LabelSet relabeled = Relabeler.process(group.labels().merge(target), config.relabelConfigs());
                    if (relabeled == null) {
                        LOGGER.debug("Target {} of job '{}' dropped by relabeling", target, job.getKey());
                        continue;
                    }
                    String address = relabeled.get(LabelSet.ADDRESS_LABEL);
                    if (address != null && addresses.contains(address)) {
                        LOGGER.debug("Skipping duplicate target {} of job '{}'", address, job.getKey());
                        continue;
                    }
                    try {
                        members.add(factory.create(relabeled));
                        addresses.add(address);
                    }
                    catch (TargetBuildException e) {
                        LOGGER.warn("Excluding target {} from server group '{}': {}", relabeled, config.name(), e.getMessage());
                    }
                }
            }
        }
        QueryClient client = new MergeClient(members, config.failureTolerance(), metrics);
        if (config.ignoreError()) {
            client = new ErrorSuppressingClient(client);
        }
        return new GroupSnapshot(members.stream().map(MergeMember::target).toList(), client);
    }

    private void publish(GroupConfig config, HttpTransport transport, GroupSnapshot next) {
        if (shutdown.get()) {
            return;
        }
        snapshot.set(next);
        HttpTransport replaced = published;
        published = transport;
        if (replaced != null && replaced != transport) {
            retire(replaced);
        }
        LOGGER.info("Server group '{}' now queries {} target(s): {}", config.name(), next.targets().size(), next.targets());
        ready.complete(null);
    }

    /**
     * @return the current snapshot, empty until the first reconciliation completed
     */
    public Optional<GroupSnapshot> currentSnapshot() {
        return Optional.ofNullable(snapshot.get());
    }

    /**
     * @return completes once, when the first snapshot is published, or fails with
     *         {@link NotReadyException} if the group is shut down before that
     */
    public CompletionStage<Void> signalReady() {
        return ready.minimalCompletionStage();
    }

    @Override
    public QueryClient snapshotClient() {
        GroupSnapshot current = snapshot.get();
        if (current == null) {
            throw new NotReadyException("server group" + name() + " has no targets yet");
        }
        return current.client();
    }

    private String name() {
        ActiveConfig current = active.get();
        return current == null ? "" : " '" + current.config.name() + "'";
    }

    @VisibleForTesting
    @Nullable
    GroupConfig activeConfig() {
        ActiveConfig current = active.get();
        return current == null ? null : current.config;
    }

    @Override
    public CompletionStage<QueryValue> getValue(Instant start, Instant end, List<LabelMatcher> matchers) {
        return Futures.invoke(() -> snapshotClient().getValue(start, end, matchers));
    }

    @Override
    public CompletionStage<QueryValue> query(String query, Instant time) {
        return Futures.invoke(() -> snapshotClient().query(query, time));
    }

    @Override
    public CompletionStage<QueryValue> queryRange(String query, QueryRange range) {
        return Futures.invoke(() -> snapshotClient().queryRange(query, range));
    }

    @Override
    public CompletionStage<List<String>> labelValues(String label) {
        return Futures.invoke(() -> snapshotClient().labelValues(label));
    }

    @Override
    public CompletionStage<List<LabelSet>> series(List<String> matchers, Instant start, Instant end) {
        return Futures.invoke(() -> snapshotClient().series(matchers, start, end));
    }

    /**
     * Stops discovery and reconciliation and closes every transport. Calling it again has no effect.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        ActiveConfig current;
        synchronized (this) {
            current = active.get();
        }
        if (current != null) {
            current.supersede();
            current.cancelSubscription();
        }
        reconciler.shutdownNow();
        try {
            if (!reconciler.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Reconciliation of server group{} did not stop within {}", name(), SHUTDOWN_TIMEOUT);
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for the reconciliation of server group{} to stop", name());
        }
        for (HttpTransport transport : List.copyOf(open)) {
            closeTransport(transport);
        }
        snapshot.set(null);
        if (ready.completeExceptionally(new NotReadyException("server group" + name() + " was shut down before becoming ready"))) {
            LOGGER.debug("Server group{} shut down before becoming ready", name());
        }
        LOGGER.info("Server group{} shut down", name());
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * A configuration together with the transport and the discovery subscription built for it.
     */
    private static final class ActiveConfig {
        private final long generation;
        private final GroupConfig config;
        private final HttpTransport transport;
        private volatile @Nullable DiscoverySubscription subscription;
        private volatile boolean superseded;

        private ActiveConfig(long generation, GroupConfig config, HttpTransport transport) {
            this.generation = generation;
            this.config = config;
            this.transport = transport;
        }

        boolean isSuperseded() {
            return superseded;
        }

        void supersede() {
            superseded = true;
        }

        void cancelSubscription() {
            DiscoverySubscription current = subscription;
            if (current != null) {
                current.cancel();
            }
        }
    }
}
