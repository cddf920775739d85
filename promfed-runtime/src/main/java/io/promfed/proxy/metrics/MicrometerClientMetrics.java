/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.metrics;

import java.time.Duration;
import java.util.Objects;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Records backend call latencies of one server group as a Micrometer {@link Timer}.
 */
public class MicrometerClientMetrics implements ClientMetrics {

    public static final String REQUEST_DURATION = "server_group_request_duration";

    private final MeterRegistry registry;
    private final String serverGroup;

    public MicrometerClientMetrics(MeterRegistry registry, String serverGroup) {
        this.registry = Objects.requireNonNull(registry);
        this.serverGroup = Objects.requireNonNull(serverGroup);
    }

    @Override
    public void observe(String target, String call, CallStatus status, Duration latency) {
        Timer.builder(REQUEST_DURATION)
                .description("Latency of requests sent to the backends of a server group")
                .tag("server_group", serverGroup)
                .tag("host", target)
                .tag("call", call)
                .tag("status", status.tagValue())
                .register(registry)
                .record(latency);
    }
}
