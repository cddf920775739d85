/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.metrics;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerClientMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MicrometerClientMetrics metrics = new MicrometerClientMetrics(registry, "eu");

    @Test
    void shouldRecordLatencyPerTargetCallAndStatus() {
        metrics.observe("http://prom-1:9090", "query", CallStatus.SUCCESS, Duration.ofMillis(20));
        metrics.observe("http://prom-1:9090", "query", CallStatus.SUCCESS, Duration.ofMillis(40));
        metrics.observe("http://prom-1:9090", "query", CallStatus.ERROR, Duration.ofMillis(5));
        metrics.observe("http://prom-2:9090", "series", CallStatus.SUCCESS, Duration.ofMillis(1));

        Timer successes = registry.get(MicrometerClientMetrics.REQUEST_DURATION)
                .tags("server_group", "eu", "host", "http://prom-1:9090", "call", "query", "status", "success")
                .timer();
        assertThat(successes.count()).isEqualTo(2);
        assertThat(successes.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(60.0);

        assertThat(registry.get(MicrometerClientMetrics.REQUEST_DURATION).tag("status", "error").timer().count()).isEqualTo(1);
        assertThat(registry.get(MicrometerClientMetrics.REQUEST_DURATION).tag("call", "series").timer().count()).isEqualTo(1);
        assertThat(registry.find(MicrometerClientMetrics.REQUEST_DURATION).timers()).hasSize(3);
    }
}
