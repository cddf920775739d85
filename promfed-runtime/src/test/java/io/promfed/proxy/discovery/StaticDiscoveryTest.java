/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.discovery;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.promfed.proxy.config.ConfigException;
import io.promfed.proxy.config.GroupConfig;
import io.promfed.proxy.model.LabelSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StaticDiscoveryTest {

    private final StaticDiscovery discovery = new StaticDiscovery();

    @Test
    void shouldDeliverStaticTargetsOnSubscribe() throws Exception {
        var config = GroupConfig.builder()
                .staticTargets(Map.of("dc", "a"), "prom-1:9090", " prom-2:9090 ")
                .staticTargets("prom-3:9090")
                .build();
        var updates = new ArrayList<Map<String, List<TargetGroup>>>();

        try (var subscription = discovery.subscribe(config, updates::add)) {
            assertThat(subscription).isNotNull();
        }

        assertThat(updates).singleElement().satisfies(update -> {
            assertThat(update).containsOnlyKeys(StaticDiscovery.JOB_NAME);
            assertThat(update.get(StaticDiscovery.JOB_NAME)).containsExactly(
                    new TargetGroup("0", List.of(LabelSet.of("__address__", "prom-1:9090"), LabelSet.of("__address__", "prom-2:9090")),
                            LabelSet.of("dc", "a")),
                    new TargetGroup("1", List.of(LabelSet.of("__address__", "prom-3:9090")), LabelSet.empty()));
        });
    }

    @Test
    void shouldDeliverEmptyJobWithoutStaticConfigs() throws Exception {
        var updates = new ArrayList<Map<String, List<TargetGroup>>>();

        discovery.subscribe(GroupConfig.builder().build(), updates::add).cancel();

        assertThat(updates).containsExactly(Map.of(StaticDiscovery.JOB_NAME, List.of()));
    }

    @Test
    void shouldRejectBlankAddress() {
        var config = GroupConfig.builder().name("eu").staticTargets("prom-1:9090", " ").build();
        var updates = new ArrayList<Map<String, List<TargetGroup>>>();

        assertThatThrownBy(() -> discovery.subscribe(config, updates::add))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("'eu'");
        assertThat(updates).isEmpty();
    }
}
