/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.relabel;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.promfed.proxy.config.RelabelAction;
import io.promfed.proxy.config.RelabelConfig;
import io.promfed.proxy.model.LabelSet;

import static org.assertj.core.api.Assertions.assertThat;

class RelabelerTest {

    private static final LabelSet TARGET = LabelSet.of(
            LabelSet.ADDRESS_LABEL, "prom-1.eu:9090",
            "__meta_zone", "eu-west-1a",
            "env", "prod");

    @Test
    void shouldReturnInputForEmptyChain() {
        assertThat(Relabeler.process(TARGET, List.of())).isSameAs(TARGET);
    }

    @Test
    void shouldReplaceWithCaptureGroups() {
        var config = RelabelConfig.replace(List.of("__meta_zone"), "(\\w+-\\w+)-\\d(\\w)", "zone", "${1}/$2");

        assertThat(Relabeler.process(TARGET, List.of(config)).get("zone")).isEqualTo("eu-west/a");
    }

    @Test
    void shouldJoinSourceLabelsWithSeparator() {
        var config = RelabelConfig.replace(List.of("env", "__meta_zone"), "(.*)", "key", "$1");

        assertThat(Relabeler.process(TARGET, List.of(config)).get("key")).isEqualTo("prod;eu-west-1a");
    }

    @Test
    void shouldLeaveLabelsAloneWhenReplaceRegexDoesNotMatch() {
        var config = RelabelConfig.replace(List.of("env"), "staging", "tier", "test");

        assertThat(Relabeler.process(TARGET, List.of(config))).isEqualTo(TARGET);
    }

    @Test
    void shouldRemoveTargetLabelWhenReplacementIsEmpty() {
        var config = RelabelConfig.replace(List.of("env"), "prod", "env", "");

        assertThat(Relabeler.process(TARGET, List.of(config)).has("env")).isFalse();
    }

    @Test
    void shouldExpandMissingGroupsToEmpty() {
        var config = RelabelConfig.replace(List.of("env"), "(prod)", "x", "$1-$2-$name");

        assertThat(Relabeler.process(TARGET, List.of(config)).get("x")).isEqualTo("prod--");
    }

    @Test
    void shouldDropMatchingTargets() {
        var drop = RelabelConfig.of(RelabelAction.DROP, List.of("env"), "prod|staging");

        assertThat(Relabeler.process(TARGET, List.of(drop))).isNull();
    }

    @Test
    void shouldKeepOnlyMatchingTargets() {
        var keep = RelabelConfig.of(RelabelAction.KEEP, List.of("env"), "prod");
        var keepStaging = RelabelConfig.of(RelabelAction.KEEP, List.of("env"), "staging");

        assertThat(Relabeler.process(TARGET, List.of(keep))).isEqualTo(TARGET);
        assertThat(Relabeler.process(TARGET, List.of(keep, keepStaging))).isNull();
    }

    @Test
    void regexShouldBeAnchored() {
        var keep = RelabelConfig.of(RelabelAction.KEEP, List.of("env"), "pro");

        assertThat(Relabeler.process(TARGET, List.of(keep))).isNull();
    }

    @Test
    void shouldHashModSourceValue() {
        var config = new RelabelConfig(List.of(LabelSet.ADDRESS_LABEL), null, null, 4, "shard", null, RelabelAction.HASHMOD);

        LabelSet relabeled = Relabeler.process(TARGET, List.of(config));

        assertThat(Integer.parseInt(relabeled.get("shard"))).isBetween(0, 3);
        assertThat(Relabeler.process(TARGET, List.of(config))).isEqualTo(relabeled);
    }

    @Test
    void shouldMapLabelNames() {
        var config = new RelabelConfig(List.of(), null, "__meta_(.+)", 0, null, "$1", RelabelAction.LABELMAP);

        LabelSet relabeled = Relabeler.process(TARGET, List.of(config));

        assertThat(relabeled.get("zone")).isEqualTo("eu-west-1a");
        assertThat(relabeled.get("__meta_zone")).isEqualTo("eu-west-1a");
    }

    @Test
    void shouldDropAndKeepLabelNames() {
        var labelDrop = new RelabelConfig(List.of(), null, "__meta_.*", 0, null, null, RelabelAction.LABELDROP);
        var labelKeep = new RelabelConfig(List.of(), null, "__.*", 0, null, null, RelabelAction.LABELKEEP);

        assertThat(Relabeler.process(TARGET, List.of(labelDrop)).asMap()).containsOnlyKeys(LabelSet.ADDRESS_LABEL, "env");
        assertThat(Relabeler.process(TARGET, List.of(labelKeep)).asMap()).containsOnlyKeys(LabelSet.ADDRESS_LABEL, "__meta_zone");
    }

    @Test
    void shouldApplyStepsInOrder() {
        var rewriteAddress = RelabelConfig.replace(List.of(LabelSet.ADDRESS_LABEL), "([^:]+):\\d+", LabelSet.ADDRESS_LABEL, "$1:9091");
        var keepRewritten = RelabelConfig.of(RelabelAction.KEEP, List.of(LabelSet.ADDRESS_LABEL), ".*:9091");

        LabelSet relabeled = Relabeler.process(TARGET, List.of(rewriteAddress, keepRewritten));

        assertThat(relabeled.get(LabelSet.ADDRESS_LABEL)).isEqualTo("prom-1.eu:9091");
    }
}
