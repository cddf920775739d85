/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.discovery;

import java.util.List;

import io.promfed.proxy.model.LabelSet;

/**
 * Targets found by discovery, with the labels they share.
 *
 * @param source identifies the group within its job
 * @param targets label sets of the targets, each holding at least {@code __address__}
 * @param labels labels common to every target of the group, overridden by target labels
 */
public record TargetGroup(String source, List<LabelSet> targets, LabelSet labels) {

    public TargetGroup {
        targets = List.copyOf(targets);
    }
}
