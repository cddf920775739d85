/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.config;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A fixed list of backend addresses sharing a set of labels.
 */
public record StaticTargetsConfig(@JsonProperty("targets") List<String> targets,
                                  @JsonProperty("labels") Map<String, String> labels) {

    public StaticTargetsConfig {
        targets = targets == null ? List.of() : List.copyOf(targets);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
