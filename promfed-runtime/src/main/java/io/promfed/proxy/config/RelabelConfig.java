/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.config;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * One step of a relabel chain, with the usual Prometheus defaults.
 */
public record RelabelConfig(@JsonProperty("source_labels") List<String> sourceLabels,
                            @JsonProperty("separator") String separator,
                            @JsonProperty("regex") String regex,
                            @JsonProperty("modulus") long modulus,
                            @JsonProperty("target_label") @Nullable String targetLabel,
                            @JsonProperty("replacement") String replacement,
                            @JsonProperty("action") RelabelAction action) {

    public static final String DEFAULT_SEPARATOR = ";";
    public static final String DEFAULT_REGEX = "(.*)";
    public static final String DEFAULT_REPLACEMENT = "$1";

    public RelabelConfig {
        sourceLabels = sourceLabels == null ? List.of() : List.copyOf(sourceLabels);
        if (separator == null) {
            separator = DEFAULT_SEPARATOR;
        }
        if (regex == null) {
            regex = DEFAULT_REGEX;
        }
        if (replacement == null) {
            replacement = DEFAULT_REPLACEMENT;
        }
        if (action == null) {
            action = RelabelAction.REPLACE;
        }
    }

    public static RelabelConfig of(RelabelAction action, List<String> sourceLabels, String regex) {
        return new RelabelConfig(sourceLabels, null, regex, 0, null, null, action);
    }

    public static RelabelConfig replace(List<String> sourceLabels, String regex, String targetLabel, String replacement) {
        return new RelabelConfig(sourceLabels, null, regex, 0, targetLabel, replacement, RelabelAction.REPLACE);
    }

    /**
     * @return the regex, anchored at both ends
     */
    public Pattern compiledRegex() {
        return Pattern.compile("^(?:" + regex + ")$");
    }

    void validate() throws ConfigException {
        try {
            compiledRegex();
        }
        catch (PatternSyntaxException e) {
            throw new ConfigException("relabel_configs: invalid regex '" + regex + "'", e);
        }
        switch (action) {
            case REPLACE -> {
                if (targetLabel == null || targetLabel.isEmpty()) {
                    throw new ConfigException("relabel_configs: 'replace' requires target_label");
                }
            }
            case HASHMOD -> {
                if (targetLabel == null || targetLabel.isEmpty()) {
                    throw new ConfigException("relabel_configs: 'hashmod' requires target_label");
                }
                if (modulus <= 0) {
                    throw new ConfigException("relabel_configs: 'hashmod' requires a positive modulus");
                }
            }
            case KEEP, DROP -> {
                if (sourceLabels.isEmpty()) {
                    throw new ConfigException("relabel_configs: '" + action.configName() + "' requires source_labels");
                }
            }
            default -> {
                // label name actions only need the regex
            }
        }
    }
}
