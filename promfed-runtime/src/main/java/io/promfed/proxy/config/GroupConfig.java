/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.promfed.proxy.model.LabelSet;

/**
 * Configuration of one server group: how its backends are discovered, relabeled, reached and merged.
 *
 * @param name identifies the group in logs and metrics
 * @param staticConfigs fixed target lists
 * @param scheme scheme of targets that do not set {@code __scheme__}
 * @param pathPrefix prepended to every API path
 * @param relabelConfigs relabel chain applied to every discovered target
 * @param labels labels added to every series the group returns, winning over target labels
 * @param remoteRead fetch raw data over the remote read protocol instead of the query API
 * @param antiAffinityLabels label names whose values identify replicas of the same data
 * @param ignoreError answer with partial data when some (but not all) backends failed
 * @param failureTolerance number of failed backends a merged call tolerates
 * @param queryTimeout timeout of every backend request
 * @param httpClient transport settings
 */
public record GroupConfig(@JsonProperty("name") String name,
                          @JsonProperty("static_configs") List<StaticTargetsConfig> staticConfigs,
                          @JsonProperty("scheme") String scheme,
                          @JsonProperty("path_prefix") String pathPrefix,
                          @JsonProperty("relabel_configs") List<RelabelConfig> relabelConfigs,
                          @JsonProperty("labels") Map<String, String> labels,
                          @JsonProperty("remote_read") boolean remoteRead,
                          @JsonProperty("anti_affinity_labels") List<String> antiAffinityLabels,
                          @JsonProperty("ignore_error") boolean ignoreError,
                          @JsonProperty("failure_tolerance") int failureTolerance,
                          @JsonProperty("query_timeout") Duration queryTimeout,
                          @JsonProperty("http_client") HttpClientConfig httpClient) {

    public static final String DEFAULT_NAME = "default";
    public static final String DEFAULT_SCHEME = "http";
    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofMinutes(1);

    private static final Pattern LABEL_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    public GroupConfig {
        if (name == null || name.isEmpty()) {
            name = DEFAULT_NAME;
        }
        staticConfigs = staticConfigs == null ? List.of() : List.copyOf(staticConfigs);
        if (scheme == null || scheme.isEmpty()) {
            scheme = DEFAULT_SCHEME;
        }
        if (pathPrefix == null) {
            pathPrefix = "";
        }
        relabelConfigs = relabelConfigs == null ? List.of() : List.copyOf(relabelConfigs);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        antiAffinityLabels = antiAffinityLabels == null ? List.of() : List.copyOf(antiAffinityLabels);
        if (queryTimeout == null || queryTimeout.isZero()) {
            queryTimeout = DEFAULT_QUERY_TIMEOUT;
        }
        if (httpClient == null) {
            httpClient = HttpClientConfig.DEFAULT;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the static labels as a label set
     */
    public LabelSet labelSet() {
        return LabelSet.of(labels);
    }

    /**
     * Checks the settings that records alone cannot enforce.
     *
     * @throws ConfigException if the configuration cannot be applied
     */
    public void validate() throws ConfigException {
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new ConfigException("server group '" + name + "': unsupported scheme '" + scheme + "'");
        }
        if (failureTolerance < 0) {
            throw new ConfigException("server group '" + name + "': failure_tolerance must not be negative");
        }
        if (queryTimeout.isNegative()) {
            throw new ConfigException("server group '" + name + "': query_timeout must not be negative");
        }
        for (String label : labels.keySet()) {
            if (!LABEL_NAME.matcher(label).matches() || LabelSet.isReserved(label)) {
                throw new ConfigException("server group '" + name + "': invalid label name '" + label + "'");
            }
        }
        for (String label : antiAffinityLabels) {
            if (!LABEL_NAME.matcher(label).matches()) {
                throw new ConfigException("server group '" + name + "': invalid anti-affinity label name '" + label + "'");
            }
        }
        for (RelabelConfig relabelConfig : relabelConfigs) {
            relabelConfig.validate();
        }
        httpClient.validate();
    }

    public static final class Builder {
        private String name;
        private final List<StaticTargetsConfig> staticConfigs = new ArrayList<>();
        private String scheme;
        private String pathPrefix;
        private final List<RelabelConfig> relabelConfigs = new ArrayList<>();
        private Map<String, String> labels;
        private boolean remoteRead;
        private List<String> antiAffinityLabels;
        private boolean ignoreError;
        private int failureTolerance;
        private Duration queryTimeout;
        private HttpClientConfig httpClient;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder staticTargets(Map<String, String> labels, String... targets) {
            this.staticConfigs.add(new StaticTargetsConfig(List.of(targets), labels));
            return this;
        }

        public Builder staticTargets(String... targets) {
            return staticTargets(Map.of(), targets);
        }

        public Builder scheme(String scheme) {
            this.scheme = scheme;
            return this;
        }

        public Builder pathPrefix(String pathPrefix) {
            this.pathPrefix = pathPrefix;
            return this;
        }

        public Builder relabel(RelabelConfig relabelConfig) {
            this.relabelConfigs.add(relabelConfig);
            return this;
        }

        public Builder labels(Map<String, String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder remoteRead(boolean remoteRead) {
            this.remoteRead = remoteRead;
            return this;
        }

        public Builder antiAffinityLabels(String... antiAffinityLabels) {
            this.antiAffinityLabels = List.of(antiAffinityLabels);
            return this;
        }

        public Builder ignoreError(boolean ignoreError) {
            this.ignoreError = ignoreError;
            return this;
        }

        public Builder failureTolerance(int failureTolerance) {
            this.failureTolerance = failureTolerance;
            return this;
        }

        public Builder queryTimeout(Duration queryTimeout) {
            this.queryTimeout = queryTimeout;
            return this;
        }

        public Builder httpClient(HttpClientConfig httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public GroupConfig build() {
            return new GroupConfig(name, staticConfigs, scheme, pathPrefix, relabelConfigs, labels, remoteRead, antiAffinityLabels, ignoreError,
                    failureTolerance, queryTimeout, httpClient);
        }
    }
}
