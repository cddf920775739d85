/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.config;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigParserTest {

    private final ConfigParser parser = new ConfigParser();

    @Test
    void shouldParseFullGroupConfiguration() throws Exception {
        ProxyConfiguration configuration = parser.parseConfiguration("""
                server_groups:
                  - name: eu
                    static_configs:
                      - targets: ["prom-1:9090", "prom-2:9090"]
                        labels:
                          dc: eu-west
                    scheme: https
                    path_prefix: /prometheus
                    relabel_configs:
                      - source_labels: [__address__]
                        regex: "prom-(\\\\d+):9090"
                        target_label: replica
                        replacement: "r$1"
                      - action: drop
                        source_labels: [replica]
                        regex: r9
                    labels:
                      region: eu
                    remote_read: true
                    anti_affinity_labels: [dc]
                    ignore_error: true
                    failure_tolerance: 1
                    query_timeout: 30s
                    http_client:
                      dial_timeout: 1s
                      tls_config:
                        insecure_skip_verify: true
                        server_name: prom.internal
                      proxy_url: http://proxy:3128
                      bearer_token: s3cret
                      max_connections_per_host: 16
                      idle_connection_timeout: 1m30s
                """);

        assertThat(configuration.serverGroups()).hasSize(1);
        GroupConfig group = configuration.serverGroups().get(0);
        assertThat(group.name()).isEqualTo("eu");
        assertThat(group.staticConfigs()).containsExactly(
                new StaticTargetsConfig(List.of("prom-1:9090", "prom-2:9090"), Map.of("dc", "eu-west")));
        assertThat(group.scheme()).isEqualTo("https");
        assertThat(group.pathPrefix()).isEqualTo("/prometheus");
        assertThat(group.relabelConfigs()).hasSize(2);
        assertThat(group.relabelConfigs().get(0).regex()).isEqualTo("prom-(\\d+):9090");
        assertThat(group.relabelConfigs().get(0).action()).isEqualTo(RelabelAction.REPLACE);
        assertThat(group.relabelConfigs().get(0).separator()).isEqualTo(";");
        assertThat(group.relabelConfigs().get(1).action()).isEqualTo(RelabelAction.DROP);
        assertThat(group.labels()).containsExactly(Map.entry("region", "eu"));
        assertThat(group.remoteRead()).isTrue();
        assertThat(group.antiAffinityLabels()).containsExactly("dc");
        assertThat(group.ignoreError()).isTrue();
        assertThat(group.failureTolerance()).isEqualTo(1);
        assertThat(group.queryTimeout()).isEqualTo(Duration.ofSeconds(30));

        HttpClientConfig httpClient = group.httpClient();
        assertThat(httpClient.dialTimeout()).isEqualTo(Duration.ofSeconds(1));
        assertThat(httpClient.tlsConfig().insecureSkipVerify()).isTrue();
        assertThat(httpClient.tlsConfig().serverName()).isEqualTo("prom.internal");
        assertThat(httpClient.proxyUrl()).isEqualTo(URI.create("http://proxy:3128"));
        assertThat(httpClient.bearerToken()).isEqualTo("s3cret");
        assertThat(httpClient.maxConnectionsPerHost()).isEqualTo(16);
        assertThat(httpClient.idleConnectionTimeout()).isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    void shouldApplyDefaults() throws Exception {
        GroupConfig group = parser.parseGroupConfig("""
                static_configs:
                  - targets: ["localhost:9090"]
                """);

        assertThat(group).isEqualTo(GroupConfig.builder().staticTargets("localhost:9090").build());
        assertThat(group.name()).isEqualTo(GroupConfig.DEFAULT_NAME);
        assertThat(group.scheme()).isEqualTo("http");
        assertThat(group.pathPrefix()).isEmpty();
        assertThat(group.failureTolerance()).isZero();
        assertThat(group.queryTimeout()).isEqualTo(GroupConfig.DEFAULT_QUERY_TIMEOUT);
        assertThat(group.httpClient()).isEqualTo(HttpClientConfig.DEFAULT);
        assertThat(group.httpClient().maxConnectionsPerHost()).isEqualTo(HttpClientConfig.DEFAULT_MAX_CONNECTIONS_PER_HOST);
        assertThat(group.httpClient().idleConnectionTimeout()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void shouldParseEmptyDocument() throws Exception {
        assertThat(parser.parseConfiguration("").serverGroups()).isEmpty();
    }

    @Test
    void shouldRejectUnknownKeys() {
        assertThatThrownBy(() -> parser.parseGroupConfig("nmae: eu"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("nmae");
    }

    @Test
    void shouldRejectMalformedDuration() {
        assertThatThrownBy(() -> parser.parseGroupConfig("query_timeout: soon"))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void shouldRejectUnknownRelabelAction() {
        assertThatThrownBy(() -> parser.parseGroupConfig("""
                relabel_configs:
                  - action: rename
                """))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void shouldRejectSeveralAuthenticationModes() {
        assertThatThrownBy(() -> parser.parseGroupConfig("""
                http_client:
                  bearer_token: a
                  basic_auth:
                    username: u
                    password: p
                """))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("at most one of");
    }

    @Test
    void shouldRejectInvalidRelabelRegex() {
        assertThatThrownBy(() -> parser.parseGroupConfig("""
                relabel_configs:
                  - action: keep
                    source_labels: [env]
                    regex: "prod("
                """))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("invalid regex");
    }

    @Test
    void shouldRejectReplaceWithoutTargetLabel() {
        assertThatThrownBy(() -> parser.parseGroupConfig("""
                relabel_configs:
                  - source_labels: [env]
                """))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("target_label");
    }

    @Test
    void shouldRejectReservedStaticLabels() {
        var config = GroupConfig.builder().labels(Map.of("__scheme__", "https")).build();

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("__scheme__");
    }

    @Test
    void shouldRejectDuplicateGroupNames() {
        assertThatThrownBy(() -> parser.parseConfiguration("""
                server_groups:
                  - name: a
                  - name: a
                """))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("duplicate");
    }

    @Test
    void shouldRejectNegativeFailureTolerance() {
        assertThatThrownBy(() -> parser.parseGroupConfig("failure_tolerance: -1"))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void shouldRejectCertificateWithoutKey() {
        assertThatThrownBy(() -> parser.parseGroupConfig("""
                http_client:
                  tls_config:
                    cert_file: /etc/certs/client.pem
                """))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("key_file");
    }

    @Test
    void shouldNotRevealSecretsInToString() {
        var config = new HttpClientConfig(null, null, null, "s3cret", null, null, 0, null);

        assertThat(config.toString()).doesNotContain("s3cret");
    }
}
