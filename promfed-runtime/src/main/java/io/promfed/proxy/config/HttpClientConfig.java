/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.config;

import java.net.URI;
import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Settings of the HTTP transport a server group uses to reach its backends.
 *
 * @param dialTimeout connect timeout
 * @param tlsConfig TLS settings, used for {@code https} targets
 * @param proxyUrl HTTP proxy every connection is tunnelled through
 * @param bearerToken static bearer token
 * @param bearerTokenFile file holding the bearer token, re-read for every request
 * @param basicAuth basic authentication credentials
 * @param maxConnectionsPerHost upper bound of pooled connections to one backend
 * @param idleConnectionTimeout pooled connections idle for longer are closed
 */
public record HttpClientConfig(@JsonProperty("dial_timeout") Duration dialTimeout,
                               @JsonProperty("tls_config") TlsConfig tlsConfig,
                               @JsonProperty("proxy_url") @Nullable URI proxyUrl,
                               @JsonProperty("bearer_token") @Nullable String bearerToken,
                               @JsonProperty("bearer_token_file") @Nullable String bearerTokenFile,
                               @JsonProperty("basic_auth") @Nullable BasicAuthConfig basicAuth,
                               @JsonProperty("max_connections_per_host") int maxConnectionsPerHost,
                               @JsonProperty("idle_connection_timeout") Duration idleConnectionTimeout) {

    public static final Duration DEFAULT_DIAL_TIMEOUT = Duration.ofMillis(200);
    public static final int DEFAULT_MAX_CONNECTIONS_PER_HOST = 1000;
    public static final Duration DEFAULT_IDLE_CONNECTION_TIMEOUT = Duration.ofMinutes(5);

    public static final HttpClientConfig DEFAULT = new HttpClientConfig(null, null, null, null, null, null, 0, null);

    public HttpClientConfig {
        if (dialTimeout == null || dialTimeout.isZero()) {
            dialTimeout = DEFAULT_DIAL_TIMEOUT;
        }
        if (tlsConfig == null) {
            tlsConfig = TlsConfig.DEFAULT;
        }
        if (maxConnectionsPerHost == 0) {
            maxConnectionsPerHost = DEFAULT_MAX_CONNECTIONS_PER_HOST;
        }
        if (idleConnectionTimeout == null || idleConnectionTimeout.isZero()) {
            idleConnectionTimeout = DEFAULT_IDLE_CONNECTION_TIMEOUT;
        }
    }

    void validate() throws ConfigException {
        if (dialTimeout.isNegative()) {
            throw new ConfigException("http_client: dial_timeout must not be negative");
        }
        if (maxConnectionsPerHost < 0) {
            throw new ConfigException("http_client: max_connections_per_host must be positive, was " + maxConnectionsPerHost);
        }
        if (idleConnectionTimeout.isNegative()) {
            throw new ConfigException("http_client: idle_connection_timeout must not be negative");
        }
        int authModes = (bearerToken != null ? 1 : 0) + (bearerTokenFile != null ? 1 : 0) + (basicAuth != null ? 1 : 0);
        if (authModes > 1) {
            throw new ConfigException("http_client: at most one of bearer_token, bearer_token_file and basic_auth may be configured");
        }
        if (basicAuth != null) {
            basicAuth.validate();
        }
        if (proxyUrl != null && (!"http".equals(proxyUrl.getScheme()) || proxyUrl.getHost() == null)) {
            throw new ConfigException("http_client: proxy_url must be an http URL with a host, was " + proxyUrl);
        }
        tlsConfig.validate();
    }

    @Override
    public String toString() {
        return "HttpClientConfig{dialTimeout=" + dialTimeout + ", tlsConfig=" + tlsConfig + ", proxyUrl=" + proxyUrl
                + ", bearerToken=" + (bearerToken == null ? null : "<secret>") + ", bearerTokenFile=" + bearerTokenFile
                + ", basicAuth=" + basicAuth + ", maxConnectionsPerHost=" + maxConnectionsPerHost
                + ", idleConnectionTimeout=" + idleConnectionTimeout + "}";
    }
}
