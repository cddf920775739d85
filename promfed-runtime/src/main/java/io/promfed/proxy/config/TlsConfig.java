/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * TLS settings for connections to backends.
 *
 * @param caFile PEM bundle of trusted certificates, the JDK trust store if absent
 * @param certFile PEM client certificate
 * @param keyFile PEM (PKCS#8) client key
 * @param serverName name to verify the backend certificate against, the target host if absent
 * @param insecureSkipVerify disables certificate and host name verification
 */
public record TlsConfig(@JsonProperty("ca_file") @Nullable String caFile,
                        @JsonProperty("cert_file") @Nullable String certFile,
                        @JsonProperty("key_file") @Nullable String keyFile,
                        @JsonProperty("server_name") @Nullable String serverName,
                        @JsonProperty("insecure_skip_verify") boolean insecureSkipVerify) {

    public static final TlsConfig DEFAULT = new TlsConfig(null, null, null, null, false);

    void validate() throws ConfigException {
        if ((certFile == null) != (keyFile == null)) {
            throw new ConfigException("tls_config: cert_file and key_file must be configured together");
        }
    }
}
