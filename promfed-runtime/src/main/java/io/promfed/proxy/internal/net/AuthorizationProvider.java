/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.net;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

import io.promfed.proxy.config.BasicAuthConfig;
import io.promfed.proxy.config.HttpClientConfig;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Supplies the {@code Authorization} header value of each request.
 * Secrets held in files are read again for every request so that rotated credentials are picked up.
 */
@FunctionalInterface
interface AuthorizationProvider {

    AuthorizationProvider NONE = () -> null;

    /**
     * @return the header value, or null if requests are sent without one
     * @throws IOException if a credentials file cannot be read
     */
    @Nullable
    String headerValue() throws IOException;

    static AuthorizationProvider forConfig(HttpClientConfig config) {
        if (config.bearerToken() != null) {
            String value = "Bearer " + config.bearerToken();
            return () -> value;
        }
        if (config.bearerTokenFile() != null) {
            Path tokenFile = Path.of(config.bearerTokenFile());
            return () -> "Bearer " + readSecret(tokenFile);
        }
        BasicAuthConfig basicAuth = config.basicAuth();
        if (basicAuth != null) {
            if (basicAuth.passwordFile() != null) {
                Path passwordFile = Path.of(basicAuth.passwordFile());
                return () -> basic(basicAuth.username(), readSecret(passwordFile));
            }
            String value = basic(basicAuth.username(), basicAuth.password() == null ? "" : basicAuth.password());
            return () -> value;
        }
        return NONE;
    }

    private static String readSecret(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8).strip();
    }

    private static String basic(String username, String password) {
        return "Basic " + Base64.getEncoder().encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
    }
}
