/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

public record BasicAuthConfig(@JsonProperty("username") String username,
                              @JsonProperty("password") @Nullable String password,
                              @JsonProperty("password_file") @Nullable String passwordFile) {

    void validate() throws ConfigException {
        if (username == null || username.isEmpty()) {
            throw new ConfigException("basic_auth: username is required");
        }
        if (password != null && passwordFile != null) {
            throw new ConfigException("basic_auth: at most one of password and password_file may be configured");
        }
    }

    @Override
    public String toString() {
        return "BasicAuthConfig{username='" + username + "', password=<secret>}";
    }
}
