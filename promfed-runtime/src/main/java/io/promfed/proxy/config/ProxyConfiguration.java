/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.config;

import java.util.HashSet;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Top level configuration: the server groups the proxy federates.
 */
public record ProxyConfiguration(@JsonProperty("server_groups") List<GroupConfig> serverGroups) {

    public ProxyConfiguration {
        serverGroups = serverGroups == null ? List.of() : List.copyOf(serverGroups);
    }

    public void validate() throws ConfigException {
        var names = new HashSet<String>();
        for (GroupConfig group : serverGroups) {
            group.validate();
            if (!names.add(group.name())) {
                throw new ConfigException("duplicate server group name '" + group.name() + "'");
            }
        }
    }
}
