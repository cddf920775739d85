/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.group;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.promfed.proxy.client.QueryClient;
import io.promfed.proxy.config.GroupConfig;
import io.promfed.proxy.internal.client.DirectQueryClient;
import io.promfed.proxy.internal.client.LabelInjectingClient;
import io.promfed.proxy.internal.client.MergeMember;
import io.promfed.proxy.internal.client.RemoteReadClient;
import io.promfed.proxy.internal.net.HttpTransport;
import io.promfed.proxy.model.LabelSet;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Builds the client stack of each target of a server group, all sharing the group's transport.
 */
public class TargetClientFactory {

    private final GroupConfig config;
    private final HttpTransport transport;

    public TargetClientFactory(GroupConfig config, HttpTransport transport) {
        this.config = Objects.requireNonNull(config);
        this.transport = Objects.requireNonNull(transport);
    }

    /**
     * @param relabeled labels of the target after relabeling
     * @return the merge member for the target
     * @throws TargetBuildException if the target has no usable address
     */
    public MergeMember create(LabelSet relabeled) throws TargetBuildException {
        TargetEndpoint endpoint = resolve(relabeled);
        QueryClient client = new DirectQueryClient(endpoint.address(), endpoint.baseUri(), transport, config.queryTimeout());
        if (config.remoteRead()) {
            client = new RemoteReadClient(endpoint.address(), endpoint.baseUri(), transport, client);
        }
        client = new LabelInjectingClient(client, endpoint.labels());
        return new MergeMember(endpoint.address(), endpoint.replicaKey(), client);
    }

    public TargetEndpoint resolve(LabelSet relabeled) throws TargetBuildException {
        String address = relabeled.get(LabelSet.ADDRESS_LABEL);
        if (address == null) {
            throw new TargetBuildException("target " + relabeled + " has no " + LabelSet.ADDRESS_LABEL + " label");
        }
        String scheme = relabeled.get(LabelSet.SCHEME_LABEL);
        if (scheme == null) {
            scheme = config.scheme();
        }
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new TargetBuildException("target " + address + " has unsupported scheme '" + scheme + "'");
        }
        URI baseUri;
        try {
            baseUri = new URI(scheme + "://" + address + pathPrefix());
        }
        catch (URISyntaxException e) {
            throw new TargetBuildException("target address '" + address + "' is not a valid host:port: " + e.getMessage(), e);
        }
        if (baseUri.getHost() == null || baseUri.getRawQuery() != null || baseUri.getRawFragment() != null
                || baseUri.getRawUserInfo() != null || !baseUri.getRawAuthority().equals(address)) {
            throw new TargetBuildException("target address '" + address + "' is not a valid host:port");
        }
        LabelSet injected = relabeled.withoutReserved().merge(config.labelSet());
        return new TargetEndpoint(address, baseUri, injected, replicaKey(relabeled.merge(config.labelSet())));
    }

    private String pathPrefix() {
        String prefix = config.pathPrefix();
        if (prefix.isEmpty() || "/".equals(prefix)) {
            return "";
        }
        if (!prefix.startsWith("/")) {
            prefix = "/" + prefix;
        }
        return prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
    }

    @Nullable
    private String replicaKey(LabelSet labels) {
        if (config.antiAffinityLabels().isEmpty()) {
            return null;
        }
        List<String> values = new ArrayList<>();
        boolean any = false;
        for (String name : config.antiAffinityLabels()) {
            String value = labels.getOrEmpty(name);
            any |= !value.isEmpty();
            values.add(name + "=" + value);
        }
        return any ? String.join(",", values) : null;
    }
}
