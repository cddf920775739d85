/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.net;

import io.promfed.proxy.config.ConfigException;
import io.promfed.proxy.config.HttpClientConfig;

/**
 * Creates the transport of a server group from its {@code http_client} settings.
 */
@FunctionalInterface
public interface TransportFactory {

    TransportFactory NETTY = NettyHttpTransport::create;

    /**
     * @throws ConfigException if the settings cannot be used, e.g. unreadable TLS files
     */
    HttpTransport create(HttpClientConfig config) throws ConfigException;
}
