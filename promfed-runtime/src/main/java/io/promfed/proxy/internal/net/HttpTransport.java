/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.net;

import java.util.concurrent.CompletableFuture;

/**
 * Sends HTTP requests to backends over pooled connections.
 * <p>
 * The returned future fails with a {@link io.promfed.proxy.client.BackendTimeoutException} when the exchange
 * exceeds the request timeout and with a {@link io.promfed.proxy.client.BackendCallException} on
 * connection failures. Cancelling it aborts the exchange and closes the connection it used.
 * Non-2xx responses are not failures at this level.
 * </p>
 */
public interface HttpTransport extends AutoCloseable {

    CompletableFuture<TransportResponse> send(TransportRequest request);

    /**
     * Closes every pooled connection. In-flight exchanges fail. Calling it again has no effect.
     */
    @Override
    void close();
}
