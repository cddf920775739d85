/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.net;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBufUtil;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.pool.ChannelPool;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpUtil;

import io.promfed.proxy.client.BackendCallException;

/**
 * Completes the future of one request/response exchange on a pooled channel, then hands
 * the channel back to its pool. The handler is removed again when the channel is released.
 */
class ExchangeHandler extends SimpleChannelInboundHandler<FullHttpResponse> {

    static final String NAME = "exchange";

    private static final Logger LOGGER = LoggerFactory.getLogger(ExchangeHandler.class);

    private final TransportRequest request;
    private final CompletableFuture<TransportResponse> future;
    private final ChannelPool pool;
    private final Channel channel;
    private final AtomicBoolean released = new AtomicBoolean();

    ExchangeHandler(TransportRequest request, CompletableFuture<TransportResponse> future, ChannelPool pool, Channel channel) {
        this.request = request;
        this.future = future;
        this.pool = pool;
        this.channel = channel;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response) {
        var headers = new HashMap<String, String>();
        for (Map.Entry<String, String> header : response.headers()) {
            headers.putIfAbsent(header.getKey().toLowerCase(Locale.ROOT), header.getValue());
        }
        byte[] body = ByteBufUtil.getBytes(response.content());
        boolean keepAlive = HttpUtil.isKeepAlive(response);
        if (!keepAlive) {
            channel.close();
        }
        // back in the pool before the caller sees the response, so a follow-up request can reuse it
        release();
        future.complete(new TransportResponse(response.status().code(), headers, body));
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (future.completeExceptionally(new BackendCallException("connection closed before a response to " + request + " was received"))) {
            LOGGER.debug("Connection {} closed during {}", channel, request);
        }
        release();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.debug("Exchange {} on {} failed", request, channel, cause);
        future.completeExceptionally(new BackendCallException("request " + request + " failed: " + cause.getMessage(), cause));
        channel.close();
        release();
    }

    /**
     * Hands the channel back to the pool. Only the first call has an effect.
     */
    void release() {
        if (released.compareAndSet(false, true)) {
            pool.release(channel);
        }
    }
}
