/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.internal.net;

import java.io.File;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.pool.AbstractChannelPoolMap;
import io.netty.channel.pool.ChannelPoolHandler;
import io.netty.channel.pool.FixedChannelPool;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpContentDecompressor;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.proxy.HttpProxyHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.resolver.NoopAddressResolverGroup;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.ScheduledFuture;

import io.promfed.proxy.client.BackendCallException;
import io.promfed.proxy.client.BackendTimeoutException;
import io.promfed.proxy.config.ConfigException;
import io.promfed.proxy.config.HttpClientConfig;
import io.promfed.proxy.config.TlsConfig;

/**
 * {@link HttpTransport} keeping one bounded pool of connections per backend host.
 * <p>
 * Every transport owns its event loop group, so closing a transport that has been replaced by a
 * reconfiguration releases all of its resources without touching the transport that replaced it.
 * </p>
 */
public class NettyHttpTransport implements HttpTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyHttpTransport.class);

    static final int MAX_CONTENT_LENGTH = 512 * 1024 * 1024;
    private static final String USER_AGENT = "promfed";

    private final HttpClientConfig config;
    private final EventLoopGroup group;
    private final SslContext sslContext;
    private final AuthorizationProvider authorization;
    private final AbstractChannelPoolMap<PoolKey, FixedChannelPool> pools;
    private final AtomicBoolean closed = new AtomicBoolean();

    private NettyHttpTransport(HttpClientConfig config, SslContext sslContext) {
        this.config = config;
        this.sslContext = sslContext;
        this.authorization = AuthorizationProvider.forConfig(config);
        this.group = new NioEventLoopGroup();
        this.pools = new AbstractChannelPoolMap<>() {
            @Override
            protected FixedChannelPool newPool(PoolKey key) {
                LOGGER.debug("Creating connection pool for {}", key);
                return new FixedChannelPool(bootstrap(key), new BackendPoolHandler(key), config.maxConnectionsPerHost());
            }
        };
    }

    /**
     * @param config transport settings
     * @return the transport
     * @throws ConfigException if the TLS material cannot be loaded
     */
    public static NettyHttpTransport create(HttpClientConfig config) throws ConfigException {
        return new NettyHttpTransport(config, buildSslContext(config.tlsConfig()));
    }

    private static SslContext buildSslContext(TlsConfig tls) throws ConfigException {
        try {
            SslContextBuilder builder = SslContextBuilder.forClient();
            if (tls.insecureSkipVerify()) {
                builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
            }
            else if (tls.caFile() != null) {
                builder.trustManager(new File(tls.caFile()));
            }
            if (tls.certFile() != null && tls.keyFile() != null) {
                builder.keyManager(new File(tls.certFile()), new File(tls.keyFile()));
            }
            return builder.build();
        }
        catch (IOException | IllegalArgumentException e) {
            throw new ConfigException("tls_config: cannot load TLS material: " + e.getMessage(), e);
        }
    }

    private Bootstrap bootstrap(PoolKey key) {
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, config.dialTimeout().toMillis()))
                .option(ChannelOption.SO_KEEPALIVE, true);
        if (config.proxyUrl() != null) {
            // the proxy resolves the backend host
            return bootstrap.resolver(NoopAddressResolverGroup.INSTANCE)
                    .remoteAddress(InetSocketAddress.createUnresolved(key.host(), key.port()));
        }
        return bootstrap.remoteAddress(key.host(), key.port());
    }

    @Override
    public CompletableFuture<TransportResponse> send(TransportRequest request) {
        CompletableFuture<TransportResponse> future = new CompletableFuture<>();
        if (closed.get()) {
            future.completeExceptionally(new BackendCallException("transport is closed, cannot send " + request));
            return future;
        }
        FullHttpRequest httpRequest;
        FixedChannelPool pool;
        try {
            httpRequest = toHttpRequest(request);
            pool = pools.get(PoolKey.of(request.uri()));
        }
        catch (IOException e) {
            future.completeExceptionally(new BackendCallException("cannot read credentials for " + request, e));
            return future;
        }
        catch (IllegalStateException e) {
            // the pool map rejects lookups once closed
            future.completeExceptionally(new BackendCallException("transport is closed, cannot send " + request, e));
            return future;
        }

        Future<Channel> acquire = pool.acquire();
        future.whenComplete((response, error) -> {
            if (future.isCancelled()) {
                acquire.cancel(false);
            }
        });
        acquire.addListener((Future<Channel> f) -> {
            if (!f.isSuccess()) {
                httpRequest.release();
                if (!f.isCancelled()) {
                    future.completeExceptionally(new BackendCallException("cannot connect to " + request.uri().getAuthority() + ": "
                            + f.cause().getMessage(), f.cause()));
                }
                return;
            }
            exchange(request, httpRequest, pool, f.getNow(), future);
        });
        return future;
    }

    private void exchange(TransportRequest request, FullHttpRequest httpRequest, FixedChannelPool pool, Channel channel,
                          CompletableFuture<TransportResponse> future) {
        var handler = new ExchangeHandler(request, future, pool, channel);
        if (future.isDone()) {
            // cancelled while waiting for a connection
            httpRequest.release();
            handler.release();
            return;
        }
        channel.pipeline().addLast(ExchangeHandler.NAME, handler);

        ScheduledFuture<?> timeout = channel.eventLoop().schedule(() -> {
            if (future.completeExceptionally(new BackendTimeoutException(request + " timed out after " + request.timeout()))) {
                channel.close();
            }
        }, request.timeout().toNanos(), TimeUnit.NANOSECONDS);

        future.whenComplete((response, error) -> {
            timeout.cancel(false);
            if (future.isCancelled()) {
                LOGGER.debug("{} cancelled, closing {}", request, channel);
                channel.close();
            }
        });

        channel.writeAndFlush(httpRequest).addListener((ChannelFutureListener) write -> {
            if (!write.isSuccess()) {
                future.completeExceptionally(new BackendCallException("cannot send " + request + ": " + write.cause().getMessage(), write.cause()));
                channel.close();
            }
        });
    }

    private FullHttpRequest toHttpRequest(TransportRequest request) throws IOException {
        URI uri = request.uri();
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            path = path + "?" + uri.getRawQuery();
        }
        FullHttpRequest httpRequest = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, request.method(), path,
                Unpooled.wrappedBuffer(request.body()));
        var headers = httpRequest.headers();
        headers.set(HttpHeaderNames.HOST, uri.getPort() == -1 ? uri.getHost() : uri.getHost() + ":" + uri.getPort());
        headers.set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
        headers.set(HttpHeaderNames.ACCEPT_ENCODING, HttpHeaderValues.GZIP);
        headers.set(HttpHeaderNames.USER_AGENT, USER_AGENT);
        headers.setInt(HttpHeaderNames.CONTENT_LENGTH, request.body().length);
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            headers.set(header.getKey(), header.getValue());
        }
        String authorizationValue = authorization.headerValue();
        if (authorizationValue != null) {
            headers.set(HttpHeaderNames.AUTHORIZATION, authorizationValue);
        }
        return httpRequest;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            LOGGER.debug("Closing transport");
            pools.close();
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
    }

    /**
     * Identifies the connection pool of one backend host.
     */
    record PoolKey(boolean secure, String host, int port) {

        static PoolKey of(URI uri) {
            boolean secure = "https".equalsIgnoreCase(uri.getScheme());
            int port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);
            return new PoolKey(secure, uri.getHost(), port);
        }

        @Override
        public String toString() {
            return (secure ? "https://" : "http://") + host + ":" + port;
        }
    }

    /**
     * Sets up the pipeline of new pooled connections and cleans up per-exchange state on release.
     */
    private class BackendPoolHandler implements ChannelPoolHandler {
        private final PoolKey key;

        BackendPoolHandler(PoolKey key) {
            this.key = key;
        }

        @Override
        public void channelCreated(Channel ch) {
            ChannelPipeline p = ch.pipeline();
            URI proxyUrl = config.proxyUrl();
            if (proxyUrl != null) {
                int proxyPort = proxyUrl.getPort() == -1 ? 80 : proxyUrl.getPort();
                p.addLast("proxy", new HttpProxyHandler(new InetSocketAddress(proxyUrl.getHost(), proxyPort)));
            }
            if (key.secure()) {
                p.addLast("ssl", sslHandler(ch));
            }
            long idleMillis = config.idleConnectionTimeout().toMillis();
            p.addLast("idle", new IdleStateHandler(0, 0, idleMillis, TimeUnit.MILLISECONDS));
            p.addLast("idleCloser", new IdleConnectionCloser());
            p.addLast("httpCodec", new HttpClientCodec());
            p.addLast("httpDecompressor", new HttpContentDecompressor());
            p.addLast("httpAggregator", new HttpObjectAggregator(MAX_CONTENT_LENGTH));
        }

        private SslHandler sslHandler(Channel ch) {
            TlsConfig tls = config.tlsConfig();
            String peerHost = tls.serverName() != null ? tls.serverName() : key.host();
            SslHandler handler = sslContext.newHandler(ch.alloc(), peerHost, key.port());
            if (!tls.insecureSkipVerify()) {
                SSLEngine engine = handler.engine();
                SSLParameters parameters = engine.getSSLParameters();
                parameters.setEndpointIdentificationAlgorithm("HTTPS");
                engine.setSSLParameters(parameters);
            }
            return handler;
        }

        @Override
        public void channelReleased(Channel ch) {
            if (ch.pipeline().get(ExchangeHandler.NAME) != null) {
                ch.pipeline().remove(ExchangeHandler.NAME);
            }
        }

        @Override
        public void channelAcquired(Channel ch) {
            // per-exchange handlers are added by send
        }
    }

    private static class IdleConnectionCloser extends ChannelInboundHandlerAdapter {
        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt instanceof IdleStateEvent) {
                LOGGER.debug("Closing idle connection {}", ctx.channel());
                ctx.close();
            }
            else {
                super.userEventTriggered(ctx, evt);
            }
        }
    }

    @Override
    public String toString() {
        return "NettyHttpTransport{" + config + "}";
    }
}
