package com.streambot.client.transport;

import com.streambot.client.TransportException;
import com.streambot.common.logging.LogRedact;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Netty websocket client. {@code wss://} endpoints are opened over TLS
 * without certificate or hostname validation, matching the vendor's
 * deployment.
 */
@Slf4j
public class NettyTransportConnector implements TransportConnector {

    private static final int MAX_FRAME_SIZE = 1024 * 1024;

    private final EventLoopGroup group;
    private final long handshakeTimeoutMs;
    private final long writeTimeoutMs;

    public NettyTransportConnector(long handshakeTimeoutMs) {
        this(handshakeTimeoutMs, handshakeTimeoutMs);
    }

    public NettyTransportConnector(long handshakeTimeoutMs, long writeTimeoutMs) {
        this.handshakeTimeoutMs = handshakeTimeoutMs;
        this.writeTimeoutMs = writeTimeoutMs;
        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory("streambot-transport", true));
    }

    @Override
    public TransportSession open(String url) throws TransportException {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new TransportException("invalid websocket url", e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase();
        if (!"ws".equals(scheme) && !"wss".equals(scheme)) {
            throw new TransportException("unsupported websocket scheme: " + scheme);
        }
        boolean tls = "wss".equals(scheme);
        String host = uri.getHost();
        int port = uri.getPort() != -1 ? uri.getPort() : (tls ? 443 : 80);

        SslContext sslContext = null;
        if (tls) {
            try {
                sslContext = SslContextBuilder.forClient()
                        .trustManager(InsecureTrustManagerFactory.INSTANCE)
                        .build();
            } catch (SSLException e) {
                throw new TransportException("cannot build TLS context", e);
            }
        }

        BlockingQueue<TransportEvent> inbound = new LinkedBlockingQueue<>();
        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, true, new DefaultHttpHeaders(), MAX_FRAME_SIZE);
        StreamChannelHandler handler = new StreamChannelHandler(handshaker, inbound);
        SslContext ssl = sslContext;

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) handshakeTimeoutMs)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (ssl != null) {
                            p.addLast(ssl.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(
                                new HttpClientCodec(),
                                new HttpObjectAggregator(65536),
                                new WebSocketFrameAggregator(MAX_FRAME_SIZE),
                                handler);
                    }
                });

        String safeUrl = LogRedact.redact(url);
        Channel channel = null;
        try {
            ChannelFuture connect = bootstrap.connect(host, port);
            if (!connect.await(handshakeTimeoutMs, TimeUnit.MILLISECONDS)) {
                connect.cancel(true);
                throw new TransportException("connect to " + safeUrl + " timed out");
            }
            if (!connect.isSuccess()) {
                throw new TransportException("connect to " + safeUrl + " failed: "
                        + connect.cause().getMessage(), connect.cause());
            }
            channel = connect.channel();

            if (!handler.handshakeFuture().await(handshakeTimeoutMs, TimeUnit.MILLISECONDS)) {
                channel.close();
                throw new TransportException("websocket handshake with " + safeUrl + " timed out");
            }
            if (!handler.handshakeFuture().isSuccess()) {
                channel.close();
                Throwable cause = handler.handshakeFuture().cause();
                throw new TransportException("websocket handshake with " + safeUrl + " failed: "
                        + cause.getMessage(), cause);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (channel != null) {
                channel.close();
            }
            throw new TransportException("websocket connect interrupted", e);
        }

        log.debug("Websocket open: {}", safeUrl);
        return new NettyTransportSession(channel, inbound, writeTimeoutMs);
    }

    @Override
    public void close() {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }
}
