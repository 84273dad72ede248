package com.streambot.client.transport;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.BlockingQueue;

/**
 * Completes the client handshake, then turns websocket frames into
 * {@link TransportEvent}s on the session's receive queue.
 */
@Slf4j
class StreamChannelHandler extends SimpleChannelInboundHandler<Object> {

    private final WebSocketClientHandshaker handshaker;
    private final BlockingQueue<TransportEvent> inbound;
    private ChannelPromise handshakeFuture;

    StreamChannelHandler(WebSocketClientHandshaker handshaker, BlockingQueue<TransportEvent> inbound) {
        this.handshaker = handshaker;
        this.inbound = inbound;
    }

    ChannelPromise handshakeFuture() {
        return handshakeFuture;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        handshakeFuture = ctx.newPromise();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        if (!handshakeFuture.isDone()) {
            handshakeFuture.tryFailure(new WebSocketHandshakeException("connection closed during handshake"));
        }
        inbound.offer(TransportEvent.close(-1, "connection closed"));
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        Channel ch = ctx.channel();
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ch, (FullHttpResponse) msg);
                handshakeFuture.trySuccess();
            } catch (WebSocketHandshakeException e) {
                handshakeFuture.tryFailure(e);
            }
            return;
        }

        if (msg instanceof FullHttpResponse response) {
            inbound.offer(TransportEvent.other("unexpected HTTP response " + response.status()));
            return;
        }

        WebSocketFrame frame = (WebSocketFrame) msg;
        if (frame instanceof TextWebSocketFrame text) {
            inbound.offer(TransportEvent.text(text.text()));
        } else if (frame instanceof PongWebSocketFrame) {
            inbound.offer(TransportEvent.pong());
        } else if (frame instanceof PingWebSocketFrame) {
            ch.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
            inbound.offer(TransportEvent.other("ping"));
        } else if (frame instanceof CloseWebSocketFrame close) {
            inbound.offer(TransportEvent.close(close.statusCode(), close.reasonText()));
            ch.close();
        } else {
            inbound.offer(TransportEvent.other(frame.getClass().getSimpleName()));
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (!handshakeFuture.isDone()) {
            handshakeFuture.tryFailure(cause);
        } else {
            inbound.offer(TransportEvent.error(cause));
        }
        log.debug("Stream channel error: {}", cause.getMessage());
        ctx.close();
    }
}
