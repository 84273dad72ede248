package com.streambot.client.transport;

import com.streambot.client.NotConnectedException;
import com.streambot.client.StreamException;
import com.streambot.client.TransportException;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link TransportSession} over a Netty channel whose handshake has
 * completed.
 */
@Slf4j
class NettyTransportSession implements TransportSession {

    private final Channel channel;
    private final BlockingQueue<TransportEvent> inbound;
    private final long writeTimeoutMs;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    NettyTransportSession(Channel channel, BlockingQueue<TransportEvent> inbound, long writeTimeoutMs) {
        this.channel = channel;
        this.inbound = inbound;
        this.writeTimeoutMs = writeTimeoutMs;
    }

    @Override
    public void send(String text) throws StreamException {
        write(new TextWebSocketFrame(text));
    }

    @Override
    public void ping() throws StreamException {
        write(new PingWebSocketFrame(Unpooled.buffer(0)));
    }

    private void write(WebSocketFrame frame) throws StreamException {
        writeLock.lock();
        try {
            if (closed.get() || !channel.isActive()) {
                frame.release();
                throw new NotConnectedException("stream not connected");
            }
            ChannelFuture future = channel.writeAndFlush(frame);
            if (!future.await(writeTimeoutMs, TimeUnit.MILLISECONDS)) {
                throw new TransportException("write timed out after " + writeTimeoutMs + "ms");
            }
            if (!future.isSuccess()) {
                throw new TransportException("write failed: " + future.cause().getMessage(), future.cause());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("write interrupted", e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public TransportEvent nextEvent() throws InterruptedException {
        return inbound.take();
    }

    @Override
    public void abort(String reason) {
        if (closed.compareAndSet(false, true)) {
            log.debug("Aborting stream session: {}", reason);
            channel.close();
        }
        inbound.offer(TransportEvent.close(-1, reason));
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (channel.isActive()) {
            channel.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
        } else {
            channel.close();
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && channel.isActive();
    }
}
