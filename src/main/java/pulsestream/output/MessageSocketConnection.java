package pulsestream.output;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulsestream.core.ClientConnection;
import pulsestream.core.ClientKind;
import pulsestream.core.SchedulerBridge;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A WebSocket client served by the event loop. {@link #send(String)} never blocks: payloads go through the
 * connection's own {@link SchedulerBridge.Subscription} and are written by a task running on the channel's loop.
 * A failed write marks the connection dead, and the next send reports it so the router can evict it.
 */
public class MessageSocketConnection implements ClientConnection {
    private static final Logger logger = LoggerFactory.getLogger(MessageSocketConnection.class);

    private final String id;
    private final Channel channel;
    private final SchedulerBridge.Subscription subscription;
    private final AtomicBoolean failed = new AtomicBoolean(false);

    public MessageSocketConnection(String id, Channel channel, SchedulerBridge bridge) {
        this.id = id;
        this.channel = channel;
        this.subscription = bridge.subscribe(channel.eventLoop(), this::write);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ClientKind kind() {
        return ClientKind.MESSAGE;
    }

    @Override
    public void send(String json) throws IOException {
        if (failed.get() || !channel.isActive() || subscription.isCancelled()) {
            throw new IOException("Connection " + id + " is closed");
        }
        try {
            subscription.offer(json);
        } catch (IllegalStateException e) {
            throw new IOException("Connection " + id + " cannot accept events", e);
        }
    }

    @Override
    public void close() {
        subscription.cancel();
        if (channel.isOpen()) {
            channel.close();
        }
    }

    /**
     * @return payloads waiting to be written by the loop
     */
    public int pending() {
        return subscription.pending();
    }

    // Runs on the event loop
    private void write(String json) {
        channel.writeAndFlush(new TextWebSocketFrame(json)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess() && failed.compareAndSet(false, true)) {
                logger.warn("Failed to send to message client {}: {}", id, String.valueOf(future.cause()));
            }
        });
    }

    @Override
    public String toString() {
        return "MessageSocketConnection{" + id + "}";
    }
}
