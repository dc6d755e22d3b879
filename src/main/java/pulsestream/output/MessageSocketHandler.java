package pulsestream.output;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulsestream.core.BroadcastRouter;
import pulsestream.core.SchedulerBridge;

import java.util.function.Consumer;

/**
 * Per-channel handler that ties a WebSocket to the router once the handshake completes.
 * Everything here runs on the event loop, so it only enqueues and never blocks.
 */
class MessageSocketHandler extends SimpleChannelInboundHandler<WebSocketFrame> {
    private static final Logger logger = LoggerFactory.getLogger(MessageSocketHandler.class);

    private final BroadcastRouter router;
    private final SchedulerBridge bridge;
    private final String id;
    private final Consumer<MessageSocketConnection> onOpened;
    private final Consumer<MessageSocketConnection> onClosed;

    private MessageSocketConnection connection;

    MessageSocketHandler(BroadcastRouter router, SchedulerBridge bridge, String id,
                         Consumer<MessageSocketConnection> onOpened,
                         Consumer<MessageSocketConnection> onClosed) {
        this.router = router;
        this.bridge = bridge;
        this.id = id;
        this.onOpened = onOpened;
        this.onClosed = onClosed;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            connection = new MessageSocketConnection(id + "@" + ctx.channel().remoteAddress(), ctx.channel(), bridge);
            logger.info("New message client connected: {}", connection.id());
            onOpened.accept(connection);
            router.connect(connection);
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (frame instanceof TextWebSocketFrame) {
            String text = ((TextWebSocketFrame) frame).text();
            logger.debug("Received message from {}: {}", id, text);
            router.receiveCommand(text, connection);
        } else {
            logger.debug("Ignoring {} from message client {}", frame.getClass().getSimpleName(), id);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (connection != null) {
            router.disconnect(connection);
            connection.close();
            onClosed.accept(connection);
            logger.info("Message client disconnected: {}", connection.id());
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.warn("Message client {} error: {}", id, cause.toString());
        ctx.close();
    }
}
