package pulsestream.output;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulsestream.core.BroadcastRouter;
import pulsestream.core.SchedulerBridge;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * WebSocket server for dashboard clients. A single event-loop thread accepts and serves every connection;
 * events reach it only through the {@link SchedulerBridge}.
 */
public class MessageSocketServer implements ClientTransport {
    private static final Logger logger = LoggerFactory.getLogger(MessageSocketServer.class);
    private static final int MAX_CONTENT_LENGTH = 65536;

    private final String host;
    private final int port;
    private final BroadcastRouter router;
    private final SchedulerBridge bridge;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger connectionCounter = new AtomicInteger();
    private final Set<MessageSocketConnection> connections = ConcurrentHashMap.newKeySet();

    private EventLoopGroup loopGroup;
    private volatile Channel serverChannel;

    public MessageSocketServer(String host, int port, BroadcastRouter router, SchedulerBridge bridge) {
        this.host = host;
        this.port = port;
        this.router = Objects.requireNonNull(router, "router cannot be null");
        this.bridge = Objects.requireNonNull(bridge, "bridge cannot be null");
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            loopGroup = new NioEventLoopGroup(1, r -> {
                Thread t = new Thread(r, "message-socket-loop");
                t.setDaemon(true);
                return t;
            });
            try {
                ServerBootstrap bootstrap = new ServerBootstrap()
                        .group(loopGroup)
                        .channel(NioServerSocketChannel.class)
                        .option(ChannelOption.SO_REUSEADDR, true)
                        .childOption(ChannelOption.TCP_NODELAY, true)
                        .childHandler(new ChannelInitializer<SocketChannel>() {
                            @Override
                            protected void initChannel(SocketChannel ch) {
                                ch.pipeline()
                                        .addLast(new HttpServerCodec())
                                        .addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH))
                                        .addLast(new WebSocketServerProtocolHandler(
                                                "/", null, true, MAX_CONTENT_LENGTH, false, true))
                                        .addLast(new MessageSocketHandler(router, bridge,
                                                "message-" + connectionCounter.incrementAndGet(),
                                                connections::add, connections::remove));
                            }
                        });

                serverChannel = bootstrap.bind(new InetSocketAddress(host, port)).sync().channel();
                logger.info("Message socket server started on {}:{}", host, getPort());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                shutdownLoop();
                running.set(false);
                throw new RuntimeException("Interrupted while starting message socket server", e);
            } catch (Exception e) {
                shutdownLoop();
                running.set(false);
                throw new RuntimeException("Failed to start message socket server on " + host + ":" + port, e);
            }
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
            for (MessageSocketConnection connection : connections) {
                router.disconnect(connection);
                connection.close();
            }
            connections.clear();
            shutdownLoop();
            logger.info("Message socket server stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get() && serverChannel != null;
    }

    @Override
    public int getPort() {
        Channel channel = serverChannel;
        if (channel != null && channel.localAddress() instanceof InetSocketAddress) {
            return ((InetSocketAddress) channel.localAddress()).getPort();
        }
        return port;
    }

    /**
     * @return the number of open WebSocket connections
     */
    public int getConnectedClients() {
        return connections.size();
    }

    private void shutdownLoop() {
        if (loopGroup != null) {
            loopGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            loopGroup = null;
        }
    }
}
