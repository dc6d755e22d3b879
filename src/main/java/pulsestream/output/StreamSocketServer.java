package pulsestream.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulsestream.core.BroadcastRouter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Plain TCP server for line-oriented clients.
 * One thread accepts connections; each connection then gets its own thread that reads commands
 * with blocking reads until the peer goes away.
 */
public class StreamSocketServer implements ClientTransport {
    private static final Logger logger = LoggerFactory.getLogger(StreamSocketServer.class);
    private static final int BACKLOG = 50;

    private final String host;
    private final int port;
    private final BroadcastRouter router;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger connectionCounter = new AtomicInteger();
    private final Set<StreamSocketConnection> connections = ConcurrentHashMap.newKeySet();

    private volatile ServerSocket serverSocket;
    private Thread acceptThread;

    public StreamSocketServer(String host, int port, BroadcastRouter router) {
        this.host = host;
        this.port = port;
        this.router = Objects.requireNonNull(router, "router cannot be null");
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            try {
                ServerSocket socket = new ServerSocket();
                socket.setReuseAddress(true);
                socket.bind(new InetSocketAddress(host, port), BACKLOG);
                serverSocket = socket;
            } catch (IOException e) {
                running.set(false);
                throw new RuntimeException("Failed to start stream socket server on " + host + ":" + port, e);
            }

            acceptThread = new Thread(this::acceptLoop, "stream-socket-acceptor");
            acceptThread.setDaemon(true);
            acceptThread.start();
            logger.info("Stream socket server started on {}:{}", host, getPort());
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            try {
                if (serverSocket != null) {
                    serverSocket.close();
                }
            } catch (IOException e) {
                logger.debug("Error closing server socket", e);
            }
            for (StreamSocketConnection connection : connections) {
                router.disconnect(connection);
                connection.close();
            }
            connections.clear();
            logger.info("Stream socket server stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get() && serverSocket != null;
    }

    @Override
    public int getPort() {
        ServerSocket socket = serverSocket;
        return socket != null ? socket.getLocalPort() : port;
    }

    /**
     * @return the number of open connections
     */
    public int getConnectedClients() {
        return connections.size();
    }

    private void acceptLoop() {
        while (running.get()) {
            try {
                Socket socket = serverSocket.accept();
                socket.setTcpNoDelay(true);
                int number = connectionCounter.incrementAndGet();
                String id = "stream-" + number + "@" + socket.getRemoteSocketAddress();
                StreamSocketConnection connection = new StreamSocketConnection(id, socket);
                connections.add(connection);

                Thread handler = new Thread(() -> handleClient(connection), "stream-client-" + number);
                handler.setDaemon(true);
                handler.start();
            } catch (SocketException e) {
                if (running.get()) {
                    logger.error("Stream socket accept failed", e);
                }
            } catch (IOException e) {
                if (running.get()) {
                    logger.error("Error accepting stream client", e);
                }
            }
        }
    }

    private void handleClient(StreamSocketConnection connection) {
        logger.info("New stream client connected: {}", connection.id());
        router.connect(connection);

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                connection.getSocket().getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running.get() && (line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    logger.debug("Received from {}: {}", connection.id(), line);
                    router.receiveCommand(line, connection);
                }
            }
        } catch (IOException e) {
            if (!connection.isClosed()) {
                logger.debug("Stream client {} connection error: {}", connection.id(), e.toString());
            }
        } finally {
            router.disconnect(connection);
            connections.remove(connection);
            connection.close();
            logger.info("Stream client disconnected: {}", connection.id());
        }
    }
}
