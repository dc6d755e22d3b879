package pulsestream.persist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulsestream.domain.BiometricEvent;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Client of the stream-socket transport that hands each received event to a consumer, reconnecting with
 * exponential backoff whenever the connection drops. Events sent while disconnected are lost.
 */
public class StreamSubscriber implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(StreamSubscriber.class);
    private static final long INITIAL_BACKOFF_MS = 1000L;
    private static final long MAX_BACKOFF_MS = 30000L;
    private static final int CONNECT_TIMEOUT_MS = 3000;

    private final String host;
    private final int port;
    private final Consumer<BiometricEvent> consumer;
    private final Object stateLock = new Object();
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicLong received = new AtomicLong();

    private volatile boolean running = false;
    private volatile Socket socket;
    private Thread readerThread;

    public StreamSubscriber(String host, int port, Consumer<BiometricEvent> consumer) {
        this.host = host;
        this.port = port;
        this.consumer = Objects.requireNonNull(consumer, "consumer cannot be null");
    }

    public void start() {
        if (running) {
            return;
        }
        running = true;
        readerThread = new Thread(this::connectionLoop, "stream-subscriber");
        readerThread.setDaemon(true);
        readerThread.start();
    }

    public boolean isConnected() {
        return connected.get();
    }

    /**
     * @return the number of events handed to the consumer
     */
    public long getReceived() {
        return received.get();
    }

    @Override
    public void close() {
        running = false;
        if (readerThread != null) {
            readerThread.interrupt();
        }
        synchronized (stateLock) {
            closeSocket();
        }
        connected.set(false);
        logger.info("Stream subscriber closed");
    }

    private void connectionLoop() {
        long backoffMs = INITIAL_BACKOFF_MS;
        logger.info("Subscribing to event stream at {}:{}", host, port);

        while (running) {
            try {
                BufferedReader reader = connect();
                backoffMs = INITIAL_BACKOFF_MS;
                logger.info("Connected to event stream at {}:{}", host, port);
                readLines(reader);
                if (running) {
                    logger.warn("Event stream closed by server, reconnecting");
                }
            } catch (IOException e) {
                if (!running) {
                    break;
                }
                logger.warn("Event stream unavailable: {}. Retrying in {} ms", e.getMessage(), backoffMs);
                sleep(backoffMs);
                backoffMs = Math.min(MAX_BACKOFF_MS, backoffMs * 2);
            } finally {
                connected.set(false);
                synchronized (stateLock) {
                    closeSocket();
                }
            }
        }
    }

    private BufferedReader connect() throws IOException {
        Socket s = new Socket();
        s.setTcpNoDelay(true);
        s.setKeepAlive(true);
        try {
            s.connect(new InetSocketAddress(host, port), CONNECT_TIMEOUT_MS);
        } catch (IOException e) {
            s.close();
            throw e;
        }
        synchronized (stateLock) {
            closeSocket();
            socket = s;
        }
        connected.set(true);
        return new BufferedReader(new InputStreamReader(s.getInputStream(), StandardCharsets.UTF_8));
    }

    private void readLines(BufferedReader reader) throws IOException {
        String line;
        while (running && (line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            BiometricEvent event;
            try {
                event = BiometricEvent.fromJson(line);
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping unparseable event: {}", e.getMessage());
                continue;
            }
            received.incrementAndGet();
            try {
                consumer.accept(event);
            } catch (RuntimeException e) {
                logger.error("Event consumer failed for {}", event.eventType().wireName(), e);
            }
        }
    }

    private void closeSocket() {
        Socket s = socket;
        socket = null;
        if (s != null) {
            try {
                s.close();
            } catch (IOException e) {
                logger.debug("Error closing subscriber socket", e);
            }
        }
    }

    private void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
