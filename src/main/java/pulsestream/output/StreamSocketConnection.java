package pulsestream.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulsestream.core.ClientConnection;
import pulsestream.core.ClientKind;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A TCP client receiving newline-delimited JSON.
 * <p>
 * Writes run on the connection's own sender thread, so {@link #send(String)} only enqueues. A failed write, or
 * a peer that lets {@link #MAX_PENDING_WRITES} lines pile up, marks the connection dead and the next send
 * reports it so the router can evict it.
 */
public class StreamSocketConnection implements ClientConnection {
    private static final Logger logger = LoggerFactory.getLogger(StreamSocketConnection.class);

    /** Lines queued behind a peer that stopped reading before the connection is given up. */
    public static final int MAX_PENDING_WRITES = 10_000;

    private final String id;
    private final Socket socket;
    private final OutputStream outputStream;
    private final ExecutorService senderExecutor;
    private final AtomicInteger pendingWrites = new AtomicInteger();
    private final AtomicBoolean failed = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public StreamSocketConnection(String id, Socket socket) throws IOException {
        this.id = id;
        this.socket = socket;
        this.outputStream = new BufferedOutputStream(socket.getOutputStream());
        this.senderExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "stream-sender-" + id);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ClientKind kind() {
        return ClientKind.STREAM;
    }

    @Override
    public void send(String json) throws IOException {
        if (closed.get() || failed.get()) {
            throw new IOException("Connection " + id + " is closed");
        }
        if (pendingWrites.incrementAndGet() > MAX_PENDING_WRITES) {
            pendingWrites.decrementAndGet();
            IOException stalled = new IOException("Stream client " + id + " is not reading ("
                    + MAX_PENDING_WRITES + " lines pending)");
            markFailed(stalled);
            throw stalled;
        }

        byte[] line = (json + "\n").getBytes(StandardCharsets.UTF_8);
        try {
            senderExecutor.execute(() -> write(line));
        } catch (RejectedExecutionException e) {
            pendingWrites.decrementAndGet();
            throw new IOException("Connection " + id + " is closed", e);
        }
    }

    public Socket getSocket() {
        return socket;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * @return lines accepted by {@link #send(String)} and not yet written
     */
    public int pending() {
        return pendingWrites.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            senderExecutor.shutdownNow();
            try {
                // Also unblocks a write stuck on a peer that stopped reading
                socket.close();
            } catch (IOException e) {
                logger.debug("Error closing stream client {}", id, e);
            }
        }
    }

    // Runs on the sender thread
    private void write(byte[] line) {
        try {
            if (!failed.get()) {
                outputStream.write(line);
                outputStream.flush();
                logger.debug("Sent {} bytes to stream client {}", line.length, id);
            }
        } catch (IOException e) {
            markFailed(e);
        } finally {
            pendingWrites.decrementAndGet();
        }
    }

    private void markFailed(Exception cause) {
        if (failed.compareAndSet(false, true) && !closed.get()) {
            logger.warn("Failed to send to stream client {}: {}", id, cause.toString());
        }
    }

    @Override
    public String toString() {
        return "StreamSocketConnection{" + id + "}";
    }
}
