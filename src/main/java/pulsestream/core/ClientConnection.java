package pulsestream.core;

import java.io.IOException;

/**
 * A connected receiver of the event stream.
 * Implementations should make {@link #close()} idempotent.
 */
public interface ClientConnection {

    /**
     * @return an identifier for logging, unique among live connections
     */
    String id();

    ClientKind kind();

    /**
     * Deliver one serialized event. Calls for one connection arrive in publish order.
     *
     * @param json the event JSON, without any transport framing
     * @throws IOException if the peer is gone; the caller evicts the connection
     */
    void send(String json) throws IOException;

    /**
     * Close the underlying connection.
     */
    void close();
}
