package pulsestream.output;

/**
 * A server that accepts live clients of one kind and hands them to the router.
 */
public interface ClientTransport {
    /**
     * Bind and start accepting clients.
     * @throws RuntimeException if the server cannot be started
     */
    void start();

    /**
     * Stop accepting clients and close every open connection. Idempotent.
     */
    void stop();

    /**
     * @return true while accepting clients
     */
    boolean isRunning();

    /**
     * @return the bound port, which differs from the configured one when that was 0
     */
    int getPort();
}
