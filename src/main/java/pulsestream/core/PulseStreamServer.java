package pulsestream.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulsestream.output.ClientTransport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the lifecycle of the engine: the transports that accept clients, the player and the router.
 */
public class PulseStreamServer {
    private static final Logger logger = LoggerFactory.getLogger(PulseStreamServer.class);

    private final ScenarioPlayer player;
    private final BroadcastRouter router;
    private final List<ClientTransport> transports;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile long startTime;

    /**
     * @param player the scenario player, already bound to the router
     * @param router the router the transports hand their clients to
     * @param transports the client-facing servers
     */
    public PulseStreamServer(ScenarioPlayer player, BroadcastRouter router, List<ClientTransport> transports) {
        this.player = Objects.requireNonNull(player, "player cannot be null");
        this.router = Objects.requireNonNull(router, "router cannot be null");
        this.transports = List.copyOf(Objects.requireNonNull(transports, "transports cannot be null"));

        if (this.transports.isEmpty()) {
            throw new IllegalArgumentException("At least one transport is required");
        }
    }

    /**
     * Start every transport. If one fails, those already started are stopped again.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            List<ClientTransport> started = new ArrayList<>();
            try {
                for (ClientTransport transport : transports) {
                    transport.start();
                    started.add(transport);
                }
                startTime = System.currentTimeMillis();
                logger.info("PulseStream server started with {} transport(s)", transports.size());
            } catch (Exception e) {
                running.set(false);
                stopAll(started);
                throw new RuntimeException("Failed to start PulseStream server", e);
            }
        }
    }

    /**
     * Stop playback, the transports and the command dispatcher.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            try {
                router.setStopOrphanedScenario(false);
                player.stop();
                stopAll(transports);
                router.shutdown();
                logger.info("PulseStream server stopped. Statistics: {}", router.getStatistics());
            } catch (Exception e) {
                logger.error("Error during PulseStream server shutdown", e);
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public ScenarioPlayer getPlayer() {
        return player;
    }

    public BroadcastRouter getRouter() {
        return router;
    }

    public List<ClientTransport> getTransports() {
        return transports;
    }

    /**
     * @return milliseconds since start, or 0 if never started
     */
    public long getUptime() {
        long started = startTime;
        return started == 0 ? 0 : System.currentTimeMillis() - started;
    }

    private void stopAll(List<ClientTransport> targets) {
        for (ClientTransport transport : targets) {
            try {
                transport.stop();
            } catch (Exception e) {
                logger.warn("Error stopping transport: {}", transport.getClass().getSimpleName(), e);
            }
        }
    }
}
