package pulsestream.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulsestream.domain.BiometricEvent;
import pulsestream.domain.Command;
import pulsestream.input.CommandParseException;
import pulsestream.input.CommandParser;
import pulsestream.input.ScenarioLoadException;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans events out to every registered connection and routes client commands to the {@link ScenarioPlayer}.
 * <p>
 * Commands run one at a time on a dedicated dispatcher, in the order they were received, so neither the
 * connection threads nor the event loop ever wait on playback. The router also turns the player's
 * lifecycle into {@code scenario_started}, {@code scenario_stopped} and {@code scenario_complete}
 * broadcasts.
 */
public class BroadcastRouter implements PlaybackListener {
    private static final Logger logger = LoggerFactory.getLogger(BroadcastRouter.class);

    /** Message prefix of the {@code scenario_started} notice sent to clients joining mid-scenario. */
    public static final String CURRENT_SCENARIO_PREFIX = "Current scenario: ";

    private final ClientRegistry registry;
    private final CommandParser parser;
    private final Executor commandExecutor;
    private final ExecutorService ownedExecutor;
    private final Clock clock;
    private final RouterStatistics statistics = new RouterStatistics();

    private volatile ScenarioPlayer player;
    private volatile boolean stopOrphanedScenario = true;

    /**
     * Create a router with its own command dispatcher thread.
     */
    public BroadcastRouter(ClientRegistry registry) {
        this(registry, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "command-dispatcher");
            t.setDaemon(true);
            return t;
        }), Clock.systemUTC());
    }

    /**
     * Create a router.
     *
     * @param registry the connections to fan out to
     * @param commandExecutor runs commands; must execute them one at a time in submission order
     * @param clock source of event timestamps
     */
    public BroadcastRouter(ClientRegistry registry, Executor commandExecutor, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.commandExecutor = Objects.requireNonNull(commandExecutor, "commandExecutor cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.ownedExecutor = commandExecutor instanceof ExecutorService ? (ExecutorService) commandExecutor : null;
        this.parser = new CommandParser();
    }

    /**
     * Bind the player that commands are routed to.
     */
    public void setPlayer(ScenarioPlayer player) {
        this.player = player;
    }

    /**
     * Stop a running scenario once the last client has disconnected. Enabled by default.
     */
    public void setStopOrphanedScenario(boolean stopOrphanedScenario) {
        this.stopOrphanedScenario = stopOrphanedScenario;
    }

    public ClientRegistry getRegistry() {
        return registry;
    }

    public RouterStatistics getStatistics() {
        return statistics;
    }

    /**
     * Greet a new connection and add it to the fan-out. It receives only events published from now on.
     */
    public void connect(ClientConnection connection) {
        try {
            String greeting = connection.kind() == ClientKind.MESSAGE
                    ? "Connected to heartbeat WebSocket server"
                    : "Connected to heartbeat server";
            connection.send(BiometricEvent.welcome(clock.millis(), greeting).toJSON());

            Optional<String> current = currentScenario();
            if (current.isPresent()) {
                connection.send(BiometricEvent.scenarioStarted(
                        clock.millis(), current.get(), CURRENT_SCENARIO_PREFIX + current.get()).toJSON());
            }
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to greet {} client {}: {}", connection.kind(), connection.id(), e.toString());
            connection.close();
            return;
        }
        registry.register(connection);
    }

    /**
     * Remove a connection after its peer went away.
     */
    public void disconnect(ClientConnection connection) {
        if (registry.unregister(connection)) {
            stopIfOrphaned();
        }
    }

    /**
     * Deliver an event to every registered connection of both kinds.
     * A connection that fails is evicted without affecting delivery to the others.
     */
    public void publish(BiometricEvent event) {
        String json = event.toJSON();
        statistics.recordPublished();

        for (ClientKind kind : ClientKind.values()) {
            List<ClientConnection> targets = registry.snapshot(kind);
            logger.debug("Broadcasting {} to {} {} clients", event.eventType().wireName(), targets.size(), kind);
            for (ClientConnection connection : targets) {
                try {
                    connection.send(json);
                    statistics.recordDelivered();
                } catch (IOException | RuntimeException e) {
                    logger.warn("Failed to send to {} client {}, evicting: {}",
                            kind, connection.id(), e.toString());
                    evict(connection);
                }
            }
        }
    }

    /**
     * Handle raw inbound text from any connection. Malformed input is logged and dropped;
     * the connection stays open.
     */
    public void receiveCommand(String raw, ClientConnection origin) {
        String source = origin != null ? origin.kind() + " client " + origin.id() : "local";
        Command command;
        try {
            command = parser.parse(raw);
        } catch (CommandParseException e) {
            statistics.recordRejected();
            logger.warn("Discarding invalid command from {}: {} ({})", source, raw, e.getMessage());
            return;
        }

        if (command.type() == Command.Type.CLIENT_HEARTBEAT) {
            logger.debug("Client heartbeat received from {}", source);
            return;
        }

        logger.info("Received {} from {}", command.type().wireName(), source);
        statistics.recordAccepted();
        dispatch(command);
    }

    /**
     * Stop the command dispatcher if this router created it.
     */
    public void shutdown() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ownedExecutor.shutdownNow();
            }
        }
    }

    // PlaybackListener

    @Override
    public void onScenarioStarted(String scenario) {
        publish(BiometricEvent.scenarioStarted(clock.millis(), scenario, "Started " + scenario + " scenario"));
    }

    @Override
    public void onEvent(BiometricEvent event) {
        publish(event);
    }

    @Override
    public void onScenarioStopped(String scenario) {
        publish(BiometricEvent.scenarioStopped(clock.millis(), scenario, "Scenario stopped"));
    }

    @Override
    public void onScenarioComplete(String scenario, int totalEvents, long totalDurationMs) {
        publish(BiometricEvent.scenarioComplete(clock.millis(), scenario, totalEvents, totalDurationMs));
    }

    private Optional<String> currentScenario() {
        ScenarioPlayer current = player;
        return current != null ? current.currentScenario() : Optional.empty();
    }

    private void evict(ClientConnection connection) {
        if (registry.unregister(connection)) {
            statistics.recordEvicted();
            stopIfOrphaned();
        }
        try {
            connection.close();
        } catch (RuntimeException e) {
            logger.debug("Error closing evicted client {}", connection.id(), e);
        }
    }

    private void stopIfOrphaned() {
        ScenarioPlayer current = player;
        if (stopOrphanedScenario && current != null && current.isPlaying() && registry.isEmpty()) {
            logger.info("No clients connected, stopping orphaned scenario: {}",
                    current.currentScenario().orElse("?"));
            dispatch(Command.stop());
        }
    }

    private void dispatch(Command command) {
        try {
            commandExecutor.execute(() -> execute(command));
        } catch (RejectedExecutionException e) {
            logger.warn("Command dispatcher is shut down, dropping {}", command.type().wireName());
        }
    }

    private void execute(Command command) {
        ScenarioPlayer current = player;
        if (current == null) {
            logger.warn("No scenario player bound, ignoring {}", command.type().wireName());
            return;
        }
        try {
            switch (command.type()) {
                case START_SCENARIO:
                    current.start(command.scenario());
                    break;
                case STOP_SCENARIO:
                    current.stop();
                    break;
                default:
                    break;
            }
        } catch (ScenarioLoadException e) {
            statistics.recordFailed();
            logger.error("Cannot start scenario {}: {}", e.getScenario(), e.getMessage());
        } catch (RuntimeException e) {
            statistics.recordFailed();
            logger.error("Command {} failed", command.type().wireName(), e);
        }
    }

    /**
     * Counters for the router's traffic.
     */
    public static class RouterStatistics {
        private final AtomicLong eventsPublished = new AtomicLong();
        private final AtomicLong deliveries = new AtomicLong();
        private final AtomicLong evictions = new AtomicLong();
        private final AtomicLong commandsAccepted = new AtomicLong();
        private final AtomicLong commandsRejected = new AtomicLong();
        private final AtomicLong commandsFailed = new AtomicLong();

        void recordPublished() {
            eventsPublished.incrementAndGet();
        }

        void recordDelivered() {
            deliveries.incrementAndGet();
        }

        void recordEvicted() {
            evictions.incrementAndGet();
        }

        void recordAccepted() {
            commandsAccepted.incrementAndGet();
        }

        void recordRejected() {
            commandsRejected.incrementAndGet();
        }

        void recordFailed() {
            commandsFailed.incrementAndGet();
        }

        public long getEventsPublished() {
            return eventsPublished.get();
        }

        public long getDeliveries() {
            return deliveries.get();
        }

        public long getEvictions() {
            return evictions.get();
        }

        public long getCommandsAccepted() {
            return commandsAccepted.get();
        }

        public long getCommandsRejected() {
            return commandsRejected.get();
        }

        public long getCommandsFailed() {
            return commandsFailed.get();
        }

        @Override
        public String toString() {
            return String.format("RouterStatistics{published=%d, deliveries=%d, evictions=%d, "
                            + "commandsAccepted=%d, commandsRejected=%d, commandsFailed=%d}",
                    getEventsPublished(), getDeliveries(), getEvictions(),
                    getCommandsAccepted(), getCommandsRejected(), getCommandsFailed());
        }
    }
}
