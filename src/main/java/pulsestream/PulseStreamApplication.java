package pulsestream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulsestream.core.BroadcastRouter;
import pulsestream.core.ClientRegistry;
import pulsestream.core.PulseStreamServer;
import pulsestream.core.ScenarioPlayer;
import pulsestream.core.SchedulerBridge;
import pulsestream.input.FileScenarioStore;
import pulsestream.output.MessageSocketServer;
import pulsestream.output.StreamSocketServer;
import pulsestream.persist.BatchedPersister;
import pulsestream.persist.ScenarioRecorder;
import pulsestream.persist.StreamSubscriber;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main application class for PulseStream.
 * Wires the scenario store, player, router and both transports, and keeps them running until shutdown.
 */
public class PulseStreamApplication {
    private static final Logger logger = LoggerFactory.getLogger(PulseStreamApplication.class);

    private final PulseStreamConfig config;
    private final PulseStreamServer server;
    private final StreamSocketServer streamServer;
    private final MessageSocketServer messageServer;
    private final BatchedPersister persister;
    private final Object recorderLock = new Object();
    private StreamSubscriber recorder;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private final AtomicBoolean shutDown = new AtomicBoolean(false);

    /**
     * Create the application with default configuration.
     */
    public PulseStreamApplication() {
        this(PulseStreamConfig.defaults());
    }

    public PulseStreamApplication(PulseStreamConfig config) {
        this.config = config;

        ClientRegistry registry = new ClientRegistry();
        BroadcastRouter router = new BroadcastRouter(registry);
        router.setStopOrphanedScenario(config.stopOrphanedScenario());
        ScenarioPlayer player = new ScenarioPlayer(new FileScenarioStore(config.scenarioDir()), router);
        router.setPlayer(player);

        this.streamServer = new StreamSocketServer(config.host(), config.streamPort(), router);
        this.messageServer = new MessageSocketServer(
                config.host(), config.messagePort(), router, new SchedulerBridge());
        this.server = new PulseStreamServer(player, router, List.of(streamServer, messageServer));

        this.persister = config.recording()
                ? new BatchedPersister(config.recordFile(), config.batchSize())
                : null;

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "pulse-stream-shutdown"));
    }

    protected void exitApplication(int status) {
        System.exit(status);
    }

    public PulseStreamServer getServer() {
        return server;
    }

    /**
     * Start the application and block until {@link #shutdown()}.
     */
    public void start() {
        try {
            logger.info("Starting PulseStream Application...");
            server.start();
            if (persister != null) {
                startRecorder();
            }

            logger.info("Application started successfully");
            logger.info("Stream clients: tcp://{}:{} (newline-delimited JSON)", config.host(), streamServer.getPort());
            logger.info("Message clients: ws://{}:{}", config.host(), messageServer.getPort());
            logger.info("Scenarios are read from {}", config.scenarioDir().toAbsolutePath());

            try {
                shutdownLatch.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.info("Application interrupted");
            }
        } catch (Exception e) {
            logger.error("Failed to start application", e);
            exitApplication(1);
        }
    }

    /**
     * Shutdown the application gracefully.
     */
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down PulseStream Application...");
        try {
            synchronized (recorderLock) {
                if (recorder != null) {
                    recorder.close();
                    recorder = null;
                }
            }
            server.stop();
            if (persister != null) {
                persister.close();
            }
            logger.info("Uptime: {} seconds", server.getUptime() / 1000);
            logger.info("Application shut down successfully");
        } catch (Exception e) {
            logger.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
        }
    }

    private void startRecorder() {
        synchronized (recorderLock) {
            if (shutDown.get()) {
                return;
            }
            // Subscribe to the bound port, which differs from the configured one when that was 0
            String recorderHost = PulseStreamConfig.DEFAULT_HOST.equals(config.host()) ? "127.0.0.1" : config.host();
            recorder = new StreamSubscriber(recorderHost, streamServer.getPort(), new ScenarioRecorder(persister));
            recorder.start();
        }
        logger.info("Recording live stream to {}", persister.getTarget());
    }

    /**
     * Main entry point.
     *
     * @param args command line arguments:
     *             [0] - host (default: 0.0.0.0)
     *             [1] - stream port (default: 5000)
     *             [2] - message port (default: 8092)
     *             [3] - scenario directory (default: scenarios)
     *             [4] - verbose (default: false)
     *             [5] - record file (default: none)
     */
    public static void main(String[] args) {
        PulseStreamConfig config = PulseStreamConfig.fromArgs(args);
        if (config.verbose()) {
            LoggingConfigurator.enableVerboseLogging();
        }

        logger.info("Configuration:");
        logger.info("  - Host: {}", config.host());
        logger.info("  - Stream port: {}", config.streamPort());
        logger.info("  - Message port: {}", config.messagePort());
        logger.info("  - Scenario directory: {}", config.scenarioDir());
        logger.info("  - Verbose: {}", config.verbose());
        logger.info("  - Record file: {}", config.recording() ? config.recordFile() : "none");

        new PulseStreamApplication(config).start();
    }
}
