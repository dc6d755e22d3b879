package pulsestream;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Runtime settings of the server.
 *
 * @param host interface both transports bind to
 * @param streamPort TCP port of the newline-delimited JSON transport
 * @param messagePort port of the WebSocket transport
 * @param scenarioDir directory holding {@code <scenario>.json} offset files
 * @param verbose log at DEBUG level
 * @param recordFile when set, the live stream is recorded into this JSON array file
 * @param batchSize records buffered before each write of the record file
 * @param stopOrphanedScenario stop playback once the last client disconnects
 */
public record PulseStreamConfig(
        String host,
        int streamPort,
        int messagePort,
        Path scenarioDir,
        boolean verbose,
        Path recordFile,
        int batchSize,
        boolean stopOrphanedScenario
) {
    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_STREAM_PORT = 5000;
    public static final int DEFAULT_MESSAGE_PORT = 8092;
    public static final String DEFAULT_SCENARIO_DIR = "scenarios";
    public static final int DEFAULT_BATCH_SIZE = 10;

    public PulseStreamConfig {
        Objects.requireNonNull(host, "host cannot be null");
        Objects.requireNonNull(scenarioDir, "scenarioDir cannot be null");
        checkPort(streamPort, "streamPort");
        checkPort(messagePort, "messagePort");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
    }

    public static PulseStreamConfig defaults() {
        return new PulseStreamConfig(DEFAULT_HOST, DEFAULT_STREAM_PORT, DEFAULT_MESSAGE_PORT,
                Path.of(DEFAULT_SCENARIO_DIR), false, null, DEFAULT_BATCH_SIZE, true);
    }

    /**
     * Parse positional command line arguments, any of which may be omitted from the end:
     * {@code [host] [streamPort] [messagePort] [scenarioDir] [verbose] [recordFile]}.
     *
     * @throws IllegalArgumentException if a port is not a valid number
     */
    public static PulseStreamConfig fromArgs(String[] args) {
        String host = args.length > 0 ? args[0] : DEFAULT_HOST;
        int streamPort = args.length > 1 ? parsePort(args[1], "streamPort") : DEFAULT_STREAM_PORT;
        int messagePort = args.length > 2 ? parsePort(args[2], "messagePort") : DEFAULT_MESSAGE_PORT;
        Path scenarioDir = Path.of(args.length > 3 ? args[3] : DEFAULT_SCENARIO_DIR);
        boolean verbose = args.length > 4 && Boolean.parseBoolean(args[4]);
        Path recordFile = args.length > 5 && !args[5].isBlank() ? Path.of(args[5]) : null;
        return new PulseStreamConfig(host, streamPort, messagePort, scenarioDir, verbose, recordFile,
                DEFAULT_BATCH_SIZE, true);
    }

    public boolean recording() {
        return recordFile != null;
    }

    private static int parsePort(String value, String name) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number: " + value, e);
        }
    }

    private static void checkPort(int port, String name) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(name + " out of range: " + port);
        }
    }
}
