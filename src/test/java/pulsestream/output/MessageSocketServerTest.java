package pulsestream.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import pulsestream.core.BroadcastRouter;
import pulsestream.core.ClientKind;
import pulsestream.core.ClientRegistry;
import pulsestream.core.ScenarioPlayer;
import pulsestream.core.SchedulerBridge;
import pulsestream.domain.BiometricEvent;

import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class MessageSocketServerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private ScenarioPlayer mockPlayer;

    private ClientRegistry registry;
    private BroadcastRouter router;
    private SchedulerBridge bridge;
    private MessageSocketServer server;
    private TestClient client;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(mockPlayer.currentScenario()).thenReturn(Optional.empty());

        registry = new ClientRegistry();
        router = new BroadcastRouter(registry, Runnable::run, Clock.systemUTC());
        router.setPlayer(mockPlayer);
        bridge = new SchedulerBridge();
        server = new MessageSocketServer("127.0.0.1", 0, router, bridge);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (client != null && client.isOpen()) {
            client.closeBlocking();
        }
        server.stop();
    }

    @Test
    @DisplayName("Should bind an ephemeral port and stop cleanly")
    void testStartAndStop() {
        server.start();

        assertThat(server.isRunning()).isTrue();
        assertThat(server.getPort()).isPositive();

        server.stop();
        server.stop();
        assertThat(server.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should send a welcome frame after the handshake")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testWelcome() throws Exception {
        server.start();
        client = connect("/");

        JsonNode welcome = MAPPER.readTree(client.next());
        assertThat(welcome.get("event_type").asText()).isEqualTo("welcome");
        assertThat(welcome.get("message").asText()).isEqualTo("Connected to heartbeat WebSocket server");
        waitUntil(() -> registry.size(ClientKind.MESSAGE) == 1);
        assertThat(server.getConnectedClients()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should accept the upgrade on any path")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testAnyPath() throws Exception {
        server.start();
        client = connect("/ws/heartbeats");

        assertThat(client.next()).contains("\"event_type\":\"welcome\"");
    }

    @Test
    @DisplayName("Should deliver published events as text frames in order")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testDeliversEventsInOrder() throws Exception {
        server.start();
        client = connect("/");
        client.next();
        waitUntil(() -> registry.size(ClientKind.MESSAGE) == 1);

        List<BiometricEvent> events = List.of(
                BiometricEvent.heartbeat(1L, "normal", 0, 800, 800),
                BiometricEvent.heartbeat(2L, "normal", 1, 810, 1610),
                BiometricEvent.heartbeat(3L, "normal", 2, 785, 2395));
        for (BiometricEvent event : events) {
            router.publish(event);
        }

        for (BiometricEvent event : events) {
            assertThat(client.next()).isEqualTo(event.toJSON());
        }
    }

    @Test
    @DisplayName("Should route commands from a text frame")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testReceivesCommands() throws Exception {
        server.start();
        client = connect("/");
        client.next();

        client.send("{\"command\":\"start_scenario\",\"scenario\":\"cardiac-arrest\"}");
        client.send("{\"type\":\"client_heartbeat\"}");
        client.send("{\"command\":");

        verify(mockPlayer, timeout(2000)).start("cardiac-arrest");
        waitUntil(() -> router.getStatistics().getCommandsRejected() == 1);
        assertThat(client.isOpen()).isTrue();
    }

    @Test
    @DisplayName("Should unregister a client when it closes")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testClientClose() throws Exception {
        server.start();
        client = connect("/");
        client.next();
        waitUntil(() -> registry.size(ClientKind.MESSAGE) == 1);

        client.closeBlocking();

        waitUntil(() -> registry.size(ClientKind.MESSAGE) == 0);
        waitUntil(() -> server.getConnectedClients() == 0);
        waitUntil(() -> bridge.activeSubscriptions() == 0);
    }

    private TestClient connect(String path) throws Exception {
        TestClient testClient = new TestClient(new URI("ws://127.0.0.1:" + server.getPort() + path));
        assertThat(testClient.connectBlocking(2, TimeUnit.SECONDS)).isTrue();
        return testClient;
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met in time");
            }
            Thread.sleep(10);
        }
    }

    private static class TestClient extends WebSocketClient {
        private final BlockingQueue<String> messages = new LinkedBlockingQueue<>();

        TestClient(URI uri) {
            super(uri);
        }

        String next() throws InterruptedException {
            String message = messages.poll(2, TimeUnit.SECONDS);
            assertThat(message).as("message received in time").isNotNull();
            return message;
        }

        @Override
        public void onOpen(ServerHandshake handshake) {
        }

        @Override
        public void onMessage(String message) {
            messages.add(message);
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
        }

        @Override
        public void onError(Exception ex) {
        }
    }
}
