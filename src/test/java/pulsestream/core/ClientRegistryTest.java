package pulsestream.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class ClientRegistryTest {

    private ClientRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ClientRegistry();
    }

    @Test
    @DisplayName("Should keep stream and message clients in separate populations")
    void testRegisterByKind() {
        FakeConnection stream = new FakeConnection("s1", ClientKind.STREAM);
        FakeConnection message = new FakeConnection("m1", ClientKind.MESSAGE);

        assertThat(registry.register(stream)).isTrue();
        assertThat(registry.register(message)).isTrue();

        assertThat(registry.snapshot(ClientKind.STREAM)).containsExactly(stream);
        assertThat(registry.snapshot(ClientKind.MESSAGE)).containsExactly(message);
        assertThat(registry.size(ClientKind.STREAM)).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.isEmpty()).isFalse();
    }

    @Test
    @DisplayName("Should report duplicate registration and unknown removal")
    void testDuplicateAndUnknown() {
        FakeConnection stream = new FakeConnection("s1", ClientKind.STREAM);

        assertThat(registry.register(stream)).isTrue();
        assertThat(registry.register(stream)).isFalse();
        assertThat(registry.size()).isEqualTo(1);

        assertThat(registry.unregister(stream)).isTrue();
        assertThat(registry.unregister(stream)).isFalse();
        assertThat(registry.unregister(null)).isFalse();
        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should reject a null connection")
    void testRegisterNull() {
        assertThatThrownBy(() -> registry.register(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("connection cannot be null");
    }

    @Test
    @DisplayName("Should return snapshots that are unaffected by later changes")
    void testSnapshotIsCopy() {
        FakeConnection first = new FakeConnection("s1", ClientKind.STREAM);
        FakeConnection second = new FakeConnection("s2", ClientKind.STREAM);
        registry.register(first);

        List<ClientConnection> snapshot = registry.snapshot(ClientKind.STREAM);
        registry.register(second);
        registry.unregister(first);

        assertThat(snapshot).containsExactly(first);
        assertThatThrownBy(() -> snapshot.add(second)).isInstanceOf(UnsupportedOperationException.class);
        assertThat(registry.snapshot(ClientKind.STREAM)).containsExactly(second);
    }

    @Test
    @DisplayName("Should stay consistent under concurrent registration and removal")
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testConcurrentMembership() throws Exception {
        int threads = 8;
        int perThread = 200;
        CountDownLatch go = new CountDownLatch(1);
        List<Thread> workers = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            int index = t;
            Thread worker = new Thread(() -> {
                try {
                    go.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perThread; i++) {
                    ClientKind kind = i % 2 == 0 ? ClientKind.STREAM : ClientKind.MESSAGE;
                    FakeConnection connection = new FakeConnection(index + "-" + i, kind);
                    registry.register(connection);
                    registry.snapshot(kind);
                    if (i % 4 < 2) {
                        registry.unregister(connection);
                    }
                }
            });
            workers.add(worker);
            worker.start();
        }
        go.countDown();
        for (Thread worker : workers) {
            worker.join();
        }

        assertThat(registry.size()).isEqualTo(threads * perThread / 2);
        assertThat(registry.size(ClientKind.STREAM) + registry.size(ClientKind.MESSAGE))
                .isEqualTo(registry.size());
    }
}
