package pulsestream.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;

class SchedulerBridgeTest {

    private SchedulerBridge bridge;
    private ExecutorService loop;

    @BeforeEach
    void setUp() {
        bridge = new SchedulerBridge();
        loop = Executors.newSingleThreadExecutor(r -> new Thread(r, "test-loop"));
    }

    @AfterEach
    void tearDown() {
        loop.shutdownNow();
    }

    @Test
    @DisplayName("Should forward payloads in FIFO order on the loop thread")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testFifoOnLoop() throws Exception {
        List<String> delivered = Collections.synchronizedList(new ArrayList<>());
        List<String> threads = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch done = new CountDownLatch(1000);

        SchedulerBridge.Subscription subscription = bridge.subscribe(loop, payload -> {
            delivered.add(payload);
            threads.add(Thread.currentThread().getName());
            done.countDown();
        });

        Thread producer = new Thread(() -> {
            for (int i = 0; i < 1000; i++) {
                subscription.offer("p" + i);
            }
        });
        producer.start();
        producer.join();

        assertThat(done.await(3, TimeUnit.SECONDS)).isTrue();
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            expected.add("p" + i);
        }
        assertThat(delivered).containsExactlyElementsOf(expected);
        assertThat(threads).containsOnly("test-loop");
    }

    @Test
    @DisplayName("Should not block the producer while the loop is busy")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testOfferNeverBlocks() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        loop.execute(() -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        List<String> delivered = Collections.synchronizedList(new ArrayList<>());
        SchedulerBridge.Subscription subscription = bridge.subscribe(loop, delivered::add);

        long before = System.nanoTime();
        for (int i = 0; i < 100; i++) {
            subscription.offer("p" + i);
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - before);

        assertThat(elapsedMs).isLessThan(500L);
        assertThat(subscription.pending()).isEqualTo(100);
        assertThat(delivered).isEmpty();

        release.countDown();
        waitUntil(() -> delivered.size() == 100);
        assertThat(subscription.pending()).isZero();
    }

    @Test
    @DisplayName("Should isolate a cancelled subscription from the others")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testCancelIsolation() throws Exception {
        List<String> first = Collections.synchronizedList(new ArrayList<>());
        List<String> second = Collections.synchronizedList(new ArrayList<>());
        SchedulerBridge.Subscription a = bridge.subscribe(loop, first::add);
        SchedulerBridge.Subscription b = bridge.subscribe(loop, second::add);
        assertThat(bridge.activeSubscriptions()).isEqualTo(2);

        a.offer("one");
        b.offer("one");
        waitUntil(() -> first.size() == 1 && second.size() == 1);

        a.cancel();
        a.cancel();
        assertThat(a.isCancelled()).isTrue();
        assertThat(bridge.activeSubscriptions()).isEqualTo(1);
        assertThatThrownBy(() -> a.offer("two"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Subscription cancelled");

        b.offer("two");
        waitUntil(() -> second.size() == 2);
        assertThat(first).containsExactly("one");
        assertThat(second).containsExactly("one", "two");
    }

    @Test
    @DisplayName("Should cancel a subscription whose sink throws")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testFailingSink() throws Exception {
        SchedulerBridge.Subscription subscription = bridge.subscribe(loop, payload -> {
            throw new IllegalStateException("sink failed");
        });

        subscription.offer("boom");

        waitUntil(subscription::isCancelled);
        assertThat(bridge.activeSubscriptions()).isZero();
    }

    @Test
    @DisplayName("Should report a loop that no longer accepts tasks")
    void testRejectedByLoop() {
        loop.shutdown();
        SchedulerBridge.Subscription subscription = bridge.subscribe(loop, payload -> { });

        assertThatThrownBy(() -> subscription.offer("late"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("rejected");
        assertThat(subscription.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("Should reject null arguments")
    void testNullArguments() {
        assertThatThrownBy(() -> bridge.subscribe(null, payload -> { }))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("loop cannot be null");
        assertThatThrownBy(() -> bridge.subscribe(loop, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("sink cannot be null");
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
}
