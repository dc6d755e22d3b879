package pulsestream.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Hands payloads produced on arbitrary threads over to a single-threaded event loop.
 * <p>
 * Every subscriber gets its own unbounded queue and its own forwarding task, so a slow or cancelled
 * subscriber never holds up the others and producers never block. The forwarding task only runs on
 * the loop, which keeps per-subscriber delivery in FIFO order.
 */
public class SchedulerBridge {
    private static final Logger logger = LoggerFactory.getLogger(SchedulerBridge.class);

    private final AtomicInteger active = new AtomicInteger();

    /**
     * Open a subscription whose payloads are forwarded to {@code sink} on {@code loop}.
     *
     * @param loop the event loop; {@code execute} must be thread-safe and must not block
     * @param sink called on the loop for each payload
     */
    public Subscription subscribe(Executor loop, Consumer<String> sink) {
        Subscription subscription = new Subscription(
                Objects.requireNonNull(loop, "loop cannot be null"),
                Objects.requireNonNull(sink, "sink cannot be null"));
        active.incrementAndGet();
        return subscription;
    }

    /**
     * @return the number of subscriptions not yet cancelled
     */
    public int activeSubscriptions() {
        return active.get();
    }

    /**
     * One subscriber's queue and forwarding task.
     */
    public final class Subscription {
        private final Executor loop;
        private final Consumer<String> sink;
        private final Queue<String> queue = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean drainScheduled = new AtomicBoolean(false);
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private Subscription(Executor loop, Consumer<String> sink) {
            this.loop = loop;
            this.sink = sink;
        }

        /**
         * Enqueue a payload without waiting for the loop.
         *
         * @throws IllegalStateException if the subscription is cancelled or the loop no longer accepts tasks
         */
        public void offer(String payload) {
            if (cancelled.get()) {
                throw new IllegalStateException("Subscription cancelled");
            }
            queue.add(payload);
            if (drainScheduled.compareAndSet(false, true)) {
                try {
                    loop.execute(this::drain);
                } catch (RejectedExecutionException e) {
                    cancel();
                    throw new IllegalStateException("Event loop rejected forwarding task", e);
                }
            }
        }

        /**
         * Stop forwarding and drop anything still queued. Other subscriptions are unaffected.
         */
        public void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                queue.clear();
                active.decrementAndGet();
            }
        }

        public boolean isCancelled() {
            return cancelled.get();
        }

        public int pending() {
            return queue.size();
        }

        private void drain() {
            // Reset before polling so an offer racing with the last poll schedules a new drain
            drainScheduled.set(false);
            String payload;
            while (!cancelled.get() && (payload = queue.poll()) != null) {
                try {
                    sink.accept(payload);
                } catch (RuntimeException e) {
                    logger.warn("Forwarding task failed, cancelling subscription", e);
                    cancel();
                }
            }
        }
    }
}
