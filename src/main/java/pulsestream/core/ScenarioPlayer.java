package pulsestream.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulsestream.domain.BiometricEvent;
import pulsestream.domain.ScenarioDefinition;
import pulsestream.input.ScenarioLoadException;
import pulsestream.input.ScenarioStore;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Replays one scenario at a time with real-time pacing on a dedicated worker thread.
 * <p>
 * Starting a scenario stops the running one first and waits for its worker to exit, so events of two
 * sessions never interleave. Stopping is cooperative: the worker sees the request at its next wait,
 * which wakes early when cancelled.
 */
public class ScenarioPlayer {
    private static final Logger logger = LoggerFactory.getLogger(ScenarioPlayer.class);

    private final ScenarioStore store;
    private final PlaybackListener listener;
    private final Clock clock;
    private final Object controlLock = new Object();
    private final Object sessionLock = new Object();
    private final AtomicInteger workerCounter = new AtomicInteger();

    // Guarded by sessionLock
    private PlaybackSession session;

    public ScenarioPlayer(ScenarioStore store, PlaybackListener listener) {
        this(store, listener, Clock.systemUTC());
    }

    public ScenarioPlayer(ScenarioStore store, PlaybackListener listener, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.listener = Objects.requireNonNull(listener, "listener cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Start replaying a scenario, replacing any running one. The same name as the running scenario
     * restarts it from its first offset.
     * <p>
     * Returns once the previous worker has exited and the new one is running.
     *
     * @param name the scenario name
     * @throws ScenarioLoadException if the scenario cannot be loaded; a running scenario is left untouched
     */
    public void start(String name) throws ScenarioLoadException {
        ScenarioDefinition definition = store.load(name);

        PlaybackSession next;
        String preempted;
        synchronized (controlLock) {
            PlaybackSession previous = currentSession();
            preempted = previous != null ? previous.definition.name() : null;
            if (previous != null) {
                logger.info("Stopping current scenario ({}) to start {}", preempted, name);
                cancelAndAwait(previous);
            }

            next = new PlaybackSession(definition);
            Thread worker = new Thread(() -> run(next),
                    "scenario-player-" + workerCounter.incrementAndGet());
            worker.setDaemon(true);
            next.worker = worker;
            synchronized (sessionLock) {
                session = next;
            }
        }

        if (preempted != null) {
            listener.onScenarioStopped(preempted);
        }
        listener.onScenarioStarted(name);
        next.worker.start();
        logger.info("Started scenario {} ({} events over {} ms)",
                name, definition.eventCount(), definition.totalDurationMs());
    }

    /**
     * Stop the running scenario. No completion event is sent for a stopped run.
     *
     * @return true if a scenario was running
     */
    public boolean stop() {
        PlaybackSession stopped;
        synchronized (controlLock) {
            stopped = currentSession();
            if (stopped == null) {
                logger.info("No scenario currently running");
                return false;
            }
            logger.info("Stopping current scenario: {}", stopped.definition.name());
            cancelAndAwait(stopped);
        }
        listener.onScenarioStopped(stopped.definition.name());
        return true;
    }

    /**
     * @return the name of the running scenario, if any
     */
    public Optional<String> currentScenario() {
        PlaybackSession current = currentSession();
        return current != null ? Optional.of(current.definition.name()) : Optional.empty();
    }

    public boolean isPlaying() {
        return currentSession() != null;
    }

    private PlaybackSession currentSession() {
        synchronized (sessionLock) {
            return session != null && session.running ? session : null;
        }
    }

    private void cancelAndAwait(PlaybackSession target) {
        synchronized (sessionLock) {
            target.running = false;
            if (session == target) {
                session = null;
            }
        }
        target.cancelRequested.countDown();

        Thread worker = target.worker;
        if (worker == null || worker == Thread.currentThread()) {
            return;
        }
        try {
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for scenario {} to stop", target.definition.name());
        }
    }

    private void run(PlaybackSession current) {
        ScenarioDefinition definition = current.definition;
        String name = definition.name();
        long startMillis = clock.millis();
        long startNanos = System.nanoTime();
        int emitted = 0;

        try {
            for (int i = 0; i < definition.eventCount(); i++) {
                long deadline = startNanos + TimeUnit.MILLISECONDS.toNanos(definition.relativeOffset(i));
                if (awaitDeadline(current, deadline)) {
                    logger.info("Scenario {} stopped after {} events", name, emitted);
                    return;
                }

                long now = clock.millis();
                BiometricEvent event = BiometricEvent.heartbeat(
                        now, name, emitted, definition.intervals().get(i), now - startMillis);
                listener.onEvent(event);
                emitted++;
                logger.debug("Sent heartbeat event {} of scenario {}", emitted, name);
            }

            boolean completed;
            synchronized (sessionLock) {
                completed = current.running;
                current.running = false;
                if (session == current) {
                    session = null;
                }
            }
            if (completed) {
                listener.onScenarioComplete(name, emitted, clock.millis() - startMillis);
                logger.info("Completed scenario {}", name);
            } else {
                logger.info("Scenario {} was stopped", name);
            }
        } catch (RuntimeException e) {
            logger.error("Scenario {} aborted after {} events", name, emitted, e);
            synchronized (sessionLock) {
                current.running = false;
                if (session == current) {
                    session = null;
                }
            }
        }
    }

    /**
     * Wait until the deadline or a cancel request.
     *
     * @return true if the session was cancelled
     */
    private boolean awaitDeadline(PlaybackSession current, long deadlineNanos) {
        try {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining > 0 && current.cancelRequested.await(remaining, TimeUnit.NANOSECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
        return current.cancelRequested.getCount() == 0;
    }

    /**
     * State of one replay. Only {@code cancelRequested} is touched from outside the worker.
     */
    private static final class PlaybackSession {
        final ScenarioDefinition definition;
        final CountDownLatch cancelRequested = new CountDownLatch(1);
        volatile boolean running = true;
        Thread worker;

        PlaybackSession(ScenarioDefinition definition) {
            this.definition = definition;
        }
    }
}
