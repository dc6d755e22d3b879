package pulsestream.core;

import pulsestream.domain.BiometricEvent;

/**
 * Receives the lifecycle and the events of a {@link ScenarioPlayer}.
 * Callbacks for a session arrive in order: started, events, then either stopped or complete.
 */
public interface PlaybackListener {

    /**
     * Called on the thread that started the scenario, before its first event.
     */
    void onScenarioStarted(String scenario);

    /**
     * Called on the playback worker for each replayed event.
     */
    void onEvent(BiometricEvent event);

    /**
     * Called once a cancelled session has stopped emitting.
     */
    void onScenarioStopped(String scenario);

    /**
     * Called on the playback worker when a session replays its whole sequence without being cancelled.
     */
    void onScenarioComplete(String scenario, int totalEvents, long totalDurationMs);
}
