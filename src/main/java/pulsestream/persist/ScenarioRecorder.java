package pulsestream.persist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulsestream.core.BroadcastRouter;
import pulsestream.domain.BiometricEvent;
import pulsestream.domain.EventType;

import java.io.IOException;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Feeds received events into a {@link BatchedPersister}, keeping one scenario per recording.
 * <p>
 * When a new scenario starts, the pending batch is flushed and the file is emptied before the new
 * scenario's events arrive. The notice sent to a client joining mid-scenario does not start a new recording.
 */
public class ScenarioRecorder implements Consumer<BiometricEvent> {
    private static final Logger logger = LoggerFactory.getLogger(ScenarioRecorder.class);

    private final BatchedPersister persister;

    public ScenarioRecorder(BatchedPersister persister) {
        this.persister = Objects.requireNonNull(persister, "persister cannot be null");
    }

    @Override
    public void accept(BiometricEvent event) {
        if (event.eventType() == EventType.SCENARIO_STARTED && !isCurrentScenarioNotice(event)) {
            startRecording(event.scenario());
            return;
        }
        persister.accept(event);
    }

    private void startRecording(String scenario) {
        persister.flush();
        try {
            persister.reset();
            logger.info("Recording scenario {} to {}", scenario, persister.getTarget());
        } catch (IOException e) {
            logger.error("Failed to clear {} for scenario {}", persister.getTarget(), scenario, e);
        }
    }

    private static boolean isCurrentScenarioNotice(BiometricEvent event) {
        String message = event.stringField(BiometricEvent.MESSAGE);
        return message != null && message.startsWith(BroadcastRouter.CURRENT_SCENARIO_PREFIX);
    }
}
