package pulsestream.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminator of a {@link BiometricEvent}, serialized as the {@code event_type} field.
 */
public enum EventType {
    HEARTBEAT("heartbeat", true),
    RESPIRATION("respiration", true),
    SPO2("spo2", true),
    TEMPERATURE("temperature", true),
    ECG_RHYTHM("ecg_rhythm", true),
    BLOOD_PRESSURE("blood_pressure", true),
    WELCOME("welcome", false),
    SCENARIO_STARTED("scenario_started", false),
    SCENARIO_STOPPED("scenario_stopped", false),
    SCENARIO_COMPLETE("scenario_complete", false);

    private final String wireName;
    private final boolean biometric;

    EventType(String wireName, boolean biometric) {
        this.wireName = wireName;
        this.biometric = biometric;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @return true for physiological measurements, false for control events
     */
    public boolean isBiometric() {
        return biometric;
    }

    @JsonCreator
    public static EventType fromWireName(String wireName) {
        for (EventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + wireName);
    }
}
