package pulsestream.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One event on the live stream, as sent to every connected client.
 * The common fields come first on the wire, followed by the type-specific fields in insertion order.
 * Integral payload values are held as {@link Long} so that an event parsed back from the wire
 * equals the one that was sent.
 */
public record BiometricEvent(
        long timestamp,
        EventType eventType,
        String scenario,
        Map<String, Object> fields
) {
    public static final String TIMESTAMP = "timestamp";
    public static final String EVENT_TYPE = "event_type";
    public static final String SCENARIO = "scenario";
    public static final String MESSAGE = "message";
    public static final String EVENT_NUMBER = "event_number";
    public static final String INTERVAL_MS = "interval_ms";
    public static final String ELAPSED_MS = "elapsed_ms";
    public static final String TOTAL_EVENTS = "total_events";
    public static final String TOTAL_DURATION_MS = "total_duration_ms";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public BiometricEvent {
        Objects.requireNonNull(eventType, "eventType cannot be null");
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static BiometricEvent heartbeat(long timestamp, String scenario, long eventNumber,
                                           long intervalMs, long elapsedMs) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(EVENT_NUMBER, eventNumber);
        fields.put(INTERVAL_MS, intervalMs);
        fields.put(ELAPSED_MS, elapsedMs);
        return new BiometricEvent(timestamp, EventType.HEARTBEAT, scenario, fields);
    }

    public static BiometricEvent welcome(long timestamp, String message) {
        return new BiometricEvent(timestamp, EventType.WELCOME, null, Map.of(MESSAGE, message));
    }

    public static BiometricEvent scenarioStarted(long timestamp, String scenario, String message) {
        return new BiometricEvent(timestamp, EventType.SCENARIO_STARTED, scenario, Map.of(MESSAGE, message));
    }

    public static BiometricEvent scenarioStopped(long timestamp, String scenario, String message) {
        return new BiometricEvent(timestamp, EventType.SCENARIO_STOPPED, scenario, Map.of(MESSAGE, message));
    }

    public static BiometricEvent scenarioComplete(long timestamp, String scenario,
                                                  long totalEvents, long totalDurationMs) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(TOTAL_EVENTS, totalEvents);
        fields.put(TOTAL_DURATION_MS, totalDurationMs);
        return new BiometricEvent(timestamp, EventType.SCENARIO_COMPLETE, scenario, fields);
    }

    /**
     * Get a payload field as a long.
     *
     * @return the value, or null if the field is absent or not numeric
     */
    public Long longField(String name) {
        Object value = fields.get(name);
        return value instanceof Number ? ((Number) value).longValue() : null;
    }

    public String stringField(String name) {
        Object value = fields.get(name);
        return value != null ? value.toString() : null;
    }

    /**
     * Build the flat JSON object carried on the wire.
     */
    public ObjectNode toJsonNode() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(TIMESTAMP, timestamp);
        node.put(EVENT_TYPE, eventType.wireName());
        if (scenario != null) {
            node.put(SCENARIO, scenario);
        }
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            node.set(field.getKey(), MAPPER.valueToTree(field.getValue()));
        }
        return node;
    }

    /**
     * Convert this event to its JSON representation.
     */
    public String toJSON() {
        try {
            return MAPPER.writeValueAsString(toJsonNode());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + eventType.wireName() + " event", e);
        }
    }

    /**
     * Parse an event from its wire representation.
     *
     * @throws IllegalArgumentException if the text is not a JSON object with a timestamp and a known event_type
     */
    public static BiometricEvent fromJson(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid event JSON: " + e.getOriginalMessage(), e);
        }
        return fromJsonNode(root);
    }

    public static BiometricEvent fromJsonNode(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Event must be a JSON object");
        }
        JsonNode timestamp = root.get(TIMESTAMP);
        JsonNode type = root.get(EVENT_TYPE);
        if (timestamp == null || !timestamp.isIntegralNumber()) {
            throw new IllegalArgumentException("Event is missing an integer timestamp");
        }
        if (type == null || !type.isTextual()) {
            throw new IllegalArgumentException("Event is missing event_type");
        }
        JsonNode scenario = root.get(SCENARIO);

        Map<String, Object> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String name = entry.getKey();
            if (TIMESTAMP.equals(name) || EVENT_TYPE.equals(name) || SCENARIO.equals(name)) {
                continue;
            }
            fields.put(name, toValue(entry.getValue()));
        }

        return new BiometricEvent(
                timestamp.longValue(),
                EventType.fromWireName(type.textValue()),
                scenario != null && scenario.isTextual() ? scenario.textValue() : null,
                fields
        );
    }

    private static Object toValue(JsonNode node) {
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return MAPPER.convertValue(node, Object.class);
    }
}
