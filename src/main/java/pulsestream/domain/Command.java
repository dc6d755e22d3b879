package pulsestream.domain;

import java.util.Objects;

/**
 * A control request received from any connected client.
 */
public record Command(Type type, String scenario) {

    public enum Type {
        START_SCENARIO("start_scenario"),
        STOP_SCENARIO("stop_scenario"),
        /** Keep-alive sent by dashboard clients; carries no action. */
        CLIENT_HEARTBEAT("client_heartbeat");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    public Command {
        Objects.requireNonNull(type, "type cannot be null");
        if (type == Type.START_SCENARIO && (scenario == null || scenario.isBlank())) {
            throw new IllegalArgumentException("start_scenario requires a scenario name");
        }
    }

    public static Command start(String scenario) {
        return new Command(Type.START_SCENARIO, scenario);
    }

    public static Command stop() {
        return new Command(Type.STOP_SCENARIO, null);
    }
}
