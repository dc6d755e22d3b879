package pulsestream.input;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import pulsestream.domain.Command;

/**
 * Parses command messages received over either transport.
 *
 * <pre>
 * { "command": "start_scenario", "scenario": "normal" }
 * { "command": "stop_scenario" }
 * { "type": "client_heartbeat" }
 * </pre>
 */
public class CommandParser {
    private final ObjectMapper objectMapper;

    public CommandParser() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    }

    /**
     * Parse one raw message.
     *
     * @param raw the message text, without the line terminator
     * @return the parsed command
     * @throws CommandParseException if the text is not JSON or names no known command
     */
    public Command parse(String raw) throws CommandParseException {
        if (raw == null || raw.isBlank()) {
            throw new CommandParseException("Empty command");
        }

        JsonNode root;
        try {
            // Strip stray control characters left by line-oriented clients
            root = objectMapper.readTree(raw.replaceAll("[\\x00-\\x1F\\x7F]", ""));
        } catch (JsonProcessingException e) {
            throw new CommandParseException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new CommandParseException("Command must be a JSON object");
        }

        String command = root.path("command").asText(null);
        if (command == null) {
            if (Command.Type.CLIENT_HEARTBEAT.wireName().equals(root.path("type").asText(null))) {
                return new Command(Command.Type.CLIENT_HEARTBEAT, null);
            }
            throw new CommandParseException("Missing 'command' field");
        }

        if (Command.Type.START_SCENARIO.wireName().equals(command)) {
            String scenario = root.path("scenario").asText(null);
            if (scenario == null || scenario.isBlank()) {
                throw new CommandParseException("start_scenario requires a 'scenario' field");
            }
            return Command.start(scenario.trim());
        }
        if (Command.Type.STOP_SCENARIO.wireName().equals(command)) {
            return Command.stop();
        }
        throw new CommandParseException("Unknown command: " + command);
    }
}
