package pulsestream.input;

/**
 * Thrown for inbound client text that is not a valid command.
 */
public class CommandParseException extends Exception {

    public CommandParseException(String message) {
        super(message);
    }

    public CommandParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
