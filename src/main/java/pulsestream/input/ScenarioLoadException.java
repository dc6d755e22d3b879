package pulsestream.input;

/**
 * Thrown when a scenario cannot be loaded. Playback is never started for such a scenario.
 */
public class ScenarioLoadException extends Exception {

    private final String scenario;

    public ScenarioLoadException(String scenario, String message) {
        super(message);
        this.scenario = scenario;
    }

    public ScenarioLoadException(String scenario, String message, Throwable cause) {
        super(message, cause);
        this.scenario = scenario;
    }

    public String getScenario() {
        return scenario;
    }
}
