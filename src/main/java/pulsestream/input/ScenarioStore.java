package pulsestream.input;

import pulsestream.domain.ScenarioDefinition;

/**
 * Read-only source of recorded scenarios.
 */
public interface ScenarioStore {
    /**
     * Load a scenario by name.
     *
     * @param name the scenario name
     * @return the loaded definition
     * @throws ScenarioLoadException if the scenario is missing or its data cannot be parsed
     */
    ScenarioDefinition load(String name) throws ScenarioLoadException;
}
