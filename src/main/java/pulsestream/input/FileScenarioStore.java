package pulsestream.input;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulsestream.domain.ScenarioDefinition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Loads scenarios from {@code <directory>/<name>.json}, each file holding a JSON array of offsets in milliseconds.
 * Files are read on every load, so edits are picked up by the next start.
 */
public class FileScenarioStore implements ScenarioStore {
    private static final Logger logger = LoggerFactory.getLogger(FileScenarioStore.class);
    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9_\\-]+");
    private static final TypeReference<List<Long>> OFFSETS = new TypeReference<>() {};

    private final Path directory;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public FileScenarioStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public ScenarioDefinition load(String name) throws ScenarioLoadException {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new ScenarioLoadException(name, "Invalid scenario name: " + name);
        }

        Path file = directory.resolve(name + ".json");
        if (!Files.isRegularFile(file)) {
            throw new ScenarioLoadException(name, "Scenario data file not found: " + file);
        }

        try {
            List<Long> offsets = objectMapper.readValue(file.toFile(), OFFSETS);
            ScenarioDefinition definition = new ScenarioDefinition(name, offsets);
            logger.info("Loaded {} heartbeat offsets from scenario {}", offsets.size(), name);
            return definition;
        } catch (JsonProcessingException e) {
            throw new ScenarioLoadException(name,
                    "Scenario data in " + file + " is not an array of offsets: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ScenarioLoadException(name, "Failed to read scenario data " + file, e);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ScenarioLoadException(name, e.getMessage() != null ? e.getMessage() : "Invalid scenario data", e);
        }
    }
}
