package dev.macros.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.macros.coords.Surface;
import dev.macros.model.ConfigurationException;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;

/**
 * Loads the optional runner configuration:
 *
 * <pre>
 * {
 *   "adbPath": "adb",
 *   "resolutionTimeoutMs": 5000,
 *   "captureTtlMs": 1000,
 *   "captureTimeoutMs": 5000,
 *   "pollIntervalMs": 100,
 *   "actionTimeoutMs": 5000,
 *   "assignmentsFile": "workers.json",
 *   "targets": [ "emulator-5554", {"id": "emulator-5556", "surface": {"x":0,"y":0,"width":540,"height":960}} ]
 * }
 * </pre>
 */
public final class RunnerConfigLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RunnerConfigLoader() {}

    public static RunnerConfig loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parse(root, path.toAbsolutePath().getParent());
    }

    public static RunnerConfig loadFromString(String json) throws IOException {
        return parse(MAPPER.readTree(json), null);
    }

    private static RunnerConfig parse(JsonNode root, Path baseDir) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Runner config must be a JSON object");
        }
        EngineSettings defaults = EngineSettings.defaults();
        EngineSettings settings;
        try {
            settings = new EngineSettings(
                millis(root, "resolutionTimeoutMs", defaults.resolutionTimeout()),
                millis(root, "captureTtlMs", defaults.captureTtl()),
                millis(root, "captureTimeoutMs", defaults.captureTimeout()),
                millis(root, "pollIntervalMs", defaults.pollInterval()),
                millis(root, "actionTimeoutMs", defaults.actionTimeout()),
                root.has("adbPath") ? root.get("adbPath").asText() : defaults.adbPath());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid runner config: " + e.getMessage(), e);
        }

        var targets = new ArrayList<TargetConfig>();
        JsonNode targetsNode = root.get("targets");
        if (targetsNode != null) {
            if (!targetsNode.isArray()) {
                throw new ConfigurationException("'targets' must be an array");
            }
            for (JsonNode t : targetsNode) {
                targets.add(parseTarget(t));
            }
        }

        Path assignments = null;
        if (root.hasNonNull("assignmentsFile")) {
            assignments = Path.of(root.get("assignmentsFile").asText());
            if (baseDir != null && !assignments.isAbsolute()) {
                assignments = baseDir.resolve(assignments);
            }
        }
        return new RunnerConfig(settings, targets, assignments);
    }

    private static TargetConfig parseTarget(JsonNode node) {
        if (node.isTextual()) {
            return TargetConfig.of(node.asText());
        }
        if (!node.has("id")) {
            throw new ConfigurationException("Target entry missing 'id': " + node);
        }
        Surface surface = null;
        JsonNode s = node.get("surface");
        if (s != null && !s.isNull()) {
            try {
                surface = new Surface(integer(s, "x", 0), integer(s, "y", 0),
                    integer(s, "width", 0), integer(s, "height", 0));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid surface for target %s: %s"
                    .formatted(node.get("id").asText(), e.getMessage()), e);
            }
        }
        return new TargetConfig(node.get("id").asText(), surface);
    }

    private static Duration millis(JsonNode root, String field, Duration fallback) {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new ConfigurationException("'%s' must be a whole number of milliseconds, got %s".formatted(field, value));
        }
        return Duration.ofMillis(value.longValue());
    }

    private static int integer(JsonNode node, String field, int fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new ConfigurationException("'%s' must be an integer, got %s".formatted(field, value));
        }
        return value.intValue();
    }
}
