package dev.macros.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.macros.model.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Stable worker numbers per target. A new target takes the lowest free number, so
 * with 1 and 3 taken the next is 2. Persisted as
 * {@code {"assignments": {"emulator-5554": 1}}}.
 */
public final class WorkerAssignments {

    private static final Logger log = LoggerFactory.getLogger(WorkerAssignments.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Map<String, Integer> byTarget = new LinkedHashMap<>();

    public synchronized int assign(String target) {
        Integer existing = byTarget.get(target);
        if (existing != null) {
            return existing;
        }
        var taken = new TreeSet<>(byTarget.values());
        int next = 1;
        while (taken.contains(next)) {
            next++;
        }
        byTarget.put(target, next);
        log.debug("Assigned worker {} to {}", next, target);
        return next;
    }

    public synchronized boolean release(String target) {
        return byTarget.remove(target) != null;
    }

    public synchronized Optional<Integer> numberOf(String target) {
        return Optional.ofNullable(byTarget.get(target));
    }

    public synchronized Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(byTarget));
    }

    /** Load from {@code path}; a missing file yields no assignments. */
    public static WorkerAssignments load(Path path) throws IOException {
        var assignments = new WorkerAssignments();
        if (!Files.exists(path)) {
            return assignments;
        }
        JsonNode root = MAPPER.readTree(path.toFile());
        JsonNode node = root == null ? null : root.get("assignments");
        if (node == null || !node.isObject()) {
            throw new ConfigurationException("Worker assignment file %s has no 'assignments' object".formatted(path));
        }
        for (var entry : node.properties()) {
            int number = entry.getValue().asInt();
            if (number < 1) {
                throw new ConfigurationException("Invalid worker number %d for %s".formatted(number, entry.getKey()));
            }
            if (assignments.byTarget.containsValue(number)) {
                throw new ConfigurationException("Worker number %d assigned twice in %s".formatted(number, path));
            }
            assignments.byTarget.put(entry.getKey(), number);
        }
        return assignments;
    }

    public synchronized void save(Path path) throws IOException {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode node = root.putObject("assignments");
        byTarget.forEach(node::put);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), root);
    }
}
