package dev.macros.engine;

import dev.macros.model.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerAssignmentsTest {

    @TempDir
    Path tempDir;

    @Test
    void assignsLowestFreeNumber() {
        var assignments = new WorkerAssignments();

        assertThat(assignments.assign("a")).isEqualTo(1);
        assertThat(assignments.assign("b")).isEqualTo(2);
        assertThat(assignments.assign("c")).isEqualTo(3);
        assertThat(assignments.release("b")).isTrue();

        assertThat(assignments.assign("d")).isEqualTo(2);
        assertThat(assignments.assign("a")).isEqualTo(1);
        assertThat(assignments.numberOf("zzz")).isEmpty();
    }

    @Test
    void survivesSaveAndLoad() throws Exception {
        var assignments = new WorkerAssignments();
        assignments.assign("emulator-5554");
        assignments.assign("127.0.0.1:21503");
        Path file = tempDir.resolve("state/workers.json");

        assignments.save(file);
        WorkerAssignments loaded = WorkerAssignments.load(file);

        assertThat(loaded.asMap()).containsExactly(
            Map.entry("emulator-5554", 1),
            Map.entry("127.0.0.1:21503", 2));
        assertThat(loaded.assign("emulator-5556")).isEqualTo(3);
    }

    @Test
    void missingFileMeansNoAssignments() throws Exception {
        assertThat(WorkerAssignments.load(tempDir.resolve("absent.json")).asMap()).isEmpty();
    }

    @Test
    void rejectsDuplicateNumbers() throws Exception {
        Path file = tempDir.resolve("workers.json");
        Files.writeString(file, "{\"assignments\": {\"a\": 1, \"b\": 1}}");

        assertThatThrownBy(() -> WorkerAssignments.load(file))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("assigned twice");
    }

    @Test
    void rejectsFilesWithoutAssignments() throws Exception {
        Path file = tempDir.resolve("workers.json");
        Files.writeString(file, "{\"workers\": []}");

        assertThatThrownBy(() -> WorkerAssignments.load(file)).isInstanceOf(ConfigurationException.class);
    }
}
