package dev.macros.engine;

import dev.macros.backend.FakeDeviceBackend;
import dev.macros.backend.FakeDeviceShell;
import dev.macros.capture.CaptureCache;
import dev.macros.capture.FakeCaptureProvider;
import dev.macros.config.EngineSettings;
import dev.macros.config.TargetConfig;
import dev.macros.coords.Surface;
import dev.macros.device.DeviceResolutionService;
import dev.macros.model.Command;
import dev.macros.model.CommandSpec;
import dev.macros.model.Script;
import dev.macros.time.SystemMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerFleetTest {

    private FakeDeviceShell shell;
    private FakeDeviceBackend backend;
    private WorkerFleet fleet;

    @BeforeEach
    void setUp() {
        shell = new FakeDeviceShell()
            .reply("wm size", id -> id.equals("emulator-5554") ? "Physical size: 1080x1920" : "Physical size: 720x1280");
        backend = new FakeDeviceBackend();
        EngineSettings settings = EngineSettings.defaults().withPollInterval(Duration.ofMillis(10));
        CaptureCache captures = new CaptureCache(List.of(FakeCaptureProvider.solid(100, 100, 0xFF000000)),
            settings.captureTtl(), settings.captureTimeout(), SystemMonotonicClock.INSTANCE);
        fleet = new WorkerFleet(backend, DeviceResolutionService.withDefaultProbes(shell), captures,
            settings, new WorkerAssignments(), SystemMonotonicClock.INSTANCE);
    }

    @Test
    void runsTheScriptOnEveryTargetIndependently() throws Exception {
        Script script = new Script(List.of(Command.of("tap", CommandSpec.Click.at(500, 1000))));

        List<RunReport> reports = fleet.runAll(script, List.of(
            TargetConfig.of("emulator-5554"),
            new TargetConfig("emulator-5556", Surface.atOrigin(360, 640))));

        assertThat(reports).extracting(RunReport::target).containsExactly("emulator-5554", "emulator-5556");
        assertThat(reports).allMatch(RunReport::completed);
        assertThat(fleet.worker("emulator-5554").coordinateMapper().scaleX()).isEqualTo(1.0);
        assertThat(fleet.worker("emulator-5556").coordinateMapper().scaleX()).isEqualTo(0.5);
        assertThat(backend.clicks()).hasSize(2);
        assertThat(shell.commands("emulator-5556", "wm size")).hasSize(1);
    }

    @Test
    void duplicateTargetsLaunchOneWorker() throws Exception {
        Script script = new Script(List.of(Command.of("k", CommandSpec.KeyPress.once("a"))));

        List<RunReport> reports = fleet.runAll(script, List.of(
            TargetConfig.of("emulator-5554"), TargetConfig.of("emulator-5554")));

        assertThat(reports).hasSize(1);
        assertThat(reports.get(0).completed()).isTrue();
        assertThat(backend.keys()).hasSize(1);
    }

    @Test
    void assignsStableWorkerNumbers() throws Exception {
        Script script = new Script(List.of(Command.of("k", CommandSpec.KeyPress.once("a"))));
        List<TargetConfig> targets = List.of(TargetConfig.of("emulator-5554"), TargetConfig.of("emulator-5556"));

        fleet.runAll(script, targets);
        Worker first = fleet.worker("emulator-5554");
        fleet.runAll(script, targets);

        assertThat(fleet.worker("emulator-5554")).isSameAs(first);
        assertThat(fleet.assignments().numberOf("emulator-5554")).contains(1);
        assertThat(fleet.assignments().numberOf("emulator-5556")).contains(2);
    }

    @Test
    void pauseAllHoldsEveryWorkerUntilResumed() throws Exception {
        Script script = new Script(List.of(
            Command.of("settle", CommandSpec.Wait.forDuration(Duration.ofMillis(100))),
            Command.of("k", CommandSpec.KeyPress.once("a"))));

        var futures = fleet.launch(script, List.of(TargetConfig.of("emulator-5554"), TargetConfig.of("emulator-5556")));
        fleet.pauseAll();
        assertThat(fleet.worker("emulator-5554").state()).isEqualTo(WorkerState.PAUSED);
        assertThat(fleet.worker("emulator-5556").state()).isEqualTo(WorkerState.PAUSED);
        Thread.sleep(300);
        assertThat(backend.keys()).isEmpty();

        fleet.resumeAll();
        for (var future : futures.values()) {
            assertThat(future.get(5, TimeUnit.SECONDS).state()).isEqualTo(WorkerState.COMPLETED);
        }
        assertThat(backend.keys()).hasSize(2);
    }

    @Test
    void stopAllHaltsEveryWorker() throws Exception {
        Script script = new Script(List.of(Command.of("long", CommandSpec.Wait.forDuration(Duration.ofSeconds(30)))));

        var futures = fleet.launch(script, List.of(TargetConfig.of("emulator-5554"), TargetConfig.of("emulator-5556")));
        fleet.stopAll();

        for (var future : futures.values()) {
            assertThat(future.get(5, TimeUnit.SECONDS).state()).isEqualTo(WorkerState.STOPPED);
        }
    }
}
