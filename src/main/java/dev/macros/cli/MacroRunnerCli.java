package dev.macros.cli;

import dev.macros.backend.AdbBridge;
import dev.macros.backend.AdbDeviceBackend;
import dev.macros.backend.AdbPngScreencapProvider;
import dev.macros.backend.AdbRawScreencapProvider;
import dev.macros.backend.DeviceBackend;
import dev.macros.backend.DeviceShell;
import dev.macros.backend.Sleeper;
import dev.macros.capture.CaptureCache;
import dev.macros.config.EngineSettings;
import dev.macros.config.RunnerConfig;
import dev.macros.config.RunnerConfigLoader;
import dev.macros.config.TargetConfig;
import dev.macros.device.DeviceResolutionService;
import dev.macros.engine.RunReport;
import dev.macros.engine.WorkerAssignments;
import dev.macros.engine.WorkerFleet;
import dev.macros.io.ScriptLoader;
import dev.macros.model.ConfigurationException;
import dev.macros.model.Script;
import dev.macros.time.SystemMonotonicClock;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * CLI entry point for macro-runner.
 */
@Command(
    name = "macro-runner",
    mixinStandardHelpOptions = true,
    description = "Run an automation script against one or more device targets, one worker per target."
)
public class MacroRunnerCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_CONFIG = 2;

    @Parameters(index = "0", arity = "0..1", description = "Script JSON file")
    private Path scriptPath;

    @Option(names = "--target", description = "Target device id (repeatable; default: config targets, then every online device)")
    private List<String> targets;

    @Option(names = "--config", description = "Runner config JSON (targets, surfaces, timings)")
    private Path configPath;

    @Option(names = "--list-targets", description = "List reachable targets and exit")
    private boolean listTargets;

    @Option(names = "--validate", description = "Load and validate the script without running it")
    private boolean validate;

    @Option(names = "--dry-run", description = "Print script structure without executing")
    private boolean dryRun;

    @Option(names = "--max-iterations", description = "Override the script's maxIterations")
    private Integer maxIterations;

    @Option(names = "--adb", description = "Path to the adb executable")
    private String adbPath;

    @Option(names = "--resolution-timeout-ms", description = "Bound on each resolution probe")
    private Long resolutionTimeoutMs;

    @Option(names = "--capture-ttl-ms", description = "How long a screen capture stays fresh")
    private Long captureTtlMs;

    @Option(names = "--verbose", description = "Log every dispatched command")
    private boolean verbose;

    @Spec
    private CommandLine.Model.CommandSpec spec;

    private final Function<String, DeviceShell> shellFactory;

    public MacroRunnerCli() {
        this(AdbBridge::new);
    }

    /** @param shellFactory builds the device transport from the adb path */
    MacroRunnerCli(Function<String, DeviceShell> shellFactory) {
        this.shellFactory = shellFactory;
    }

    @Override
    public Integer call() {
        if (verbose) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        RunnerConfig config;
        try {
            config = loadConfig();
        } catch (ConfigurationException | IOException e) {
            err.println("Error: invalid config: " + e.getMessage());
            return EXIT_CONFIG;
        }
        EngineSettings settings = config.settings();

        if (listTargets) {
            return listTargets(settings, out, err);
        }

        if (scriptPath == null) {
            err.println("Error: script file required. Use --help for usage.");
            return EXIT_CONFIG;
        }

        Script script;
        try {
            script = ScriptLoader.loadFromFile(scriptPath);
            if (maxIterations != null) {
                script = new Script(script.sequence(), script.variablesGlobal(), maxIterations, script.onErrorHandler());
            }
        } catch (ConfigurationException e) {
            err.println("Error: invalid script " + scriptPath + ":");
            e.errors().forEach(msg -> err.println("  - " + msg));
            return EXIT_CONFIG;
        } catch (IOException e) {
            err.println("Error: cannot read " + scriptPath + ": " + e.getMessage());
            return EXIT_CONFIG;
        }

        if (validate) {
            out.println("Script is valid: %d top-level commands, maxIterations %d"
                .formatted(script.sequence().size(), script.maxIterations()));
            return EXIT_OK;
        }
        if (dryRun) {
            out.print(ScriptOutline.render(script));
            out.flush();
            return EXIT_OK;
        }
        return run(script, config, out, err);
    }

    private int run(Script script, RunnerConfig config, PrintWriter out, PrintWriter err) {
        EngineSettings settings = config.settings();
        DeviceShell shell = shellFactory.apply(settings.adbPath());
        DeviceBackend backend = new AdbDeviceBackend(shell, settings.actionTimeout(), Sleeper.SYSTEM, new Random());

        List<TargetConfig> runTargets;
        try {
            runTargets = resolveTargets(config, backend);
        } catch (IOException e) {
            err.println("Error: cannot list targets: " + e.getMessage());
            return EXIT_RUN_FAILED;
        }
        if (runTargets.isEmpty()) {
            err.println("Error: no targets. Pass --target or connect a device.");
            return EXIT_RUN_FAILED;
        }

        WorkerAssignments assignments;
        try {
            assignments = config.assignmentsFile() == null
                ? new WorkerAssignments()
                : WorkerAssignments.load(config.assignmentsFile());
        } catch (ConfigurationException | IOException e) {
            err.println("Error: cannot read worker assignments: " + e.getMessage());
            return EXIT_CONFIG;
        }

        var captures = new CaptureCache(
            List.of(new AdbRawScreencapProvider(shell), new AdbPngScreencapProvider(shell)),
            settings.captureTtl(), settings.captureTimeout(), SystemMonotonicClock.INSTANCE);
        var fleet = new WorkerFleet(backend, DeviceResolutionService.withDefaultProbes(shell), captures,
            settings, assignments, SystemMonotonicClock.INSTANCE);

        Runtime.getRuntime().addShutdownHook(new Thread(fleet::stopAll, "macro-runner-shutdown"));
        List<RunReport> reports;
        try {
            reports = fleet.runAll(script, runTargets);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fleet.stopAll();
            err.println("Interrupted; workers stopped.");
            return EXIT_RUN_FAILED;
        }

        if (config.assignmentsFile() != null) {
            try {
                assignments.save(config.assignmentsFile());
            } catch (IOException e) {
                err.println("Warning: cannot save worker assignments: " + e.getMessage());
            }
        }

        reports.forEach(r -> out.println(r.summary()));
        out.flush();
        return reports.stream().allMatch(RunReport::completed) ? EXIT_OK : EXIT_RUN_FAILED;
    }

    private int listTargets(EngineSettings settings, PrintWriter out, PrintWriter err) {
        DeviceShell shell = shellFactory.apply(settings.adbPath());
        try {
            List<String> ids = new AdbDeviceBackend(shell, settings.actionTimeout(), Sleeper.SYSTEM, new Random()).listTargets();
            if (ids.isEmpty()) {
                out.println("No targets found.");
            } else {
                out.println("Available targets:");
                ids.forEach(id -> out.println("  " + id));
            }
            return EXIT_OK;
        } catch (IOException e) {
            err.println("Error: cannot list targets: " + e.getMessage());
            return EXIT_RUN_FAILED;
        }
    }

    private RunnerConfig loadConfig() throws IOException {
        RunnerConfig config = configPath == null ? RunnerConfig.defaults() : RunnerConfigLoader.loadFromFile(configPath);
        EngineSettings settings = config.settings();
        try {
            if (adbPath != null) {
                settings = settings.withAdbPath(adbPath);
            }
            if (resolutionTimeoutMs != null) {
                settings = settings.withResolutionTimeout(Duration.ofMillis(resolutionTimeoutMs));
            }
            if (captureTtlMs != null) {
                settings = settings.withCaptureTtl(Duration.ofMillis(captureTtlMs));
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        return config.withSettings(settings);
    }

    private List<TargetConfig> resolveTargets(RunnerConfig config, DeviceBackend backend) throws IOException {
        if (targets != null && !targets.isEmpty()) {
            return targets.stream()
                .distinct()
                .map(id -> config.targets().stream()
                    .filter(t -> t.id().equals(id))
                    .findFirst()
                    .orElse(TargetConfig.of(id)))
                .toList();
        }
        if (!config.targets().isEmpty()) {
            return config.targets();
        }
        return backend.listTargets().stream().map(TargetConfig::of).toList();
    }
}
