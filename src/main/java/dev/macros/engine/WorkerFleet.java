package dev.macros.engine;

import dev.macros.backend.DeviceBackend;
import dev.macros.capture.CaptureCache;
import dev.macros.config.EngineSettings;
import dev.macros.config.TargetConfig;
import dev.macros.device.DeviceResolutionService;
import dev.macros.model.Script;
import dev.macros.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * One {@link Worker} per target, all sharing a single resolution service and
 * capture cache. Workers run independently on their own threads.
 */
public final class WorkerFleet {

    private static final Logger log = LoggerFactory.getLogger(WorkerFleet.class);

    private final DeviceBackend backend;
    private final DeviceResolutionService resolutionService;
    private final CaptureCache captures;
    private final EngineSettings settings;
    private final WorkerAssignments assignments;
    private final MonotonicClock clock;

    private final Map<String, Worker> workers = new LinkedHashMap<>();

    public WorkerFleet(DeviceBackend backend, DeviceResolutionService resolutionService, CaptureCache captures,
                       EngineSettings settings, WorkerAssignments assignments, MonotonicClock clock) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.resolutionService = Objects.requireNonNull(resolutionService, "resolutionService");
        this.captures = Objects.requireNonNull(captures, "captures");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.assignments = Objects.requireNonNull(assignments, "assignments");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Start {@code script} on every target. Each call reuses the target's worker
     * from earlier launches.
     */
    public synchronized Map<String, CompletableFuture<RunReport>> launch(Script script, List<TargetConfig> targets) {
        var futures = new LinkedHashMap<String, CompletableFuture<RunReport>>();
        for (TargetConfig target : targets) {
            if (futures.containsKey(target.id())) {
                log.warn("Target {} listed more than once, launching it once", target.id());
                continue;
            }
            Worker worker = workers.computeIfAbsent(target.id(), id -> newWorker(target));
            log.info("Launching worker {} on {}", assignments.numberOf(target.id()).orElse(0), target.id());
            futures.put(target.id(), worker.start(script));
        }
        return futures;
    }

    /** Launch on every target and wait for all reports, in target order. */
    public List<RunReport> runAll(Script script, List<TargetConfig> targets) throws InterruptedException {
        Map<String, CompletableFuture<RunReport>> futures = launch(script, targets);
        var reports = new ArrayList<RunReport>(futures.size());
        for (var entry : futures.entrySet()) {
            try {
                reports.add(entry.getValue().get());
            } catch (ExecutionException e) {
                log.error("{}: worker ended abnormally", entry.getKey(), e.getCause());
                throw new IllegalStateException("Worker for " + entry.getKey() + " ended abnormally", e.getCause());
            }
        }
        return reports;
    }

    public synchronized Worker worker(String target) {
        return workers.get(target);
    }

    public synchronized void pauseAll() {
        workers.values().forEach(Worker::pause);
    }

    public synchronized void resumeAll() {
        workers.values().forEach(Worker::resume);
    }

    public synchronized void stopAll() {
        log.info("Stopping {} workers", workers.size());
        workers.values().forEach(Worker::stop);
    }

    public WorkerAssignments assignments() {
        return assignments;
    }

    private Worker newWorker(TargetConfig target) {
        int number = assignments.assign(target.id());
        return Worker.builder(target.id())
            .backend(backend)
            .resolutionService(resolutionService)
            .captures(captures)
            .surface(target.surface())
            .settings(settings)
            .clock(clock)
            .threadName("worker-%d-%s".formatted(number, target.id()))
            .build();
    }
}
