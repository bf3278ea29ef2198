package dev.macros.engine;

import dev.macros.backend.ActionResult;
import dev.macros.backend.ClickAction;
import dev.macros.backend.DeviceBackend;
import dev.macros.backend.HotKeyAction;
import dev.macros.backend.KeyAction;
import dev.macros.backend.TextAction;
import dev.macros.capture.CapabilityException;
import dev.macros.capture.CaptureCache;
import dev.macros.capture.ColorMatch;
import dev.macros.capture.ColorScanner;
import dev.macros.capture.Frame;
import dev.macros.capture.ScreenComparator;
import dev.macros.config.EngineSettings;
import dev.macros.coords.CoordinateMapper;
import dev.macros.coords.Point;
import dev.macros.coords.Resolution;
import dev.macros.coords.Surface;
import dev.macros.device.DeviceResolutionService;
import dev.macros.device.ResolutionResult;
import dev.macros.expr.ExpressionEvaluator;
import dev.macros.expr.ExpressionException;
import dev.macros.model.Command;
import dev.macros.model.CommandExecutionException;
import dev.macros.model.CommandSpec;
import dev.macros.model.CommandTimeoutException;
import dev.macros.model.ConfigurationException;
import dev.macros.model.ErrorKind;
import dev.macros.model.OnFail;
import dev.macros.model.Region;
import dev.macros.model.Script;
import dev.macros.model.WaitMode;
import dev.macros.time.MonotonicClock;
import dev.macros.time.SystemMonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a {@link Script} against one target.
 *
 * <p>Each visited command costs one iteration, whether it is top-level, nested in a
 * Repeat or Condition, or disabled. Actions are scaled through the worker's
 * {@link CoordinateMapper} and sent to the {@link DeviceBackend}; logic commands are
 * evaluated in-process. A failing command is resolved by its {@link OnFail} policy.
 * Stop and pause take effect between commands and at every Wait poll tick, never in
 * the middle of an action.</p>
 *
 * <p>{@link #run} executes on the calling thread; {@link #start} runs on a dedicated
 * thread. {@link #pause}, {@link #resume} and {@link #stop} may be called from any
 * thread.</p>
 */
public final class Worker {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    /** 1-based pass number, visible inside a Repeat. */
    public static final String LOOP_INDEX = "_loop_index";

    private final String target;
    private final DeviceBackend backend;
    private final DeviceResolutionService resolutionService;
    private final CaptureCache captures;
    private final Surface surface; // nullable
    private final EngineSettings settings;
    private final MonotonicClock clock;
    private final String threadName;

    private final RunControl control = new RunControl();
    private final Object stateLock = new Object();
    private volatile WorkerState state = WorkerState.IDLE;

    // Per-run state, written by the running thread only.
    private Script script;
    private volatile VariableStore variables = new VariableStore(Map.of());
    private volatile int iterationCount;
    private volatile String cursor;
    private volatile CoordinateMapper mapper;
    private long startedAtNanos;

    private Worker(Builder b) {
        this.target = Objects.requireNonNull(b.target, "target");
        this.backend = Objects.requireNonNull(b.backend, "backend");
        this.resolutionService = Objects.requireNonNull(b.resolutionService, "resolutionService");
        this.captures = Objects.requireNonNull(b.captures, "captures");
        this.surface = b.surface;
        this.settings = b.settings;
        this.clock = b.clock;
        this.threadName = b.threadName != null ? b.threadName : "worker-" + b.target;
    }

    public static Builder builder(String target) {
        return new Builder(target);
    }

    public String target() { return target; }
    public WorkerState state() { return state; }
    public int iterationCount() { return iterationCount; }
    public String cursor() { return cursor; }
    public Map<String, Object> variables() { return variables.snapshot(); }

    /** Mapper bound at the start of the current or last run, or null before the first run. */
    public CoordinateMapper coordinateMapper() { return mapper; }

    /**
     * Run {@code script} to completion on the calling thread.
     *
     * @throws IllegalStateException if a run is already in progress
     */
    public RunReport run(Script script) {
        begin(script);
        return execute();
    }

    /**
     * Run {@code script} on a dedicated thread. The worker is RUNNING when this
     * returns, so an immediate {@link #stop()} is never lost.
     */
    public CompletableFuture<RunReport> start(Script script) {
        begin(script);
        var future = new CompletableFuture<RunReport>();
        Thread thread = new Thread(() -> {
            try {
                future.complete(execute());
            } catch (Throwable t) {
                log.error("{}: worker thread died", target, t);
                future.completeExceptionally(t);
            }
        }, threadName);
        thread.start();
        return future;
    }

    public void pause() {
        synchronized (stateLock) {
            if (state == WorkerState.RUNNING && control.pause()) {
                state = WorkerState.PAUSED;
                log.info("{}: paused at iteration {}", target, iterationCount);
            }
        }
    }

    public void resume() {
        synchronized (stateLock) {
            if (state == WorkerState.PAUSED && control.resume()) {
                state = WorkerState.RUNNING;
                log.info("{}: resumed", target);
            }
        }
    }

    /** Idempotent and safe from any state. A running worker stops at its next dispatch boundary. */
    public void stop() {
        synchronized (stateLock) {
            control.stop();
            if (state == WorkerState.IDLE) {
                state = WorkerState.STOPPED;
            }
        }
        log.debug("{}: stop requested", target);
    }

    private void begin(Script script) {
        Objects.requireNonNull(script, "script");
        synchronized (stateLock) {
            if (state.isActive()) {
                throw new IllegalStateException("Worker for %s is already %s".formatted(target, state));
            }
            control.reset();
            this.script = script;
            this.variables = new VariableStore(script.variablesGlobal());
            this.iterationCount = 0;
            this.cursor = script.firstCommandId();
            this.startedAtNanos = clock.nowNanos();
            state = WorkerState.RUNNING;
        }
    }

    private RunReport execute() {
        log.info("{}: starting script with {} commands (max {} iterations)",
            target, script.sequence().size(), script.maxIterations());

        Step.Halt end;
        try {
            bindCoordinates();
            end = loop();
        } catch (CapabilityException e) {
            log.error("{}: capture unavailable: {}", target, e.getMessage());
            end = Step.Halt.failed(ErrorKind.CAPABILITY, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{}: unexpected error before iteration {}", target, iterationCount + 1, e);
            end = Step.Halt.failed(ErrorKind.UNEXPECTED, String.valueOf(e));
        }

        if (end.state() == WorkerState.FAILED) {
            runErrorHandler();
        }

        synchronized (stateLock) {
            state = end.state();
        }
        RunReport report = report(end);
        if (end.state() == WorkerState.FAILED) {
            log.warn("{}", report.summary());
        } else {
            log.info("{}", report.summary());
        }
        return report;
    }

    private RunReport report(Step.Halt end) {
        Command last = cursor == null ? null : script.command(cursor);
        return new RunReport(target, end.state(), iterationCount,
            Duration.ofNanos(clock.nowNanos() - startedAtNanos),
            cursor, last == null ? null : last.name(),
            end.kind(), end.message(), variables.snapshot());
    }

    /**
     * Query the device resolution and bind the mapper. An unresolved device falls
     * back to the observed surface at scale 1.0.
     */
    private void bindCoordinates() {
        ResolutionResult result = resolutionService.queryResolution(target, settings.resolutionTimeout());
        Optional<Resolution> resolved = result.toOptional();

        Surface bound = surface;
        if (bound == null) {
            if (resolved.isPresent()) {
                bound = Surface.atOrigin(resolved.get().width(), resolved.get().height());
            } else {
                Frame frame = captures.get(target, false);
                bound = Surface.atOrigin(frame.width(), frame.height());
            }
        }
        Resolution logical = resolved.orElse(bound.size());
        if (resolved.isEmpty()) {
            log.warn("{}: resolution unresolved, using surface {} at scale 1.0", target, logical);
        }

        if (mapper == null) {
            mapper = new CoordinateMapper(logical, bound);
        } else if (mapper.update(logical, bound)) {
            log.info("{}: rescaled to {} -> {}x{}", target, logical, bound.width(), bound.height());
        }
    }

    private Step.Halt loop() {
        String current = script.firstCommandId();
        while (current != null) {
            Command command = script.command(current);
            if (command == null) {
                return Step.Halt.failed(ErrorKind.CONFIGURATION, "Command id not found: " + current);
            }
            Step step = visit(command);
            if (step instanceof Step.Halt halt) {
                return halt;
            }
            current = step instanceof Step.Jump jump ? jump.commandId() : script.naturalNext(command.id());
        }
        return new Step.Halt(WorkerState.COMPLETED, null, null);
    }

    /** Gate, count and dispatch one command. */
    private Step visit(Command command) {
        if (control.isStopped()) {
            return Step.Halt.stopped();
        }
        control.awaitWhilePaused();
        if (control.isStopped()) {
            return Step.Halt.stopped();
        }
        if (iterationCount >= script.maxIterations()) {
            log.warn("{}: iteration limit {} reached", target, script.maxIterations());
            return Step.Halt.failed(ErrorKind.ITERATION_LIMIT_EXCEEDED,
                "Reached maxIterations " + script.maxIterations());
        }
        iterationCount++;
        cursor = command.id();

        if (!script.isEnabled(command)) {
            log.debug("{}: [{}] {} disabled, skipping", target, iterationCount, command.name());
            return Step.NEXT;
        }
        log.debug("{}: [{}] {} ({})", target, iterationCount, command.name(), command.kind().label());
        return dispatch(command);
    }

    private Step dispatch(Command command) {
        int iteration = iterationCount;
        try {
            Outcome outcome = perform(command);
            if (!(outcome.step() instanceof Step.Halt)) {
                mergeOutputs(command, outcome.results());
            }
            return outcome.step();
        } catch (CommandExecutionException e) {
            log.warn("{}: command {} '{}' failed at iteration {} ({}): {}",
                target, command.id(), command.name(), iteration, e.kind(), e.getMessage());
            return applyOnFail(command, e);
        } catch (CapabilityException e) {
            log.error("{}: command {} '{}' has no capture at iteration {}: {}",
                target, command.id(), command.name(), iteration, e.getMessage());
            return Step.Halt.failed(ErrorKind.CAPABILITY, e.getMessage());
        } catch (ConfigurationException e) {
            log.error("{}: command {} '{}' misconfigured at iteration {}: {}",
                target, command.id(), command.name(), iteration, e.getMessage());
            return Step.Halt.failed(ErrorKind.CONFIGURATION, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{}: command {} '{}' threw at iteration {}", target, command.id(), command.name(), iteration, e);
            return Step.Halt.failed(ErrorKind.UNEXPECTED, String.valueOf(e));
        }
    }

    private Step applyOnFail(Command command, CommandExecutionException e) {
        OnFail onFail = command.onFail();
        if (onFail instanceof OnFail.Skip) {
            return Step.NEXT;
        }
        if (onFail instanceof OnFail.GotoLabel gotoLabel) {
            return jumpTo(gotoLabel.target());
        }
        return Step.Halt.failed(e.kind(), e.getMessage());
    }

    private Step jumpTo(String label) {
        String id = script.resolveLabel(label);
        if (id == null) {
            return Step.Halt.failed(ErrorKind.CONFIGURATION, "Unresolved label '%s'".formatted(label));
        }
        return new Step.Jump(id);
    }

    private void mergeOutputs(Command command, Map<String, Object> results) {
        for (String key : command.variablesOut()) {
            if (results.containsKey(key)) {
                variables.put(key, results.get(key));
            } else {
                log.debug("{}: {} produced no '{}'", target, command.name(), key);
            }
        }
    }

    private Outcome perform(Command command) {
        CommandSpec spec = command.spec();
        if (spec instanceof CommandSpec.Click click) {
            return click(click);
        }
        if (spec instanceof CommandSpec.CropImage crop) {
            return cropImage(crop);
        }
        if (spec instanceof CommandSpec.KeyPress key) {
            require(backend.keyPress(target, new KeyAction(key.key(), key.repeat(), key.delayBetweenMs())));
            return Outcome.next(Map.of("key", key.key()));
        }
        if (spec instanceof CommandSpec.HotKey hotKey) {
            require(backend.hotKey(target, new HotKeyAction(hotKey.keys(), hotKey.order())));
            return Outcome.next(Map.of("keys", hotKey.keys()));
        }
        if (spec instanceof CommandSpec.Text text) {
            return text(text);
        }
        if (spec instanceof CommandSpec.Wait wait) {
            return waitFor(wait);
        }
        if (spec instanceof CommandSpec.Repeat repeat) {
            return repeat(repeat);
        }
        if (spec instanceof CommandSpec.Goto go) {
            boolean taken = go.guardExpr() == null || evaluate(go.guardExpr());
            return new Outcome(taken ? jumpTo(go.targetLabel()) : Step.NEXT, Map.of("taken", taken));
        }
        if (spec instanceof CommandSpec.Condition condition) {
            return condition(condition);
        }
        throw new IllegalStateException("Unhandled command variant: " + spec);
    }

    private Outcome click(CommandSpec.Click click) {
        Point p = mapper.localToScreen(click.x(), click.y());
        require(backend.click(target, new ClickAction(click.button(), p,
            click.humanizeDelayMinMs(), click.humanizeDelayMaxMs(), click.wheelDelta())));
        return Outcome.next(Map.of("x", (long) p.x(), "y", (long) p.y()));
    }

    private Outcome text(CommandSpec.Text text) {
        Point focus = text.hasFocus() ? mapper.localToScreen(text.focusX(), text.focusY()) : null;
        require(backend.text(target, new TextAction(text.content(), text.mode(),
            text.speedMinCps(), text.speedMaxCps(), focus)));
        return Outcome.next(Map.of("text", text.content()));
    }

    private Outcome cropImage(CommandSpec.CropImage crop) {
        Frame frame = captures.get(target, false);
        Region region = mapper.localRegionToFrame(crop.region(), frame.width(), frame.height());
        Optional<ColorMatch> match = ColorScanner.scan(frame, region, crop.targetColor(), crop.tolerance(), crop.scanMode());
        if (match.isEmpty()) {
            variables.put(crop.outputVar(), null);
            throw new CommandExecutionException("Color %s not found in %s".formatted(crop.targetColor(), crop.region()));
        }
        Point local = mapper.frameToLocal(match.get().x(), match.get().y(), frame.width(), frame.height());
        var found = new LinkedHashMap<String, Object>();
        found.put("x", (long) local.x());
        found.put("y", (long) local.y());
        found.put("confidence", match.get().confidence());
        variables.put(crop.outputVar(), found);

        var results = new LinkedHashMap<String, Object>(found);
        results.put(crop.outputVar(), found);
        return Outcome.next(results);
    }

    /**
     * Poll until the wait condition holds or its timeout elapses. Time spent paused
     * does not count against the timeout.
     */
    private Outcome waitFor(CommandSpec.Wait wait) {
        long timeoutNanos = wait.timeout().toNanos();
        WaitProbe probe = waitProbe(wait);
        long active = 0;
        long mark = clock.nowNanos();

        while (true) {
            if (probe != null && probe.matched()) {
                return Outcome.next(Map.of("elapsedMs", active / 1_000_000L));
            }
            long now = clock.nowNanos();
            active += now - mark;
            mark = now;
            if (active >= timeoutNanos) {
                if (wait.mode() == WaitMode.TIMEOUT) {
                    return Outcome.next(Map.of("elapsedMs", active / 1_000_000L));
                }
                throw new CommandTimeoutException("%s wait timed out after %d ms"
                    .formatted(wait.mode().label(), wait.timeout().toMillis()));
            }
            long tick = Math.min(settings.pollInterval().toNanos(), timeoutNanos - active);
            if (!control.sleep(Duration.ofNanos(tick))) {
                return new Outcome(Step.Halt.stopped(), Map.of());
            }
            if (control.isPaused()) {
                active += clock.nowNanos() - mark;
                control.awaitWhilePaused();
                mark = clock.nowNanos();
                if (control.isStopped()) {
                    return new Outcome(Step.Halt.stopped(), Map.of());
                }
            }
        }
    }

    private WaitProbe waitProbe(CommandSpec.Wait wait) {
        if (wait.mode() == WaitMode.PIXEL_COLOR) {
            CommandSpec.PixelProbe pixel = wait.pixel();
            return () -> {
                Frame frame = captures.get(target, true);
                Point at = mapper.localToFrame(pixel.x(), pixel.y(), frame.width(), frame.height());
                return pixel.color().maxChannelDelta(frame.pixel(at.x(), at.y())) <= pixel.tolerance();
            };
        }
        if (wait.mode() == WaitMode.SCREEN_CHANGE) {
            CommandSpec.ScreenProbe screen = wait.screen();
            Frame baseline = captures.get(target, true);
            Region region = screen.region() == null
                ? baseline.bounds()
                : mapper.localRegionToFrame(screen.region(), baseline.width(), baseline.height());
            double required = 1.0 - screen.threshold();
            return () -> ScreenComparator.divergence(baseline, captures.get(target, true), region) > required;
        }
        return null;
    }

    private Outcome repeat(CommandSpec.Repeat repeat) {
        boolean hadIndex = variables.contains(LOOP_INDEX);
        Object previousIndex = variables.get(LOOP_INDEX);
        long pass = 0;
        try {
            while (repeat.count() == 0 || pass < repeat.count()) {
                pass++;
                variables.put(LOOP_INDEX, pass);
                Step step = runNested(repeat.innerCommands());
                if (!(step instanceof Step.Next)) {
                    return new Outcome(step, Map.of());
                }
                if (repeat.untilExpr() != null && evaluate(repeat.untilExpr())) {
                    break;
                }
            }
        } finally {
            if (hadIndex) {
                variables.put(LOOP_INDEX, previousIndex);
            } else {
                variables.remove(LOOP_INDEX);
            }
        }
        return Outcome.next(Map.of("passes", pass));
    }

    private Outcome condition(CommandSpec.Condition condition) {
        boolean result = evaluate(condition.expr());
        String label = result ? condition.thenLabel() : condition.elseLabel();
        List<Command> nested = result ? condition.nestedThen() : condition.nestedElse();
        Step step;
        if (label != null) {
            step = jumpTo(label);
        } else if (!nested.isEmpty()) {
            step = runNested(nested);
        } else {
            step = Step.NEXT;
        }
        return new Outcome(step, Map.of("result", result));
    }

    /** Run a child list in order; a jump or halt abandons the rest of it. */
    private Step runNested(List<Command> commands) {
        for (Command child : commands) {
            Step step = visit(child);
            if (!(step instanceof Step.Next)) {
                return step;
            }
        }
        return Step.NEXT;
    }

    private boolean evaluate(String source) {
        try {
            return ExpressionEvaluator.test(script.expression(source), variables::get, variables.snapshot());
        } catch (ExpressionException e) {
            throw new CommandExecutionException("Cannot evaluate '%s': %s".formatted(source, e.getMessage()), e);
        }
    }

    private void require(ActionResult result) {
        if (!result.success()) {
            throw new CommandExecutionException(result.error() == null ? "Device action failed" : result.error());
        }
    }

    /** Dispatch the script's error handler once, outside iteration accounting. */
    private void runErrorHandler() {
        Command handler = script.onErrorHandler();
        if (handler == null || !script.isEnabled(handler)) {
            return;
        }
        log.info("{}: running error handler '{}'", target, handler.name());
        try {
            Outcome outcome = perform(handler);
            if (!(outcome.step() instanceof Step.Halt)) {
                mergeOutputs(handler, outcome.results());
            }
        } catch (RuntimeException e) {
            log.warn("{}: error handler '{}' failed: {}", target, handler.name(), e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface WaitProbe {
        boolean matched();
    }

    private record Outcome(Step step, Map<String, Object> results) {
        static Outcome next(Map<String, Object> results) {
            return new Outcome(Step.NEXT, results);
        }
    }

    public static final class Builder {
        private final String target;
        private DeviceBackend backend;
        private DeviceResolutionService resolutionService;
        private CaptureCache captures;
        private Surface surface;
        private EngineSettings settings = EngineSettings.defaults();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private String threadName;

        private Builder(String target) {
            this.target = target;
        }

        public Builder backend(DeviceBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder resolutionService(DeviceResolutionService resolutionService) {
            this.resolutionService = resolutionService;
            return this;
        }

        public Builder captures(CaptureCache captures) {
            this.captures = captures;
            return this;
        }

        /** Observed physical surface; defaults to the device resolution at the origin. */
        public Builder surface(Surface surface) {
            this.surface = surface;
            return this;
        }

        public Builder settings(EngineSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
            return this;
        }

        public Builder clock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder threadName(String threadName) {
            this.threadName = threadName;
            return this;
        }

        public Worker build() {
            return new Worker(this);
        }
    }
}
