package dev.macros.device;

import dev.macros.backend.DeviceShell;
import dev.macros.coords.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeoutException;

/**
 * Shared, tiered lookup of a device's display resolution.
 *
 * <p>One instance serves every worker. Probes run in order (primary {@code wm size},
 * secondary {@code dumpsys display}); each gets its own bounded timeout and the
 * first parseable answer wins. When all fail the result is
 * {@link ResolutionResult.Unresolved} carrying why each tier failed. Resolved sizes
 * are cached per device; queries for different devices never wait on each other.</p>
 */
public final class DeviceResolutionService {

    private static final Logger log = LoggerFactory.getLogger(DeviceResolutionService.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final DeviceShell shell;
    private final List<ResolutionProbe> probes;
    private final ConcurrentMap<String, Resolution> resolved = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Object> deviceLocks = new ConcurrentHashMap<>();

    public DeviceResolutionService(DeviceShell shell, List<ResolutionProbe> probes) {
        this.shell = Objects.requireNonNull(shell, "shell");
        if (probes == null || probes.isEmpty()) {
            throw new IllegalArgumentException("At least one resolution probe is required");
        }
        this.probes = List.copyOf(probes);
    }

    /** Service with the standard {@code wm size} then {@code dumpsys display} tiers. */
    public static DeviceResolutionService withDefaultProbes(DeviceShell shell) {
        return new DeviceResolutionService(shell, List.of(new WmSizeProbe(), new DisplayDumpProbe()));
    }

    public ResolutionResult queryResolution(String deviceId) {
        return queryResolution(deviceId, DEFAULT_TIMEOUT);
    }

    /**
     * Resolve {@code deviceId}. Each probe attempt is bounded by {@code timeout};
     * a malformed id short-circuits before any I/O.
     */
    public ResolutionResult queryResolution(String deviceId, Duration timeout) {
        if (!DeviceIds.isValid(deviceId)) {
            log.warn("Refusing resolution query for malformed device id '{}'", deviceId);
            return new ResolutionResult.Unresolved(List.of(
                new ProbeFailure("validation", ProbeFailure.Reason.INVALID_ID, String.valueOf(deviceId))));
        }

        Resolution cached = resolved.get(deviceId);
        if (cached != null) {
            return new ResolutionResult.Resolved(cached, "cache");
        }

        Object lock = deviceLocks.computeIfAbsent(deviceId, id -> new Object());
        synchronized (lock) {
            cached = resolved.get(deviceId);
            if (cached != null) {
                return new ResolutionResult.Resolved(cached, "cache");
            }
            ResolutionResult result = probe(deviceId, timeout);
            if (result instanceof ResolutionResult.Resolved r) {
                resolved.put(deviceId, r.resolution());
            }
            return result;
        }
    }

    /** Forget a cached resolution so the next query probes again. */
    public void invalidate(String deviceId) {
        resolved.remove(deviceId);
    }

    public Optional<Resolution> cached(String deviceId) {
        return Optional.ofNullable(resolved.get(deviceId));
    }

    private ResolutionResult probe(String deviceId, Duration timeout) {
        var failures = new ArrayList<ProbeFailure>();
        for (ResolutionProbe probe : probes) {
            try {
                String output = shell.shell(deviceId, probe.command(), timeout);
                Optional<Resolution> parsed = probe.parse(output == null ? "" : output);
                if (parsed.isPresent()) {
                    log.info("{}: resolution {} ({})", deviceId, parsed.get(), probe.name());
                    return new ResolutionResult.Resolved(parsed.get(), probe.name());
                }
                failures.add(new ProbeFailure(probe.name(), ProbeFailure.Reason.UNPARSEABLE, abbreviate(output)));
                log.warn("{}: {} returned no recognizable size", deviceId, probe.name());
            } catch (TimeoutException e) {
                failures.add(new ProbeFailure(probe.name(), ProbeFailure.Reason.TIMEOUT, "after " + timeout.toMillis() + " ms"));
                log.warn("{}: {} timed out after {} ms", deviceId, probe.name(), timeout.toMillis());
            } catch (IOException e) {
                failures.add(new ProbeFailure(probe.name(), ProbeFailure.Reason.TRANSPORT, e.getMessage()));
                log.warn("{}: {} failed: {}", deviceId, probe.name(), e.getMessage());
            }
        }
        log.warn("{}: resolution unresolved: {}", deviceId, failures);
        return new ResolutionResult.Unresolved(failures);
    }

    private static String abbreviate(String output) {
        if (output == null) {
            return "no output";
        }
        String flat = output.strip().replace('\n', ' ');
        return flat.length() > 80 ? flat.substring(0, 80) + "..." : flat;
    }
}
