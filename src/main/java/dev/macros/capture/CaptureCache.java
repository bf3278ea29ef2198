package dev.macros.capture;

import dev.macros.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Short-lived per-target store of the most recent capture.
 *
 * <p>A cached frame younger than the TTL is reused unless the caller forces a
 * refresh. A refresh walks the provider chain in order and keeps the first frame
 * any provider returns. Each target has its own lock, so a slow capture of one
 * target never holds up another.</p>
 */
public final class CaptureCache {

    private static final Logger log = LoggerFactory.getLogger(CaptureCache.class);

    private final List<CaptureProvider> providers;
    private final Duration ttl;
    private final Duration captureTimeout;
    private final MonotonicClock clock;
    private final ConcurrentMap<String, Slot> slots = new ConcurrentHashMap<>();

    public CaptureCache(List<CaptureProvider> providers, Duration ttl, Duration captureTimeout, MonotonicClock clock) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("At least one capture provider is required");
        }
        this.providers = List.copyOf(providers);
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.captureTimeout = Objects.requireNonNull(captureTimeout, "captureTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Frame for {@code target}, from cache when fresh enough.
     *
     * @throws CapabilityException if a capture was needed and every provider failed
     */
    public Frame get(String target, boolean forceRefresh) {
        Slot slot = slots.computeIfAbsent(target, t -> new Slot());
        synchronized (slot) {
            if (!forceRefresh && slot.frame != null && clock.nowNanos() - slot.capturedAtNanos < ttl.toNanos()) {
                return slot.frame;
            }
            Frame fresh = acquire(target);
            slot.frame = fresh;
            slot.capturedAtNanos = clock.nowNanos();
            return fresh;
        }
    }

    /** Drop the cached frame for one target. */
    public void invalidate(String target) {
        Slot slot = slots.get(target);
        if (slot != null) {
            synchronized (slot) {
                slot.frame = null;
            }
        }
    }

    private Frame acquire(String target) {
        var attempts = new ArrayList<String>();
        for (CaptureProvider provider : providers) {
            try {
                Frame frame = provider.capture(target, captureTimeout);
                if (frame != null) {
                    if (!attempts.isEmpty()) {
                        log.info("Captured {} with fallback provider {} after: {}", target, provider.name(), attempts);
                    }
                    return frame;
                }
                attempts.add(provider.name() + ": no frame");
            } catch (CaptureException e) {
                attempts.add("%s: %s%s".formatted(provider.name(), e.isTimeout() ? "timeout " : "", e.getMessage()));
                log.debug("Provider {} failed for {}", provider.name(), target, e);
            } catch (RuntimeException e) {
                attempts.add("%s: %s".formatted(provider.name(), e));
                log.warn("Provider {} threw for {}", provider.name(), target, e);
            }
        }
        log.error("All {} capture providers failed for {}: {}", providers.size(), target, attempts);
        throw new CapabilityException(target, attempts);
    }

    private static final class Slot {
        private Frame frame;
        private long capturedAtNanos;
    }
}
