package dev.macros.device;

import dev.macros.coords.Resolution;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a resolution lookup.
 */
public sealed interface ResolutionResult {

    record Resolved(Resolution resolution, String source) implements ResolutionResult {}

    record Unresolved(List<ProbeFailure> failures) implements ResolutionResult {
        public Unresolved {
            failures = List.copyOf(failures);
        }

        public boolean timedOut() {
            return failures.stream().anyMatch(f -> f.reason() == ProbeFailure.Reason.TIMEOUT);
        }
    }

    default Optional<Resolution> toOptional() {
        return this instanceof Resolved resolved ? Optional.of(resolved.resolution()) : Optional.empty();
    }
}
