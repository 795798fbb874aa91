package FSA.Simulation;

import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Outcome of a non-deterministic run.
 *
 * @param accepted - whether at least one accepting path exists
 * @param paths - every accepting path found, in discovery order
 * @param rejectionReason - why the input was rejected, null when accepted
 */
public record NFASimulationResult(boolean accepted, List<List<Step>> paths, @Nullable String rejectionReason) {

    public NFASimulationResult {
        paths = List.copyOf(paths);
    }

    static NFASimulationResult accepted(List<List<Step>> paths) {
        return new NFASimulationResult(true, paths, null);
    }

    static NFASimulationResult rejected(String reason) {
        return new NFASimulationResult(false, List.of(), reason);
    }
}
