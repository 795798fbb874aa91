package FSA.Simulation;

import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Progress event of a streamed simulation. A {@code STEP} carries the move just explored and the
 * path leading up to and including it; an {@code ACCEPT} carries a complete accepting path; the
 * single {@code REJECT} that ends a stream without accepting paths carries the reason.
 */
public record SimulationEvent(Type type, @Nullable Step step, List<Step> path, @Nullable String reason) {

    public enum Type {
        STEP,
        ACCEPT,
        REJECT
    }

    public SimulationEvent {
        path = List.copyOf(path);
    }

    static SimulationEvent step(List<Step> path) {
        return new SimulationEvent(Type.STEP, path.get(path.size() - 1), path, null);
    }

    static SimulationEvent accept(List<Step> path) {
        return new SimulationEvent(Type.ACCEPT, null, path, null);
    }

    static SimulationEvent reject(String reason) {
        return new SimulationEvent(Type.REJECT, null, List.of(), reason);
    }
}
