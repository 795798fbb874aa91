package FSA.Minimise;

import java.util.List;

import FSA.Model.Automaton;

/**
 * Outcome of {@link NFAMinimiser#minimise}: the chosen automaton and how it was obtained.
 *
 * @param stages - pipeline stages in execution order
 */
public record MinimisationResult(Automaton nfa,
                                 int originalStates,
                                 int finalStates,
                                 Method method,
                                 List<String> stages,
                                 List<CandidateReport> candidates) {

    public MinimisationResult {
        stages = List.copyOf(stages);
        candidates = List.copyOf(candidates);
    }

    public int reduction() {
        return originalStates - finalStates;
    }

    public double reductionPercentage() {
        if (originalStates == 0) {
            return 0.0;
        }
        return 100.0 * reduction() / originalStates;
    }
}
