package FSA.Minimise;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

import FSA.Equivalence;
import FSA.Equivalence.EquivalenceResult;
import FSA.NFATrim;
import FSA.PowersetDeterminizer;
import FSA.Model.Automaton;
import FSA.Model.Cancellation;
import FSA.Model.Threshold;

/**
 * Multi-candidate NFA minimisation. Every candidate is checked for language equivalence with the
 * original input before it may be selected; the smallest verified candidate wins, ties going to
 * the earlier {@link Method}. If nothing verifies the original input is returned.
 */
public class NFAMinimiser {
    public static boolean DEBUG = false;

    private final MinimisationConfig config;
    private final Cancellation cancellation;

    public NFAMinimiser(MinimisationConfig config, Cancellation cancellation) {
        this.config = config;
        this.cancellation = cancellation;
    }

    public static MinimisationResult minimise(Automaton nfa) {
        return new NFAMinimiser(MinimisationConfig.defaults(), Cancellation.none()).run(nfa);
    }

    /**
     * @param kamedaWeinerThreshold - largest complexity on which Kameda–Weiner is attempted
     */
    public static MinimisationResult minimise(Automaton nfa, int kamedaWeinerThreshold) {
        return new NFAMinimiser(MinimisationConfig.withThreshold(kamedaWeinerThreshold), Cancellation.none()).run(nfa);
    }

    public MinimisationResult run(Automaton original) {
        final List<String> stages = new ArrayList<>();
        final List<CandidateReport> reports = new ArrayList<>();
        final Map<Method, Automaton> verified = new EnumMap<>(Method.class);
        final Threshold threshold = config.threshold();

        stages.add("preprocess");
        final Automaton trimmed = NFATrim.trim(original);
        stages.add("remove_epsilon");
        final Automaton epsilonFree = NFATrim.removeEpsilon(trimmed);
        stages.add("preprocess");
        final Automaton preprocessed = NFATrim.trim(epsilonFree);

        candidate(Method.PREPROCESSED, () -> preprocessed, original, stages, reports, verified);

        if (threshold.test(preprocessed)) {
            candidate(Method.KAMEDA_WEINER, () -> new KamedaWeiner(config, cancellation).run(preprocessed),
                    original, stages, reports, verified);
        } else {
            reports.add(CandidateReport.skipped(Method.KAMEDA_WEINER, aboveThreshold(threshold, preprocessed)));
        }

        final Automaton minimalDfa = candidate(Method.DETERMINIZE_MINIMISE, () -> {
            final Automaton dfa = new PowersetDeterminizer(cancellation).run(preprocessed).dfa();
            return NFATrim.trim(DFAMinimiser.minimise(dfa));
        }, original, stages, reports, verified);

        if (minimalDfa == null) {
            reports.add(CandidateReport.skipped(Method.DFA_KAMEDA_WEINER, "no minimal DFA"));
        } else if (threshold.test(minimalDfa)) {
            candidate(Method.DFA_KAMEDA_WEINER, () -> new KamedaWeiner(config, cancellation).run(minimalDfa),
                    original, stages, reports, verified);
        } else {
            reports.add(CandidateReport.skipped(Method.DFA_KAMEDA_WEINER, aboveThreshold(threshold, minimalDfa)));
        }

        candidate(Method.BISIMULATION, () -> NFATrim.bisim(preprocessed), original, stages, reports, verified);

        stages.add("select");
        Method method = Method.ORIGINAL;
        Automaton best = original;
        for (Map.Entry<Method, Automaton> e : verified.entrySet()) {
            // EnumMap iterates in priority order, so only strictly smaller candidates replace the best
            if (method == Method.ORIGINAL || e.getValue().size() < best.size()) {
                method = e.getKey();
                best = e.getValue();
            }
        }
        if (DEBUG) {
            System.out.println("DEBUG: Selected " + method + ": " + original.size() + " -> " + best.size() + " states");
        }
        return new MinimisationResult(best, original.size(), best.size(), method, stages, reports);
    }

    /**
     * Produces and verifies one candidate.
     * @return the candidate, or null if it was not produced
     */
    private Automaton candidate(Method method,
                                Supplier<Automaton> producer,
                                Automaton original,
                                List<String> stages,
                                List<CandidateReport> reports,
                                Map<Method, Automaton> verified) {
        if (cancellation.isCancelled()) {
            reports.add(CandidateReport.skipped(method, "cancelled (" + cancellation.cancelLabel() + ")"));
            return null;
        }
        stages.add(method.name().toLowerCase());
        final Automaton candidate;
        try {
            candidate = producer.get();
        } catch (CancellationException e) {
            reports.add(CandidateReport.skipped(method, "cancelled (" + e.getMessage() + ")"));
            return null;
        }
        final EquivalenceResult check = Equivalence.check(candidate, original);
        if (DEBUG) {
            System.out.println("DEBUG: " + method + " candidate: " + candidate.size() + " states, "
                    + (check.equivalent() ? "verified" : "rejected: " + check.reason()));
        }
        if (check.equivalent()) {
            verified.put(method, candidate);
            reports.add(CandidateReport.verified(method, candidate.size()));
        } else {
            reports.add(CandidateReport.rejected(method, candidate.size(), check.reason()));
        }
        return candidate;
    }

    private static String aboveThreshold(Threshold threshold, Automaton a) {
        return threshold.getName() + " " + a.complexity() + " above threshold " + threshold.getParam();
    }
}
