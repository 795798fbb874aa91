package FSA.Minimise;

/**
 * Minimisation candidates, in tie-break priority order (earlier wins on equal state counts).
 */
public enum Method {
    DETERMINIZE_MINIMISE,
    KAMEDA_WEINER,
    DFA_KAMEDA_WEINER,
    BISIMULATION,
    PREPROCESSED,
    ORIGINAL
}
