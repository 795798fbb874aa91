package FSA.Minimise;

/**
 * Diagnostics for one minimisation candidate.
 *
 * @param states - state count of the candidate, or -1 if it was not produced
 * @param reason - why the candidate was rejected or skipped; empty when it verified
 */
public record CandidateReport(Method method, int states, boolean verified, String reason) {

    static CandidateReport verified(Method method, int states) {
        return new CandidateReport(method, states, true, "");
    }

    static CandidateReport rejected(Method method, int states, String reason) {
        return new CandidateReport(method, states, false, reason);
    }

    static CandidateReport skipped(Method method, String reason) {
        return new CandidateReport(method, -1, false, reason);
    }
}
