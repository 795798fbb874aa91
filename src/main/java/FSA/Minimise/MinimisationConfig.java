package FSA.Minimise;

import FSA.Model.Threshold;

/**
 * Bounds for the exponential parts of NFA minimisation.
 *
 * @param kamedaWeinerThreshold - largest complexity (states + transitions) on which Kameda–Weiner runs
 * @param maxCoverSize - largest number of grids in a cover
 * @param maxCovers - how many covers of the first successful size are synthesized
 * @param coverSearchBudget - search nodes visited per cover size before giving up on that size
 */
public record MinimisationConfig(int kamedaWeinerThreshold, int maxCoverSize, int maxCovers, int coverSearchBudget) {
    public static final int DEFAULT_MAX_COVER_SIZE = 12;
    public static final int DEFAULT_MAX_COVERS = 10;
    public static final int DEFAULT_COVER_SEARCH_BUDGET = 100_000;

    public MinimisationConfig {
        if (kamedaWeinerThreshold < 0 || maxCoverSize < 1 || maxCovers < 1 || coverSearchBudget < 1) {
            throw new IllegalArgumentException("Invalid minimisation bounds: threshold=" + kamedaWeinerThreshold
                    + ", maxCoverSize=" + maxCoverSize + ", maxCovers=" + maxCovers
                    + ", coverSearchBudget=" + coverSearchBudget);
        }
    }

    public static MinimisationConfig defaults() {
        return withThreshold(Threshold.DEFAULT_THRESHOLD_SIZE);
    }

    public static MinimisationConfig withThreshold(int kamedaWeinerThreshold) {
        return new MinimisationConfig(kamedaWeinerThreshold, DEFAULT_MAX_COVER_SIZE, DEFAULT_MAX_COVERS,
                DEFAULT_COVER_SEARCH_BUDGET);
    }

    public Threshold threshold() {
        return Threshold.maxComplexity(kamedaWeinerThreshold);
    }
}
