package pass;

/**
 * What a pass reports back to the pipeline about cached analysis results.
 */
public enum PreservedAnalyses {
    /** nothing changed, every analysis is still valid */
    ALL,
    /** the IR was modified, downstream analyses must be recomputed */
    NONE;

    public static PreservedAnalyses of(boolean changed) {
        return changed ? NONE : ALL;
    }

    public PreservedAnalyses intersect(PreservedAnalyses other) {
        return this == ALL && other == ALL ? ALL : NONE;
    }

    public boolean areAllPreserved() {
        return this == ALL;
    }
}
