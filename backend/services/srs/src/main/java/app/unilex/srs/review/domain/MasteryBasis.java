package app.unilex.srs.review.domain;

/**
 * Which skill axes contribute to an item's mastery level.
 */
public enum MasteryBasis {
    NONE,
    RECOGNITION_ONLY,
    PRODUCTION_ONLY,
    BLENDED;

    public static MasteryBasis of(PerformanceCounters performance) {
        if (performance == null) {
            return NONE;
        }
        boolean recognition = performance.recognition().total() > 0;
        boolean production = performance.production().total() > 0;
        if (recognition && production) return BLENDED;
        if (recognition) return RECOGNITION_ONLY;
        if (production) return PRODUCTION_ONLY;
        return NONE;
    }
}
