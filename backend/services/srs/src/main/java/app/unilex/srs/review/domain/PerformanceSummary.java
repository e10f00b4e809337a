package app.unilex.srs.review.domain;

public record PerformanceSummary(
        SkillSummary recognition,
        SkillSummary production,
        Overall overall
) {
    public record SkillSummary(
            long correct,
            long incorrect,
            long total,
            Double accuracy
    ) {
        public static SkillSummary of(PerformanceCounters.SkillCounter counter) {
            return new SkillSummary(
                    counter.correctCount(),
                    counter.incorrectCount(),
                    counter.total(),
                    counter.accuracy()
            );
        }
    }

    public record Overall(
            Double mastery,
            boolean mastered,
            int streak,
            Double daysUntilDue,
            boolean due
    ) {
    }
}
