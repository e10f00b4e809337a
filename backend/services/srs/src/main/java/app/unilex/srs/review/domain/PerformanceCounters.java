package app.unilex.srs.review.domain;

import java.time.Instant;

/**
 * Per-skill attempt counters for one vocabulary item. Counts only ever grow.
 */
public record PerformanceCounters(
        SkillCounter recognition,
        SkillCounter production
) {
    public static final PerformanceCounters EMPTY = new PerformanceCounters(SkillCounter.EMPTY, SkillCounter.EMPTY);

    public PerformanceCounters {
        recognition = recognition == null ? SkillCounter.EMPTY : recognition;
        production = production == null ? SkillCounter.EMPTY : production;
    }

    public PerformanceCounters withAttempt(ActivityType type, boolean correct, Instant attemptedAt) {
        return switch (type) {
            case RECOGNITION -> new PerformanceCounters(recognition.withAttempt(correct, attemptedAt), production);
            case PRODUCTION -> new PerformanceCounters(recognition, production.withAttempt(correct, attemptedAt));
        };
    }

    public record SkillCounter(
            long correctCount,
            long incorrectCount,
            Instant lastAttemptAt
    ) {
        public static final SkillCounter EMPTY = new SkillCounter(0, 0, null);

        public SkillCounter {
            correctCount = Math.max(0, correctCount);
            incorrectCount = Math.max(0, incorrectCount);
        }

        public long total() {
            return correctCount + incorrectCount;
        }

        public Double accuracy() {
            long total = total();
            if (total == 0) {
                return null;
            }
            return (double) correctCount / total;
        }

        SkillCounter withAttempt(boolean correct, Instant attemptedAt) {
            return new SkillCounter(
                    correct ? correctCount + 1 : correctCount,
                    correct ? incorrectCount : incorrectCount + 1,
                    attemptedAt
            );
        }
    }
}
