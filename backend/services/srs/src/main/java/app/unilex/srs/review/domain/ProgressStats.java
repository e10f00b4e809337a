package app.unilex.srs.review.domain;

import java.time.Instant;

public record ProgressStats(
        long totalVocabCount,
        long learnedVocabCount,
        long reviewDueCount,
        long streakDays,
        Instant lastSessionAt
) {
}
