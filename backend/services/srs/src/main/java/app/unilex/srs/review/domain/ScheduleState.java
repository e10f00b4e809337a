package app.unilex.srs.review.domain;

import java.time.Instant;

/**
 * Spaced-repetition bookkeeping for one vocabulary item. Replaced wholesale on every review.
 */
public record ScheduleState(
        String algorithm,
        int streak,
        double intervalHours,
        double easeFactor,
        Instant dueAt,
        Instant lastReviewedAt
) {
    public ScheduleState {
        if (algorithm == null || algorithm.isBlank()) {
            throw new IllegalArgumentException("algorithm is required");
        }
        if (dueAt == null) {
            throw new IllegalArgumentException("dueAt is required");
        }
        streak = Math.max(0, streak);
        intervalHours = Math.max(0.0, intervalHours);
    }

    public boolean isDueAt(Instant now) {
        return !dueAt.isAfter(now);
    }
}
