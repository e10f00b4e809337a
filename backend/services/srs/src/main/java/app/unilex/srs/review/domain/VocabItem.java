package app.unilex.srs.review.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * The slice of a stored vocabulary item this service reads. {@code schedule} is null until the first
 * review and {@code performance} is null until the first attempt.
 */
public record VocabItem(
        UUID id,
        Instant createdAt,
        ScheduleState schedule,
        PerformanceCounters performance
) {
    public static VocabItem fresh(UUID id, Instant createdAt) {
        return new VocabItem(id, createdAt, null, null);
    }

    public VocabItem apply(ItemReviewUpdate update) {
        return new VocabItem(id, createdAt, update.schedule(), update.performance());
    }
}
