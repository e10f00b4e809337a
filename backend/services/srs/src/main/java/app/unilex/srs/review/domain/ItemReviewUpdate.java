package app.unilex.srs.review.domain;

import java.util.UUID;

/**
 * New review state for one item. The caller writes {@code schedule} and {@code performance} back
 * to the item store, replacing what was there.
 */
public record ItemReviewUpdate(
        UUID itemId,
        ScheduleState schedule,
        PerformanceCounters performance,
        int quality,
        boolean successful
) {
}
