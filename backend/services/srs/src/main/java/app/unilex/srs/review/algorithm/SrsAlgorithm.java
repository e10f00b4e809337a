package app.unilex.srs.review.algorithm;

import app.unilex.srs.review.domain.ScheduleState;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public interface SrsAlgorithm {

    int MIN_QUALITY = 0;
    int MAX_QUALITY = 5;

    String id();

    /**
     * Computes the schedule that follows a review graded {@code quality}.
     *
     * @param previous state before this review, or null for an item never reviewed
     * @throws IllegalArgumentException if {@code quality} is outside [0, 5]
     */
    ReviewComputation apply(ScheduleState previous, int quality, Instant reviewedAt, double minIntervalHours);

    default Map<Integer, Instant> previewDueAt(ScheduleState previous, Instant reviewedAt, double minIntervalHours) {
        Map<Integer, Instant> out = new LinkedHashMap<>();
        for (int q = MIN_QUALITY; q <= MAX_QUALITY; q++) {
            out.put(q, apply(previous, q, reviewedAt, minIntervalHours).schedule().dueAt());
        }
        return out;
    }

    record ReviewComputation(
            ScheduleState schedule,
            boolean successful
    ) {
    }
}
