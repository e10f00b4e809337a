package app.unilex.srs.review.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

public record DrillSession(
        UUID id,
        Instant startedAt,
        Instant endedAt,
        int correctCount,
        int incorrectCount,
        double score
) {
    public Duration duration() {
        if (startedAt == null || endedAt == null || endedAt.isBefore(startedAt)) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, endedAt);
    }
}
