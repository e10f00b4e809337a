package app.unilex.srs.review.domain;

import java.time.Instant;
import java.util.Objects;

public record ActivityOutcome(
        ActivityType activityType,
        boolean wasCorrect,
        Double score,
        Instant attemptedAt
) {
    public ActivityOutcome {
        Objects.requireNonNull(activityType, "activityType");
        Objects.requireNonNull(attemptedAt, "attemptedAt");
    }

    public static ActivityOutcome recognition(boolean wasCorrect, Instant attemptedAt) {
        return new ActivityOutcome(ActivityType.RECOGNITION, wasCorrect, null, attemptedAt);
    }

    public static ActivityOutcome production(boolean wasCorrect, Double score, Instant attemptedAt) {
        return new ActivityOutcome(ActivityType.PRODUCTION, wasCorrect, score, attemptedAt);
    }
}
