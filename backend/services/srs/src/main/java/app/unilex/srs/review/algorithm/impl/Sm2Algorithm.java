package app.unilex.srs.review.algorithm.impl;

import app.unilex.srs.review.algorithm.SrsAlgorithm;
import app.unilex.srs.review.domain.ScheduleState;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * SM-2 with hour-based intervals. Quality 3 and above counts as a successful review.
 */
@Component
public class Sm2Algorithm implements SrsAlgorithm {

    public static final String ID = "sm2";

    public static final double DEFAULT_MIN_INTERVAL_HOURS = 24.0;
    public static final double INITIAL_EASE_FACTOR = 2.5;
    public static final double MIN_EASE_FACTOR = 1.3;
    public static final double MAX_INTERVAL_HOURS = 36_500.0 * 24.0;

    private static final int SUCCESS_QUALITY = 3;
    private static final int GRADUATION_MULTIPLIER = 6;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ReviewComputation apply(ScheduleState previous, int quality, Instant reviewedAt, double minIntervalHours) {
        if (quality < MIN_QUALITY || quality > MAX_QUALITY) {
            throw new IllegalArgumentException("quality must be between 0 and 5 inclusive, got " + quality);
        }
        if (reviewedAt == null) {
            throw new IllegalArgumentException("reviewedAt is required");
        }

        double minInterval = Double.isNaN(minIntervalHours)
                ? DEFAULT_MIN_INTERVAL_HOURS
                : clamp(minIntervalHours, DEFAULT_MIN_INTERVAL_HOURS, MAX_INTERVAL_HOURS);

        double prevEase = previous == null ? INITIAL_EASE_FACTOR : previous.easeFactor();
        int prevStreak = previous == null ? 0 : previous.streak();
        double prevInterval = previous == null ? 0.0 : previous.intervalHours();
        String algorithm = previous == null ? ID : previous.algorithm();

        int offset = MAX_QUALITY - quality;
        double ef = prevEase + (0.1 - offset * (0.08 + offset * 0.02));
        ef = Math.max(MIN_EASE_FACTOR, ef);

        boolean successful = quality >= SUCCESS_QUALITY;
        int streak;
        double interval;

        if (!successful) {
            streak = 0;
            interval = minInterval;
        } else {
            streak = prevStreak + 1;
            if (prevStreak == 0) {
                interval = minInterval;
            } else if (prevStreak == 1) {
                interval = Math.min(MAX_INTERVAL_HOURS, GRADUATION_MULTIPLIER * minInterval);
            } else {
                interval = clamp(Math.round(prevInterval * ef), minInterval, MAX_INTERVAL_HOURS);
            }
        }

        Instant due = plusHoursSaturating(reviewedAt, interval);
        ScheduleState next = new ScheduleState(algorithm, streak, interval, round4(ef), due, reviewedAt);
        return new ReviewComputation(next, successful);
    }

    // Instant.MAX when the due date would fall past the representable range
    private static Instant plusHoursSaturating(Instant from, double hours) {
        Duration step = Duration.ofSeconds(Math.round(hours * 3600.0));
        if (Duration.between(from, Instant.MAX).compareTo(step) < 0) {
            return Instant.MAX;
        }
        return from.plus(step);
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
