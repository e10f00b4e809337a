package app.unilex.srs.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DateTimeException;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "app.srs")
public record SrsProps(
        Schedule schedule,
        Queue queue,
        Mastery mastery,
        Progress progress
) {
    public static final SrsProps DEFAULTS = new SrsProps(null, null, null, null);

    public SrsProps {
        schedule = schedule == null ? new Schedule(null, null) : schedule;
        queue = queue == null ? new Queue(null) : queue;
        mastery = mastery == null ? new Mastery(null, null, null, null) : mastery;
        progress = progress == null ? new Progress(null, null, null) : progress;
    }

    public record Schedule(String defaultAlgorithm, Double minIntervalHours) {
        public Schedule {
            defaultAlgorithm = (defaultAlgorithm == null || defaultAlgorithm.isBlank()) ? "sm2" : defaultAlgorithm.trim();
            minIntervalHours = minIntervalHours == null ? 24.0 : minIntervalHours;
            if (minIntervalHours <= 0) {
                throw new IllegalArgumentException("app.srs.schedule.min-interval-hours must be positive");
            }
        }
    }

    public record Queue(Integer upcomingWindowHours) {
        public Queue {
            upcomingWindowHours = upcomingWindowHours == null ? 12 : upcomingWindowHours;
            if (upcomingWindowHours < 0) {
                throw new IllegalArgumentException("app.srs.queue.upcoming-window-hours must be >= 0");
            }
        }
    }

    public record Mastery(Double threshold,
                          Integer streakThreshold,
                          Double recognitionWeight,
                          Double productionWeight) {
        public Mastery {
            threshold = threshold == null ? 0.8 : threshold;
            streakThreshold = streakThreshold == null ? 3 : streakThreshold;
            recognitionWeight = recognitionWeight == null ? 0.4 : recognitionWeight;
            productionWeight = productionWeight == null ? 0.6 : productionWeight;
            if (threshold < 0 || threshold > 1) {
                throw new IllegalArgumentException("app.srs.mastery.threshold must be in range [0, 1]");
            }
            if (recognitionWeight < 0 || productionWeight < 0 || recognitionWeight + productionWeight <= 0) {
                throw new IllegalArgumentException("app.srs.mastery weights must be non-negative and not both zero");
            }
        }
    }

    public record Progress(Integer learnedStreakThreshold,
                           String timeZone,
                           Integer dayCutoffMinutes) {
        public Progress {
            learnedStreakThreshold = learnedStreakThreshold == null ? 3 : learnedStreakThreshold;
            timeZone = (timeZone == null || timeZone.isBlank()) ? "UTC" : timeZone.trim();
            dayCutoffMinutes = dayCutoffMinutes == null ? 0 : dayCutoffMinutes;
            if (dayCutoffMinutes < 0 || dayCutoffMinutes > 24 * 60 - 1) {
                throw new IllegalArgumentException("app.srs.progress.day-cutoff-minutes must be in range [0, 1439]");
            }
            try {
                ZoneId.of(timeZone);
            } catch (DateTimeException ex) {
                throw new IllegalArgumentException("Unknown time zone: " + timeZone);
            }
        }

        public ZoneId zoneId() {
            return ZoneId.of(timeZone);
        }
    }
}
