package app.unilex.srs.review.service;

import app.unilex.srs.config.SrsProps;
import app.unilex.srs.review.domain.MasteryBasis;
import app.unilex.srs.review.domain.PerformanceCounters;
import app.unilex.srs.review.domain.PerformanceSummary;
import app.unilex.srs.review.domain.VocabItem;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

@Service
public class MasteryService {

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final double masteryThreshold;
    private final int masteryStreakThreshold;
    private final double recognitionWeight;
    private final double productionWeight;

    public MasteryService(SrsProps props) {
        SrsProps.Mastery mastery = props.mastery();
        this.masteryThreshold = mastery.threshold();
        this.masteryStreakThreshold = mastery.streakThreshold();
        this.recognitionWeight = mastery.recognitionWeight();
        this.productionWeight = mastery.productionWeight();
    }

    /**
     * Blended accuracy across both skill axes, or null when the item has never been attempted.
     */
    public Double masteryLevel(VocabItem item) {
        PerformanceCounters perf = item.performance();
        return switch (MasteryBasis.of(perf)) {
            case NONE -> null;
            case RECOGNITION_ONLY -> perf.recognition().accuracy();
            case PRODUCTION_ONLY -> perf.production().accuracy();
            case BLENDED -> (perf.recognition().accuracy() * recognitionWeight
                    + perf.production().accuracy() * productionWeight)
                    / (recognitionWeight + productionWeight);
        };
    }

    public boolean isMastered(VocabItem item) {
        Double mastery = masteryLevel(item);
        if (mastery == null || mastery < masteryThreshold) {
            return false;
        }
        return item.schedule() != null && item.schedule().streak() >= masteryStreakThreshold;
    }

    /**
     * Signed days until the next review, rounded to one decimal. Negative means overdue.
     */
    public Double daysUntilDue(VocabItem item, Instant now) {
        if (item.schedule() == null) {
            return null;
        }
        long diffMs = Duration.between(now, item.schedule().dueAt()).toMillis();
        return Math.round(diffMs / MILLIS_PER_DAY * 10.0) / 10.0;
    }

    public boolean isDue(VocabItem item, Instant now) {
        return item.schedule() != null && item.schedule().isDueAt(now);
    }

    public PerformanceSummary summarize(VocabItem item, Instant now) {
        PerformanceCounters perf = item.performance() == null ? PerformanceCounters.EMPTY : item.performance();
        return new PerformanceSummary(
                PerformanceSummary.SkillSummary.of(perf.recognition()),
                PerformanceSummary.SkillSummary.of(perf.production()),
                new PerformanceSummary.Overall(
                        masteryLevel(item),
                        isMastered(item),
                        item.schedule() == null ? 0 : item.schedule().streak(),
                        daysUntilDue(item, now),
                        isDue(item, now)
                )
        );
    }
}
