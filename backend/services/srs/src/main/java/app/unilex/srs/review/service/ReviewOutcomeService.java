package app.unilex.srs.review.service;

import app.unilex.srs.config.SrsProps;
import app.unilex.srs.review.algorithm.AlgorithmRegistry;
import app.unilex.srs.review.algorithm.SrsAlgorithm;
import app.unilex.srs.review.domain.ActivityOutcome;
import app.unilex.srs.review.domain.ActivityType;
import app.unilex.srs.review.domain.ItemReviewUpdate;
import app.unilex.srs.review.domain.PerformanceCounters;
import app.unilex.srs.review.domain.ScheduleState;
import app.unilex.srs.review.domain.VocabItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class ReviewOutcomeService {

    private static final Logger log = LoggerFactory.getLogger(ReviewOutcomeService.class);

    private final AlgorithmRegistry registry;
    private final QualityGrader grader;
    private final double minIntervalHours;

    public ReviewOutcomeService(AlgorithmRegistry registry, QualityGrader grader, SrsProps props) {
        this.registry = registry;
        this.grader = grader;
        this.minIntervalHours = props.schedule().minIntervalHours();
    }

    public ItemReviewUpdate applyOutcome(VocabItem item, ActivityOutcome outcome) {
        ScheduleState current = item.schedule();
        PerformanceCounters performance = item.performance() == null ? PerformanceCounters.EMPTY : item.performance();

        PerformanceCounters nextPerformance = performance.withAttempt(
                outcome.activityType(),
                outcome.wasCorrect(),
                outcome.attemptedAt()
        );

        int quality = grader.grade(outcome);
        SrsAlgorithm algorithm = registry.resolveOrDefault(current == null ? null : current.algorithm());
        SrsAlgorithm.ReviewComputation computation = algorithm.apply(
                current,
                quality,
                outcome.attemptedAt(),
                minIntervalHours
        );

        log.debug("Applied {} outcome to item {}: quality={}, streak={}, dueAt={}",
                outcome.activityType(), item.id(), quality,
                computation.schedule().streak(), computation.schedule().dueAt());

        return new ItemReviewUpdate(
                item.id(),
                computation.schedule(),
                nextPerformance,
                quality,
                computation.successful()
        );
    }

    /**
     * Due dates the item would get if answered correctly or incorrectly at {@code at}.
     * Scored production answers can land elsewhere; this previews the unscored grades.
     */
    public Map<Boolean, Instant> previewDueAt(VocabItem item, ActivityType activityType, Instant at) {
        ScheduleState current = item.schedule();
        SrsAlgorithm algorithm = registry.resolveOrDefault(current == null ? null : current.algorithm());

        Map<Integer, Instant> byQuality = algorithm.previewDueAt(current, at, minIntervalHours);

        Map<Boolean, Instant> out = new LinkedHashMap<>();
        for (boolean correct : new boolean[]{true, false}) {
            int quality = grader.grade(new ActivityOutcome(activityType, correct, null, at));
            out.put(correct, byQuality.get(quality));
        }
        return out;
    }
}
