package app.unilex.srs.review.service;

import app.unilex.srs.review.domain.ActivityOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns an activity outcome into an SM-2 quality grade in [0, 5].
 * <p>
 * Recognition drills and production drills without a score are binary: correct is 4, incorrect is 2.
 * Scored production drills are quantised, and {@code wasCorrect} decides which side of the
 * success boundary (3) the grade falls on:
 * <pre>
 *   correct:   score &gt;= 0.9 -&gt; 5, score &gt;= 0.7 -&gt; 4, otherwise 3
 *   incorrect: score &gt;= 0.3 -&gt; 2, otherwise 1
 * </pre>
 */
@Component
public class QualityGrader {

    private static final Logger log = LoggerFactory.getLogger(QualityGrader.class);

    static final int CORRECT_QUALITY = 4;
    static final int INCORRECT_QUALITY = 2;

    public int grade(ActivityOutcome outcome) {
        int quality = switch (outcome.activityType()) {
            case RECOGNITION -> binary(outcome.wasCorrect());
            case PRODUCTION -> outcome.score() == null || outcome.score().isNaN()
                    ? binary(outcome.wasCorrect())
                    : scored(outcome.wasCorrect(), clampScore(outcome.score()));
        };
        return Math.max(0, Math.min(5, quality));
    }

    private static int binary(boolean correct) {
        return correct ? CORRECT_QUALITY : INCORRECT_QUALITY;
    }

    private static int scored(boolean correct, double score) {
        if (correct) {
            if (score >= 0.9) return 5;
            if (score >= 0.7) return 4;
            return 3;
        }
        if (score >= 0.3) return 2;
        return 1;
    }

    private static double clampScore(double score) {
        if (score < 0 || score > 1) {
            log.warn("Production score {} outside [0, 1], clamping", score);
            return Math.max(0.0, Math.min(1.0, score));
        }
        return score;
    }
}
