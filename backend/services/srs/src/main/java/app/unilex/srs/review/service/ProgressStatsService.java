package app.unilex.srs.review.service;

import app.unilex.srs.config.SrsProps;
import app.unilex.srs.review.domain.DrillSession;
import app.unilex.srs.review.domain.ProgressStats;
import app.unilex.srs.review.domain.ScheduleState;
import app.unilex.srs.review.domain.SessionSummary;
import app.unilex.srs.review.domain.VocabItem;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

@Service
public class ProgressStatsService {

    private final int defaultLearnedStreakThreshold;
    private final ZoneId zone;
    private final int dayCutoffMinutes;

    public ProgressStatsService(SrsProps props) {
        this.defaultLearnedStreakThreshold = props.progress().learnedStreakThreshold();
        this.zone = props.progress().zoneId();
        this.dayCutoffMinutes = props.progress().dayCutoffMinutes();
    }

    public ProgressStats aggregate(Collection<VocabItem> items, Collection<DrillSession> sessions, Instant now) {
        return aggregate(items, sessions, now, defaultLearnedStreakThreshold);
    }

    public ProgressStats aggregate(Collection<VocabItem> items,
                                   Collection<DrillSession> sessions,
                                   Instant now,
                                   int learnedStreakThreshold) {
        long learned = 0;
        long due = 0;
        for (VocabItem item : items) {
            ScheduleState schedule = item.schedule();
            if (schedule == null) {
                continue;
            }
            if (schedule.streak() >= learnedStreakThreshold) {
                learned++;
            }
            if (schedule.isDueAt(now)) {
                due++;
            }
        }

        Instant lastSessionAt = null;
        Set<LocalDate> activeDays = new HashSet<>();
        for (DrillSession session : sessions) {
            Instant endedAt = session.endedAt();
            if (endedAt == null) {
                continue;
            }
            if (lastSessionAt == null || endedAt.isAfter(lastSessionAt)) {
                lastSessionAt = endedAt;
            }
            activeDays.add(studyDay(endedAt));
        }

        return new ProgressStats(
                items.size(),
                learned,
                due,
                streakDays(activeDays, studyDay(now)),
                lastSessionAt
        );
    }

    public SessionSummary summarizeSessions(Collection<DrillSession> sessions) {
        if (sessions.isEmpty()) {
            return SessionSummary.EMPTY;
        }
        long correct = 0;
        long incorrect = 0;
        double scoreSum = 0;
        long durationSeconds = 0;
        for (DrillSession session : sessions) {
            correct += Math.max(0, session.correctCount());
            incorrect += Math.max(0, session.incorrectCount());
            scoreSum += session.score();
            durationSeconds += session.duration().getSeconds();
        }
        int count = sessions.size();
        return new SessionSummary(
                count,
                correct,
                incorrect,
                (double) correct / Math.max(1, correct + incorrect),
                scoreSum / count,
                (double) durationSeconds / count
        );
    }

    // A miss on today's study day ends the walk at once.
    private static long streakDays(Set<LocalDate> activeDays, LocalDate today) {
        long streak = 0;
        LocalDate cursor = today;
        while (activeDays.contains(cursor)) {
            streak++;
            cursor = cursor.minusDays(1);
        }
        return streak;
    }

    private LocalDate studyDay(Instant instant) {
        ZonedDateTime zoned = instant.atZone(zone);
        LocalDate date = zoned.toLocalDate();
        LocalTime cutoff = LocalTime.of(dayCutoffMinutes / 60, dayCutoffMinutes % 60);
        if (dayCutoffMinutes > 0 && zoned.toLocalTime().isBefore(cutoff)) {
            return date.minusDays(1);
        }
        return date;
    }
}
