package app.unilex.srs.review.service;

import app.unilex.srs.config.SrsProps;
import app.unilex.srs.review.domain.ReviewQueue;
import app.unilex.srs.review.domain.VocabItem;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

@Service
public class ReviewQueueService {

    private static final Comparator<VocabItem> BY_DUE =
            Comparator.comparing(item -> item.schedule().dueAt());
    private static final Comparator<VocabItem> BY_CREATED =
            Comparator.comparing(VocabItem::createdAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final int defaultUpcomingWindowHours;

    public ReviewQueueService(SrsProps props) {
        this.defaultUpcomingWindowHours = props.queue().upcomingWindowHours();
    }

    public ReviewQueue buildQueue(Collection<VocabItem> items, Instant now) {
        return buildQueue(items, now, items.size(), defaultUpcomingWindowHours);
    }

    public ReviewQueue buildQueue(Collection<VocabItem> items, Instant now, int limit) {
        return buildQueue(items, now, limit, defaultUpcomingWindowHours);
    }

    /**
     * Orders items as due, upcoming, new, later. Due, upcoming and later are sorted by due date,
     * new items by creation time. Counts are taken before truncating to {@code limit}.
     */
    public ReviewQueue buildQueue(Collection<VocabItem> items, Instant now, int limit, int upcomingWindowHours) {
        List<VocabItem> due = new ArrayList<>();
        List<VocabItem> upcoming = new ArrayList<>();
        List<VocabItem> fresh = new ArrayList<>();
        List<VocabItem> later = new ArrayList<>();

        for (VocabItem item : items) {
            if (item.schedule() == null) {
                fresh.add(item);
                continue;
            }
            long hoursUntilDue = Duration.between(now, item.schedule().dueAt()).toHours();
            if (hoursUntilDue <= 0) {
                due.add(item);
            } else if (hoursUntilDue <= upcomingWindowHours) {
                upcoming.add(item);
            } else {
                later.add(item);
            }
        }

        due.sort(BY_DUE);
        upcoming.sort(BY_DUE);
        fresh.sort(BY_CREATED);
        later.sort(BY_DUE);

        List<VocabItem> ordered = new ArrayList<>(items.size());
        ordered.addAll(due);
        ordered.addAll(upcoming);
        ordered.addAll(fresh);
        ordered.addAll(later);

        int size = Math.max(0, Math.min(limit, ordered.size()));
        return new ReviewQueue(ordered.subList(0, size), due.size(), upcoming.size(), fresh.size());
    }
}
