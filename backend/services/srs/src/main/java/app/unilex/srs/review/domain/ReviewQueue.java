package app.unilex.srs.review.domain;

import java.util.List;

/**
 * Ordered practice queue. The counts are bucket sizes before the queue was truncated.
 */
public record ReviewQueue(
        List<VocabItem> queue,
        int dueCount,
        int upcomingCount,
        int newCount
) {
    public ReviewQueue {
        queue = List.copyOf(queue);
    }
}
