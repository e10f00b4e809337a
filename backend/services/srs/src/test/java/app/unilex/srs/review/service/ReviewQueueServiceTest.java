package app.unilex.srs.review.service;

import app.unilex.srs.config.SrsProps;
import app.unilex.srs.review.domain.ReviewQueue;
import app.unilex.srs.review.domain.ScheduleState;
import app.unilex.srs.review.domain.VocabItem;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ReviewQueueServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    private final ReviewQueueService service = new ReviewQueueService(SrsProps.DEFAULTS);

    @Test
    void buildQueue_ordersDueUpcomingNewLater() {
        VocabItem later = scheduled(NOW.plus(Duration.ofHours(48)));
        VocabItem fresh = VocabItem.fresh(UUID.randomUUID(), NOW.minus(Duration.ofDays(1)));
        VocabItem soon = scheduled(NOW.plus(Duration.ofHours(3)));
        VocabItem overdue = scheduled(NOW.minus(Duration.ofHours(2)));

        ReviewQueue result = service.buildQueue(List.of(later, fresh, soon, overdue), NOW, 10, 12);

        assertThat(result.queue()).containsExactly(overdue, soon, fresh, later);
        assertThat(result.dueCount()).isEqualTo(1);
        assertThat(result.upcomingCount()).isEqualTo(1);
        assertThat(result.newCount()).isEqualTo(1);
    }

    @Test
    void buildQueue_sortsWithinBuckets() {
        VocabItem due1 = scheduled(NOW.minus(Duration.ofHours(1)));
        VocabItem due5 = scheduled(NOW.minus(Duration.ofHours(5)));
        VocabItem newer = VocabItem.fresh(UUID.randomUUID(), NOW.minus(Duration.ofDays(1)));
        VocabItem older = VocabItem.fresh(UUID.randomUUID(), NOW.minus(Duration.ofDays(3)));
        VocabItem undated = VocabItem.fresh(UUID.randomUUID(), null);
        VocabItem far = scheduled(NOW.plus(Duration.ofDays(10)));
        VocabItem near = scheduled(NOW.plus(Duration.ofDays(2)));

        ReviewQueue result = service.buildQueue(List.of(due1, undated, newer, far, due5, older, near), NOW);

        assertThat(result.queue()).containsExactly(due5, due1, older, newer, undated, near, far);
        assertThat(result.newCount()).isEqualTo(3);
    }

    @Test
    void buildQueue_countsBucketsBeforeTruncation() {
        List<VocabItem> items = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            items.add(scheduled(NOW.minus(Duration.ofHours(i + 1))));
        }
        items.add(VocabItem.fresh(UUID.randomUUID(), NOW));

        ReviewQueue result = service.buildQueue(items, NOW, 10);

        assertThat(result.queue()).hasSize(10);
        assertThat(result.dueCount()).isEqualTo(12);
        assertThat(result.newCount()).isEqualTo(1);
        assertThat(result.queue().get(0)).isSameAs(items.get(11));
    }

    @Test
    void buildQueue_usesWholeHoursUntilDue() {
        VocabItem fortyMinutes = scheduled(NOW.plus(Duration.ofMinutes(40)));
        VocabItem edgeOfWindow = scheduled(NOW.plus(Duration.ofHours(12).plusMinutes(30)));
        VocabItem pastWindow = scheduled(NOW.plus(Duration.ofHours(13)));

        ReviewQueue result = service.buildQueue(List.of(pastWindow, edgeOfWindow, fortyMinutes), NOW);

        assertThat(result.dueCount()).isEqualTo(1);
        assertThat(result.upcomingCount()).isEqualTo(1);
        assertThat(result.queue()).containsExactly(fortyMinutes, edgeOfWindow, pastWindow);
    }

    @Test
    void buildQueue_handlesEmptyInputAndZeroLimit() {
        ReviewQueue empty = service.buildQueue(List.of(), NOW);
        assertThat(empty.queue()).isEmpty();
        assertThat(empty.dueCount()).isZero();

        ReviewQueue none = service.buildQueue(List.of(scheduled(NOW)), NOW, 0);
        assertThat(none.queue()).isEmpty();
        assertThat(none.dueCount()).isEqualTo(1);
    }

    @Test
    void buildQueue_doesNotModifyInput() {
        List<VocabItem> items = new ArrayList<>(List.of(
                scheduled(NOW.plus(Duration.ofDays(3))),
                scheduled(NOW.minus(Duration.ofDays(3)))
        ));
        List<VocabItem> copy = List.copyOf(items);

        service.buildQueue(items, NOW);

        assertThat(items).containsExactlyElementsOf(copy);
    }

    private static VocabItem scheduled(Instant dueAt) {
        ScheduleState schedule = new ScheduleState("sm2", 1, 24.0, 2.5, dueAt, dueAt.minus(Duration.ofHours(24)));
        return new VocabItem(UUID.randomUUID(), NOW.minus(Duration.ofDays(7)), schedule, null);
    }
}
