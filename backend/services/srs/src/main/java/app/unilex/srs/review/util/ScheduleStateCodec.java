package app.unilex.srs.review.util;

import app.unilex.srs.review.algorithm.impl.Sm2Algorithm;
import app.unilex.srs.review.domain.PerformanceCounters;
import app.unilex.srs.review.domain.ScheduleState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * JSON form of the per-item review state, for storage adapters. Decoding fills missing fields with
 * defaults so documents written by older clients still load.
 */
@Component
public class ScheduleStateCodec {

    private final ObjectMapper om;

    public ScheduleStateCodec(ObjectMapper om) {
        this.om = om;
    }

    public ObjectNode toJson(ScheduleState state) {
        ObjectNode n = om.createObjectNode();
        n.put("algorithm", state.algorithm());
        n.put("streak", state.streak());
        n.put("intervalHours", state.intervalHours());
        n.put("easeFactor", state.easeFactor());
        n.put("dueAt", state.dueAt().toString());
        if (state.lastReviewedAt() == null) {
            n.putNull("lastReviewedAt");
        } else {
            n.put("lastReviewedAt", state.lastReviewedAt().toString());
        }
        return n;
    }

    public ScheduleState scheduleFromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        Instant dueAt = readInstant(node.path("dueAt"));
        if (dueAt == null) {
            throw new IllegalArgumentException("Schedule document has no valid dueAt");
        }
        String algorithm = node.path("algorithm").asText("");
        return new ScheduleState(
                algorithm.isBlank() ? Sm2Algorithm.ID : algorithm,
                node.path("streak").asInt(0),
                node.path("intervalHours").asDouble(0.0),
                node.path("easeFactor").asDouble(Sm2Algorithm.INITIAL_EASE_FACTOR),
                dueAt,
                readInstant(node.path("lastReviewedAt"))
        );
    }

    public ObjectNode toJson(PerformanceCounters performance) {
        ObjectNode n = om.createObjectNode();
        n.set("recognition", skillToJson(performance.recognition()));
        n.set("production", skillToJson(performance.production()));
        return n;
    }

    public PerformanceCounters performanceFromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return new PerformanceCounters(
                skillFromJson(node.path("recognition")),
                skillFromJson(node.path("production"))
        );
    }

    private ObjectNode skillToJson(PerformanceCounters.SkillCounter counter) {
        ObjectNode n = om.createObjectNode();
        n.put("correctCount", counter.correctCount());
        n.put("incorrectCount", counter.incorrectCount());
        if (counter.lastAttemptAt() == null) {
            n.putNull("lastAttemptAt");
        } else {
            n.put("lastAttemptAt", counter.lastAttemptAt().toString());
        }
        return n;
    }

    private static PerformanceCounters.SkillCounter skillFromJson(JsonNode n) {
        if (n == null || !n.isObject()) {
            return PerformanceCounters.SkillCounter.EMPTY;
        }
        return new PerformanceCounters.SkillCounter(
                n.path("correctCount").asLong(0),
                n.path("incorrectCount").asLong(0),
                readInstant(n.path("lastAttemptAt"))
        );
    }

    private static Instant readInstant(JsonNode n) {
        if (n == null || !n.isTextual() || n.asText().isBlank()) {
            return null;
        }
        try {
            return Instant.parse(n.asText());
        } catch (DateTimeParseException ex) {
            return null;
        }
    }
}
