package app.unilex.srs.review.domain;

public record SessionSummary(
        int sessionCount,
        long correctCount,
        long incorrectCount,
        double accuracy,
        double averageScore,
        double averageDurationSeconds
) {
    public static final SessionSummary EMPTY = new SessionSummary(0, 0, 0, 0.0, 0.0, 0.0);
}
