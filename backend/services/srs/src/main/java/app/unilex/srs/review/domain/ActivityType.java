package app.unilex.srs.review.domain;

/**
 * Skill axis exercised by a drill.
 */
public enum ActivityType {
    /** Passive recall: the learner sees the term and judges it. */
    RECOGNITION,
    /** Active recall: the learner produces the term, e.g. by translating. */
    PRODUCTION
}
