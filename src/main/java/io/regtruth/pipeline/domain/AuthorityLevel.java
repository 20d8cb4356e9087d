package io.regtruth.pipeline.domain;

/**
 * Legal authority of a rule's source. A lower rank means higher authority.
 */
public enum AuthorityLevel {
    LAW(1),
    GUIDANCE(2),
    PROCEDURE(3),
    PRACTICE(4);

    private final int rank;

    AuthorityLevel(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean outranks(AuthorityLevel other) {
        return rank < other.rank;
    }
}
