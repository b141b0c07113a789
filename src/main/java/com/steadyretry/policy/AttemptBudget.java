package com.steadyretry.policy;

/**
 * Cap on operation invocations for one retry session: either a positive count or unbounded.
 */
public record AttemptBudget(boolean bounded, int limit) {

    private static final AttemptBudget UNBOUNDED = new AttemptBudget(false, 0);

    public AttemptBudget {
        if (bounded && limit < 1) {
            throw new IllegalArgumentException("attempt limit must be positive, got " + limit);
        }
        if (!bounded && limit != 0) {
            throw new IllegalArgumentException("unbounded budget carries no limit");
        }
    }

    public static AttemptBudget of(int limit) {
        return new AttemptBudget(true, limit);
    }

    public static AttemptBudget unbounded() {
        return UNBOUNDED;
    }

    /**
     * True when {@code attempt} (1-based) is the last invocation this budget allows.
     */
    public boolean isExhaustedBy(int attempt) {
        return bounded && attempt >= limit;
    }

    @Override
    public String toString() {
        return bounded ? String.valueOf(limit) : "unbounded";
    }
}
