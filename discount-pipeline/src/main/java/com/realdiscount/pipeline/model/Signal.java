package com.realdiscount.pipeline.model;

/**
 * Tri-state rule outcome: {@code ABSENT} (not enough data to decide), {@code FALSE} or {@code TRUE},
 * optionally carrying the measured value the decision was taken on.
 *
 * ABSENT is never interchangeable with FALSE: scoring leaves it out of the weighted sum and the
 * rule trace serializes it as JSON null.
 */
public record Signal(State state, Double value) {

    public enum State { ABSENT, FALSE, TRUE }

    private static final Signal ABSENT_SIGNAL = new Signal(State.ABSENT, null);

    public static Signal absent() {
        return ABSENT_SIGNAL;
    }

    public static Signal of(boolean passed) {
        return of(passed, null);
    }

    public static Signal of(boolean passed, Double value) {
        return new Signal(passed ? State.TRUE : State.FALSE, value);
    }

    public boolean isPresent() {
        return state != State.ABSENT;
    }

    public boolean isTrue() {
        return state == State.TRUE;
    }

    public boolean isFalse() {
        return state == State.FALSE;
    }

    /** true / false / null, as written into the rule trace */
    public Boolean toTraceValue() {
        return switch (state) {
            case TRUE -> Boolean.TRUE;
            case FALSE -> Boolean.FALSE;
            case ABSENT -> null;
        };
    }
}
