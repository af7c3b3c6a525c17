package com.specbridge.assertion;

import java.util.Objects;

/**
 * Renderable description of why a test failed.
 *
 * Two kinds exist:
 *   - VALUE_MISMATCH -- an assertion did not hold; carries the rendered actual value
 *                       and the rendered assertion it failed to satisfy
 *   - THROWN         -- the body raised; carries the throwable and its message
 *
 * Immutable -- use the static factories.
 */
public final class FailureDetail {

    public enum Kind { VALUE_MISMATCH, THROWN }

    private final Kind      kind;
    private final String    actual;      // VALUE_MISMATCH only
    private final String    expected;    // VALUE_MISMATCH only
    private final Throwable throwable;   // THROWN only

    private FailureDetail(Kind kind, String actual, String expected, Throwable throwable) {
        this.kind      = kind;
        this.actual    = actual;
        this.expected  = expected;
        this.throwable = throwable;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static FailureDetail mismatch(Object actual, String expected) {
        return new FailureDetail(Kind.VALUE_MISMATCH, String.valueOf(actual), expected, null);
    }

    public static FailureDetail thrown(Throwable throwable) {
        return new FailureDetail(Kind.THROWN, null, null, Objects.requireNonNull(throwable, "throwable"));
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Kind      getKind()      { return kind; }
    public String    getActual()    { return actual; }
    public String    getExpected()  { return expected; }
    public Throwable getThrowable() { return throwable; }

    public boolean isValueMismatch() { return kind == Kind.VALUE_MISMATCH; }

    /**
     * Plain-text description: {@code "<actual> did not satisfy <expected>"} for a
     * mismatch, the throwable's message (or class name when it has none) otherwise.
     */
    public String describe() {
        if (isValueMismatch()) {
            return actual + " did not satisfy " + expected;
        }
        String message = throwable.getMessage();
        return message != null ? message : throwable.getClass().getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FailureDetail other)) return false;
        return kind == other.kind
            && Objects.equals(actual, other.actual)
            && Objects.equals(expected, other.expected)
            && Objects.equals(throwable, other.throwable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, actual, expected, throwable);
    }

    @Override
    public String toString() {
        return String.format("FailureDetail{%s, %s}", kind, describe());
    }
}
