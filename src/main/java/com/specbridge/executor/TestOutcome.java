package com.specbridge.executor;

import com.specbridge.assertion.FailureDetail;

import java.util.List;

/**
 * The outcome of one leaf test.
 *
 * A test either:
 *   - PASSED  -- the body returned a successful result
 *   - FAILED  -- the body returned a failed result or raised; details say why
 *   - IGNORED -- the test was marked ignored; the body never ran
 *
 * Immutable -- use the static factories.
 */
public final class TestOutcome {

    public enum Status { PASSED, FAILED, IGNORED }

    private static final TestOutcome PASSED  = new TestOutcome(Status.PASSED, List.of());
    private static final TestOutcome IGNORED = new TestOutcome(Status.IGNORED, List.of());

    private final Status              status;
    private final List<FailureDetail> failures;   // non-empty only when FAILED

    private TestOutcome(Status status, List<FailureDetail> failures) {
        this.status   = status;
        this.failures = failures;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static TestOutcome passed()  { return PASSED; }
    public static TestOutcome ignored() { return IGNORED; }

    public static TestOutcome failed(List<FailureDetail> failures) {
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("A failed outcome needs at least one failure detail");
        }
        return new TestOutcome(Status.FAILED, List.copyOf(failures));
    }

    public static TestOutcome failed(FailureDetail failure) {
        return new TestOutcome(Status.FAILED, List.of(failure));
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Status              getStatus()   { return status; }
    public List<FailureDetail> getFailures() { return failures; }

    public boolean isPassed()  { return status == Status.PASSED; }
    public boolean isFailed()  { return status == Status.FAILED; }
    public boolean isIgnored() { return status == Status.IGNORED; }

    @Override
    public String toString() {
        return isFailed()
            ? String.format("TestOutcome{FAILED, failures=%s}", failures)
            : String.format("TestOutcome{%s}", status);
    }
}
