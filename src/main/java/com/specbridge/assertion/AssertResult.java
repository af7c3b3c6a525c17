package com.specbridge.assertion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a test body returns: success, or failure with one {@link FailureDetail} per
 * fragment that did not hold.
 */
public final class AssertResult {

    private static final AssertResult SUCCESS = new AssertResult(Collections.emptyList());

    private final List<FailureDetail> failures;

    private AssertResult(List<FailureDetail> failures) {
        this.failures = failures;
    }

    public static AssertResult success() {
        return SUCCESS;
    }

    public static AssertResult failure(FailureDetail detail) {
        return new AssertResult(List.of(detail));
    }

    public static AssertResult failure(List<FailureDetail> details) {
        if (details.isEmpty()) {
            throw new IllegalArgumentException("A failed result needs at least one detail");
        }
        return new AssertResult(List.copyOf(details));
    }

    /** Both must hold; failure details of both sides are kept in order. */
    public AssertResult and(AssertResult other) {
        if (isSuccess()) return other;
        if (other.isSuccess()) return this;
        List<FailureDetail> merged = new ArrayList<>(failures);
        merged.addAll(other.failures);
        return new AssertResult(Collections.unmodifiableList(merged));
    }

    public boolean isSuccess() { return failures.isEmpty(); }
    public boolean isFailure() { return !failures.isEmpty(); }

    public List<FailureDetail> getFailures() { return failures; }

    @Override
    public String toString() {
        return isSuccess() ? "AssertResult{SUCCESS}" : "AssertResult{FAILURE, " + failures + "}";
    }
}
