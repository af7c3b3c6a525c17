package com.specbridge.report;

/**
 * Raised once, after every task has finished, when at least one task failed.
 * The only failure allowed to end a run.
 */
public class AggregateTestFailureError extends AssertionError {

    private final int failedCount;

    public AggregateTestFailureError(int failedCount) {
        super(failedCount + " tests failed");
        this.failedCount = failedCount;
    }

    public int getFailedCount() {
        return failedCount;
    }
}
