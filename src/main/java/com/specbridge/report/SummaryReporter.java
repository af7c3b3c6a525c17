package com.specbridge.report;

import java.util.Collection;

/**
 * Counts task outcomes and renders the terminal summary line:
 * {@code Summary: failed: <n>, successful: <n>}.
 *
 * A non-zero failed count is rendered red, a non-zero successful count green.
 */
public class SummaryReporter {

    /** Pass/fail counts for a batch of tasks. */
    public record Summary(int failedCount, int successfulCount) {

        public boolean hasFailures() {
            return failedCount > 0;
        }
    }

    private final boolean colors;

    public SummaryReporter(boolean colors) {
        this.colors = colors;
    }

    public SummaryReporter() {
        this(true);
    }

    /**
     * @param taskFailed one entry per task: {@code true} when any test in it failed
     */
    public Summary summarize(Collection<Boolean> taskFailed) {
        int failed = (int) taskFailed.stream().filter(Boolean::booleanValue).count();
        return new Summary(failed, taskFailed.size() - failed);
    }

    public String render(Summary summary) {
        String failed = "failed: " + summary.failedCount();
        String successful = "successful: " + summary.successfulCount();
        if (colors && summary.failedCount() > 0) failed = Ansi.red(failed);
        if (colors && summary.successfulCount() > 0) successful = Ansi.green(successful);
        return "Summary: " + failed + ", " + successful;
    }

    /**
     * @throws AggregateTestFailureError when the summary has any failed task
     */
    public void assertNoFailures(Summary summary) {
        if (summary.hasFailures()) {
            throw new AggregateTestFailureError(summary.failedCount());
        }
    }
}
