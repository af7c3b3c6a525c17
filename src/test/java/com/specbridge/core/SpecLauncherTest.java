package com.specbridge.core;

import com.specbridge.report.AggregateTestFailureError;
import com.specbridge.report.SummaryReporter;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SpecLauncherTest {

    @Test
    public void run_failsWithAggregateErrorWhenAnySuiteFails() {
        assertThatThrownBy(() -> new SpecLauncher().run(new String[] { "com.specbridge.fixtures" }))
            .isInstanceOf(AggregateTestFailureError.class)
            .hasMessage("2 tests failed")
            .satisfies(e -> assertThat(((AggregateTestFailureError) e).getFailedCount()).isEqualTo(2));
    }

    @Test
    public void run_searchTermNarrowsToPassingTests() {
        SummaryReporter.Summary summary = new SpecLauncher()
            .run(new String[] { "com.specbridge.fixtures", "-t", "passing", "-no-color" });

        assertThat(summary.failedCount()).isZero();
        assertThat(summary.successfulCount()).isEqualTo(3);
    }

    @Test
    public void run_tagFilterRunsOnlyTaggedTests() {
        SummaryReporter.Summary summary = new SpecLauncher()
            .run(new String[] { "-tags", "slow", "com.specbridge.fixtures" });

        assertThat(summary.hasFailures()).isFalse();
        assertThat(summary.successfulCount()).isEqualTo(3);
    }
}
