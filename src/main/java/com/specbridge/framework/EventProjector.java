package com.specbridge.framework;

import com.specbridge.assertion.FailureDetail;
import com.specbridge.executor.ExecutedSpec;
import com.specbridge.executor.ExecutedSuite;
import com.specbridge.executor.ExecutedTest;
import com.specbridge.executor.TestOutcome;
import sbt.testing.OptionalThrowable;
import sbt.testing.Status;
import sbt.testing.TestSelector;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a result tree into one {@link SpecEvent} per leaf test. Suites produce no event.
 *
 * The selector carries the test's own label, not its path: two tests with the same
 * label in different groups of one suite report the same selector.
 */
public class EventProjector {

    public List<SpecEvent> project(String fullyQualifiedName, ExecutedSpec root) {
        List<SpecEvent> events = new ArrayList<>();
        collect(fullyQualifiedName, root, events);
        return events;
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private void collect(String fqn, ExecutedSpec node, List<SpecEvent> events) {
        if (node instanceof ExecutedSuite suite) {
            for (ExecutedSpec child : suite.children()) {
                collect(fqn, child, events);
            }
        } else if (node instanceof ExecutedTest test) {
            events.add(toEvent(fqn, test));
        }
    }

    private SpecEvent toEvent(String fqn, ExecutedTest test) {
        TestOutcome outcome = test.outcome();
        return new SpecEvent(
            fqn,
            RunnableSpecFingerprint.INSTANCE,
            new TestSelector(test.label()),
            status(outcome),
            outcome.isFailed() ? new OptionalThrowable(failureOf(outcome)) : new OptionalThrowable(),
            test.durationMillis());
    }

    static Status status(TestOutcome outcome) {
        return switch (outcome.getStatus()) {
            case PASSED  -> Status.Success;
            case FAILED  -> Status.Failure;
            case IGNORED -> Status.Ignored;
        };
    }

    private static TestFailedException failureOf(TestOutcome outcome) {
        String message = outcome.getFailures().stream()
            .map(FailureDetail::describe)
            .collect(Collectors.joining("\n"));
        Throwable cause = outcome.getFailures().stream()
            .filter(f -> !f.isValueMismatch())
            .map(FailureDetail::getThrowable)
            .findFirst()
            .orElse(null);
        return new TestFailedException(message, cause);
    }
}
