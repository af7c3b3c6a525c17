package com.specbridge.executor;

import com.specbridge.assertion.Assert;
import com.specbridge.assertion.AssertResult;
import com.specbridge.assertion.Assertion;
import com.specbridge.assertion.FailureDetail;
import com.specbridge.model.Spec;
import com.specbridge.model.TestAspect;
import org.testng.annotations.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

public class SpecExecutorTest {

    private final SpecExecutor executor = new SpecExecutor();

    @Test
    public void execute_mirrorsTreeShapeInDeclarationOrder() {
        Spec spec = Spec.suite("root",
            Spec.test("a", AssertResult::success),
            Spec.suite("group",
                Spec.test("b", AssertResult::success),
                Spec.test("c", AssertResult::success)),
            Spec.test("d", AssertResult::success));

        ExecutedSuite root = (ExecutedSuite) executor.execute(spec);

        assertThat(root.label()).isEqualTo("root");
        assertThat(root.children()).extracting(ExecutedSpec::label).containsExactly("a", "group", "d");
        ExecutedSuite group = (ExecutedSuite) root.children().get(1);
        assertThat(group.children()).extracting(ExecutedSpec::label).containsExactly("b", "c");
        assertThat(root.hasFailures()).isFalse();
    }

    @Test
    public void execute_returnedFailureBecomesFailedOutcomeWithDetails() {
        ExecutedTest test = (ExecutedTest) executor.execute(
            Spec.test("t", () -> Assert.that(1, Assertion.equalTo(2))));

        assertThat(test.outcome().isFailed()).isTrue();
        assertThat(test.outcome().getFailures()).containsExactly(FailureDetail.mismatch(1, "equals(2)"));
    }

    @Test
    public void execute_thrownAssertionErrorIsRecordedAsFailure() {
        ExecutedTest test = (ExecutedTest) executor.execute(Spec.test("t", () -> {
            throw new AssertionError("expected something else");
        }));

        FailureDetail detail = test.outcome().getFailures().get(0);
        assertThat(detail.getKind()).isEqualTo(FailureDetail.Kind.THROWN);
        assertThat(detail.describe()).isEqualTo("expected something else");
    }

    @Test
    public void execute_fatalErrorInBodyDoesNotStopTraversal() {
        AtomicInteger laterRuns = new AtomicInteger();
        Spec spec = Spec.suite("root",
            Spec.test("overflows", () -> {
                throw new StackOverflowError();
            }),
            Spec.test("after", () -> {
                laterRuns.incrementAndGet();
                return AssertResult.success();
            }));

        ExecutedSuite root = (ExecutedSuite) executor.execute(spec);

        ExecutedTest overflows = (ExecutedTest) root.children().get(0);
        ExecutedTest after = (ExecutedTest) root.children().get(1);
        assertThat(overflows.outcome().isFailed()).isTrue();
        assertThat(overflows.outcome().getFailures().get(0).describe()).isEqualTo(StackOverflowError.class.getName());
        assertThat(after.outcome().isPassed()).isTrue();
        assertThat(laterRuns.get()).isEqualTo(1);
        assertThat(root.hasFailures()).isTrue();
    }

    @Test
    public void execute_interruptedBodyFailsAndRestoresInterruptFlag() {
        ExecutedTest test = (ExecutedTest) executor.execute(Spec.test("t", () -> {
            throw new InterruptedException("stop");
        }));

        try {
            assertThat(test.outcome().isFailed()).isTrue();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void execute_nullResultIsAFailure() {
        ExecutedTest test = (ExecutedTest) executor.execute(Spec.test("t", () -> null));

        assertThat(test.outcome().isFailed()).isTrue();
        assertThat(test.outcome().getFailures().get(0).describe()).contains("returned null");
    }

    @Test
    public void execute_ignoredTestIsNotRunAndTakesNoTime() {
        AtomicInteger runs = new AtomicInteger();
        ExecutedTest test = (ExecutedTest) executor.execute(Spec.test("t", () -> {
            runs.incrementAndGet();
            return AssertResult.success();
        }).with(TestAspect.ignore()));

        assertThat(test.outcome().isIgnored()).isTrue();
        assertThat(test.durationMillis()).isZero();
        assertThat(runs.get()).isZero();
    }

    @Test
    public void execute_blockingBodyCompletesBeforeNextSibling() {
        List<String> order = new CopyOnWriteArrayList<>();
        Spec spec = Spec.suite("root",
            Spec.test("slow", () -> {
                Thread.sleep(20);
                order.add("slow");
                return AssertResult.success();
            }),
            Spec.test("fast", () -> {
                order.add("fast");
                return AssertResult.success();
            }));

        executor.execute(spec);

        assertThat(order).containsExactly("slow", "fast");
    }
}
