package com.specbridge.executor;

import com.specbridge.assertion.AssertResult;
import com.specbridge.assertion.FailureDetail;
import com.specbridge.model.Spec;
import com.specbridge.model.SuiteSpec;
import com.specbridge.model.TestSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a {@link Spec} and builds its result tree.
 *
 * ## Execution model
 *
 *   1. Depth-first, declaration order. Nodes are never merged or reordered.
 *   2. Ignored tests get {@link TestOutcome#ignored()} and their body is not invoked.
 *   3. Every body runs inside its own catch boundary: a returned failure, an
 *      {@link AssertionError} or any other throwable fails that test only, and
 *      traversal continues with the next node.
 *   4. Bodies run sequentially on the calling thread; a body that blocks blocks the walk.
 *
 * The whole tree is built before {@link #execute} returns, so reporters only
 * ever see a complete, immutable result.
 *
 * Stateless -- one instance can serve any number of tasks concurrently.
 */
public class SpecExecutor {

    private static final Logger log = LoggerFactory.getLogger(SpecExecutor.class);

    // ── Primary API ───────────────────────────────────────────────────────────

    public ExecutedSpec execute(Spec spec) {
        if (spec instanceof TestSpec test) {
            return executeTest(test);
        }
        if (spec instanceof SuiteSpec suite) {
            List<ExecutedSpec> children = new ArrayList<>(suite.children().size());
            for (Spec child : suite.children()) {
                children.add(execute(child));
            }
            return new ExecutedSuite(suite.label(), children);
        }
        throw new IllegalArgumentException("Unsupported spec node: " + spec.getClass().getName());
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private ExecutedTest executeTest(TestSpec test) {
        if (test.ignored()) {
            log.debug("SpecExecutor: '{}' ignored -- body not invoked", test.label());
            return new ExecutedTest(test.label(), TestOutcome.ignored(), 0L);
        }

        long started = System.nanoTime();
        TestOutcome outcome = runBody(test);
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000L;

        log.debug("SpecExecutor: '{}' -> {} ({} ms)", test.label(), outcome.getStatus(), elapsedMillis);
        return new ExecutedTest(test.label(), outcome, elapsedMillis);
    }

    private TestOutcome runBody(TestSpec test) {
        AssertResult result;
        try {
            result = test.body().run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("SpecExecutor: '{}' interrupted", test.label(), e);
            return TestOutcome.failed(FailureDetail.thrown(e));
        } catch (Throwable t) {
            log.debug("SpecExecutor: '{}' threw {}", test.label(), t.getClass().getName(), t);
            return TestOutcome.failed(FailureDetail.thrown(t));
        }

        if (result == null) {
            return TestOutcome.failed(FailureDetail.thrown(
                new IllegalStateException("Test body returned null instead of an AssertResult")));
        }
        return result.isSuccess() ? TestOutcome.passed() : TestOutcome.failed(result.getFailures());
    }
}
