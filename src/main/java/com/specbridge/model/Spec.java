package com.specbridge.model;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * An immutable, named tree of tests.
 *
 * A node is either a {@link SuiteSpec} (a label plus ordered children) or a
 * {@link TestSpec} (a label plus an executable body). Labels need not be unique;
 * a node's identity for reporting is the path of labels from the root.
 *
 * <pre>
 *   Spec spec = Spec.suite("some suite",
 *       Spec.test("passing test", () -&gt; Assert.that(1, Assertion.equalTo(1))),
 *       Spec.test("ignored test", () -&gt; Assert.that(1, Assertion.equalTo(2)))
 *           .with(TestAspect.ignore()));
 * </pre>
 */
public interface Spec {

    /** The label of this node. */
    String label();

    /**
     * Returns a copy of this spec with the given aspect applied to every test below it.
     */
    default Spec with(TestAspect aspect) {
        return aspect.apply(this);
    }

    // ── Factories ─────────────────────────────────────────────────────────────

    static SuiteSpec suite(String label, Spec... children) {
        return new SuiteSpec(label, Arrays.asList(children));
    }

    static SuiteSpec suite(String label, List<? extends Spec> children) {
        return new SuiteSpec(label, List.copyOf(children));
    }

    static TestSpec test(String label, TestBody body) {
        return new TestSpec(label, body, false, Set.of());
    }
}
