package com.specbridge.framework;

import com.specbridge.model.Spec;

import java.util.Objects;

/**
 * Base class of every runnable suite.
 *
 * Subclasses must be concrete and have a no-arg constructor (it may be non-public)
 * so they can be discovered through {@link RunnableSpecFingerprint} and built by
 * {@link ClassLoaderSpecResolver}:
 *
 * <pre>
 *   public class ArithmeticSpec extends RunnableSpec {
 *       public ArithmeticSpec() {
 *           super(Spec.suite("arithmetic",
 *               Spec.test("adds", () -&gt; Assert.that(1 + 1, Assertion.equalTo(2)))));
 *       }
 *   }
 * </pre>
 *
 * The spec is built once in the constructor and never changes.
 */
public abstract class RunnableSpec {

    private final Spec spec;

    protected RunnableSpec(Spec spec) {
        this.spec = Objects.requireNonNull(spec, "spec");
    }

    public final Spec spec() {
        return spec;
    }
}
