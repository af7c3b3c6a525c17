package com.specbridge.assertion;

/**
 * Entry point for checks inside a test body.
 *
 * <pre>
 *   Spec.test("adds", () -&gt; Assert.that(1 + 1, Assertion.equalTo(2)))
 * </pre>
 */
public final class Assert {

    private Assert() {}

    /**
     * Checks {@code actual} against {@code assertion}. Each conjunct of an
     * {@link Assertion#and} contributes its own failure detail.
     */
    public static <A> AssertResult that(A actual, Assertion<A> assertion) {
        AssertResult result = AssertResult.success();
        for (Assertion<A> part : assertion.parts()) {
            if (!part.test(actual)) {
                result = result.and(AssertResult.failure(FailureDetail.mismatch(actual, part.render())));
            }
        }
        return result;
    }

    /** Fails with a thrown-style detail carrying {@code message}. */
    public static AssertResult fail(String message) {
        return AssertResult.failure(FailureDetail.thrown(new AssertionError(message)));
    }
}
