package com.specbridge.fixtures;

import com.specbridge.assertion.Assert;
import com.specbridge.assertion.Assertion;
import com.specbridge.framework.RunnableSpec;
import com.specbridge.model.Spec;

public class ArithmeticSpec extends RunnableSpec {

    public ArithmeticSpec() {
        super(Spec.suite("arithmetic",
            Spec.suite("addition",
                Spec.test("adds small numbers", () -> Assert.that(2 + 2, Assertion.equalTo(4))),
                Spec.test("adds negatives", () -> Assert.that(-2 + -3, Assertion.equalTo(-5)))),
            Spec.test("compares", () ->
                Assert.that(7, Assertion.isGreaterThan(3).and(Assertion.isLessThan(10))))));
    }
}
