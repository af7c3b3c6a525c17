package com.specbridge.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * A transformation applied to every test below a spec node.
 *
 * Applied with {@link Spec#with(TestAspect)}; suites are rebuilt with their children
 * transformed, labels and order untouched.
 */
@FunctionalInterface
public interface TestAspect {

    Spec apply(Spec spec);

    /** Marks every test below the node as ignored; ignored bodies never run. */
    static TestAspect ignore() {
        return everyTest(TestSpec::asIgnored);
    }

    /** Adds the given tags to every test below the node. */
    static TestAspect tagged(String... tags) {
        Set<String> tagSet = new LinkedHashSet<>(Arrays.asList(tags));
        if (tagSet.contains(null)) {
            throw new IllegalArgumentException("Tags must not be null: " + Arrays.toString(tags));
        }
        return everyTest(test -> test.withTags(tagSet));
    }

    private static TestAspect everyTest(UnaryOperator<TestSpec> f) {
        return new TestAspect() {
            @Override
            public Spec apply(Spec spec) {
                if (spec instanceof TestSpec test) {
                    return f.apply(test);
                }
                SuiteSpec suite = (SuiteSpec) spec;
                List<Spec> children = new ArrayList<>(suite.children().size());
                for (Spec child : suite.children()) {
                    children.add(apply(child));
                }
                return new SuiteSpec(suite.label(), children);
            }
        };
    }
}
