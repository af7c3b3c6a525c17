package com.specbridge.model;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A leaf test.
 *
 * @param label   the test's own name, used as its selector when reported
 * @param body    the code under test; never invoked when {@code ignored} is set
 * @param ignored true when the test has been marked with {@link TestAspect#ignore()}
 * @param tags    free-form tags used by tag filters
 */
public record TestSpec(String label, TestBody body, boolean ignored, Set<String> tags) implements Spec {

    public TestSpec {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(body, "body");
        tags = Set.copyOf(tags);
    }

    public TestSpec asIgnored() {
        return new TestSpec(label, body, true, tags);
    }

    public TestSpec withTags(Set<String> extra) {
        Set<String> merged = new HashSet<>(tags);
        merged.addAll(extra);
        return new TestSpec(label, body, ignored, merged);
    }
}
