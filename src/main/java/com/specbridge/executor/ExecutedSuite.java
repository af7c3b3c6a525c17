package com.specbridge.executor;

import java.util.List;

/**
 * An executed group. It has no outcome of its own; its status is derived from its children.
 */
public record ExecutedSuite(String label, List<ExecutedSpec> children) implements ExecutedSpec {

    public ExecutedSuite {
        children = List.copyOf(children);
    }

    @Override
    public boolean hasFailures() {
        return children.stream().anyMatch(ExecutedSpec::hasFailures);
    }
}
