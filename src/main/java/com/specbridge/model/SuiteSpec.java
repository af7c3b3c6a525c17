package com.specbridge.model;

import java.util.List;
import java.util.Objects;

/**
 * A group of specs. Children keep their declaration order.
 */
public record SuiteSpec(String label, List<Spec> children) implements Spec {

    public SuiteSpec {
        Objects.requireNonNull(label, "label");
        children = List.copyOf(children);
    }
}
