package com.specbridge.executor;

/**
 * A node of the result tree produced by one execution. Mirrors the shape of the
 * executed {@link com.specbridge.model.Spec}, with an outcome on every test.
 */
public interface ExecutedSpec {

    String label();

    /** True when any test at or below this node failed. */
    boolean hasFailures();
}
