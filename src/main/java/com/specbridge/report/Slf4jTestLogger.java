package com.specbridge.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapts an SLF4J logger to the test-interface {@link sbt.testing.Logger}, for runs
 * driven without a build tool.
 */
public final class Slf4jTestLogger implements sbt.testing.Logger {

    private final Logger delegate;
    private final boolean ansiCodesSupported;

    public Slf4jTestLogger(Logger delegate, boolean ansiCodesSupported) {
        this.delegate = delegate;
        this.ansiCodesSupported = ansiCodesSupported;
    }

    public Slf4jTestLogger(String name) {
        this(LoggerFactory.getLogger(name), true);
    }

    @Override
    public boolean ansiCodesSupported() {
        return ansiCodesSupported;
    }

    @Override
    public void error(String msg) {
        delegate.error(msg);
    }

    @Override
    public void warn(String msg) {
        delegate.warn(msg);
    }

    @Override
    public void info(String msg) {
        delegate.info(msg);
    }

    @Override
    public void debug(String msg) {
        delegate.debug(msg);
    }

    @Override
    public void trace(Throwable t) {
        delegate.trace(t.toString(), t);
    }
}
