package com.specbridge.framework;

import com.specbridge.core.SpecBridgeConfig;
import sbt.testing.Fingerprint;
import sbt.testing.Framework;

/**
 * Entry point a build tool loads to discover and run {@link RunnableSpec} suites.
 */
public class SpecFramework implements Framework {

    public static final String NAME = "SpecBridge";

    @Override
    public String name() {
        return NAME;
    }

    /** Always a one-element array holding {@link RunnableSpecFingerprint#INSTANCE}. */
    @Override
    public Fingerprint[] fingerprints() {
        return new Fingerprint[] { RunnableSpecFingerprint.INSTANCE };
    }

    @Override
    public SpecRunner runner(String[] args, String[] remoteArgs, ClassLoader testClassLoader) {
        return runner(args, remoteArgs, new ClassLoaderSpecResolver(testClassLoader));
    }

    /** Builds a runner that resolves suites through the given resolver, e.g. a {@link SpecRegistry}. */
    public SpecRunner runner(String[] args, String[] remoteArgs, SpecResolver resolver) {
        SpecBridgeConfig config = SpecBridgeConfig.fromEnvironment().withArgs(args);
        return new SpecRunner(args, remoteArgs, resolver, config);
    }
}
