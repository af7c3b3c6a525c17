package com.specbridge.framework;

import sbt.testing.Fingerprint;
import sbt.testing.SubclassFingerprint;

/**
 * The single fingerprint this framework understands: a concrete class extending
 * {@link RunnableSpec} with a no-arg constructor.
 *
 * Stateless and process-wide; compare with {@link #matches(Fingerprint)}.
 */
public final class RunnableSpecFingerprint implements SubclassFingerprint {

    public static final RunnableSpecFingerprint INSTANCE = new RunnableSpecFingerprint();

    private RunnableSpecFingerprint() {}

    @Override
    public boolean isModule() {
        return false;
    }

    @Override
    public String superclassName() {
        return RunnableSpec.class.getName();
    }

    @Override
    public boolean requireNoArgConstructor() {
        return true;
    }

    /**
     * True for this instance, or for an equivalent subclass fingerprint a build tool
     * reconstructed on its side of a fork.
     */
    public static boolean matches(Fingerprint fingerprint) {
        if (fingerprint == INSTANCE) return true;
        return fingerprint instanceof SubclassFingerprint sub
            && !sub.isModule()
            && INSTANCE.superclassName().equals(sub.superclassName());
    }

    @Override
    public String toString() {
        return "RunnableSpecFingerprint{superclass=" + superclassName() + "}";
    }
}
