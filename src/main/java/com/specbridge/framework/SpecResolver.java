package com.specbridge.framework;

import sbt.testing.Fingerprint;

/**
 * Looks up the suite behind a fully-qualified name.
 */
public interface SpecResolver {

    /**
     * @throws SpecResolutionException when the name is unknown, or does not denote a
     *         {@link RunnableSpec} satisfying {@code fingerprint}
     */
    RunnableSpec resolve(String fullyQualifiedName, Fingerprint fingerprint);
}
