package com.specbridge.framework;

/**
 * A suite name did not resolve to a {@link RunnableSpec} matching the requested fingerprint.
 * Raised while building tasks; no task is created for the offending name.
 */
public class SpecResolutionException extends RuntimeException {

    private final String fullyQualifiedName;

    public SpecResolutionException(String fullyQualifiedName, String reason) {
        this(fullyQualifiedName, reason, null);
    }

    public SpecResolutionException(String fullyQualifiedName, String reason, Throwable cause) {
        super("Cannot resolve spec '" + fullyQualifiedName + "': " + reason, cause);
        this.fullyQualifiedName = fullyQualifiedName;
    }

    public String getFullyQualifiedName() {
        return fullyQualifiedName;
    }
}
