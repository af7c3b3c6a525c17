package com.specbridge.framework;

import sbt.testing.Event;
import sbt.testing.Fingerprint;
import sbt.testing.OptionalThrowable;
import sbt.testing.Selector;
import sbt.testing.Status;

/**
 * The report of one leaf test, as handed to the build tool's {@link sbt.testing.EventHandler}.
 *
 * @param selector  a {@link sbt.testing.TestSelector} holding the test's own label
 * @param throwable defined only for {@link Status#Failure}
 * @param duration  milliseconds spent in the body; 0 for ignored tests
 */
public record SpecEvent(
    String fullyQualifiedName,
    Fingerprint fingerprint,
    Selector selector,
    Status status,
    OptionalThrowable throwable,
    long duration
) implements Event {
}
