package com.specbridge.framework;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sbt.testing.Fingerprint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * An explicit name-to-suite lookup table.
 *
 * Built once with {@link Builder} and read-only afterwards, so it can back any
 * number of runners at once. Duplicate names cause an {@link IllegalStateException}
 * at build time so a shadowed suite is never silent.
 */
public class SpecRegistry implements SpecResolver {

    private static final Logger log = LoggerFactory.getLogger(SpecRegistry.class);

    private final Map<String, RunnableSpec> specs;

    private SpecRegistry(Map<String, RunnableSpec> specs) {
        this.specs = Collections.unmodifiableMap(new LinkedHashMap<>(specs));
        log.info("SpecRegistry: {} spec(s) registered", this.specs.size());
    }

    // ── Lookup ────────────────────────────────────────────────────────────────

    @Override
    public RunnableSpec resolve(String fullyQualifiedName, Fingerprint fingerprint) {
        if (!RunnableSpecFingerprint.matches(fingerprint)) {
            throw new SpecResolutionException(fullyQualifiedName, "unsupported fingerprint " + fingerprint);
        }
        RunnableSpec spec = specs.get(fullyQualifiedName);
        if (spec == null) {
            throw new SpecResolutionException(fullyQualifiedName, "no spec registered under this name");
        }
        return spec;
    }

    /** Registered names, in registration order. */
    public Set<String> names() {
        return specs.keySet();
    }

    public int size() {
        return specs.size();
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private final Map<String, RunnableSpec> specs = new LinkedHashMap<>();

        /** Registers {@code spec} under its class name. */
        public Builder register(RunnableSpec spec) {
            return register(spec.getClass().getName(), spec);
        }

        public Builder register(String name, RunnableSpec spec) {
            if (specs.containsKey(name)) {
                throw new IllegalStateException(
                    "Duplicate spec name '" + name + "': " + specs.get(name).getClass().getName() +
                    " and " + spec.getClass().getName());
            }
            specs.put(name, spec);
            return this;
        }

        public SpecRegistry build() {
            return new SpecRegistry(specs);
        }
    }
}
