package com.specbridge.framework;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sbt.testing.Fingerprint;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;

/**
 * Resolves a suite by loading its class and calling its no-arg constructor.
 *
 * The class must extend {@link RunnableSpec}, be concrete, and declare a no-arg
 * constructor (package-private and private constructors are supported).
 */
public class ClassLoaderSpecResolver implements SpecResolver {

    private static final Logger log = LoggerFactory.getLogger(ClassLoaderSpecResolver.class);

    private final ClassLoader classLoader;

    public ClassLoaderSpecResolver(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public RunnableSpec resolve(String fullyQualifiedName, Fingerprint fingerprint) {
        if (!RunnableSpecFingerprint.matches(fingerprint)) {
            throw new SpecResolutionException(fullyQualifiedName, "unsupported fingerprint " + fingerprint);
        }

        Class<?> cls;
        try {
            cls = Class.forName(fullyQualifiedName, true, classLoader);
        } catch (ClassNotFoundException e) {
            throw new SpecResolutionException(fullyQualifiedName, "class not found", e);
        } catch (LinkageError e) {
            // ExceptionInInitializerError on first load, NoClassDefFoundError afterwards
            throw new SpecResolutionException(fullyQualifiedName, "class failed to load: " + e, e);
        }

        if (!RunnableSpec.class.isAssignableFrom(cls)) {
            throw new SpecResolutionException(fullyQualifiedName,
                "does not extend " + RunnableSpec.class.getName());
        }
        if (Modifier.isAbstract(cls.getModifiers())) {
            throw new SpecResolutionException(fullyQualifiedName, "class is abstract");
        }

        try {
            Constructor<?> constructor = cls.getDeclaredConstructor();
            constructor.setAccessible(true);  // support package-private specs
            RunnableSpec spec = (RunnableSpec) constructor.newInstance();
            log.debug("ClassLoaderSpecResolver: resolved {} -> '{}'", fullyQualifiedName, spec.spec().label());
            return spec;
        } catch (NoSuchMethodException e) {
            throw new SpecResolutionException(fullyQualifiedName, "no no-arg constructor", e);
        } catch (InvocationTargetException e) {
            throw new SpecResolutionException(fullyQualifiedName,
                "constructor threw " + e.getCause(), e.getCause());
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new SpecResolutionException(fullyQualifiedName, "cannot instantiate: " + e, e);
        }
    }
}
