package com.specbridge.core;

import com.specbridge.framework.RunnableSpec;
import com.specbridge.framework.RunnableSpecFingerprint;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sbt.testing.Selector;
import sbt.testing.SuiteSelector;
import sbt.testing.TaskDef;

import java.lang.reflect.Modifier;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Finds runnable suites on the classpath, the way a build tool would using
 * {@link RunnableSpecFingerprint}.
 *
 * Uses the Reflections library to scan the given packages for every concrete
 * subclass of {@link RunnableSpec}. Results are sorted by class name so runs are
 * repeatable.
 */
public class SpecDiscovery {

    private static final Logger log = LoggerFactory.getLogger(SpecDiscovery.class);

    private final ClassLoader classLoader;

    public SpecDiscovery(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    /** Fully-qualified names of every concrete {@link RunnableSpec} below the packages. */
    public List<String> discover(String... packages) {
        ConfigurationBuilder configuration = new ConfigurationBuilder()
            .setScanners(Scanners.SubTypes)
            .addClassLoaders(classLoader);
        FilterBuilder inputs = new FilterBuilder();
        for (String pkg : packages) {
            configuration.forPackage(pkg, classLoader);
            inputs.includePackage(pkg);
        }
        configuration.filterInputsBy(inputs);

        Set<Class<? extends RunnableSpec>> found = new Reflections(configuration).getSubTypesOf(RunnableSpec.class);

        List<String> names = found.stream()
            .filter(cls -> !Modifier.isAbstract(cls.getModifiers()))
            .map(Class::getName)
            .sorted(Comparator.naturalOrder())
            .toList();

        log.info("SpecDiscovery: {} spec(s) found in {}", names.size(), List.of(packages));
        return names;
    }

    /** One task definition per discovered suite, selecting the whole suite. */
    public TaskDef[] taskDefs(String... packages) {
        return discover(packages).stream()
            .map(name -> new TaskDef(name, RunnableSpecFingerprint.INSTANCE, false,
                new Selector[] { new SuiteSelector() }))
            .toArray(TaskDef[]::new);
    }
}
