package com.firmo.dispatch.cli;

import com.firmo.core.tree.TestSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Finds {@link TestSpec} implementations: by class name when names are given, otherwise every
 * implementation registered in {@code META-INF/services/com.firmo.core.tree.TestSpec}.
 */
@Component
public class SpecLoader {

    private static final Logger log = LoggerFactory.getLogger(SpecLoader.class);

    private final ClassLoader classLoader;

    public SpecLoader() {
        this(Thread.currentThread().getContextClassLoader());
    }

    SpecLoader(ClassLoader classLoader) {
        this.classLoader = classLoader != null ? classLoader : SpecLoader.class.getClassLoader();
    }

    public List<TestSpec> load(List<String> classNames) {
        if (classNames == null || classNames.isEmpty()) {
            var specs = new ArrayList<TestSpec>();
            try {
                ServiceLoader.load(TestSpec.class, classLoader).forEach(specs::add);
            } catch (ServiceConfigurationError | LinkageError e) {
                throw new SpecLoadException("Cannot load registered specs: " + e.getMessage(), e);
            }
            log.info("Discovered {} registered spec(s)", specs.size());
            return specs;
        }
        var specs = new ArrayList<TestSpec>(classNames.size());
        for (String name : classNames) {
            specs.add(instantiate(name));
        }
        return specs;
    }

    private TestSpec instantiate(String className) {
        Class<?> type;
        try {
            type = Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException e) {
            throw new SpecLoadException("Spec class not found: " + className, e);
        } catch (LinkageError e) {
            // ExceptionInInitializerError wraps the static initializer's failure
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new SpecLoadException("Cannot initialize " + className + ": " + cause, e);
        }
        if (!TestSpec.class.isAssignableFrom(type)) {
            throw new SpecLoadException(className + " does not implement " + TestSpec.class.getName());
        }
        try {
            log.debug("Loading spec {}", className);
            return (TestSpec) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new SpecLoadException("Cannot instantiate " + className + ": " + e.getMessage(), e);
        }
    }
}
