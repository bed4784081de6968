package io.surfworks.symforge.core.analysis;

import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Registry for static graph analyzers.
 *
 * <p>Implementations on the class path are discovered through
 * {@link ServiceLoader} on first use. The system property
 * {@value #DEFAULT_PROPERTY} names the default analyzer.
 */
public final class AnalyzerRegistry {

    /** System property selecting the default analyzer. */
    public static final String DEFAULT_PROPERTY = "symforge.analyzer";

    private static final Logger LOG = Logger.getLogger(AnalyzerRegistry.class.getName());

    private static final Map<String, Supplier<StaticGraphAnalyzer>> FACTORIES = new ConcurrentHashMap<>();
    private static volatile String defaultAnalyzerName;
    private static volatile boolean discovered;

    private AnalyzerRegistry() {} // Utility class

    /**
     * Register an analyzer factory.
     *
     * @param name    Analyzer name
     * @param factory Factory function that creates analyzer instances
     */
    public static void register(String name, Supplier<StaticGraphAnalyzer> factory) {
        FACTORIES.put(name.toLowerCase(), factory);
    }

    /**
     * Unregister an analyzer.
     *
     * @param name Analyzer name to remove
     */
    public static void unregister(String name) {
        FACTORIES.remove(name.toLowerCase());
    }

    /**
     * Check if an analyzer is registered.
     */
    public static boolean isRegistered(String name) {
        discover();
        return FACTORIES.containsKey(name.toLowerCase());
    }

    /**
     * Get a new instance of a registered analyzer.
     *
     * @param name Analyzer name
     * @return A new analyzer instance
     * @throws IllegalArgumentException if the analyzer is not registered
     */
    public static StaticGraphAnalyzer get(String name) {
        discover();
        Supplier<StaticGraphAnalyzer> factory = FACTORIES.get(name.toLowerCase());
        if (factory == null) {
            throw new IllegalArgumentException(
                "Analyzer '" + name + "' not registered. Available: " + available());
        }
        return factory.get();
    }

    /**
     * Get a new instance of the default analyzer.
     *
     * <p>When no default is configured, or the configured one is not registered,
     * the registered analyzer whose name sorts first is used.
     *
     * @return A new instance of the default analyzer
     * @throws IllegalStateException if no analyzers are registered
     */
    public static StaticGraphAnalyzer getDefault() {
        discover();
        if (FACTORIES.isEmpty()) {
            throw new IllegalStateException("No static graph analyzers registered");
        }
        String name = getDefaultName();
        if (name != null) {
            Supplier<StaticGraphAnalyzer> factory = FACTORIES.get(name.toLowerCase());
            if (factory != null) {
                return factory.get();
            }
            LOG.warning("Default analyzer '" + name + "' not registered, falling back. Available: " + available());
        }
        Map.Entry<String, Supplier<StaticGraphAnalyzer>> first = new TreeMap<>(FACTORIES).firstEntry();
        if (first == null) {
            throw new IllegalStateException("No static graph analyzers registered");
        }
        return first.getValue().get();
    }

    /**
     * Set the default analyzer name.
     *
     * @param name Analyzer name to use as default
     */
    public static void setDefault(String name) {
        if (!isRegistered(name)) {
            throw new IllegalArgumentException("Analyzer '" + name + "' not registered");
        }
        defaultAnalyzerName = name.toLowerCase();
    }

    /**
     * Get the name of the default analyzer, or null if none is configured.
     */
    public static String getDefaultName() {
        if (defaultAnalyzerName != null) {
            return defaultAnalyzerName;
        }
        String configured = System.getProperty(DEFAULT_PROPERTY);
        return configured == null || configured.isBlank() ? null : configured.trim().toLowerCase();
    }

    /**
     * Get list of available analyzer names.
     */
    public static List<String> available() {
        discover();
        return List.copyOf(FACTORIES.keySet());
    }

    /**
     * Clear all registered analyzers (mainly for testing).
     * Service providers are discovered again on next use.
     */
    public static void clear() {
        FACTORIES.clear();
        defaultAnalyzerName = null;
        discovered = false;
    }

    private static void discover() {
        if (discovered) {
            return;
        }
        synchronized (AnalyzerRegistry.class) {
            if (discovered) {
                return;
            }
            for (ServiceLoader.Provider<StaticGraphAnalyzer> provider
                    : ServiceLoader.load(StaticGraphAnalyzer.class).stream().toList()) {
                String name = provider.get().name().toLowerCase();
                if (FACTORIES.putIfAbsent(name, provider::get) == null) {
                    LOG.fine("Discovered static graph analyzer '" + name + "'");
                }
            }
            discovered = true;
        }
    }
}
