package webscan.scanner;

import webscan.scanner.sqlinjection.SqlInjectionPlugin;
import webscan.scanner.traversal.PathTraversalPlugin;
import webscan.scanner.xss.XssPlugin;

import java.util.*;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Реестр плагинов сканера: статическая таблица «имя → фабрика».
 *
 * <p>Каждый вызов {@link #create(String)} возвращает новый экземпляр, так что
 * плагин принадлежит ровно одному сканированию.
 */
public final class PluginRegistry {
    private static final Logger logger = Logger.getLogger(PluginRegistry.class.getName());

    private final Map<String, Supplier<ScannerPlugin>> factories = new LinkedHashMap<>();

    public PluginRegistry() {
    }

    /**
     * Registry holding the built-in plugins: {@code sql_injection}, {@code xss} and {@code path_traversal}.
     */
    public static PluginRegistry withDefaults() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(SqlInjectionPlugin.NAME, SqlInjectionPlugin::new);
        registry.register(XssPlugin.NAME, XssPlugin::new);
        registry.register(PathTraversalPlugin.NAME, PathTraversalPlugin::new);
        return registry;
    }

    /**
     * @throws IllegalArgumentException if a plugin with the same name is already registered
     */
    public synchronized void register(String name, Supplier<ScannerPlugin> factory) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(factory, "factory cannot be null");
        if (factories.containsKey(name)) {
            throw new IllegalArgumentException("Plugin '" + name + "' is already registered");
        }
        factories.put(name, factory);
        logger.fine("Registered plugin: " + name);
    }

    public synchronized List<String> availablePluginNames() {
        return List.copyOf(factories.keySet());
    }

    public synchronized boolean contains(String name) {
        return factories.containsKey(name);
    }

    /**
     * Creates a fresh plugin instance.
     *
     * @return the plugin, or empty if the name is unknown or the factory failed
     */
    public Optional<ScannerPlugin> create(String name) {
        Supplier<ScannerPlugin> factory;
        synchronized (this) {
            factory = factories.get(name);
        }
        if (factory == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(factory.get());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to instantiate plugin '" + name + "'", e);
            return Optional.empty();
        }
    }
}
