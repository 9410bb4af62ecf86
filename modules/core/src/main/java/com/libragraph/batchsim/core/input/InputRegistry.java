package com.libragraph.batchsim.core.input;

import com.libragraph.batchsim.core.input.catalog.CatalogLoader;
import com.libragraph.batchsim.core.input.dict.DictLoader;
import com.libragraph.batchsim.core.input.header.FitsHeaderLoader;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Input loaders by type name. Iteration follows registration order; re-registering a
 * name replaces its loader but keeps its original position.
 */
public class InputRegistry {

    private static final Logger log = Logger.getLogger(InputRegistry.class);

    private final Map<String, InputLoader<?>> loaders = new LinkedHashMap<>();

    /** Registry holding the catalog, dict and fits_header loaders. */
    public static InputRegistry withBuiltins() {
        InputRegistry registry = new InputRegistry();
        registry.register(new CatalogLoader());
        registry.register(new DictLoader());
        registry.register(new FitsHeaderLoader());
        return registry;
    }

    public void register(InputLoader<?> loader) {
        register(loader.typeName(), loader);
    }

    public synchronized void register(String typeName, InputLoader<?> loader) {
        if (!loader.objectType().isInterface()) {
            throw new IllegalArgumentException("Input type '" + typeName
                    + "' must be used through an interface, got " + loader.objectType().getName());
        }
        if (loader.hasNObjects() && !NObjectsAware.class.isAssignableFrom(loader.objectType())) {
            throw new IllegalArgumentException("Input type '" + typeName
                    + "' claims an object count but " + loader.objectType().getSimpleName()
                    + " does not extend NObjectsAware");
        }
        InputLoader<?> previous = loaders.put(typeName, loader);
        if (previous != null) {
            log.debugf("Replaced input loader '%s': %s -> %s", typeName,
                    previous.getClass().getSimpleName(), loader.getClass().getSimpleName());
        } else {
            log.debugf("Registered input loader '%s' -> %s", typeName, loader.getClass().getSimpleName());
        }
    }

    public synchronized InputLoader<?> resolve(String typeName) {
        InputLoader<?> loader = loaders.get(typeName);
        if (loader == null) {
            throw new UnknownInputTypeException(typeName);
        }
        return loader;
    }

    public synchronized Optional<InputLoader<?>> lookup(String typeName) {
        return Optional.ofNullable(loaders.get(typeName));
    }

    public synchronized boolean contains(String typeName) {
        return loaders.containsKey(typeName);
    }

    /** Type names in registration order. */
    public synchronized List<String> typeNames() {
        return List.copyOf(loaders.keySet());
    }

    public synchronized int size() {
        return loaders.size();
    }
}
