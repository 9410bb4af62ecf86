package com.libragraph.batchsim.core.input;

import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.config.ParamParser;
import com.libragraph.batchsim.core.config.ParamSpec;
import com.libragraph.batchsim.core.config.Params;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds one kind of input object (catalog, dictionary, header...) from its config
 * field. Loaders are registered in the {@link InputRegistry} under a type name that is
 * also the key of the {@code input} config branch.
 *
 * @param <T> the interface the object is used through. Must be an interface so a
 *            shared instance can be handed out as a proxy.
 */
public interface InputLoader<T> {

    /** Default registration name, e.g. {@code catalog}. */
    String typeName();

    Class<T> objectType();

    /** Value generators reading from this input; their memos are dropped on rebuild. */
    Set<String> valueTypes();

    ParamSpec paramSpec();

    /** True if the object implements {@link NObjectsAware}. */
    default boolean hasNObjects() {
        return false;
    }

    /** True if the object must exist before per-file setup (e.g. to name the file). */
    default boolean fileScope() {
        return false;
    }

    /** Objects drawing random numbers at construction differ per file, so are never safe. */
    default boolean takesRng() {
        return false;
    }

    default ConstructionArgs getConstructionArgs(Map<String, Object> field, JobContext ctx) {
        Params p = ParamParser.getAllParams(field, "input." + typeName(), ctx, paramSpec());
        return new ConstructionArgs(p.values(), p.safe() && !takesRng());
    }

    /**
     * @param nobjectsOnly the caller only needs {@link NObjectsAware#getNObjects()}, so
     *                     a loader may skip reading the full contents
     */
    T construct(Map<String, Object> kwargs, boolean nobjectsOnly) throws IOException;

    /** Per-image hook, called before each image is drawn. */
    default void setupImage(T object, Map<String, Object> field, JobContext ctx) {
    }

    /**
     * Lets a loader say the object is unsafe without parsing its arguments. Empty means
     * "parse the arguments to find out".
     */
    default Optional<Boolean> isSafeWithoutBuilding(Map<String, Object> field, JobContext ctx) {
        return Optional.empty();
    }
}
