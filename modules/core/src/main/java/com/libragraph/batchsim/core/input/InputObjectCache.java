package com.libragraph.batchsim.core.input;

import com.libragraph.batchsim.core.config.ConfigValidationException;
import com.libragraph.batchsim.core.config.InvalidParameterException;
import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.config.ParamParser;
import com.libragraph.batchsim.core.share.SharedInputManager;
import com.libragraph.batchsim.util.ConfigMaps;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built input objects by {@code (type, index)}, plus their safety state.
 * <p>
 * A job holds one cache on the controlling thread. Each worker gets its own
 * {@link #workerView()} that starts from the job's safe objects. Not thread-safe.
 */
public class InputObjectCache {

    private static final Logger log = Logger.getLogger(InputObjectCache.class);

    private final InputRegistry registry;
    private final SharedInputManager manager;
    private final Map<String, List<InputSlot>> slots = new LinkedHashMap<>();

    public InputObjectCache(InputRegistry registry) {
        this(registry, null);
    }

    public InputObjectCache(InputRegistry registry, SharedInputManager manager) {
        this.registry = registry;
        this.manager = manager;
    }

    public InputRegistry registry() {
        return registry;
    }

    public Optional<SharedInputManager> manager() {
        return Optional.ofNullable(manager);
    }

    /**
     * Rewrites every registered key of the {@code input} branch into a list of fields
     * and checks the branch holds no unregistered key.
     *
     * @return the configured type names in registry order
     */
    public List<String> normalizeInputs(Map<String, Object> config) {
        Map<String, Object> input = inputBranch(config);
        if (input == null) {
            return List.of();
        }
        ParamParser.checkAllowedKeys(input, "input", registry.typeNames());
        List<String> configured = new ArrayList<>();
        for (String type : registry.typeNames()) {
            if (!input.containsKey(type)) continue;
            Object value = input.get(type);
            if (!(value instanceof List<?>)) {
                input.put(type, ConfigMaps.asList(value));
            }
            configured.add(type);
        }
        return configured;
    }

    /**
     * Builds the configured inputs the scope selects, in registry order.
     */
    public void processInputs(JobContext ctx, ProcessScope scope) {
        List<String> configured = normalizeInputs(ctx.config());
        for (String type : configured) {
            InputLoader<?> loader = registry.resolve(type);
            if (scope == ProcessScope.FILE_SCOPE_ONLY && !loader.fileScope()) continue;
            if (scope == ProcessScope.COUNT_CAPABLE_ONLY && !loader.hasNObjects()) continue;

            int nfields = fields(ctx, type).size();
            for (int i = 0; i < nfields; i++) {
                if (scope == ProcessScope.SAFE_ONLY) {
                    BuildOutcome outcome = buildOrUnsafe(type, i, ctx);
                    if (outcome instanceof BuildOutcome.Unsafe u) {
                        log.debugf("Input %s %d left for per-file build: %s", type, i, u.reason());
                    }
                } else {
                    ensureBuilt(type, i, ctx);
                }
            }
        }
    }

    /**
     * Returns the object at {@code (type, index)}, building it if the slot holds nothing
     * usable for the context's file. Building is skipped for a safe object and for an
     * unsafe one built for the same file.
     *
     * @throws InputConstructionException if the loader fails
     */
    public Object ensureBuilt(String type, int index, JobContext ctx) {
        InputSlot slot = slot(type, index);
        if (slot.isReusableFor(ctx.fileNum())) {
            log.debugf("Using %s %d already read in for file %d", type, index, ctx.fileNum());
            return slot.object();
        }

        InputLoader<?> loader = registry.resolve(type);
        ConstructionArgs args = loader.getConstructionArgs(field(ctx, type, index), ctx);
        Object object = construct(loader, slot, args);
        slot.built(object, args.safe(), ctx.fileNum());
        ctx.evaluator().removeCurrent(ctx, loader.valueTypes());

        if (loader.hasNObjects()) {
            log.debugf("file %d: Built %s %d with %d objects (safe=%s)", ctx.fileNum(), type, index,
                    ((NObjectsAware) object).getNObjects(), args.safe());
        } else {
            log.debugf("file %d: Built %s %d (safe=%s)", ctx.fileNum(), type, index, args.safe());
        }
        return object;
    }

    /**
     * Builds the object only if it is safe for all files. Anything that makes it
     * unsafe, including argument parsing that needs per-file state or a failed
     * construction, leaves the slot unbuilt for the per-file pass.
     */
    public BuildOutcome buildOrUnsafe(String type, int index, JobContext ctx) {
        InputSlot slot = slot(type, index);
        if (slot.state() == SlotState.BUILT_SAFE) {
            return BuildOutcome.built(slot.object());
        }

        InputLoader<?> loader = registry.resolve(type);
        Map<String, Object> field = field(ctx, type, index);
        Optional<Boolean> declared = loader.isSafeWithoutBuilding(field, ctx);
        if (declared.isPresent() && !declared.get()) {
            return BuildOutcome.unsafe("loader declares it unsafe");
        }

        ConstructionArgs args;
        try {
            args = loader.getConstructionArgs(field, ctx);
        } catch (InvalidParameterException e) {
            return BuildOutcome.unsafe("arguments not resolvable yet: " + e.getMessage());
        }
        if (!args.safe()) {
            return BuildOutcome.unsafe("arguments vary per file");
        }

        Object object;
        try {
            object = construct(loader, slot, args);
        } catch (InputConstructionException e) {
            return BuildOutcome.unsafe("construction failed: " + e.getMessage());
        }
        slot.built(object, true, ctx.fileNum());
        ctx.evaluator().removeCurrent(ctx, loader.valueTypes());
        log.debugf("Built safe input %s %d", type, index);
        return BuildOutcome.built(object);
    }

    /** Runs every built object's per-image hook. */
    public void setupForImage(JobContext ctx) {
        for (Map.Entry<String, List<InputSlot>> e : slots.entrySet()) {
            InputLoader<?> loader = registry.resolve(e.getKey());
            for (InputSlot slot : e.getValue()) {
                if (slot.isBuilt()) {
                    setupImage(loader, slot.object(), field(ctx, e.getKey(), slot.index()), ctx);
                }
            }
        }
    }

    private static <T> void setupImage(InputLoader<T> loader, Object object, Map<String, Object> field,
                                       JobContext ctx) {
        loader.setupImage(loader.objectType().cast(object), field, ctx);
    }

    /**
     * Looks up a built object for a value generator.
     *
     * @param paramName the value type asking, for error messages
     * @throws InputNotAvailableException if nothing of that type is built
     * @throws InvalidParameterException  if {@code num} is out of range
     */
    public Object getInputObject(String type, int num, String paramName) {
        List<InputSlot> list = slots.get(type);
        if (list == null || list.stream().noneMatch(InputSlot::isBuilt)) {
            throw new InputNotAvailableException(type, paramName);
        }
        if (num < 0) {
            throw new InvalidParameterException("Invalid num < 0 supplied for " + paramName + ": num = " + num);
        }
        if (num >= list.size()) {
            throw new InvalidParameterException("Invalid num supplied for " + paramName
                    + " (too large): num = " + num);
        }
        InputSlot slot = list.get(num);
        if (!slot.isBuilt()) {
            throw new InputNotAvailableException(type, paramName);
        }
        return slot.object();
    }

    public <T> T getInputObject(String type, int num, String paramName, Class<T> objectType) {
        return objectType.cast(getInputObject(type, num, paramName));
    }

    /**
     * Object count from the first count-capable input configured, in registry order.
     * Uses the built object if there is one usable for this file, otherwise constructs a
     * throwaway in count-only mode.
     */
    public Optional<NObjectsProbe> processInputNObjects(JobContext ctx) {
        List<String> configured = normalizeInputs(ctx.config());
        List<String> candidates = new ArrayList<>();
        for (String type : configured) {
            if (registry.resolve(type).hasNObjects()) {
                candidates.add(type);
            }
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        String type = candidates.get(0);
        if (candidates.size() > 1) {
            log.warnf("Several count-capable inputs configured %s; counting objects from '%s'",
                    candidates, type);
        }

        InputSlot slot = slot(type, 0);
        NObjectsAware counted;
        if (slot.isReusableFor(ctx.fileNum())) {
            counted = (NObjectsAware) slot.object();
        } else {
            InputLoader<?> loader = registry.resolve(type);
            ConstructionArgs args = loader.getConstructionArgs(field(ctx, type, 0), ctx);
            try {
                counted = (NObjectsAware) loader.construct(args.kwargs(), true);
            } catch (Exception e) {
                throw new InputConstructionException("Failed to count objects in input " + type, e);
            }
        }
        int n = counted.getNObjects();
        log.debugf("file %d: Found nobjects = %d for %s", ctx.fileNum(), n, type);
        return Optional.of(new NObjectsProbe(type, n));
    }

    /** Forces the next {@link #ensureBuilt} of this slot to rebuild. */
    public void invalidate(String type, int index) {
        slot(type, index).invalidate();
    }

    public Optional<InputSlot> findSlot(String type, int index) {
        List<InputSlot> list = slots.get(type);
        if (list == null || index >= list.size()) {
            return Optional.empty();
        }
        return Optional.of(list.get(index));
    }

    /** A cache for one worker: shares this cache's safe objects and nothing else. */
    public InputObjectCache workerView() {
        InputObjectCache view = new InputObjectCache(registry, manager);
        for (Map.Entry<String, List<InputSlot>> e : slots.entrySet()) {
            List<InputSlot> copies = new ArrayList<>();
            for (InputSlot slot : e.getValue()) {
                copies.add(slot.state() == SlotState.BUILT_SAFE ? slot.copy() : new InputSlot(slot.typeName(), slot.index()));
            }
            view.slots.put(e.getKey(), copies);
        }
        return view;
    }

    /** A cache holding every object built so far, for sub-tasks of the current file. */
    public InputObjectCache snapshot() {
        InputObjectCache copy = new InputObjectCache(registry, manager);
        for (Map.Entry<String, List<InputSlot>> e : slots.entrySet()) {
            List<InputSlot> copies = new ArrayList<>();
            for (InputSlot slot : e.getValue()) {
                copies.add(slot.copy());
            }
            copy.slots.put(e.getKey(), copies);
        }
        return copy;
    }

    // -- internals --

    private Object construct(InputLoader<?> loader, InputSlot slot, ConstructionArgs args) {
        if (manager != null && manager.isRunning() && manager.isBound(slot.tag())) {
            return manager.construct(slot.tag(), args.kwargs());
        }
        try {
            return loader.construct(args.kwargs(), false);
        } catch (Exception e) {
            throw new InputConstructionException("Failed to build input " + slot.typeName()
                    + " " + slot.index() + ": " + e.getMessage(), e);
        }
    }

    private InputSlot slot(String type, int index) {
        List<InputSlot> list = slots.computeIfAbsent(type, k -> new ArrayList<>());
        while (list.size() <= index) {
            list.add(new InputSlot(type, list.size()));
        }
        return list.get(index);
    }

    private static Map<String, Object> inputBranch(Map<String, Object> config) {
        try {
            return ConfigMaps.subMap(config, "input");
        } catch (IllegalArgumentException e) {
            throw new ConfigValidationException(e.getMessage(), e);
        }
    }

    private static List<Object> fields(JobContext ctx, String type) {
        Map<String, Object> input = inputBranch(ctx.config());
        if (input == null || !input.containsKey(type)) {
            throw new InputNotAvailableException(type, type);
        }
        return ConfigMaps.asList(input.get(type));
    }

    private static Map<String, Object> field(JobContext ctx, String type, int index) {
        List<Object> fields = fields(ctx, type);
        if (index >= fields.size()) {
            throw new InvalidParameterException("input." + type + " has no entry " + index);
        }
        try {
            return ConfigMaps.asMap(fields.get(index), "input." + type + "[" + index + "]");
        } catch (IllegalArgumentException e) {
            throw new ConfigValidationException(e.getMessage(), e);
        }
    }
}
