package com.libragraph.batchsim.core.value;

import com.libragraph.batchsim.core.config.ConfigValidationException;
import com.libragraph.batchsim.core.config.IndexKey;
import com.libragraph.batchsim.core.config.InvalidParameterException;
import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.config.ParsedValue;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluator backed by a registry of {@link ValueGenerator}s. Results of value configs
 * are memoized per context in its {@link CurrentValueCache}.
 */
@ApplicationScoped
public class DefaultValueEvaluator implements ValueEvaluator {

    private static final Logger log = Logger.getLogger(DefaultValueEvaluator.class);

    private final Map<String, ValueGenerator> generators = new ConcurrentHashMap<>();

    public DefaultValueEvaluator() {
        register("Sequence", BuiltinGenerators::sequence);
        register("List", BuiltinGenerators::list);
        register("NumberedFile", BuiltinGenerators::numberedFile);
        register("FormattedStr", BuiltinGenerators::formattedStr);
        register(InputValueGenerators.CATALOG, InputValueGenerators::catalog);
        register(InputValueGenerators.DICT, InputValueGenerators::dict);
        register(InputValueGenerators.FITS_HEADER, InputValueGenerators::fitsHeader);
    }

    public void register(String valueType, ValueGenerator generator) {
        if (generators.put(valueType, generator) != null) {
            log.debugf("Replaced value generator for type '%s'", valueType);
        }
    }

    public Optional<ValueGenerator> lookup(String valueType) {
        return Optional.ofNullable(generators.get(valueType));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> ParsedValue<T> parse(Map<String, Object> parent, String key, JobContext ctx, Class<T> type) {
        if (parent == null || !parent.containsKey(key)) {
            throw new InvalidParameterException("Attribute " + key + " is required");
        }
        Object raw = parent.get(key);

        if (raw instanceof Map<?, ?> map) {
            return evaluate((Map<String, Object>) map, key, ctx, type);
        }
        if (raw instanceof List<?>) {
            throw new InvalidParameterException("Attribute " + key
                    + " is a list; use {type: List, items: [...]} to pick one element");
        }
        return ParsedValue.safe(ValueCoercion.coerce(raw, type, key));
    }

    @Override
    public int removeCurrent(JobContext ctx, Set<String> valueTypes) {
        int removed = ctx.currentValues().remove(valueTypes);
        if (removed > 0) {
            log.debugf("file %d: dropped %d memoized values of types %s", ctx.fileNum(), removed, valueTypes);
        }
        return removed;
    }

    private <T> ParsedValue<T> evaluate(Map<String, Object> node, String key, JobContext ctx, Class<T> type) {
        Object typeName = node.get("type");
        if (typeName == null) {
            throw new InvalidParameterException("Attribute " + key + " is a map with no type");
        }
        String valueType = String.valueOf(typeName);
        ValueGenerator generator = generators.get(valueType);
        if (generator == null) {
            throw new ConfigValidationException("Unknown value type " + valueType + " for " + key);
        }

        IndexKey indexKey = node.containsKey("index_key")
                ? IndexKey.fromConfigName(String.valueOf(node.get("index_key")))
                : ctx.indexKey();
        int index = ctx.index(indexKey);

        Optional<CurrentValueCache.Entry> current = ctx.currentValues().lookup(node, indexKey, index);
        if (current.isPresent()) {
            CurrentValueCache.Entry e = current.get();
            return new ParsedValue<>(ValueCoercion.coerce(e.value(), type, key), e.safe());
        }

        ParsedValue<?> generated = generator.generate(node, ctx, type);
        T value = ValueCoercion.coerce(generated.value(), type, key);
        ctx.currentValues().store(node, new CurrentValueCache.Entry(
                valueType, indexKey, index, generated.value(), generated.safe()));
        return new ParsedValue<>(value, generated.safe());
    }
}
