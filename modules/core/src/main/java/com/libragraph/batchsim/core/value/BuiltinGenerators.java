package com.libragraph.batchsim.core.value;

import com.libragraph.batchsim.core.config.IndexKey;
import com.libragraph.batchsim.core.config.InvalidParameterException;
import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.config.ParamParser;
import com.libragraph.batchsim.core.config.ParamSpec;
import com.libragraph.batchsim.core.config.Params;
import com.libragraph.batchsim.core.config.ParsedValue;
import com.libragraph.batchsim.util.ConfigMaps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Generators that need nothing but the config and the running indices.
 */
final class BuiltinGenerators {

    private static final ParamSpec INT_SEQUENCE = sequenceSpec(Integer.class);
    private static final ParamSpec FLOAT_SEQUENCE = sequenceSpec(Double.class);

    private static final ParamSpec LIST = ParamSpec.builder()
            .required("items", Object.class)
            .optional("index", Integer.class)
            .build();

    private static final ParamSpec NUMBERED_FILE = ParamSpec.builder()
            .required("root", String.class)
            .optional("num", Integer.class)
            .optional("digits", Integer.class)
            .optional("ext", String.class)
            .build();

    private static final ParamSpec FORMATTED_STR = ParamSpec.builder()
            .required("format", String.class)
            .ignore("items")
            .build();

    private BuiltinGenerators() {
    }

    private static ParamSpec sequenceSpec(Class<?> numberType) {
        return ParamSpec.builder()
                .optional("first", numberType)
                .optional("last", numberType)
                .optional("step", numberType)
                .optional("repeat", Integer.class)
                .optional("nitems", Integer.class)
                .ignore("index_key")
                .build();
    }

    /** {@code first + step * index}, optionally repeated and wrapped. Never safe. */
    static ParsedValue<?> sequence(Map<String, Object> config, JobContext ctx, Class<?> type) {
        boolean floating = type == Double.class;
        Params p = ParamParser.getAllParams(config, "type = Sequence", ctx,
                floating ? FLOAT_SEQUENCE : INT_SEQUENCE);
        if (p.has("last") && p.has("nitems")) {
            throw new InvalidParameterException(
                    "At most one of the attributes last and nitems is allowed for type = Sequence");
        }

        IndexKey indexKey = config.containsKey("index_key")
                ? IndexKey.fromConfigName(String.valueOf(config.get("index_key")))
                : ctx.indexKey();
        int index = ctx.index(indexKey);
        int repeat = p.getOrDefault("repeat", Integer.class, 1);
        if (repeat > 1) {
            index /= repeat;
        }

        if (floating) {
            double first = p.getOrDefault("first", Double.class, 0.0);
            double step = p.getOrDefault("step", Double.class, 1.0);
            if (step == 0.0) {
                throw new InvalidParameterException("step = 0 is not allowed for type = Sequence");
            }
            Integer nitems = p.optional("nitems", Integer.class).orElse(null);
            if (p.has("last")) {
                nitems = (int) Math.floor((p.get("last", Double.class) - first) / step) + 1;
            }
            if (nitems != null) {
                index = wrap(index, nitems);
            }
            return ParsedValue.unsafe(first + index * step);
        }

        int first = p.getOrDefault("first", Integer.class, 0);
        int step = p.getOrDefault("step", Integer.class, 1);
        if (step == 0) {
            throw new InvalidParameterException("step = 0 is not allowed for type = Sequence");
        }
        Integer nitems = p.optional("nitems", Integer.class).orElse(null);
        if (p.has("last")) {
            nitems = (p.get("last", Integer.class) - first) / step + 1;
        }
        if (nitems != null) {
            index = wrap(index, nitems);
        }
        return ParsedValue.unsafe(first + index * step);
    }

    /** One element of {@code items}, chosen by {@code index} (default: the running index). */
    static ParsedValue<?> list(Map<String, Object> config, JobContext ctx, Class<?> type) {
        ParamParser.checkAllParams(config, "type = List", LIST);
        List<Object> items = ConfigMaps.asList(config.get("items"));
        if (items.isEmpty()) {
            throw new InvalidParameterException("items may not be empty for type = List");
        }
        ParsedValue<Integer> index = defaultIndex(config, ctx, items.size());
        if (index.value() < 0 || index.value() >= items.size()) {
            throw new InvalidParameterException("index " + index.value()
                    + " out of bounds for type = List with " + items.size() + " items");
        }
        ParsedValue<?> item = ctx.parse(itemHolder(items.get(index.value())), "item", type);
        return new ParsedValue<>(item.value(), item.safe() && index.safe());
    }

    /** {@code root + zero-padded num + ext}. */
    static ParsedValue<?> numberedFile(Map<String, Object> config, JobContext ctx, Class<?> type) {
        Params p = ParamParser.getAllParams(config, "type = NumberedFile", ctx, NUMBERED_FILE);
        boolean safe = p.safe();
        int num;
        if (p.has("num")) {
            num = p.get("num", Integer.class);
        } else {
            num = ctx.index();
            safe = false;
        }
        String digits = String.valueOf(num);
        if (p.has("digits")) {
            int width = p.get("digits", Integer.class);
            if (width < 0) {
                throw new InvalidParameterException("digits = " + width + " is invalid for type = NumberedFile");
            }
            if (width > 0) {
                digits = String.format("%0" + width + "d", num);
            }
        }
        String name = p.get("root", String.class) + digits + p.getOrDefault("ext", String.class, "");
        return new ParsedValue<>(name, safe);
    }

    /** {@link String#format} over the parsed {@code items}. */
    static ParsedValue<?> formattedStr(Map<String, Object> config, JobContext ctx, Class<?> type) {
        Params p = ParamParser.getAllParams(config, "type = FormattedStr", ctx, FORMATTED_STR);
        boolean safe = p.safe();
        List<Object> items = ConfigMaps.asList(config.get("items"));
        List<Object> args = new ArrayList<>(items.size());
        for (Object item : items) {
            ParsedValue<Object> v = ctx.parse(itemHolder(item), "item", Object.class);
            args.add(v.value());
            safe &= v.safe();
        }
        try {
            return new ParsedValue<>(String.format(p.get("format", String.class), args.toArray()), safe);
        } catch (java.util.IllegalFormatException e) {
            throw new InvalidParameterException("Bad format for type = FormattedStr: " + e.getMessage(), e);
        }
    }

    /**
     * The explicit {@code index} of a value config, or the running index wrapped to
     * {@code nitems} when none is given (then unsafe).
     */
    static ParsedValue<Integer> defaultIndex(Map<String, Object> config, JobContext ctx, int nitems) {
        if (config.containsKey("index")) {
            return ctx.parse(config, "index", Integer.class);
        }
        return ParsedValue.unsafe(wrap(ctx.index(), nitems));
    }

    static Map<String, Object> itemHolder(Object item) {
        return Collections.singletonMap("item", item);
    }

    private static int wrap(int index, int nitems) {
        if (nitems <= 0) {
            throw new InvalidParameterException("nitems must be positive, got " + nitems);
        }
        return Math.floorMod(index, nitems);
    }
}
