package com.libragraph.batchsim.core.value;

import com.libragraph.batchsim.core.config.InvalidParameterException;
import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.config.ParamParser;
import com.libragraph.batchsim.core.config.ParamSpec;
import com.libragraph.batchsim.core.config.Params;
import com.libragraph.batchsim.core.config.ParsedValue;
import com.libragraph.batchsim.core.input.SlotState;
import com.libragraph.batchsim.core.input.catalog.Catalog;
import com.libragraph.batchsim.core.input.dict.InputDict;
import com.libragraph.batchsim.core.input.header.FitsHeader;

import java.util.Map;

/**
 * Generators that read from built input objects. A value is safe only if its
 * parameters are and the object it reads was built safe.
 */
final class InputValueGenerators {

    static final String CATALOG = "Catalog";
    static final String DICT = "Dict";
    static final String FITS_HEADER = "FitsHeader";

    private static final ParamSpec CATALOG_PARAMS = ParamSpec.builder()
            .required("col", Integer.class)
            .optional("num", Integer.class)
            .ignore("index")
            .build();

    private static final ParamSpec KEYED_PARAMS = ParamSpec.builder()
            .required("key", String.class)
            .optional("num", Integer.class)
            .build();

    private InputValueGenerators() {
    }

    static ParsedValue<?> catalog(Map<String, Object> config, JobContext ctx, Class<?> type) {
        Params p = ParamParser.getAllParams(config, "type = " + CATALOG, ctx, CATALOG_PARAMS);
        int num = p.getOrDefault("num", Integer.class, 0);
        Catalog catalog = ctx.inputs().getInputObject("catalog", num, CATALOG, Catalog.class);
        ParsedValue<Integer> index = BuiltinGenerators.defaultIndex(config, ctx, catalog.getNObjects());
        int col = p.get("col", Integer.class);
        try {
            String value = catalog.get(index.value(), col);
            return new ParsedValue<>(value, p.safe() && index.safe() && builtSafe(ctx, "catalog", num));
        } catch (IndexOutOfBoundsException e) {
            throw new InvalidParameterException(e.getMessage(), e);
        }
    }

    static ParsedValue<?> dict(Map<String, Object> config, JobContext ctx, Class<?> type) {
        Params p = ParamParser.getAllParams(config, "type = " + DICT, ctx, KEYED_PARAMS);
        int num = p.getOrDefault("num", Integer.class, 0);
        InputDict dict = ctx.inputs().getInputObject("dict", num, DICT, InputDict.class);
        String key = p.get("key", String.class);
        Object value = dict.get(key);
        if (value == null) {
            throw new InvalidParameterException("Key " + key + " not found in input dict " + num);
        }
        return new ParsedValue<>(value, p.safe() && builtSafe(ctx, "dict", num));
    }

    static ParsedValue<?> fitsHeader(Map<String, Object> config, JobContext ctx, Class<?> type) {
        Params p = ParamParser.getAllParams(config, "type = " + FITS_HEADER, ctx, KEYED_PARAMS);
        int num = p.getOrDefault("num", Integer.class, 0);
        FitsHeader header = ctx.inputs().getInputObject("fits_header", num, FITS_HEADER, FitsHeader.class);
        String key = p.get("key", String.class);
        Object value = header.get(key);
        if (value == null) {
            throw new InvalidParameterException("Keyword " + key + " not found in input fits_header " + num);
        }
        return new ParsedValue<>(value, p.safe() && builtSafe(ctx, "fits_header", num));
    }

    private static boolean builtSafe(JobContext ctx, String type, int num) {
        return ctx.inputs().findSlot(type, num)
                .map(s -> s.state() == SlotState.BUILT_SAFE)
                .orElse(false);
    }
}
