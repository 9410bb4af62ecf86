package com.libragraph.batchsim.core.input.catalog;

import com.libragraph.batchsim.core.config.ParamSpec;
import com.libragraph.batchsim.core.input.InputLoader;
import com.libragraph.batchsim.core.input.InputPaths;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.util.Map;
import java.util.Set;

@ApplicationScoped
public class CatalogLoader implements InputLoader<Catalog> {

    private static final ParamSpec PARAMS = ParamSpec.builder()
            .required("file_name", String.class)
            .optional("dir", String.class)
            .optional("comments", String.class)
            .build();

    @Override
    public String typeName() {
        return "catalog";
    }

    @Override
    public Class<Catalog> objectType() {
        return Catalog.class;
    }

    @Override
    public Set<String> valueTypes() {
        return Set.of("Catalog");
    }

    @Override
    public ParamSpec paramSpec() {
        return PARAMS;
    }

    @Override
    public boolean hasNObjects() {
        return true;
    }

    @Override
    public Catalog construct(Map<String, Object> kwargs, boolean nobjectsOnly) throws IOException {
        String comments = kwargs.containsKey("comments") ? String.valueOf(kwargs.get("comments")) : "#";
        return AsciiCatalog.read(InputPaths.resolve(kwargs), comments, nobjectsOnly);
    }
}
