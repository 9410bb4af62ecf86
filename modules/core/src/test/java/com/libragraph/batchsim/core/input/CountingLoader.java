package com.libragraph.batchsim.core.input;

import com.libragraph.batchsim.core.config.ParamSpec;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test loader building {@link Counted} objects and counting constructions.
 */
public class CountingLoader implements InputLoader<CountingLoader.Counted> {

    public interface Counted extends NObjectsAware {
        String label();

        String builtOn();
    }

    private static final ParamSpec PARAMS = ParamSpec.builder()
            .required("label", String.class)
            .optional("n", Integer.class)
            .optional("fail", Boolean.class)
            .build();

    private final String typeName;
    private final Set<String> valueTypes;
    private final boolean hasNObjects;
    private final boolean fileScope;
    public final AtomicInteger constructions = new AtomicInteger();
    public final AtomicInteger countOnlyConstructions = new AtomicInteger();

    public CountingLoader(String typeName, Set<String> valueTypes, boolean hasNObjects, boolean fileScope) {
        this.typeName = typeName;
        this.valueTypes = valueTypes;
        this.hasNObjects = hasNObjects;
        this.fileScope = fileScope;
    }

    public CountingLoader(String typeName) {
        this(typeName, Set.of(), true, false);
    }

    @Override
    public String typeName() {
        return typeName;
    }

    @Override
    public Class<Counted> objectType() {
        return Counted.class;
    }

    @Override
    public Set<String> valueTypes() {
        return valueTypes;
    }

    @Override
    public ParamSpec paramSpec() {
        return PARAMS;
    }

    @Override
    public boolean hasNObjects() {
        return hasNObjects;
    }

    @Override
    public boolean fileScope() {
        return fileScope;
    }

    @Override
    public Counted construct(Map<String, Object> kwargs, boolean nobjectsOnly) throws IOException {
        if (Boolean.TRUE.equals(kwargs.get("fail"))) {
            throw new IOException("cannot read " + kwargs.get("label"));
        }
        if (nobjectsOnly) {
            countOnlyConstructions.incrementAndGet();
        } else {
            constructions.incrementAndGet();
        }
        String label = String.valueOf(kwargs.get("label"));
        int n = kwargs.containsKey("n") ? ((Number) kwargs.get("n")).intValue() : 10;
        String thread = Thread.currentThread().getName();
        return new Counted() {
            @Override
            public String label() {
                return label;
            }

            @Override
            public String builtOn() {
                return thread;
            }

            @Override
            public int getNObjects() {
                return n;
            }
        };
    }
}
