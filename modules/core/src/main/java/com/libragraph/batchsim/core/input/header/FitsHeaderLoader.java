package com.libragraph.batchsim.core.input.header;

import com.libragraph.batchsim.core.config.ParamSpec;
import com.libragraph.batchsim.core.input.InputLoader;
import com.libragraph.batchsim.core.input.InputPaths;
import com.libragraph.batchsim.formats.fits.FitsHeaderReader;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Set;

@ApplicationScoped
public class FitsHeaderLoader implements InputLoader<FitsHeader> {

    private static final ParamSpec PARAMS = ParamSpec.builder()
            .required("file_name", String.class)
            .optional("dir", String.class)
            .optional("hdu", Integer.class)
            .build();

    @Override
    public String typeName() {
        return "fits_header";
    }

    @Override
    public Class<FitsHeader> objectType() {
        return FitsHeader.class;
    }

    @Override
    public Set<String> valueTypes() {
        return Set.of("FitsHeader");
    }

    @Override
    public ParamSpec paramSpec() {
        return PARAMS;
    }

    @Override
    public boolean fileScope() {
        return true;
    }

    @Override
    public FitsHeader construct(Map<String, Object> kwargs, boolean nobjectsOnly) throws IOException {
        int hdu = kwargs.containsKey("hdu") ? ((Number) kwargs.get("hdu")).intValue() : 0;
        try {
            Map<String, Object> cards = FitsHeaderReader.read(InputPaths.resolve(kwargs), hdu);
            return new FitsHeader() {
                @Override
                public Object get(String keyword) {
                    return cards.get(keyword);
                }

                @Override
                public Set<String> keywords() {
                    return cards.keySet();
                }
            };
        } catch (UncheckedIOException e) {
            throw new IOException(e.getMessage(), e.getCause());
        }
    }
}
