package com.libragraph.batchsim.core.input.dict;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.libragraph.batchsim.core.config.InvalidParameterException;
import com.libragraph.batchsim.core.config.ParamSpec;
import com.libragraph.batchsim.core.input.InputLoader;
import com.libragraph.batchsim.core.input.InputPaths;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads a JSON or YAML document. The format comes from {@code file_type}, else from
 * the file extension.
 */
@ApplicationScoped
public class DictLoader implements InputLoader<InputDict> {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final ParamSpec PARAMS = ParamSpec.builder()
            .required("file_name", String.class)
            .optional("dir", String.class)
            .optional("file_type", String.class)
            .optional("key_split", String.class)
            .build();

    @Override
    public String typeName() {
        return "dict";
    }

    @Override
    public Class<InputDict> objectType() {
        return InputDict.class;
    }

    @Override
    public Set<String> valueTypes() {
        return Set.of("Dict");
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
    public InputDict construct(Map<String, Object> kwargs, boolean nobjectsOnly) throws IOException {
        Path path = InputPaths.resolve(kwargs);
        String fileType = kwargs.containsKey("file_type")
                ? String.valueOf(kwargs.get("file_type")).toLowerCase(Locale.ROOT)
                : fileTypeOf(path);
        ObjectMapper mapper;
        switch (fileType) {
            case "json":
                mapper = JSON;
                break;
            case "yaml":
            case "yml":
                mapper = YAML;
                break;
            default:
                throw new InvalidParameterException("Unsupported dict file_type: " + fileType);
        }
        Map<String, Object> root = mapper.readValue(path.toFile(), MAP_TYPE);
        String keySplit = kwargs.containsKey("key_split") ? String.valueOf(kwargs.get("key_split")) : ".";
        return new FileDict(root, keySplit);
    }

    private static String fileTypeOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            throw new InvalidParameterException("Unable to determine file_type from file_name " + name);
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
