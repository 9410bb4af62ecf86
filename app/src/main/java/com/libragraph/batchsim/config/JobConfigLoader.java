package com.libragraph.batchsim.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.libragraph.batchsim.core.config.ConfigValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads job files (JSON or YAML, by extension) into mutable config trees and applies
 * {@code key.path=value} overrides from the command line.
 */
@ApplicationScoped
public class JobConfigLoader {

    private static final Logger log = Logger.getLogger(JobConfigLoader.class);

    private static final TypeReference<LinkedHashMap<String, Object>> TREE = new TypeReference<>() {};

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    @Inject
    ObjectMapper json;

    /**
     * Loads {@code file}. When the job sets no {@code root}, it is the file name without
     * its extension.
     *
     * @throws ConfigValidationException if the file is not a mapping
     * @throws UncheckedIOException      if it cannot be read
     */
    public Map<String, Object> load(Path file) {
        ObjectMapper mapper = isYaml(file) ? yaml : json;
        Map<String, Object> config;
        try {
            config = mapper.readValue(file.toFile(), TREE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read job file " + file + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigValidationException("Job file " + file + " is empty");
        }
        if (!config.containsKey("root")) {
            config.put("root", rootName(file));
        }
        log.debugf("Loaded job %s with top-level keys %s", file, config.keySet());
        return config;
    }

    /**
     * Applies overrides such as {@code output.nfiles=4}. Values are parsed as YAML, so
     * {@code 4} is a number and {@code [1, 2]} a list. Missing intermediate fields are
     * created.
     */
    @SuppressWarnings("unchecked")
    public void applyOverrides(Map<String, Object> config, List<String> overrides) {
        for (String override : overrides) {
            int eq = override.indexOf('=');
            if (eq <= 0) {
                throw new ConfigValidationException("Invalid override '" + override + "', expected key=value");
            }
            String[] path = override.substring(0, eq).split("\\.");
            Object value = parseValue(override.substring(eq + 1));

            Map<String, Object> node = config;
            for (int i = 0; i < path.length - 1; i++) {
                Object child = node.get(path[i]);
                if (child == null) {
                    child = new LinkedHashMap<String, Object>();
                    node.put(path[i], child);
                } else if (!(child instanceof Map)) {
                    throw new ConfigValidationException("Cannot override " + override.substring(0, eq)
                            + ": " + path[i] + " is not a field");
                }
                node = (Map<String, Object>) child;
            }
            node.put(path[path.length - 1], value);
            log.infof("Override %s = %s", override.substring(0, eq), value);
        }
    }

    private Object parseValue(String text) {
        if (text.isEmpty()) {
            return "";
        }
        try {
            return yaml.readValue(text, Object.class);
        } catch (IOException e) {
            return text;
        }
    }

    static boolean isYaml(Path file) {
        String name = file.getFileName().toString().toLowerCase();
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    static String rootName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
