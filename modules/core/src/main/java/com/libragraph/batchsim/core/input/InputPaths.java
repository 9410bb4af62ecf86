package com.libragraph.batchsim.core.input;

import java.nio.file.Path;
import java.util.Map;

/**
 * Resolves the {@code file_name} / {@code dir} pair common to file-backed loaders.
 */
public final class InputPaths {

    private InputPaths() {
    }

    public static Path resolve(Map<String, Object> kwargs) {
        String fileName = String.valueOf(kwargs.get("file_name"));
        Object dir = kwargs.get("dir");
        return dir == null ? Path.of(fileName) : Path.of(String.valueOf(dir)).resolve(fileName);
    }
}
