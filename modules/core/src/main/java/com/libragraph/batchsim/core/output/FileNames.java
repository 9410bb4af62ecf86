package com.libragraph.batchsim.core.output;

import java.util.Map;

/**
 * File name defaults applied to config before it is parsed.
 */
public final class FileNames {

    private FileNames() {
    }

    /** Gives a {@code NumberedFile} file name the extension {@code ext} unless it has one. */
    @SuppressWarnings("unchecked")
    public static void setDefaultExt(Map<String, Object> field, String ext) {
        Object fileName = field.get("file_name");
        if (fileName instanceof Map<?, ?> m && "NumberedFile".equals(m.get("type")) && !m.containsKey("ext")) {
            ((Map<String, Object>) m).put("ext", ext);
        }
    }
}
