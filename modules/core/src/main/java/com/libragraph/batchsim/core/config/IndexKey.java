package com.libragraph.batchsim.core.config;

/**
 * Which running index drives a sequence-like value.
 */
public enum IndexKey {
    FILE_NUM("file_num"),
    IMAGE_NUM("image_num"),
    OBJ_NUM("obj_num");

    private final String configName;

    IndexKey(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static IndexKey fromConfigName(String name) {
        for (IndexKey k : values()) {
            if (k.configName.equals(name)) return k;
        }
        throw new InvalidParameterException("Invalid index_key: " + name
                + " (expected file_num, image_num or obj_num)");
    }
}
