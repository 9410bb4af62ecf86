package com.libragraph.batchsim.core.input.dict;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

final class FileDict implements InputDict {

    private final Map<String, Object> root;
    private final String keySplit;

    FileDict(Map<String, Object> root, String keySplit) {
        this.root = root;
        this.keySplit = keySplit;
    }

    @Override
    public Object get(String key) {
        Object current = root;
        String[] parts = keySplit.isEmpty() ? new String[]{key} : key.split(Pattern.quote(keySplit));
        for (String part : parts) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(part)) {
                return null;
            }
            current = map.get(part);
        }
        return current;
    }

    @Override
    public boolean containsKey(String key) {
        return get(key) != null;
    }

    @Override
    public Set<String> topLevelKeys() {
        return root.keySet();
    }
}
