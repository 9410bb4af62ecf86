package com.libragraph.batchsim.core.value;

import com.libragraph.batchsim.core.config.IndexKey;

import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Memo of the last value produced by each value config node, keyed on node identity.
 * A safe entry is reused for any index, an unsafe one only while the node's index is
 * unchanged. Not thread-safe: each
 * {@link com.libragraph.batchsim.core.config.JobContext} owns one.
 */
public final class CurrentValueCache {

    public record Entry(String valueType, IndexKey indexKey, int index, Object value, boolean safe) {
    }

    private final Map<Map<String, Object>, Entry> entries = new IdentityHashMap<>();

    public Optional<Entry> lookup(Map<String, Object> node, IndexKey indexKey, int index) {
        Entry e = entries.get(node);
        if (e == null) {
            return Optional.empty();
        }
        if (!e.safe() && (e.indexKey() != indexKey || e.index() != index)) {
            return Optional.empty();
        }
        return Optional.of(e);
    }

    public void store(Map<String, Object> node, Entry entry) {
        entries.put(node, entry);
    }

    public int remove(Set<String> valueTypes) {
        int removed = 0;
        Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (valueTypes.contains(it.next().valueType())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public boolean contains(Map<String, Object> node) {
        return entries.containsKey(node);
    }

    public int size() {
        return entries.size();
    }
}
