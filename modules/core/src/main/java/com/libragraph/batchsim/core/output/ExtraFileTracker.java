package com.libragraph.batchsim.core.output;

import com.libragraph.batchsim.core.render.LayerKind;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * Remembers the last file name used for each extra layer, so consecutive files that
 * share an extra file only write it once. Used on the controlling thread only.
 */
public final class ExtraFileTracker {

    private final Map<LayerKind, Path> last = new EnumMap<>(LayerKind.class);

    /**
     * @return true if {@code file} differs from the previous name for this layer and
     *         should be written
     */
    public boolean claim(LayerKind kind, Path file) {
        Path previous = last.put(kind, file);
        return !file.equals(previous);
    }
}
