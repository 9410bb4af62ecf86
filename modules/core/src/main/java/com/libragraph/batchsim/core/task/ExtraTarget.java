package com.libragraph.batchsim.core.task;

import com.libragraph.batchsim.core.render.LayerKind;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Where one extra layer of a file goes: its own file, or an extension of the main file.
 */
public record ExtraTarget(LayerKind kind, Optional<Path> fileName, Optional<Integer> hdu) {

    public static ExtraTarget toFile(LayerKind kind, Path fileName) {
        return new ExtraTarget(kind, Optional.of(fileName), Optional.empty());
    }

    public static ExtraTarget toHdu(LayerKind kind, int hdu) {
        return new ExtraTarget(kind, Optional.empty(), Optional.of(hdu));
    }
}
