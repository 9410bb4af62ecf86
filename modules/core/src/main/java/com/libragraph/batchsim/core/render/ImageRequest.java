package com.libragraph.batchsim.core.render;

import com.libragraph.batchsim.util.image.ImageSize;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * What to draw for one image.
 *
 * @param objNum     index of the first object on this image, across the whole job
 * @param layers     always contains {@link LayerKind#MAIN}
 * @param forcedSize size every layer must have, when set
 */
public record ImageRequest(
        int imageNum,
        int objNum,
        int nobjects,
        Set<LayerKind> layers,
        Optional<ImageSize> forcedSize
) {
    public ImageRequest {
        EnumSet<LayerKind> copy = EnumSet.of(LayerKind.MAIN);
        copy.addAll(layers);
        layers = copy;
    }

    public boolean wants(LayerKind kind) {
        return layers.contains(kind);
    }
}
