package com.libragraph.batchsim.core.render;

import com.libragraph.batchsim.util.image.PixelImage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The images drawn for one request.
 */
public final class RenderedLayers {

    private final int imageNum;
    private final Map<LayerKind, PixelImage> layers;

    public RenderedLayers(int imageNum, Map<LayerKind, PixelImage> layers) {
        if (!layers.containsKey(LayerKind.MAIN)) {
            throw new IllegalArgumentException("Image " + imageNum + " has no main layer");
        }
        this.imageNum = imageNum;
        this.layers = Collections.unmodifiableMap(new EnumMap<>(layers));
    }

    public int imageNum() {
        return imageNum;
    }

    public PixelImage main() {
        return layers.get(LayerKind.MAIN);
    }

    public PixelImage layer(LayerKind kind) {
        PixelImage image = layers.get(kind);
        if (image == null) {
            throw new IllegalStateException("Image " + imageNum + " has no " + kind + " layer");
        }
        return image;
    }

    public boolean has(LayerKind kind) {
        return layers.containsKey(kind);
    }

    public Map<LayerKind, PixelImage> layers() {
        return layers;
    }
}
