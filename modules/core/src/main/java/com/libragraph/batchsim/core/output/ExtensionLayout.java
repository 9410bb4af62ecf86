package com.libragraph.batchsim.core.output;

import com.libragraph.batchsim.core.render.LayerKind;
import com.libragraph.batchsim.core.render.RenderedLayers;
import com.libragraph.batchsim.util.image.PixelImage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Assignment of layers to extension numbers in a single-image file. Extension 0 always
 * holds the main image; extras must fill 1, 2, ... without gaps.
 */
public final class ExtensionLayout {

    private final Map<Integer, LayerKind> hdus = new TreeMap<>();

    public ExtensionLayout() {
        hdus.put(0, LayerKind.MAIN);
    }

    public static ExtensionLayout of(Map<Integer, LayerKind> extras) {
        ExtensionLayout layout = new ExtensionLayout();
        new TreeMap<>(extras).forEach(layout::assign);
        layout.validate();
        return layout;
    }

    /**
     * @throws InvalidExtensionLayoutException if {@code hdu} is not positive or already taken
     */
    public ExtensionLayout assign(int hdu, LayerKind kind) {
        if (hdu <= 0 || hdus.containsKey(hdu)) {
            throw new InvalidExtensionLayoutException(
                    kind.configKey() + " hdu = " + hdu + " is invalid or a duplicate.");
        }
        hdus.put(hdu, kind);
        return this;
    }

    /**
     * @throws InvalidExtensionLayoutException if the numbers are not contiguous from 0
     */
    public void validate() {
        for (int h = 0; h < hdus.size(); h++) {
            if (!hdus.containsKey(h)) {
                throw new InvalidExtensionLayoutException(
                        "Image for hdu " + h + " not found. Cannot skip hdus.");
            }
        }
    }

    public int size() {
        return hdus.size();
    }

    /** Layers in extension order. */
    public List<LayerKind> order() {
        return new ArrayList<>(hdus.values());
    }

    public List<PixelImage> collect(RenderedLayers rendered) {
        List<PixelImage> images = new ArrayList<>(hdus.size());
        for (LayerKind kind : hdus.values()) {
            images.add(rendered.layer(kind));
        }
        return images;
    }
}
