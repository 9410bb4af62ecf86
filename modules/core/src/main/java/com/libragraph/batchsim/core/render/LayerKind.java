package com.libragraph.batchsim.core.render;

import java.util.List;

/**
 * The images drawn for one output image: the main image and its optional extras.
 */
public enum LayerKind {
    MAIN(null),
    PSF("psf"),
    WEIGHT("weight"),
    BADPIX("badpix");

    private final String configKey;

    LayerKind(String configKey) {
        this.configKey = configKey;
    }

    /** Key of the extra in the {@code output} branch; {@code null} for the main image. */
    public String configKey() {
        return configKey;
    }

    public static List<LayerKind> extras() {
        return List.of(PSF, WEIGHT, BADPIX);
    }
}
