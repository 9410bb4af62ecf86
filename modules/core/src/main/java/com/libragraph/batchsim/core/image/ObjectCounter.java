package com.libragraph.batchsim.core.image;

import com.libragraph.batchsim.core.config.ConfigValidationException;
import com.libragraph.batchsim.core.config.InvalidParameterException;
import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.input.NObjectsProbe;

import java.util.Map;
import java.util.Set;

/**
 * Number of objects drawn on one image, from {@code image.type}.
 * <ul>
 *   <li>{@code Single}: 1</li>
 *   <li>{@code Tiled}: {@code nx_tiles * ny_tiles}</li>
 *   <li>{@code Scattered}: {@code nobjects}, else the count of the first count-capable input</li>
 * </ul>
 */
public final class ObjectCounter {

    public static final String SINGLE = "Single";
    public static final String TILED = "Tiled";
    public static final String SCATTERED = "Scattered";

    private static final Set<String> IMAGE_TYPES = Set.of(SINGLE, TILED, SCATTERED);

    private ObjectCounter() {
    }

    public static String imageType(JobContext ctx) {
        Map<String, Object> image = ctx.branch("image");
        String type = ctx.parseValue(image, "type", String.class, SINGLE);
        if (!IMAGE_TYPES.contains(type)) {
            throw new ConfigValidationException("Invalid image.type=" + type
                    + " (expected one of " + IMAGE_TYPES + ")");
        }
        return type;
    }

    /**
     * @throws com.libragraph.batchsim.core.input.InputNotAvailableException if the count
     *         depends on an input that is not built yet
     */
    public static int nobjForImage(JobContext ctx, int imageNum) {
        ctx.startImage(imageNum);
        String type = imageType(ctx);
        Map<String, Object> image = ctx.branch("image");
        switch (type) {
            case TILED:
                return ctx.parseValue(image, "nx_tiles", Integer.class)
                        * ctx.parseValue(image, "ny_tiles", Integer.class);
            case SCATTERED:
                if (image.containsKey("nobjects")) {
                    return ctx.parseValue(image, "nobjects", Integer.class);
                }
                NObjectsProbe probe = ctx.inputs().processInputNObjects(ctx)
                        .orElseThrow(() -> new InvalidParameterException(
                                "Attribute nobjects is required for image.type = Scattered"));
                return probe.count();
            default:
                return 1;
        }
    }
}
