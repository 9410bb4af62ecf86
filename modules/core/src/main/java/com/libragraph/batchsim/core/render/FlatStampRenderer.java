package com.libragraph.batchsim.core.render;

import com.libragraph.batchsim.core.config.InvalidParameterException;
import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.config.ParamParser;
import com.libragraph.batchsim.core.image.ObjectCounter;
import com.libragraph.batchsim.util.image.ImageSize;
import com.libragraph.batchsim.util.image.PixelImage;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Draws each object as a flat square stamp of constant surface brightness. The layout
 * follows {@code image.type}: one stamp filling a Single image, a grid for Tiled, rows
 * of stamps for Scattered.
 * <p>
 * Reads {@code gal.flux} and {@code psf.flux} per object (default 1). Weight images are
 * uniform 1, bad pixel masks are all 0.
 */
@ApplicationScoped
public class FlatStampRenderer implements ImageRenderer {

    private static final Logger log = Logger.getLogger(FlatStampRenderer.class);

    static final int DEFAULT_STAMP_SIZE = 32;

    private static final Set<String> IMAGE_KEYS = Set.of(
            "type", "xsize", "ysize", "stamp_size", "nx_tiles", "ny_tiles", "nobjects");

    @Override
    public RenderedLayers render(JobContext ctx, ImageRequest request) {
        Map<String, Object> image = ctx.branchOrCreate("image");
        ParamParser.checkAllowedKeys(image, "image", IMAGE_KEYS);
        String type = ObjectCounter.imageType(ctx);
        int stamp = ctx.parseValue(image, "stamp_size", Integer.class, DEFAULT_STAMP_SIZE);

        ImageSize size = request.forcedSize().orElseGet(() -> naturalSize(ctx, image, type, stamp));
        Map<LayerKind, PixelImage> layers = new EnumMap<>(LayerKind.class);
        for (LayerKind kind : request.layers()) {
            layers.put(kind, PixelImage.blank(size));
        }
        if (request.wants(LayerKind.WEIGHT)) {
            layers.get(LayerKind.WEIGHT).fill(1f);
        }

        int cols = Math.max(1, size.xsize() / Math.min(stamp, size.xsize()));
        for (int k = 0; k < request.nobjects(); k++) {
            ctx.startObject(request.objNum() + k);
            int w = ObjectCounter.SINGLE.equals(type) ? size.xsize() : stamp;
            int h = ObjectCounter.SINGLE.equals(type) ? size.ysize() : stamp;
            int x0 = (k % cols) * w;
            int y0 = ((k / cols) * h) % Math.max(1, size.ysize());

            double flux = ctx.parseValue(ctx.branch("gal"), "flux", Double.class, 1.0);
            layers.get(LayerKind.MAIN).fillRect(x0, y0, w, h, (float) (flux / ((double) w * h)));
            if (request.wants(LayerKind.PSF)) {
                double psfFlux = ctx.parseValue(ctx.branch("psf"), "flux", Double.class, 1.0);
                layers.get(LayerKind.PSF).fillRect(x0, y0, w, h, (float) (psfFlux / ((double) w * h)));
            }
        }
        log.debugf("image %d: drew %d objects from obj_num %d on %s", request.imageNum(),
                request.nobjects(), request.objNum(), size);
        return new RenderedLayers(request.imageNum(), layers);
    }

    private static ImageSize naturalSize(JobContext ctx, Map<String, Object> image, String type, int stamp) {
        switch (type) {
            case ObjectCounter.TILED: {
                int nx = ctx.parseValue(image, "nx_tiles", Integer.class);
                int ny = ctx.parseValue(image, "ny_tiles", Integer.class);
                return new ImageSize(nx * stamp, ny * stamp);
            }
            case ObjectCounter.SCATTERED: {
                for (String key : List.of("xsize", "ysize")) {
                    if (!image.containsKey(key)) {
                        throw new InvalidParameterException("Attribute image." + key
                                + " is required for image.type = Scattered");
                    }
                }
                return new ImageSize(ctx.parseValue(image, "xsize", Integer.class),
                        ctx.parseValue(image, "ysize", Integer.class));
            }
            default: {
                int xsize = ctx.parseValue(image, "xsize", Integer.class, stamp);
                int ysize = ctx.parseValue(image, "ysize", Integer.class, xsize);
                return new ImageSize(xsize, ysize);
            }
        }
    }
}
