package com.libragraph.batchsim.core.render;

import com.libragraph.batchsim.core.config.JobContext;

/**
 * Draws the pixels of one image. Implementations must honor the request's forced
 * size and return every requested layer.
 */
public interface ImageRenderer {

    RenderedLayers render(JobContext ctx, ImageRequest request);
}
