package com.libragraph.batchsim.formats.api;

import com.libragraph.batchsim.util.image.PixelImage;

import java.nio.file.Path;
import java.util.List;

/**
 * Serializes rendered pixel layers to disk.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 *
 * <p>Callers never retry a failed write.
 */
public interface ImageWriter {

    /**
     * Writes one image as the primary HDU of a new file.
     *
     * @throws WriteException on I/O failure
     */
    void writeSingle(PixelImage image, Path path);

    /**
     * Writes images as consecutive HDUs; the first is the primary.
     *
     * @throws WriteException on I/O failure
     */
    void writeMultiExtension(List<PixelImage> images, Path path);

    /**
     * Writes same-sized images as one 3-D cube.
     *
     * @throws WriteException on I/O failure, or if the images differ in size
     */
    void writeCube(List<PixelImage> images, Path path);
}
