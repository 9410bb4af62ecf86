package com.libragraph.batchsim.formats.fits;

import com.libragraph.batchsim.formats.api.ImageWriter;
import com.libragraph.batchsim.formats.api.WriteException;
import com.libragraph.batchsim.util.image.ImageSize;
import com.libragraph.batchsim.util.image.PixelImage;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes 32-bit float FITS files: single images, multi-extension files and data cubes.
 */
@ApplicationScoped
public class FitsImageWriter implements ImageWriter {

    private static final Logger log = Logger.getLogger(FitsImageWriter.class);

    @Override
    public void writeSingle(PixelImage image, Path path) {
        writeMultiExtension(List.of(image), path);
    }

    @Override
    public void writeMultiExtension(List<PixelImage> images, Path path) {
        if (images.isEmpty()) {
            throw new WriteException("No images to write to " + path);
        }
        try (DataOutputStream out = open(path)) {
            for (int i = 0; i < images.size(); i++) {
                PixelImage image = images.get(i);
                FitsCards header = i == 0
                        ? primaryHeader(image.xsize(), image.ysize())
                        : extensionHeader(image.xsize(), image.ysize());
                if (i == 0 && images.size() > 1) {
                    header.logical("EXTEND", true);
                }
                out.write(header.toBytes());
                writeData(out, List.of(image));
            }
        } catch (IOException e) {
            throw new WriteException("Failed to write " + path, e);
        }
        log.debugf("Wrote %d HDU(s) to %s", images.size(), path);
    }

    @Override
    public void writeCube(List<PixelImage> images, Path path) {
        if (images.isEmpty()) {
            throw new WriteException("No images to write to " + path);
        }
        ImageSize size = images.get(0).size();
        for (PixelImage image : images) {
            if (!image.size().equals(size)) {
                throw new WriteException("Cube images must share one size: "
                        + size + " vs " + image.size() + " for " + path);
            }
        }
        try (DataOutputStream out = open(path)) {
            FitsCards header = primaryHeader(size.xsize(), size.ysize(), images.size());
            out.write(header.toBytes());
            writeData(out, images);
        } catch (IOException e) {
            throw new WriteException("Failed to write " + path, e);
        }
        log.debugf("Wrote %d-plane cube to %s", images.size(), path);
    }

    // mandatory keyword order: SIMPLE/XTENSION, BITPIX, NAXIS, NAXISn, then the rest
    private static FitsCards primaryHeader(int... axes) {
        return axes(new FitsCards().logical("SIMPLE", true), axes);
    }

    private static FitsCards extensionHeader(int... axes) {
        return axes(new FitsCards().string("XTENSION", "IMAGE"), axes)
                .integer("PCOUNT", 0)
                .integer("GCOUNT", 1);
    }

    private static FitsCards axes(FitsCards cards, int... axes) {
        cards.integer("BITPIX", -32).integer("NAXIS", axes.length);
        for (int i = 0; i < axes.length; i++) {
            cards.integer("NAXIS" + (i + 1), axes[i]);
        }
        return cards;
    }

    private static DataOutputStream open(Path path) throws IOException {
        OutputStream raw = Files.newOutputStream(path);
        return new DataOutputStream(new BufferedOutputStream(raw));
    }

    private static void writeData(DataOutputStream out, List<PixelImage> planes) throws IOException {
        long bytes = 0;
        for (PixelImage plane : planes) {
            // DataOutputStream is big-endian, as FITS requires
            for (float v : plane.pixels()) {
                out.writeFloat(v);
            }
            bytes += 4L * plane.pixels().length;
        }
        long padding = FitsCards.paddedLength(bytes) - bytes;
        for (long i = 0; i < padding; i++) {
            out.write(0);
        }
    }
}
