package com.libragraph.batchsim.util.image;

import java.util.Arrays;
import java.util.Objects;

/**
 * Row-major 32-bit float image. This is the unit handed from the renderer to the writer.
 *
 * <p>Not thread-safe; a rendered image is owned by the task that produced it.
 */
public final class PixelImage {

    private final ImageSize size;
    private final float[] pixels;

    private PixelImage(ImageSize size, float[] pixels) {
        this.size = size;
        this.pixels = pixels;
    }

    /**
     * Creates a zero-filled image.
     */
    public static PixelImage blank(ImageSize size) {
        Objects.requireNonNull(size, "size cannot be null");
        return new PixelImage(size, new float[size.pixelCount()]);
    }

    public static PixelImage blank(int xsize, int ysize) {
        return blank(new ImageSize(xsize, ysize));
    }

    /**
     * Wraps existing pixel data without copying.
     *
     * @throws IllegalArgumentException if the array length does not match the size
     */
    public static PixelImage wrap(ImageSize size, float[] pixels) {
        Objects.requireNonNull(size, "size cannot be null");
        Objects.requireNonNull(pixels, "pixels cannot be null");
        if (pixels.length != size.pixelCount()) {
            throw new IllegalArgumentException("Pixel array length " + pixels.length
                    + " does not match size " + size);
        }
        return new PixelImage(size, pixels);
    }

    public ImageSize size() {
        return size;
    }

    public int xsize() {
        return size.xsize();
    }

    public int ysize() {
        return size.ysize();
    }

    public float get(int x, int y) {
        return pixels[index(x, y)];
    }

    public void set(int x, int y, float value) {
        pixels[index(x, y)] = value;
    }

    public void fill(float value) {
        Arrays.fill(pixels, value);
    }

    /**
     * Fills the rectangle {@code [x0, x0+w) x [y0, y0+h)}, clipped to the image bounds.
     */
    public void fillRect(int x0, int y0, int w, int h, float value) {
        int x1 = Math.min(x0 + w, size.xsize());
        int y1 = Math.min(y0 + h, size.ysize());
        for (int y = Math.max(y0, 0); y < y1; y++) {
            int row = y * size.xsize();
            for (int x = Math.max(x0, 0); x < x1; x++) {
                pixels[row + x] = value;
            }
        }
    }

    /** Direct access to the backing array, row-major. */
    public float[] pixels() {
        return pixels;
    }

    private int index(int x, int y) {
        if (x < 0 || x >= size.xsize() || y < 0 || y >= size.ysize()) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside " + size);
        }
        return y * size.xsize() + x;
    }
}
