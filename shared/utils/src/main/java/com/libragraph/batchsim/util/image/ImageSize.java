package com.libragraph.batchsim.util.image;

/**
 * Pixel dimensions of an image (x = columns, y = rows).
 */
public record ImageSize(int xsize, int ysize) {

    public ImageSize {
        if (xsize <= 0 || ysize <= 0) {
            throw new IllegalArgumentException(
                    "Image size must be positive, got: " + xsize + " x " + ysize);
        }
    }

    public int pixelCount() {
        return xsize * ysize;
    }

    @Override
    public String toString() {
        return xsize + " x " + ysize;
    }
}
