package com.libragraph.batchsim.formats.api;

/**
 * Describes what an output file type can hold and where its extra layers may go.
 *
 * @param canDoMultiple  one file holds several images, so a single-file job can still be
 *                       parallelized at the image level
 * @param extraFileName  extra layers (psf, weight, badpix) may be written to their own file
 * @param extraHdu       extra layers may be written to an extension of the main file
 */
public record OutputCapabilities(
        boolean canDoMultiple,
        boolean extraFileName,
        boolean extraHdu
) {

    /** One image per file; extras to a separate file or to an HDU of the same file. */
    public static OutputCapabilities singleImage() {
        return new OutputCapabilities(false, true, true);
    }

    /** Many images per file; extras only to separate files of the same shape. */
    public static OutputCapabilities multiImage() {
        return new OutputCapabilities(true, true, false);
    }
}
