package com.libragraph.batchsim.core.sequence;

import com.libragraph.batchsim.core.config.JobContext;

import java.util.List;

/**
 * Index assignment for one output file.
 *
 * @param imageNum     first image index of the file
 * @param objNum       first object index of the file
 * @param nobjPerImage object count of each image
 * @param context      the file's private context, already holding derived settings
 */
public record FilePlan(int fileNum, int imageNum, int objNum, List<Integer> nobjPerImage, JobContext context) {

    public FilePlan {
        nobjPerImage = List.copyOf(nobjPerImage);
    }

    public int nimages() {
        return nobjPerImage.size();
    }

    public int nobjects() {
        int n = 0;
        for (int c : nobjPerImage) n += c;
        return n;
    }
}
