package com.libragraph.batchsim.core.task;

import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.render.LayerKind;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Everything needed to build one output file independently of the others.
 *
 * @param imageNum     index of the file's first image across the job
 * @param objNum       index of the file's first object across the job
 * @param nobjPerImage object count of each image in the file
 * @param context      private config copy for this file
 * @param extras       extra layers to write; duplicates of the previous file are left out
 * @param imageNproc   workers for image-level parallelism inside the file
 */
public record FileTask(
        int fileNum,
        Path fileName,
        int imageNum,
        int objNum,
        List<Integer> nobjPerImage,
        JobContext context,
        List<ExtraTarget> extras,
        int imageNproc
) {
    public FileTask {
        nobjPerImage = List.copyOf(nobjPerImage);
        extras = List.copyOf(extras);
    }

    public int nimages() {
        return nobjPerImage.size();
    }

    /** Main layer plus every extra layer requested. */
    public Set<LayerKind> layers() {
        EnumSet<LayerKind> layers = EnumSet.of(LayerKind.MAIN);
        for (ExtraTarget e : extras) {
            layers.add(e.kind());
        }
        return layers;
    }
}
