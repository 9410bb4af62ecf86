package com.libragraph.batchsim.core.output;

import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.image.ImageBatchBuilder;
import com.libragraph.batchsim.core.render.RenderedLayers;
import com.libragraph.batchsim.core.task.ExtraTarget;
import com.libragraph.batchsim.core.task.FileOutcome;
import com.libragraph.batchsim.core.task.FileTask;
import com.libragraph.batchsim.formats.api.ImageWriter;
import com.libragraph.batchsim.formats.api.OutputCapabilities;
import com.libragraph.batchsim.util.image.ImageSize;
import com.libragraph.batchsim.util.image.PixelImage;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * {@code nimages} same-sized images stacked into one 3-D array. The first image is
 * drawn alone; its size is then imposed on the rest.
 */
public class DataCubeOutputType extends AbstractOutputType {

    public static final String NAME = "DataCube";

    private static final Set<String> KEYS = withCommon("nimages");

    public DataCubeOutputType(ImageBatchBuilder imageBuilder, ImageWriter writer) {
        super(imageBuilder, writer);
    }

    @Override
    public String typeName() {
        return NAME;
    }

    @Override
    public OutputCapabilities capabilities() {
        return OutputCapabilities.multiImage();
    }

    @Override
    public Set<String> validKeys() {
        return KEYS;
    }

    @Override
    public List<Integer> nobjPerFile(JobContext ctx, int fileNum, int imageNum) {
        checkOutputKeys(ctx);
        return countImages(ctx, nimages(ctx), imageNum);
    }

    @Override
    public FileOutcome buildFile(FileTask task, JobContext ctx) {
        int nimages = task.nimages();
        List<RenderedLayers> images = new ArrayList<>(nimages);

        RenderedLayers first = imageBuilder.buildImage(ctx.copyForTask(), task.imageNum(), task.objNum(),
                task.layers());
        images.add(first);
        ImageSize size = first.main().size();
        ctx.forceImageSize(size);
        log.debugf("file %d: cube image size fixed to %s", task.fileNum(), size);

        if (nimages > 1) {
            int nproc = Math.min(task.imageNproc(), nimages - 1);
            images.addAll(imageBuilder.buildImages(nimages - 1, ctx, nproc, task.imageNum() + 1,
                    task.objNum() + task.nobjPerImage().get(0), task.layers()));
        }

        List<PixelImage> mains = new ArrayList<>(nimages);
        for (RenderedLayers r : images) {
            mains.add(r.main());
        }
        writer.writeCube(mains, task.fileName());
        for (ExtraTarget extra : task.extras()) {
            extra.fileName().ifPresent(f -> writer.writeCube(layerOf(images, extra), f));
        }
        return new FileOutcome(task.fileName(), nimages, extraFiles(task.extras()));
    }
}
