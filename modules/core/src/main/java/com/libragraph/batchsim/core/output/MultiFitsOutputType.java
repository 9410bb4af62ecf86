package com.libragraph.batchsim.core.output;

import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.image.ImageBatchBuilder;
import com.libragraph.batchsim.core.render.RenderedLayers;
import com.libragraph.batchsim.core.task.ExtraTarget;
import com.libragraph.batchsim.core.task.FileOutcome;
import com.libragraph.batchsim.core.task.FileTask;
import com.libragraph.batchsim.formats.api.ImageWriter;
import com.libragraph.batchsim.formats.api.OutputCapabilities;
import com.libragraph.batchsim.util.image.PixelImage;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * {@code nimages} images per file, one per extension.
 */
public class MultiFitsOutputType extends AbstractOutputType {

    public static final String NAME = "MultiFits";

    private static final Set<String> KEYS = withCommon("nimages");

    public MultiFitsOutputType(ImageBatchBuilder imageBuilder, ImageWriter writer) {
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
        List<RenderedLayers> images = imageBuilder.buildImages(nimages, ctx, task.imageNproc(),
                task.imageNum(), task.objNum(), task.layers());

        List<PixelImage> mains = new ArrayList<>(nimages);
        for (RenderedLayers r : images) {
            mains.add(r.main());
        }
        writer.writeMultiExtension(mains, task.fileName());
        for (ExtraTarget extra : task.extras()) {
            extra.fileName().ifPresent(f -> writer.writeMultiExtension(layerOf(images, extra), f));
        }
        return new FileOutcome(task.fileName(), nimages, extraFiles(task.extras()));
    }
}
