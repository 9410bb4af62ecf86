package com.libragraph.batchsim.core.output;

import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.image.ImageBatchBuilder;
import com.libragraph.batchsim.core.image.ObjectCounter;
import com.libragraph.batchsim.core.render.RenderedLayers;
import com.libragraph.batchsim.core.task.ExtraTarget;
import com.libragraph.batchsim.core.task.FileOutcome;
import com.libragraph.batchsim.core.task.FileTask;
import com.libragraph.batchsim.formats.api.ImageWriter;
import com.libragraph.batchsim.formats.api.OutputCapabilities;
import com.libragraph.batchsim.util.image.PixelImage;

import java.util.List;

/**
 * One image per file. Extras go to their own file or to an extension of this one.
 */
public class FitsOutputType extends AbstractOutputType {

    public static final String NAME = "Fits";

    public FitsOutputType(ImageBatchBuilder imageBuilder, ImageWriter writer) {
        super(imageBuilder, writer);
    }

    @Override
    public String typeName() {
        return NAME;
    }

    @Override
    public OutputCapabilities capabilities() {
        return OutputCapabilities.singleImage();
    }

    @Override
    public List<Integer> nobjPerFile(JobContext ctx, int fileNum, int imageNum) {
        checkOutputKeys(ctx);
        return List.of(ObjectCounter.nobjForImage(ctx, imageNum));
    }

    @Override
    public FileOutcome buildFile(FileTask task, JobContext ctx) {
        ExtensionLayout layout = new ExtensionLayout();
        for (ExtraTarget extra : task.extras()) {
            extra.hdu().ifPresent(h -> layout.assign(h, extra.kind()));
        }
        layout.validate();

        RenderedLayers rendered = imageBuilder.buildImage(ctx, task.imageNum(), task.objNum(), task.layers());

        List<PixelImage> hdus = layout.collect(rendered);
        if (hdus.size() == 1) {
            writer.writeSingle(rendered.main(), task.fileName());
        } else {
            writer.writeMultiExtension(hdus, task.fileName());
        }
        for (ExtraTarget extra : task.extras()) {
            extra.fileName().ifPresent(f -> {
                writer.writeSingle(rendered.layer(extra.kind()), f);
                log.debugf("file %d: Wrote %s image to %s", task.fileNum(), extra.kind(), f);
            });
        }
        return new FileOutcome(task.fileName(), 1, extraFiles(task.extras()));
    }
}
