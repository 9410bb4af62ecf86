package com.libragraph.batchsim.core.output;

import com.libragraph.batchsim.core.config.InvalidParameterException;
import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.config.ParamParser;
import com.libragraph.batchsim.core.image.ImageBatchBuilder;
import com.libragraph.batchsim.core.image.ObjectCounter;
import com.libragraph.batchsim.core.input.NObjectsProbe;
import com.libragraph.batchsim.core.render.RenderedLayers;
import com.libragraph.batchsim.core.task.ExtraTarget;
import com.libragraph.batchsim.formats.api.ImageWriter;
import com.libragraph.batchsim.util.image.PixelImage;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shared plumbing for the built-in output types.
 */
public abstract class AbstractOutputType implements OutputType {

    protected final Logger log = Logger.getLogger(getClass());

    protected final ImageBatchBuilder imageBuilder;
    protected final ImageWriter writer;

    protected AbstractOutputType(ImageBatchBuilder imageBuilder, ImageWriter writer) {
        this.imageBuilder = imageBuilder;
        this.writer = writer;
    }

    @Override
    public Set<String> validKeys() {
        return COMMON_KEYS;
    }

    protected void checkOutputKeys(JobContext ctx) {
        ParamParser.checkAllowedKeys(ctx.branchOrCreate("output"), "output.type = " + typeName(), validKeys());
    }

    protected static Set<String> withCommon(String... extra) {
        Set<String> keys = new HashSet<>(COMMON_KEYS);
        keys.addAll(List.of(extra));
        return Set.copyOf(keys);
    }

    /**
     * {@code output.nimages}, defaulting to the first count-capable input's object count
     * when each image holds a single object.
     */
    protected int nimages(JobContext ctx) {
        Map<String, Object> output = ctx.branchOrCreate("output");
        if (!output.containsKey("nimages") && ObjectCounter.SINGLE.equals(ObjectCounter.imageType(ctx))) {
            Optional<NObjectsProbe> probe = ctx.inputs().processInputNObjects(ctx);
            probe.ifPresent(p -> {
                log.debugf("file %d: nimages = %d from input %s", ctx.fileNum(), p.count(), p.typeName());
                output.put("nimages", p.count());
            });
        }
        if (!output.containsKey("nimages")) {
            throw new InvalidParameterException(
                    "Attribute output.nimages is required for output.type = " + typeName());
        }
        int nimages = ctx.parseValue(output, "nimages", Integer.class);
        if (nimages <= 0) {
            throw new InvalidParameterException("output.nimages must be positive, got " + nimages);
        }
        return nimages;
    }

    protected List<Integer> countImages(JobContext ctx, int nimages, int imageNum) {
        List<Integer> nobj = new ArrayList<>(nimages);
        for (int j = 0; j < nimages; j++) {
            nobj.add(ObjectCounter.nobjForImage(ctx, imageNum + j));
        }
        return nobj;
    }

    protected static List<PixelImage> layerOf(List<RenderedLayers> images, ExtraTarget extra) {
        List<PixelImage> layer = new ArrayList<>(images.size());
        for (RenderedLayers r : images) {
            layer.add(r.layer(extra.kind()));
        }
        return layer;
    }

    protected static List<Path> extraFiles(List<ExtraTarget> extras) {
        List<Path> files = new ArrayList<>();
        for (ExtraTarget e : extras) {
            e.fileName().ifPresent(files::add);
        }
        return files;
    }
}
