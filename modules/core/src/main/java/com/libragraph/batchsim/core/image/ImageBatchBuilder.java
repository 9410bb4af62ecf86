package com.libragraph.batchsim.core.image;

import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.input.InputObjectCache;
import com.libragraph.batchsim.core.render.ImageRenderer;
import com.libragraph.batchsim.core.render.ImageRequest;
import com.libragraph.batchsim.core.render.LayerKind;
import com.libragraph.batchsim.core.render.RenderedLayers;
import com.libragraph.batchsim.core.task.JobFailedException;
import com.libragraph.batchsim.core.task.TaskResult;
import com.libragraph.batchsim.core.task.WorkerPool;
import com.libragraph.batchsim.util.image.ImageSize;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Draws the images of one file, optionally spread over worker threads.
 */
public class ImageBatchBuilder {

    private static final Logger log = Logger.getLogger(ImageBatchBuilder.class);

    private final ImageRenderer renderer;

    public ImageBatchBuilder(ImageRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * Draws one image starting at object {@code objNum}.
     *
     * @throws IllegalStateException if the renderer ignored a forced image size
     */
    public RenderedLayers buildImage(JobContext ctx, int imageNum, int objNum, Set<LayerKind> layers) {
        int nobjects = ObjectCounter.nobjForImage(ctx, imageNum);
        ctx.inputs().setupForImage(ctx);
        ImageRequest request = new ImageRequest(imageNum, objNum, nobjects, layers, ctx.forcedImageSize());
        RenderedLayers rendered = renderer.render(ctx, request);

        for (LayerKind kind : request.layers()) {
            rendered.layer(kind);
        }
        if (request.forcedSize().isPresent()) {
            ImageSize want = request.forcedSize().get();
            for (LayerKind kind : request.layers()) {
                ImageSize got = rendered.layer(kind).size();
                if (!got.equals(want)) {
                    throw new IllegalStateException("image " + imageNum + ": " + kind + " layer is "
                            + got + " but this file requires " + want);
                }
            }
        }
        return rendered;
    }

    /**
     * Draws {@code nimages} consecutive images. Object start indices are fixed before
     * any drawing starts, so results do not depend on {@code nproc}.
     *
     * @return images in image order
     */
    public List<RenderedLayers> buildImages(int nimages, JobContext ctx, int nproc,
                                            int imageNum, int objNum, Set<LayerKind> layers) {
        List<ImageTask> tasks = new ArrayList<>(nimages);
        int obj = objNum;
        for (int j = 0; j < nimages; j++) {
            JobContext copy = ctx.copyForTask();
            tasks.add(new ImageTask(imageNum + j, obj, copy));
            obj += ObjectCounter.nobjForImage(copy, imageNum + j);
        }

        if (nproc > nimages) {
            log.warnf("Trying to use more processes than images: image.nproc=%d, nimages=%d. "
                    + "Reducing nproc to %d.", nproc, nimages, nimages);
            nproc = nimages;
        }

        List<RenderedLayers> images = new ArrayList<>(nimages);
        if (nproc <= 1) {
            for (ImageTask task : tasks) {
                images.add(buildImage(task.context(), task.imageNum(), task.objNum(), layers));
            }
            return images;
        }

        InputObjectCache shared = ctx.inputs();
        WorkerPool<ImageTask, RenderedLayers> pool = new WorkerPool<>("image-worker", nproc, () -> {
            InputObjectCache view = shared.snapshot();
            return (task, worker) -> {
                log.debugf("%s: start image %d, obj_num %d", worker, task.imageNum(), task.objNum());
                return buildImage(task.context().withInputs(view), task.imageNum(), task.objNum(), layers);
            };
        });
        List<TaskResult<RenderedLayers>> results = pool.runAll(tasks);
        List<TaskResult<?>> failures = new ArrayList<>();
        for (TaskResult<RenderedLayers> r : results) {
            if (r.isDone()) {
                images.add(r.value());
            } else {
                failures.add(r);
            }
        }
        if (!failures.isEmpty()) {
            TaskResult<?> first = failures.get(0);
            throw new JobFailedException(failures.size() + " of " + nimages + " images failed, first: "
                    + first.error().summary(), failures, first.error().cause());
        }
        return images;
    }
}
