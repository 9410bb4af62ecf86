package com.libragraph.batchsim.core.image;

import com.libragraph.batchsim.core.RecordingRenderer;
import com.libragraph.batchsim.core.TestJobs;
import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.render.ImageRenderer;
import com.libragraph.batchsim.core.render.LayerKind;
import com.libragraph.batchsim.core.render.RenderedLayers;
import com.libragraph.batchsim.core.task.JobFailedException;
import com.libragraph.batchsim.util.image.ImageSize;
import com.libragraph.batchsim.util.image.PixelImage;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class ImageBatchBuilderTest {

    private static final String VARYING = "{'image': {'type': 'Scattered', 'xsize': 64, 'ysize': 64,"
            + " 'nobjects': {'type': 'Sequence', 'first': 2, 'index_key': 'image_num'}}}";

    @Test
    void shouldAssignSameObjectRangesForAnyNproc() {
        var serial = new RecordingRenderer();
        var parallel = new RecordingRenderer();

        new ImageBatchBuilder(serial).buildImages(5, TestJobs.context(VARYING), 1, 10, 100, Set.of());
        new ImageBatchBuilder(parallel).buildImages(5, TestJobs.context(VARYING), 3, 10, 100, Set.of());

        assertThat(serial.drawn()).extracting(RecordingRenderer.Drawn::objNum)
                .containsExactly(100, 112, 125, 139, 154);
        assertThat(parallel.drawn()).extracting(RecordingRenderer.Drawn::objNum)
                .containsExactlyElementsOf(serial.drawn().stream().map(RecordingRenderer.Drawn::objNum).toList());
        assertThat(parallel.drawn()).extracting(RecordingRenderer.Drawn::thread)
                .allMatch(t -> t.startsWith("image-worker-"));
    }

    @Test
    void shouldReturnImagesInOrderWithRequestedLayers() {
        var builder = new ImageBatchBuilder(new RecordingRenderer());

        var images = builder.buildImages(3, TestJobs.context(VARYING), 2, 0, 0, Set.of(LayerKind.WEIGHT));

        assertThat(images).extracting(RenderedLayers::imageNum).containsExactly(0, 1, 2);
        assertThat(images).allMatch(r -> r.has(LayerKind.MAIN) && r.has(LayerKind.WEIGHT));
    }

    @Test
    void shouldReduceNprocToImageCount() {
        var renderer = new RecordingRenderer();

        new ImageBatchBuilder(renderer).buildImages(2, TestJobs.context(VARYING), 8, 0, 0, Set.of());

        assertThat(renderer.drawn()).hasSize(2);
    }

    @Test
    void shouldRejectRendererIgnoringForcedSize() {
        ImageRenderer stubborn = (ctx, request) -> new RenderedLayers(request.imageNum(),
                Map.of(LayerKind.MAIN, PixelImage.blank(10, 10)));
        JobContext ctx = TestJobs.context("{}");
        ctx.forceImageSize(new ImageSize(20, 20));

        assertThatThrownBy(() -> new ImageBatchBuilder(stubborn).buildImage(ctx, 0, 0, Set.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("requires 20 x 20");
    }

    @Test
    void shouldReportFailedImages() {
        ImageRenderer flaky = (ctx, request) -> {
            if (request.imageNum() == 1) throw new IllegalArgumentException("bad image");
            return new RenderedLayers(request.imageNum(), Map.of(LayerKind.MAIN, PixelImage.blank(4, 4)));
        };

        assertThatThrownBy(() -> new ImageBatchBuilder(flaky).buildImages(3, TestJobs.context("{}"), 2, 0, 0, Set.of()))
                .isInstanceOf(JobFailedException.class)
                .hasMessageContaining("1 of 3 images failed")
                .hasMessageContaining("bad image");
    }
}
