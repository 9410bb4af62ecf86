package com.libragraph.batchsim.core.output;

import com.libragraph.batchsim.core.RecordingImageWriter;
import com.libragraph.batchsim.core.RecordingRenderer;
import com.libragraph.batchsim.core.TestJobs;
import com.libragraph.batchsim.core.config.InvalidParameterException;
import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.image.ImageBatchBuilder;
import com.libragraph.batchsim.core.render.LayerKind;
import com.libragraph.batchsim.core.task.ExtraTarget;
import com.libragraph.batchsim.core.task.FileTask;
import com.libragraph.batchsim.util.image.ImageSize;
import com.libragraph.batchsim.util.image.PixelImage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DataCubeOutputTypeTest {

    private static final String GROWING_IMAGES = "{'image': {'type': 'Single', 'xsize': "
            + "{'type': 'Sequence', 'first': 50, 'step': 10, 'index_key': 'image_num'}},"
            + " 'output': {'type': 'DataCube', 'nimages': 4}}";

    private final RecordingImageWriter writer = new RecordingImageWriter();
    private final RecordingRenderer renderer = new RecordingRenderer();
    private final DataCubeOutputType cube = new DataCubeOutputType(new ImageBatchBuilder(renderer), writer);

    @Test
    void shouldForceFirstImageSizeOnAllImages() {
        JobContext ctx = TestJobs.context(GROWING_IMAGES);
        List<Integer> nobj = cube.nobjPerFile(ctx, 0, 0);
        var task = new FileTask(0, Path.of("cube.fits"), 0, 0, nobj, ctx, List.of(), 1);

        var outcome = cube.buildFile(task, ctx);

        assertThat(outcome.nimages()).isEqualTo(4);
        var write = writer.writesTo(Path.of("cube.fits")).get(0);
        assertThat(write.kind()).isEqualTo(RecordingImageWriter.Kind.CUBE);
        assertThat(write.images()).extracting(PixelImage::size)
                .containsOnly(new ImageSize(50, 50))
                .hasSize(4);
    }

    @Test
    void shouldForceSizeWhenImagesRunInParallel() {
        JobContext ctx = TestJobs.context(GROWING_IMAGES);
        var task = new FileTask(0, Path.of("cube.fits"), 0, 0, cube.nobjPerFile(ctx, 0, 0), ctx, List.of(), 3);

        cube.buildFile(task, ctx);

        assertThat(writer.writes().get(0).images()).extracting(PixelImage::size)
                .containsOnly(new ImageSize(50, 50));
        assertThat(renderer.drawn()).extracting(RecordingRenderer.Drawn::objNum)
                .containsExactly(0, 1, 2, 3);
    }

    @Test
    void shouldWriteExtraLayersAsCubes() {
        JobContext ctx = TestJobs.context(GROWING_IMAGES);
        var extras = List.of(ExtraTarget.toFile(LayerKind.WEIGHT, Path.of("weight.fits")));
        var task = new FileTask(0, Path.of("cube.fits"), 0, 0, cube.nobjPerFile(ctx, 0, 0), ctx, extras, 1);

        var outcome = cube.buildFile(task, ctx);

        assertThat(outcome.extraFiles()).containsExactly(Path.of("weight.fits"));
        var weight = writer.writesTo(Path.of("weight.fits")).get(0);
        assertThat(weight.kind()).isEqualTo(RecordingImageWriter.Kind.CUBE);
        assertThat(weight.images()).hasSize(4);
        assertThat(weight.images().get(3).get(0, 0)).isEqualTo(1f);
    }

    @Test
    void shouldRequireNimagesWithoutCountingInput() {
        JobContext ctx = TestJobs.context("{'image': {'type': 'Single'}, 'output': {'type': 'DataCube'}}");

        assertThatThrownBy(() -> cube.nobjPerFile(ctx, 0, 0))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessage("Attribute output.nimages is required for output.type = DataCube");
    }

    @Test
    void shouldTakeNimagesFromCatalog(@TempDir Path dir) {
        Path cat = TestJobs.writeCatalog(dir, "cat.txt", 6);
        JobContext ctx = TestJobs.context("{'input': {'catalog': {'file_name': '" + TestJobs.json(cat) + "'}},"
                + " 'output': {'type': 'DataCube'}}");

        assertThat(cube.nobjPerFile(ctx, 0, 0)).hasSize(6).containsOnly(1);
    }
}
