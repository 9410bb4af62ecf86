package com.libragraph.batchsim.core.output;

import com.libragraph.batchsim.core.config.ConfigValidationException;
import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.config.ParamParser;
import com.libragraph.batchsim.core.config.ParamSpec;
import com.libragraph.batchsim.core.config.Params;
import com.libragraph.batchsim.core.render.LayerKind;
import com.libragraph.batchsim.core.task.ExtraTarget;
import com.libragraph.batchsim.formats.api.OutputCapabilities;
import com.libragraph.batchsim.util.ConfigMaps;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the {@code psf}, {@code weight} and {@code badpix} sub-branches of
 * {@code output} into extra targets for one file.
 */
public final class ExtraOutputParser {

    private static final Logger log = Logger.getLogger(ExtraOutputParser.class);

    private ExtraOutputParser() {
    }

    /**
     * @param baseDir   directory relative extra {@code dir}s resolve against
     * @param outputDir directory of the main file, used when an extra has no {@code dir}
     * @param tracker   drops an extra file whose name repeats the previous file's
     */
    public static List<ExtraTarget> parse(JobContext ctx, OutputCapabilities caps, Path baseDir,
                                          Path outputDir, ExtraFileTracker tracker) {
        Map<String, Object> output = ctx.branchOrCreate("output");
        List<ExtraTarget> targets = new ArrayList<>();

        for (LayerKind kind : LayerKind.extras()) {
            String key = kind.configKey();
            if (!output.containsKey(key)) continue;
            Map<String, Object> field;
            try {
                field = ConfigMaps.subMap(output, key);
            } catch (IllegalArgumentException e) {
                throw new ConfigValidationException(e.getMessage(), e);
            }

            FileNames.setDefaultExt(field, ".fits");
            Params p = ParamParser.getAllParams(field, "output." + key, ctx, specFor(kind, caps));

            if (p.has("hdu")) {
                targets.add(ExtraTarget.toHdu(kind, p.get("hdu", Integer.class)));
                continue;
            }
            Path dir = p.optional("dir", String.class).map(baseDir::resolve).orElse(outputDir);
            Path file = dir.resolve(p.get("file_name", String.class));
            if (!tracker.claim(kind, file)) {
                log.debugf("file %d: Not writing %s file = %s because already written",
                        ctx.fileNum(), key, file);
                continue;
            }
            createDirectories(dir);
            targets.add(ExtraTarget.toFile(kind, file));
        }
        return targets;
    }

    static ParamSpec specFor(LayerKind kind, OutputCapabilities caps) {
        ParamSpec.Builder b = ParamSpec.builder().optional("dir", String.class);
        if (caps.extraHdu()) {
            b.single(Map.of("file_name", String.class, "hdu", Integer.class));
        } else {
            b.required("file_name", String.class);
        }
        if (kind == LayerKind.PSF) {
            b.ignore("real_space", "signal_to_noise");
        } else if (kind == LayerKind.WEIGHT) {
            b.ignore("include_obj_var");
        }
        return b.build();
    }

    static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + dir, e);
        }
    }
}
