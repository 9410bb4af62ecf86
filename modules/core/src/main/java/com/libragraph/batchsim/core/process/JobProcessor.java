package com.libragraph.batchsim.core.process;

import com.libragraph.batchsim.core.config.ConfigValidationException;
import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.input.InputLoader;
import com.libragraph.batchsim.core.input.InputObjectCache;
import com.libragraph.batchsim.core.input.InputRegistry;
import com.libragraph.batchsim.core.input.ProcessScope;
import com.libragraph.batchsim.core.output.ExtraFileTracker;
import com.libragraph.batchsim.core.output.ExtraOutputParser;
import com.libragraph.batchsim.core.output.FileNames;
import com.libragraph.batchsim.core.output.OutputType;
import com.libragraph.batchsim.core.output.OutputTypeRegistry;
import com.libragraph.batchsim.core.sequence.FilePlan;
import com.libragraph.batchsim.core.sequence.NumberingSequencer;
import com.libragraph.batchsim.core.share.SharedInputManager;
import com.libragraph.batchsim.core.task.ExtraTarget;
import com.libragraph.batchsim.core.task.FileOutcome;
import com.libragraph.batchsim.core.task.FileTask;
import com.libragraph.batchsim.core.task.FileTaskDispatcher;
import com.libragraph.batchsim.core.task.TaskResult;
import com.libragraph.batchsim.core.value.ValueEvaluator;
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
import java.util.function.Supplier;

/**
 * Runs a whole job: resolves worker counts, sets up shared inputs, numbers the files,
 * applies skip rules and hands the remaining files to the dispatcher.
 */
public class JobProcessor {

    private static final Logger log = Logger.getLogger(JobProcessor.class);

    /** Worker counts for files and for images within a file. */
    record NprocPlan(int fileNproc, int imageNproc) {
    }

    private final InputRegistry inputRegistry;
    private final OutputTypeRegistry outputTypes;
    private final ValueEvaluator evaluator;
    private final JobSettings settings;
    private final Supplier<SharedInputManager> managerFactory;
    private final NumberingSequencer sequencer = new NumberingSequencer();

    public JobProcessor(InputRegistry inputRegistry, OutputTypeRegistry outputTypes,
                        ValueEvaluator evaluator, JobSettings settings) {
        this(inputRegistry, outputTypes, evaluator, settings,
                () -> new SharedInputManager(r -> {
                    Thread t = new Thread(r, "shared-input-manager");
                    t.setDaemon(true);
                    return t;
                }, settings.managerStartupTimeout()));
    }

    public JobProcessor(InputRegistry inputRegistry, OutputTypeRegistry outputTypes,
                        ValueEvaluator evaluator, JobSettings settings,
                        Supplier<SharedInputManager> managerFactory) {
        this.inputRegistry = inputRegistry;
        this.outputTypes = outputTypes;
        this.evaluator = evaluator;
        this.settings = settings;
        this.managerFactory = managerFactory;
    }

    public JobReport process(Map<String, Object> config) {
        Map<String, Object> output = ConfigMaps.subMapOrCreate(config, "output");
        if (!output.containsKey("type")) {
            output.put("type", "Fits");
        }
        OutputType type = outputTypes.resolve(String.valueOf(output.get("type")));

        InputObjectCache localInputs = new InputObjectCache(inputRegistry);
        List<String> configured = localInputs.normalizeInputs(config);
        JobContext jobCtx = new JobContext(config, localInputs, evaluator);
        jobCtx.startFile(0);

        int nfiles = jobCtx.parseValue(output, "nfiles", Integer.class, 1);
        int nproc = jobCtx.parseValue(output, "nproc", Integer.class, settings.defaultNproc());
        NprocPlan np = resolveNproc(nproc, nfiles, type.capabilities(), settings.cpuCount());
        log.infof("Building %d %s file(s), nproc = %d (image nproc = %d)", nfiles, type.typeName(),
                np.fileNproc(), np.imageNproc());

        SharedInputManager manager = null;
        if ((np.fileNproc() > 1 || np.imageNproc() > 1) && !configured.isEmpty()) {
            manager = startManager(config, configured);
        }
        InputObjectCache inputs = manager == null ? localInputs : new InputObjectCache(inputRegistry, manager);
        jobCtx.withInputs(inputs);

        try {
            if (np.fileNproc() > 1) {
                inputs.processInputs(jobCtx, ProcessScope.SAFE_ONLY);
            }
            List<FilePlan> plans = sequencer.plan(jobCtx, type, nfiles);

            ExtraFileTracker tracker = new ExtraFileTracker();
            List<FileTask> tasks = new ArrayList<>();
            List<Integer> skipped = new ArrayList<>();
            for (FilePlan plan : plans) {
                JobContext ctx = plan.context();
                ctx.startFile(plan.fileNum());
                ctx.inputs().processInputs(ctx, ProcessScope.FILE_SCOPE_ONLY);
                ctx.startFile(plan.fileNum());

                Map<String, Object> fileOutput = ctx.branchOrCreate("output");
                Path dir = outputDir(ctx, fileOutput);
                Path fileName = dir.resolve(fileName(ctx, fileOutput));

                if (ctx.parseValue(fileOutput, "skip", Boolean.class, false)) {
                    log.infof("Skipping file %d = %s because output.skip = True", plan.fileNum(), fileName);
                    skipped.add(plan.fileNum());
                    continue;
                }
                if (ctx.parseValue(fileOutput, "noclobber", Boolean.class, false) && Files.exists(fileName)) {
                    log.infof("Skipping file %d = %s because output.noclobber = True and file exists",
                            plan.fileNum(), fileName);
                    skipped.add(plan.fileNum());
                    continue;
                }
                createDirectories(dir);
                List<ExtraTarget> extras = ExtraOutputParser.parse(ctx, type.capabilities(),
                        settings.baseDir(), dir, tracker);

                tasks.add(new FileTask(plan.fileNum(), fileName, plan.imageNum(), plan.objNum(),
                        plan.nobjPerImage(), ctx, extras, np.imageNproc()));
            }

            FileTaskDispatcher dispatcher = new FileTaskDispatcher(type::buildFile);
            List<TaskResult<FileOutcome>> results = dispatcher.dispatch(tasks, np.fileNproc(), inputs);
            log.infof("Done building files: %d written, %d skipped", results.size(), skipped.size());
            return new JobReport(nfiles, skipped, results, manager != null);
        } finally {
            if (manager != null) {
                manager.close();
            }
        }
    }

    /**
     * Splits the requested worker count between files and images. A single file that
     * can hold several images gets the workers at image level instead.
     */
    static NprocPlan resolveNproc(int nproc, int nfiles, OutputCapabilities caps, int cpuCount) {
        int imageNproc = 1;
        if (nproc <= 0) {
            nproc = cpuCount;
            log.debugf("ncpu = %d", nproc);
            if (nproc > nfiles) {
                if (nfiles == 1 && caps.canDoMultiple()) {
                    imageNproc = nproc;
                    nproc = 1;
                } else {
                    nproc = nfiles;
                }
            }
        } else if (nproc > nfiles) {
            if (nfiles == 1 && caps.canDoMultiple()) {
                imageNproc = nproc;
                nproc = 1;
            } else {
                log.warnf("Trying to use more processes than files: output.nproc=%d, nfiles=%d. "
                        + "Reducing nproc to %d.", nproc, nfiles, nfiles);
                nproc = Math.max(nfiles, 1);
            }
        }
        return new NprocPlan(nproc, imageNproc);
    }

    private SharedInputManager startManager(Map<String, Object> config, List<String> configured) {
        SharedInputManager manager = managerFactory.get();
        try {
            manager.start();
        } catch (Exception e) {
            log.warnf("Unable to start the shared input manager, each worker will build its own "
                    + "input objects: %s", e.getMessage());
            manager.close();
            return null;
        }
        Map<String, Object> input = ConfigMaps.subMap(config, "input");
        for (String type : configured) {
            InputLoader<?> loader = inputRegistry.resolve(type);
            int nfields = ConfigMaps.asList(input.get(type)).size();
            for (int i = 0; i < nfields; i++) {
                manager.bind(type + i, loader);
            }
        }
        return manager;
    }

    private Path outputDir(JobContext ctx, Map<String, Object> output) {
        if (!output.containsKey("dir")) {
            return settings.baseDir();
        }
        return settings.baseDir().resolve(ctx.parseValue(output, "dir", String.class));
    }

    private static String fileName(JobContext ctx, Map<String, Object> output) {
        FileNames.setDefaultExt(output, ".fits");
        if (output.containsKey("file_name")) {
            return ctx.parseValue(output, "file_name", String.class);
        }
        Object root = ctx.config().get("root");
        if (root == null) {
            throw new ConfigValidationException(
                    "No output.file_name specified and unable to generate it automatically.");
        }
        return root + ".fits";
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + dir, e);
        }
    }
}
