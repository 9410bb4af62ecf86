package com.libragraph.batchsim;

import com.libragraph.batchsim.config.JobConfigLoader;
import com.libragraph.batchsim.core.input.InputRegistry;
import com.libragraph.batchsim.core.output.OutputTypeRegistry;
import com.libragraph.batchsim.core.process.JobProcessor;
import com.libragraph.batchsim.core.process.JobReport;
import com.libragraph.batchsim.core.process.JobSettings;
import com.libragraph.batchsim.core.value.DefaultValueEvaluator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads a job file and runs it.
 */
@ApplicationScoped
public class JobRunner {

    private static final Logger log = Logger.getLogger(JobRunner.class);

    @Inject
    JobConfigLoader configLoader;

    @Inject
    JobProcessor processor;

    @Inject
    InputRegistry inputRegistry;

    @Inject
    OutputTypeRegistry outputTypes;

    @Inject
    DefaultValueEvaluator evaluator;

    @Inject
    JobSettings settings;

    public JobReport run(Path jobFile, List<String> overrides) {
        return run(jobFile, overrides, processor);
    }

    /** Runs with output dirs resolved against {@code outputDir} instead of the configured one. */
    public JobReport run(Path jobFile, List<String> overrides, Path outputDir) {
        return run(jobFile, overrides,
                new JobProcessor(inputRegistry, outputTypes, evaluator, settings.withBaseDir(outputDir)));
    }

    private JobReport run(Path jobFile, List<String> overrides, JobProcessor jobProcessor) {
        Map<String, Object> config = configLoader.load(jobFile);
        configLoader.applyOverrides(config, overrides);
        log.infof("Running job %s", jobFile);
        long start = System.nanoTime();
        JobReport report = jobProcessor.process(config);
        log.infof("Job %s finished: %d of %d files written in %.3f sec", jobFile, report.filesWritten(),
                report.nfiles(), (System.nanoTime() - start) / 1e9);
        return report;
    }
}
