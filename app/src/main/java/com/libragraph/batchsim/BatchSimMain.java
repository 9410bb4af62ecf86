package com.libragraph.batchsim;

import com.libragraph.batchsim.core.BatchSimException;
import com.libragraph.batchsim.formats.api.WriteException;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Command-line entry: {@code batchsim <job.yaml|job.json> [field.path=value ...]}.
 * Exit codes: 0 success, 1 job failure, 2 usage error.
 */
@QuarkusMain
public class BatchSimMain implements QuarkusApplication {

    private static final Logger log = Logger.getLogger(BatchSimMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    @Inject
    JobRunner runner;

    @Override
    public int run(String... args) {
        if (args.length == 0) {
            log.error("Usage: batchsim <job file> [field.path=value ...]");
            return EXIT_USAGE;
        }
        Path jobFile = Path.of(args[0]);
        if (!Files.isRegularFile(jobFile)) {
            log.errorf("Job file %s not found", jobFile);
            return EXIT_USAGE;
        }
        try {
            runner.run(jobFile, Arrays.asList(args).subList(1, args.length));
            return EXIT_OK;
        } catch (BatchSimException | WriteException | UncheckedIOException e) {
            log.errorf(e, "Job %s failed: %s", jobFile, e.getMessage());
            return EXIT_FAILED;
        }
    }
}
