package com.libragraph.batchsim.core.output;

import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.task.FileOutcome;
import com.libragraph.batchsim.core.task.FileTask;
import com.libragraph.batchsim.formats.api.OutputCapabilities;

import java.util.List;
import java.util.Set;

/**
 * One kind of output file, selected by {@code output.type}.
 */
public interface OutputType {

    /** Keys every output type accepts. */
    Set<String> COMMON_KEYS = Set.of("type", "file_name", "dir", "nfiles", "psf", "weight", "badpix",
            "nproc", "skip", "noclobber");

    String typeName();

    OutputCapabilities capabilities();

    /** Keys this type accepts in the {@code output} branch. */
    Set<String> validKeys();

    /**
     * Object count of each image of file {@code fileNum}, whose first image is
     * {@code imageNum}. May record derived settings (such as {@code nimages}) in the
     * context's {@code output} branch.
     */
    List<Integer> nobjPerFile(JobContext ctx, int fileNum, int imageNum);

    FileOutcome buildFile(FileTask task, JobContext ctx);
}
