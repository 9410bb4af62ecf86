package com.libragraph.batchsim.core.process;

import com.libragraph.batchsim.core.task.FileOutcome;
import com.libragraph.batchsim.core.task.TaskResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of a finished job.
 *
 * @param skippedFiles   file indices not built because of {@code skip} or {@code noclobber}
 * @param sharedInputs   true if inputs were served by the shared input manager
 */
public record JobReport(
        int nfiles,
        List<Integer> skippedFiles,
        List<TaskResult<FileOutcome>> results,
        boolean sharedInputs
) {
    public JobReport {
        skippedFiles = List.copyOf(skippedFiles);
        results = List.copyOf(results);
    }

    public List<FileOutcome> outcomes() {
        List<FileOutcome> outcomes = new ArrayList<>(results.size());
        for (TaskResult<FileOutcome> r : results) {
            outcomes.add(r.value());
        }
        return outcomes;
    }

    public int filesWritten() {
        return results.size();
    }
}
