package com.libragraph.batchsim.core.process;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Environment of a job run, as opposed to the job config itself.
 *
 * @param baseDir               directory that relative output dirs resolve against
 * @param managerStartupTimeout how long to wait for the shared input manager's thread
 * @param cpuCount              worker count used for {@code nproc <= 0}
 * @param defaultNproc          {@code output.nproc} when the job does not set it
 */
public record JobSettings(Path baseDir, Duration managerStartupTimeout, int cpuCount, int defaultNproc) {

    public static JobSettings defaults() {
        return new JobSettings(Path.of("."), Duration.ofSeconds(10),
                Runtime.getRuntime().availableProcessors(), 1);
    }

    public JobSettings withBaseDir(Path dir) {
        return new JobSettings(dir, managerStartupTimeout, cpuCount, defaultNproc);
    }
}
