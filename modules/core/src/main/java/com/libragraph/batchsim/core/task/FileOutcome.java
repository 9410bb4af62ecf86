package com.libragraph.batchsim.core.task;

import java.nio.file.Path;
import java.util.List;

/**
 * What building one file wrote.
 */
public record FileOutcome(Path fileName, int nimages, List<Path> extraFiles) {

    public FileOutcome {
        extraFiles = List.copyOf(extraFiles);
    }
}
