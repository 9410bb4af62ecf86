package com.libragraph.batchsim.core.image;

import com.libragraph.batchsim.core.config.JobContext;

/**
 * One image of a multi-image file, with its own context copy.
 */
record ImageTask(int imageNum, int objNum, JobContext context) {
}
