package com.libragraph.batchsim.core.task;

public enum TaskStatus {
    QUEUED,
    RUNNING,
    DONE,
    FAILED
}
