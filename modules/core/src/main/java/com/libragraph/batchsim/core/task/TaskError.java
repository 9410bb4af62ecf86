package com.libragraph.batchsim.core.task;

import java.io.PrintWriter;
import java.io.StringWriter;

public record TaskError(
        String message,
        String exceptionType,
        String stackTrace,
        Throwable cause
) {
    public static TaskError from(Throwable t) {
        var sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return new TaskError(t.getMessage(), t.getClass().getName(), sw.toString(), t);
    }

    public String summary() {
        return exceptionType + ": " + message;
    }
}
