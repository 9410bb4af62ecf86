package com.libragraph.batchsim.core.task;

import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.input.InputObjectCache;
import com.libragraph.batchsim.core.input.ProcessScope;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs file tasks in order on the calling thread, or in parallel on a
 * {@link WorkerPool}. In parallel mode every task is drained before failures are
 * reported.
 */
public class FileTaskDispatcher {

    private static final Logger log = Logger.getLogger(FileTaskDispatcher.class);

    @FunctionalInterface
    public interface FileBuilder {
        FileOutcome build(FileTask task, JobContext ctx);
    }

    private final FileBuilder builder;

    public FileTaskDispatcher(FileBuilder builder) {
        this.builder = builder;
    }

    /**
     * @param jobInputs the job's input cache; parallel workers start from its safe objects
     * @throws JobFailedException if any task failed in parallel mode (after all tasks ran)
     */
    public List<TaskResult<FileOutcome>> dispatch(List<FileTask> tasks, int nproc, InputObjectCache jobInputs) {
        if (nproc <= 1 || tasks.size() <= 1) {
            return runSequential(tasks);
        }
        if (nproc > tasks.size()) {
            nproc = tasks.size();
        }
        log.infof("Building %d files with %d workers", tasks.size(), nproc);

        WorkerPool<FileTask, FileOutcome> pool = new WorkerPool<>("file-worker", nproc, () -> {
            InputObjectCache view = jobInputs.workerView();
            return (task, worker) -> {
                log.debugf("%s: Received job to do file %d, image %d, obj %d", worker,
                        task.fileNum(), task.imageNum(), task.objNum());
                return buildOne(task, task.context().withInputs(view));
            };
        });

        List<TaskResult<FileOutcome>> results = pool.runAll(tasks, r -> {
            FileTask task = tasks.get(r.index());
            if (r.isDone()) {
                log.infof("%s: File %d = %s: time = %.3f sec", r.worker(), task.fileNum(),
                        task.fileName(), seconds(r.elapsed()));
            } else {
                log.errorf("%s: File %d = %s failed: %s", r.worker(), task.fileNum(),
                        task.fileName(), r.error().summary());
            }
        });

        List<TaskResult<?>> failures = new ArrayList<>();
        for (TaskResult<FileOutcome> r : results) {
            if (!r.isDone()) failures.add(r);
        }
        if (!failures.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            for (TaskResult<?> f : failures) {
                if (sb.length() > 0) sb.append(", ");
                sb.append(tasks.get(f.index()).fileName());
            }
            throw new JobFailedException(failures.size() + " of " + tasks.size()
                    + " files failed: " + sb, failures, failures.get(0).error().cause());
        }
        return results;
    }

    private List<TaskResult<FileOutcome>> runSequential(List<FileTask> tasks) {
        List<TaskResult<FileOutcome>> results = new ArrayList<>(tasks.size());
        String worker = Thread.currentThread().getName();
        for (int i = 0; i < tasks.size(); i++) {
            FileTask task = tasks.get(i);
            long start = System.nanoTime();
            FileOutcome outcome = buildOne(task, task.context());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.infof("File %d = %s: time = %.3f sec", task.fileNum(), task.fileName(), seconds(elapsed));
            results.add(TaskResult.done(i, worker, outcome, elapsed));
        }
        return results;
    }

    private FileOutcome buildOne(FileTask task, JobContext ctx) {
        ctx.startFile(task.fileNum());
        ctx.inputs().processInputs(ctx, ProcessScope.ALL);
        return builder.build(task, ctx);
    }

    private static double seconds(Duration d) {
        return d.toNanos() / 1e9;
    }
}
