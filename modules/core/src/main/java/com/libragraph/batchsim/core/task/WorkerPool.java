package com.libragraph.batchsim.core.task;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Fixed set of platform threads draining a task queue.
 * <p>
 * All tasks are queued up front, followed by one stop marker per worker. Each worker
 * builds its {@link Worker} from the factory once, on its own thread, so it can hold
 * thread-confined state. A task that throws an exception is reported as
 * {@link TaskStatus#FAILED} and the worker carries on; a worker that dies from an
 * {@link Error} makes {@link #runAll} throw {@link JobFailedException}.
 *
 * @param <T> task type
 * @param <R> result type
 */
public class WorkerPool<T, R> {

    private static final Logger log = Logger.getLogger(WorkerPool.class);

    @FunctionalInterface
    public interface Worker<T, R> {
        R execute(T task, String workerName) throws Exception;
    }

    private sealed interface Envelope<T> permits Work, Stop {
    }

    private record Work<T>(int index, T task) implements Envelope<T> {
    }

    private record Stop<T>() implements Envelope<T> {
    }

    private sealed interface Completion<R> permits Finished, Crashed {
    }

    private record Finished<R>(TaskResult<R> result) implements Completion<R> {
    }

    private record Crashed<R>(String worker, Throwable cause) implements Completion<R> {
    }

    private final String namePrefix;
    private final int nworkers;
    private final Supplier<Worker<T, R>> workerFactory;
    private final Map<Integer, TaskStatus> statuses = new ConcurrentHashMap<>();

    public WorkerPool(String namePrefix, int nworkers, Supplier<Worker<T, R>> workerFactory) {
        if (nworkers < 1) {
            throw new IllegalArgumentException("nworkers must be >= 1, got " + nworkers);
        }
        this.namePrefix = namePrefix;
        this.nworkers = nworkers;
        this.workerFactory = workerFactory;
    }

    public List<TaskResult<R>> runAll(List<T> tasks) {
        return runAll(tasks, r -> { });
    }

    /**
     * Runs every task and waits for all of them.
     *
     * @param onResult called on the calling thread as each result arrives
     * @return results ordered by task index
     */
    public List<TaskResult<R>> runAll(List<T> tasks, Consumer<TaskResult<R>> onResult) {
        BlockingQueue<Envelope<T>> taskQueue = new LinkedBlockingQueue<>();
        BlockingQueue<Completion<R>> resultQueue = new LinkedBlockingQueue<>();

        for (int i = 0; i < tasks.size(); i++) {
            statuses.put(i, TaskStatus.QUEUED);
            taskQueue.add(new Work<>(i, tasks.get(i)));
        }
        for (int i = 0; i < nworkers; i++) {
            taskQueue.add(new Stop<>());
        }

        List<Thread> threads = new ArrayList<>(nworkers);
        for (int i = 0; i < nworkers; i++) {
            Thread t = new Thread(() -> workerLoop(taskQueue, resultQueue), namePrefix + "-" + i);
            t.setUncaughtExceptionHandler((th, e) -> resultQueue.add(new Crashed<>(th.getName(), e)));
            threads.add(t);
        }
        log.debugf("Starting %s workers: %d for %d tasks", namePrefix, nworkers, tasks.size());
        threads.forEach(Thread::start);

        List<TaskResult<R>> results = new ArrayList<>(tasks.size());
        try {
            while (results.size() < tasks.size()) {
                Completion<R> c = resultQueue.take();
                if (c instanceof Crashed<?> crash) {
                    taskQueue.clear();
                    for (int i = 0; i < nworkers; i++) {
                        taskQueue.add(new Stop<>());
                    }
                    throw new JobFailedException("Worker " + crash.worker() + " died: " + crash.cause(),
                            crash.cause());
                }
                TaskResult<R> result = ((Finished<R>) c).result();
                statuses.put(result.index(), result.status());
                onResult.accept(result);
                results.add(result);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            threads.forEach(Thread::interrupt);
            throw new JobFailedException("Interrupted while waiting for " + namePrefix + " results", e);
        } finally {
            joinAll(threads);
        }

        results.sort(Comparator.comparingInt(TaskResult::index));
        return results;
    }

    public TaskStatus status(int index) {
        return statuses.get(index);
    }

    private void workerLoop(BlockingQueue<Envelope<T>> taskQueue, BlockingQueue<Completion<R>> resultQueue) {
        String name = Thread.currentThread().getName();
        Worker<T, R> worker = workerFactory.get();
        while (true) {
            Envelope<T> envelope;
            try {
                envelope = taskQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (envelope instanceof Stop<?>) {
                log.debugf("%s: stopping", name);
                return;
            }
            Work<T> work = (Work<T>) envelope;
            statuses.put(work.index(), TaskStatus.RUNNING);
            long start = System.nanoTime();
            try {
                R value = worker.execute(work.task(), name);
                resultQueue.add(new Finished<>(TaskResult.done(work.index(), name, value, since(start))));
            } catch (Exception e) {
                log.errorf(e, "%s: task %d failed", name, work.index());
                resultQueue.add(new Finished<>(
                        TaskResult.failed(work.index(), name, TaskError.from(e), since(start))));
            }
        }
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private void joinAll(List<Thread> threads) {
        for (Thread t : threads) {
            try {
                t.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warnf("Interrupted while joining %s", t.getName());
                return;
            }
        }
    }
}
