package com.schedq.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs job work on a bounded worker pool under per-key concurrency ceilings.
 * <p>
 * The running count of a key is incremented before the work starts and decremented once
 * the work has stopped running, before the result completes when the work ends on its own.
 * A timeout fails the result at once but keeps the slot until the work actually stops.
 * Failures of the work itself complete the returned future exceptionally; the executor
 * does not interpret them.
 */
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final ExecutorService workerPool;
    private final RunningJobsTable runningJobs = new RunningJobsTable();

    public JobExecutor(int maxWorkers) {
        this(createWorkerPool(maxWorkers));
    }

    public JobExecutor(ExecutorService workerPool) {
        this.workerPool = workerPool;
    }

    private static ExecutorService createWorkerPool(int maxWorkers) {
        int workers = Math.max(1, maxWorkers);
        return new ThreadPoolExecutor(
                workers,
                workers,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new CustomizableThreadFactory("schedq-worker-"));
    }

    public CompletableFuture<ExecutionResult> execute(JobWork work, ExecutionLimits limits) {
        return submit(work, limits).result();
    }

    public ExecutionHandle submit(JobWork work, ExecutionLimits limits) {
        String key = limits.jobKey();
        if (key != null && !runningJobs.tryAcquire(key, limits.maxInstances())) {
            int running = runningJobs.count(key);
            log.debug("Rejected invocation of {}: {} of {} instance(s) already running",
                    key, running, limits.maxInstances());
            return ExecutionHandle.done(CompletableFuture.completedFuture(ExecutionResult.rejected(key, running)));
        }

        CompletableFuture<Void> finished = new CompletableFuture<>();
        if (key != null) {
            finished.whenComplete((ignored, error) -> runningJobs.release(key));
        }
        CompletableFuture<Object> outcome = new CompletableFuture<>();
        AtomicReference<CompletionStage<?>> asyncStage = new AtomicReference<>();
        Duration timeout = limits.timeout();
        Future<?> task;
        try {
            task = workerPool.submit(() -> start(work, timeout, outcome, finished, asyncStage));
        } catch (RejectedExecutionException e) {
            finished.complete(null);
            return ExecutionHandle.done(CompletableFuture.failedFuture(e));
        }

        CompletableFuture<ExecutionResult> result = new CompletableFuture<>();
        outcome.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(ExecutionResult.completed(key, value));
                return;
            }
            if (error instanceof TimeoutException) {
                task.cancel(true);
                cancelStage(asyncStage.get());
                if (!finished.isDone()) {
                    log.warn("Job {} timed out after {}; its slot stays taken until the work stops", key, timeout);
                }
                result.completeExceptionally(new TimeoutException("Job timed out after " + timeout));
                return;
            }
            result.completeExceptionally(error);
        });
        return new ExecutionHandle(result, finished);
    }

    /**
     * Runs on a worker thread. The timeout starts with the work, so time spent queued for a
     * worker does not count against it. {@code finished} completes before {@code outcome}
     * unless the timeout already failed the outcome.
     */
    private void start(JobWork work, Duration timeout, CompletableFuture<Object> outcome,
                       CompletableFuture<Void> finished, AtomicReference<CompletionStage<?>> asyncStage) {
        if (timeout != null) {
            outcome.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        CompletionStage<?> stage;
        try {
            stage = work.start();
            if (stage == null) {
                throw new IllegalStateException("Job work returned no completion stage");
            }
        } catch (Throwable e) {
            finished.complete(null);
            outcome.completeExceptionally(e);
            return;
        }
        asyncStage.set(stage);
        stage.whenComplete((value, error) -> {
            finished.complete(null);
            if (error != null) {
                outcome.completeExceptionally(unwrap(error));
            } else {
                outcome.complete(value);
            }
        });
        if (outcome.isCompletedExceptionally()) {
            cancelStage(stage);
        }
    }

    private static void cancelStage(CompletionStage<?> stage) {
        if (stage == null) {
            return;
        }
        try {
            stage.toCompletableFuture().cancel(true);
        } catch (UnsupportedOperationException e) {
            log.debug("Completion stage {} cannot be cancelled", stage);
        }
    }

    /**
     * Strips the wrappers the concurrency utilities put around a failure.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public RunningJobsTable getRunningJobs() {
        return runningJobs;
    }

    public int runningCount(String jobKey) {
        return runningJobs.count(jobKey);
    }

    /**
     * The worker pool, for short coordination tasks that must stay off the caller's thread.
     */
    public Executor getWorkerPool() {
        return workerPool;
    }

    public void shutdown(boolean wait) {
        workerPool.shutdown();
        if (!wait) {
            return;
        }
        try {
            if (!workerPool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate within 30s; interrupting running jobs");
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
