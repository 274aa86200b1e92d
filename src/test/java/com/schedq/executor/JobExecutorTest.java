package com.schedq.executor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobExecutorTest {

    private JobExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new JobExecutor(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown(false);
    }

    @Test
    void shouldReturnValueOfBlockingWork() throws Exception {
        ExecutionResult result = executor.execute(JobWork.blocking(() -> "done"), ExecutionLimits.of("job", 1))
                .get(5, TimeUnit.SECONDS);

        assertFalse(result.rejected());
        assertEquals("done", result.value());
        assertEquals(0, executor.runningCount("job"));
    }

    @Test
    void shouldRejectSecondInvocationWhileFirstRuns() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<ExecutionResult> first = executor.execute(JobWork.blocking(() -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "first";
        }), ExecutionLimits.of("job", 1));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        ExecutionResult second = executor.execute(JobWork.blocking(() -> "second"), ExecutionLimits.of("job", 1))
                .get(5, TimeUnit.SECONDS);

        assertTrue(second.rejected());
        assertEquals(1, second.runningInstances());
        assertEquals(1, executor.runningCount("job"));

        release.countDown();
        assertEquals("first", first.get(5, TimeUnit.SECONDS).value());
        assertEquals(0, executor.runningCount("job"));
    }

    @Test
    void shouldAllowUpToMaxInstancesPerKey() throws Exception {
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        JobWork work = JobWork.blocking(() -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        });

        CompletableFuture<ExecutionResult> a = executor.execute(work, ExecutionLimits.of("job", 2));
        CompletableFuture<ExecutionResult> b = executor.execute(work, ExecutionLimits.of("job", 2));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        ExecutionResult c = executor.execute(work, ExecutionLimits.of("job", 2)).get(5, TimeUnit.SECONDS);
        ExecutionResult other = executor.execute(JobWork.blocking(() -> "other"), ExecutionLimits.of("other", 1))
                .get(5, TimeUnit.SECONDS);

        assertTrue(c.rejected());
        assertFalse(other.rejected());
        assertEquals(2, executor.getRunningJobs().total());

        release.countDown();
        a.get(5, TimeUnit.SECONDS);
        b.get(5, TimeUnit.SECONDS);
        assertThat(executor.getRunningJobs().snapshot()).isEmpty();
    }

    @Test
    void shouldReleaseSlotWhenWorkFails() {
        CompletableFuture<ExecutionResult> result = executor.execute(JobWork.blocking(() -> {
            throw new IllegalStateException("boom");
        }), ExecutionLimits.of("job", 1));

        assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertEquals(0, executor.runningCount("job"));
    }

    @Test
    void shouldFailWithTimeoutAndReleaseSlot() {
        CountDownLatch never = new CountDownLatch(1);
        CompletableFuture<ExecutionResult> result = executor.execute(JobWork.blocking(() -> {
            never.await(10, TimeUnit.SECONDS);
            return null;
        }), ExecutionLimits.of("slow", 1).withTimeout(Duration.ofMillis(100)));

        assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(TimeoutException.class)
                .hasMessageContaining("Job timed out after PT0.1S");
        await().atMost(Duration.ofSeconds(5)).until(() -> executor.runningCount("slow") == 0);
    }

    @Test
    void shouldKeepSlotWhileTimedOutWorkIgnoresInterruption() throws Exception {
        AtomicBoolean stop = new AtomicBoolean();
        ExecutionHandle handle = executor.submit(JobWork.blocking(() -> {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (!stop.get() && System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
            return null;
        }), ExecutionLimits.of("busy", 1).withTimeout(Duration.ofMillis(100)));

        assertThatThrownBy(() -> handle.result().get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(TimeoutException.class);
        assertFalse(handle.finished().isDone());
        assertEquals(1, executor.runningCount("busy"));
        ExecutionResult second = executor.execute(JobWork.blocking(() -> "second"), ExecutionLimits.of("busy", 1))
                .get(5, TimeUnit.SECONDS);
        assertTrue(second.rejected());

        stop.set(true);
        handle.finished().get(5, TimeUnit.SECONDS);
        assertEquals(0, executor.runningCount("busy"));
    }

    @Test
    void shouldNotCountQueueWaitAgainstTimeout() throws Exception {
        executor.shutdown(false);
        executor = new JobExecutor(1);
        CountDownLatch blockerStarted = new CountDownLatch(1);
        CountDownLatch releaseBlocker = new CountDownLatch(1);
        AtomicInteger queuedRuns = new AtomicInteger();
        CompletableFuture<ExecutionResult> blocker = executor.execute(JobWork.blocking(() -> {
            blockerStarted.countDown();
            releaseBlocker.await(5, TimeUnit.SECONDS);
            return "blocker";
        }), ExecutionLimits.of("a", 1));
        assertTrue(blockerStarted.await(5, TimeUnit.SECONDS));

        CompletableFuture<ExecutionResult> queued = executor.execute(JobWork.blocking(queuedRuns::incrementAndGet),
                ExecutionLimits.of("b", 1).withTimeout(Duration.ofMillis(200)));
        Thread.sleep(400);
        assertFalse(queued.isDone());

        releaseBlocker.countDown();
        assertEquals("blocker", blocker.get(5, TimeUnit.SECONDS).value());
        assertEquals(1, queued.get(5, TimeUnit.SECONDS).value());
        assertEquals(1, queuedRuns.get());
    }

    @Test
    void shouldFinishRejectedAndCompletedHandles() throws Exception {
        ExecutionHandle handle = executor.submit(JobWork.blocking(() -> "done"), ExecutionLimits.of("job", 1));

        assertEquals("done", handle.result().get(5, TimeUnit.SECONDS).value());
        assertTrue(handle.finished().isDone());
    }

    @Test
    void shouldCompleteAsyncWorkWhenStageCompletes() throws Exception {
        CompletableFuture<String> stage = new CompletableFuture<>();
        CompletableFuture<ExecutionResult> result = executor.execute(JobWork.async(() -> stage),
                ExecutionLimits.of("async", 1));

        assertFalse(result.isDone());
        stage.complete("later");

        assertEquals("later", result.get(5, TimeUnit.SECONDS).value());
        assertEquals(0, executor.runningCount("async"));
    }

    @Test
    void shouldNotCountUnmeteredWork() throws Exception {
        ExecutionResult result = executor.execute(JobWork.blocking(() -> 42), ExecutionLimits.unmetered())
                .get(5, TimeUnit.SECONDS);

        assertEquals(42, result.value());
        assertThat(executor.getRunningJobs().snapshot()).isEmpty();
    }

    @Test
    void shouldFailWhenPoolIsShutDown() {
        executor.shutdown(false);

        CompletableFuture<ExecutionResult> result = executor.execute(JobWork.blocking(() -> 1), ExecutionLimits.of("job", 1));

        assertThat(result).isCompletedExceptionally();
        assertEquals(0, executor.runningCount("job"));
    }

    @Test
    void shouldUnwrapCompletionWrappers() {
        IllegalStateException cause = new IllegalStateException("root");

        assertThat(JobExecutor.unwrap(new java.util.concurrent.CompletionException(new ExecutionException(cause))))
                .isSameAs(cause);
    }
}
