package com.schedq;

import com.schedq.config.SchedQProperties;
import com.schedq.event.JobErrorEvent;
import com.schedq.event.JobExecutedEvent;
import com.schedq.event.JobMissedEvent;
import com.schedq.event.JobRetryEvent;
import com.schedq.event.JobSkippedEvent;
import com.schedq.event.SchedulerListener;
import com.schedq.executor.ExecutionHandle;
import com.schedq.executor.ExecutionLimits;
import com.schedq.executor.ExecutionResult;
import com.schedq.executor.JobExecutor;
import com.schedq.executor.JobWork;
import com.schedq.history.ExecutionHistory;
import com.schedq.history.ExecutionRecord;
import com.schedq.lock.DistributedLock;
import com.schedq.retry.RetryStrategy;
import com.schedq.store.JobState;
import com.schedq.store.JobStore;
import com.schedq.trigger.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Drives registered jobs: evaluates their triggers on a single control thread, gates
 * each occurrence through the distributed lock, runs it on the {@link JobExecutor} and
 * applies the job's retry strategy to failures.
 * <p>
 * Occurrences that come due while the scheduler was busy or stopped are handled by the
 * misfire rules: with {@code coalesce} they collapse into one run, otherwise each one
 * within the grace period runs and the rest are reported as missed.
 * <p>
 * A distributed lock, once acquired for an occurrence, is held across the whole retry
 * chain of that occurrence and renewed every third of its timeout.
 */
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private static final int MAX_CATCH_UP = 1000;
    private static final Duration MAX_IDLE_WAIT = Duration.ofSeconds(30);
    private static final DateTimeFormatter RUN_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String RUN_ID_CHARS = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final String LOCK_KEY_PREFIX = "job:";

    private final JobRegistry registry;
    private final JobExecutor executor;
    private final DistributedLock lock;
    private final JobStore store;
    private final ExecutionHistory history;
    private final Clock clock;
    private final boolean enabled;
    private final ZoneId zone;
    private final Duration misfireGraceTime;
    private final boolean coalesce;
    private final boolean lockingEnabled;
    private final Duration lockTimeout;
    private final ScheduledThreadPoolExecutor controlLoop;

    private final Map<String, JobRuntime> runtimes = new ConcurrentHashMap<>();
    private final List<SchedulerListener> listeners = new CopyOnWriteArrayList<>();
    private final Object tickMonitor = new Object();
    private ScheduledFuture<?> pendingTick;
    private volatile boolean running = false;
    private volatile boolean shutdown = false;

    /**
     * @param history run history, or {@code null} when history is disabled
     */
    public JobScheduler(JobRegistry registry,
                        JobExecutor executor,
                        DistributedLock lock,
                        JobStore store,
                        ExecutionHistory history,
                        SchedQProperties properties,
                        Clock clock) {
        this.registry = registry;
        this.executor = executor;
        this.lock = lock;
        this.store = store;
        this.history = history;
        this.clock = clock;
        this.enabled = properties.isEnabled();
        this.zone = ZoneId.of(properties.getTimezone());
        this.misfireGraceTime = properties.getMisfireGraceTime();
        this.coalesce = properties.isCoalesce();
        this.lockingEnabled = properties.getLock().isEnabled();
        this.lockTimeout = properties.getLock().getTimeout();

        this.controlLoop = new ScheduledThreadPoolExecutor(1, new CustomizableThreadFactory("schedq-scheduler-"));
        this.controlLoop.setRemoveOnCancelPolicy(true);
        this.controlLoop.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.controlLoop.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    }

    public void start() {
        if (shutdown) {
            throw new IllegalStateException("Scheduler has been shut down and cannot be restarted");
        }
        if (!enabled) {
            log.info("Scheduler is disabled");
            return;
        }
        if (running) {
            log.warn("Scheduler is already running");
            return;
        }
        running = true;
        Instant now = clock.instant();
        for (JobRuntime runtime : runtimes.values()) {
            if (runtime.arm(now)) {
                persist(runtime);
            }
        }
        log.info("Scheduler started with {} jobs (timezone {}, lock {})", runtimes.size(), zone,
                lockingEnabled ? lock.getStrategyName() : "disabled");
        wakeUp();
    }

    /**
     * Stops dispatching. Retries that have not started yet are dropped.
     *
     * @param wait whether to wait for running jobs to finish
     */
    public void shutdown(boolean wait) {
        if (shutdown) {
            return;
        }
        shutdown = true;
        running = false;
        synchronized (tickMonitor) {
            if (pendingTick != null) {
                pendingTick.cancel(false);
            }
        }
        controlLoop.shutdown();
        executor.shutdown(wait);
        log.info("Scheduler shutdown complete");
    }

    public boolean isRunning() {
        return running;
    }

    public void addListener(SchedulerListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Registers a job and, when the scheduler is running, arms its trigger right away.
     * Triggers declared without a timezone are evaluated in the scheduler's timezone.
     *
     * @return the job code
     */
    public String addJob(JobDefinition definition) {
        JobDefinition zoned = definition.withTriggers(definition.getTriggers().stream()
                .map(trigger -> trigger.withDefaultZone(zone))
                .toList());
        String code = registry.register(zoned);

        Instant now = clock.instant();
        addRuntime(zoned, now);
        for (String subCode : registry.subJobCodes(code)) {
            addRuntime(registry.get(subCode), now);
        }

        if (zoned.isMultiTrigger()) {
            log.info("Multi-trigger job registered: {} with {} triggers", code, zoned.getTriggers().size());
        } else {
            log.info("Job registered: {} ({})", code, zoned.getName());
        }
        wakeUp();
        return code;
    }

    private void addRuntime(JobDefinition definition, Instant now) {
        Optional<JobState> state = store.load(definition.getCode());
        JobRuntime runtime = state.map(JobState::jobId)
                .map(jobId -> new JobRuntime(definition, jobId))
                .orElseGet(() -> new JobRuntime(definition, UUID.randomUUID().toString()));
        state.ifPresent(runtime::restore);
        if (running) {
            runtime.arm(now);
        }
        runtimes.put(definition.getCode(), runtime);
        persist(runtime);
    }

    /**
     * Removes a job and its sub-jobs. Runs already in flight complete normally.
     *
     * @throws IllegalStateException if {@code code} names a sub-job
     */
    public boolean removeJob(String code) {
        List<JobDefinition> removed = registry.unregister(code);
        if (removed.isEmpty()) {
            log.warn("Job not found: {}", code);
            return false;
        }
        for (JobDefinition definition : removed) {
            runtimes.remove(definition.getCode());
            deleteState(definition.getCode());
        }
        log.info("Job removed: {}", code);
        return true;
    }

    public boolean pauseJob(String code) {
        List<JobRuntime> family = family(code);
        if (family.isEmpty()) {
            log.warn("Job not found: {}", code);
            return false;
        }
        for (JobRuntime runtime : family) {
            synchronized (runtime) {
                runtime.paused = true;
            }
            persist(runtime);
        }
        log.info("Job paused: {}", code);
        return true;
    }

    /**
     * Resumes a paused job. The next fire time is computed from now; occurrences that
     * came due while paused are not run.
     */
    public boolean resumeJob(String code) {
        List<JobRuntime> family = family(code);
        if (family.isEmpty()) {
            log.warn("Job not found: {}", code);
            return false;
        }
        Instant now = clock.instant();
        for (JobRuntime runtime : family) {
            synchronized (runtime) {
                runtime.paused = false;
                runtime.rearm(now);
            }
            persist(runtime);
        }
        log.info("Job resumed: {}", code);
        wakeUp();
        return true;
    }

    /**
     * Replaces the trigger of a single-trigger job or of one sub-job.
     *
     * @throws IllegalStateException if {@code code} names a multi-trigger parent
     */
    public boolean rescheduleJob(String code, Trigger trigger) {
        Optional<JobDefinition> found = registry.find(code);
        if (found.isEmpty()) {
            log.warn("Job not found: {}", code);
            return false;
        }
        JobDefinition definition = found.get();
        if (definition.isMultiTrigger()) {
            throw new IllegalStateException("Job '" + code + "' has " + definition.getTriggers().size()
                    + " triggers; reschedule one of its sub-jobs instead");
        }
        Trigger zoned = trigger.withDefaultZone(zone);
        JobDefinition updated = definition.withTriggers(List.of(zoned));
        registry.replace(updated);
        definition.getParentCode().ifPresent(parentCode -> replaceParentTrigger(parentCode, code, zoned));

        JobRuntime runtime = runtimes.get(code);
        if (runtime != null) {
            synchronized (runtime) {
                runtime.definition = updated;
                runtime.rearm(clock.instant());
            }
            persist(runtime);
        }
        log.info("Job rescheduled: {} ({})", code, zoned);
        wakeUp();
        return true;
    }

    private void replaceParentTrigger(String parentCode, String subCode, Trigger trigger) {
        JobDefinition parent = registry.get(parentCode);
        int index = Integer.parseInt(subCode.substring(subCode.lastIndexOf(JobDefinition.SUB_JOB_SEPARATOR) + 1));
        List<Trigger> triggers = new ArrayList<>(parent.getTriggers());
        triggers.set(index - 1, trigger);
        JobDefinition updatedParent = parent.withTriggers(triggers);
        registry.replace(updatedParent);
        JobRuntime parentRuntime = runtimes.get(parentCode);
        if (parentRuntime != null) {
            parentRuntime.definition = updatedParent;
        }
    }

    /**
     * Runs a job now, outside its schedule. Lock and concurrency rules apply as for a
     * scheduled run.
     *
     * @throws JobNotFoundException if no job is registered under {@code code}
     */
    public JobRun runJob(String code) {
        registry.get(code);
        JobRuntime runtime = runtimes.get(code);
        if (runtime == null) {
            throw new JobNotFoundException(code);
        }
        JobContext context = newContext(runtime, TriggerType.MANUAL, clock.instant());
        log.info("Job triggered manually: {}, run_id: {}", code, context.runId());
        return new JobRun(context.runId(), code, dispatch(runtime, context));
    }

    public JobRegistry getRegistry() {
        return registry;
    }

    public Optional<JobSnapshot> getJob(String code) {
        return registry.find(code).map(this::snapshot);
    }

    public List<JobSnapshot> getJobs() {
        return registry.getDefinitions().stream().map(this::snapshot).toList();
    }

    /**
     * Same as {@link #getJob(String)}; the snapshot carries the job's run statistics.
     */
    public Optional<JobSnapshot> getJobStats(String code) {
        return getJob(code);
    }

    public SchedulerStats getStats() {
        int paused = 0;
        long totalRuns = 0;
        long successRuns = 0;
        long failedRuns = 0;
        for (JobRuntime runtime : runtimes.values()) {
            if (runtime.paused) {
                paused++;
            }
            totalRuns += runtime.runCount.get();
            successRuns += runtime.successCount.get();
            failedRuns += runtime.failCount.get();
        }
        int total = runtimes.size();
        return new SchedulerStats(running, total, total - paused, paused, totalRuns, successRuns, failedRuns,
                executor.getRunningJobs().total());
    }

    public List<ExecutionRecord> getExecutions(String code, int limit) {
        return history == null ? List.of() : history.findByJob(code, limit);
    }

    public Optional<ExecutionRecord> getExecution(String runId) {
        return history == null ? Optional.empty() : history.find(runId);
    }

    private JobSnapshot snapshot(JobDefinition definition) {
        String code = definition.getCode();
        JobRuntime own = runtimes.get(code);
        List<String> subCodes = registry.subJobCodes(code);
        List<JobRuntime> members = new ArrayList<>();
        if (own != null) {
            members.add(own);
        }
        subCodes.stream().map(runtimes::get).filter(Objects::nonNull).forEach(members::add);

        long totalRuns = 0;
        long successRuns = 0;
        long failedRuns = 0;
        int runningInstances = 0;
        Instant nextRunTime = null;
        JobRuntime latest = null;
        for (JobRuntime member : members) {
            totalRuns += member.runCount.get();
            successRuns += member.successCount.get();
            failedRuns += member.failCount.get();
            runningInstances += executor.runningCount(member.code());
            Instant next = member.paused ? null : member.nextFireTime;
            if (next != null && (nextRunTime == null || next.isBefore(nextRunTime))) {
                nextRunTime = next;
            }
            if (member.lastRunTime != null && (latest == null || member.lastRunTime.isAfter(latest.lastRunTime))) {
                latest = member;
            }
        }
        String trigger = definition.isMultiTrigger()
                ? definition.getTriggers().toString()
                : definition.getTrigger().toString();
        return new JobSnapshot(
                code,
                own != null ? own.jobId : null,
                definition.getName(),
                definition.getDescription(),
                definition.getParentCode().orElse(null),
                subCodes,
                definition.getTriggers().size(),
                trigger,
                nextRunTime,
                own != null && own.paused,
                totalRuns,
                successRuns,
                failedRuns,
                latest != null ? latest.lastRunId : null,
                latest != null ? latest.lastRunTime : null,
                latest != null ? latest.lastStatus : null,
                runningInstances);
    }

    private List<JobRuntime> family(String code) {
        List<JobRuntime> family = new ArrayList<>();
        JobRuntime runtime = runtimes.get(code);
        if (runtime == null) {
            return family;
        }
        family.add(runtime);
        registry.subJobCodes(code).stream().map(runtimes::get).filter(Objects::nonNull).forEach(family::add);
        return family;
    }

    private void wakeUp() {
        scheduleTick(Duration.ZERO);
    }

    private void scheduleTick(Duration delay) {
        synchronized (tickMonitor) {
            if (!running) {
                return;
            }
            if (pendingTick != null) {
                pendingTick.cancel(false);
            }
            try {
                pendingTick = controlLoop.schedule(this::tick, Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Control loop no longer accepts ticks");
            }
        }
    }

    private void tick() {
        if (!running) {
            return;
        }
        Instant now = clock.instant();
        runDueJobs(now);
        scheduleTick(timeUntilNextFire(now));
    }

    /**
     * Dispatches every occurrence due at {@code now}.
     */
    void runDueJobs(Instant now) {
        for (JobRuntime runtime : runtimes.values()) {
            try {
                fireDueOccurrences(runtime, now);
            } catch (RuntimeException e) {
                log.error("Failed to evaluate trigger of job {}", runtime.code(), e);
            }
        }
    }

    private Duration timeUntilNextFire(Instant now) {
        Instant earliest = runtimes.values().stream()
                .filter(runtime -> !runtime.paused && !runtime.definition.isMultiTrigger())
                .map(runtime -> runtime.nextFireTime)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .orElse(null);
        if (earliest == null) {
            return MAX_IDLE_WAIT;
        }
        Duration wait = Duration.between(now, earliest);
        if (wait.isNegative()) {
            return Duration.ZERO;
        }
        return wait.compareTo(MAX_IDLE_WAIT) > 0 ? MAX_IDLE_WAIT : wait;
    }

    private void fireDueOccurrences(JobRuntime runtime, Instant now) {
        List<Instant> due = new ArrayList<>();
        synchronized (runtime) {
            JobDefinition definition = runtime.definition;
            Instant fireTime = runtime.nextFireTime;
            if (definition.isMultiTrigger() || runtime.paused || fireTime == null || fireTime.isAfter(now)) {
                return;
            }
            Trigger trigger = definition.getTrigger();
            while (fireTime != null && !fireTime.isAfter(now) && due.size() < MAX_CATCH_UP) {
                due.add(fireTime);
                fireTime = trigger.nextFireTime(fireTime).orElse(null);
            }
            if (fireTime != null && !fireTime.isAfter(now)) {
                fireTime = trigger.nextFireTime(now).orElse(null);
            }
            runtime.nextFireTime = fireTime;
        }
        persist(runtime);

        if (coalesce) {
            Instant latest = due.get(due.size() - 1);
            if (due.size() > 1) {
                log.info("Coalescing {} due occurrences of job {} into one run", due.size(), runtime.code());
            }
            dispatch(runtime, newContext(runtime, TriggerType.SCHEDULED, latest));
            return;
        }
        for (Instant scheduledTime : due) {
            if (Duration.between(scheduledTime, now).compareTo(misfireGraceTime) > 0) {
                reportMissed(runtime, scheduledTime, now);
            } else {
                dispatch(runtime, newContext(runtime, TriggerType.SCHEDULED, scheduledTime));
            }
        }
    }

    private CompletableFuture<RunStatus> dispatch(JobRuntime runtime, JobContext context) {
        try {
            if (!lockingEnabled) {
                return runAttempt(runtime, context, null);
            }
            return CompletableFuture.supplyAsync(() -> acquireLease(runtime, context), executor.getWorkerPool())
                    .thenCompose(lease -> {
                        if (lease == null) {
                            return CompletableFuture.completedFuture(skip(runtime, context, RunStatus.SKIPPED_LOCK));
                        }
                        return runAttempt(runtime, context, lease)
                                .whenComplete((status, error) -> lease.releaseWhenIdle());
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Dropped run {} of job {}: scheduler is shutting down", context.runId(), runtime.code());
            return CompletableFuture.failedFuture(e);
        }
    }

    private LockLease acquireLease(JobRuntime runtime, JobContext context) {
        String key = LOCK_KEY_PREFIX + runtime.code();
        Duration timeout = runtime.definition.getTimeout().orElse(lockTimeout);
        if (!lock.acquire(key, timeout)) {
            log.debug("Job {} skipped: another instance is running (run_id: {})", runtime.code(), context.runId());
            return null;
        }
        long renewMillis = Math.max(1L, timeout.toMillis() / 3);
        ScheduledFuture<?> renewal;
        try {
            renewal = controlLoop.scheduleAtFixedRate(() -> renewLease(key, timeout),
                    renewMillis, renewMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            renewal = null;
        }
        return new LockLease(key, renewal);
    }

    private void renewLease(String key, Duration timeout) {
        try {
            if (!lock.extend(key, timeout)) {
                log.warn("Failed to extend lock {}; another instance may start the job", key);
            }
        } catch (RuntimeException e) {
            log.error("Error extending lock {}", key, e);
        }
    }

    private CompletableFuture<RunStatus> runAttempt(JobRuntime runtime, JobContext context, LockLease lease) {
        JobDefinition definition = runtime.definition;
        AtomicReference<JobContext> startedContext = new AtomicReference<>();
        JobWork work = () -> {
            JobContext started = context.withStartTime(clock.instant());
            startedContext.set(started);
            attemptStarted(runtime, started);
            return JobWork.of(definition.getJob(), started).start();
        };
        ExecutionLimits limits = new ExecutionLimits(runtime.code(), definition.effectiveMaxInstances(),
                definition.getTimeout().orElse(null));

        CompletableFuture<ExecutionResult> execution;
        try {
            ExecutionHandle handle = executor.submit(work, limits);
            if (lease != null) {
                lease.track(handle.finished());
            }
            execution = handle.result();
        } catch (RuntimeException e) {
            execution = CompletableFuture.failedFuture(e);
        }
        return execution.handle((result, error) -> {
            JobContext attempted = startedContext.get() != null ? startedContext.get() : context;
            if (error != null) {
                return attemptFailed(runtime, attempted, JobExecutor.unwrap(error), lease);
            }
            if (result.rejected()) {
                return CompletableFuture.completedFuture(skip(runtime, context, RunStatus.SKIPPED_CONCURRENCY));
            }
            attemptSucceeded(runtime, attempted, result.value());
            return CompletableFuture.completedFuture(RunStatus.SUCCEEDED);
        }).thenCompose(Function.identity());
    }

    private void attemptStarted(JobRuntime runtime, JobContext context) {
        runtime.runCount.incrementAndGet();
        runtime.lastRunId = context.runId();
        runtime.lastRunTime = context.startTime();
        runtime.lastStatus = RunStatus.RUNNING;
        if (history != null) {
            history.recordStart(runtime.definition.getOwnerCode(), context);
        }
        persist(runtime);
    }

    private void attemptSucceeded(JobRuntime runtime, JobContext context, Object result) {
        Instant endTime = clock.instant();
        Duration duration = elapsed(context, endTime);
        runtime.successCount.incrementAndGet();
        runtime.lastStatus = RunStatus.SUCCEEDED;
        if (history != null) {
            history.recordSuccess(runtime.definition.getOwnerCode(), context, endTime, result);
        }
        persist(runtime);
        log.info("Job executed successfully: {}, run_id: {}, duration: {}ms",
                context.jobCode(), context.runId(), duration.toMillis());

        ScheduledJob job = runtime.definition.getJob();
        invokeSafely("onSuccess", context, () -> job.onSuccess(context, result));
        notifyListeners(listener -> listener.onJobExecuted(new JobExecutedEvent(context, endTime, duration, result)));
    }

    private CompletableFuture<RunStatus> attemptFailed(JobRuntime runtime, JobContext context, Throwable error,
                                                      LockLease lease) {
        Instant endTime = clock.instant();
        Duration duration = elapsed(context, endTime);
        JobDefinition definition = runtime.definition;
        RetryStrategy strategy = definition.effectiveRetryStrategy();
        boolean willRetry = !shutdown && strategy.shouldRetry(error, context.attempt());

        runtime.failCount.incrementAndGet();
        runtime.lastStatus = willRetry ? RunStatus.FAILED_RETRY_PENDING : RunStatus.FAILED_FINAL;
        if (history != null) {
            history.recordFailure(definition.getOwnerCode(), context, endTime, error, willRetry);
        }
        persist(runtime);
        log.error("Job failed: {}, run_id: {}, attempt: {}, duration: {}ms",
                context.jobCode(), context.runId(), context.attempt(), duration.toMillis(), error);

        ScheduledJob job = definition.getJob();
        invokeSafely("onError", context, () -> job.onError(context, error));
        notifyListeners(listener -> listener.onJobError(new JobErrorEvent(context, endTime, duration, error, willRetry)));

        if (!willRetry) {
            return CompletableFuture.completedFuture(RunStatus.FAILED_FINAL);
        }
        return scheduleRetry(runtime, context, error, endTime, lease);
    }

    private CompletableFuture<RunStatus> scheduleRetry(JobRuntime runtime, JobContext failed, Throwable error,
                                                      Instant failedAt, LockLease lease) {
        Duration delay = runtime.definition.effectiveRetryStrategy().getDelay(failed.attempt());
        JobContext next = failed.nextAttempt(newRunId(), runtime.runCount.get());

        CompletableFuture<Void> delayElapsed = new CompletableFuture<>();
        try {
            controlLoop.schedule(() -> delayElapsed.complete(null), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Dropped retry of job {} (run_id: {}): scheduler is shutting down",
                    failed.jobCode(), failed.runId());
            return CompletableFuture.completedFuture(RunStatus.FAILED_FINAL);
        }
        log.info("Scheduling retry for job {}, attempt {}, delay: {}ms",
                failed.jobCode(), next.attempt(), delay.toMillis());

        ScheduledJob job = runtime.definition.getJob();
        invokeSafely("onRetry", failed, () -> job.onRetry(failed, error));
        notifyListeners(listener -> listener.onJobRetry(
                new JobRetryEvent(failed, next.attempt(), delay, failedAt.plus(delay), error)));

        return delayElapsed.thenCompose(ignored -> {
            if (runtimes.get(runtime.code()) != runtime) {
                log.info("Job {} was removed; abandoning retry {}", runtime.code(), next.runId());
                return CompletableFuture.completedFuture(RunStatus.FAILED_FINAL);
            }
            return runAttempt(runtime, next, lease);
        });
    }

    private RunStatus skip(JobRuntime runtime, JobContext context, RunStatus reason) {
        log.debug("Job {} skipped ({}), run_id: {}", runtime.code(), reason, context.runId());
        if (history != null) {
            history.recordSkip(runtime.definition.getOwnerCode(), context, reason);
        }
        notifyListeners(listener -> listener.onJobSkipped(new JobSkippedEvent(context, reason)));
        return reason;
    }

    private void reportMissed(JobRuntime runtime, Instant scheduledTime, Instant now) {
        log.warn("Job missed: {} (scheduled at {}, {}ms late)", runtime.code(), scheduledTime,
                Duration.between(scheduledTime, now).toMillis());
        if (history != null) {
            history.recordSkip(runtime.definition.getOwnerCode(),
                    newContext(runtime, TriggerType.SCHEDULED, scheduledTime), RunStatus.MISSED);
        }
        JobDefinition definition = runtime.definition;
        notifyListeners(listener -> listener.onJobMissed(
                new JobMissedEvent(definition.getCode(), definition.getName(), scheduledTime, now)));
    }

    private JobContext newContext(JobRuntime runtime, TriggerType triggerType, Instant scheduledTime) {
        JobDefinition definition = runtime.definition;
        return new JobContext(runtime.jobId, definition.getCode(), definition.getName(), definition.getDescription(),
                newRunId(), 1, triggerType, scheduledTime, null, null, runtime.runCount.get(),
                definition.getExtra());
    }

    String newRunId() {
        StringBuilder suffix = new StringBuilder(6);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < 6; i++) {
            suffix.append(RUN_ID_CHARS.charAt(random.nextInt(RUN_ID_CHARS.length())));
        }
        return "run_" + LocalDateTime.ofInstant(clock.instant(), zone).format(RUN_ID_TIME) + "_" + suffix;
    }

    private static Duration elapsed(JobContext context, Instant endTime) {
        return context.startTime() == null ? Duration.ZERO : Duration.between(context.startTime(), endTime);
    }

    private void invokeSafely(String callback, JobContext context, Runnable invocation) {
        try {
            invocation.run();
        } catch (RuntimeException e) {
            log.error("{} callback failed for job {} (run_id: {})", callback, context.jobCode(), context.runId(), e);
        }
    }

    private void notifyListeners(Consumer<SchedulerListener> notification) {
        for (SchedulerListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                log.error("Error in event listener {}", listener.getClass().getName(), e);
            }
        }
    }

    private void persist(JobRuntime runtime) {
        try {
            store.save(runtime.toState());
        } catch (RuntimeException e) {
            log.error("Failed to persist state of job {}", runtime.code(), e);
        }
    }

    private void deleteState(String code) {
        try {
            store.delete(code);
        } catch (RuntimeException e) {
            log.error("Failed to delete stored state of job {}", code, e);
        }
    }

    /**
     * A held lock, renewed until every attempt started under it has stopped running.
     */
    private final class LockLease {

        private final String key;
        private final ScheduledFuture<?> renewal;
        private final Queue<CompletableFuture<Void>> attempts = new ConcurrentLinkedQueue<>();

        private LockLease(String key, ScheduledFuture<?> renewal) {
            this.key = key;
            this.renewal = renewal;
        }

        void track(CompletableFuture<Void> attemptFinished) {
            attempts.add(attemptFinished);
        }

        void releaseWhenIdle() {
            CompletableFuture<?>[] pending = attempts.stream()
                    .filter(attempt -> !attempt.isDone())
                    .toArray(CompletableFuture<?>[]::new);
            if (pending.length == 0) {
                release();
                return;
            }
            log.warn("Keeping lock {} until timed-out work of the job stops", key);
            CompletableFuture.allOf(pending).whenComplete((ignored, error) -> release());
        }

        private void release() {
            if (renewal != null) {
                renewal.cancel(false);
            }
            try {
                lock.release(key);
            } catch (RuntimeException e) {
                log.warn("Failed to release lock {}", key, e);
            }
        }
    }

    /**
     * Mutable scheduling state of one job code. Trigger state is guarded by the runtime's
     * monitor; counters are atomic.
     */
    private static final class JobRuntime {

        private final String jobId;
        private volatile JobDefinition definition;
        private volatile Instant nextFireTime;
        private volatile boolean armed;
        private volatile boolean paused;
        private final AtomicLong runCount = new AtomicLong();
        private final AtomicLong successCount = new AtomicLong();
        private final AtomicLong failCount = new AtomicLong();
        private volatile String lastRunId;
        private volatile Instant lastRunTime;
        private volatile RunStatus lastStatus;

        private JobRuntime(JobDefinition definition, String jobId) {
            this.definition = definition;
            this.jobId = jobId;
        }

        String code() {
            return definition.getCode();
        }

        void restore(JobState state) {
            this.nextFireTime = state.nextFireTime();
            this.armed = state.nextFireTime() != null;
            this.paused = state.paused();
            this.runCount.set(state.runCount());
            this.successCount.set(state.successCount());
            this.failCount.set(state.failCount());
            this.lastRunId = state.lastRunId();
            this.lastRunTime = state.lastRunTime();
            this.lastStatus = state.lastStatus();
        }

        /**
         * Computes the first fire time unless it is already known.
         *
         * @return whether the state changed
         */
        synchronized boolean arm(Instant now) {
            if (armed || definition.isMultiTrigger()) {
                return false;
            }
            rearm(now);
            return true;
        }

        synchronized void rearm(Instant now) {
            if (definition.isMultiTrigger()) {
                return;
            }
            nextFireTime = definition.getTrigger().nextFireTime(now).orElse(null);
            armed = true;
        }

        JobState toState() {
            return new JobState(code(), jobId, nextFireTime, paused, runCount.get(), successCount.get(),
                    failCount.get(), lastRunId, lastRunTime, lastStatus);
        }
    }
}
