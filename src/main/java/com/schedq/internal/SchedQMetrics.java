package com.schedq.internal;

import com.schedq.JobRegistry;
import com.schedq.RunStatus;
import com.schedq.event.JobErrorEvent;
import com.schedq.event.JobExecutedEvent;
import com.schedq.event.JobMissedEvent;
import com.schedq.event.JobRetryEvent;
import com.schedq.event.JobSkippedEvent;
import com.schedq.event.SchedulerListener;
import com.schedq.executor.JobExecutor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes job gauges and per-outcome run counters. Registered with the scheduler as
 * a listener.
 */
public class SchedQMetrics implements SchedulerListener {

    private static final Logger log = LoggerFactory.getLogger(SchedQMetrics.class);

    private final JobRegistry jobRegistry;
    private final JobExecutor jobExecutor;
    private final MeterRegistry meterRegistry;

    public SchedQMetrics(JobRegistry jobRegistry, JobExecutor jobExecutor, MeterRegistry meterRegistry) {
        this.jobRegistry = jobRegistry;
        this.jobExecutor = jobExecutor;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering SchedQ gauges...");

        Gauge.builder("schedq.jobs.registered", jobRegistry, JobRegistry::size)
                .description("Number of registered SchedQ jobs, sub-jobs included")
                .register(meterRegistry);

        Gauge.builder("schedq.jobs.running", jobExecutor, executor -> executor.getRunningJobs().total())
                .description("Number of SchedQ job attempts currently executing")
                .register(meterRegistry);
    }

    @Override
    public void onJobExecuted(JobExecutedEvent event) {
        increment("succeeded");
    }

    @Override
    public void onJobError(JobErrorEvent event) {
        increment("failed");
    }

    @Override
    public void onJobRetry(JobRetryEvent event) {
        increment("retried");
    }

    @Override
    public void onJobMissed(JobMissedEvent event) {
        increment("missed");
    }

    @Override
    public void onJobSkipped(JobSkippedEvent event) {
        increment(event.reason() == RunStatus.SKIPPED_LOCK ? "skipped_lock" : "skipped_concurrency");
    }

    private void increment(String outcome) {
        Counter.builder("schedq.runs")
                .description("SchedQ runs by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
