package com.schedq.internal;

import com.schedq.JobDefinition;
import com.schedq.JobScheduler;
import com.schedq.event.SchedulerListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.List;

/**
 * Registers every {@link JobDefinition} and {@link SchedulerListener} bean with the
 * scheduler and starts it once the context is refreshed. Stops the scheduler on
 * context shutdown.
 */
public class JobDefinitionInitializer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(JobDefinitionInitializer.class);

    private final JobScheduler scheduler;
    private final List<JobDefinition> definitions;
    private final List<SchedulerListener> listeners;
    private final boolean shutdownWait;
    private volatile boolean running = false;

    public JobDefinitionInitializer(
            JobScheduler scheduler,
            List<JobDefinition> definitions,
            List<SchedulerListener> listeners,
            boolean shutdownWait) {
        this.scheduler = scheduler;
        this.definitions = definitions;
        this.listeners = listeners;
        this.shutdownWait = shutdownWait;
    }

    @Override
    public void start() {
        listeners.forEach(scheduler::addListener);

        int registered = 0;
        for (JobDefinition definition : definitions) {
            if (scheduler.getRegistry().contains(definition.getCode())) {
                log.debug("Job {} already registered; skipping bean definition", definition.getCode());
                continue;
            }
            scheduler.addJob(definition);
            registered++;
        }
        log.info("Registered {} job definition bean(s) and {} listener(s)", registered, listeners.size());

        scheduler.start();
        this.running = true;
    }

    @Override
    public void stop() {
        scheduler.shutdown(shutdownWait);
        this.running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE; // Start last
    }
}
