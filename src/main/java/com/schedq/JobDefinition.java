package com.schedq;

import com.schedq.retry.RetryStrategy;
import com.schedq.trigger.Trigger;
import org.springframework.context.annotation.Description;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, validated declaration of a job: what runs, when, and under which retry and
 * concurrency policy.
 * <p>
 * A definition with several triggers stands for one sub-job per trigger, coded
 * {@code CODE#1 .. CODE#n}, each scheduled, retried and locked on its own but sharing the
 * parent's work and policy.
 */
public final class JobDefinition {

    static final String SUB_JOB_SEPARATOR = "#";

    private final String code;
    private final String name;
    private final String description;
    private final List<Trigger> triggers;
    private final int maxRetries;
    private final Duration retryDelay;
    private final RetryStrategy retryStrategy;
    private final boolean concurrent;
    private final int maxInstances;
    private final Duration timeout;
    private final ScheduledJob job;
    private final String parentCode;
    private final Map<String, Object> extra;

    private JobDefinition(String code, String name, String description, List<Trigger> triggers, int maxRetries,
                          Duration retryDelay, RetryStrategy retryStrategy, boolean concurrent, int maxInstances,
                          Duration timeout, ScheduledJob job, String parentCode, Map<String, Object> extra) {
        this.code = code;
        this.name = name;
        this.description = description;
        this.triggers = List.copyOf(triggers);
        this.maxRetries = maxRetries;
        this.retryDelay = retryDelay;
        this.retryStrategy = retryStrategy;
        this.concurrent = concurrent;
        this.maxInstances = maxInstances;
        this.timeout = timeout;
        this.job = job;
        this.parentCode = parentCode;
        this.extra = Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public static Builder builder(String code) {
        return new Builder().code(code);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<Trigger> getTriggers() {
        return triggers;
    }

    /**
     * The single trigger of a schedulable definition.
     *
     * @throws IllegalStateException if this definition declares several triggers
     */
    public Trigger getTrigger() {
        if (isMultiTrigger()) {
            throw new IllegalStateException("Job '" + code + "' declares " + triggers.size()
                    + " triggers; schedule its sub-jobs instead");
        }
        return triggers.get(0);
    }

    public boolean isMultiTrigger() {
        return triggers.size() > 1;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public Optional<RetryStrategy> getRetryStrategy() {
        return Optional.ofNullable(retryStrategy);
    }

    /**
     * The explicit retry strategy, or a fixed-delay policy allowing {@code maxRetries}
     * retries after the first attempt.
     */
    public RetryStrategy effectiveRetryStrategy() {
        if (retryStrategy != null) {
            return retryStrategy;
        }
        return maxRetries == 0 ? RetryStrategy.none() : RetryStrategy.fixed(maxRetries + 1, retryDelay);
    }

    public boolean isConcurrent() {
        return concurrent;
    }

    public int getMaxInstances() {
        return maxInstances;
    }

    public int effectiveMaxInstances() {
        return concurrent ? maxInstances : 1;
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public ScheduledJob getJob() {
        return job;
    }

    public Optional<String> getParentCode() {
        return Optional.ofNullable(parentCode);
    }

    public Map<String, Object> getExtra() {
        return extra;
    }

    /**
     * Code under which runs of this definition are reported: the parent code for a
     * sub-job, the own code otherwise.
     */
    public String getOwnerCode() {
        return parentCode != null ? parentCode : code;
    }

    public JobDefinition withTriggers(List<Trigger> newTriggers) {
        return new JobDefinition(code, name, description, newTriggers, maxRetries, retryDelay, retryStrategy,
                concurrent, maxInstances, timeout, job, parentCode, extra);
    }

    /**
     * One single-trigger definition per trigger, in declaration order. Empty for a
     * single-trigger definition.
     */
    public List<JobDefinition> subJobs() {
        if (!isMultiTrigger()) {
            return List.of();
        }
        List<JobDefinition> subJobs = new ArrayList<>(triggers.size());
        for (int i = 0; i < triggers.size(); i++) {
            int index = i + 1;
            subJobs.add(new JobDefinition(code + SUB_JOB_SEPARATOR + index, name + " (trigger " + index + ")",
                    description, List.of(triggers.get(i)), maxRetries, retryDelay, retryStrategy, concurrent,
                    maxInstances, timeout, job, code, extra));
        }
        return subJobs;
    }

    @Override
    public String toString() {
        return "JobDefinition[" + code + ", " + name + ", triggers=" + triggers + "]";
    }

    public static final class Builder {

        private String code;
        private String name;
        private String description;
        private Trigger trigger;
        private List<Trigger> triggers;
        private int maxRetries = 0;
        private Duration retryDelay = Duration.ofSeconds(60);
        private RetryStrategy retryStrategy;
        private boolean concurrent = true;
        private int maxInstances = 1;
        private Duration timeout;
        private ScheduledJob job;
        private final Map<String, Object> extra = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder trigger(Trigger trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder triggers(List<Trigger> triggers) {
            this.triggers = triggers;
            return this;
        }

        public Builder triggers(Trigger... triggers) {
            return triggers(Arrays.asList(triggers));
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder retryStrategy(RetryStrategy retryStrategy) {
            this.retryStrategy = retryStrategy;
            return this;
        }

        public Builder concurrent(boolean concurrent) {
            this.concurrent = concurrent;
            return this;
        }

        public Builder maxInstances(int maxInstances) {
            this.maxInstances = maxInstances;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder job(ScheduledJob job) {
            this.job = job;
            return this;
        }

        public Builder extra(String key, Object value) {
            this.extra.put(key, value);
            return this;
        }

        public JobDefinition build() {
            if (code == null || code.isBlank()) {
                throw new InvalidJobDefinitionException("Job code must not be blank");
            }
            String jobCode = code.trim();
            if (jobCode.contains(SUB_JOB_SEPARATOR)) {
                throw new InvalidJobDefinitionException(
                        "Job code '" + jobCode + "' must not contain '" + SUB_JOB_SEPARATOR + "'");
            }
            if (job == null) {
                throw new InvalidJobDefinitionException("Job '" + jobCode + "' must provide an execute implementation");
            }
            List<Trigger> resolvedTriggers = resolveTriggers(jobCode);
            if (maxRetries < 0) {
                throw new InvalidJobDefinitionException(
                        "Job '" + jobCode + "' maxRetries must not be negative but was " + maxRetries);
            }
            if (retryDelay == null || retryDelay.isNegative()) {
                throw new InvalidJobDefinitionException(
                        "Job '" + jobCode + "' retryDelay must not be negative but was " + retryDelay);
            }
            if (maxInstances < 1) {
                throw new InvalidJobDefinitionException(
                        "Job '" + jobCode + "' maxInstances must be at least 1 but was " + maxInstances);
            }
            if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
                throw new InvalidJobDefinitionException(
                        "Job '" + jobCode + "' timeout must be positive but was " + timeout);
            }
            return new JobDefinition(jobCode, resolveName(jobCode), resolveDescription(), resolvedTriggers,
                    maxRetries, retryDelay, retryStrategy, concurrent, maxInstances, timeout, job, null, extra);
        }

        private List<Trigger> resolveTriggers(String jobCode) {
            if (trigger != null && triggers != null) {
                throw new InvalidJobDefinitionException(
                        "Job '" + jobCode + "' must define either 'trigger' or 'triggers', not both");
            }
            if (trigger != null) {
                return List.of(trigger);
            }
            if (triggers == null || triggers.isEmpty()) {
                throw new InvalidJobDefinitionException("Job '" + jobCode + "' must define at least one trigger");
            }
            if (triggers.contains(null)) {
                throw new InvalidJobDefinitionException("Job '" + jobCode + "' declares a null trigger");
            }
            return triggers;
        }

        private String resolveName(String jobCode) {
            if (name != null && !name.isBlank()) {
                return name.trim();
            }
            Class<?> jobClass = ClassUtils.getUserClass(job);
            String simpleName = jobClass.getSimpleName();
            if (simpleName.isEmpty() || jobClass.isSynthetic() || simpleName.contains("$$Lambda")) {
                return jobCode;
            }
            return simpleName;
        }

        private String resolveDescription() {
            if (description != null) {
                return description;
            }
            Description annotation = AnnotationUtils.findAnnotation(ClassUtils.getUserClass(job), Description.class);
            return annotation != null ? annotation.value() : "";
        }
    }
}
