package com.schedq;

import com.schedq.retry.FixedRetryStrategy;
import com.schedq.retry.RetryStrategy;
import com.schedq.trigger.Trigger;
import com.schedq.trigger.Triggers;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.Description;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobDefinitionTest {

    private static final ScheduledJob NOOP = context -> null;

    @Description("Sends the daily report")
    static class DailyReportJob implements ScheduledJob {
        @Override
        public Object execute(JobContext context) {
            return "sent";
        }
    }

    @Test
    void shouldApplyDefaults() {
        JobDefinition definition = JobDefinition.builder("cleanup")
                .trigger(Triggers.interval(Duration.ofMinutes(5)))
                .job(NOOP)
                .build();

        assertEquals("cleanup", definition.getCode());
        assertEquals("cleanup", definition.getName());
        assertEquals("", definition.getDescription());
        assertEquals(0, definition.getMaxRetries());
        assertEquals(Duration.ofSeconds(60), definition.getRetryDelay());
        assertTrue(definition.isConcurrent());
        assertEquals(1, definition.getMaxInstances());
        assertThat(definition.getTimeout()).isEmpty();
        assertThat(definition.getParentCode()).isEmpty();
        assertFalse(definition.isMultiTrigger());
        assertThat(definition.effectiveRetryStrategy().shouldRetry(new RuntimeException(), 1)).isFalse();
    }

    @Test
    void shouldDeriveNameAndDescriptionFromJobClass() {
        JobDefinition definition = JobDefinition.builder("daily_report")
                .trigger(Triggers.cron("0 8 * * *"))
                .job(new DailyReportJob())
                .build();

        assertEquals("DailyReportJob", definition.getName());
        assertEquals("Sends the daily report", definition.getDescription());
    }

    @Test
    void shouldPreferExplicitNameAndDescription() {
        JobDefinition definition = JobDefinition.builder("daily_report")
                .name("Daily report")
                .description("Custom")
                .trigger(Triggers.cron("0 8 * * *"))
                .job(new DailyReportJob())
                .build();

        assertEquals("Daily report", definition.getName());
        assertEquals("Custom", definition.getDescription());
    }

    @Test
    void shouldDeriveFixedRetryStrategyFromMaxRetries() {
        JobDefinition definition = JobDefinition.builder("sync")
                .trigger(Triggers.interval(Duration.ofMinutes(1)))
                .maxRetries(2)
                .retryDelay(Duration.ofSeconds(5))
                .job(NOOP)
                .build();

        RetryStrategy strategy = definition.effectiveRetryStrategy();
        assertThat(strategy).isInstanceOf(FixedRetryStrategy.class);
        assertThat(strategy.getDelay(1)).isEqualTo(Duration.ofSeconds(5));
        assertTrue(strategy.shouldRetry(new RuntimeException(), 1));
        assertTrue(strategy.shouldRetry(new RuntimeException(), 2));
        assertFalse(strategy.shouldRetry(new RuntimeException(), 3));
    }

    @Test
    void shouldPreferExplicitRetryStrategy() {
        RetryStrategy strategy = RetryStrategy.linear(4, Duration.ofSeconds(1), Duration.ofSeconds(1));
        JobDefinition definition = JobDefinition.builder("sync")
                .trigger(Triggers.interval(Duration.ofMinutes(1)))
                .maxRetries(9)
                .retryStrategy(strategy)
                .job(NOOP)
                .build();

        assertThat(definition.effectiveRetryStrategy()).isSameAs(strategy);
    }

    @Test
    void shouldLimitNonConcurrentJobToOneInstance() {
        JobDefinition definition = JobDefinition.builder("report")
                .trigger(Triggers.interval(Duration.ofMinutes(1)))
                .concurrent(false)
                .maxInstances(5)
                .job(NOOP)
                .build();

        assertEquals(1, definition.effectiveMaxInstances());
    }

    @Test
    void shouldSplitMultiTriggerDefinitionIntoSubJobs() {
        Trigger morning = Triggers.cron("0 8 * * *");
        Trigger evening = Triggers.cron("0 20 * * *");
        JobDefinition definition = JobDefinition.builder("report")
                .name("Report")
                .triggers(morning, evening)
                .job(NOOP)
                .build();

        List<JobDefinition> subJobs = definition.subJobs();

        assertTrue(definition.isMultiTrigger());
        assertThat(subJobs).extracting(JobDefinition::getCode).containsExactly("report#1", "report#2");
        assertThat(subJobs).extracting(JobDefinition::getName).containsExactly("Report (trigger 1)", "Report (trigger 2)");
        assertThat(subJobs.get(0).getTrigger()).isSameAs(morning);
        assertThat(subJobs.get(1).getTrigger()).isSameAs(evening);
        assertThat(subJobs.get(0).getParentCode()).contains("report");
        assertThat(subJobs.get(0).getOwnerCode()).isEqualTo("report");
        assertThatThrownBy(definition::getTrigger).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRejectBothTriggerAndTriggers() {
        assertThatThrownBy(() -> JobDefinition.builder("x")
                .trigger(Triggers.cron("0 8 * * *"))
                .triggers(List.of(Triggers.cron("0 9 * * *")))
                .job(NOOP)
                .build())
                .isInstanceOf(InvalidJobDefinitionException.class)
                .hasMessageContaining("must define either 'trigger' or 'triggers', not both");
    }

    @Test
    void shouldRejectMissingTrigger() {
        assertThatThrownBy(() -> JobDefinition.builder("x").job(NOOP).build())
                .isInstanceOf(InvalidJobDefinitionException.class)
                .hasMessageContaining("at least one trigger");
        assertThatThrownBy(() -> JobDefinition.builder("x").triggers(List.of()).job(NOOP).build())
                .isInstanceOf(InvalidJobDefinitionException.class)
                .hasMessageContaining("at least one trigger");
        assertThatThrownBy(() -> JobDefinition.builder("x").triggers(Triggers.cron("0 8 * * *"), null).job(NOOP).build())
                .isInstanceOf(InvalidJobDefinitionException.class)
                .hasMessageContaining("null trigger");
    }

    @Test
    void shouldRejectInvalidCodeAndMissingJob() {
        Trigger trigger = Triggers.interval(Duration.ofMinutes(1));

        assertThatThrownBy(() -> JobDefinition.builder(" ").trigger(trigger).job(NOOP).build())
                .isInstanceOf(InvalidJobDefinitionException.class);
        assertThatThrownBy(() -> JobDefinition.builder("a#1").trigger(trigger).job(NOOP).build())
                .isInstanceOf(InvalidJobDefinitionException.class)
                .hasMessageContaining("must not contain '#'");
        assertThatThrownBy(() -> JobDefinition.builder("a").trigger(trigger).build())
                .isInstanceOf(InvalidJobDefinitionException.class)
                .hasMessageContaining("execute");
    }

    @Test
    void shouldRejectOutOfRangePolicies() {
        Trigger trigger = Triggers.interval(Duration.ofMinutes(1));

        assertThatThrownBy(() -> JobDefinition.builder("a").trigger(trigger).job(NOOP).maxRetries(-1).build())
                .isInstanceOf(InvalidJobDefinitionException.class);
        assertThatThrownBy(() -> JobDefinition.builder("a").trigger(trigger).job(NOOP).retryDelay(Duration.ofSeconds(-1)).build())
                .isInstanceOf(InvalidJobDefinitionException.class);
        assertThatThrownBy(() -> JobDefinition.builder("a").trigger(trigger).job(NOOP).maxInstances(0).build())
                .isInstanceOf(InvalidJobDefinitionException.class);
        assertThatThrownBy(() -> JobDefinition.builder("a").trigger(trigger).job(NOOP).timeout(Duration.ZERO).build())
                .isInstanceOf(InvalidJobDefinitionException.class);
    }

    @Test
    void shouldCopyExtraValues() {
        JobDefinition definition = JobDefinition.builder("a")
                .trigger(Triggers.interval(Duration.ofMinutes(1)))
                .job(NOOP)
                .extra("region", "eu")
                .build();

        assertThat(definition.getExtra()).containsEntry("region", "eu");
        assertThatThrownBy(() -> definition.getExtra().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }
}
