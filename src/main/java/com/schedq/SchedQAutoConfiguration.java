package com.schedq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.schedq.config.SchedQProperties;
import com.schedq.event.SchedulerListener;
import com.schedq.executor.JobExecutor;
import com.schedq.history.ExecutionHistory;
import com.schedq.history.InMemoryExecutionHistory;
import com.schedq.internal.HistoryCleaner;
import com.schedq.internal.JobDefinitionInitializer;
import com.schedq.internal.SchedQMetrics;
import com.schedq.lock.DistributedLock;
import com.schedq.lock.InMemoryDistributedLock;
import com.schedq.lock.NoOpDistributedLock;
import com.schedq.lock.RedisDistributedLock;
import com.schedq.store.InMemoryJobStore;
import com.schedq.store.JobStore;
import com.schedq.store.JsonFileJobStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.nio.file.Path;
import java.time.Clock;

@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@EnableScheduling
@EnableConfigurationProperties(SchedQProperties.class)
@ConditionalOnProperty(prefix = "schedq", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedQAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SchedQAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(name = "schedqObjectMapper")
    public ObjectMapper schedqObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRegistry jobRegistry() {
        return new JobRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutor jobExecutor(SchedQProperties properties) {
        return new JobExecutor(properties.getMaxWorkers());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStore jobStore(SchedQProperties properties, @Qualifier("schedqObjectMapper") ObjectMapper objectMapper) {
        if (properties.getStore() == SchedQProperties.Store.PERSISTENT) {
            return new JsonFileJobStore(Path.of(properties.getStorePath()), objectMapper);
        }
        return new InMemoryJobStore();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "schedq.history", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ExecutionHistory executionHistory() {
        return new InMemoryExecutionHistory();
    }

    @Bean
    @ConditionalOnMissingBean
    public DistributedLock distributedLock(SchedQProperties properties) {
        if (properties.getLock().isEnabled()) {
            log.warn("Distributed locking is enabled but Spring Data Redis is not available; "
                    + "locks only exclude runs within this JVM");
            return new InMemoryDistributedLock();
        }
        return new NoOpDistributedLock();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(
            JobRegistry jobRegistry,
            JobExecutor jobExecutor,
            DistributedLock distributedLock,
            JobStore jobStore,
            ObjectProvider<ExecutionHistory> executionHistory,
            SchedQProperties properties) {
        return new JobScheduler(jobRegistry, jobExecutor, distributedLock, jobStore,
                executionHistory.getIfAvailable(), properties, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobDefinitionInitializer jobDefinitionInitializer(
            JobScheduler jobScheduler,
            ObjectProvider<JobDefinition> jobDefinitions,
            ObjectProvider<SchedulerListener> listeners,
            SchedQProperties properties) {
        return new JobDefinitionInitializer(jobScheduler, jobDefinitions.orderedStream().toList(),
                listeners.orderedStream().toList(), properties.isShutdownWait());
    }

    @Bean
    @ConditionalOnProperty(prefix = "schedq.history", name = "enabled", havingValue = "true", matchIfMissing = true)
    public HistoryCleaner schedqHistoryCleaner(ExecutionHistory executionHistory, SchedQProperties properties) {
        return new HistoryCleaner(executionHistory, properties, Clock.systemUTC());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(StringRedisTemplate.class)
    @ConditionalOnProperty(prefix = "schedq.lock", name = "enabled", havingValue = "true")
    static class RedisLockConfiguration {

        @Bean
        @ConditionalOnMissingBean(DistributedLock.class)
        public RedisDistributedLock redisDistributedLock(SchedQProperties properties,
                                                         ObjectProvider<StringRedisTemplate> redisTemplate) {
            SchedQProperties.Lock lock = properties.getLock();
            if (lock.getBackendUrl() != null && !lock.getBackendUrl().isBlank()) {
                return RedisDistributedLock.fromUrl(lock.getBackendUrl(), lock.getPrefix());
            }
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null) {
                throw new IllegalStateException(
                        "schedq.lock.enabled=true requires schedq.lock.backend-url or a StringRedisTemplate bean");
            }
            return new RedisDistributedLock(template, lock.getPrefix());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        public SchedQMetrics schedqMetrics(JobRegistry jobRegistry, JobExecutor jobExecutor,
                                           MeterRegistry meterRegistry) {
            return new SchedQMetrics(jobRegistry, jobExecutor, meterRegistry);
        }
    }
}
