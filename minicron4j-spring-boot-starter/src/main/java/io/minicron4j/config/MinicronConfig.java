package io.minicron4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.minicron4j.JobExecutor;
import io.minicron4j.NotificationSink;
import io.minicron4j.Scheduler;
import io.minicron4j.internal.file.FileJobStore;
import io.minicron4j.internal.file.FileScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration entrypoint for scheduler components.
 *
 * <p>Applications supply a {@link JobExecutor} bean and optionally a {@link NotificationSink}.
 */
@AutoConfiguration
@ConditionalOnClass({Scheduler.class, ObjectMapper.class})
@EnableConfigurationProperties(SchedulerProperties.class)
@ConditionalOnProperty(prefix = "minicron", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MinicronConfig {
    private static final Logger log = LoggerFactory.getLogger(MinicronConfig.class);

    @Bean
    @ConditionalOnMissingBean
    protected FileJobStore fileJobStore(SchedulerProperties props, ObjectProvider<ObjectMapper> objectMapper) {
        return new FileJobStore(props.resolveJobsPath(), objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(Scheduler.class)
    public FileScheduler scheduler(SchedulerProperties props,
                                   FileJobStore jobStore,
                                   ObjectProvider<JobExecutor> executor,
                                   ObjectProvider<NotificationSink> notificationSink) {
        JobExecutor jobExecutor = executor.getIfAvailable(() -> job ->
                log.warn("No JobExecutor bean registered, job fired without work id={} name={}",
                        job.getId(), job.getName()));
        return new FileScheduler(props, jobStore, jobExecutor, notificationSink.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public MinicronLifecycle minicronLifecycle(Scheduler scheduler) {
        return new MinicronLifecycle(scheduler);
    }
}
