package com.scholary.captions.config;

import com.scholary.captions.logging.MdcTaskDecorator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Two bounded pools: one runs whole caption jobs, the other runs the windows of those jobs.
 * Keeping them separate means a job waiting for its windows never occupies a window thread. Both
 * copy the submitting thread's MDC so logs carry the job id.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "jobExecutor")
  public ThreadPoolTaskExecutor jobExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.jobThreads());
    executor.setMaxPoolSize(properties.jobThreads());
    executor.setQueueCapacity(properties.jobQueueSize());
    executor.setThreadNamePrefix("caption-job-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }

  @Bean(name = "windowExecutor")
  public ThreadPoolTaskExecutor windowExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setThreadNamePrefix("caption-window-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }
}
