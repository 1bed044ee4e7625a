package com.scholary.captioner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for the threads that drive a captioning run.
 *
 * <ul>
 *   <li>workerExecutor: one thread per device worker, sized to the configured device list
 *   <li>coordinatorExecutor: a single thread that prepares devices and waits for workers
 *   <li>broadcastScheduler: a single thread that delivers progress snapshots in order
 * </ul>
 *
 * <p>The manager only ever runs one job at a time, so the coordinator pool never needs more than
 * one thread.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "workerExecutor")
  public ThreadPoolTaskExecutor workerExecutor(CaptionerProperties properties) {
    int threads = properties.devices().size();

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(threads);
    executor.setThreadNamePrefix("caption-worker-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "coordinatorExecutor")
  public ThreadPoolTaskExecutor coordinatorExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(1);
    executor.setThreadNamePrefix("caption-job-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "broadcastScheduler")
  public ThreadPoolTaskScheduler broadcastScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("progress-broadcast-");
    scheduler.initialize();
    return scheduler;
  }
}
