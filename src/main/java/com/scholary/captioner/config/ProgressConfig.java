package com.scholary.captioner.config;

import com.scholary.captioner.progress.ProgressAggregator;
import com.scholary.captioner.progress.ProgressBroadcaster;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/** Configuration for progress aggregation and broadcasting. */
@Configuration
public class ProgressConfig {

  @Bean
  public ProgressBroadcaster progressBroadcaster(
      @Qualifier("broadcastScheduler") ThreadPoolTaskScheduler broadcastScheduler,
      CaptionerProperties properties) {
    return new ProgressBroadcaster(
        broadcastScheduler,
        Duration.ofMillis(properties.progress().broadcastIntervalMillis()));
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  public ProgressAggregator progressAggregator(
      ProgressBroadcaster progressBroadcaster, CaptionerProperties properties) {
    return new ProgressAggregator(
        properties.progress().eventQueueCapacity(), progressBroadcaster);
  }
}
