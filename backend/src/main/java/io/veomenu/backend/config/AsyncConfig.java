package io.veomenu.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

  /**
   * Bounded pool for notification deliveries. Deliveries beyond the queue capacity are rejected
   * and reported as failed channels rather than blocking the request thread.
   */
  @Bean(name = "notificationExecutor")
  ThreadPoolTaskExecutor notificationExecutor(NotificationProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.poolSize());
    executor.setMaxPoolSize(properties.poolSize());
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("notify-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();
    return executor;
  }
}
