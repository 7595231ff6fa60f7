/*
 * Where: Watch configuration
 * What: Bounded thread pools for status checks and job dispatch
 * Why: Pool size is the ceiling on concurrent calls to the page source and channel providers
 */
package com.engagewatch.watch.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExecutorConfig {

  public static final String POLL_EXECUTOR = "pollExecutor";
  public static final String DISPATCH_EXECUTOR = "dispatchExecutor";

  @Bean(name = POLL_EXECUTOR)
  ThreadPoolTaskExecutor pollExecutor(PollerProperties properties) {
    return boundedExecutor("watch-poll-", properties.maxConcurrency(), properties.batchSize());
  }

  @Bean(name = DISPATCH_EXECUTOR)
  ThreadPoolTaskExecutor dispatchExecutor(DispatchProperties properties) {
    return boundedExecutor("watch-dispatch-", properties.maxConcurrency(), properties.batchSize());
  }

  private ThreadPoolTaskExecutor boundedExecutor(String prefix, int threads, int queueCapacity) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix(prefix);
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(Math.max(queueCapacity, threads));
    // a full queue runs the task on the scheduler thread, which slows the next claim
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
