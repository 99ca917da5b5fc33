package org.chucc.graphserver.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for asynchronous task execution.
 * Provides a bounded worker pool that bulk mutations fan out on.
 */
@Configuration
@EnableConfigurationProperties(AsyncConfig.BulkExecutorProperties.class)
public class AsyncConfig {

  private final BulkExecutorProperties properties;

  /**
   * Constructor for AsyncConfig.
   *
   * @param properties bulk executor properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "BulkExecutorProperties is a Spring-managed configuration bean")
  public AsyncConfig(BulkExecutorProperties properties) {
    this.properties = properties;
  }

  /**
   * Carries the submitting thread's MDC (correlation ID) into the worker thread.
   *
   * @param task the task to wrap
   * @return the wrapped task
   */
  static Runnable withCallerMdc(Runnable task) {
    Map<String, String> context = MDC.getCopyOfContextMap();
    return () -> {
      Map<String, String> previous = MDC.getCopyOfContextMap();
      if (context == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(context);
      }
      try {
        task.run();
      } finally {
        if (previous == null) {
          MDC.clear();
        } else {
          MDC.setContextMap(previous);
        }
      }
    };
  }

  /**
   * Thread pool for bulk create/update items.
   * Callers block on each item's result, so the pool rejects instead of queuing unboundedly.
   *
   * @return ThreadPoolTaskExecutor for bulk items
   */
  @Bean(name = "bulkExecutor")
  public ThreadPoolTaskExecutor bulkExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.corePoolSize);
    executor.setMaxPoolSize(properties.maxPoolSize);
    executor.setQueueCapacity(properties.queueCapacity);
    executor.setThreadNamePrefix("bulk-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(properties.awaitTerminationSeconds);
    executor.setTaskDecorator(AsyncConfig::withCallerMdc);
    executor.initialize();
    return executor;
  }

  /**
   * Configuration properties for the bulk executor thread pool.
   */
  @ConfigurationProperties(prefix = "graph.bulk.executor")
  public static class BulkExecutorProperties {
    private int corePoolSize = 8;
    private int maxPoolSize = 20;
    private int queueCapacity = 1000;
    private int awaitTerminationSeconds = 30;

    public int getCorePoolSize() {
      return corePoolSize;
    }

    public void setCorePoolSize(int corePoolSize) {
      this.corePoolSize = corePoolSize;
    }

    public int getMaxPoolSize() {
      return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
      this.maxPoolSize = maxPoolSize;
    }

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }

    public int getAwaitTerminationSeconds() {
      return awaitTerminationSeconds;
    }

    public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
      this.awaitTerminationSeconds = awaitTerminationSeconds;
    }
  }
}
