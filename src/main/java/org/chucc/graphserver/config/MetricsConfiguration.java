package org.chucc.graphserver.config;

import io.micrometer.core.aop.CountedAspect;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Metrics setup: {@code @Timed}/{@code @Counted} support via AOP and a common
 * {@code application} tag on every meter.
 */
@Configuration
@EnableAspectJAutoProxy
public class MetricsConfiguration {

  /**
   * Tags every meter with the application name.
   *
   * @param applicationName spring.application.name
   * @return the customizer
   */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> commonTags(
      @Value("${spring.application.name:graph-server}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }

  /**
   * Enables {@code @Timed} on service operations (merge, expand, traverse, bulk).
   *
   * @param registry the meter registry
   * @return the timed aspect
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /**
   * Enables {@code @Counted} on write operations.
   *
   * @param registry the meter registry
   * @return the counted aspect
   */
  @Bean
  public CountedAspect countedAspect(MeterRegistry registry) {
    return new CountedAspect(registry);
  }
}
