package org.chucc.graphserver.testutil;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/**
 * Supplies an in-memory meter registry to web slice tests, where metrics auto-configuration
 * is not applied.
 */
@TestConfiguration
public class MeterRegistryTestConfig {

  @Bean
  public MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }
}
