package org.chucc.graphserver.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class AsyncConfigTest {

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void withCallerMdc_carriesCorrelationIdIntoTask() throws Exception {
    // Given
    MDC.put("correlationId", "bulk-42");
    AtomicReference<String> seen = new AtomicReference<>();
    Runnable task = AsyncConfig.withCallerMdc(() -> seen.set(MDC.get("correlationId")));
    MDC.clear();

    // When
    Thread worker = new Thread(task);
    worker.start();
    worker.join();

    // Then
    assertThat(seen.get()).isEqualTo("bulk-42");
  }

  @Test
  void withCallerMdc_restoresPreviousContextAfterRun() {
    Runnable task = AsyncConfig.withCallerMdc(() -> MDC.put("extra", "x"));
    MDC.put("correlationId", "worker-own");

    task.run();

    assertThat(MDC.get("correlationId")).isEqualTo("worker-own");
    assertThat(MDC.get("extra")).isNull();
  }
}
