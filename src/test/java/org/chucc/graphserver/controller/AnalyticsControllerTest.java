package org.chucc.graphserver.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.chucc.graphserver.dto.AnalyticsItem;
import org.chucc.graphserver.dto.AnalyticsResponse;
import org.chucc.graphserver.exception.ValidationException;
import org.chucc.graphserver.service.AnalyticsService;
import org.chucc.graphserver.testutil.MeterRegistryTestConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Unit tests for AnalyticsController.
 */
@WebMvcTest(AnalyticsController.class)
@Import(MeterRegistryTestConfig.class)
class AnalyticsControllerTest {

  private static final UUID ID = UUID.fromString("01936c7f-8a2e-7890-abcd-ef1234567890");

  @Autowired
  private MockMvc mockMvc;

  @MockitoBean
  private AnalyticsService analyticsService;

  @Test
  void testMostAccessed() throws Exception {
    AnalyticsItem item = new AnalyticsItem(ID, ID, "Doc", "d", Map.of(), List.of(),
        Instant.parse("2025-01-10T14:30:00Z"), 7, 0L, Instant.parse("2025-01-01T00:00:00Z"));
    when(analyticsService.mostAccessed(5, 2, null))
        .thenReturn(new AnalyticsResponse(List.of(item), 1, Map.of("limit", 5)));

    mockMvc.perform(get("/api/graph/analytics/most-accessed")
            .param("limit", "5")
            .param("min_access_count", "2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[0].access_count").value(7))
        .andExpect(jsonPath("$.total").value(1))
        .andExpect(jsonPath("$.meta.limit").value(5));
  }

  @Test
  void testUnused_withNegativeThreshold_returns400() throws Exception {
    when(analyticsService.unused(null, -1, null))
        .thenThrow(new ValidationException("days_threshold cannot be negative"));

    mockMvc.perform(get("/api/graph/analytics/unused").param("days_threshold", "-1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("validation_error"));
  }
}
