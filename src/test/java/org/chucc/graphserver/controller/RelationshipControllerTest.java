package org.chucc.graphserver.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.chucc.graphserver.domain.GraphRelationship;
import org.chucc.graphserver.dto.CreateRelationshipRequest;
import org.chucc.graphserver.exception.DanglingReferenceException;
import org.chucc.graphserver.service.BulkMutationService;
import org.chucc.graphserver.service.RelationshipService;
import org.chucc.graphserver.testutil.MeterRegistryTestConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Unit tests for RelationshipController.
 */
@WebMvcTest(RelationshipController.class)
@Import(MeterRegistryTestConfig.class)
class RelationshipControllerTest {

  private static final UUID SRC = UUID.fromString("01936c7f-8a2e-7890-abcd-ef1234567801");
  private static final UUID DST = UUID.fromString("01936c7f-8a2e-7890-abcd-ef1234567802");
  private static final UUID REL_ID = UUID.fromString("01936c7f-8a2e-7890-abcd-ef1234567803");
  private static final UUID INVERSE_ID =
      UUID.fromString("01936c7f-8a2e-7890-abcd-ef1234567804");

  @Autowired
  private MockMvc mockMvc;

  @MockitoBean
  private RelationshipService relationshipService;

  @MockitoBean
  private BulkMutationService bulkMutationService;

  private static GraphRelationship relationship(UUID id, String type, UUID src, UUID dst) {
    return new GraphRelationship(id, id, null, null, 1, type, src, dst, Map.of(), 0.5, null,
        Instant.parse("2025-01-10T14:30:00Z"), null, null);
  }

  @Test
  void testCreate_returnsHeadWithInverse() throws Exception {
    when(relationshipService.create(any(CreateRelationshipRequest.class)))
        .thenReturn(new RelationshipService.RelationshipWrite(
            relationship(REL_ID, "PARENT_OF", SRC, DST),
            relationship(INVERSE_ID, "CHILD_OF", DST, SRC)));

    mockMvc.perform(post("/api/graph/relationships")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"type\":\"PARENT_OF\",\"src_id\":\"" + SRC + "\",\"dst_id\":\"" + DST
                + "\",\"weight\":0.5}"))
        .andExpect(status().isCreated())
        .andExpect(header().string("ETag", "\"" + REL_ID + "\""))
        .andExpect(jsonPath("$.id").value(REL_ID.toString()))
        .andExpect(jsonPath("$.src_id").value(SRC.toString()))
        .andExpect(jsonPath("$.weight").value(0.5))
        .andExpect(jsonPath("$.inverse_relationship.type").value("CHILD_OF"))
        .andExpect(jsonPath("$.inverse_relationship.src_id").value(DST.toString()));
  }

  @Test
  void testCreate_withMissingEndpoint_returns422() throws Exception {
    when(relationshipService.create(any(CreateRelationshipRequest.class)))
        .thenThrow(new DanglingReferenceException(List.of(DST)));

    mockMvc.perform(post("/api/graph/relationships")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"type\":\"KNOWS\",\"src_id\":\"" + SRC + "\",\"dst_id\":\"" + DST
                + "\"}"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("dangling_reference"))
        .andExpect(jsonPath("$.missing_ids[0]").value(DST.toString()));
  }

  @Test
  void testHistory() throws Exception {
    when(relationshipService.history(REL_ID, "main"))
        .thenReturn(List.of(relationship(REL_ID, "KNOWS", SRC, DST)));

    mockMvc.perform(get("/api/graph/relationships/{id}/history", REL_ID)
            .param("branch_id", "main"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].type").value("KNOWS"));
  }
}
