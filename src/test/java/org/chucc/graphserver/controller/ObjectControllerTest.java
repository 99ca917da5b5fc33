package org.chucc.graphserver.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.chucc.graphserver.domain.Direction;
import org.chucc.graphserver.domain.GraphObject;
import org.chucc.graphserver.dto.BulkCreateObjectsRequest;
import org.chucc.graphserver.dto.BulkItemResult;
import org.chucc.graphserver.dto.BulkResponse;
import org.chucc.graphserver.dto.CreateObjectRequest;
import org.chucc.graphserver.dto.ObjectEdgesResponse;
import org.chucc.graphserver.dto.ObjectSearchCriteria;
import org.chucc.graphserver.dto.PatchObjectRequest;
import org.chucc.graphserver.dto.SearchResponse;
import org.chucc.graphserver.exception.KeyConflictException;
import org.chucc.graphserver.exception.ObjectNotFoundException;
import org.chucc.graphserver.exception.ValidationException;
import org.chucc.graphserver.exception.VersionConflictException;
import org.chucc.graphserver.service.BulkMutationService;
import org.chucc.graphserver.service.ObjectService;
import org.chucc.graphserver.testutil.MeterRegistryTestConfig;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Unit tests for ObjectController.
 */
@WebMvcTest(ObjectController.class)
@Import(MeterRegistryTestConfig.class)
class ObjectControllerTest {

  private static final UUID VERSION_ID =
      UUID.fromString("01936c7f-8a2e-7890-abcd-ef1234567890");
  private static final UUID CANONICAL_ID =
      UUID.fromString("01936c7f-8a2e-7890-abcd-ef1234567891");
  private static final UUID NEXT_VERSION_ID =
      UUID.fromString("01936c7f-8a2e-7890-abcd-ef1234567892");

  @Autowired
  private MockMvc mockMvc;

  @MockitoBean
  private ObjectService objectService;

  @MockitoBean
  private BulkMutationService bulkMutationService;

  private static GraphObject version(UUID id, int number) {
    return new GraphObject(id, CANONICAL_ID, null, null, number, "Person", "alice", null,
        Map.of("name", "Alice"), List.of("vip"), null,
        Instant.parse("2025-01-10T14:30:00Z"), null, null);
  }

  @Test
  void testCreate_returns201WithLocationAndEtag() throws Exception {
    when(objectService.create(any(CreateObjectRequest.class))).thenReturn(version(VERSION_ID, 1));

    mockMvc.perform(post("/api/graph/objects")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"type\":\"Person\",\"key\":\"alice\",\"properties\":{\"name\":\"Alice\"}}"))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", "/api/graph/objects/" + CANONICAL_ID))
        .andExpect(header().string("ETag", "\"" + VERSION_ID + "\""))
        .andExpect(jsonPath("$.id").value(VERSION_ID.toString()))
        .andExpect(jsonPath("$.canonical_id").value(CANONICAL_ID.toString()))
        .andExpect(jsonPath("$.version").value(1))
        .andExpect(jsonPath("$.properties.name").value("Alice"))
        .andExpect(jsonPath("$.deleted_at").doesNotExist());

    ArgumentCaptor<CreateObjectRequest> captor =
        ArgumentCaptor.forClass(CreateObjectRequest.class);
    verify(objectService).create(captor.capture());
    assertThat(captor.getValue().type()).isEqualTo("Person");
    assertThat(captor.getValue().key()).isEqualTo("alice");
  }

  @Test
  void testCreate_whenInvalid_returns400Problem() throws Exception {
    when(objectService.create(any(CreateObjectRequest.class)))
        .thenThrow(new ValidationException("type is required"));

    mockMvc.perform(post("/api/graph/objects")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(content().contentTypeCompatibleWith("application/problem+json"))
        .andExpect(jsonPath("$.status").value(400))
        .andExpect(jsonPath("$.code").value("validation_error"))
        .andExpect(jsonPath("$.detail").value("type is required"));
  }

  @Test
  void testCreate_whenKeyTaken_returns409WithHolder() throws Exception {
    when(objectService.create(any(CreateObjectRequest.class)))
        .thenThrow(new KeyConflictException("Person", "alice", CANONICAL_ID));

    mockMvc.perform(post("/api/graph/objects")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"type\":\"Person\",\"key\":\"alice\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("key_conflict"))
        .andExpect(jsonPath("$.canonical_id").value(CANONICAL_ID.toString()))
        .andExpect(jsonPath("$.key").value("alice"));
  }

  @Test
  void testCreate_withMalformedBody_returns400() throws Exception {
    mockMvc.perform(post("/api/graph/objects")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("malformed_request"));
  }

  @Test
  void testUpsert_whenUnchanged_returns200() throws Exception {
    when(objectService.upsert(any(CreateObjectRequest.class)))
        .thenReturn(new ObjectService.UpsertOutcome(version(VERSION_ID, 1),
            ObjectService.UpsertOutcome.UNCHANGED));

    mockMvc.perform(post("/api/graph/objects/upsert")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"type\":\"Person\",\"key\":\"alice\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("unchanged"))
        .andExpect(jsonPath("$.object.id").value(VERSION_ID.toString()));
  }

  @Test
  void testUpsert_whenCreated_returns201() throws Exception {
    when(objectService.upsert(any(CreateObjectRequest.class)))
        .thenReturn(new ObjectService.UpsertOutcome(version(VERSION_ID, 1),
            ObjectService.UpsertOutcome.CREATED));

    mockMvc.perform(post("/api/graph/objects/upsert")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"type\":\"Person\",\"key\":\"alice\"}"))
        .andExpect(status().isCreated());
  }

  @Test
  void testGet_whenMissing_returns404() throws Exception {
    when(objectService.get(CANONICAL_ID, null, false))
        .thenThrow(new ObjectNotFoundException(CANONICAL_ID));

    mockMvc.perform(get("/api/graph/objects/{id}", CANONICAL_ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("object_not_found"))
        .andExpect(jsonPath("$.type").value("/problems/object-not-found"));
  }

  @Test
  void testGet_withInvalidId_returns400() throws Exception {
    mockMvc.perform(get("/api/graph/objects/{id}", "not-a-uuid"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("invalid_argument"));
  }

  @Test
  void testGet_passesBranchAndResolveHead() throws Exception {
    when(objectService.get(VERSION_ID, "main", true)).thenReturn(version(NEXT_VERSION_ID, 2));

    mockMvc.perform(get("/api/graph/objects/{id}", VERSION_ID)
            .param("branch_id", "main")
            .param("resolve_head", "true"))
        .andExpect(status().isOk())
        .andExpect(header().string("ETag", "\"" + NEXT_VERSION_ID + "\""))
        .andExpect(jsonPath("$.version").value(2));
  }

  @Test
  void testPatch_forwardsIfMatch() throws Exception {
    when(objectService.patch(eq(CANONICAL_ID), isNull(), any(PatchObjectRequest.class),
        eq(VERSION_ID))).thenReturn(version(NEXT_VERSION_ID, 2));

    mockMvc.perform(patch("/api/graph/objects/{id}", CANONICAL_ID)
            .header("If-Match", "\"" + VERSION_ID + "\"")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"properties\":{\"age\":31}}"))
        .andExpect(status().isOk())
        .andExpect(header().string("ETag", "\"" + NEXT_VERSION_ID + "\""));
  }

  @Test
  void testPatch_whenStale_returns409WithHeads() throws Exception {
    when(objectService.patch(eq(CANONICAL_ID), isNull(), any(PatchObjectRequest.class),
        eq(VERSION_ID)))
        .thenThrow(new VersionConflictException(CANONICAL_ID, VERSION_ID, NEXT_VERSION_ID));

    mockMvc.perform(patch("/api/graph/objects/{id}", CANONICAL_ID)
            .header("If-Match", VERSION_ID.toString())
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\":\"done\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("version_conflict"))
        .andExpect(jsonPath("$.expected").value(VERSION_ID.toString()))
        .andExpect(jsonPath("$.actual").value(NEXT_VERSION_ID.toString()));
  }

  @Test
  void testPatch_withInvalidIfMatch_returns400() throws Exception {
    mockMvc.perform(patch("/api/graph/objects/{id}", CANONICAL_ID)
            .header("If-Match", "\"v1\"")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\":\"done\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("invalid_argument"));
  }

  @Test
  void testDelete_returnsTombstone() throws Exception {
    GraphObject tombstone = version(NEXT_VERSION_ID, 2)
        .withDeletedAt(Instant.parse("2025-01-11T00:00:00Z"));
    when(objectService.delete(CANONICAL_ID, null, null)).thenReturn(tombstone);

    mockMvc.perform(delete("/api/graph/objects/{id}", CANONICAL_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deleted_at").value("2025-01-11T00:00:00Z"));
  }

  @Test
  void testHistory_returnsVersionsOldestFirst() throws Exception {
    when(objectService.history(CANONICAL_ID, null))
        .thenReturn(List.of(version(VERSION_ID, 1), version(NEXT_VERSION_ID, 2)));

    mockMvc.perform(get("/api/graph/objects/{id}/history", CANONICAL_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[0].version").value(1))
        .andExpect(jsonPath("$[1].version").value(2));
  }

  @Test
  void testSearch_mapsQueryParameters() throws Exception {
    when(objectService.search(any(ObjectSearchCriteria.class)))
        .thenReturn(new SearchResponse<>(List.of(version(VERSION_ID, 1)), "next", 1));

    mockMvc.perform(get("/api/graph/objects/search")
            .param("type", "Person")
            .param("label", "vip")
            .param("limit", "10")
            .param("order", "asc"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[0].key").value("alice"))
        .andExpect(jsonPath("$.next_cursor").value("next"));

    ArgumentCaptor<ObjectSearchCriteria> captor =
        ArgumentCaptor.forClass(ObjectSearchCriteria.class);
    verify(objectService).search(captor.capture());
    assertThat(captor.getValue().allTypes()).containsExactly("Person");
    assertThat(captor.getValue().limit()).isEqualTo(10);
    assertThat(captor.getValue().includeDeleted()).isFalse();
  }

  @Test
  void testEdges_mergesTypeParameters() throws Exception {
    when(objectService.edges(eq(CANONICAL_ID), isNull(), any(), eq(Direction.OUT)))
        .thenReturn(new ObjectEdgesResponse(List.of(), List.of()));

    mockMvc.perform(get("/api/graph/objects/{id}/edges", CANONICAL_ID)
            .param("types", "KNOWS")
            .param("type", "WORKS_AT")
            .param("direction", "out"))
        .andExpect(status().isOk());

    verify(objectService).edges(CANONICAL_ID, null, List.of("KNOWS", "WORKS_AT"),
        Direction.OUT);
  }

  @Test
  void testBulkCreate_returnsPerItemResults() throws Exception {
    when(bulkMutationService.createObjects(any(BulkCreateObjectsRequest.class)))
        .thenReturn(BulkResponse.of(List.of(
            new BulkItemResult(0, true, "created", version(VERSION_ID, 1), null, null, null),
            new BulkItemResult(1, false, "conflict", null, null, "taken", "key_exists"))));

    mockMvc.perform(post("/api/graph/objects/bulk")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"items\":[{\"type\":\"Person\",\"key\":\"alice\"},"
                + "{\"type\":\"Person\",\"key\":\"alice\"}]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(1))
        .andExpect(jsonPath("$.failed").value(1))
        .andExpect(jsonPath("$.results[1].code").value("key_exists"));
  }

  @Test
  void testCorrelationIdIsEchoed() throws Exception {
    when(objectService.get(CANONICAL_ID, null, false)).thenReturn(version(VERSION_ID, 1));

    mockMvc.perform(get("/api/graph/objects/{id}", CANONICAL_ID)
            .header("X-Correlation-ID", "req-42"))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Correlation-ID", "req-42"));
  }
}
