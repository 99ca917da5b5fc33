package org.chucc.graphserver.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

/**
 * End-to-end tests of the graph API over HTTP against the in-memory store.
 *
 * <p>The application context (and store) is shared between tests, so every test uses its own
 * keys and branch names.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("it")
class GraphApiIntegrationTest {

  @Autowired
  private TestRestTemplate restTemplate;

  @Autowired
  private ObjectMapper objectMapper;

  @Autowired
  private MeterRegistry meterRegistry;

  private static String unique(String prefix) {
    return prefix + "-" + UUID.randomUUID();
  }

  private ResponseEntity<String> send(HttpMethod method, String url, String body,
      HttpHeaders extra) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    if (extra != null) {
      headers.addAll(extra);
    }
    return restTemplate.exchange(url, method, new HttpEntity<>(body, headers), String.class);
  }

  private JsonNode json(ResponseEntity<String> response) throws Exception {
    return objectMapper.readTree(response.getBody());
  }

  private JsonNode createObject(String type, String key, String branchId) throws Exception {
    String branchField = branchId == null ? "" : ",\"branch_id\":\"" + branchId + "\"";
    ResponseEntity<String> response = send(HttpMethod.POST, "/api/graph/objects",
        "{\"type\":\"" + type + "\",\"key\":\"" + key + "\",\"properties\":{\"v\":1}"
            + branchField + "}", null);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    return json(response);
  }

  @Test
  void healthEndpoint_reportsGraphStore() {
    ResponseEntity<String> response = restTemplate.getForEntity(
        "/actuator/health", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).contains("\"status\":\"UP\"").contains("graphStore");
  }

  @Test
  void createPatchAndHistory_roundTripOverHttp() throws Exception {
    // Given
    JsonNode created = createObject("Person", unique("alice"), null);
    String canonicalId = created.get("canonical_id").asText();
    String firstVersion = created.get("id").asText();

    // When
    HttpHeaders ifMatch = new HttpHeaders();
    ifMatch.setIfMatch("\"" + firstVersion + "\"");
    ResponseEntity<String> patched = send(HttpMethod.PATCH,
        "/api/graph/objects/" + canonicalId, "{\"properties\":{\"v\":2}}", ifMatch);
    ResponseEntity<String> stale = send(HttpMethod.PATCH,
        "/api/graph/objects/" + canonicalId, "{\"properties\":{\"v\":3}}", ifMatch);
    ResponseEntity<String> history = restTemplate.getForEntity(
        "/api/graph/objects/" + canonicalId + "/history", String.class);

    // Then
    assertThat(patched.getStatusCode()).isEqualTo(HttpStatus.OK);
    JsonNode head = json(patched);
    assertThat(head.get("version").asInt()).isEqualTo(2);
    assertThat(head.get("supersedes_id").asText()).isEqualTo(firstVersion);
    assertThat(patched.getHeaders().getETag()).isEqualTo("\"" + head.get("id").asText() + "\"");

    assertThat(stale.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(json(stale).get("code").asText()).isEqualTo("version_conflict");
    assertThat(json(stale).get("actual").asText()).isEqualTo(head.get("id").asText());

    JsonNode versions = json(history);
    assertThat(versions).hasSize(2);
    assertThat(versions.get(0).get("version").asInt()).isEqualTo(1);
    assertThat(versions.get(1).get("properties").get("v").asInt()).isEqualTo(2);
  }

  @Test
  void duplicateKey_returnsConflictNamingTheHolder() throws Exception {
    String key = unique("dup");
    JsonNode first = createObject("Person", key, null);

    ResponseEntity<String> second = send(HttpMethod.POST, "/api/graph/objects",
        "{\"type\":\"Person\",\"key\":\"" + key + "\"}", null);

    assertThat(second.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(second.getHeaders().getContentType().toString())
        .startsWith("application/problem+json");
    assertThat(json(second).get("canonical_id").asText())
        .isEqualTo(first.get("canonical_id").asText());
  }

  @Test
  void relationshipWithInverseType_createsBothDirections() throws Exception {
    // Given
    String parent = createObject("Person", unique("parent"), null).get("canonical_id").asText();
    String child = createObject("Person", unique("child"), null).get("canonical_id").asText();

    // When
    ResponseEntity<String> response = send(HttpMethod.POST, "/api/graph/relationships",
        "{\"type\":\"PARENT_OF\",\"src_id\":\"" + parent + "\",\"dst_id\":\"" + child + "\"}",
        null);

    // Then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    JsonNode body = json(response);
    assertThat(body.get("type").asText()).isEqualTo("PARENT_OF");
    assertThat(body.get("inverse_relationship").get("type").asText()).isEqualTo("CHILD_OF");
    assertThat(body.get("inverse_relationship").get("src_id").asText()).isEqualTo(child);

    ResponseEntity<String> edges = restTemplate.getForEntity(
        "/api/graph/objects/" + child + "/edges?direction=out", String.class);
    assertThat(json(edges).get("outgoing").get(0).get("type").asText()).isEqualTo("CHILD_OF");
  }

  @Test
  void branchMerge_dryRunThenApply() throws Exception {
    // Given
    ResponseEntity<String> branch = send(HttpMethod.POST, "/api/graph/branches",
        "{\"name\":\"" + unique("feature") + "\"}", null);
    assertThat(branch.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    String branchId = json(branch).get("id").asText();
    String canonicalId = createObject("Doc", unique("doc"), branchId)
        .get("canonical_id").asText();

    // When
    ResponseEntity<String> dryRun = send(HttpMethod.POST,
        "/api/graph/branches/main/merge", "{\"sourceBranchId\":\"" + branchId + "\"}", null);
    ResponseEntity<String> applied = send(HttpMethod.POST, "/api/graph/branches/main/merge",
        "{\"sourceBranchId\":\"" + branchId + "\",\"execute\":true}", null);

    // Then
    JsonNode preview = json(dryRun);
    assertThat(preview.get("dryRun").asBoolean()).isTrue();
    assertThat(preview.get("added_count").asInt()).isEqualTo(1);
    assertThat(preview.has("applied")).isFalse();

    JsonNode result = json(applied);
    assertThat(result.get("applied").asBoolean()).isTrue();
    assertThat(result.get("applied_objects").asInt()).isEqualTo(1);

    ResponseEntity<String> onMain = restTemplate.getForEntity(
        "/api/graph/objects/" + canonicalId + "?branch_id=main", String.class);
    assertThat(onMain.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(json(onMain).get("merged_from_id").isTextual()).isTrue();
  }

  @Test
  void correlationId_isEchoedOrMinted() {
    HttpHeaders headers = new HttpHeaders();
    headers.set("X-Correlation-ID", "it-correlation-1");
    ResponseEntity<String> echoed = restTemplate.exchange("/api/graph/branches",
        HttpMethod.GET, new HttpEntity<>(headers), String.class);
    ResponseEntity<String> minted = restTemplate.getForEntity("/api/graph/branches",
        String.class);

    assertThat(echoed.getHeaders().getFirst("X-Correlation-ID")).isEqualTo("it-correlation-1");
    assertThat(minted.getHeaders().getFirst("X-Correlation-ID")).isNotBlank();
  }

  @Test
  void errors_areCountedByCode() {
    restTemplate.getForEntity("/api/graph/objects/" + UUID.randomUUID(), String.class);

    assertThat(meterRegistry.find("graph.errors").tag("code", "object_not_found").counter())
        .isNotNull();
  }
}
