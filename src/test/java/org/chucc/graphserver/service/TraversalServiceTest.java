package org.chucc.graphserver.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.chucc.graphserver.domain.Branch;
import org.chucc.graphserver.domain.GraphObject;
import org.chucc.graphserver.dto.CreateRelationshipRequest;
import org.chucc.graphserver.dto.EdgePhase;
import org.chucc.graphserver.dto.ExpandNode;
import org.chucc.graphserver.dto.ExpandRequest;
import org.chucc.graphserver.dto.ExpandResponse;
import org.chucc.graphserver.dto.Projection;
import org.chucc.graphserver.dto.PropertyPredicate;
import org.chucc.graphserver.dto.TraversalEdge;
import org.chucc.graphserver.dto.TraverseNode;
import org.chucc.graphserver.dto.TraverseRequest;
import org.chucc.graphserver.dto.TraverseResponse;
import org.chucc.graphserver.exception.LimitExceededException;
import org.chucc.graphserver.exception.ValidationException;
import org.chucc.graphserver.testutil.GraphFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TraversalService expansion and traversal.
 */
class TraversalServiceTest {

  private GraphFixture graph;

  @BeforeEach
  void setUp() {
    graph = new GraphFixture();
  }

  private GraphObject node(String key) {
    return graph.createObject("Node", key, Map.of("name", key));
  }

  private void link(GraphObject src, GraphObject dst) {
    graph.relate("LINKS", src.canonicalId(), dst.canonicalId(), null);
  }

  private static ExpandRequest expand(UUID root, String direction, Integer maxDepth,
      Integer maxNodes) {
    return new ExpandRequest(List.of(root), direction, maxDepth, maxNodes, null, null, null,
        null, null, null, null);
  }

  private static TraverseRequest traverse(UUID root, Integer limit, String pageDirection,
      String cursor) {
    return new TraverseRequest(List.of(root), "out", 1, null, null, null, null, null, null,
        limit, pageDirection, cursor, null, null, null, null, null);
  }

  private static Set<UUID> nodeIds(ExpandResponse response) {
    Set<UUID> ids = new HashSet<>();
    response.nodes().forEach(n -> ids.add(n.canonicalId()));
    return ids;
  }

  @Test
  void expand_stopsAtNodeBoundAndKeepsEdgesInsideResult() {
    // Given
    GraphObject hub = node("hub");
    for (int i = 0; i < 10; i++) {
      link(hub, node("leaf" + i));
    }

    // When
    ExpandResponse response = graph.traversalService.expand(
        expand(hub.canonicalId(), "out", 1, 5));

    // Then
    assertThat(response.nodes()).hasSize(5);
    assertThat(response.totalNodes()).isEqualTo(5);
    assertThat(response.truncated()).isTrue();
    assertThat(response.maxDepthReached()).isEqualTo(1);
    assertThat(response.edges()).hasSize(4);
    Set<UUID> ids = nodeIds(response);
    for (TraversalEdge edge : response.edges()) {
      assertThat(ids).contains(edge.srcId(), edge.dstId());
    }
    assertThat(response.meta().requested().maxNodes()).isEqualTo(5);
    assertThat(response.meta().requested().direction()).isEqualTo("out");
  }

  @Test
  void expand_respectsDepthAndDirection() {
    // Given
    GraphObject a = node("a");
    GraphObject b = node("b");
    GraphObject c = node("c");
    GraphObject d = node("d");
    link(a, b);
    link(b, c);
    link(c, d);

    // When
    ExpandResponse outward = graph.traversalService.expand(expand(a.canonicalId(), "out", 2,
        null));
    ExpandResponse inward = graph.traversalService.expand(expand(a.canonicalId(), "in", 2,
        null));

    // Then
    assertThat(outward.nodes()).extracting(ExpandNode::canonicalId)
        .containsExactly(a.canonicalId(), b.canonicalId(), c.canonicalId());
    assertThat(outward.nodes()).extracting(ExpandNode::depth).containsExactly(0, 1, 2);
    assertThat(outward.truncated()).isFalse();
    assertThat(outward.roots()).containsExactly(a.canonicalId());
    assertThat(inward.nodes()).extracting(ExpandNode::canonicalId)
        .containsExactly(a.canonicalId());
  }

  @Test
  void expand_filtersRelationshipAndObjectTypes() {
    // Given
    GraphObject person = graph.createObject("Person", "p", Map.of());
    GraphObject company = graph.createObject("Company", "c", Map.of());
    GraphObject city = graph.createObject("City", "x", Map.of());
    GraphObject friend = graph.createObject("Person", "f", Map.of());
    graph.relate("WORKS_AT", person.canonicalId(), company.canonicalId(), null);
    graph.relate("LIVES_IN", person.canonicalId(), city.canonicalId(), null);
    graph.relate("KNOWS", person.canonicalId(), friend.canonicalId(), null);

    // When
    ExpandResponse byRelationship = graph.traversalService.expand(new ExpandRequest(
        List.of(person.canonicalId()), "both", 1, null, null, List.of("WORKS_AT"), null, null,
        null, null, null));
    ExpandResponse byObjectType = graph.traversalService.expand(new ExpandRequest(
        List.of(person.canonicalId()), "both", 1, null, null, null, List.of("Person"), null,
        null, null, null));

    // Then
    assertThat(nodeIds(byRelationship))
        .containsExactlyInAnyOrder(person.canonicalId(), company.canonicalId());
    assertThat(nodeIds(byObjectType))
        .containsExactlyInAnyOrder(person.canonicalId(), friend.canonicalId());
    assertThat(byObjectType.edges()).extracting(TraversalEdge::type).containsExactly("KNOWS");
  }

  @Test
  void expand_appliesProjectionAndRelationshipProperties() {
    // Given
    GraphObject a = graph.createObject("Node", "a", Map.of("name", "a", "secret", "s"));
    GraphObject b = node("b");
    graph.relationshipService.create(new CreateRelationshipRequest("LINKS",
        a.canonicalId(), b.canonicalId(), Map.of("since", 2020), null, null));

    // When
    ExpandResponse response = graph.traversalService.expand(new ExpandRequest(
        List.of(a.canonicalId()), "out", 1, null, null, null, null, null, null,
        new Projection(null, List.of("secret")), true));

    // Then
    assertThat(response.nodes().get(0).properties()).containsOnlyKeys("name");
    assertThat(response.edges().get(0).properties()).containsEntry("since", 2020);
  }

  @Test
  void expand_skipsDeletedNodesAndMissingRoots() {
    // Given
    GraphObject a = node("a");
    GraphObject b = node("b");
    GraphObject c = node("c");
    link(a, b);
    link(a, c);
    graph.objectService.delete(c.canonicalId(), null, null);

    // When
    ExpandResponse response = graph.traversalService.expand(new ExpandRequest(
        List.of(UUID.randomUUID(), a.canonicalId()), "out", 1, null, null, null, null, null,
        null, null, null));

    // Then
    assertThat(response.roots()).containsExactly(a.canonicalId());
    assertThat(nodeIds(response)).containsExactlyInAnyOrder(a.canonicalId(), b.canonicalId());
  }

  @Test
  void expand_readsTheRequestedBranch() {
    // Given
    Branch feature = graph.createBranch("feature");
    GraphObject a = node("a");
    GraphObject b = node("b");
    graph.relate("LINKS", a.canonicalId(), b.canonicalId(), feature.getId());

    // When
    ExpandResponse onMain = graph.traversalService.expand(expand(a.canonicalId(), "out", 1,
        null));
    ExpandResponse onBranch = graph.traversalService.expand(new ExpandRequest(
        List.of(a.canonicalId()), "out", 1, null, null, null, null, null, feature.getId(),
        null, null));

    // Then
    assertThat(onMain.nodes()).hasSize(1);
    assertThat(onBranch.nodes()).hasSize(2);
  }

  @Test
  void expand_recordsAccessForReturnedNodes() {
    // Given
    GraphObject a = node("a");
    GraphObject b = node("b");
    link(a, b);

    // When
    graph.traversalService.expand(expand(a.canonicalId(), "out", 1, null));

    // Then
    assertThat(graph.accessStatsRepository.find(b.canonicalId())).isPresent();
  }

  @Test
  void expand_rejectsBoundsAboveMaximum() {
    GraphObject a = node("a");

    assertThatThrownBy(() -> graph.traversalService.expand(
        expand(a.canonicalId(), "out", 99, null)))
        .isInstanceOf(LimitExceededException.class);
    assertThatThrownBy(() -> graph.traversalService.expand(
        expand(a.canonicalId(), "out", -1, null)))
        .isInstanceOf(ValidationException.class);

    graph.properties.getTraversal().setMaxRoots(2);
    List<UUID> roots = List.of(a.canonicalId(), UUID.randomUUID(), UUID.randomUUID());
    assertThatThrownBy(() -> graph.traversalService.expand(new ExpandRequest(roots, null,
        null, null, null, null, null, null, null, null, null)))
        .isInstanceOf(LimitExceededException.class);
  }

  @Test
  void traverse_runsPhasesInOrder() {
    // Given
    GraphObject person = graph.createObject("Person", "p", Map.of());
    GraphObject company = graph.createObject("Company", "c", Map.of());
    GraphObject city = graph.createObject("City", "hq", Map.of());
    GraphObject home = graph.createObject("City", "home", Map.of());
    graph.relate("WORKS_AT", person.canonicalId(), company.canonicalId(), null);
    graph.relate("LOCATED_IN", company.canonicalId(), city.canonicalId(), null);
    graph.relate("LIVES_IN", person.canonicalId(), home.canonicalId(), null);
    List<EdgePhase> phases = List.of(
        new EdgePhase(List.of("WORKS_AT"), "out", 1, null, null),
        new EdgePhase(List.of("LOCATED_IN"), "out", 1, null, null));

    // When
    TraverseResponse response = graph.traversalService.traverse(new TraverseRequest(
        List.of(person.canonicalId()), null, null, null, null, null, null, null, null, null,
        null, null, phases, null, null, null, null));

    // Then
    assertThat(response.nodes()).extracting(TraverseNode::canonicalId)
        .containsExactly(person.canonicalId(), company.canonicalId(), city.canonicalId());
    assertThat(response.nodes()).extracting(TraverseNode::phaseIndex)
        .containsExactly(null, 0, 1);
    assertThat(response.maxDepthReached()).isEqualTo(2);
  }

  @Test
  void traverse_pagesForwardAndBackward() {
    // Given
    GraphObject hub = node("hub");
    for (int i = 0; i < 7; i++) {
      link(hub, node("n" + i));
    }

    // When
    TraverseResponse first = graph.traversalService.traverse(
        traverse(hub.canonicalId(), 3, null, null));
    TraverseResponse second = graph.traversalService.traverse(
        traverse(hub.canonicalId(), 3, "forward", first.nextCursor()));
    TraverseResponse last = graph.traversalService.traverse(
        traverse(hub.canonicalId(), 3, "backward", null));

    // Then
    assertThat(first.totalNodes()).isEqualTo(8);
    assertThat(first.nodes()).hasSize(3);
    assertThat(first.hasNextPage()).isTrue();
    assertThat(first.hasPreviousPage()).isFalse();
    assertThat(first.approxPositionStart()).isZero();
    assertThat(first.approxPositionEnd()).isEqualTo(3);

    assertThat(second.approxPositionStart()).isEqualTo(3);
    assertThat(second.hasPreviousPage()).isTrue();
    List<UUID> seen = new ArrayList<>();
    first.nodes().forEach(n -> seen.add(n.canonicalId()));
    second.nodes().forEach(n -> seen.add(n.canonicalId()));
    assertThat(new HashSet<>(seen)).hasSize(6);

    assertThat(last.pageDirection()).isEqualTo("backward");
    assertThat(last.nodes()).hasSize(3);
    assertThat(last.approxPositionStart()).isEqualTo(5);
    assertThat(last.hasNextPage()).isFalse();
    assertThat(last.hasPreviousPage()).isTrue();
  }

  @Test
  void traverse_pageEdgesHaveBothEndpointsOnThePage() {
    // Given
    GraphObject hub = node("hub");
    for (int i = 0; i < 7; i++) {
      link(hub, node("n" + i));
    }

    // When
    TraverseResponse first = graph.traversalService.traverse(
        traverse(hub.canonicalId(), 3, null, null));
    TraverseResponse second = graph.traversalService.traverse(
        traverse(hub.canonicalId(), 3, "forward", first.nextCursor()));

    // Then
    for (TraverseResponse page : List.of(first, second)) {
      Set<UUID> onPage = new HashSet<>();
      page.nodes().forEach(n -> onPage.add(n.canonicalId()));
      for (TraversalEdge edge : page.edges()) {
        assertThat(onPage).contains(edge.srcId(), edge.dstId());
      }
    }
    assertThat(first.edges()).hasSize(2);
    assertThat(second.edges()).isEmpty();
  }

  @Test
  void traverse_collectsDistinctPaths() {
    // Given
    GraphObject a = node("a");
    GraphObject b = node("b");
    GraphObject c = node("c");
    GraphObject d = node("d");
    link(a, b);
    link(a, c);
    link(b, d);
    link(c, d);

    // When
    TraverseResponse response = graph.traversalService.traverse(new TraverseRequest(
        List.of(a.canonicalId()), "out", 2, null, null, null, null, null, null, null, null,
        null, null, null, null, true, null));

    // Then
    TraverseNode target = response.nodes().stream()
        .filter(n -> n.canonicalId().equals(d.canonicalId()))
        .findFirst()
        .orElseThrow();
    assertThat(target.paths()).containsExactlyInAnyOrder(
        List.of(a.canonicalId().toString(), b.canonicalId().toString(),
            d.canonicalId().toString()),
        List.of(a.canonicalId().toString(), c.canonicalId().toString(),
            d.canonicalId().toString()));
  }

  @Test
  void traverse_appliesNodeFilterButNotToRoots() {
    // Given
    GraphObject root = graph.createObject("Person", "root", Map.of("age", 10));
    GraphObject old = graph.createObject("Person", "old", Map.of("age", 40));
    GraphObject young = graph.createObject("Person", "young", Map.of("age", 20));
    graph.relate("KNOWS", root.canonicalId(), old.canonicalId(), null);
    graph.relate("KNOWS", root.canonicalId(), young.canonicalId(), null);

    // When
    TraverseResponse response = graph.traversalService.traverse(new TraverseRequest(
        List.of(root.canonicalId()), "out", 1, null, null, null, null, null, null, null, null,
        null, null, new PropertyPredicate("/age", "greaterThan", 30), null, null, null));

    // Then
    assertThat(response.nodes()).extracting(TraverseNode::canonicalId)
        .containsExactly(root.canonicalId(), old.canonicalId());
    assertThat(response.nodes().get(0).paths()).isNull();
  }

  @Test
  void traverse_rejectsInvalidPhase() {
    GraphObject a = node("a");
    List<EdgePhase> phases = List.of(new EdgePhase(null, "out", 0, null, null));

    assertThatThrownBy(() -> graph.traversalService.traverse(new TraverseRequest(
        List.of(a.canonicalId()), null, null, null, null, null, null, null, null, null, null,
        null, phases, null, null, null, null)))
        .isInstanceOf(ValidationException.class);
  }
}
