package org.chucc.graphserver.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import org.chucc.graphserver.domain.Direction;
import org.chucc.graphserver.domain.GraphObject;
import org.chucc.graphserver.domain.GraphRelationship;
import org.chucc.graphserver.dto.PropertyPredicate;
import org.chucc.graphserver.repository.ObjectRepository;
import org.chucc.graphserver.repository.RelationshipRepository;
import org.chucc.graphserver.util.PredicateEvaluator;

/**
 * One bounded breadth-first walk over live heads of a branch lineage.
 *
 * <p>Roots are nodes at depth 0 and bypass all node filters. An edge is taken only if its far
 * end is already a node or is accepted as a new node within the node bound, so every edge
 * returned connects two returned nodes. Hitting the node or edge bound marks the walk
 * truncated; the edge bound also stops it.
 *
 * <p>Not thread-safe; one instance per request.
 */
final class GraphWalk {

  /**
   * One expansion phase.
   *
   * @param direction edge direction relative to the expanded node
   * @param maxDepth hops in this phase
   * @param relationshipTypes types to follow, all when empty
   * @param objectTypes object types to reach, all when empty
   * @param labels labels to reach (any-of), all when empty
   */
  record Phase(Direction direction, int maxDepth, Set<String> relationshipTypes,
      Set<String> objectTypes, Set<String> labels) {
    Phase {
      relationshipTypes = Set.copyOf(relationshipTypes);
      objectTypes = Set.copyOf(objectTypes);
      labels = Set.copyOf(labels);
    }
  }

  /**
   * A reached node.
   */
  static final class Visit {
    private final GraphObject head;
    private final int depth;
    private final Integer phaseIndex;
    private final List<List<String>> paths;

    Visit(GraphObject head, int depth, Integer phaseIndex, List<List<String>> paths) {
      this.head = head;
      this.depth = depth;
      this.phaseIndex = phaseIndex;
      this.paths = paths;
    }

    GraphObject head() {
      return head;
    }

    int depth() {
      return depth;
    }

    Integer phaseIndex() {
      return phaseIndex;
    }

    List<List<String>> paths() {
      return paths;
    }
  }

  private final ObjectRepository objectRepository;
  private final RelationshipRepository relationshipRepository;
  private final List<UUID> lineage;
  private final int maxNodes;
  private final int maxEdges;
  private final PropertyPredicate nodeFilter;
  private final PropertyPredicate edgeFilter;
  private final int maxPathsPerNode;

  private final Map<UUID, Visit> nodes = new LinkedHashMap<>();
  private final Map<UUID, GraphRelationship> edges = new LinkedHashMap<>();
  private final List<UUID> roots = new ArrayList<>();
  private boolean truncated;
  private boolean edgeBoundHit;
  private int maxDepthReached;

  /**
   * Creates a walk.
   *
   * @param objectRepository object versions
   * @param relationshipRepository relationship versions
   * @param lineage branch lineage to read
   * @param maxNodes node bound, roots included
   * @param maxEdges edge bound
   * @param nodeFilter predicate on reached objects, or null
   * @param edgeFilter predicate on followed relationships, or null
   * @param maxPathsPerNode paths tracked per node; 0 disables path tracking
   */
  GraphWalk(ObjectRepository objectRepository, RelationshipRepository relationshipRepository,
      List<UUID> lineage, int maxNodes, int maxEdges, PropertyPredicate nodeFilter,
      PropertyPredicate edgeFilter, int maxPathsPerNode) {
    this.objectRepository = objectRepository;
    this.relationshipRepository = relationshipRepository;
    this.lineage = lineage;
    this.maxNodes = maxNodes;
    this.maxEdges = maxEdges;
    this.nodeFilter = nodeFilter;
    this.edgeFilter = edgeFilter;
    this.maxPathsPerNode = maxPathsPerNode;
  }

  /**
   * Adds the roots, in order, up to the node bound.
   *
   * @param heads live root heads
   */
  void addRoots(List<GraphObject> heads) {
    for (GraphObject head : heads) {
      if (nodes.containsKey(head.canonicalId())) {
        continue;
      }
      if (nodes.size() >= maxNodes) {
        truncated = true;
        return;
      }
      List<List<String>> paths = new ArrayList<>();
      if (maxPathsPerNode > 0) {
        paths.add(List.of(head.canonicalId().toString()));
      }
      nodes.put(head.canonicalId(), new Visit(head, 0, null, paths));
      roots.add(head.canonicalId());
    }
  }

  /**
   * Runs the phases in order. Each phase starts from the nodes the previous one reached.
   *
   * @param phases the phases
   */
  void run(List<Phase> phases) {
    List<UUID> frontier = new ArrayList<>(roots);
    for (int p = 0; p < phases.size() && !frontier.isEmpty() && !edgeBoundHit; p++) {
      Phase phase = phases.get(p);
      List<UUID> reached = new ArrayList<>();
      List<UUID> level = frontier;
      for (int hop = 0; hop < phase.maxDepth() && !level.isEmpty() && !edgeBoundHit; hop++) {
        level = expandLevel(level, phase, p);
        reached.addAll(level);
      }
      frontier = reached;
    }
  }

  private List<UUID> expandLevel(List<UUID> level, Phase phase, int phaseIndex) {
    List<UUID> next = new ArrayList<>();
    for (UUID nodeId : level) {
      Visit from = nodes.get(nodeId);
      for (UUID relationshipId : new TreeSet<>(relationshipRepository.findAdjacent(nodeId))) {
        GraphRelationship relationship =
            relationshipRepository.resolveLiveHead(relationshipId, lineage).orElse(null);
        if (relationship == null || !follows(relationship, nodeId, phase)) {
          continue;
        }
        UUID neighborId = relationship.otherEnd(nodeId);
        Visit known = nodes.get(neighborId);
        if (edges.containsKey(relationshipId)) {
          if (known != null) {
            addPaths(known, from, neighborId);
          }
          continue;
        }

        GraphObject neighbor = null;
        if (known == null) {
          neighbor = objectRepository.resolveLiveHead(neighborId, lineage).orElse(null);
          if (neighbor == null || !accepts(neighbor, phase)) {
            continue;
          }
          if (nodes.size() >= maxNodes) {
            truncated = true;
            continue;
          }
        }
        if (edges.size() >= maxEdges) {
          truncated = true;
          edgeBoundHit = true;
          return next;
        }

        edges.put(relationshipId, relationship);
        if (known == null) {
          int depth = from.depth() + 1;
          nodes.put(neighborId, new Visit(neighbor, depth, phaseIndex,
              extendPaths(from, neighborId)));
          maxDepthReached = Math.max(maxDepthReached, depth);
          next.add(neighborId);
        } else {
          addPaths(known, from, neighborId);
        }
      }
    }
    return next;
  }

  private boolean follows(GraphRelationship relationship, UUID nodeId, Phase phase) {
    boolean outgoing = relationship.srcId().equals(nodeId)
        && phase.direction().includesOutgoing();
    boolean incoming = relationship.dstId().equals(nodeId)
        && phase.direction().includesIncoming();
    if (!outgoing && !incoming) {
      return false;
    }
    if (!phase.relationshipTypes().isEmpty()
        && !phase.relationshipTypes().contains(relationship.type())) {
      return false;
    }
    return edgeFilter == null || PredicateEvaluator.matches(edgeFilter,
        relationship.properties());
  }

  private boolean accepts(GraphObject object, Phase phase) {
    if (!phase.objectTypes().isEmpty() && !phase.objectTypes().contains(object.type())) {
      return false;
    }
    if (!phase.labels().isEmpty()
        && object.labels().stream().noneMatch(phase.labels()::contains)) {
      return false;
    }
    return nodeFilter == null || PredicateEvaluator.matches(nodeFilter, object.properties());
  }

  private List<List<String>> extendPaths(Visit from, UUID neighborId) {
    List<List<String>> paths = new ArrayList<>();
    for (List<String> path : from.paths()) {
      if (paths.size() >= maxPathsPerNode) {
        break;
      }
      if (!path.contains(neighborId.toString())) {
        List<String> extended = new ArrayList<>(path);
        extended.add(neighborId.toString());
        paths.add(extended);
      }
    }
    return paths;
  }

  private void addPaths(Visit target, Visit from, UUID neighborId) {
    if (maxPathsPerNode == 0 || target.depth() == 0) {
      return;
    }
    for (List<String> path : extendPaths(from, neighborId)) {
      if (target.paths().size() >= maxPathsPerNode) {
        return;
      }
      if (!target.paths().contains(path)) {
        target.paths().add(path);
      }
    }
  }

  /**
   * Returns the nodes in breadth-first order, roots first.
   *
   * @return the visits
   */
  List<Visit> visits() {
    return new ArrayList<>(nodes.values());
  }

  Collection<GraphRelationship> edges() {
    return edges.values();
  }

  List<UUID> roots() {
    return List.copyOf(roots);
  }

  boolean isTruncated() {
    return truncated;
  }

  int maxDepthReached() {
    return maxDepthReached;
  }
}
