package org.chucc.graphserver.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Timed;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.chucc.graphserver.config.GraphProperties;
import org.chucc.graphserver.domain.Direction;
import org.chucc.graphserver.domain.GraphObject;
import org.chucc.graphserver.domain.GraphRelationship;
import org.chucc.graphserver.dto.EdgePhase;
import org.chucc.graphserver.dto.ExpandMeta;
import org.chucc.graphserver.dto.ExpandNode;
import org.chucc.graphserver.dto.ExpandRequest;
import org.chucc.graphserver.dto.ExpandResponse;
import org.chucc.graphserver.dto.Projection;
import org.chucc.graphserver.dto.TraversalEdge;
import org.chucc.graphserver.dto.TraverseNode;
import org.chucc.graphserver.dto.TraverseRequest;
import org.chucc.graphserver.dto.TraverseResponse;
import org.chucc.graphserver.exception.LimitExceededException;
import org.chucc.graphserver.exception.ValidationException;
import org.chucc.graphserver.repository.AccessStatsRepository;
import org.chucc.graphserver.repository.ObjectRepository;
import org.chucc.graphserver.repository.RelationshipRepository;
import org.chucc.graphserver.util.CursorCodec;
import org.chucc.graphserver.util.SearchPager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Bounded graph expansion and paginated multi-phase traversal.
 *
 * <p>Every node and edge is read as the live head on the requested branch, so results are
 * branch-consistent. Depth, node and edge bounds are enforced during the walk; requests above
 * the configured maxima are rejected rather than clamped.
 */
@Service
public class TraversalService {

  private static final Logger logger = LoggerFactory.getLogger(TraversalService.class);

  private final ObjectRepository objectRepository;
  private final RelationshipRepository relationshipRepository;
  private final AccessStatsRepository accessStatsRepository;
  private final BranchResolver branchResolver;
  private final GraphProperties properties;

  /**
   * Constructs the service.
   *
   * @param objectRepository object versions
   * @param relationshipRepository relationship versions
   * @param accessStatsRepository access statistics, fed by expansion
   * @param branchResolver branch lineages
   * @param properties traversal bounds
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All dependencies are Spring-managed beans and are intentionally shared")
  public TraversalService(ObjectRepository objectRepository,
      RelationshipRepository relationshipRepository,
      AccessStatsRepository accessStatsRepository,
      BranchResolver branchResolver,
      GraphProperties properties) {
    this.objectRepository = objectRepository;
    this.relationshipRepository = relationshipRepository;
    this.accessStatsRepository = accessStatsRepository;
    this.branchResolver = branchResolver;
    this.properties = properties;
  }

  /**
   * Expands breadth-first from the roots.
   *
   * @param request roots, bounds and filters
   * @return reached nodes and the edges between them
   */
  @Timed(value = "graph.expand", description = "Graph expansion duration")
  public ExpandResponse expand(ExpandRequest request) {
    long started = System.nanoTime();
    request.validate();
    GraphProperties.Traversal limits = properties.getTraversal();
    checkRoots(request.rootIds());
    int maxDepth = bound("max_depth", request.maxDepth(), limits.getExpandDefaultMaxDepth(),
        limits.getExpandMaxDepth());
    int maxNodes = bound("max_nodes", request.maxNodes(), limits.getExpandDefaultMaxNodes(),
        limits.getExpandMaxNodes());
    int maxEdges = bound("max_edges", request.maxEdges(), limits.getExpandDefaultMaxEdges(),
        limits.getExpandMaxEdges());
    Direction direction = Direction.parse(request.direction(), Direction.BOTH);
    List<UUID> lineage = branchResolver.lineage(request.branchId());

    GraphWalk walk = new GraphWalk(objectRepository, relationshipRepository, lineage, maxNodes,
        maxEdges, null, null, 0);
    walk.addRoots(resolveRoots(request.rootIds(), lineage));
    walk.run(List.of(new GraphWalk.Phase(direction, maxDepth,
        new HashSet<>(request.relationshipTypes()), new HashSet<>(request.objectTypes()),
        new HashSet<>(request.labels()))));

    Projection projection = request.projection();
    Instant now = Instant.now();
    List<ExpandNode> nodes = new ArrayList<>();
    for (GraphWalk.Visit visit : walk.visits()) {
      GraphObject head = visit.head();
      accessStatsRepository.recordAccess(head.canonicalId(), now);
      Map<String, Object> props = projection == null
          ? head.properties()
          : projection.apply(head.properties());
      nodes.add(new ExpandNode(head.id(), head.canonicalId(), visit.depth(), head.type(),
          head.key(), head.labels(), props));
    }
    List<TraversalEdge> edges = walk.edges().stream()
        .map(r -> toEdge(r, request.isIncludeRelationshipProperties()))
        .toList();

    double elapsedMs = elapsedMs(started);
    ExpandMeta meta = new ExpandMeta(
        new ExpandMeta.Requested(maxDepth, maxNodes, maxEdges, wireName(direction)),
        nodes.size(), edges.size(), walk.isTruncated(), walk.maxDepthReached(), elapsedMs,
        new ExpandMeta.Filters(request.relationshipTypes(), request.objectTypes(),
            request.labels(), projection, request.isIncludeRelationshipProperties()));
    logger.debug("Expanded {} roots to {} nodes / {} edges in {} ms (truncated={})",
        walk.roots().size(), nodes.size(), edges.size(), elapsedMs, walk.isTruncated());
    return new ExpandResponse(walk.roots(), nodes, edges, walk.isTruncated(),
        walk.maxDepthReached(), nodes.size(), meta);
  }

  /**
   * Traverses from the roots through one or more phases and returns one page of the result.
   *
   * @param request roots, phases, bounds, filters and page position
   * @return the page
   */
  @Timed(value = "graph.traverse", description = "Graph traversal duration")
  public TraverseResponse traverse(TraverseRequest request) {
    long started = System.nanoTime();
    request.validate();
    GraphProperties.Traversal limits = properties.getTraversal();
    checkRoots(request.rootIds());
    int maxNodes = bound("max_nodes", request.maxNodes(), limits.getTraverseDefaultMaxNodes(),
        limits.getExpandMaxNodes());
    int maxEdges = bound("max_edges", request.maxEdges(), limits.getTraverseDefaultMaxEdges(),
        limits.getTraverseMaxEdges());
    int pageSize = SearchPager.effectiveLimit(request.limit(), properties.getSearch());
    List<GraphWalk.Phase> phases = phases(request, limits);
    List<UUID> lineage = branchResolver.lineage(request.branchId());

    GraphWalk walk = new GraphWalk(objectRepository, relationshipRepository, lineage, maxNodes,
        maxEdges, request.nodeFilter(), request.edgeFilter(),
        request.isReturnPaths() ? request.effectiveMaxPathsPerNode() : 0);
    walk.addRoots(resolveRoots(request.rootIds(), lineage));
    walk.run(phases);

    List<GraphWalk.Visit> ordered = walk.visits();
    int total = ordered.size();
    boolean backward = request.isBackward();
    int boundary;
    if (request.cursor() == null || request.cursor().isBlank()) {
      boundary = backward ? total : 0;
    } else {
      boundary = Math.min(CursorCodec.decodeOffset(request.cursor()), total);
    }
    int start = backward ? Math.max(0, boundary - pageSize) : boundary;
    int end = backward ? boundary : Math.min(total, boundary + pageSize);

    List<TraverseNode> nodes = new ArrayList<>();
    Set<UUID> onPage = new HashSet<>();
    for (GraphWalk.Visit visit : ordered.subList(start, end)) {
      GraphObject head = visit.head();
      onPage.add(head.canonicalId());
      nodes.add(new TraverseNode(head.id(), head.canonicalId(), visit.depth(), head.type(),
          head.key(), head.labels(), visit.phaseIndex(),
          request.isReturnPaths() ? visit.paths() : null));
    }
    List<TraversalEdge> edges = walk.edges().stream()
        .filter(r -> onPage.contains(r.srcId()) && onPage.contains(r.dstId()))
        .map(r -> toEdge(r, false))
        .toList();

    double elapsedMs = elapsedMs(started);
    logger.debug("Traversed {} phases to {} nodes, page [{}, {}) in {} ms", phases.size(),
        total, start, end, elapsedMs);
    return new TraverseResponse(walk.roots(), nodes, edges, walk.isTruncated(),
        walk.maxDepthReached(), total,
        end < total,
        start > 0,
        end < total ? CursorCodec.encodeOffset(end) : null,
        start > 0 ? CursorCodec.encodeOffset(start) : null,
        start, end,
        backward ? "backward" : "forward",
        elapsedMs,
        nodes.size());
  }

  private List<GraphWalk.Phase> phases(TraverseRequest request,
      GraphProperties.Traversal limits) {
    if (request.edgePhases().isEmpty()) {
      int maxDepth = bound("max_depth", request.maxDepth(), limits.getExpandDefaultMaxDepth(),
          limits.getExpandMaxDepth());
      return List.of(new GraphWalk.Phase(Direction.parse(request.direction(), Direction.BOTH),
          maxDepth, new HashSet<>(request.relationshipTypes()),
          new HashSet<>(request.objectTypes()), new HashSet<>(request.labels())));
    }
    List<GraphWalk.Phase> phases = new ArrayList<>();
    for (EdgePhase phase : request.edgePhases()) {
      phases.add(new GraphWalk.Phase(Direction.parse(phase.direction(), Direction.BOTH),
          phase.maxDepth(), new HashSet<>(phase.relationshipTypes()),
          new HashSet<>(phase.objectTypes()), new HashSet<>(phase.labels())));
    }
    return phases;
  }

  private List<GraphObject> resolveRoots(List<UUID> rootIds, List<UUID> lineage) {
    List<GraphObject> heads = new ArrayList<>();
    for (UUID rootId : rootIds) {
      UUID canonicalId = objectRepository.findById(rootId)
          .map(GraphObject::canonicalId)
          .orElse(rootId);
      objectRepository.resolveLiveHead(canonicalId, lineage).ifPresentOrElse(heads::add,
          () -> logger.debug("Root {} has no live head on the branch; skipped", rootId));
    }
    return heads;
  }

  private void checkRoots(List<UUID> rootIds) {
    int maxRoots = properties.getTraversal().getMaxRoots();
    if (rootIds.size() > maxRoots) {
      throw new LimitExceededException("root_ids", rootIds.size(), maxRoots);
    }
  }

  private static int bound(String name, Integer requested, int defaultValue, int max) {
    if (requested == null || requested == 0) {
      return defaultValue;
    }
    if (requested < 0) {
      throw new ValidationException(name + " cannot be negative");
    }
    if (requested > max) {
      throw new LimitExceededException(name, requested, max);
    }
    return requested;
  }

  private static TraversalEdge toEdge(GraphRelationship relationship, boolean withProperties) {
    return new TraversalEdge(relationship.id(), relationship.canonicalId(), relationship.type(),
        relationship.srcId(), relationship.dstId(),
        withProperties ? relationship.properties() : null);
  }

  private static String wireName(Direction direction) {
    return direction.name().toLowerCase(Locale.ROOT);
  }

  private static double elapsedMs(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1_000_000.0;
  }
}
