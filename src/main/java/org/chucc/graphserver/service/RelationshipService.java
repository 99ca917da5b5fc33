package org.chucc.graphserver.service;

import com.github.f4b6a3.uuid.UuidCreator;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Counted;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.chucc.graphserver.config.GraphProperties;
import org.chucc.graphserver.domain.GraphObject;
import org.chucc.graphserver.domain.GraphRelationship;
import org.chucc.graphserver.dto.CreateRelationshipRequest;
import org.chucc.graphserver.dto.PatchRelationshipRequest;
import org.chucc.graphserver.dto.RelationshipSearchCriteria;
import org.chucc.graphserver.dto.SearchResponse;
import org.chucc.graphserver.exception.DanglingReferenceException;
import org.chucc.graphserver.exception.GraphException;
import org.chucc.graphserver.exception.RelationshipNotFoundException;
import org.chucc.graphserver.exception.ValidationException;
import org.chucc.graphserver.repository.ObjectRepository;
import org.chucc.graphserver.repository.RelationshipRepository;
import org.chucc.graphserver.repository.WriteCondition;
import org.chucc.graphserver.util.ChangeSummaries;
import org.chucc.graphserver.util.PropertyMaps;
import org.chucc.graphserver.util.SearchPager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Relationship write and read path.
 *
 * <p>Relationships are identified per branch by (type, src, dst), so creation is an upsert:
 * unchanged content returns the current head, changed content or a tombstoned head yields a
 * new version. Both endpoints must resolve to live objects on the relationship's branch.
 */
@Service
public class RelationshipService {

  private static final Logger logger = LoggerFactory.getLogger(RelationshipService.class);

  private final RelationshipRepository relationshipRepository;
  private final ObjectRepository objectRepository;
  private final BranchResolver branchResolver;
  private final GraphProperties properties;

  /**
   * Constructs the service.
   *
   * @param relationshipRepository relationship versions
   * @param objectRepository object versions (endpoint checks)
   * @param branchResolver head resolution
   * @param properties engine settings
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All dependencies are Spring-managed beans and are intentionally shared")
  public RelationshipService(RelationshipRepository relationshipRepository,
      ObjectRepository objectRepository,
      BranchResolver branchResolver,
      GraphProperties properties) {
    this.relationshipRepository = relationshipRepository;
    this.objectRepository = objectRepository;
    this.branchResolver = branchResolver;
    this.properties = properties;
  }

  /**
   * Creates or updates the relationship (type, src, dst) on a branch, plus its inverse when
   * the type has one configured. A failing inverse is logged and does not fail the request.
   *
   * @param request the request
   * @return the written relationship and inverse
   * @throws DanglingReferenceException if an endpoint is not live on the branch
   */
  @Counted(value = "graph.relationships.created", description = "Relationship upserts")
  public RelationshipWrite create(CreateRelationshipRequest request) {
    request.validate();
    List<UUID> lineage = branchResolver.lineage(request.branchId());
    UUID srcId = toObjectCanonicalId(request.srcId());
    UUID dstId = toObjectCanonicalId(request.dstId());
    if (srcId.equals(dstId)) {
      throw new ValidationException("Self-referencing relationships are not allowed");
    }
    requireLiveEndpoints(srcId, dstId, lineage);

    GraphRelationship primary = upsertEdge(request.type(), srcId, dstId, request.properties(),
        request.weight(), lineage);

    GraphRelationship inverse = null;
    String inverseType = properties.getRelationships().getInverseTypes().get(request.type());
    if (inverseType != null && !inverseType.isBlank()) {
      try {
        inverse = upsertEdge(inverseType, dstId, srcId, request.properties(), request.weight(),
            lineage);
      } catch (GraphException e) {
        logger.warn("Failed to create inverse {} for relationship {}: {}", inverseType,
            primary.canonicalId(), e.getMessage());
      }
    }
    return new RelationshipWrite(primary, inverse);
  }

  private GraphRelationship upsertEdge(String type, UUID srcId, UUID dstId,
      Map<String, Object> props, Double weight, List<UUID> lineage) {
    UUID canonicalId = findByEndpoints(type, srcId, dstId, lineage)
        .orElseGet(() -> relationshipRepository.registerEndpoints(type, srcId, dstId,
            lineage.get(0), UuidCreator.getTimeOrderedEpoch()));
    return relationshipRepository.append(canonicalId, lineage, WriteCondition.any(), prior -> {
      GraphRelationship next;
      if (prior == null) {
        next = GraphRelationship.template(canonicalId, null, type, srcId, dstId,
            PropertyMaps.withoutNulls(props), weight);
      } else {
        next = prior.withContent(
                props != null ? PropertyMaps.withoutNulls(props) : prior.properties(),
                weight != null ? weight : prior.weight())
            .withDeletedAt(null)
            .withMergedFrom(null);
        if (next.contentHash().equals(prior.contentHash())) {
          return null;
        }
      }
      return next.withChangeSummary(ChangeSummaries.forRelationship(prior, next));
    });
  }

  /**
   * Gets a relationship by version id or canonical id.
   *
   * @param id version id or canonical id
   * @param branchRef branch, or null
   * @param resolveHead whether a version id resolves to its head
   * @return the version
   */
  public GraphRelationship get(UUID id, String branchRef, boolean resolveHead) {
    Optional<GraphRelationship> version = relationshipRepository.findById(id);
    if (version.isPresent() && !resolveHead && branchRef == null) {
      return version.get();
    }
    ObjectService.EntityRef ref = resolveRef(id, branchRef);
    return branchResolver.resolveHead(relationshipRepository, ref.canonicalId(), ref.branchId())
        .orElseThrow(() -> new RelationshipNotFoundException(id));
  }

  /**
   * Applies a partial update.
   *
   * @param id version id or canonical id
   * @param branchRef branch, or null
   * @param request the patch
   * @param ifMatch expected head version id, or null
   * @return the new (or unchanged) head
   */
  public GraphRelationship patch(UUID id, String branchRef, PatchRelationshipRequest request,
      UUID ifMatch) {
    ObjectService.EntityRef ref = resolveRef(id, branchRef);
    return relationshipRepository.append(ref.canonicalId(),
        branchResolver.lineage(ref.branchId()), WriteCondition.fromIfMatch(ifMatch), prior -> {
          GraphRelationship live = requireLive(prior, id);
          Map<String, Object> props =
              PropertyMaps.merge(live.properties(), request.properties());
          GraphRelationship next = live.withContent(props,
              request.weight() != null ? request.weight() : live.weight()).withMergedFrom(null);
          if (next.contentHash().equals(live.contentHash())) {
            return null;
          }
          return next.withChangeSummary(ChangeSummaries.forRelationship(live, next));
        });
  }

  /**
   * Soft-deletes a relationship.
   *
   * @param id version id or canonical id
   * @param branchRef branch, or null
   * @param ifMatch expected head version id, or null
   * @return the tombstone version
   */
  public GraphRelationship delete(UUID id, String branchRef, UUID ifMatch) {
    ObjectService.EntityRef ref = resolveRef(id, branchRef);
    return relationshipRepository.append(ref.canonicalId(),
        branchResolver.lineage(ref.branchId()), WriteCondition.fromIfMatch(ifMatch), prior -> {
          GraphRelationship live = requireLive(prior, id);
          GraphRelationship tombstone = live.withDeletedAt(Instant.now()).withMergedFrom(null);
          return tombstone.withChangeSummary(ChangeSummaries.forRelationship(live, tombstone));
        });
  }

  /**
   * Restores a soft-deleted relationship; both endpoints must be live.
   *
   * @param id version id or canonical id
   * @param branchRef branch, or null
   * @param ifMatch expected head version id, or null
   * @return the restored version
   */
  public GraphRelationship restore(UUID id, String branchRef, UUID ifMatch) {
    ObjectService.EntityRef ref = resolveRef(id, branchRef);
    List<UUID> lineage = branchResolver.lineage(ref.branchId());
    return relationshipRepository.append(ref.canonicalId(), lineage,
        WriteCondition.fromIfMatch(ifMatch), prior -> {
          if (prior == null) {
            throw new RelationshipNotFoundException(id);
          }
          if (!prior.isDeleted()) {
            throw new ValidationException("Relationship " + prior.canonicalId()
                + " is not deleted");
          }
          requireLiveEndpoints(prior.srcId(), prior.dstId(), lineage);
          GraphRelationship restored = prior.withDeletedAt(null).withMergedFrom(null);
          return restored.withChangeSummary(ChangeSummaries.forRelationship(prior, restored));
        });
  }

  /**
   * Version history as seen from a branch, oldest first.
   *
   * @param id version id or canonical id
   * @param branchRef branch, or null
   * @return the chain
   */
  public List<GraphRelationship> history(UUID id, String branchRef) {
    ObjectService.EntityRef ref = resolveRef(id, branchRef);
    List<GraphRelationship> history = relationshipRepository.history(ref.canonicalId(),
        branchResolver.lineage(ref.branchId()));
    if (history.isEmpty()) {
      throw new RelationshipNotFoundException(id);
    }
    return history;
  }

  /**
   * Searches relationship heads visible on a branch.
   *
   * @param criteria filters and paging
   * @return one page of results
   */
  public SearchResponse<GraphRelationship> search(RelationshipSearchCriteria criteria) {
    int limit = SearchPager.effectiveLimit(criteria.limit(), properties.getSearch());
    List<UUID> lineage = branchResolver.lineage(
        BranchResolver.parseBranchRef(criteria.branchRef()));
    List<String> types = criteria.allTypes();
    UUID src = criteria.srcId() == null ? null : toObjectCanonicalId(criteria.srcId());
    UUID dst = criteria.dstId() == null ? null : toObjectCanonicalId(criteria.dstId());

    Set<UUID> candidates = src != null
        ? relationshipRepository.findAdjacent(src)
        : dst != null
            ? relationshipRepository.findAdjacent(dst)
            : relationshipRepository.visibleCanonicalIds(lineage);

    List<GraphRelationship> matches = new ArrayList<>();
    for (UUID canonicalId : candidates) {
      relationshipRepository.resolveHead(canonicalId, lineage)
          .filter(r -> criteria.includeDeleted() || !r.isDeleted())
          .filter(r -> types.isEmpty() || types.contains(r.type()))
          .filter(r -> src == null || src.equals(r.srcId()))
          .filter(r -> dst == null || dst.equals(r.dstId()))
          .ifPresent(matches::add);
    }
    return SearchPager.page(matches, criteria.order(), criteria.cursor(), limit);
  }

  /**
   * Maps an object version id or canonical id to the canonical id.
   *
   * @param id version id or canonical id
   * @return the canonical id (the input when it is not a known version id)
   */
  UUID toObjectCanonicalId(UUID id) {
    return objectRepository.findById(id).map(GraphObject::canonicalId).orElse(id);
  }

  /**
   * Verifies that both endpoints are live objects in the lineage.
   *
   * @param srcId source canonical id
   * @param dstId destination canonical id
   * @param lineage branch lineage
   * @throws DanglingReferenceException listing the missing endpoints
   */
  void requireLiveEndpoints(UUID srcId, UUID dstId, List<UUID> lineage) {
    List<UUID> missing = new ArrayList<>();
    if (objectRepository.resolveLiveHead(srcId, lineage).isEmpty()) {
      missing.add(srcId);
    }
    if (objectRepository.resolveLiveHead(dstId, lineage).isEmpty()) {
      missing.add(dstId);
    }
    if (!missing.isEmpty()) {
      throw new DanglingReferenceException(missing);
    }
  }

  /**
   * Finds the canonical relationship registered for (type, src, dst) anywhere in a lineage.
   *
   * @param type relationship type
   * @param srcId source canonical id
   * @param dstId destination canonical id
   * @param lineage branch lineage
   * @return the canonical id, nearest branch first
   */
  Optional<UUID> findByEndpoints(String type, UUID srcId, UUID dstId, List<UUID> lineage) {
    for (UUID branchKey : lineage) {
      Optional<UUID> found = relationshipRepository.findCanonicalIdByEndpoints(type, srcId,
          dstId, branchKey);
      if (found.isPresent()) {
        return found;
      }
    }
    return Optional.empty();
  }

  private ObjectService.EntityRef resolveRef(UUID id, String branchRef) {
    Optional<GraphRelationship> version = relationshipRepository.findById(id);
    UUID canonicalId = version.map(GraphRelationship::canonicalId).orElse(id);
    UUID branchId = branchRef != null
        ? BranchResolver.parseBranchRef(branchRef)
        : version.map(GraphRelationship::branchId).orElse(null);
    if (version.isEmpty() && !relationshipRepository.containsCanonical(canonicalId)) {
      throw new RelationshipNotFoundException(id);
    }
    branchResolver.requireBranch(branchId);
    return new ObjectService.EntityRef(canonicalId, branchId);
  }

  private static GraphRelationship requireLive(GraphRelationship prior, UUID requestedId) {
    if (prior == null) {
      throw new RelationshipNotFoundException(requestedId);
    }
    if (prior.isDeleted()) {
      throw new ValidationException("Relationship " + prior.canonicalId()
          + " is deleted; restore it first");
    }
    return prior;
  }

  /**
   * Result of a relationship create.
   *
   * @param relationship the primary relationship head
   * @param inverse the inverse head, or null
   */
  public record RelationshipWrite(GraphRelationship relationship, GraphRelationship inverse) {
  }
}
