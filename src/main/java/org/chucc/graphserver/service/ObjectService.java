package org.chucc.graphserver.service;

import com.github.f4b6a3.uuid.UuidCreator;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Counted;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.chucc.graphserver.config.GraphProperties;
import org.chucc.graphserver.domain.Direction;
import org.chucc.graphserver.domain.GraphObject;
import org.chucc.graphserver.domain.GraphRelationship;
import org.chucc.graphserver.dto.CreateObjectRequest;
import org.chucc.graphserver.dto.ObjectEdgesResponse;
import org.chucc.graphserver.dto.ObjectSearchCriteria;
import org.chucc.graphserver.dto.PatchObjectRequest;
import org.chucc.graphserver.dto.SearchResponse;
import org.chucc.graphserver.exception.KeyConflictException;
import org.chucc.graphserver.exception.ObjectNotFoundException;
import org.chucc.graphserver.exception.ValidationException;
import org.chucc.graphserver.repository.AccessStatsRepository;
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
 * Single-object write and read path.
 *
 * <p>Every write goes through {@link ObjectRepository#append}, which serializes writers of one
 * canonical id and checks the optimistic precondition under the lock. Key uniqueness is
 * enforced per (type, branch) by atomic reservation before the first version is appended.
 */
@Service
public class ObjectService {

  private static final Logger logger = LoggerFactory.getLogger(ObjectService.class);

  private final ObjectRepository objectRepository;
  private final RelationshipRepository relationshipRepository;
  private final AccessStatsRepository accessStatsRepository;
  private final BranchResolver branchResolver;
  private final GraphProperties properties;

  /**
   * Constructs the service.
   *
   * @param objectRepository object versions
   * @param relationshipRepository relationship versions (for edge listing)
   * @param accessStatsRepository access statistics
   * @param branchResolver head resolution
   * @param properties engine limits
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All dependencies are Spring-managed beans and are intentionally shared")
  public ObjectService(ObjectRepository objectRepository,
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
   * Creates a new object (version 1 of a new canonical id).
   *
   * @param request the create request
   * @return the stored version
   * @throws KeyConflictException if the key is already used on (type, branch)
   */
  @Counted(value = "graph.objects.created", description = "Objects created")
  public GraphObject create(CreateObjectRequest request) {
    request.validate();
    List<UUID> lineage = branchResolver.lineage(request.branchId());
    UUID canonicalId = UuidCreator.getTimeOrderedEpoch();
    GraphObject template = GraphObject.template(canonicalId, request.branchId(), request.type(),
        request.key(), request.status(), PropertyMaps.withoutNulls(request.properties()),
        request.labels());
    Supplier<GraphObject> write = () -> objectRepository.append(canonicalId, lineage,
        WriteCondition.noHead(),
        prior -> template.withChangeSummary(ChangeSummaries.forObject(null, template)));
    if (request.key() == null) {
      return write.get();
    }
    findKeyHolder(request.type(), request.key(), lineage).ifPresent(holder -> {
      throw new KeyConflictException(request.type(), request.key(), holder);
    });
    return objectRepository.appendWithKey(request.type(), request.key(), lineage.get(0),
        canonicalId, write);
  }

  /**
   * Creates the object, or writes a new version of the object holding the key.
   * Identical content is a no-op; a tombstoned holder is revived with the new content.
   *
   * @param request the request (key required)
   * @return the outcome
   */
  public UpsertOutcome upsert(CreateObjectRequest request) {
    request.validate();
    if (request.key() == null) {
      throw new ValidationException("key is required for upsert");
    }
    List<UUID> lineage = branchResolver.lineage(request.branchId());
    Optional<UUID> holder = findKeyHolder(request.type(), request.key(), lineage);
    if (holder.isEmpty()) {
      try {
        return new UpsertOutcome(create(request), UpsertOutcome.CREATED);
      } catch (KeyConflictException e) {
        logger.debug("Upsert lost key race for {}:{}, updating winner", request.type(),
            request.key());
        holder = Optional.ofNullable(e.getExistingCanonicalId());
        if (holder.isEmpty()) {
          throw e;
        }
      }
    }
    UUID canonicalId = holder.get();
    GraphObject current = objectRepository.resolveHead(canonicalId, lineage)
        .orElseThrow(() -> new ObjectNotFoundException(canonicalId));
    GraphObject written = objectRepository.append(canonicalId, lineage, WriteCondition.any(),
        prior -> {
          GraphObject base = prior == null ? current : prior;
          GraphObject next = base.withContent(
                  request.status() != null ? request.status() : base.status(),
                  request.properties() != null
                      ? PropertyMaps.withoutNulls(request.properties()) : base.properties(),
                  request.labels() != null ? request.labels() : base.labels())
              .withDeletedAt(null)
              .withMergedFrom(null);
          if (prior != null && next.contentHash().equals(prior.contentHash())) {
            return null;
          }
          return next.withChangeSummary(ChangeSummaries.forObject(prior, next));
        });
    String outcome = written.id().equals(current.id()) ? UpsertOutcome.UNCHANGED
        : UpsertOutcome.UPDATED;
    return new UpsertOutcome(written, outcome);
  }

  /**
   * Gets an object by version id or canonical id.
   *
   * <p>A version id returns that exact version unless {@code resolveHead} is set or a branch
   * is given, in which case the head of its canonical id on that branch is returned.
   * A canonical id always returns the head on the given branch (main if absent).
   *
   * @param id version id or canonical id
   * @param branchRef branch id, "main" or null
   * @param resolveHead whether to return the head for a version id
   * @return the version
   * @throws ObjectNotFoundException if nothing matches
   */
  public GraphObject get(UUID id, String branchRef, boolean resolveHead) {
    Optional<GraphObject> version = objectRepository.findById(id);
    GraphObject result;
    if (version.isPresent() && !resolveHead && branchRef == null) {
      result = version.get();
    } else {
      EntityRef ref = resolveRef(id, branchRef);
      result = branchResolver.resolveHead(objectRepository, ref.canonicalId(), ref.branchId())
          .orElseThrow(() -> new ObjectNotFoundException(id));
    }
    accessStatsRepository.recordAccess(result.canonicalId(), Instant.now());
    return result;
  }

  /**
   * Applies a partial update, creating a new version. A patch that changes nothing returns
   * the current head.
   *
   * @param id version id or canonical id
   * @param branchRef branch, null to use the version's own branch (or main)
   * @param request the patch
   * @param ifMatch expected head version id, or null
   * @return the new (or unchanged) head
   */
  @Counted(value = "graph.objects.updated", description = "Object patches")
  public GraphObject patch(UUID id, String branchRef, PatchObjectRequest request, UUID ifMatch) {
    request.validate();
    EntityRef ref = resolveRef(id, branchRef);
    return objectRepository.append(ref.canonicalId(), branchResolver.lineage(ref.branchId()),
        WriteCondition.fromIfMatch(ifMatch), prior -> {
          GraphObject live = requireLive(prior, id);
          Map<String, Object> props =
              PropertyMaps.merge(live.properties(), request.properties());
          List<String> labels = live.labels();
          if (request.labels() != null) {
            if (request.isReplaceLabels()) {
              labels = request.labels();
            } else {
              Set<String> merged = new LinkedHashSet<>(live.labels());
              merged.addAll(request.labels());
              labels = new ArrayList<>(merged);
            }
          }
          String status = request.status() != null ? request.status() : live.status();
          GraphObject next = live.withContent(status, props, labels).withMergedFrom(null);
          if (next.contentHash().equals(live.contentHash())) {
            return null;
          }
          return next.withChangeSummary(ChangeSummaries.forObject(live, next));
        });
  }

  /**
   * Soft-deletes an object by appending a tombstone version.
   *
   * @param id version id or canonical id
   * @param branchRef branch, null for the version's own branch
   * @param ifMatch expected head version id, or null
   * @return the tombstone version
   */
  @Counted(value = "graph.objects.deleted", description = "Object deletions")
  public GraphObject delete(UUID id, String branchRef, UUID ifMatch) {
    EntityRef ref = resolveRef(id, branchRef);
    return objectRepository.append(ref.canonicalId(), branchResolver.lineage(ref.branchId()),
        WriteCondition.fromIfMatch(ifMatch), prior -> {
          GraphObject live = requireLive(prior, id);
          GraphObject tombstone = live.withDeletedAt(Instant.now()).withMergedFrom(null);
          return tombstone.withChangeSummary(ChangeSummaries.forObject(live, tombstone));
        });
  }

  /**
   * Restores a soft-deleted object as a new live version.
   *
   * @param id version id or canonical id
   * @param branchRef branch, null for the version's own branch
   * @param ifMatch expected head version id, or null
   * @return the restored version (new version id)
   */
  public GraphObject restore(UUID id, String branchRef, UUID ifMatch) {
    EntityRef ref = resolveRef(id, branchRef);
    return objectRepository.append(ref.canonicalId(), branchResolver.lineage(ref.branchId()),
        WriteCondition.fromIfMatch(ifMatch), prior -> {
          if (prior == null) {
            throw new ObjectNotFoundException(id);
          }
          if (!prior.isDeleted()) {
            throw new ValidationException("Object " + prior.canonicalId() + " is not deleted");
          }
          GraphObject restored = prior.withDeletedAt(null).withMergedFrom(null);
          return restored.withChangeSummary(ChangeSummaries.forObject(prior, restored));
        });
  }

  /**
   * Version history of an object as seen from a branch, oldest first.
   *
   * @param id version id or canonical id
   * @param branchRef branch, null for the version's own branch
   * @return the supersedes chain ending at the head
   */
  public List<GraphObject> history(UUID id, String branchRef) {
    EntityRef ref = resolveRef(id, branchRef);
    List<GraphObject> history = objectRepository.history(ref.canonicalId(),
        branchResolver.lineage(ref.branchId()));
    if (history.isEmpty()) {
      throw new ObjectNotFoundException(id);
    }
    return history;
  }

  /**
   * Live relationships touching an object on a branch.
   *
   * @param id version id or canonical id
   * @param branchRef branch, null for the version's own branch
   * @param types relationship types to include, empty for all
   * @param direction which side(s) to list
   * @return outgoing and incoming relationships
   */
  public ObjectEdgesResponse edges(UUID id, String branchRef, List<String> types,
      Direction direction) {
    EntityRef ref = resolveRef(id, branchRef);
    List<UUID> lineage = branchResolver.lineage(ref.branchId());
    if (objectRepository.resolveHead(ref.canonicalId(), lineage).isEmpty()) {
      throw new ObjectNotFoundException(id);
    }
    List<GraphRelationship> outgoing = new ArrayList<>();
    List<GraphRelationship> incoming = new ArrayList<>();
    for (UUID relId : relationshipRepository.findAdjacent(ref.canonicalId())) {
      relationshipRepository.resolveLiveHead(relId, lineage)
          .filter(rel -> types.isEmpty() || types.contains(rel.type()))
          .ifPresent(rel -> {
            if (direction.includesOutgoing() && rel.srcId().equals(ref.canonicalId())) {
              outgoing.add(rel);
            }
            if (direction.includesIncoming() && rel.dstId().equals(ref.canonicalId())) {
              incoming.add(rel);
            }
          });
    }
    return new ObjectEdgesResponse(outgoing, incoming);
  }

  /**
   * Searches object heads visible on a branch.
   *
   * @param criteria filters and paging
   * @return one page of results
   */
  public SearchResponse<GraphObject> search(ObjectSearchCriteria criteria) {
    int limit = SearchPager.effectiveLimit(criteria.limit(), properties.getSearch());
    UUID branchId = BranchResolver.parseBranchRef(criteria.branchRef());
    List<UUID> lineage = branchResolver.lineage(branchId);
    List<String> types = criteria.allTypes();
    List<String> labels = criteria.allLabels();

    Set<UUID> candidates;
    if (criteria.key() != null && !types.isEmpty()) {
      candidates = new LinkedHashSet<>();
      for (String type : types) {
        findKeyHolder(type, criteria.key(), lineage).ifPresent(candidates::add);
      }
    } else {
      candidates = objectRepository.visibleCanonicalIds(lineage);
    }

    List<GraphObject> matches = new ArrayList<>();
    for (UUID canonicalId : candidates) {
      objectRepository.resolveHead(canonicalId, lineage)
          .filter(o -> criteria.includeDeleted() || !o.isDeleted())
          .filter(o -> types.isEmpty() || types.contains(o.type()))
          .filter(o -> labels.isEmpty() || o.labels().stream().anyMatch(labels::contains))
          .filter(o -> criteria.status() == null || criteria.status().equals(o.status()))
          .filter(o -> criteria.key() == null || criteria.key().equals(o.key()))
          .ifPresent(matches::add);
    }
    return SearchPager.page(matches, criteria.order(), criteria.cursor(), limit);
  }

  /**
   * Finds the canonical id holding a key anywhere in a branch lineage.
   *
   * @param type object type
   * @param key business key
   * @param lineage branch lineage
   * @return the holder, nearest branch first
   */
  Optional<UUID> findKeyHolder(String type, String key, List<UUID> lineage) {
    for (UUID branchKey : lineage) {
      Optional<UUID> holder = objectRepository.findCanonicalIdByKey(type, key, branchKey);
      if (holder.isPresent()) {
        return holder;
      }
    }
    return Optional.empty();
  }

  /**
   * Resolves a version-or-canonical id plus optional branch into a write target.
   *
   * @param id version id or canonical id
   * @param branchRef explicit branch, or null to use the version's branch (main for canonical)
   * @return canonical id and branch
   */
  EntityRef resolveRef(UUID id, String branchRef) {
    Optional<GraphObject> version = objectRepository.findById(id);
    UUID canonicalId = version.map(GraphObject::canonicalId).orElse(id);
    UUID branchId = branchRef != null
        ? BranchResolver.parseBranchRef(branchRef)
        : version.map(GraphObject::branchId).orElse(null);
    if (version.isEmpty() && !objectRepository.containsCanonical(canonicalId)) {
      throw new ObjectNotFoundException(id);
    }
    branchResolver.requireBranch(branchId);
    return new EntityRef(canonicalId, branchId);
  }

  private static GraphObject requireLive(GraphObject prior, UUID requestedId) {
    if (prior == null) {
      throw new ObjectNotFoundException(requestedId);
    }
    if (prior.isDeleted()) {
      throw new ValidationException("Object " + prior.canonicalId()
          + " is deleted; restore it first");
    }
    return prior;
  }

  /**
   * Canonical id and branch a request addresses.
   *
   * @param canonicalId canonical id
   * @param branchId branch id, null for main
   */
  record EntityRef(UUID canonicalId, UUID branchId) {
  }

  /**
   * Result of an upsert.
   *
   * @param object resulting head
   * @param outcome "created", "updated" or "unchanged"
   */
  public record UpsertOutcome(GraphObject object, String outcome) {
    public static final String CREATED = "created";
    public static final String UPDATED = "updated";
    public static final String UNCHANGED = "unchanged";
  }
}
