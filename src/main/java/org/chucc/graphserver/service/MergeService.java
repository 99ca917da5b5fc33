package org.chucc.graphserver.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Supplier;
import org.chucc.graphserver.config.GraphProperties;
import org.chucc.graphserver.domain.Branch;
import org.chucc.graphserver.domain.GraphObject;
import org.chucc.graphserver.domain.GraphRelationship;
import org.chucc.graphserver.domain.MergeStatus;
import org.chucc.graphserver.domain.VersionedEntity;
import org.chucc.graphserver.dto.ConflictItem;
import org.chucc.graphserver.dto.MergeItemSummary;
import org.chucc.graphserver.dto.MergeRequest;
import org.chucc.graphserver.dto.MergeResponse;
import org.chucc.graphserver.dto.SkippedItem;
import org.chucc.graphserver.exception.FeatureDisabledException;
import org.chucc.graphserver.exception.GraphException;
import org.chucc.graphserver.exception.ValidationException;
import org.chucc.graphserver.repository.ObjectRepository;
import org.chucc.graphserver.repository.RelationshipRepository;
import org.chucc.graphserver.repository.WriteCondition;
import org.chucc.graphserver.util.ChangeSummaries;
import org.chucc.graphserver.util.PropertyDiff;
import org.chucc.graphserver.util.VersionAncestry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Classifies and optionally applies the differences between a source and a target branch.
 *
 * <p>Every canonical id with versions of its own on either branch is classified
 * independently:
 * <ul>
 *   <li>no source head: unchanged</li>
 *   <li>no target head: added (a source tombstone is unchanged)</li>
 *   <li>same version or same content: unchanged</li>
 *   <li>source head is an ancestor of the target head: unchanged</li>
 *   <li>target head is an ancestor of the source head: fast-forward</li>
 *   <li>otherwise: conflict</li>
 * </ul>
 *
 * <p>Apply mode writes added and fast-forward items one at a time, each under its canonical
 * id's write lock with the classified target head as precondition. Conflicts are never
 * written. A partially applied merge is valid: every committed item stays committed.
 */
@Service
public class MergeService {

  private static final Logger logger = LoggerFactory.getLogger(MergeService.class);

  static final String OBJECT = "object";
  static final String RELATIONSHIP = "relationship";

  private static final Comparator<Classified<?>> REPORT_ORDER =
      Comparator.comparing((Classified<?> item) -> item.status())
          .thenComparing(item -> item.canonicalId());

  private final ObjectRepository objectRepository;
  private final RelationshipRepository relationshipRepository;
  private final ObjectService objectService;
  private final RelationshipService relationshipService;
  private final BranchResolver branchResolver;
  private final GraphProperties properties;
  private final VersionAncestry<GraphObject> objectAncestry;
  private final VersionAncestry<GraphRelationship> relationshipAncestry;

  /**
   * Constructs the service.
   *
   * @param objectRepository object versions
   * @param relationshipRepository relationship versions
   * @param objectService key lookups
   * @param relationshipService endpoint lookups and checks
   * @param branchResolver head resolution
   * @param properties merge settings
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All dependencies are Spring-managed beans and are intentionally shared")
  public MergeService(ObjectRepository objectRepository,
      RelationshipRepository relationshipRepository,
      ObjectService objectService,
      RelationshipService relationshipService,
      BranchResolver branchResolver,
      GraphProperties properties) {
    this.objectRepository = objectRepository;
    this.relationshipRepository = relationshipRepository;
    this.objectService = objectService;
    this.relationshipService = relationshipService;
    this.branchResolver = branchResolver;
    this.properties = properties;
    this.objectAncestry = new VersionAncestry<>(objectRepository);
    this.relationshipAncestry = new VersionAncestry<>(relationshipRepository);
  }

  /**
   * Merges a source branch into a target branch.
   *
   * @param targetBranchId target branch, null for main
   * @param request source branch and mode
   * @return the classification, plus apply results when executed
   * @throws FeatureDisabledException if merges are disabled
   * @throws ValidationException if source and target are the same branch
   */
  @Timed(value = "graph.merge", description = "Branch merge duration")
  public MergeResponse merge(UUID targetBranchId, MergeRequest request) {
    if (!properties.getMerge().isEnabled()) {
      throw new FeatureDisabledException("merge");
    }
    request.validate();
    UUID sourceBranchId = BranchResolver.parseBranchRef(request.sourceBranchId());
    UUID targetId = Branch.fromKey(targetBranchId);
    if (Objects.equals(sourceBranchId, targetId)) {
      throw new ValidationException("Source and target branch must differ");
    }
    List<UUID> sourceLineage = branchResolver.lineage(sourceBranchId);
    List<UUID> targetLineage = branchResolver.lineage(targetId);
    int hardLimit = request.limit() != null && request.limit() > 0
        ? request.limit()
        : properties.getMerge().getDefaultLimit();

    Map<UUID, Classified<GraphObject>> objects = classifyObjects(sourceLineage, targetLineage);
    Map<UUID, Classified<GraphRelationship>> relationships =
        classifyRelationships(sourceLineage, targetLineage, objects);

    ApplyProgress progress = null;
    if (request.isExecute()) {
      progress = apply(objects.values(), relationships.values(), targetLineage, hardLimit);
    }
    MergeResponse response = toResponse(targetId, sourceBranchId, objects.values(),
        relationships.values(), hardLimit, progress);

    logger.info("Merge {} -> {} ({}): objects {} total / {} conflicts, relationships {} total"
            + " / {} conflicts / {} dangling, applied {}",
        branchLabel(sourceBranchId), branchLabel(targetId),
        request.isExecute() ? "apply" : "dry-run", response.totalObjects(),
        response.conflictCount(), response.relationshipsTotal(),
        response.relationshipsConflictCount(), response.relationshipsDanglingCount(),
        progress == null ? 0 : progress.applied);
    return response;
  }

  private Map<UUID, Classified<GraphObject>> classifyObjects(List<UUID> sourceLineage,
      List<UUID> targetLineage) {
    Map<UUID, Classified<GraphObject>> result = new LinkedHashMap<>();
    for (UUID canonicalId : universe(objectRepository.canonicalIdsOn(sourceLineage.get(0)),
        objectRepository.canonicalIdsOn(targetLineage.get(0)))) {
      GraphObject source = objectRepository.resolveHead(canonicalId, sourceLineage).orElse(null);
      GraphObject target = objectRepository.resolveHead(canonicalId, targetLineage).orElse(null);
      Classified<GraphObject> item = classify(canonicalId, source, target, objectAncestry,
          MergeService::objectPaths);
      if (item.status() == MergeStatus.ADDED && source.key() != null) {
        Optional<UUID> holder =
            objectService.findKeyHolder(source.type(), source.key(), targetLineage);
        if (holder.isPresent() && !holder.get().equals(canonicalId)) {
          item = item.reclassify(MergeStatus.CONFLICT, List.of("key"));
        }
      }
      result.put(canonicalId, item);
    }
    return result;
  }

  private Map<UUID, Classified<GraphRelationship>> classifyRelationships(
      List<UUID> sourceLineage, List<UUID> targetLineage,
      Map<UUID, Classified<GraphObject>> objects) {
    Map<UUID, Classified<GraphRelationship>> result = new LinkedHashMap<>();
    for (UUID canonicalId : universe(
        relationshipRepository.canonicalIdsOn(sourceLineage.get(0)),
        relationshipRepository.canonicalIdsOn(targetLineage.get(0)))) {
      GraphRelationship source =
          relationshipRepository.resolveHead(canonicalId, sourceLineage).orElse(null);
      GraphRelationship target =
          relationshipRepository.resolveHead(canonicalId, targetLineage).orElse(null);
      Classified<GraphRelationship> item = classify(canonicalId, source, target,
          relationshipAncestry, MergeService::relationshipPaths);

      if (item.status() == MergeStatus.ADDED) {
        Optional<UUID> holder = relationshipService.findByEndpoints(source.type(),
            source.srcId(), source.dstId(), targetLineage);
        if (holder.isPresent() && !holder.get().equals(canonicalId)) {
          item = item.reclassify(MergeStatus.CONFLICT, List.of("src_id", "dst_id"));
        }
      }
      if (item.status().isApplicable() && !source.isDeleted()) {
        List<String> missing = new ArrayList<>(2);
        if (!endpointLiveAfterMerge(source.srcId(), objects, targetLineage)) {
          missing.add("src_id");
        }
        if (!endpointLiveAfterMerge(source.dstId(), objects, targetLineage)) {
          missing.add("dst_id");
        }
        if (!missing.isEmpty()) {
          item = item.reclassify(MergeStatus.DANGLING_REFERENCE, missing);
        }
      }
      result.put(canonicalId, item);
    }
    return result;
  }

  private boolean endpointLiveAfterMerge(UUID objectId,
      Map<UUID, Classified<GraphObject>> objects, List<UUID> targetLineage) {
    Classified<GraphObject> merged = objects.get(objectId);
    if (merged != null && merged.status().isApplicable()) {
      return !merged.sourceHead().isDeleted();
    }
    return objectRepository.resolveLiveHead(objectId, targetLineage).isPresent();
  }

  private static <T extends VersionedEntity<T>> Classified<T> classify(UUID canonicalId,
      T source, T target, VersionAncestry<T> ancestry, BiFunction<T, T, List<String>> differ) {
    if (source == null) {
      return Classified.of(canonicalId, MergeStatus.UNCHANGED, null, target);
    }
    if (target == null) {
      return Classified.of(canonicalId,
          source.isDeleted() ? MergeStatus.UNCHANGED : MergeStatus.ADDED, source, null);
    }
    if (source.id().equals(target.id()) || source.contentHash().equals(target.contentHash())
        || ancestry.isAncestor(source.id(), target.id())) {
      return Classified.of(canonicalId, MergeStatus.UNCHANGED, source, target);
    }
    if (ancestry.isAncestor(target.id(), source.id())) {
      return new Classified<>(canonicalId, MergeStatus.FAST_FORWARD, source, target,
          differ.apply(target, source), List.of(), List.of());
    }
    T base = ancestry.findCommonAncestor(source.id(), target.id())
        .flatMap(ancestry::find)
        .orElse(null);
    return new Classified<>(canonicalId, MergeStatus.CONFLICT, source, target,
        differ.apply(base, source), differ.apply(base, target), differ.apply(target, source));
  }

  private ApplyProgress apply(Collection<Classified<GraphObject>> objects,
      Collection<Classified<GraphRelationship>> relationships, List<UUID> targetLineage,
      int hardLimit) {
    ApplyProgress progress = new ApplyProgress(hardLimit);
    for (Classified<GraphObject> item : sorted(objects)) {
      if (!item.status().isApplicable()) {
        continue;
      }
      if (!progress.canContinue()) {
        return progress;
      }
      progress.attempt(OBJECT, item.canonicalId(), () -> applyObject(item, targetLineage));
    }
    for (Classified<GraphRelationship> item : sorted(relationships)) {
      if (!item.status().isApplicable()) {
        continue;
      }
      if (!progress.canContinue()) {
        return progress;
      }
      progress.attempt(RELATIONSHIP, item.canonicalId(),
          () -> applyRelationship(item, targetLineage));
    }
    return progress;
  }

  private void applyObject(Classified<GraphObject> item, List<UUID> targetLineage) {
    GraphObject source = item.sourceHead();
    Supplier<GraphObject> write = () -> objectRepository.append(item.canonicalId(),
        targetLineage, item.expectedTarget(),
        prior -> source.withMergedFrom(source.id())
            .withChangeSummary(ChangeSummaries.forObject(prior, source)));
    if (item.status() == MergeStatus.ADDED && source.key() != null) {
      objectRepository.appendWithKey(source.type(), source.key(), targetLineage.get(0),
          item.canonicalId(), write);
    } else {
      write.get();
    }
  }

  private void applyRelationship(Classified<GraphRelationship> item,
      List<UUID> targetLineage) {
    GraphRelationship source = item.sourceHead();
    if (!source.isDeleted()) {
      relationshipService.requireLiveEndpoints(source.srcId(), source.dstId(), targetLineage);
    }
    if (item.status() == MergeStatus.ADDED) {
      UUID holder = relationshipRepository.registerEndpoints(source.type(), source.srcId(),
          source.dstId(), targetLineage.get(0), item.canonicalId());
      if (!holder.equals(item.canonicalId())) {
        throw new ValidationException("Relationship " + source.type() + " between "
            + source.srcId() + " and " + source.dstId() + " already exists as " + holder);
      }
    }
    relationshipRepository.append(item.canonicalId(), targetLineage, item.expectedTarget(),
        prior -> source.withMergedFrom(source.id())
            .withChangeSummary(ChangeSummaries.forRelationship(prior, source)));
  }

  private MergeResponse toResponse(UUID targetId, UUID sourceId,
      Collection<Classified<GraphObject>> objects,
      Collection<Classified<GraphRelationship>> relationships, int hardLimit,
      ApplyProgress progress) {
    Map<MergeStatus, Integer> objectCounts = countByStatus(objects);
    Map<MergeStatus, Integer> relationshipCounts = countByStatus(relationships);

    List<MergeItemSummary> objectSummaries = new ArrayList<>();
    List<ConflictItem> conflicts = new ArrayList<>();
    for (Classified<GraphObject> item : sorted(objects)) {
      if (objectSummaries.size() < hardLimit) {
        objectSummaries.add(item.toSummary());
      }
      if (item.status() == MergeStatus.CONFLICT && conflicts.size() < hardLimit) {
        conflicts.add(item.toConflict(OBJECT));
      }
    }
    List<MergeItemSummary> relationshipSummaries = new ArrayList<>();
    for (Classified<GraphRelationship> item : sorted(relationships)) {
      if (relationshipSummaries.size() < hardLimit) {
        relationshipSummaries.add(item.toRelationshipSummary());
      }
      if (item.status() == MergeStatus.CONFLICT && conflicts.size() < hardLimit) {
        conflicts.add(item.toConflict(RELATIONSHIP));
      }
    }

    boolean truncated = objects.size() > hardLimit || relationships.size() > hardLimit
        || (progress != null && progress.truncated);
    return new MergeResponse(
        targetId,
        sourceId,
        progress == null,
        objects.size(),
        objectCounts.get(MergeStatus.UNCHANGED),
        objectCounts.get(MergeStatus.ADDED),
        objectCounts.get(MergeStatus.FAST_FORWARD),
        objectCounts.get(MergeStatus.CONFLICT),
        objectSummaries,
        relationships.size(),
        relationshipCounts.get(MergeStatus.UNCHANGED),
        relationshipCounts.get(MergeStatus.ADDED),
        relationshipCounts.get(MergeStatus.FAST_FORWARD),
        relationshipCounts.get(MergeStatus.CONFLICT),
        relationshipCounts.get(MergeStatus.DANGLING_REFERENCE),
        relationshipSummaries,
        conflicts,
        truncated,
        hardLimit,
        progress == null ? null : progress.applied > 0,
        progress == null ? null : progress.applied,
        progress == null ? null : progress.skipped);
  }

  private static Map<MergeStatus, Integer> countByStatus(
      Collection<? extends Classified<?>> items) {
    Map<MergeStatus, Integer> counts = new LinkedHashMap<>();
    for (MergeStatus status : MergeStatus.values()) {
      counts.put(status, 0);
    }
    for (Classified<?> item : items) {
      counts.merge(item.status(), 1, Integer::sum);
    }
    return counts;
  }

  private static <T extends Classified<?>> List<T> sorted(Collection<T> items) {
    List<T> list = new ArrayList<>(items);
    list.sort(REPORT_ORDER);
    return list;
  }

  private static Set<UUID> universe(Set<UUID> source, Set<UUID> target) {
    Set<UUID> all = new TreeSet<>(source);
    all.addAll(target);
    return all;
  }

  private static String branchLabel(UUID branchId) {
    return branchId == null ? Branch.MAIN : branchId.toString();
  }

  static List<String> objectPaths(GraphObject before, GraphObject after) {
    if (before == null) {
      return PropertyDiff.changedPaths(Map.of(), after.properties());
    }
    List<String> paths = new ArrayList<>(
        PropertyDiff.changedPaths(before.properties(), after.properties()));
    if (!Objects.equals(before.status(), after.status())) {
      paths.add("status");
    }
    if (!new HashSet<>(before.labels()).equals(new HashSet<>(after.labels()))) {
      paths.add("labels");
    }
    if (before.isDeleted() != after.isDeleted()) {
      paths.add("deleted");
    }
    return paths;
  }

  static List<String> relationshipPaths(GraphRelationship before, GraphRelationship after) {
    if (before == null) {
      return PropertyDiff.changedPaths(Map.of(), after.properties());
    }
    List<String> paths = new ArrayList<>(
        PropertyDiff.changedPaths(before.properties(), after.properties()));
    if (!Objects.equals(before.weight(), after.weight())) {
      paths.add("weight");
    }
    if (before.isDeleted() != after.isDeleted()) {
      paths.add("deleted");
    }
    return paths;
  }

  /**
   * Classification of one canonical id.
   */
  private record Classified<T extends VersionedEntity<T>>(
      UUID canonicalId,
      MergeStatus status,
      T sourceHead,
      T targetHead,
      List<String> sourcePaths,
      List<String> targetPaths,
      List<String> conflicts) {

    static <T extends VersionedEntity<T>> Classified<T> of(UUID canonicalId, MergeStatus status,
        T sourceHead, T targetHead) {
      return new Classified<>(canonicalId, status, sourceHead, targetHead, List.of(), List.of(),
          List.of());
    }

    Classified<T> reclassify(MergeStatus newStatus, List<String> newConflicts) {
      return new Classified<>(canonicalId, newStatus, sourceHead, targetHead, sourcePaths,
          targetPaths, newConflicts);
    }

    WriteCondition expectedTarget() {
      return targetHead == null
          ? WriteCondition.noHead()
          : WriteCondition.headIs(targetHead.id());
    }

    MergeItemSummary toSummary() {
      return new MergeItemSummary(canonicalId, typeOf(), status, idOf(sourceHead),
          idOf(targetHead), sourcePaths, targetPaths, conflicts, null, null, null, null);
    }

    MergeItemSummary toRelationshipSummary() {
      GraphRelationship source = (GraphRelationship) sourceHead;
      GraphRelationship target = (GraphRelationship) targetHead;
      return new MergeItemSummary(canonicalId, typeOf(), status, idOf(sourceHead),
          idOf(targetHead), sourcePaths, targetPaths, conflicts,
          source == null ? null : source.srcId(), source == null ? null : source.dstId(),
          target == null ? null : target.srcId(), target == null ? null : target.dstId());
    }

    ConflictItem toConflict(String kind) {
      return new ConflictItem(kind, canonicalId, idOf(sourceHead), idOf(targetHead), conflicts,
          kind + " " + canonicalId + " changed on both branches since their common version");
    }

    private String typeOf() {
      T any = sourceHead != null ? sourceHead : targetHead;
      if (any instanceof GraphObject object) {
        return object.type();
      }
      if (any instanceof GraphRelationship relationship) {
        return relationship.type();
      }
      return null;
    }

    private static UUID idOf(VersionedEntity<?> version) {
      return version == null ? null : version.id();
    }
  }

  /**
   * Running state of an apply pass.
   */
  private static final class ApplyProgress {

    private final int limit;
    private final List<SkippedItem> skipped = new ArrayList<>();
    private int applied;
    private boolean truncated;

    ApplyProgress(int limit) {
      this.limit = limit;
    }

    boolean canContinue() {
      if (Thread.currentThread().isInterrupted()) {
        logger.warn("Merge apply interrupted after {} items", applied);
        truncated = true;
        return false;
      }
      if (applied >= limit) {
        truncated = true;
        return false;
      }
      return true;
    }

    void attempt(String kind, UUID canonicalId, Runnable write) {
      try {
        write.run();
        applied++;
      } catch (GraphException e) {
        logger.warn("Skipped merging {} {}: {}", kind, canonicalId, e.getMessage());
        skipped.add(new SkippedItem(kind, canonicalId, e.getCode(), e.getMessage()));
      }
    }
  }
}
