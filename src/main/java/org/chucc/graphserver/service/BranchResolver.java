package org.chucc.graphserver.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.chucc.graphserver.config.CacheProperties;
import org.chucc.graphserver.domain.Branch;
import org.chucc.graphserver.domain.VersionedEntity;
import org.chucc.graphserver.exception.BranchNotFoundException;
import org.chucc.graphserver.repository.BranchRepository;
import org.chucc.graphserver.repository.VersionStore;
import org.springframework.stereotype.Service;

/**
 * Resolves "the current version of X as seen from branch B".
 *
 * <p>A branch sees its own versions first, then its parent's, up to main. The lineage of a
 * branch (branch, parent, ..., main) is cached in Caffeine and invalidated whenever branches
 * are created or deleted; head lookups along the lineage hit the version store's maintained
 * head index, so resolution costs one map lookup per lineage level.
 */
@Service
public class BranchResolver {

  private final BranchRepository branchRepository;
  private final MeterRegistry meterRegistry;
  private final LoadingCache<UUID, List<UUID>> lineageCache;

  /**
   * Constructs the resolver.
   *
   * @param branchRepository the branch repository
   * @param cacheProperties lineage cache settings
   * @param meterRegistry the meter registry for cache metrics
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All dependencies are Spring-managed beans and are intentionally shared")
  public BranchResolver(BranchRepository branchRepository, CacheProperties cacheProperties,
      MeterRegistry meterRegistry) {
    this.branchRepository = branchRepository;
    this.meterRegistry = meterRegistry;
    Caffeine<Object, Object> builder = Caffeine.newBuilder()
        .maximumSize(cacheProperties.getLineageMaxSize())
        .recordStats();
    if (cacheProperties.getLineageTtlMinutes() > 0) {
      builder.expireAfterWrite(Duration.ofMinutes(cacheProperties.getLineageTtlMinutes()));
    }
    this.lineageCache = builder.build(this::loadLineage);
  }

  /**
   * Registers lineage cache metrics.
   */
  @PostConstruct
  public void initializeMetrics() {
    CaffeineCacheMetrics.monitor(meterRegistry, lineageCache, "branch_lineage");
  }

  /**
   * Parses a branch reference from a path or query parameter.
   * {@code null}, blank, {@code "main"} and the nil UUID all mean main.
   *
   * @param value raw value
   * @return the branch id, or null for main
   * @throws IllegalArgumentException if the value is not a UUID
   */
  public static UUID parseBranchRef(String value) {
    if (value == null || value.isBlank() || Branch.MAIN.equalsIgnoreCase(value.trim())) {
      return null;
    }
    try {
      return Branch.fromKey(UUID.fromString(value.trim()));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid branch id: " + value, e);
    }
  }

  /**
   * Returns the lineage of a branch as index keys, the branch itself first and main last.
   *
   * @param branchId branch id, null for main
   * @return the lineage
   * @throws BranchNotFoundException if the branch (or an ancestor) does not exist
   */
  public List<UUID> lineage(UUID branchId) {
    if (Branch.isMain(branchId)) {
      return List.of(Branch.MAIN_KEY);
    }
    return lineageCache.get(branchId);
  }

  /**
   * Verifies that a branch exists.
   *
   * @param branchId branch id, null for main
   * @throws BranchNotFoundException if it does not
   */
  public void requireBranch(UUID branchId) {
    lineage(branchId);
  }

  /**
   * Resolves the head of a canonical id on a branch, tombstones included.
   *
   * @param store version store
   * @param canonicalId canonical id
   * @param branchId branch id, null for main
   * @param <T> entity type
   * @return the head if any
   */
  public <T extends VersionedEntity<T>> Optional<T> resolveHead(VersionStore<T> store,
      UUID canonicalId, UUID branchId) {
    return store.resolveHead(canonicalId, lineage(branchId));
  }

  /**
   * Resolves the live (non-tombstoned) head of a canonical id on a branch.
   *
   * @param store version store
   * @param canonicalId canonical id
   * @param branchId branch id, null for main
   * @param <T> entity type
   * @return the live head if any
   */
  public <T extends VersionedEntity<T>> Optional<T> resolveLiveHead(VersionStore<T> store,
      UUID canonicalId, UUID branchId) {
    return store.resolveLiveHead(canonicalId, lineage(branchId));
  }

  /**
   * Drops all cached lineages.
   */
  public void invalidate() {
    lineageCache.invalidateAll();
  }

  private List<UUID> loadLineage(UUID branchId) {
    List<UUID> lineage = new ArrayList<>();
    Set<UUID> seen = new LinkedHashSet<>();
    UUID current = branchId;
    while (current != null) {
      if (!seen.add(current)) {
        throw new IllegalStateException("Branch ancestry cycle at " + current);
      }
      final UUID lookup = current;
      Branch branch = branchRepository.findById(current)
          .orElseThrow(() -> new BranchNotFoundException(lookup));
      lineage.add(branch.getId());
      current = branch.getParentBranchId();
    }
    lineage.add(Branch.MAIN_KEY);
    return List.copyOf(lineage);
  }
}
