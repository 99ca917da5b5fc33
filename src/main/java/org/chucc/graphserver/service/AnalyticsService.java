package org.chucc.graphserver.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.chucc.graphserver.config.GraphProperties;
import org.chucc.graphserver.domain.GraphObject;
import org.chucc.graphserver.dto.AnalyticsItem;
import org.chucc.graphserver.dto.AnalyticsResponse;
import org.chucc.graphserver.exception.ValidationException;
import org.chucc.graphserver.repository.AccessStatsRepository;
import org.chucc.graphserver.repository.AccessStatsRepository.AccessStats;
import org.chucc.graphserver.repository.ObjectRepository;
import org.chucc.graphserver.util.SearchPager;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Access analytics over the live objects visible on a branch.
 */
@Service
public class AnalyticsService {

  /** Default age after which an object counts as unused. */
  public static final int DEFAULT_DAYS_THRESHOLD = 30;

  private final ObjectRepository objectRepository;
  private final AccessStatsRepository accessStatsRepository;
  private final BranchResolver branchResolver;
  private final GraphProperties properties;
  private final Clock clock;

  /**
   * Constructs the service with the system clock.
   *
   * @param objectRepository object versions
   * @param accessStatsRepository access statistics
   * @param branchResolver head resolution
   * @param properties listing limits
   */
  @Autowired
  public AnalyticsService(ObjectRepository objectRepository,
      AccessStatsRepository accessStatsRepository,
      BranchResolver branchResolver,
      GraphProperties properties) {
    this(objectRepository, accessStatsRepository, branchResolver, properties,
        Clock.systemUTC());
  }

  /**
   * Constructs the service with an explicit clock.
   *
   * @param objectRepository object versions
   * @param accessStatsRepository access statistics
   * @param branchResolver head resolution
   * @param properties listing limits
   * @param clock time source for day computations
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All dependencies are Spring-managed beans and are intentionally shared")
  public AnalyticsService(ObjectRepository objectRepository,
      AccessStatsRepository accessStatsRepository,
      BranchResolver branchResolver,
      GraphProperties properties,
      Clock clock) {
    this.objectRepository = objectRepository;
    this.accessStatsRepository = accessStatsRepository;
    this.branchResolver = branchResolver;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Lists the most frequently read objects.
   *
   * @param limit maximum items (default 50, max 200)
   * @param minAccessCount minimum reads to be listed (default 1)
   * @param branchRef branch, or null for main
   * @return objects ordered by access count, most first
   */
  public AnalyticsResponse mostAccessed(Integer limit, Integer minAccessCount, String branchRef) {
    int effectiveLimit = SearchPager.effectiveLimit(limit, properties.getSearch());
    int minimum = minAccessCount == null ? 1 : minAccessCount;
    if (minimum < 0) {
      throw new ValidationException("min_access_count cannot be negative");
    }
    List<UUID> lineage = branchResolver.lineage(BranchResolver.parseBranchRef(branchRef));
    Instant now = clock.instant();

    List<AnalyticsItem> items = new ArrayList<>();
    for (Map.Entry<UUID, AccessStats> e : accessStatsRepository.findAll().entrySet()) {
      if (e.getValue().accessCount() < minimum) {
        continue;
      }
      objectRepository.resolveLiveHead(e.getKey(), lineage)
          .ifPresent(head -> items.add(toItem(head, Optional.of(e.getValue()), now)));
    }
    items.sort(Comparator.comparingLong(AnalyticsItem::accessCount).reversed()
        .thenComparing(AnalyticsItem::canonicalId));
    List<AnalyticsItem> page = items.subList(0, Math.min(effectiveLimit, items.size()));

    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("limit", effectiveLimit);
    meta.put("min_access_count", minimum);
    return new AnalyticsResponse(page, page.size(), meta);
  }

  /**
   * Lists objects not read within a number of days, never-read objects first.
   *
   * @param limit maximum items (default 50, max 200)
   * @param daysThreshold minimum days since the last read (default 30)
   * @param branchRef branch, or null for main
   * @return objects ordered by last access, oldest first
   */
  public AnalyticsResponse unused(Integer limit, Integer daysThreshold, String branchRef) {
    int effectiveLimit = SearchPager.effectiveLimit(limit, properties.getSearch());
    int days = daysThreshold == null ? DEFAULT_DAYS_THRESHOLD : daysThreshold;
    if (days < 0) {
      throw new ValidationException("days_threshold cannot be negative");
    }
    List<UUID> lineage = branchResolver.lineage(BranchResolver.parseBranchRef(branchRef));
    Instant now = clock.instant();
    Instant cutoff = now.minus(Duration.ofDays(days));

    List<AnalyticsItem> items = new ArrayList<>();
    for (UUID canonicalId : objectRepository.visibleCanonicalIds(lineage)) {
      Optional<AccessStats> stats = accessStatsRepository.find(canonicalId);
      if (stats.isPresent() && stats.get().lastAccessedAt().isAfter(cutoff)) {
        continue;
      }
      objectRepository.resolveLiveHead(canonicalId, lineage)
          .ifPresent(head -> items.add(toItem(head, stats, now)));
    }
    items.sort(Comparator.comparing(AnalyticsItem::lastAccessedAt,
            Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(AnalyticsItem::canonicalId));
    List<AnalyticsItem> page = items.subList(0, Math.min(effectiveLimit, items.size()));

    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("limit", effectiveLimit);
    meta.put("days_threshold", days);
    return new AnalyticsResponse(page, page.size(), meta);
  }

  private static AnalyticsItem toItem(GraphObject head, Optional<AccessStats> stats,
      Instant now) {
    Instant lastAccessed = stats.map(AccessStats::lastAccessedAt).orElse(null);
    Long daysSince = lastAccessed == null
        ? null
        : Duration.between(lastAccessed, now).toDays();
    return new AnalyticsItem(head.id(), head.canonicalId(), head.type(), head.key(),
        head.properties(), head.labels(), lastAccessed,
        stats.map(AccessStats::accessCount).orElse(0L), daysSince, head.createdAt());
  }
}
