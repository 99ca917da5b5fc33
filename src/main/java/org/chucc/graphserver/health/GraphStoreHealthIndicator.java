package org.chucc.graphserver.health;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.chucc.graphserver.repository.BranchRepository;
import org.chucc.graphserver.repository.ObjectRepository;
import org.chucc.graphserver.repository.RelationshipRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the in-memory graph stores.
 * Reports entity and version counts.
 */
@Component
public class GraphStoreHealthIndicator implements HealthIndicator {

  private final ObjectRepository objectRepository;
  private final RelationshipRepository relationshipRepository;
  private final BranchRepository branchRepository;

  /**
   * Creates a new graph store health indicator.
   *
   * @param objectRepository the object store
   * @param relationshipRepository the relationship store
   * @param branchRepository the branch repository
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Repositories are Spring-managed beans and are intentionally shared"
  )
  public GraphStoreHealthIndicator(ObjectRepository objectRepository,
      RelationshipRepository relationshipRepository,
      BranchRepository branchRepository) {
    this.objectRepository = objectRepository;
    this.relationshipRepository = relationshipRepository;
    this.branchRepository = branchRepository;
  }

  @Override
  public Health health() {
    try {
      return Health.up()
          .withDetail("objects", objectRepository.canonicalCount())
          .withDetail("objectVersions", objectRepository.versionCount())
          .withDetail("relationships", relationshipRepository.canonicalCount())
          .withDetail("relationshipVersions", relationshipRepository.versionCount())
          .withDetail("branches", branchRepository.count())
          .build();
    } catch (RuntimeException e) {
      return Health.down()
          .withDetail("error", e.getMessage())
          .withException(e)
          .build();
    }
  }
}
