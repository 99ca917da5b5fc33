package org.chucc.graphserver.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the branch lineage cache.
 * Lineages (branch, parent, ..., main) are resolved on every read and write.
 */
@Component
@ConfigurationProperties(prefix = "graph.cache")
public class CacheProperties {

  /**
   * Maximum number of cached branch lineages.
   */
  private int lineageMaxSize = 1000;

  /**
   * Time-to-live for cached lineages in minutes (0 = no TTL).
   */
  private int lineageTtlMinutes = 0;

  public int getLineageMaxSize() {
    return lineageMaxSize;
  }

  public void setLineageMaxSize(int lineageMaxSize) {
    this.lineageMaxSize = lineageMaxSize;
  }

  public int getLineageTtlMinutes() {
    return lineageTtlMinutes;
  }

  public void setLineageTtlMinutes(int lineageTtlMinutes) {
    this.lineageTtlMinutes = lineageTtlMinutes;
  }
}
