package org.chucc.graphserver.config;

import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the graph engine's limits and optional behaviors.
 *
 * <p>All hard caps that keep responses bounded live here: bulk batch size, merge enumeration
 * limit, traversal depth/node/edge caps, and search page sizes.
 */
@Component
@ConfigurationProperties(prefix = "graph")
public class GraphProperties {

  private final Bulk bulk = new Bulk();
  private final Merge merge = new Merge();
  private final Traversal traversal = new Traversal();
  private final Search search = new Search();
  private final Relationships relationships = new Relationships();

  public Bulk getBulk() {
    return bulk;
  }

  public Merge getMerge() {
    return merge;
  }

  public Traversal getTraversal() {
    return traversal;
  }

  public Search getSearch() {
    return search;
  }

  public Relationships getRelationships() {
    return relationships;
  }

  /**
   * Bulk mutation limits.
   */
  public static class Bulk {
    /**
     * Maximum number of items per bulk request.
     */
    private int maxBatchSize = 100;

    public int getMaxBatchSize() {
      return maxBatchSize;
    }

    public void setMaxBatchSize(int maxBatchSize) {
      this.maxBatchSize = maxBatchSize;
    }
  }

  /**
   * Branch merge settings.
   */
  public static class Merge {
    /**
     * Whether branch merges are allowed.
     */
    private boolean enabled = true;

    /**
     * Hard limit on enumerated (and applied) items when the request gives none.
     */
    private int defaultLimit = 500;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getDefaultLimit() {
      return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
      this.defaultLimit = defaultLimit;
    }
  }

  /**
   * Traversal caps for expand and traverse.
   */
  public static class Traversal {
    private int expandDefaultMaxDepth = 2;
    private int expandMaxDepth = 8;
    private int expandDefaultMaxNodes = 400;
    private int expandMaxNodes = 5000;
    private int expandDefaultMaxEdges = 800;
    private int expandMaxEdges = 15000;
    private int traverseDefaultMaxNodes = 200;
    private int traverseDefaultMaxEdges = 400;
    private int traverseMaxEdges = 10000;
    private int maxRoots = 50;

    public int getExpandDefaultMaxDepth() {
      return expandDefaultMaxDepth;
    }

    public void setExpandDefaultMaxDepth(int expandDefaultMaxDepth) {
      this.expandDefaultMaxDepth = expandDefaultMaxDepth;
    }

    public int getExpandMaxDepth() {
      return expandMaxDepth;
    }

    public void setExpandMaxDepth(int expandMaxDepth) {
      this.expandMaxDepth = expandMaxDepth;
    }

    public int getExpandDefaultMaxNodes() {
      return expandDefaultMaxNodes;
    }

    public void setExpandDefaultMaxNodes(int expandDefaultMaxNodes) {
      this.expandDefaultMaxNodes = expandDefaultMaxNodes;
    }

    public int getExpandMaxNodes() {
      return expandMaxNodes;
    }

    public void setExpandMaxNodes(int expandMaxNodes) {
      this.expandMaxNodes = expandMaxNodes;
    }

    public int getExpandDefaultMaxEdges() {
      return expandDefaultMaxEdges;
    }

    public void setExpandDefaultMaxEdges(int expandDefaultMaxEdges) {
      this.expandDefaultMaxEdges = expandDefaultMaxEdges;
    }

    public int getExpandMaxEdges() {
      return expandMaxEdges;
    }

    public void setExpandMaxEdges(int expandMaxEdges) {
      this.expandMaxEdges = expandMaxEdges;
    }

    public int getTraverseDefaultMaxNodes() {
      return traverseDefaultMaxNodes;
    }

    public void setTraverseDefaultMaxNodes(int traverseDefaultMaxNodes) {
      this.traverseDefaultMaxNodes = traverseDefaultMaxNodes;
    }

    public int getTraverseDefaultMaxEdges() {
      return traverseDefaultMaxEdges;
    }

    public void setTraverseDefaultMaxEdges(int traverseDefaultMaxEdges) {
      this.traverseDefaultMaxEdges = traverseDefaultMaxEdges;
    }

    public int getTraverseMaxEdges() {
      return traverseMaxEdges;
    }

    public void setTraverseMaxEdges(int traverseMaxEdges) {
      this.traverseMaxEdges = traverseMaxEdges;
    }

    public int getMaxRoots() {
      return maxRoots;
    }

    public void setMaxRoots(int maxRoots) {
      this.maxRoots = maxRoots;
    }
  }

  /**
   * Search and analytics paging.
   */
  public static class Search {
    private int defaultLimit = 50;
    private int maxLimit = 200;

    public int getDefaultLimit() {
      return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
      this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
      return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
      this.maxLimit = maxLimit;
    }
  }

  /**
   * Relationship behaviors.
   */
  public static class Relationships {
    /**
     * Relationship type to inverse type; creating a relationship of a mapped type also
     * creates the inverse edge (dst to src).
     */
    private Map<String, String> inverseTypes = new HashMap<>();

    public Map<String, String> getInverseTypes() {
      return inverseTypes;
    }

    public void setInverseTypes(Map<String, String> inverseTypes) {
      this.inverseTypes = inverseTypes != null ? new HashMap<>(inverseTypes) : new HashMap<>();
    }
  }
}
