package org.chucc.graphserver.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.chucc.graphserver.domain.ChangeSummary;
import org.chucc.graphserver.domain.GraphObject;
import org.chucc.graphserver.domain.GraphRelationship;

/**
 * Builds {@link ChangeSummary} values for new object and relationship versions.
 */
public final class ChangeSummaries {

  private ChangeSummaries() {
    // Utility class
  }

  /**
   * Summarizes an object version against the version it supersedes.
   *
   * @param before prior version, or null for a first version
   * @param after new version content
   * @return the summary
   */
  public static ChangeSummary forObject(GraphObject before, GraphObject after) {
    Map<String, Object> meta = new LinkedHashMap<>();
    if (before != null && !Objects.equals(before.status(), after.status())) {
      meta.put("status", fromTo(before.status(), after.status()));
    }
    if (before != null) {
      List<String> addedLabels = new ArrayList<>(after.labels());
      addedLabels.removeAll(before.labels());
      List<String> removedLabels = new ArrayList<>(before.labels());
      removedLabels.removeAll(after.labels());
      if (!addedLabels.isEmpty()) {
        meta.put("labels_added", addedLabels);
      }
      if (!removedLabels.isEmpty()) {
        meta.put("labels_removed", removedLabels);
      }
    }
    putLifecycle(meta, before == null ? null : before.deletedAt() != null,
        after.deletedAt() != null);
    return PropertyDiff.summarize(before == null ? null : before.properties(),
        after.properties(), meta);
  }

  /**
   * Summarizes a relationship version against the version it supersedes.
   *
   * @param before prior version, or null for a first version
   * @param after new version content
   * @return the summary
   */
  public static ChangeSummary forRelationship(GraphRelationship before, GraphRelationship after) {
    Map<String, Object> meta = new LinkedHashMap<>();
    if (before != null && !Objects.equals(before.weight(), after.weight())) {
      meta.put("weight", fromTo(before.weight(), after.weight()));
    }
    putLifecycle(meta, before == null ? null : before.deletedAt() != null,
        after.deletedAt() != null);
    return PropertyDiff.summarize(before == null ? null : before.properties(),
        after.properties(), meta);
  }

  private static void putLifecycle(Map<String, Object> meta, Boolean wasDeleted,
      boolean isDeleted) {
    if (wasDeleted == null) {
      meta.put("created", true);
    } else if (!wasDeleted && isDeleted) {
      meta.put("deleted", true);
    } else if (wasDeleted && !isDeleted) {
      meta.put("restored", true);
    }
  }

  private static Map<String, Object> fromTo(Object from, Object to) {
    Map<String, Object> change = new LinkedHashMap<>();
    change.put("from", from);
    change.put("to", to);
    return change;
  }
}
