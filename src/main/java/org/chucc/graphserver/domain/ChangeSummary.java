package org.chucc.graphserver.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Property-level diff between a version and the version it supersedes.
 *
 * @param added property paths that did not exist before
 * @param removed property paths that no longer exist
 * @param updated property paths whose value changed
 * @param paths all changed paths, sorted
 * @param meta changes to non-property fields (status, labels, deleted)
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ChangeSummary(
    List<String> added,
    List<String> removed,
    List<String> updated,
    List<String> paths,
    Map<String, Object> meta
) {

  /**
   * Compact constructor making all collections immutable.
   */
  public ChangeSummary {
    added = added == null ? List.of() : List.copyOf(added);
    removed = removed == null ? List.of() : List.copyOf(removed);
    updated = updated == null ? List.of() : List.copyOf(updated);
    paths = paths == null ? List.of() : List.copyOf(paths);
    meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
  }

  public boolean isEmpty() {
    return paths.isEmpty() && meta.isEmpty();
  }
}
