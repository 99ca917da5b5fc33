package org.chucc.graphserver.service;

import org.chucc.graphserver.domain.GraphObject;
import org.chucc.graphserver.domain.GraphRelationship;
import org.chucc.graphserver.dto.BulkItemResult;

/**
 * Outcome of one bulk item. Bulk processing never throws per item; each item ends in exactly
 * one of these variants.
 */
public sealed interface BulkItemOutcome
    permits BulkItemOutcome.Written, BulkItemOutcome.Conflict, BulkItemOutcome.Failed {

  /**
   * Converts the outcome to its wire form.
   *
   * @param index item position in the request
   * @return the wire result
   */
  BulkItemResult toResult(int index);

  /**
   * The item was written.
   *
   * @param status "created" or "updated"
   * @param object written object, for object items
   * @param relationship written relationship, for relationship items
   */
  record Written(String status, GraphObject object, GraphRelationship relationship)
      implements BulkItemOutcome {
    @Override
    public BulkItemResult toResult(int index) {
      return new BulkItemResult(index, true, status, object, relationship, null, null);
    }
  }

  /**
   * The item lost a uniqueness race; the caller resolves it by lookup.
   *
   * @param reason conflict reason, e.g. "key_exists"
   * @param message human-readable detail
   */
  record Conflict(String reason, String message) implements BulkItemOutcome {
    @Override
    public BulkItemResult toResult(int index) {
      return new BulkItemResult(index, false, "conflict", null, null, message, reason);
    }
  }

  /**
   * The item failed.
   *
   * @param code error code
   * @param message error message
   */
  record Failed(String code, String message) implements BulkItemOutcome {
    @Override
    public BulkItemResult toResult(int index) {
      return new BulkItemResult(index, false, "error", null, null, message, code);
    }
  }
}
