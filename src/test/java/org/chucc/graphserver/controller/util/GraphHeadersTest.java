package org.chucc.graphserver.controller.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class GraphHeadersTest {

  private static final UUID VERSION_ID =
      UUID.fromString("0190f1c2-0000-7000-8000-000000000042");

  @Test
  void testEtagIsQuotedVersionId() {
    assertEquals("\"" + VERSION_ID + "\"", GraphHeaders.etag(VERSION_ID).getETag());
  }

  @Test
  void testParseIfMatchAcceptsQuotedWeakAndBareValues() {
    assertEquals(VERSION_ID, GraphHeaders.parseIfMatch("\"" + VERSION_ID + "\""));
    assertEquals(VERSION_ID, GraphHeaders.parseIfMatch("W/\"" + VERSION_ID + "\""));
    assertEquals(VERSION_ID, GraphHeaders.parseIfMatch(" " + VERSION_ID + " "));
  }

  @Test
  void testParseIfMatchWithoutPrecondition() {
    assertNull(GraphHeaders.parseIfMatch(null));
    assertNull(GraphHeaders.parseIfMatch(""));
    assertNull(GraphHeaders.parseIfMatch("*"));
  }

  @Test
  void testParseIfMatchRejectsGarbage() {
    assertThrows(IllegalArgumentException.class, () -> GraphHeaders.parseIfMatch("\"abc\""));
  }
}
