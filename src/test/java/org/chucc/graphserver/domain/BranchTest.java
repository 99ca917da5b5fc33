package org.chucc.graphserver.domain;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class BranchTest {

  private static final UUID BRANCH_ID = UUID.fromString("0190f1c2-0000-7000-8000-000000000001");
  private static final Instant CREATED = Instant.parse("2025-01-01T00:00:00Z");

  @Test
  void testValidNames() {
    assertDoesNotThrow(() -> Branch.validateName("feature-123"));
    assertDoesNotThrow(() -> Branch.validateName("dev.branch"));
    assertDoesNotThrow(() -> Branch.validateName("branch_name"));
    assertDoesNotThrow(() -> Branch.validateName("team/feature"));
  }

  @Test
  void testInvalidNames() {
    assertThrows(IllegalArgumentException.class, () -> Branch.validateName(null));
    assertThrows(IllegalArgumentException.class, () -> Branch.validateName("  "));
    assertThrows(IllegalArgumentException.class, () -> Branch.validateName("branch name"));
    assertThrows(IllegalArgumentException.class, () -> Branch.validateName("branch@name"));
    assertThrows(IllegalArgumentException.class, () -> Branch.validateName("_hidden"));
    assertThrows(IllegalArgumentException.class, () -> Branch.validateName(".hidden"));
    assertThrows(IllegalArgumentException.class, () -> Branch.validateName("a".repeat(129)));
  }

  @Test
  void testMainIsReserved() {
    assertThrows(IllegalArgumentException.class, () -> Branch.validateName("main"));
    assertThrows(IllegalArgumentException.class, () -> Branch.validateName("MAIN"));
  }

  @Test
  void testNonNfcNameRejected() {
    // "e" followed by a combining acute accent
    assertThrows(IllegalArgumentException.class, () -> Branch.validateName("café"));
  }

  @Test
  void testMainKeyMapping() {
    assertEquals(Branch.MAIN_KEY, Branch.key(null));
    assertEquals(BRANCH_ID, Branch.key(BRANCH_ID));
    assertNull(Branch.fromKey(Branch.MAIN_KEY));
    assertEquals(BRANCH_ID, Branch.fromKey(BRANCH_ID));
    assertTrue(Branch.isMain(null));
    assertTrue(Branch.isMain(Branch.MAIN_KEY));
    assertFalse(Branch.isMain(BRANCH_ID));
  }

  @Test
  void testParentMainKeyNormalizedToNull() {
    Branch branch = new Branch(BRANCH_ID, "feature", Branch.MAIN_KEY, CREATED);

    assertNull(branch.getParentBranchId());
  }

  @Test
  void testInvalidIdsRejected() {
    assertThrows(NullPointerException.class, () -> new Branch(null, "feature", null, CREATED));
    assertThrows(IllegalArgumentException.class,
        () -> new Branch(Branch.MAIN_KEY, "feature", null, CREATED));
    assertThrows(IllegalArgumentException.class,
        () -> new Branch(BRANCH_ID, "feature", BRANCH_ID, CREATED));
  }

  @Test
  void testWithNameKeepsIdentity() {
    Branch branch = new Branch(BRANCH_ID, "feature", null, CREATED);

    Branch renamed = branch.withName("renamed");

    assertEquals(BRANCH_ID, renamed.getId());
    assertEquals("renamed", renamed.getName());
    assertEquals(CREATED, renamed.getCreatedAt());
  }
}
