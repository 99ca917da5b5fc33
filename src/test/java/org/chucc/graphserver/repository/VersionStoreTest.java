package org.chucc.graphserver.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.chucc.graphserver.domain.Branch;
import org.chucc.graphserver.domain.GraphObject;
import org.chucc.graphserver.exception.VersionConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the append-only version store and its head index.
 */
class VersionStoreTest {

  private static final List<UUID> MAIN = List.of(Branch.MAIN_KEY);

  private ObjectRepository store;
  private UUID canonicalId;

  @BeforeEach
  void setUp() {
    store = new ObjectRepository();
    canonicalId = UUID.randomUUID();
  }

  private GraphObject append(List<UUID> lineage, WriteCondition condition, int n) {
    return store.append(canonicalId, lineage, condition, prior ->
        GraphObject.template(canonicalId, null, "Person", null, null, Map.of("n", n), List.of()));
  }

  @Test
  void append_assignsLineageFields() {
    // When
    GraphObject first = append(MAIN, WriteCondition.noHead(), 1);
    GraphObject second = append(MAIN, WriteCondition.headIs(first.id()), 2);

    // Then
    assertThat(first.version()).isEqualTo(1);
    assertThat(first.supersedesId()).isNull();
    assertThat(first.createdAt()).isNotNull();
    assertThat(second.version()).isEqualTo(2);
    assertThat(second.supersedesId()).isEqualTo(first.id());
    assertThat(second.id()).isNotEqualTo(first.id());
    assertThat(store.resolveHead(canonicalId, MAIN)).contains(second);
    assertThat(store.history(canonicalId, MAIN)).containsExactly(first, second);
  }

  @Test
  void append_withStaleExpectedHead_throwsVersionConflict() {
    // Given
    GraphObject first = append(MAIN, WriteCondition.noHead(), 1);
    GraphObject second = append(MAIN, WriteCondition.any(), 2);

    // When / Then
    assertThatThrownBy(() -> append(MAIN, WriteCondition.headIs(first.id()), 3))
        .isInstanceOf(VersionConflictException.class)
        .satisfies(e -> {
          VersionConflictException conflict = (VersionConflictException) e;
          assertThat(conflict.getExpected()).isEqualTo(first.id());
          assertThat(conflict.getActual()).isEqualTo(second.id());
          assertThat(conflict.getCode()).isEqualTo("version_conflict");
        });
    assertThat(store.versionCount()).isEqualTo(2);
  }

  @Test
  void append_mutationReturningNull_isNoOp() {
    // Given
    GraphObject first = append(MAIN, WriteCondition.noHead(), 1);

    // When
    GraphObject result = store.append(canonicalId, MAIN, WriteCondition.any(), prior -> null);

    // Then
    assertThat(result).isEqualTo(first);
    assertThat(store.allVersions(canonicalId)).hasSize(1);
  }

  @Test
  void branchWrite_shadowsInheritedHeadWithoutTouchingParent() {
    // Given
    UUID branchKey = UUID.randomUUID();
    List<UUID> branchLineage = List.of(branchKey, Branch.MAIN_KEY);
    GraphObject onMain = append(MAIN, WriteCondition.noHead(), 1);

    // When: inherited before the branch writes
    assertThat(store.resolveHead(canonicalId, branchLineage)).contains(onMain);
    GraphObject onBranch = append(branchLineage, WriteCondition.headIs(onMain.id()), 2);

    // Then
    assertThat(onBranch.branchId()).isEqualTo(branchKey);
    assertThat(onBranch.supersedesId()).isEqualTo(onMain.id());
    assertThat(store.resolveHead(canonicalId, branchLineage)).contains(onBranch);
    assertThat(store.resolveHead(canonicalId, MAIN)).contains(onMain);
    assertThat(store.canonicalIdsOn(branchKey)).containsExactly(canonicalId);
    assertThat(store.history(canonicalId, branchLineage)).containsExactly(onMain, onBranch);
  }

  @Test
  void concurrentAppends_produceOneLinearChainAndSingleHead() throws Exception {
    // Given
    int writers = 16;
    append(MAIN, WriteCondition.noHead(), 0);
    ExecutorService executor = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<GraphObject>> futures = new ArrayList<>();

    // When
    try {
      for (int i = 1; i <= writers; i++) {
        int n = i;
        futures.add(executor.submit(() -> {
          start.await();
          return append(MAIN, WriteCondition.any(), n);
        }));
      }
      start.countDown();
      for (Future<GraphObject> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    // Then
    List<GraphObject> history = store.history(canonicalId, MAIN);
    assertThat(history).hasSize(writers + 1);
    Set<Integer> versions = new HashSet<>();
    for (int i = 0; i < history.size(); i++) {
      versions.add(history.get(i).version());
      if (i > 0) {
        assertThat(history.get(i).supersedesId()).isEqualTo(history.get(i - 1).id());
      }
    }
    assertThat(versions).hasSize(writers + 1);
    assertThat(store.resolveHead(canonicalId, MAIN).orElseThrow().version())
        .isEqualTo(writers + 1);
    assertThat(store.headIndexSnapshot()).hasSize(1);
  }

  @Test
  void rebuildHeadIndex_recoversSameHeads() {
    // Given
    UUID branchKey = UUID.randomUUID();
    GraphObject first = append(MAIN, WriteCondition.noHead(), 1);
    append(MAIN, WriteCondition.headIs(first.id()), 2);
    append(List.of(branchKey, Branch.MAIN_KEY), WriteCondition.any(), 3);
    Map<?, UUID> before = store.headIndexSnapshot();

    // When
    store.rebuildHeadIndex();

    // Then
    assertThat(store.headIndexSnapshot()).isEqualTo(before);
    assertThat(store.canonicalIdsOn(branchKey)).containsExactly(canonicalId);
  }
}
