package org.chucc.graphserver.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.chucc.graphserver.domain.Branch;
import org.chucc.graphserver.domain.GraphObject;
import org.chucc.graphserver.exception.KeyConflictException;
import org.chucc.graphserver.exception.VersionConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the object key index.
 */
class ObjectRepositoryTest {

  private static final List<UUID> MAIN = List.of(Branch.MAIN_KEY);

  private ObjectRepository repository;

  @BeforeEach
  void setUp() {
    repository = new ObjectRepository();
  }

  private GraphObject firstVersion(UUID canonicalId) {
    return repository.append(canonicalId, MAIN, WriteCondition.noHead(), prior ->
        GraphObject.template(canonicalId, null, "Doc", "d1", null, Map.of(), List.of()));
  }

  @Test
  void appendWithKey_publishesKeyWithStoredHead() {
    // Given
    UUID canonicalId = UUID.randomUUID();

    // When
    GraphObject stored = repository.appendWithKey("Doc", "d1", Branch.MAIN_KEY, canonicalId,
        () -> firstVersion(canonicalId));

    // Then
    assertThat(repository.findCanonicalIdByKey("Doc", "d1", Branch.MAIN_KEY))
        .contains(canonicalId);
    assertThat(repository.resolveHead(canonicalId, MAIN)).contains(stored);
  }

  @Test
  void appendWithKey_failedWrite_leavesKeyFree() {
    // Given
    UUID moved = UUID.randomUUID();
    firstVersion(moved);

    // When
    assertThatThrownBy(() -> repository.appendWithKey("Doc", "d1", Branch.MAIN_KEY, moved,
        () -> firstVersion(moved)))
        .isInstanceOf(VersionConflictException.class);

    // Then
    assertThat(repository.findCanonicalIdByKey("Doc", "d1", Branch.MAIN_KEY)).isEmpty();
    UUID next = UUID.randomUUID();
    repository.appendWithKey("Doc", "d1", Branch.MAIN_KEY, next, () -> firstVersion(next));
    assertThat(repository.findCanonicalIdByKey("Doc", "d1", Branch.MAIN_KEY)).contains(next);
  }

  @Test
  void appendWithKey_heldByAnother_throwsWithoutWriting() {
    // Given
    UUID holder = UUID.randomUUID();
    repository.appendWithKey("Doc", "d1", Branch.MAIN_KEY, holder, () -> firstVersion(holder));
    UUID challenger = UUID.randomUUID();
    AtomicBoolean written = new AtomicBoolean();

    // When / Then
    assertThatThrownBy(() -> repository.appendWithKey("Doc", "d1", Branch.MAIN_KEY, challenger,
        () -> {
          written.set(true);
          return firstVersion(challenger);
        }))
        .isInstanceOf(KeyConflictException.class)
        .satisfies(e -> assertThat(((KeyConflictException) e).getExistingCanonicalId())
            .isEqualTo(holder));
    assertThat(written).isFalse();
    assertThat(repository.resolveHead(challenger, MAIN)).isEmpty();
  }
}
