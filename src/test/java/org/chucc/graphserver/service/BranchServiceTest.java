package org.chucc.graphserver.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.chucc.graphserver.domain.Branch;
import org.chucc.graphserver.domain.GraphObject;
import org.chucc.graphserver.dto.CreateBranchRequest;
import org.chucc.graphserver.dto.UpdateBranchRequest;
import org.chucc.graphserver.exception.BranchAlreadyExistsException;
import org.chucc.graphserver.exception.BranchDeletionForbiddenException;
import org.chucc.graphserver.exception.BranchNotFoundException;
import org.chucc.graphserver.exception.ValidationException;
import org.chucc.graphserver.testutil.GraphFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for BranchService and branch lineage resolution.
 */
class BranchServiceTest {

  private GraphFixture graph;

  @BeforeEach
  void setUp() {
    graph = new GraphFixture();
  }

  @Test
  void create_branchesOffMainByDefault() {
    // When
    Branch branch = graph.createBranch("feature");

    // Then
    assertThat(branch.getParentBranchId()).isNull();
    assertThat(graph.branchService.get(branch.getId()).getName()).isEqualTo("feature");
    assertThat(graph.branchResolver.lineage(branch.getId()))
        .containsExactly(branch.getId(), Branch.MAIN_KEY);
  }

  @Test
  void create_nestedBranchHasFullLineage() {
    // Given
    Branch parent = graph.createBranch("parent");

    // When
    Branch child = graph.branchService.create(
        new CreateBranchRequest("child", parent.getId()));

    // Then
    assertThat(child.getParentBranchId()).isEqualTo(parent.getId());
    assertThat(graph.branchResolver.lineage(child.getId()))
        .containsExactly(child.getId(), parent.getId(), Branch.MAIN_KEY);
  }

  @Test
  void create_rejectsDuplicateNames() {
    graph.createBranch("feature");

    assertThatThrownBy(() -> graph.createBranch("feature"))
        .isInstanceOf(BranchAlreadyExistsException.class);
  }

  @Test
  void create_rejectsInvalidNamesAndUnknownParents() {
    assertThatThrownBy(() -> graph.createBranch("main"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> graph.createBranch(""))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> graph.branchService.create(
        new CreateBranchRequest("orphan", UUID.randomUUID())))
        .isInstanceOf(BranchNotFoundException.class);
  }

  @Test
  void list_returnsBranchesInCreationOrder() {
    Branch first = graph.createBranch("zeta");
    Branch second = graph.createBranch("alpha");

    List<Branch> branches = graph.branchService.list();

    assertThat(branches).extracting(Branch::getName).containsExactlyInAnyOrder("alpha", "zeta");
    assertThat(branches.get(0).getCreatedAt()).isBeforeOrEqualTo(branches.get(1).getCreatedAt());
    assertThat(branches).extracting(Branch::getId)
        .containsExactlyInAnyOrder(first.getId(), second.getId());
  }

  @Test
  void rename_keepsIdAndFreesOldName() {
    // Given
    Branch branch = graph.createBranch("old-name");
    graph.createBranch("taken");

    // When
    Branch renamed = graph.branchService.rename(branch.getId(),
        new UpdateBranchRequest("new-name"));

    // Then
    assertThat(renamed.getId()).isEqualTo(branch.getId());
    assertThat(graph.createBranch("old-name").getName()).isEqualTo("old-name");
    assertThatThrownBy(() -> graph.branchService.rename(branch.getId(),
        new UpdateBranchRequest("taken")))
        .isInstanceOf(BranchAlreadyExistsException.class);
  }

  @Test
  void delete_refusesBranchesWithChildren() {
    // Given
    Branch parent = graph.createBranch("parent");
    Branch child = graph.branchService.create(
        new CreateBranchRequest("child", parent.getId()));

    // When / Then
    assertThatThrownBy(() -> graph.branchService.delete(parent.getId()))
        .isInstanceOf(BranchDeletionForbiddenException.class);
    graph.branchService.delete(child.getId());
    graph.branchService.delete(parent.getId());
    assertThat(graph.branchService.list()).isEmpty();
    assertThatThrownBy(() -> graph.branchResolver.lineage(parent.getId()))
        .isInstanceOf(BranchNotFoundException.class);
  }

  @Test
  void branchWrites_shadowMainWithoutChangingIt() {
    // Given
    GraphObject doc = graph.createObject("Doc", "d", Map.of("v", 1));
    Branch branch = graph.createBranch("feature");

    // When
    graph.patchProperties(doc.canonicalId(), Map.of("v", 2), branch.getId());
    GraphObject later = graph.patchProperties(doc.canonicalId(), Map.of("w", 1), null);

    // Then
    GraphObject onBranch = graph.objectService.get(doc.canonicalId(),
        branch.getId().toString(), true);
    assertThat(onBranch.properties()).containsEntry("v", 2).doesNotContainKey("w");
    assertThat(graph.objectService.get(doc.canonicalId(), "main", true).id())
        .isEqualTo(later.id());
  }
}
