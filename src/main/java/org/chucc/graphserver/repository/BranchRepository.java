package org.chucc.graphserver.repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.chucc.graphserver.domain.Branch;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for managing branches.
 * Thread-safe implementation using ConcurrentHashMap; names are unique across branches.
 */
@Repository
public class BranchRepository {

  private final Map<UUID, Branch> branchesById = new ConcurrentHashMap<>();
  private final Map<String, UUID> idsByName = new ConcurrentHashMap<>();

  /**
   * Finds a branch by id.
   *
   * @param id the branch id
   * @return an Optional containing the branch if found, empty otherwise
   */
  public Optional<Branch> findById(UUID id) {
    return id == null ? Optional.empty() : Optional.ofNullable(branchesById.get(id));
  }

  /**
   * Finds a branch by name.
   *
   * @param name the branch name
   * @return an Optional containing the branch if found, empty otherwise
   */
  public Optional<Branch> findByName(String name) {
    return Optional.ofNullable(idsByName.get(name)).map(branchesById::get);
  }

  /**
   * Finds all branches, oldest first.
   *
   * @return a list of all branches
   */
  public List<Branch> findAll() {
    return branchesById.values().stream()
        .sorted(Comparator.comparing(Branch::getCreatedAt).thenComparing(Branch::getId))
        .toList();
  }

  /**
   * Finds the branches directly based on the given branch.
   *
   * @param parentId parent branch id, null for main
   * @return child branches
   */
  public List<Branch> findChildren(UUID parentId) {
    return branchesById.values().stream()
        .filter(b -> parentId == null
            ? b.getParentBranchId() == null
            : parentId.equals(b.getParentBranchId()))
        .toList();
  }

  /**
   * Saves a new branch if its name is free.
   *
   * @param branch the branch to save
   * @return true if saved, false if the name is taken
   */
  public boolean saveIfNameAvailable(Branch branch) {
    if (idsByName.putIfAbsent(branch.getName(), branch.getId()) != null) {
      return false;
    }
    branchesById.put(branch.getId(), branch);
    return true;
  }

  /**
   * Renames a branch if the new name is free.
   *
   * @param branch the branch
   * @param newName the new name
   * @return the renamed branch, or empty if the new name is taken
   */
  public Optional<Branch> rename(Branch branch, String newName) {
    if (branch.getName().equals(newName)) {
      return Optional.of(branch);
    }
    Branch renamed = branch.withName(newName);
    if (idsByName.putIfAbsent(newName, branch.getId()) != null) {
      return Optional.empty();
    }
    branchesById.put(branch.getId(), renamed);
    idsByName.remove(branch.getName(), branch.getId());
    return Optional.of(renamed);
  }

  /**
   * Deletes a branch.
   *
   * @param id the branch id
   * @return true if the branch was deleted, false if it didn't exist
   */
  public boolean delete(UUID id) {
    Branch removed = branchesById.remove(id);
    if (removed == null) {
      return false;
    }
    idsByName.remove(removed.getName(), id);
    return true;
  }

  public int count() {
    return branchesById.size();
  }
}
