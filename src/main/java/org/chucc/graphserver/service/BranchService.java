package org.chucc.graphserver.service;

import com.github.f4b6a3.uuid.UuidCreator;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.chucc.graphserver.domain.Branch;
import org.chucc.graphserver.dto.CreateBranchRequest;
import org.chucc.graphserver.dto.UpdateBranchRequest;
import org.chucc.graphserver.exception.BranchAlreadyExistsException;
import org.chucc.graphserver.exception.BranchDeletionForbiddenException;
import org.chucc.graphserver.exception.BranchNotFoundException;
import org.chucc.graphserver.exception.ValidationException;
import org.chucc.graphserver.repository.BranchRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Service for branch lifecycle operations.
 * Versions written on a branch are never removed; deleting a branch only removes its name.
 */
@Service
public class BranchService {

  private static final Logger logger = LoggerFactory.getLogger(BranchService.class);

  private final BranchRepository branchRepository;
  private final BranchResolver branchResolver;

  /**
   * Constructs the service.
   *
   * @param branchRepository the branch repository
   * @param branchResolver the resolver whose lineage cache is invalidated on change
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Repositories are Spring-managed beans and are intentionally shared")
  public BranchService(BranchRepository branchRepository, BranchResolver branchResolver) {
    this.branchRepository = branchRepository;
    this.branchResolver = branchResolver;
  }

  /**
   * Creates a branch off main or off another branch.
   *
   * @param request the create request
   * @return the created branch
   * @throws BranchAlreadyExistsException if the name is taken
   * @throws BranchNotFoundException if the parent does not exist
   */
  public Branch create(CreateBranchRequest request) {
    request.validate();
    UUID parentId = Branch.fromKey(request.parentBranchId());
    branchResolver.requireBranch(parentId);

    Branch branch = newBranch(request.name(), parentId);
    if (!branchRepository.saveIfNameAvailable(branch)) {
      throw new BranchAlreadyExistsException(request.name());
    }
    branchResolver.invalidate();
    logger.info("Created branch '{}' ({}) from {}", branch.getName(), branch.getId(),
        parentId == null ? Branch.MAIN : parentId);
    return branch;
  }

  /**
   * Lists all branches.
   *
   * @return branches in creation order
   */
  public List<Branch> list() {
    return branchRepository.findAll();
  }

  /**
   * Gets a branch by id.
   *
   * @param id the branch id
   * @return the branch
   * @throws BranchNotFoundException if it does not exist
   */
  public Branch get(UUID id) {
    return branchRepository.findById(id).orElseThrow(() -> new BranchNotFoundException(id));
  }

  /**
   * Renames a branch.
   *
   * @param id the branch id
   * @param request the rename request
   * @return the renamed branch
   */
  public Branch rename(UUID id, UpdateBranchRequest request) {
    request.validate();
    Branch branch = get(id);
    try {
      Branch.validateName(request.name());
    } catch (IllegalArgumentException e) {
      throw new ValidationException(e.getMessage(), e);
    }
    Branch renamed = branchRepository.rename(branch, request.name())
        .orElseThrow(() -> new BranchAlreadyExistsException(request.name()));
    logger.info("Renamed branch {} from '{}' to '{}'", id, branch.getName(), renamed.getName());
    return renamed;
  }

  /**
   * Deletes a branch that has no child branches.
   *
   * @param id the branch id
   * @throws BranchNotFoundException if it does not exist
   * @throws BranchDeletionForbiddenException if child branches exist
   */
  public void delete(UUID id) {
    Branch branch = get(id);
    if (!branchRepository.findChildren(id).isEmpty()) {
      throw new BranchDeletionForbiddenException(branch.getName());
    }
    if (!branchRepository.delete(id)) {
      throw new BranchNotFoundException(id);
    }
    branchResolver.invalidate();
    logger.info("Deleted branch '{}' ({})", branch.getName(), id);
  }

  private static Branch newBranch(String name, UUID parentId) {
    try {
      return new Branch(UuidCreator.getTimeOrderedEpoch(), name, parentId, Instant.now());
    } catch (IllegalArgumentException e) {
      throw new ValidationException(e.getMessage(), e);
    }
  }
}
