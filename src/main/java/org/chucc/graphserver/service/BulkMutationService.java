package org.chucc.graphserver.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;
import org.chucc.graphserver.config.GraphProperties;
import org.chucc.graphserver.dto.BulkCreateObjectsRequest;
import org.chucc.graphserver.dto.BulkCreateRelationshipsRequest;
import org.chucc.graphserver.dto.BulkItemResult;
import org.chucc.graphserver.dto.BulkResponse;
import org.chucc.graphserver.dto.BulkUpdateStatusRequest;
import org.chucc.graphserver.dto.CreateObjectRequest;
import org.chucc.graphserver.dto.CreateRelationshipRequest;
import org.chucc.graphserver.dto.PatchObjectRequest;
import org.chucc.graphserver.exception.GraphException;
import org.chucc.graphserver.exception.KeyConflictException;
import org.chucc.graphserver.exception.LimitExceededException;
import org.chucc.graphserver.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Bulk write path.
 *
 * <p>Items fan out on the bounded {@code bulkExecutor} pool and are processed independently:
 * one item's failure never affects its siblings, and nothing is rolled back. Key races surface
 * as {@code conflict/key_exists} results, which callers resolve by looking the key up.
 *
 * <p>If the request thread is interrupted while waiting, items that have not started are
 * reported as {@code error/cancelled}; items already running finish and are reported with
 * their real outcome, so every committed version is accounted for.
 */
@Service
public class BulkMutationService {

  private static final Logger logger = LoggerFactory.getLogger(BulkMutationService.class);

  private static final int NEW = 0;
  private static final int RUNNING = 1;
  private static final int CANCELLED = 2;

  private final ObjectService objectService;
  private final RelationshipService relationshipService;
  private final ThreadPoolTaskExecutor bulkExecutor;
  private final GraphProperties properties;

  /**
   * Constructs the service.
   *
   * @param objectService single-object writes
   * @param relationshipService single-relationship writes
   * @param bulkExecutor worker pool
   * @param properties bulk limits
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "All dependencies are Spring-managed beans and are intentionally shared")
  public BulkMutationService(ObjectService objectService,
      RelationshipService relationshipService,
      @Qualifier("bulkExecutor") ThreadPoolTaskExecutor bulkExecutor,
      GraphProperties properties) {
    this.objectService = objectService;
    this.relationshipService = relationshipService;
    this.bulkExecutor = bulkExecutor;
    this.properties = properties;
  }

  /**
   * Creates many objects independently.
   *
   * @param request the items
   * @return per-item results
   */
  @Timed(value = "graph.bulk.objects", description = "Bulk object create duration")
  public BulkResponse createObjects(BulkCreateObjectsRequest request) {
    checkBatch(request.items().size());
    BulkResponse response = fanOut(request.items(), this::createObject);
    logger.info("Bulk object create: {} succeeded, {} failed", response.success(),
        response.failed());
    return response;
  }

  /**
   * Creates (upserts) many relationships independently.
   *
   * @param request the items
   * @return per-item results
   */
  @Timed(value = "graph.bulk.relationships", description = "Bulk relationship create duration")
  public BulkResponse createRelationships(BulkCreateRelationshipsRequest request) {
    checkBatch(request.items().size());
    BulkResponse response = fanOut(request.items(), this::createRelationship);
    logger.info("Bulk relationship create: {} succeeded, {} failed", response.success(),
        response.failed());
    return response;
  }

  /**
   * Sets the status of many objects independently.
   *
   * @param request ids and status
   * @return per-item results
   */
  @Timed(value = "graph.bulk.status", description = "Bulk status update duration")
  public BulkResponse updateStatus(BulkUpdateStatusRequest request) {
    request.validate();
    checkBatch(request.ids().size());
    String branchRef = request.branchId() == null ? null : request.branchId().toString();
    PatchObjectRequest patch = new PatchObjectRequest(null, null, null, request.status());
    BulkResponse response = fanOut(request.ids(), id -> guarded(() ->
        new BulkItemOutcome.Written("updated",
            objectService.patch(id, branchRef, patch, null), null)));
    logger.info("Bulk status update to '{}': {} succeeded, {} failed", request.status(),
        response.success(), response.failed());
    return response;
  }

  private BulkItemOutcome createObject(CreateObjectRequest item) {
    if (item == null) {
      return new BulkItemOutcome.Failed("validation_error", "item cannot be null");
    }
    return guarded(() -> new BulkItemOutcome.Written("created", objectService.create(item),
        null));
  }

  private BulkItemOutcome createRelationship(CreateRelationshipRequest item) {
    if (item == null) {
      return new BulkItemOutcome.Failed("validation_error", "item cannot be null");
    }
    return guarded(() -> new BulkItemOutcome.Written("created", null,
        relationshipService.create(item).relationship()));
  }

  private BulkItemOutcome guarded(Supplier<BulkItemOutcome> work) {
    try {
      return work.get();
    } catch (KeyConflictException e) {
      logger.debug("Bulk item key conflict: {}", e.getMessage());
      return new BulkItemOutcome.Conflict("key_exists", e.getMessage());
    } catch (GraphException e) {
      logger.debug("Bulk item failed with {}: {}", e.getCode(), e.getMessage());
      return new BulkItemOutcome.Failed(e.getCode(), e.getMessage());
    } catch (IllegalArgumentException e) {
      return new BulkItemOutcome.Failed("invalid_argument", e.getMessage());
    } catch (RuntimeException e) {
      logger.error("Bulk item failed unexpectedly", e);
      return new BulkItemOutcome.Failed("internal_error", e.getMessage());
    }
  }

  private void checkBatch(int size) {
    if (size == 0) {
      throw new ValidationException("items cannot be empty");
    }
    int max = properties.getBulk().getMaxBatchSize();
    if (size > max) {
      throw new LimitExceededException("Bulk batch size", size, max);
    }
  }

  private <I> BulkResponse fanOut(List<I> items, Function<I, BulkItemOutcome> work) {
    List<AtomicInteger> states = new ArrayList<>(items.size());
    List<CompletableFuture<BulkItemOutcome>> futures = new ArrayList<>(items.size());
    for (I item : items) {
      AtomicInteger state = new AtomicInteger(NEW);
      states.add(state);
      futures.add(submit(() -> state.compareAndSet(NEW, RUNNING)
          ? work.apply(item)
          : cancelled()));
    }

    List<BulkItemResult> results = new ArrayList<>(items.size());
    boolean interrupted = false;
    for (int i = 0; i < futures.size(); i++) {
      BulkItemOutcome outcome;
      if (interrupted && states.get(i).compareAndSet(NEW, CANCELLED)) {
        outcome = cancelled();
      } else if (interrupted) {
        outcome = futures.get(i).join();
      } else {
        try {
          outcome = futures.get(i).get();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          interrupted = true;
          logger.warn("Bulk request interrupted; cancelling items not yet started");
          outcome = states.get(i).compareAndSet(NEW, CANCELLED)
              ? cancelled()
              : futures.get(i).join();
        } catch (ExecutionException e) {
          logger.error("Bulk item {} failed unexpectedly", i, e.getCause());
          outcome = new BulkItemOutcome.Failed("internal_error",
              e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
      }
      results.add(outcome.toResult(i));
    }
    return BulkResponse.of(results);
  }

  private CompletableFuture<BulkItemOutcome> submit(
      Supplier<BulkItemOutcome> task) {
    try {
      return CompletableFuture.supplyAsync(task, bulkExecutor);
    } catch (RejectedExecutionException e) {
      logger.warn("Bulk executor saturated: {}", e.getMessage());
      return CompletableFuture.completedFuture(
          new BulkItemOutcome.Failed("overloaded", "Bulk worker pool is saturated"));
    }
  }

  private static BulkItemOutcome cancelled() {
    return new BulkItemOutcome.Failed("cancelled", "Cancelled before processing");
  }
}
