package org.chucc.graphserver.repository;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.chucc.graphserver.domain.GraphObject;
import org.chucc.graphserver.exception.KeyConflictException;
import org.springframework.stereotype.Repository;

/**
 * Version store for graph objects plus the business key index.
 *
 * <p>The key index maps (type, branch, key) to the canonical id holding the key on that branch.
 * A key is claimed under a per-(type, branch, key) lock that is held across the first append,
 * and the index entry is published only once that version is stored. Of N concurrent creates
 * with the same key exactly one wins, and a reader that finds a holder always finds its head.
 * Keys stay claimed when the holding object is deleted.
 */
@Repository
public class ObjectRepository extends VersionStore<GraphObject> {

  private final Map<ObjectKey, UUID> keyIndex = new ConcurrentHashMap<>();
  private final Map<ObjectKey, ReentrantLock> keyLocks = new ConcurrentHashMap<>();

  /**
   * Creates an empty object repository.
   */
  public ObjectRepository() {
    super("object");
  }

  /**
   * Finds the canonical id holding a key on exactly this branch.
   *
   * @param type object type
   * @param key business key
   * @param branchKey branch index key
   * @return the holder if any
   */
  public Optional<UUID> findCanonicalIdByKey(String type, String key, UUID branchKey) {
    return Optional.ofNullable(keyIndex.get(new ObjectKey(type, branchKey, key)));
  }

  /**
   * Claims a key for a canonical id and writes its first version on the branch.
   *
   * <p>The write runs under the key's lock. The key is published only if the write returns
   * normally, so a failed write leaves the key free.
   *
   * @param type object type
   * @param key business key
   * @param branchKey branch index key
   * @param canonicalId canonical id claiming the key
   * @param write appends the version for {@code canonicalId}
   * @return the stored version
   * @throws KeyConflictException if another canonical id holds the key on the branch
   */
  public GraphObject appendWithKey(String type, String key, UUID branchKey, UUID canonicalId,
      Supplier<GraphObject> write) {
    ObjectKey objectKey = new ObjectKey(type, branchKey, key);
    ReentrantLock lock = keyLocks.computeIfAbsent(objectKey, k -> new ReentrantLock());
    lock.lock();
    try {
      UUID holder = keyIndex.get(objectKey);
      if (holder != null && !holder.equals(canonicalId)) {
        throw new KeyConflictException(type, key, holder);
      }
      GraphObject stored = write.get();
      keyIndex.put(objectKey, canonicalId);
      return stored;
    } finally {
      lock.unlock();
    }
  }

  public int keyCount() {
    return keyIndex.size();
  }

  private record ObjectKey(String type, UUID branchKey, String key) {
  }
}
