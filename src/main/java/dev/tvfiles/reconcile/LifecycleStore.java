package dev.tvfiles.reconcile;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence operations the reconciler needs for one source.
 *
 * <p>All calls of one pass are expected to run inside the same transactional scope; the
 * implementation does not commit on its own.
 */
public interface LifecycleStore {

  /** Look up a row by natural key. */
  Optional<StoredEntity> findByKey(EntityKind kind, NaturalKey key);

  /**
   * Insert a new row. File rows are stamped with {@code added_at = observedAt} and an empty
   * {@code removed_at}.
   *
   * @return the durable id of the new row
   * @throws org.springframework.dao.DuplicateKeyException in JPA-backed stores, or an equivalent
   *     runtime exception, if a row with {@code key} already exists
   */
  UUID insert(EntityKind kind, NaturalKey key, Attributes attributes, Lineage lineage, Instant observedAt);

  /** Keys and ids of every file row whose {@code removed_at} is null, read in one scan. */
  Map<NaturalKey, UUID> listActiveLeafKeys();

  /** Set {@code removed_at} on an active file row. */
  void markRemoved(UUID leafId, Instant removedAt);

  /** Clear {@code removed_at} on a removed file row. */
  void clearRemoved(UUID leafId);
}
