package dev.tvfiles.reconcile;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ensures a row exists for a natural key and returns its durable id.
 *
 * <p>Rules:
 *
 * <ul>
 *   <li>An existing row is returned unchanged; attributes are never overwritten (first write
 *       wins).
 *   <li>A missing row is inserted with the given attributes and parent ids.
 *   <li>An existing file row with {@code removed_at} set is restored through {@link
 *       LifecycleStore#clearRemoved}.
 *   <li>When the key model says the kind needs a series and the lineage has none, nothing is
 *       written and {@link Resolution.Outcome#UNRESOLVED_PARENT} is returned.
 * </ul>
 */
public class UpsertResolver {

  private static final Logger log = LoggerFactory.getLogger(UpsertResolver.class);

  private final LifecycleStore store;
  private final EntityKeyModel keyModel;

  public UpsertResolver(LifecycleStore store, EntityKeyModel keyModel) {
    this.store = store;
    this.keyModel = keyModel;
  }

  /**
   * Resolve one entity.
   *
   * @param kind the entity level
   * @param key its natural key
   * @param attributes attributes used only if the row has to be inserted
   * @param lineage ids of the parents resolved before this entity
   * @param observedAt pass timestamp, stamped as {@code added_at} on new file rows
   * @return the resolution; never null
   */
  public Resolution resolve(
      EntityKind kind, NaturalKey key, Attributes attributes, Lineage lineage, Instant observedAt) {
    if (keyModel.requiresSeries(kind) && lineage.seriesId() == null) {
      log.debug("Unresolved parent for {} {}", kind, key);
      return Resolution.unresolvedParent();
    }

    Optional<StoredEntity> existing = store.findByKey(kind, key);
    if (existing.isPresent()) {
      StoredEntity entity = existing.get();
      if (kind == EntityKind.FILE && entity.isRemoved()) {
        store.clearRemoved(entity.id());
        log.debug("Restored {} (removed at {})", key, entity.removedAt());
        return Resolution.of(entity.id(), Resolution.Outcome.RESTORED);
      }
      return Resolution.of(entity.id(), Resolution.Outcome.EXISTING);
    }

    UUID id = store.insert(kind, key, attributes, lineage, observedAt);
    log.debug("Inserted {} {}", kind, key);
    return Resolution.of(id, Resolution.Outcome.INSERTED);
  }
}
