package dev.tvfiles.reconcile;

import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * What the store reports about an existing row: its durable id and, for file records, the
 * soft-delete timestamp. {@code removedAt} is always null for series and episodes.
 */
public record StoredEntity(UUID id, @Nullable Instant removedAt) {

  public static StoredEntity active(UUID id) {
    return new StoredEntity(id, null);
  }

  public boolean isRemoved() {
    return removedAt != null;
  }
}
