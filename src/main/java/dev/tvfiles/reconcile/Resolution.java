package dev.tvfiles.reconcile;

import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Result of {@link UpsertResolver#resolve}.
 *
 * @param id durable id of the row, null only when {@code outcome} is {@link
 *     Outcome#UNRESOLVED_PARENT}
 * @param outcome what the resolver did
 */
public record Resolution(@Nullable UUID id, Outcome outcome) {

  public enum Outcome {
    /** A new row was inserted. */
    INSERTED,
    /** The row already existed and was left as is. */
    EXISTING,
    /** The file row existed with {@code removed_at} set and was cleared. */
    RESTORED,
    /** A required parent id was missing; nothing was written. */
    UNRESOLVED_PARENT
  }

  static Resolution of(UUID id, Outcome outcome) {
    return new Resolution(id, outcome);
  }

  static Resolution unresolvedParent() {
    return new Resolution(null, Outcome.UNRESOLVED_PARENT);
  }

  public boolean isResolved() {
    return outcome != Outcome.UNRESOLVED_PARENT;
  }

  /**
   * The durable id of a resolved row.
   *
   * @throws IllegalStateException if the parent was unresolved
   */
  public UUID requireId() {
    if (id == null) {
      throw new IllegalStateException("Resolution has no id: " + outcome);
    }
    return id;
  }
}
