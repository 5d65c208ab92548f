package dev.tvfiles.reconcile;

import java.util.Set;

/**
 * Source-specific rules for deriving natural keys and insert attributes from an observation.
 *
 * <p>Implementations must be pure: deterministic, no I/O, no side effects. File paths are
 * canonicalized with {@link PathCanonicalizer} before they become part of a key.
 */
public interface EntityKeyModel {

  /** The entity levels this source describes, a subset of {@link EntityKind#values()}. */
  Set<EntityKind> levels();

  /**
   * Extract the natural key of one level of an observation.
   *
   * @throws IllegalArgumentException if the observation does not carry that level
   */
  NaturalKey extractKey(EntityKind kind, Observation observation);

  /**
   * Extract the attributes written when the row of that level is first inserted.
   *
   * @throws IllegalArgumentException if the observation does not carry that level
   */
  Attributes extractAttributes(EntityKind kind, Observation observation);

  default boolean describes(EntityKind kind) {
    return levels().contains(kind);
  }

  /** Whether rows of {@code kind} must reference a resolved series. */
  default boolean requiresSeries(EntityKind kind) {
    return kind != EntityKind.SERIES && describes(EntityKind.SERIES);
  }
}
