package dev.tvfiles.reconcile;

/**
 * The three entity levels a source can describe, declared in dependency order.
 *
 * <p>A pass always resolves {@code SERIES → EPISODE → FILE} within one observation, so a child
 * never references a parent that has not been resolved first.
 */
public enum EntityKind {
  /** Parent entity: a show or series. Never soft-deleted. */
  SERIES,
  /** Child entity: one episode of a series. Never soft-deleted. */
  EPISODE,
  /** Leaf entity: a file record carrying {@code added_at} / {@code removed_at}. */
  FILE
}
