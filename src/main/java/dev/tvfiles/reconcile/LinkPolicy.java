package dev.tvfiles.reconcile;

/**
 * What a pass does with a file whose episode cannot be resolved.
 *
 * <p>In both cases the observation is counted as unresolved. A file whose series cannot be
 * resolved is always dropped.
 */
public enum LinkPolicy {
  /** Track the file with an empty episode link. */
  INSERT_UNLINKED,
  /** Do not track the file in this pass; it does not enter the seen-key set. */
  DROP_UNRESOLVED
}
