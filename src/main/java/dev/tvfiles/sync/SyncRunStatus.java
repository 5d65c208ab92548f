package dev.tvfiles.sync;

/**
 * Lifecycle states of a {@link SyncRun}: {@code RUNNING → COMPLETED} or {@code RUNNING →
 * FAILED}.
 */
public enum SyncRunStatus {
  /** Pass started, not yet committed. */
  RUNNING,
  /** Pass committed; counters recorded. */
  COMPLETED,
  /** Pass rolled back; see the error message. */
  FAILED
}
