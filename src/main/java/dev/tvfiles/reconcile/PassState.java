package dev.tvfiles.reconcile;

/**
 * Lifecycle of a {@link ReconciliationPass}: {@code IDLE → STREAMING → FINALIZING → DONE}.
 *
 * <p>There is no transition out of {@code DONE}; a new pass object is created for every run.
 */
public enum PassState {
  /** Created, nothing observed yet. */
  IDLE,
  /** Consuming observations and upserting. */
  STREAMING,
  /** Stream exhausted; soft-deleting unseen leaves. */
  FINALIZING,
  /** Summary reported. */
  DONE
}
