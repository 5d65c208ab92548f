package dev.tvfiles.reconcile;

import java.time.Clock;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives reconciliation passes for one source: streams every observation through a fresh {@link
 * ReconciliationPass} and finalizes removals once the stream is exhausted.
 *
 * <p>The reconciler keeps no state between passes. It does not open transactions; callers run
 * {@link #reconcile} inside the scope that should commit or roll back the pass as a whole.
 */
public class ObservationReconciler {

  private static final Logger log = LoggerFactory.getLogger(ObservationReconciler.class);

  private final EntityKeyModel keyModel;
  private final LifecycleStore store;
  private final LinkPolicy linkPolicy;
  private final Clock clock;

  public ObservationReconciler(
      EntityKeyModel keyModel, LifecycleStore store, LinkPolicy linkPolicy, Clock clock) {
    this.keyModel = keyModel;
    this.store = store;
    this.linkPolicy = linkPolicy;
    this.clock = clock;
  }

  /**
   * Run one complete pass.
   *
   * @param source the source to observe; its stream is closed before this method returns
   * @return the counters of the finished pass
   * @throws SourceUnavailableException if the source fails; the pass does not finalize
   */
  public PassSummary reconcile(ObservationSource source) {
    ReconciliationPass pass = newPass();
    pass.begin();
    try (Stream<Observation> observations = source.observe()) {
      observations.forEachOrdered(pass::accept);
    }
    PassSummary summary = pass.finish();
    log.info(
        "Pass complete in {}ms: seen={}, inserted={}, restored={}, linked={}, unresolved={}, removed={}",
        summary.durationMs(),
        summary.seen(),
        summary.inserted(),
        summary.restored(),
        summary.linked(),
        summary.unresolved(),
        summary.removed());
    return summary;
  }

  /** Create an idle pass bound to this reconciler's store, key model and policy. */
  public ReconciliationPass newPass() {
    return new ReconciliationPass(keyModel, store, linkPolicy, clock);
  }
}
