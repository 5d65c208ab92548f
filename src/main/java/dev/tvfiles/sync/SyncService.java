package dev.tvfiles.sync;

import dev.tvfiles.reconcile.ObservationReconciler;
import dev.tvfiles.reconcile.PassSummary;
import dev.tvfiles.reconcile.SourceUnavailableException;
import dev.tvfiles.reconcile.StoreUnavailableException;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs reconciliation passes for the registered {@link SyncSource}s.
 *
 * <p>Each pass executes inside a single transaction that commits once the pass reaches its
 * terminal state, so a failure anywhere leaves the store as it was before the pass. Passes of the
 * same source are serialized in-process; a second request while one is running is rejected.
 *
 * <p>Every pass is logged to {@code sync_runs} outside the pass transaction, so failed passes
 * remain recorded after rollback.
 */
@Service
public class SyncService {

  private static final Logger log = LoggerFactory.getLogger(SyncService.class);

  private final Map<SourceKind, SyncSource> sources = new EnumMap<>(SourceKind.class);
  private final TransactionTemplate transactionTemplate;
  private final SyncRunRepository syncRunRepository;
  private final SyncProperties properties;
  private final Clock clock;
  private final Set<SourceKind> runningPasses = ConcurrentHashMap.newKeySet();

  public SyncService(
      List<SyncSource> sources,
      PlatformTransactionManager transactionManager,
      SyncRunRepository syncRunRepository,
      SyncProperties properties,
      Clock clock) {
    for (SyncSource source : sources) {
      SyncSource previous = this.sources.put(source.kind(), source);
      if (previous != null) {
        throw new IllegalStateException("Duplicate sync source for " + source.kind());
      }
    }
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.syncRunRepository = syncRunRepository;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Run one full pass for a source.
   *
   * @param kind the source to reconcile
   * @return the counters of the committed pass
   * @throws SourceUnavailableException if the source could not be read; nothing was committed
   * @throws StoreUnavailableException if the store failed; nothing was committed
   * @throws IllegalStateException if a pass for the same source is already running
   */
  public PassSummary sync(SourceKind kind) {
    SyncSource source = sources.get(kind);
    if (source == null) {
      throw new IllegalArgumentException("No sync source registered for " + kind.cliName());
    }
    if (!runningPasses.add(kind)) {
      throw new IllegalStateException("A " + kind.cliName() + " pass is already running");
    }
    try {
      return runPass(source);
    } finally {
      runningPasses.remove(kind);
    }
  }

  /** The most recent run of a source, if any. */
  public Optional<SyncRun> lastRun(SourceKind kind) {
    return syncRunRepository.findFirstBySourceOrderByStartedAtDesc(kind);
  }

  private PassSummary runPass(SyncSource source) {
    SyncRun run = startRun(source.kind());
    ObservationReconciler reconciler =
        new ObservationReconciler(source.keyModel(), source.store(), properties.linkPolicy(), clock);

    log.info("Starting {} sync (link policy: {})", source.kind().cliName(), properties.linkPolicy());
    try {
      PassSummary summary =
          transactionTemplate.execute(status -> reconciler.reconcile(source.observations()));
      if (summary == null) {
        throw new IllegalStateException("Pass returned no summary");
      }
      recordCompletion(run, summary);
      log.info(
          "{} sync complete: files seen={}, inserted={}, restored={}, episodes linked={}, unresolved={}, removed={}",
          source.kind().cliName(),
          summary.seen(),
          summary.inserted(),
          summary.restored(),
          summary.linked(),
          summary.unresolved(),
          summary.removed());
      return summary;
    } catch (SourceUnavailableException | DuplicateKeyException e) {
      recordFailure(run, e);
      throw e;
    } catch (DataAccessException | TransactionException e) {
      recordFailure(run, e);
      throw new StoreUnavailableException(
          "Store failed during " + source.kind().cliName() + " sync: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      recordFailure(run, e);
      throw e;
    }
  }

  private SyncRun startRun(SourceKind kind) {
    try {
      return syncRunRepository.save(new SyncRun(kind, clock.instant()));
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("Cannot record start of " + kind.cliName() + " sync", e);
    }
  }

  // The pass is already committed here, so a failing run-log write must not report it as failed
  private void recordCompletion(SyncRun run, PassSummary summary) {
    try {
      run.complete(summary, clock.instant());
      syncRunRepository.save(run);
    } catch (DataAccessException e) {
      log.warn("Could not record completion of {} sync: {}", run.getSource().cliName(), e.getMessage());
    }
  }

  private void recordFailure(SyncRun run, RuntimeException cause) {
    log.error("{} sync failed, changes rolled back: {}", run.getSource().cliName(), cause.getMessage());
    try {
      run.fail(cause.getMessage(), clock.instant());
      syncRunRepository.save(run);
    } catch (DataAccessException e) {
      log.warn("Could not record failure of {} sync: {}", run.getSource().cliName(), e.getMessage());
      cause.addSuppressed(e);
    }
  }
}
