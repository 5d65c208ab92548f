package dev.tvfiles.reconcile;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One full reconciliation run over a complete observation set.
 *
 * <p>Call {@link #begin()}, then {@link #accept(Observation)} for every observation in source
 * order, then {@link #finish()}. Out-of-order calls throw {@link IllegalStateException}. A pass
 * object is single use.
 *
 * <p>Within one observation the levels are resolved series first, then episode, then file. If a
 * level fails, the observation is counted as unresolved and skipped at that point; parents it
 * already resolved stay persisted for later observations. Series and episode ids are cached for
 * the duration of the pass.
 */
public final class ReconciliationPass {

  private static final Logger log = LoggerFactory.getLogger(ReconciliationPass.class);

  private final EntityKeyModel keyModel;
  private final UpsertResolver resolver;
  private final LifecycleStore store;
  private final LinkPolicy linkPolicy;
  private final Clock clock;

  private final Set<NaturalKey> seenKeys = new HashSet<>();
  private final Map<EntityKind, Map<NaturalKey, UUID>> resolvedParents =
      new EnumMap<>(EntityKind.class);

  private PassState state = PassState.IDLE;
  private Instant passTime = Instant.EPOCH;
  private int seen;
  private int inserted;
  private int restored;
  private int linked;
  private int unresolved;
  private int removed;

  ReconciliationPass(
      EntityKeyModel keyModel, LifecycleStore store, LinkPolicy linkPolicy, Clock clock) {
    this.keyModel = keyModel;
    this.resolver = new UpsertResolver(store, keyModel);
    this.store = store;
    this.linkPolicy = linkPolicy;
    this.clock = clock;
  }

  public PassState state() {
    return state;
  }

  /** {@code IDLE → STREAMING}: fix the pass timestamp and start with an empty seen-key set. */
  public void begin() {
    transition(PassState.IDLE, PassState.STREAMING);
    passTime = clock.instant();
    log.debug("Pass started at {}", passTime);
  }

  /**
   * Resolve one observation and record its file key as seen.
   *
   * @param observation the next observation from the source
   */
  public void accept(Observation observation) {
    requireState(PassState.STREAMING);
    seen++;

    Lineage lineage = Lineage.none();
    if (keyModel.describes(EntityKind.SERIES)) {
      Optional<UUID> seriesId = resolveParent(EntityKind.SERIES, observation, lineage);
      if (seriesId.isEmpty()) {
        unresolved++;
        log.debug("Skipping {}: series could not be resolved", observation.file());
        return;
      }
      lineage = Lineage.ofSeries(seriesId.get());
    }

    if (keyModel.describes(EntityKind.EPISODE)) {
      Optional<UUID> episodeId = resolveParent(EntityKind.EPISODE, observation, lineage);
      if (episodeId.isPresent()) {
        linked++;
        lineage = lineage.withEpisode(episodeId.get());
      } else {
        unresolved++;
        if (linkPolicy == LinkPolicy.DROP_UNRESOLVED) {
          log.debug("Dropping {}: episode could not be resolved", observation.file());
          return;
        }
      }
    }

    NaturalKey fileKey = keyModel.extractKey(EntityKind.FILE, observation);
    Resolution resolution =
        resolver.resolve(
            EntityKind.FILE,
            fileKey,
            keyModel.extractAttributes(EntityKind.FILE, observation),
            lineage,
            passTime);
    if (!resolution.isResolved()) {
      unresolved++;
      return;
    }

    seenKeys.add(fileKey);
    if (resolution.outcome() == Resolution.Outcome.INSERTED) {
      inserted++;
    } else if (resolution.outcome() == Resolution.Outcome.RESTORED) {
      restored++;
    }
  }

  /**
   * {@code STREAMING → FINALIZING → DONE}: soft-delete every active file row whose key was not
   * seen, then report the counters.
   *
   * @return the pass summary
   */
  public PassSummary finish() {
    transition(PassState.STREAMING, PassState.FINALIZING);

    Map<NaturalKey, UUID> activeLeaves = store.listActiveLeafKeys();
    for (Map.Entry<NaturalKey, UUID> leaf : activeLeaves.entrySet()) {
      if (!seenKeys.contains(leaf.getKey())) {
        store.markRemoved(leaf.getValue(), passTime);
        removed++;
        log.debug("Marked removed: {}", leaf.getKey());
      }
    }

    transition(PassState.FINALIZING, PassState.DONE);
    long durationMs = Duration.between(passTime, clock.instant()).toMillis();
    return new PassSummary(passTime, seen, inserted, restored, linked, unresolved, removed, durationMs);
  }

  private Optional<UUID> resolveParent(EntityKind kind, Observation observation, Lineage lineage) {
    boolean present =
        kind == EntityKind.SERIES ? observation.series() != null : observation.episode() != null;
    if (!present) {
      return Optional.empty();
    }

    NaturalKey key = keyModel.extractKey(kind, observation);
    Map<NaturalKey, UUID> cache = resolvedParents.computeIfAbsent(kind, k -> new HashMap<>());
    UUID cached = cache.get(key);
    if (cached != null) {
      return Optional.of(cached);
    }

    Resolution resolution =
        resolver.resolve(kind, key, keyModel.extractAttributes(kind, observation), lineage, passTime);
    if (!resolution.isResolved()) {
      return Optional.empty();
    }
    cache.put(key, resolution.requireId());
    return Optional.of(resolution.requireId());
  }

  private void requireState(PassState expected) {
    if (state != expected) {
      throw new IllegalStateException("Pass is " + state + ", expected " + expected);
    }
  }

  private void transition(PassState from, PassState to) {
    requireState(from);
    state = to;
  }
}
