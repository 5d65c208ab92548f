package dev.tvfiles.reconcile;

import java.time.Instant;

/**
 * Counters reported when a pass reaches {@link PassState#DONE}.
 *
 * @param passTime the timestamp stamped on every row the pass inserted or removed
 * @param seen observations consumed (files reported by the source, duplicates included)
 * @param inserted file rows inserted
 * @param restored file rows whose {@code removed_at} was cleared
 * @param linked observations whose episode was resolved
 * @param unresolved observations with a missing series or episode link
 * @param removed file rows soft-deleted in finalization
 * @param durationMs wall-clock duration of the pass
 */
public record PassSummary(
    Instant passTime,
    int seen,
    int inserted,
    int restored,
    int linked,
    int unresolved,
    int removed,
    long durationMs) {}
