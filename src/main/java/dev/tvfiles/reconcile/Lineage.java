package dev.tvfiles.reconcile;

import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Durable ids of the already-resolved parents an entity is inserted under.
 *
 * @param seriesId id of the owning series row, if resolved
 * @param episodeId id of the owning episode row, if resolved
 */
public record Lineage(@Nullable UUID seriesId, @Nullable UUID episodeId) {

  private static final Lineage NONE = new Lineage(null, null);

  public static Lineage none() {
    return NONE;
  }

  public static Lineage ofSeries(UUID seriesId) {
    return new Lineage(seriesId, null);
  }

  public Lineage withEpisode(@Nullable UUID episodeId) {
    return new Lineage(seriesId, episodeId);
  }
}
