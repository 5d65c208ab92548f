package dev.tvfiles.reconcile;

import java.util.EnumSet;
import java.util.Set;

/**
 * Key model for catalog sources that describe the full series → episode → file hierarchy.
 *
 * <p>Series and episodes are keyed by the identifiers the catalog assigns; subclasses decide how
 * a file is keyed.
 */
public abstract class CatalogKeyModel implements EntityKeyModel {

  private static final Set<EntityKind> LEVELS = EnumSet.allOf(EntityKind.class);

  @Override
  public Set<EntityKind> levels() {
    return LEVELS;
  }

  @Override
  public NaturalKey extractKey(EntityKind kind, Observation observation) {
    return switch (kind) {
      case SERIES -> new NaturalKey.ExternalId(series(observation).externalId());
      case EPISODE -> new NaturalKey.ExternalId(episode(observation).externalId());
      case FILE -> fileKey(observation.file());
    };
  }

  @Override
  public Attributes extractAttributes(EntityKind kind, Observation observation) {
    return switch (kind) {
      case SERIES -> {
        Observation.SeriesInfo series = series(observation);
        yield Attributes.ofSeries(series.title(), series.path());
      }
      case EPISODE -> {
        Observation.EpisodeInfo episode = episode(observation);
        yield Attributes.ofEpisode(episode.seasonNumber(), episode.episodeNumber());
      }
      case FILE -> Attributes.ofFile(observation.file().createdAt());
    };
  }

  /** Key a file record. Implementations must canonicalize the path. */
  protected abstract NaturalKey fileKey(Observation.FileInfo file);

  private static Observation.SeriesInfo series(Observation observation) {
    if (observation.series() == null) {
      throw new IllegalArgumentException("Observation carries no series: " + observation.file());
    }
    return observation.series();
  }

  private static Observation.EpisodeInfo episode(Observation observation) {
    if (observation.episode() == null) {
      throw new IllegalArgumentException("Observation carries no episode: " + observation.file());
    }
    return observation.episode();
  }
}
