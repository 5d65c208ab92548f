package dev.tvfiles.plex;

import dev.tvfiles.persistence.StoreKeys;
import dev.tvfiles.reconcile.Attributes;
import dev.tvfiles.reconcile.EntityKind;
import dev.tvfiles.reconcile.LifecycleStore;
import dev.tvfiles.reconcile.Lineage;
import dev.tvfiles.reconcile.NaturalKey;
import dev.tvfiles.reconcile.StoredEntity;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link LifecycleStore} over {@code plex_series}, {@code plex_episodes} and {@code plex_files}.
 *
 * <p>Must be called inside the pass transaction opened by the sync service.
 */
@Component
@Transactional(propagation = Propagation.MANDATORY)
public class PlexLifecycleStore implements LifecycleStore {

  private final PlexSeriesRepository seriesRepository;
  private final PlexEpisodeRepository episodeRepository;
  private final PlexFileRepository fileRepository;

  public PlexLifecycleStore(
      PlexSeriesRepository seriesRepository,
      PlexEpisodeRepository episodeRepository,
      PlexFileRepository fileRepository) {
    this.seriesRepository = seriesRepository;
    this.episodeRepository = episodeRepository;
    this.fileRepository = fileRepository;
  }

  @Override
  public Optional<StoredEntity> findByKey(EntityKind kind, NaturalKey key) {
    return switch (kind) {
      case SERIES ->
          seriesRepository
              .findByPlexKey(externalId(key))
              .map(series -> StoredEntity.active(series.getId()));
      case EPISODE ->
          episodeRepository
              .findByPlexKey(externalId(key))
              .map(episode -> StoredEntity.active(episode.getId()));
      case FILE -> {
        NaturalKey.NameInDirectory fileKey = StoreKeys.expect(key, NaturalKey.NameInDirectory.class);
        yield fileRepository
            .findByFilenameAndFilepath(fileKey.name(), fileKey.directory())
            .map(file -> new StoredEntity(file.getId(), file.getRemovedAt()));
      }
    };
  }

  @Override
  public UUID insert(
      EntityKind kind, NaturalKey key, Attributes attributes, Lineage lineage, Instant observedAt) {
    return switch (kind) {
      case SERIES -> {
        String plexKey = externalId(key);
        if (seriesRepository.existsByPlexKey(plexKey)) {
          throw new DuplicateKeyException("Plex series already tracked: " + plexKey);
        }
        yield seriesRepository.save(new PlexSeries(plexKey, requireTitle(attributes, plexKey))).getId();
      }
      case EPISODE -> {
        String plexKey = externalId(key);
        if (episodeRepository.existsByPlexKey(plexKey)) {
          throw new DuplicateKeyException("Plex episode already tracked: " + plexKey);
        }
        PlexEpisode episode =
            new PlexEpisode(
                plexKey,
                requireSeries(lineage, key),
                attributes.seasonNumber(),
                attributes.episodeNumber());
        yield episodeRepository.save(episode).getId();
      }
      case FILE -> {
        NaturalKey.NameInDirectory fileKey = StoreKeys.expect(key, NaturalKey.NameInDirectory.class);
        if (fileRepository.existsByFilenameAndFilepath(fileKey.name(), fileKey.directory())) {
          throw new DuplicateKeyException("Plex file already tracked: " + fileKey);
        }
        PlexFile file =
            new PlexFile(
                fileKey.name(),
                fileKey.directory(),
                requireSeries(lineage, key),
                lineage.episodeId(),
                observedAt);
        yield fileRepository.save(file).getId();
      }
    };
  }

  @Override
  public Map<NaturalKey, UUID> listActiveLeafKeys() {
    Map<NaturalKey, UUID> active = new LinkedHashMap<>();
    for (PlexFile file : fileRepository.findAllByRemovedAtIsNull()) {
      active.put(new NaturalKey.NameInDirectory(file.getFilename(), file.getFilepath()), file.getId());
    }
    return active;
  }

  @Override
  public void markRemoved(UUID leafId, Instant removedAt) {
    load(leafId).markRemoved(removedAt);
  }

  @Override
  public void clearRemoved(UUID leafId) {
    load(leafId).clearRemoved();
  }

  private PlexFile load(UUID leafId) {
    return fileRepository
        .findById(leafId)
        .orElseThrow(() -> new IllegalStateException("No Plex file with id " + leafId));
  }

  private static String externalId(NaturalKey key) {
    return StoreKeys.expect(key, NaturalKey.ExternalId.class).value();
  }

  private static String requireTitle(Attributes attributes, String plexKey) {
    if (attributes.title() == null) {
      throw new IllegalArgumentException("Plex series " + plexKey + " has no title");
    }
    return attributes.title();
  }

  private static UUID requireSeries(Lineage lineage, NaturalKey key) {
    if (lineage.seriesId() == null) {
      throw new IllegalArgumentException("No series id for " + key);
    }
    return lineage.seriesId();
  }
}
