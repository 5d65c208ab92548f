package dev.tvfiles.sonarr;

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
 * {@link LifecycleStore} over {@code sonarr_series}, {@code sonarr_episodes} and {@code
 * sonarr_files}. Series and episodes are looked up by Sonarr's numeric ids.
 *
 * <p>Must be called inside the pass transaction opened by the sync service.
 */
@Component
@Transactional(propagation = Propagation.MANDATORY)
public class SonarrLifecycleStore implements LifecycleStore {

  private final SonarrSeriesRepository seriesRepository;
  private final SonarrEpisodeRepository episodeRepository;
  private final SonarrFileRepository fileRepository;

  public SonarrLifecycleStore(
      SonarrSeriesRepository seriesRepository,
      SonarrEpisodeRepository episodeRepository,
      SonarrFileRepository fileRepository) {
    this.seriesRepository = seriesRepository;
    this.episodeRepository = episodeRepository;
    this.fileRepository = fileRepository;
  }

  @Override
  public Optional<StoredEntity> findByKey(EntityKind kind, NaturalKey key) {
    return switch (kind) {
      case SERIES ->
          seriesRepository
              .findBySonarrId(StoreKeys.numericId(key))
              .map(series -> StoredEntity.active(series.getId()));
      case EPISODE ->
          episodeRepository
              .findBySonarrId(StoreKeys.numericId(key))
              .map(episode -> StoredEntity.active(episode.getId()));
      case FILE ->
          fileRepository
              .findByFilePath(StoreKeys.expect(key, NaturalKey.AbsolutePath.class).path())
              .map(file -> new StoredEntity(file.getId(), file.getRemovedAt()));
    };
  }

  @Override
  public UUID insert(
      EntityKind kind, NaturalKey key, Attributes attributes, Lineage lineage, Instant observedAt) {
    return switch (kind) {
      case SERIES -> {
        int sonarrId = StoreKeys.numericId(key);
        if (seriesRepository.existsBySonarrId(sonarrId)) {
          throw new DuplicateKeyException("Sonarr series already tracked: " + sonarrId);
        }
        String title = attributes.title() == null ? String.valueOf(sonarrId) : attributes.title();
        yield seriesRepository.save(new SonarrSeries(sonarrId, title, attributes.path())).getId();
      }
      case EPISODE -> {
        int sonarrId = StoreKeys.numericId(key);
        if (episodeRepository.existsBySonarrId(sonarrId)) {
          throw new DuplicateKeyException("Sonarr episode already tracked: " + sonarrId);
        }
        SonarrEpisode episode =
            new SonarrEpisode(
                sonarrId,
                requireSeries(lineage, key),
                attributes.seasonNumber(),
                attributes.episodeNumber());
        yield episodeRepository.save(episode).getId();
      }
      case FILE -> {
        String path = StoreKeys.expect(key, NaturalKey.AbsolutePath.class).path();
        if (fileRepository.existsByFilePath(path)) {
          throw new DuplicateKeyException("Sonarr file already tracked: " + path);
        }
        SonarrFile file =
            new SonarrFile(path, requireSeries(lineage, key), lineage.episodeId(), observedAt);
        yield fileRepository.save(file).getId();
      }
    };
  }

  @Override
  public Map<NaturalKey, UUID> listActiveLeafKeys() {
    Map<NaturalKey, UUID> active = new LinkedHashMap<>();
    for (SonarrFile file : fileRepository.findAllByRemovedAtIsNull()) {
      active.put(new NaturalKey.AbsolutePath(file.getFilePath()), file.getId());
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

  private SonarrFile load(UUID leafId) {
    return fileRepository
        .findById(leafId)
        .orElseThrow(() -> new IllegalStateException("No Sonarr file with id " + leafId));
  }

  private static UUID requireSeries(Lineage lineage, NaturalKey key) {
    if (lineage.seriesId() == null) {
      throw new IllegalArgumentException("No series id for " + key);
    }
    return lineage.seriesId();
  }
}
