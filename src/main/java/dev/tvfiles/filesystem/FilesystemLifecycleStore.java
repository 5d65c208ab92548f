package dev.tvfiles.filesystem;

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
 * {@link LifecycleStore} over the {@code files} table. Only {@link EntityKind#FILE} is supported.
 *
 * <p>Must be called inside the pass transaction opened by the sync service.
 */
@Component
@Transactional(propagation = Propagation.MANDATORY)
public class FilesystemLifecycleStore implements LifecycleStore {

  private final ScannedFileRepository fileRepository;

  public FilesystemLifecycleStore(ScannedFileRepository fileRepository) {
    this.fileRepository = fileRepository;
  }

  @Override
  public Optional<StoredEntity> findByKey(EntityKind kind, NaturalKey key) {
    StoreKeys.requireKind(kind, EntityKind.FILE);
    NaturalKey.NameInDirectory fileKey = StoreKeys.expect(key, NaturalKey.NameInDirectory.class);
    return fileRepository
        .findByFilenameAndFilepath(fileKey.name(), fileKey.directory())
        .map(file -> new StoredEntity(file.getId(), file.getRemovedAt()));
  }

  @Override
  public UUID insert(
      EntityKind kind, NaturalKey key, Attributes attributes, Lineage lineage, Instant observedAt) {
    StoreKeys.requireKind(kind, EntityKind.FILE);
    NaturalKey.NameInDirectory fileKey = StoreKeys.expect(key, NaturalKey.NameInDirectory.class);
    if (fileRepository.existsByFilenameAndFilepath(fileKey.name(), fileKey.directory())) {
      throw new DuplicateKeyException("File already tracked: " + fileKey);
    }
    ScannedFile file =
        new ScannedFile(fileKey.name(), fileKey.directory(), attributes.createdAt(), observedAt);
    return fileRepository.save(file).getId();
  }

  @Override
  public Map<NaturalKey, UUID> listActiveLeafKeys() {
    Map<NaturalKey, UUID> active = new LinkedHashMap<>();
    for (ScannedFile file : fileRepository.findAllByRemovedAtIsNull()) {
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

  private ScannedFile load(UUID leafId) {
    return fileRepository
        .findById(leafId)
        .orElseThrow(() -> new IllegalStateException("No file with id " + leafId));
  }
}
