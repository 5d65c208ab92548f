package dev.tvfiles.filesystem;

import dev.tvfiles.reconcile.EntityKeyModel;
import dev.tvfiles.reconcile.LifecycleStore;
import dev.tvfiles.reconcile.ObservationSource;
import dev.tvfiles.sync.SourceKind;
import dev.tvfiles.sync.SyncSource;
import org.springframework.stereotype.Component;

/** Binds the directory walk to the {@code files} table. */
@Component
public class FilesystemSyncSource implements SyncSource {

  private final EntityKeyModel keyModel = new DirectoryKeyModel();
  private final FilesystemLifecycleStore store;
  private final FilesystemObservationSource observations;

  public FilesystemSyncSource(
      FilesystemLifecycleStore store, FilesystemObservationSource observations) {
    this.store = store;
    this.observations = observations;
  }

  @Override
  public SourceKind kind() {
    return SourceKind.FILESYSTEM;
  }

  @Override
  public EntityKeyModel keyModel() {
    return keyModel;
  }

  @Override
  public LifecycleStore store() {
    return store;
  }

  @Override
  public ObservationSource observations() {
    return observations;
  }
}
