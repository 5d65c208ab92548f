package dev.tvfiles.plex;

import dev.tvfiles.reconcile.EntityKeyModel;
import dev.tvfiles.reconcile.LifecycleStore;
import dev.tvfiles.reconcile.ObservationSource;
import dev.tvfiles.sync.SourceKind;
import dev.tvfiles.sync.SyncSource;
import org.springframework.stereotype.Component;

/** Binds the Plex library walk to the {@code plex_*} tables. */
@Component
public class PlexSyncSource implements SyncSource {

  private final EntityKeyModel keyModel = new PlexKeyModel();
  private final PlexLifecycleStore store;
  private final PlexObservationSource observations;

  public PlexSyncSource(PlexLifecycleStore store, PlexObservationSource observations) {
    this.store = store;
    this.observations = observations;
  }

  @Override
  public SourceKind kind() {
    return SourceKind.PLEX;
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
