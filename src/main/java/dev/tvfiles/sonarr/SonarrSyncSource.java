package dev.tvfiles.sonarr;

import dev.tvfiles.reconcile.EntityKeyModel;
import dev.tvfiles.reconcile.LifecycleStore;
import dev.tvfiles.reconcile.ObservationSource;
import dev.tvfiles.sync.SourceKind;
import dev.tvfiles.sync.SyncSource;
import org.springframework.stereotype.Component;

/** Binds the Sonarr series listing to the {@code sonarr_*} tables. */
@Component
public class SonarrSyncSource implements SyncSource {

  private final EntityKeyModel keyModel = new SonarrKeyModel();
  private final SonarrLifecycleStore store;
  private final SonarrObservationSource observations;

  public SonarrSyncSource(SonarrLifecycleStore store, SonarrObservationSource observations) {
    this.store = store;
    this.observations = observations;
  }

  @Override
  public SourceKind kind() {
    return SourceKind.SONARR;
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
