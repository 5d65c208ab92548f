package dev.tvfiles.sync;

import dev.tvfiles.reconcile.EntityKeyModel;
import dev.tvfiles.reconcile.LifecycleStore;
import dev.tvfiles.reconcile.ObservationSource;

/**
 * Binds one source's observation stream, key model and store adapter so {@link SyncService} can
 * run it through the shared reconciler. Each source package contributes one bean.
 */
public interface SyncSource {

  SourceKind kind();

  EntityKeyModel keyModel();

  LifecycleStore store();

  ObservationSource observations();
}
