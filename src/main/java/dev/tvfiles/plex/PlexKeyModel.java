package dev.tvfiles.plex;

import dev.tvfiles.reconcile.CatalogKeyModel;
import dev.tvfiles.reconcile.NaturalKey;
import dev.tvfiles.reconcile.Observation;
import dev.tvfiles.reconcile.PathCanonicalizer;

/**
 * Plex keys series and episodes by their metadata key and files by {@code (filename,
 * filepath)}.
 */
public class PlexKeyModel extends CatalogKeyModel {

  @Override
  protected NaturalKey fileKey(Observation.FileInfo file) {
    return new NaturalKey.NameInDirectory(file.name(), PathCanonicalizer.canonicalize(file.directory()));
  }
}
