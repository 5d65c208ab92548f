package dev.tvfiles.sonarr;

import dev.tvfiles.reconcile.CatalogKeyModel;
import dev.tvfiles.reconcile.NaturalKey;
import dev.tvfiles.reconcile.Observation;
import dev.tvfiles.reconcile.PathCanonicalizer;

/** Sonarr keys series and episodes by their numeric ids and files by full path. */
public class SonarrKeyModel extends CatalogKeyModel {

  @Override
  protected NaturalKey fileKey(Observation.FileInfo file) {
    String directory = file.directory().endsWith("/") ? file.directory() : file.directory() + "/";
    return new NaturalKey.AbsolutePath(PathCanonicalizer.canonicalize(directory + file.name()));
  }
}
