package dev.tvfiles.filesystem;

import dev.tvfiles.reconcile.Attributes;
import dev.tvfiles.reconcile.EntityKeyModel;
import dev.tvfiles.reconcile.EntityKind;
import dev.tvfiles.reconcile.NaturalKey;
import dev.tvfiles.reconcile.Observation;
import dev.tvfiles.reconcile.PathCanonicalizer;
import java.util.EnumSet;
import java.util.Set;

/**
 * Key model for the filesystem walk: files only, keyed by name within their canonical
 * directory.
 */
public class DirectoryKeyModel implements EntityKeyModel {

  private static final Set<EntityKind> LEVELS = EnumSet.of(EntityKind.FILE);

  @Override
  public Set<EntityKind> levels() {
    return LEVELS;
  }

  @Override
  public NaturalKey extractKey(EntityKind kind, Observation observation) {
    requireFile(kind);
    Observation.FileInfo file = observation.file();
    return new NaturalKey.NameInDirectory(file.name(), PathCanonicalizer.canonicalize(file.directory()));
  }

  @Override
  public Attributes extractAttributes(EntityKind kind, Observation observation) {
    requireFile(kind);
    return Attributes.ofFile(observation.file().createdAt());
  }

  private static void requireFile(EntityKind kind) {
    if (kind != EntityKind.FILE) {
      throw new IllegalArgumentException("Filesystem observations carry no " + kind);
    }
  }
}
