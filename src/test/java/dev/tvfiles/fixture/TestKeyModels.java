package dev.tvfiles.fixture;

import dev.tvfiles.reconcile.Attributes;
import dev.tvfiles.reconcile.CatalogKeyModel;
import dev.tvfiles.reconcile.EntityKeyModel;
import dev.tvfiles.reconcile.EntityKind;
import dev.tvfiles.reconcile.NaturalKey;
import dev.tvfiles.reconcile.Observation;
import dev.tvfiles.reconcile.PathCanonicalizer;
import java.util.EnumSet;
import java.util.Set;

/** Key models for core tests, independent of the source packages. */
public final class TestKeyModels {

  private TestKeyModels() {
    // utility class
  }

  /** Files only, keyed by name within the canonical directory. */
  public static EntityKeyModel flat() {
    return new EntityKeyModel() {
      @Override
      public Set<EntityKind> levels() {
        return EnumSet.of(EntityKind.FILE);
      }

      @Override
      public NaturalKey extractKey(EntityKind kind, Observation observation) {
        return new NaturalKey.NameInDirectory(
            observation.file().name(), PathCanonicalizer.canonicalize(observation.file().directory()));
      }

      @Override
      public Attributes extractAttributes(EntityKind kind, Observation observation) {
        return Attributes.ofFile(observation.file().createdAt());
      }
    };
  }

  /** Series, episode and file, with files keyed by canonical absolute path. */
  public static EntityKeyModel catalog() {
    return new CatalogKeyModel() {
      @Override
      protected NaturalKey fileKey(Observation.FileInfo file) {
        return new NaturalKey.AbsolutePath(
            PathCanonicalizer.canonicalize(file.directory() + "/" + file.name()));
      }
    };
  }
}
