package dev.tvfiles.reconcile;

import java.util.Objects;

/**
 * Externally meaningful identity of an entity, independent of the store-assigned id.
 *
 * <p>Implementations are value records so they can be collected into the seen-key set of a pass
 * and compared against keys read back from the store.
 */
public sealed interface NaturalKey
    permits NaturalKey.ExternalId, NaturalKey.NameInDirectory, NaturalKey.AbsolutePath {

  /** Identifier assigned by the remote catalog (Plex metadata key, Sonarr id). */
  record ExternalId(String value) implements NaturalKey {
    public ExternalId {
      Objects.requireNonNull(value, "value");
    }
  }

  /** Composite key of a file name and its canonical containing directory. */
  record NameInDirectory(String name, String directory) implements NaturalKey {
    public NameInDirectory {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(directory, "directory");
    }
  }

  /** Single-string key: the canonical absolute path of a file. */
  record AbsolutePath(String path) implements NaturalKey {
    public AbsolutePath {
      Objects.requireNonNull(path, "path");
    }
  }
}
