package dev.tvfiles.persistence;

import dev.tvfiles.reconcile.EntityKind;
import dev.tvfiles.reconcile.NaturalKey;

/** Argument checks shared by the JPA-backed lifecycle stores. */
public final class StoreKeys {

  private StoreKeys() {
    // utility class
  }

  /**
   * Narrow a natural key to the type a table is keyed by.
   *
   * @throws IllegalArgumentException if the key has another shape
   */
  public static <K extends NaturalKey> K expect(NaturalKey key, Class<K> type) {
    if (!type.isInstance(key)) {
      throw new IllegalArgumentException(
          "Expected " + type.getSimpleName() + " key but got " + key.getClass().getSimpleName());
    }
    return type.cast(key);
  }

  /**
   * Parse a numeric external id.
   *
   * @throws IllegalArgumentException if the id is not an integer
   */
  public static int numericId(NaturalKey key) {
    String value = expect(key, NaturalKey.ExternalId.class).value();
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a numeric id: " + value, e);
    }
  }

  /**
   * Reject entity kinds a store has no table for.
   *
   * @throws IllegalArgumentException if {@code kind} is not {@code supported}
   */
  public static void requireKind(EntityKind kind, EntityKind supported) {
    if (kind != supported) {
      throw new IllegalArgumentException("Store does not track " + kind);
    }
  }
}
