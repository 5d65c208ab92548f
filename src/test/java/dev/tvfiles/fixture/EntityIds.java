package dev.tvfiles.fixture;

import java.lang.reflect.Field;
import java.util.UUID;

/**
 * Assigns ids to JPA entities built in unit tests, where no persistence provider generates
 * them.
 */
public final class EntityIds {

  private EntityIds() {
    // utility class
  }

  /** Set the {@code id} field declared on the entity class or one of its superclasses. */
  public static <T> T withId(T entity, UUID id) {
    Class<?> type = entity.getClass();
    while (type != null) {
      try {
        Field field = type.getDeclaredField("id");
        field.setAccessible(true);
        field.set(entity, id);
        return entity;
      } catch (NoSuchFieldException e) {
        type = type.getSuperclass();
      } catch (ReflectiveOperationException e) {
        throw new IllegalStateException("Failed to set id on " + entity.getClass().getSimpleName(), e);
      }
    }
    throw new IllegalStateException("No id field on " + entity.getClass().getSimpleName());
  }
}
