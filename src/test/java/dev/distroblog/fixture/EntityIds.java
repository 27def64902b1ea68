package dev.distroblog.fixture;

import java.lang.reflect.Field;
import java.util.UUID;

/** Assigns the generated id of a JPA entity outside a persistence context. */
public final class EntityIds {

  private EntityIds() {}

  public static <T> T assign(T entity, UUID id) {
    try {
      Field field = entity.getClass().getDeclaredField("id");
      field.setAccessible(true);
      field.set(entity, id);
      return entity;
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to set id on " + entity.getClass().getSimpleName(), e);
    }
  }
}
