package io.b2mash.eventops.testutil;

import java.lang.reflect.Field;
import java.util.UUID;

/** Sets database-generated ids on entities built in unit tests. */
public final class TestEntities {

  private TestEntities() {}

  public static <T> T withId(T entity, UUID id) {
    setField(entity, "id", id);
    return entity;
  }

  public static void setField(Object target, String name, Object value) {
    try {
      Field field = findField(target.getClass(), name);
      field.setAccessible(true);
      field.set(target, value);
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to set " + name + " on " + target.getClass(), e);
    }
  }

  private static Field findField(Class<?> type, String name) throws NoSuchFieldException {
    for (Class<?> c = type; c != null; c = c.getSuperclass()) {
      try {
        return c.getDeclaredField(name);
      } catch (NoSuchFieldException e) {
        // keep walking up the hierarchy
      }
    }
    throw new NoSuchFieldException(name);
  }
}
