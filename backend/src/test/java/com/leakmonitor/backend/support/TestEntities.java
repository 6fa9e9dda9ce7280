package com.leakmonitor.backend.support;

import java.lang.reflect.Field;

public final class TestEntities {

  private TestEntities() {}

  public static <T> T withId(T entity, Object id) {
    setField(entity, "id", id);
    return entity;
  }

  public static void setField(Object target, String fieldName, Object value) {
    try {
      Field field = target.getClass().getDeclaredField(fieldName);
      field.setAccessible(true);
      field.set(target, value);
    } catch (NoSuchFieldException | IllegalAccessException exception) {
      throw new RuntimeException(exception);
    }
  }
}
