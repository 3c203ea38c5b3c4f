package com.autoorm.engine;

import com.autoorm.exceptions.UnknownFieldException;
import com.autoorm.schema.ModelClasses;
import com.google.common.base.MoreObjects;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * An immutable record of one model as returned by the engine.
 *
 * <p>{@link #values()} holds every field of the model in declaration order, the identifier
 * included, with canonical values: {@code Long} for integers and identifiers, {@code Double} for
 * floats, {@code String}, {@code Boolean} and {@code Instant}. Unset nullable fields map to null.
 */
public final class DataRecord {

  private final String modelName;
  private final long id;
  private final Map<String, Object> values;

  DataRecord(String modelName, long id, Map<String, Object> values) {
    this.modelName = modelName;
    this.id = id;
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  @Nonnull
  public String modelName() {
    return modelName;
  }

  public long id() {
    return id;
  }

  /**
   * Returns the value of a field, or null if it is unset.
   *
   * @throws UnknownFieldException if the model has no such field
   */
  @Nullable
  public Object get(String field) {
    if (!values.containsKey(field)) {
      throw new UnknownFieldException(modelName, field);
    }
    return values.get(field);
  }

  public boolean isNull(String field) {
    return get(field) == null;
  }

  @Nullable
  public String getString(String field) {
    return typed(field, String.class);
  }

  @Nullable
  public Long getLong(String field) {
    return typed(field, Long.class);
  }

  @Nullable
  public Double getDouble(String field) {
    return typed(field, Double.class);
  }

  @Nullable
  public Boolean getBoolean(String field) {
    return typed(field, Boolean.class);
  }

  @Nullable
  public Instant getInstant(String field) {
    return typed(field, Instant.class);
  }

  /** Returns all field values in declaration order. The map cannot be modified. */
  @Nonnull
  public Map<String, Object> values() {
    return values;
  }

  /**
   * Converts this record to an instance of a Java record class whose component names match field
   * names. Integer fields narrow to {@code int}, {@code short} or {@code byte} components and
   * float fields to {@code float} components.
   *
   * @throws UnknownFieldException if a component has no matching field
   * @throws IllegalArgumentException if a value does not fit its component
   */
  @Nonnull
  public <R extends java.lang.Record> R as(Class<R> recordClass) {
    return ModelClasses.instantiate(recordClass, modelName, values);
  }

  private <T> T typed(String field, Class<T> type) {
    Object value = get(field);
    if (value == null) {
      return null;
    }
    if (!type.isInstance(value)) {
      throw new IllegalStateException(
          "Field '" + field + "' of model '" + modelName + "' holds a "
              + value.getClass().getSimpleName() + ", not a " + type.getSimpleName());
    }
    return type.cast(value);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof DataRecord)) {
      return false;
    }
    DataRecord other = (DataRecord) obj;
    return id == other.id && modelName.equals(other.modelName) && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(modelName, id, values);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(modelName).add("id", id).add("values", values).toString();
  }
}
