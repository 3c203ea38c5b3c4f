package com.autoorm.schema;

import javax.annotation.Nullable;

/**
 * A raw, unvalidated field declaration as supplied by a model discovery source.
 *
 * <p>The registry turns these into {@link FieldSchema} instances. Nothing is checked here; a
 * definition with an unknown type tag or a default of the wrong type is rejected by {@link
 * ModelRegistry#load}.
 *
 * @param name the field name, unique within its model
 * @param type the declared type tag, one of the {@link FieldType} tags
 * @param nullable whether the field may hold null
 * @param defaultValue the value used when a create leaves the field unset, or null for none
 * @param unique whether no two records of the model may share a non-null value
 * @param primaryKey whether this field is the model's identifier
 */
public record FieldDefinition(
    String name,
    String type,
    boolean nullable,
    @Nullable Object defaultValue,
    boolean unique,
    boolean primaryKey) {

  /** A required, non-unique field with no default. */
  public static FieldDefinition of(String name, String type) {
    return new FieldDefinition(name, type, false, null, false, false);
  }

  /** A required, non-unique field with no default. */
  public static FieldDefinition of(String name, FieldType type) {
    return of(name, type.tag());
  }

  /** The model's identifier field. */
  public static FieldDefinition primaryKey(String name) {
    return new FieldDefinition(name, FieldType.IDENTIFIER.tag(), false, null, false, true);
  }

  public FieldDefinition asNullable() {
    return new FieldDefinition(name, type, true, defaultValue, unique, primaryKey);
  }

  public FieldDefinition asUnique() {
    return new FieldDefinition(name, type, nullable, defaultValue, true, primaryKey);
  }

  public FieldDefinition withDefault(@Nullable Object value) {
    return new FieldDefinition(name, type, nullable, value, unique, primaryKey);
  }
}
