package com.autoorm.schema;

import javax.annotation.Nullable;

/**
 * A validated field of a {@link ModelSchema}. Any default is already in its canonical form.
 *
 * @param name the field name
 * @param type the field type
 * @param nullable whether the field may hold null
 * @param defaultValue the canonical default, or null for none
 * @param unique whether values must be unique across the model's records
 * @param primaryKey whether this is the identifier field
 */
public record FieldSchema(
    String name,
    FieldType type,
    boolean nullable,
    @Nullable Object defaultValue,
    boolean unique,
    boolean primaryKey) {

  public boolean hasDefault() {
    return defaultValue != null;
  }
}
