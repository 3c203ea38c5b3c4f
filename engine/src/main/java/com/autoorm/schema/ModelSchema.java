package com.autoorm.schema;

import com.autoorm.exceptions.SchemaException;
import com.autoorm.exceptions.UnknownFieldException;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * The validated, immutable description of one model: its name and its fields in declaration
 * order. Exactly one field is the identifier.
 */
public final class ModelSchema {

  /** Name of the identifier field added when a definition does not declare one. */
  public static final String DEFAULT_ID_FIELD = "id";

  private final String name;
  private final ImmutableList<FieldSchema> fields;
  private final ImmutableMap<String, FieldSchema> fieldsByName;
  private final FieldSchema identifier;
  private final ImmutableList<FieldSchema> uniqueFields;

  private ModelSchema(String name, List<FieldSchema> fields) {
    this.name = name;
    this.fields = ImmutableList.copyOf(fields);
    ImmutableMap.Builder<String, FieldSchema> byName = ImmutableMap.builder();
    ImmutableList.Builder<FieldSchema> unique = ImmutableList.builder();
    FieldSchema id = null;
    for (FieldSchema field : fields) {
      byName.put(field.name(), field);
      if (field.primaryKey()) {
        id = field;
      }
      if (field.unique() && !field.primaryKey()) {
        unique.add(field);
      }
    }
    this.fieldsByName = byName.buildOrThrow();
    this.identifier = Objects.requireNonNull(id);
    this.uniqueFields = unique.build();
  }

  /**
   * Validates a raw definition into a schema.
   *
   * @throws SchemaException if the definition has a blank name, a blank or duplicate field name,
   *     an unsupported type, a default that does not fit its field, or an identifier that is
   *     duplicated, mistyped, nullable or clashes with the implicit {@code id} field
   */
  @Nonnull
  public static ModelSchema fromDefinition(ModelDefinition definition) {
    if (definition == null) {
      throw new SchemaException("Model definition must not be null");
    }
    String modelName = definition.name();
    if (modelName == null || modelName.isBlank()) {
      throw new SchemaException("Model definition has a blank name");
    }

    Map<String, FieldSchema> validated = new LinkedHashMap<>();
    List<String> primaryKeys = new ArrayList<>();
    for (FieldDefinition field : definition.fields()) {
      if (field == null) {
        throw new SchemaException("Model '" + modelName + "' contains a null field definition");
      }
      FieldSchema schema = validateField(modelName, field);
      if (validated.containsKey(schema.name())) {
        throw new SchemaException(
            "Model '" + modelName + "' declares field '" + schema.name() + "' more than once");
      }
      validated.put(schema.name(), schema);
      if (schema.primaryKey()) {
        primaryKeys.add(schema.name());
      }
    }

    if (primaryKeys.size() > 1) {
      throw new SchemaException(
          "Model '" + modelName + "' declares more than one identifier field: " + primaryKeys);
    }

    List<FieldSchema> fields = new ArrayList<>(validated.values());
    if (primaryKeys.isEmpty()) {
      if (validated.containsKey(DEFAULT_ID_FIELD)) {
        throw new SchemaException(
            "Model '" + modelName + "' has a field named '" + DEFAULT_ID_FIELD
                + "' that is not marked as the identifier");
      }
      fields.add(
          0, new FieldSchema(DEFAULT_ID_FIELD, FieldType.IDENTIFIER, false, null, false, true));
    }
    return new ModelSchema(modelName, fields);
  }

  private static FieldSchema validateField(String modelName, FieldDefinition field) {
    String fieldName = field.name();
    if (fieldName == null || fieldName.isBlank()) {
      throw new SchemaException("Model '" + modelName + "' has a field with a blank name");
    }
    FieldType type =
        FieldType.fromTag(field.type())
            .orElseThrow(
                () ->
                    new SchemaException(
                        "Field '" + fieldName + "' of model '" + modelName
                            + "' declares unsupported type '" + field.type() + "'"));

    if (field.primaryKey()) {
      if (type != FieldType.IDENTIFIER) {
        throw new SchemaException(
            "Identifier field '" + fieldName + "' of model '" + modelName
                + "' must have type 'identifier', not '" + type + "'");
      }
      if (field.nullable() || field.defaultValue() != null) {
        throw new SchemaException(
            "Identifier field '" + fieldName + "' of model '" + modelName
                + "' cannot be nullable or have a default");
      }
    }

    Object defaultValue = null;
    if (field.defaultValue() != null) {
      defaultValue =
          type.coerce(field.defaultValue())
              .orElseThrow(
                  () ->
                      new SchemaException(
                          "Default '" + field.defaultValue() + "' of field '" + fieldName
                              + "' in model '" + modelName + "' is not a valid " + type));
    }
    return new FieldSchema(
        fieldName, type, field.nullable(), defaultValue, field.unique(), field.primaryKey());
  }

  @Nonnull
  public String name() {
    return name;
  }

  /** Returns all fields in declaration order, the identifier included. */
  @Nonnull
  public ImmutableList<FieldSchema> fields() {
    return fields;
  }

  @Nonnull
  public Optional<FieldSchema> field(String fieldName) {
    return Optional.ofNullable(fieldsByName.get(fieldName));
  }

  /**
   * Returns the named field.
   *
   * @throws UnknownFieldException if the model has no such field
   */
  @Nonnull
  public FieldSchema requireField(String fieldName) {
    FieldSchema field = fieldsByName.get(fieldName);
    if (field == null) {
      throw new UnknownFieldException(name, fieldName);
    }
    return field;
  }

  @Nonnull
  public FieldSchema identifier() {
    return identifier;
  }

  @Nonnull
  public ImmutableList<FieldSchema> uniqueFields() {
    return uniqueFields;
  }

  public boolean hasUniqueFields() {
    return !uniqueFields.isEmpty();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    ModelSchema other = (ModelSchema) obj;
    return name.equals(other.name) && fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, fields);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("name", name).add("fields", fields).toString();
  }
}
