package com.autoorm.engine;

import com.autoorm.exceptions.MissingFieldException;
import com.autoorm.exceptions.TypeMismatchException;
import com.autoorm.exceptions.ValidationException;
import com.autoorm.schema.FieldSchema;
import com.autoorm.schema.FieldType;
import com.autoorm.schema.ModelSchema;
import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Checks caller input against a {@link ModelSchema} and converts it to canonical values. Nothing
 * here touches storage, so a rejected write has no side effects.
 */
final class RecordValidator {

  /**
   * Field values ready for insertion.
   *
   * @param requestedId the identifier the caller asked for, or null to have one assigned
   * @param values every non-identifier field, in declaration order
   */
  record CreateValues(@Nullable Long requestedId, Map<String, Object> values) {}

  private RecordValidator() {}

  static CreateValues forCreate(ModelSchema schema, Map<String, ?> input) {
    rejectUnknownFields(schema, input);

    FieldSchema identifier = schema.identifier();
    Long requestedId = null;
    Object rawId = input.get(identifier.name());
    if (rawId != null) {
      requestedId = (Long) coerce(schema, identifier, rawId);
    }

    Map<String, Object> values = new LinkedHashMap<>();
    for (FieldSchema field : schema.fields()) {
      if (field.primaryKey()) {
        continue;
      }
      Object raw = input.get(field.name());
      if (raw != null) {
        values.put(field.name(), coerce(schema, field, raw));
      } else if (field.hasDefault()) {
        values.put(field.name(), field.defaultValue());
      } else if (field.nullable()) {
        values.put(field.name(), null);
      } else {
        throw new MissingFieldException(schema.name(), field.name());
      }
    }
    return new CreateValues(requestedId, values);
  }

  /** Validates a partial update. Only the supplied fields are checked and returned. */
  static Map<String, Object> forUpdate(ModelSchema schema, long id, Map<String, ?> input) {
    rejectUnknownFields(schema, input);

    Map<String, Object> values = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : input.entrySet()) {
      FieldSchema field = schema.requireField(entry.getKey());
      Object raw = entry.getValue();
      if (field.primaryKey()) {
        if (raw == null || !coerce(schema, field, raw).equals(id)) {
          throw new ValidationException(
              schema.name(),
              field.name(),
              "Identifier '" + field.name() + "' of model '" + schema.name()
                  + "' cannot be changed (record " + id + ")");
        }
        continue;
      }
      if (raw == null) {
        if (!field.nullable()) {
          throw new MissingFieldException(schema.name(), field.name());
        }
        values.put(field.name(), null);
      } else {
        values.put(field.name(), coerce(schema, field, raw));
      }
    }
    return values;
  }

  /**
   * Converts a filter operand to the canonical type of its field. {@link Operator#IN} takes a
   * collection whose elements are each converted; range operators reject null.
   */
  @Nullable
  static Object forCondition(ModelSchema schema, Condition condition) {
    FieldSchema field = schema.requireField(condition.field());
    Object operand = condition.value();
    switch (condition.operator()) {
      case EQUALS:
      case NOT_EQUALS:
        return operand == null ? null : coerce(schema, field, operand);
      case GREATER_THAN:
      case LESS_THAN:
        if (operand == null) {
          throw new ValidationException(
              schema.name(), field.name(), "Condition '" + condition + "' has no value to compare");
        }
        return coerce(schema, field, operand);
      case IN:
        if (!(operand instanceof Collection)) {
          throw new TypeMismatchException(
              schema.name(), field.name(), "a collection of " + field.type(), operand);
        }
        ImmutableList.Builder<Object> elements = ImmutableList.builder();
        for (Object element : (Collection<?>) operand) {
          if (element == null) {
            throw new ValidationException(
                schema.name(), field.name(), "Condition '" + condition + "' contains null");
          }
          elements.add(coerce(schema, field, element));
        }
        return elements.build();
      default:
        throw new AssertionError("Unhandled operator " + condition.operator());
    }
  }

  private static void rejectUnknownFields(ModelSchema schema, Map<String, ?> input) {
    for (String name : input.keySet()) {
      schema.requireField(name);
    }
  }

  private static Object coerce(ModelSchema schema, FieldSchema field, Object raw) {
    FieldType type = field.type();
    return type.coerce(raw)
        .orElseThrow(
            () -> new TypeMismatchException(schema.name(), field.name(), type.tag(), raw));
  }
}
