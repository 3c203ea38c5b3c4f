package com.autoorm.schema;

import com.autoorm.exceptions.SchemaException;
import com.autoorm.exceptions.UnknownFieldException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * Declarative model discovery from Java record classes.
 *
 * <p>A record such as
 *
 * <pre>
 * record User(&#64;Field(unique = true) String name, int age, &#64;Field(defaultValue = "active") String status) {}
 * </pre>
 *
 * becomes the model {@code users} with a required {@code integer} field {@code age}, a nullable
 * unique {@code text} field {@code name}, a {@code status} field defaulting to {@code "active"}
 * and an implicit {@code id} identifier. The registry only ever sees the resulting {@link
 * ModelDefinition}; it never inspects classes itself.
 */
public final class ModelClasses {

  private static final ImmutableMap<Class<?>, FieldType> COMPONENT_TYPES =
      ImmutableMap.<Class<?>, FieldType>builder()
          .put(long.class, FieldType.INTEGER)
          .put(Long.class, FieldType.INTEGER)
          .put(int.class, FieldType.INTEGER)
          .put(Integer.class, FieldType.INTEGER)
          .put(short.class, FieldType.INTEGER)
          .put(Short.class, FieldType.INTEGER)
          .put(byte.class, FieldType.INTEGER)
          .put(Byte.class, FieldType.INTEGER)
          .put(double.class, FieldType.FLOAT)
          .put(Double.class, FieldType.FLOAT)
          .put(float.class, FieldType.FLOAT)
          .put(Float.class, FieldType.FLOAT)
          .put(String.class, FieldType.TEXT)
          .put(boolean.class, FieldType.BOOLEAN)
          .put(Boolean.class, FieldType.BOOLEAN)
          .put(Instant.class, FieldType.TIMESTAMP)
          .buildOrThrow();

  private ModelClasses() {
    // Utility class
  }

  /** Derives model definitions for several record classes, in order. */
  @Nonnull
  public static List<ModelDefinition> definitionsOf(
      Iterable<Class<? extends java.lang.Record>> recordClasses) {
    ImmutableList.Builder<ModelDefinition> definitions = ImmutableList.builder();
    for (Class<? extends java.lang.Record> recordClass : recordClasses) {
      definitions.add(definitionOf(recordClass));
    }
    return definitions.build();
  }

  /**
   * Derives the model definition of a record class.
   *
   * @throws SchemaException if a component has a type with no field type counterpart, or an
   *     annotated default cannot be parsed
   */
  @Nonnull
  public static ModelDefinition definitionOf(Class<? extends java.lang.Record> recordClass) {
    String modelName = modelNameOf(recordClass);
    List<FieldDefinition> fields = new ArrayList<>();
    for (RecordComponent component : recordClass.getRecordComponents()) {
      fields.add(fieldOf(modelName, component));
    }
    return new ModelDefinition(modelName, fields);
  }

  /**
   * Returns the model name for a class: its {@link Model} annotation if present, otherwise the
   * lower-cased simple name in plural form ({@code User -> users}, {@code Company -> companies},
   * {@code Class -> classes}).
   */
  @Nonnull
  public static String modelNameOf(Class<?> modelClass) {
    Model model = modelClass.getAnnotation(Model.class);
    if (model != null) {
      return model.value();
    }
    return pluralize(modelClass.getSimpleName().toLowerCase(Locale.ROOT));
  }

  static String pluralize(String name) {
    if (name.endsWith("y")) {
      return name.substring(0, name.length() - 1) + "ies";
    }
    if (name.endsWith("s")) {
      return name + "es";
    }
    return name + "s";
  }

  private static FieldDefinition fieldOf(String modelName, RecordComponent component) {
    Class<?> javaType = component.getType();
    FieldType type = COMPONENT_TYPES.get(javaType);
    if (type == null) {
      throw new SchemaException(
          "Component '" + component.getName() + "' of model '" + modelName
              + "' has unsupported type " + javaType.getName());
    }

    if (component.isAnnotationPresent(Id.class)) {
      if (type != FieldType.INTEGER) {
        throw new SchemaException(
            "Identifier component '" + component.getName() + "' of model '" + modelName
                + "' must be an integral type, not " + javaType.getName());
      }
      return FieldDefinition.primaryKey(component.getName());
    }

    Field field = component.getAnnotation(Field.class);
    boolean nullable = !javaType.isPrimitive() && (field == null || field.nullable());
    Object defaultValue = null;
    if (field != null && !field.defaultValue().isEmpty()) {
      defaultValue =
          type.decode(field.defaultValue())
              .orElseThrow(
                  () ->
                      new SchemaException(
                          "Default '" + field.defaultValue() + "' of component '"
                              + component.getName() + "' in model '" + modelName
                              + "' is not a valid " + type));
    }
    boolean unique = field != null && field.unique();
    return new FieldDefinition(
        component.getName(), type.tag(), nullable, defaultValue, unique, false);
  }

  /**
   * Builds an instance of a record class from canonical field values, matching record components
   * to fields by name.
   *
   * @param recordClass the record class to build
   * @param modelName the model the values belong to, used in error messages
   * @param values canonical field values keyed by field name
   * @throws UnknownFieldException if a component has no matching field
   * @throws IllegalArgumentException if a value cannot be assigned to its component
   */
  @Nonnull
  public static <R extends java.lang.Record> R instantiate(
      Class<R> recordClass, String modelName, Map<String, Object> values) {
    RecordComponent[] components = recordClass.getRecordComponents();
    Class<?>[] parameterTypes = new Class<?>[components.length];
    Object[] arguments = new Object[components.length];
    for (int i = 0; i < components.length; i++) {
      RecordComponent component = components[i];
      if (!values.containsKey(component.getName())) {
        throw new UnknownFieldException(modelName, component.getName());
      }
      parameterTypes[i] = component.getType();
      arguments[i] = toComponentValue(component, values.get(component.getName()));
    }
    try {
      Constructor<R> constructor = recordClass.getDeclaredConstructor(parameterTypes);
      constructor.setAccessible(true);
      return constructor.newInstance(arguments);
    } catch (InvocationTargetException e) {
      throw new IllegalArgumentException(
          "Constructor of " + recordClass.getName() + " rejected " + modelName + " values",
          e.getCause());
    } catch (ReflectiveOperationException e) {
      throw new IllegalArgumentException(
          "Cannot construct " + recordClass.getName() + " from " + modelName + " values", e);
    }
  }

  private static Object toComponentValue(RecordComponent component, Object value) {
    Class<?> target = component.getType();
    if (value == null) {
      if (target.isPrimitive()) {
        throw new IllegalArgumentException(
            "Component '" + component.getName() + "' is primitive but the value is null");
      }
      return null;
    }
    if (value instanceof Long) {
      long l = (Long) value;
      if (target == long.class || target == Long.class) {
        return l;
      }
      if (target == int.class || target == Integer.class) {
        return (int) checkRange(component, l, Integer.MIN_VALUE, Integer.MAX_VALUE);
      }
      if (target == short.class || target == Short.class) {
        return (short) checkRange(component, l, Short.MIN_VALUE, Short.MAX_VALUE);
      }
      if (target == byte.class || target == Byte.class) {
        return (byte) checkRange(component, l, Byte.MIN_VALUE, Byte.MAX_VALUE);
      }
    }
    if (value instanceof Double && (target == float.class || target == Float.class)) {
      double d = (Double) value;
      if (Math.abs(d) > Float.MAX_VALUE) {
        throw outOfRange(component, value);
      }
      return (float) d;
    }
    if (target == double.class && value instanceof Double
        || target == boolean.class && value instanceof Boolean
        || target.isInstance(value)) {
      return value;
    }
    throw new IllegalArgumentException(
        "Component '" + component.getName() + "' of type " + target.getName()
            + " cannot hold " + value.getClass().getSimpleName() + " '" + value + "'");
  }

  private static long checkRange(RecordComponent component, long value, long min, long max) {
    if (value < min || value > max) {
      throw outOfRange(component, value);
    }
    return value;
  }

  private static IllegalArgumentException outOfRange(RecordComponent component, Object value) {
    return new IllegalArgumentException(
        "Value " + value + " does not fit component '" + component.getName() + "' of type "
            + component.getType().getName());
  }
}
