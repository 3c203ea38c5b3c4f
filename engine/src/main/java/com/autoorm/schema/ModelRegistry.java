package com.autoorm.schema;

import com.autoorm.exceptions.SchemaException;
import com.autoorm.exceptions.UnknownModelException;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Holds the schemas of all known models, keyed by model name.
 *
 * <p>The mapping is an immutable map behind an {@link AtomicReference}. Lookups never lock, and a
 * {@link #load} either replaces the whole mapping or leaves the previous one untouched.
 */
public final class ModelRegistry {

  private final AtomicReference<ImmutableMap<String, ModelSchema>> schemas =
      new AtomicReference<>(ImmutableMap.of());

  /** Creates an empty registry. */
  public ModelRegistry() {}

  /** Creates a registry loaded with the given definitions. */
  public static ModelRegistry of(Iterable<ModelDefinition> definitions) {
    ModelRegistry registry = new ModelRegistry();
    registry.load(definitions);
    return registry;
  }

  /**
   * Validates every definition and replaces the registry's contents with the result.
   *
   * @param definitions the raw model definitions, typically from a discovery source
   * @throws SchemaException if any definition is invalid or two share a name; the previous
   *     contents are kept in that case
   */
  public void load(Iterable<ModelDefinition> definitions) {
    Map<String, ModelSchema> loaded = new LinkedHashMap<>();
    try {
      for (ModelDefinition definition : definitions) {
        ModelSchema schema = ModelSchema.fromDefinition(definition);
        if (loaded.putIfAbsent(schema.name(), schema) != null) {
          throw new SchemaException("Model '" + schema.name() + "' is defined more than once");
        }
      }
    } catch (SchemaException e) {
      Logger.warn("Rejected model definitions, keeping {} loaded models: {}",
          schemas.get().size(), e.getMessage());
      throw e;
    }
    schemas.set(ImmutableMap.copyOf(loaded));
    Logger.info("Loaded {} models: {}", loaded.size(), loaded.keySet());
  }

  /**
   * Returns the schema of the named model.
   *
   * @throws UnknownModelException if no model with that name is loaded
   */
  @Nonnull
  public ModelSchema resolve(String modelName) {
    ModelSchema schema = schemas.get().get(modelName);
    if (schema == null) {
      throw new UnknownModelException(modelName);
    }
    return schema;
  }

  @Nonnull
  public Optional<ModelSchema> find(String modelName) {
    return Optional.ofNullable(schemas.get().get(modelName));
  }

  @Nonnull
  public ImmutableSet<String> modelNames() {
    return schemas.get().keySet();
  }
}
