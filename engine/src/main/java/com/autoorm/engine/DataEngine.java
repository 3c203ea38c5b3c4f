package com.autoorm.engine;

import com.autoorm.common.status.StatusCode;
import com.autoorm.common.status.StatusOr;
import com.autoorm.config.EngineConfig;
import com.autoorm.exceptions.DuplicateKeyException;
import com.autoorm.exceptions.NotFoundException;
import com.autoorm.exceptions.StorageException;
import com.autoorm.schema.FieldSchema;
import com.autoorm.schema.ModelDefinition;
import com.autoorm.schema.ModelRegistry;
import com.autoorm.schema.ModelSchema;
import com.autoorm.storage.StorageBackend;
import com.autoorm.storage.StorageBackends;
import com.autoorm.storage.StoredRecord;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Ordering;
import com.google.common.util.concurrent.Striped;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * The single entry point for reading and writing model records.
 *
 * <p>Every operation resolves the model's schema from the {@link ModelRegistry}, validates its
 * input against it and only then calls the {@link StorageBackend}, scoped to a namespace. Input
 * errors surface as {@link com.autoorm.exceptions.ValidationException}s before storage is touched.
 *
 * <pre>
 * DataEngine engine = new DataEngine(new DataEngine.Config(registry, new InMemoryStorageBackend(), "default"));
 * DataRecord alice = engine.use("crm").create("users", Map.of("name", "Alice", "age", 30));
 * for (DataRecord user : engine.query("users", Filter.where("age", Operator.GREATER_THAN, 20))) {
 *   ...
 * }
 * </pre>
 *
 * <p>The namespace chosen with {@link #use} is shared by every caller of this engine. Threads that
 * need their own namespace should work through {@link #in}, which returns an immutable view.
 *
 * <p>Writes to a model with unique fields are serialized per namespace and model, so two callers
 * of the same engine cannot both pass the uniqueness check for the same value. Separate engine
 * instances over one store do not coordinate.
 */
public final class DataEngine implements AutoCloseable {

  private static final Pattern NAMESPACE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /**
   * Collaborators of the engine.
   *
   * @param registry the schemas of all known models
   * @param backend where records are stored; closed together with the engine
   * @param defaultNamespace the namespace used until {@link #use} picks another one
   */
  public record Config(ModelRegistry registry, StorageBackend backend, String defaultNamespace) {
    public Config {
      Objects.requireNonNull(registry, "registry");
      Objects.requireNonNull(backend, "backend");
      checkNamespace(defaultNamespace);
    }
  }

  private final ModelRegistry registry;
  private final StorageBackend backend;
  private final Striped<Lock> writeLocks = Striped.lock(64);
  private volatile String namespace;

  public DataEngine(Config config) {
    this.registry = config.registry();
    this.backend = config.backend();
    this.namespace = config.defaultNamespace();
  }

  /**
   * Builds an engine with the backend named by {@code config}, loaded with {@code definitions}.
   *
   * @throws com.autoorm.exceptions.SchemaException if a definition is invalid
   * @throws StorageException if the backend cannot be initialized
   */
  @Nonnull
  public static DataEngine fromConfig(EngineConfig config, Iterable<ModelDefinition> definitions) {
    Logger.info("Starting data engine with {}", config.toSecureString());
    StorageBackend backend = StorageBackends.create(config);
    try {
      ModelRegistry registry = ModelRegistry.of(definitions);
      return new DataEngine(new Config(registry, backend, config.defaultNamespace()));
    } catch (RuntimeException e) {
      backend.close();
      throw e;
    }
  }

  /**
   * Makes {@code newNamespace} the active namespace for subsequent calls. Namespaces need not
   * exist beforehand.
   *
   * @return this engine, for chaining
   * @throws IllegalArgumentException if the name is not an identifier ({@code [A-Za-z_][A-Za-z0-9_]*})
   */
  @Nonnull
  public DataEngine use(String newNamespace) {
    checkNamespace(newNamespace);
    String previous = namespace;
    namespace = newNamespace;
    if (!previous.equals(newNamespace)) {
      Logger.info("Switched active namespace from {} to {}", previous, newNamespace);
    }
    return this;
  }

  @Nonnull
  public String currentNamespace() {
    return namespace;
  }

  /**
   * Returns a view of this engine bound to one namespace. The view is unaffected by later {@link
   * #use} calls.
   */
  @Nonnull
  public Database in(String viewNamespace) {
    checkNamespace(viewNamespace);
    return new Database(this, viewNamespace);
  }

  /**
   * Creates a record in the active namespace.
   *
   * <p>Absent fields take their default, or null if nullable. A value for the identifier field
   * stores the record under that identifier instead of the next generated one.
   *
   * @throws com.autoorm.exceptions.UnknownModelException if the model is not registered
   * @throws com.autoorm.exceptions.MissingFieldException if a required field has no value
   * @throws com.autoorm.exceptions.TypeMismatchException if a value does not fit its field
   * @throws com.autoorm.exceptions.UnknownFieldException if a key is not a field of the model
   * @throws DuplicateKeyException if a unique field or the identifier is already taken
   */
  @Nonnull
  public DataRecord create(String model, Map<String, ?> values) {
    return create(namespace, model, values);
  }

  /** Returns the record with the given identifier, or empty if there is none. */
  @Nonnull
  public Optional<DataRecord> get(String model, long id) {
    return get(namespace, model, id);
  }

  /**
   * Changes some fields of a record. Fields not in {@code values} keep their stored value. Setting
   * a field to null is allowed only if it is nullable.
   *
   * @throws NotFoundException if there is no record with that identifier
   * @throws com.autoorm.exceptions.ValidationException if the identifier would change
   * @throws DuplicateKeyException if a changed unique field collides with another record
   */
  @Nonnull
  public DataRecord update(String model, long id, Map<String, ?> values) {
    return update(namespace, model, id, values);
  }

  /**
   * Deletes a record.
   *
   * @return true if a record was removed, false if there was none
   */
  public boolean delete(String model, long id) {
    return delete(namespace, model, id);
  }

  /** Returns the records of a model, in identifier order. */
  @Nonnull
  public RecordSequence query(String model) {
    return query(namespace, model, Query.all());
  }

  /**
   * Returns the records matching {@code filter}, in identifier order. Filter values are checked
   * against their fields' types when this method is called; storage is read during iteration.
   */
  @Nonnull
  public RecordSequence query(String model, Filter filter) {
    return query(namespace, model, Query.of(filter));
  }

  /** Returns the records matching {@code query}, ordered, skipped and limited as it asks. */
  @Nonnull
  public RecordSequence query(String model, Query query) {
    return query(namespace, model, query);
  }

  /**
   * Replaces the registered models. On failure the previous models stay in place.
   *
   * @throws com.autoorm.exceptions.SchemaException if any definition is invalid
   */
  public void reload(Iterable<ModelDefinition> definitions) {
    registry.load(definitions);
  }

  @Nonnull
  public ModelRegistry registry() {
    return registry;
  }

  /** Returns the namespaces that currently hold data. */
  @Nonnull
  public Set<String> namespaces() {
    return unwrap(backend.namespaces(), "Listing namespaces");
  }

  @Override
  public void close() {
    backend.close();
    Logger.info("Closed data engine");
  }

  DataRecord create(String ns, String model, Map<String, ?> values) {
    ModelSchema schema = registry.resolve(model);
    Objects.requireNonNull(values, "values");
    RecordValidator.CreateValues validated = RecordValidator.forCreate(schema, values);
    Logger.debug("create {}.{}", ns, model);

    return withWriteLock(ns, schema, () -> {
      checkUnique(ns, schema, validated.values(), null);
      StatusOr<Long> idOr = backend.insert(ns, model, validated.requestedId(), validated.values());
      if (idOr.isNotOk()) {
        if (idOr.getStatus().getCode() == StatusCode.ALREADY_EXISTS) {
          throw new DuplicateKeyException(
              model, schema.identifier().name(), validated.requestedId());
        }
        throw new StorageException("Insert into " + ns + "." + model, idOr.getStatus());
      }
      return RecordConverter.toRecord(schema, idOr.getValue(), validated.values());
    });
  }

  Optional<DataRecord> get(String ns, String model, long id) {
    ModelSchema schema = registry.resolve(model);
    Logger.debug("get {}.{} {}", ns, model, id);
    Optional<Map<String, Object>> stored =
        unwrap(backend.fetch(ns, model, id), "Fetch from " + ns + "." + model);
    return stored.map(values -> RecordConverter.toRecord(schema, id, values));
  }

  DataRecord update(String ns, String model, long id, Map<String, ?> values) {
    ModelSchema schema = registry.resolve(model);
    Objects.requireNonNull(values, "values");
    Map<String, Object> changes = RecordValidator.forUpdate(schema, id, values);
    Logger.debug("update {}.{} {} fields {}", ns, model, id, changes.keySet());

    return withWriteLock(ns, schema, () -> {
      if (touchesUniqueField(schema, changes)) {
        Optional<Map<String, Object>> current =
            unwrap(backend.fetch(ns, model, id), "Fetch from " + ns + "." + model);
        if (current.isEmpty()) {
          throw new NotFoundException(model, id);
        }
        checkUnique(ns, schema, changes, id);
      }
      StatusOr<Map<String, Object>> mergedOr = backend.update(ns, model, id, changes);
      if (mergedOr.isNotOk()) {
        if (mergedOr.getStatus().getCode() == StatusCode.NOT_FOUND) {
          throw new NotFoundException(model, id);
        }
        throw new StorageException("Update of " + ns + "." + model, mergedOr.getStatus());
      }
      return RecordConverter.toRecord(schema, id, mergedOr.getValue());
    });
  }

  boolean delete(String ns, String model, long id) {
    registry.resolve(model);
    Logger.debug("delete {}.{} {}", ns, model, id);
    return unwrap(backend.delete(ns, model, id), "Delete from " + ns + "." + model);
  }

  RecordSequence query(String ns, String model, Query query) {
    ModelSchema schema = registry.resolve(model);
    Objects.requireNonNull(query, "query");
    Predicate<StoredRecord> predicate = RecordConverter.toPredicate(schema, query.getFilter());
    Optional<FieldSchema> orderField = query.getOrderField().map(schema::requireField);
    Logger.debug("query {}.{} {}", ns, model, query);

    Iterable<StoredRecord> scanned =
        unwrap(backend.scan(ns, model, predicate), "Scan of " + ns + "." + model);
    Iterable<DataRecord> records =
        Iterables.transform(scanned, stored -> RecordConverter.toRecord(schema, stored));

    if (orderField.isPresent()) {
      Ordering<DataRecord> ordering = orderingOn(orderField.get().name());
      Ordering<DataRecord> effective = query.isDescending() ? ordering.reverse() : ordering;
      Iterable<DataRecord> unsorted = records;
      records = () -> effective.sortedCopy(unsorted).iterator();
    }
    if (query.getOffset() > 0) {
      records = Iterables.skip(records, query.getOffset());
    }
    if (query.getLimit().isPresent()) {
      records = Iterables.limit(records, query.getLimit().get());
    }
    return new RecordSequence(records);
  }

  private <T> T withWriteLock(String ns, ModelSchema schema, Supplier<T> write) {
    if (!schema.hasUniqueFields()) {
      return write.get();
    }
    Lock lock = writeLocks.get(ImmutableList.of(ns, schema.name()));
    lock.lock();
    try {
      return write.get();
    } finally {
      lock.unlock();
    }
  }

  private void checkUnique(
      String ns, ModelSchema schema, Map<String, Object> candidate, @Nullable Long selfId) {
    for (FieldSchema field : schema.uniqueFields()) {
      Object value = candidate.get(field.name());
      if (value == null) {
        continue;
      }
      Predicate<StoredRecord> sameValue =
          RecordConverter.toPredicate(schema, Filter.where(field.name(), Operator.EQUALS, value));
      Predicate<StoredRecord> clash =
          selfId == null ? sameValue : sameValue.and(stored -> stored.id() != selfId);
      Iterable<StoredRecord> hits =
          unwrap(
              backend.scan(ns, schema.name(), clash),
              "Uniqueness check on " + ns + "." + schema.name());
      if (hits.iterator().hasNext()) {
        throw new DuplicateKeyException(schema.name(), field.name(), value);
      }
    }
  }

  private static boolean touchesUniqueField(ModelSchema schema, Map<String, Object> changes) {
    for (FieldSchema field : schema.uniqueFields()) {
      if (changes.get(field.name()) != null) {
        return true;
      }
    }
    return false;
  }

  @SuppressWarnings("unchecked")
  private static Ordering<DataRecord> orderingOn(String field) {
    Ordering<Comparable<Object>> natural = Ordering.<Comparable<Object>>natural().nullsFirst();
    return natural.onResultOf(record -> (Comparable<Object>) record.get(field));
  }

  private static <T> T unwrap(StatusOr<T> result, String context) {
    return result.orElseThrow(status -> new StorageException(context, status));
  }

  private static void checkNamespace(String candidate) {
    if (candidate == null || !NAMESPACE.matcher(candidate).matches()) {
      throw new IllegalArgumentException(
          "Namespace must match " + NAMESPACE.pattern() + ", got '" + candidate + "'");
    }
  }
}
