package com.autoorm.engine;

import com.autoorm.exceptions.NotFoundException;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * A {@link DataEngine} bound to one namespace.
 *
 * <p>Unlike {@link DataEngine#use}, a view never changes its namespace, so it can be shared between
 * threads. Operations behave exactly as their {@link DataEngine} counterparts.
 */
public final class Database {

  private final DataEngine engine;
  private final String namespace;

  Database(DataEngine engine, String namespace) {
    this.engine = engine;
    this.namespace = namespace;
  }

  @Nonnull
  public String namespace() {
    return namespace;
  }

  @Nonnull
  public DataRecord create(String model, Map<String, ?> values) {
    return engine.create(namespace, model, values);
  }

  @Nonnull
  public Optional<DataRecord> get(String model, long id) {
    return engine.get(namespace, model, id);
  }

  /**
   * Changes some fields of a record.
   *
   * @throws NotFoundException if there is no record with that identifier
   */
  @Nonnull
  public DataRecord update(String model, long id, Map<String, ?> values) {
    return engine.update(namespace, model, id, values);
  }

  public boolean delete(String model, long id) {
    return engine.delete(namespace, model, id);
  }

  @Nonnull
  public RecordSequence query(String model) {
    return engine.query(namespace, model, Query.all());
  }

  @Nonnull
  public RecordSequence query(String model, Filter filter) {
    return engine.query(namespace, model, Query.of(filter));
  }

  @Nonnull
  public RecordSequence query(String model, Query query) {
    return engine.query(namespace, model, query);
  }

  @Override
  public String toString() {
    return "Database[" + namespace + "]";
  }
}
