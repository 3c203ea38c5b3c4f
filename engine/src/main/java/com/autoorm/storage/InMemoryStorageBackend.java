package com.autoorm.storage;

import com.autoorm.common.status.Status;
import com.autoorm.common.status.StatusOr;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterators;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Reference {@link StorageBackend} that keeps everything in process memory.
 *
 * <p>Each {@code (namespace, model)} pair owns a table: a sorted map from identifier to an
 * unmodifiable copy of the record's values, plus a counter that hands out identifiers 1, 2, 3 and
 * so on, up to {@link Long#MAX_VALUE}. Every operation is a single operation on a concurrent map,
 * which makes it atomic per record.
 */
public final class InMemoryStorageBackend implements StorageBackend {

  private record TableKey(String namespace, String model) {}

  private static final class Table {
    final ConcurrentSkipListMap<Long, Map<String, Object>> rows = new ConcurrentSkipListMap<>();
    final AtomicLong lastId = new AtomicLong();
  }

  private final ConcurrentMap<TableKey, Table> tables = new ConcurrentHashMap<>();

  public InMemoryStorageBackend() {
    Logger.info("Using in-memory storage backend");
  }

  @Nonnull
  @Override
  public StatusOr<Long> insert(
      String namespace, String model, @Nullable Long requestedId, Map<String, Object> values) {
    Table table = tables.computeIfAbsent(new TableKey(namespace, model), key -> new Table());
    Map<String, Object> row = freeze(values);

    if (requestedId != null) {
      // Keep generated identifiers clear of ones the caller picked.
      table.lastId.accumulateAndGet(requestedId, Math::max);
      if (table.rows.putIfAbsent(requestedId, row) != null) {
        return StatusOr.ofStatus(
            Status.alreadyExists(
                "Record " + requestedId + " already exists in " + namespace + "." + model));
      }
      return StatusOr.ofValue(requestedId);
    }

    while (true) {
      long last = table.lastId.get();
      if (last == Long.MAX_VALUE) {
        return StatusOr.ofStatus(identifiersExhausted(namespace, model));
      }
      long id = last + 1;
      if (table.lastId.compareAndSet(last, id) && table.rows.putIfAbsent(id, row) == null) {
        return StatusOr.ofValue(id);
      }
    }
  }

  @Nonnull
  @Override
  public StatusOr<Optional<Map<String, Object>>> fetch(String namespace, String model, long id) {
    Table table = tables.get(new TableKey(namespace, model));
    if (table == null) {
      return StatusOr.ofValue(Optional.empty());
    }
    return StatusOr.ofValue(Optional.ofNullable(table.rows.get(id)).map(LinkedHashMap::new));
  }

  @Nonnull
  @Override
  public StatusOr<Map<String, Object>> update(
      String namespace, String model, long id, Map<String, Object> values) {
    Table table = tables.get(new TableKey(namespace, model));
    Map<String, Object> merged =
        table == null
            ? null
            : table.rows.computeIfPresent(
                id,
                (key, current) -> {
                  Map<String, Object> next = new LinkedHashMap<>(current);
                  next.putAll(values);
                  return Collections.unmodifiableMap(next);
                });
    if (merged == null) {
      return StatusOr.ofStatus(
          Status.notFound("Record " + id + " does not exist in " + namespace + "." + model));
    }
    return StatusOr.ofValue(new LinkedHashMap<>(merged));
  }

  @Nonnull
  @Override
  public StatusOr<Boolean> delete(String namespace, String model, long id) {
    Table table = tables.get(new TableKey(namespace, model));
    return StatusOr.ofValue(table != null && table.rows.remove(id) != null);
  }

  @Nonnull
  @Override
  public StatusOr<Iterable<StoredRecord>> scan(
      String namespace, String model, Predicate<? super StoredRecord> filter) {
    TableKey key = new TableKey(namespace, model);
    Iterable<StoredRecord> records =
        () -> {
          Table table = tables.get(key);
          if (table == null) {
            return Collections.emptyIterator();
          }
          return Iterators.filter(
              Iterators.transform(
                  table.rows.entrySet().iterator(),
                  entry -> new StoredRecord(entry.getKey(), new LinkedHashMap<>(entry.getValue()))),
              filter::test);
        };
    return StatusOr.ofValue(records);
  }

  @Nonnull
  @Override
  public StatusOr<Set<String>> namespaces() {
    ImmutableSet.Builder<String> namespaces = ImmutableSet.builder();
    for (TableKey key : tables.keySet()) {
      namespaces.add(key.namespace());
    }
    return StatusOr.ofValue(namespaces.build());
  }

  private static Status identifiersExhausted(String namespace, String model) {
    return Status.failedPrecondition(
        "No identifiers left in " + namespace + "." + model + ", the last one is "
            + Long.MAX_VALUE);
  }

  private static Map<String, Object> freeze(Map<String, Object> values) {
    return Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }
}
