package com.autoorm.storage;

import com.autoorm.common.status.StatusOr;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The persistence contract every storage implementation satisfies.
 *
 * <p>All operations are scoped to a namespace (a logical database) and a model name. Namespaces
 * and models spring into existence on first insert. Schema rules are the engine's job; a backend
 * only guarantees that identifiers are unique within a {@code (namespace, model)} pair.
 *
 * <p>Expected outcomes are reported through the returned {@link StatusOr}:
 *
 * <ul>
 *   <li>{@code ALREADY_EXISTS} from {@link #insert} when the identifier is taken
 *   <li>{@code NOT_FOUND} from {@link #update} when the identifier does not exist
 *   <li>{@code INTERNAL} for storage faults
 * </ul>
 *
 * <p>A missing record is not an error for {@link #fetch} or {@link #delete}.
 *
 * <p>Each call is atomic per record: a concurrent {@link #fetch} never observes a half-applied
 * insert or update. Calls complete synchronously; when one returns, the write is as durable as
 * the implementation promises. Value maps passed in are copied, and maps handed out are copies, so
 * no caller can mutate stored state by reference.
 */
public interface StorageBackend extends AutoCloseable {

  /**
   * Stores a new record.
   *
   * @param requestedId the identifier to store under, or null to have the backend assign the next
   *     one
   * @param values field values, without the identifier
   * @return the identifier the record was stored under
   */
  @Nonnull
  StatusOr<Long> insert(
      String namespace, String model, @Nullable Long requestedId, Map<String, Object> values);

  /** Returns the stored values of a record, or an empty Optional if there is none. */
  @Nonnull
  StatusOr<Optional<Map<String, Object>>> fetch(String namespace, String model, long id);

  /**
   * Merges {@code values} into an existing record.
   *
   * @return the full set of values after the merge
   */
  @Nonnull
  StatusOr<Map<String, Object>> update(
      String namespace, String model, long id, Map<String, Object> values);

  /**
   * Removes a record.
   *
   * @return true if a record existed and was removed, false if there was nothing to remove
   */
  @Nonnull
  StatusOr<Boolean> delete(String namespace, String model, long id);

  /**
   * Returns the records of a model that match {@code filter}, in ascending identifier order.
   *
   * <p>The result is lazy: nothing is read until iteration starts. It is restartable: each call to
   * {@link Iterable#iterator()} reads the store again. Items reflect the store as of the moment
   * they are read; there is no snapshot across the whole sequence.
   */
  @Nonnull
  StatusOr<Iterable<StoredRecord>> scan(
      String namespace, String model, Predicate<? super StoredRecord> filter);

  /** Returns the namespaces that currently hold at least one model's data. */
  @Nonnull
  StatusOr<Set<String>> namespaces();

  /** Releases any resources held by the backend. */
  @Override
  default void close() {}
}
