/**
 * The storage layer: the {@link com.autoorm.storage.StorageBackend} contract and its
 * implementations.
 *
 * <p>Backends know nothing about schemas. They store maps of raw values per {@code (namespace,
 * model, id)} and report outcomes as {@code StatusOr}. Two implementations ship with the engine:
 *
 * <ul>
 *   <li>{@link com.autoorm.storage.InMemoryStorageBackend}, the reference backend
 *   <li>{@link com.autoorm.storage.jdbc.JdbcStorageBackend}, PostgreSQL with JSONB values
 * </ul>
 *
 * <p>{@link com.autoorm.storage.StorageBackends} picks one based on an {@code EngineConfig}.
 */
package com.autoorm.storage;
