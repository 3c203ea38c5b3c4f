package com.autoorm.storage.jdbc;

import com.autoorm.common.status.Status;
import com.autoorm.common.status.StatusOr;
import com.autoorm.exceptions.StorageException;
import com.autoorm.storage.StorageBackend;
import com.autoorm.storage.StoredRecord;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterators;
import com.google.common.io.Resources;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.sql.DataSource;
import org.tinylog.Logger;

/**
 * {@link StorageBackend} on top of PostgreSQL.
 *
 * <p>All records share the {@code autoorm_record} table, keyed by namespace, model and record id,
 * with the field values in a JSONB column. Identifier counters live in {@code autoorm_sequence} and
 * are advanced with a single upsert, so concurrent inserts never receive the same identifier.
 * Call {@link #initializeSchema()} once before first use.
 */
public final class JdbcStorageBackend implements StorageBackend {

  static final String SCHEMA_RESOURCE = "/db/schema.sql";

  private final DataSource dataSource;

  public JdbcStorageBackend(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  /** Creates the backend's tables if they do not exist yet. */
  @Nonnull
  public Status initializeSchema() {
    String ddl;
    try {
      ddl =
          Resources.toString(
              Resources.getResource(JdbcStorageBackend.class, SCHEMA_RESOURCE),
              StandardCharsets.UTF_8);
    } catch (IOException | IllegalArgumentException e) {
      return Status.internal("Failed to read " + SCHEMA_RESOURCE + ": " + e.getMessage(), e);
    }
    try (Connection conn = dataSource.getConnection();
        Statement stmt = conn.createStatement()) {
      stmt.execute(ddl);
      Logger.info("Initialized JDBC storage schema");
      return Status.ok();
    } catch (SQLException e) {
      Logger.error(e, "Failed to initialize JDBC storage schema: {}", e.getMessage());
      return Status.internal("Failed to initialize schema: " + e.getMessage(), e);
    }
  }

  @Nonnull
  @Override
  public StatusOr<Long> insert(
      String namespace, String model, @Nullable Long requestedId, Map<String, Object> values) {
    try (Connection conn = dataSource.getConnection()) {
      StatusOr<Long> idOr =
          requestedId == null
              ? nextId(conn, namespace, model)
              : reserveId(conn, namespace, model, requestedId);
      if (idOr.isNotOk()) {
        return idOr;
      }
      long id = idOr.getValue();

      String sql = """
          INSERT INTO autoorm_record (namespace, model, record_id, field_values)
          VALUES (?, ?, ?, ?)
          ON CONFLICT (namespace, model, record_id) DO NOTHING
          """;
      try (PreparedStatement stmt = conn.prepareStatement(sql)) {
        stmt.setString(1, namespace);
        stmt.setString(2, model);
        stmt.setLong(3, id);
        Status bound = JsonValues.setValuesParameter(stmt, 4, values);
        if (bound.isError()) {
          return StatusOr.ofStatus(bound);
        }
        if (stmt.executeUpdate() == 0) {
          return StatusOr.ofStatus(
              Status.alreadyExists(
                  "Record " + id + " already exists in " + namespace + "." + model));
        }
        return StatusOr.ofValue(id);
      }
    } catch (SQLException e) {
      Logger.error(e, "Insert into {}.{} failed: {}", namespace, model, e.getMessage());
      return StatusOr.ofException(e);
    }
  }

  @Nonnull
  @Override
  public StatusOr<Optional<Map<String, Object>>> fetch(String namespace, String model, long id) {
    String sql = """
        SELECT field_values
          FROM autoorm_record
         WHERE namespace = ? AND model = ? AND record_id = ?
        """;
    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, namespace);
      stmt.setString(2, model);
      stmt.setLong(3, id);
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return StatusOr.ofValue(Optional.empty());
        }
        return JsonValues.getValues(rs, "field_values").map(Optional::of);
      }
    } catch (SQLException e) {
      Logger.error(e, "Fetch of {}.{} {} failed: {}", namespace, model, id, e.getMessage());
      return StatusOr.ofException(e);
    }
  }

  @Nonnull
  @Override
  public StatusOr<Map<String, Object>> update(
      String namespace, String model, long id, Map<String, Object> values) {
    String select = """
        SELECT field_values
          FROM autoorm_record
         WHERE namespace = ? AND model = ? AND record_id = ?
           FOR UPDATE
        """;
    String update = """
        UPDATE autoorm_record
           SET field_values = ?
         WHERE namespace = ? AND model = ? AND record_id = ?
        """;
    try (Connection conn = dataSource.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        Map<String, Object> merged;
        try (PreparedStatement stmt = conn.prepareStatement(select)) {
          stmt.setString(1, namespace);
          stmt.setString(2, model);
          stmt.setLong(3, id);
          try (ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
              conn.rollback();
              return StatusOr.ofStatus(
                  Status.notFound(
                      "Record " + id + " does not exist in " + namespace + "." + model));
            }
            StatusOr<Map<String, Object>> currentOr = JsonValues.getValues(rs, "field_values");
            if (currentOr.isNotOk()) {
              conn.rollback();
              return currentOr;
            }
            merged = new LinkedHashMap<>(currentOr.getValue());
            merged.putAll(values);
          }
        }
        try (PreparedStatement stmt = conn.prepareStatement(update)) {
          Status bound = JsonValues.setValuesParameter(stmt, 1, merged);
          if (bound.isError()) {
            conn.rollback();
            return StatusOr.ofStatus(bound);
          }
          stmt.setString(2, namespace);
          stmt.setString(3, model);
          stmt.setLong(4, id);
          stmt.executeUpdate();
        }
        conn.commit();
        // Hand back what a fetch would return, not the caller's objects.
        return JsonValues.toJson(merged).flatMap(JsonValues::fromJson);
      } catch (SQLException e) {
        conn.rollback();
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      Logger.error(e, "Update of {}.{} {} failed: {}", namespace, model, id, e.getMessage());
      return StatusOr.ofException(e);
    }
  }

  @Nonnull
  @Override
  public StatusOr<Boolean> delete(String namespace, String model, long id) {
    String sql = """
        DELETE FROM autoorm_record
         WHERE namespace = ? AND model = ? AND record_id = ?
        """;
    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, namespace);
      stmt.setString(2, model);
      stmt.setLong(3, id);
      return StatusOr.ofValue(stmt.executeUpdate() > 0);
    } catch (SQLException e) {
      Logger.error(e, "Delete of {}.{} {} failed: {}", namespace, model, id, e.getMessage());
      return StatusOr.ofException(e);
    }
  }

  /**
   * {@inheritDoc}
   *
   * <p>Each iteration runs one query and filters its rows in memory. A failing query surfaces as a
   * {@link StorageException} from {@link Iterable#iterator()}.
   */
  @Nonnull
  @Override
  public StatusOr<Iterable<StoredRecord>> scan(
      String namespace, String model, Predicate<? super StoredRecord> filter) {
    Iterable<StoredRecord> records =
        () -> {
          StatusOr<List<StoredRecord>> rowsOr = loadAll(namespace, model);
          if (rowsOr.isNotOk()) {
            throw new StorageException("Scan of " + namespace + "." + model, rowsOr.getStatus());
          }
          return Iterators.filter(rowsOr.getValue().iterator(), filter::test);
        };
    return StatusOr.ofValue(records);
  }

  @Nonnull
  @Override
  public StatusOr<Set<String>> namespaces() {
    String sql = "SELECT DISTINCT namespace FROM autoorm_record ORDER BY namespace";
    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(sql);
        ResultSet rs = stmt.executeQuery()) {
      ImmutableSet.Builder<String> namespaces = ImmutableSet.builder();
      while (rs.next()) {
        namespaces.add(rs.getString("namespace"));
      }
      return StatusOr.ofValue(namespaces.build());
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /** Closes the underlying pool if the data source is one that can be closed. */
  @Override
  public void close() {
    if (dataSource instanceof AutoCloseable) {
      try {
        ((AutoCloseable) dataSource).close();
        Logger.info("Closed JDBC storage data source");
      } catch (Exception e) {
        Logger.error(e, "Error closing data source: {}", e.getMessage());
      }
    }
  }

  private StatusOr<List<StoredRecord>> loadAll(String namespace, String model) {
    String sql = """
        SELECT record_id, field_values
          FROM autoorm_record
         WHERE namespace = ? AND model = ?
         ORDER BY record_id
        """;
    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, namespace);
      stmt.setString(2, model);
      try (ResultSet rs = stmt.executeQuery()) {
        List<StoredRecord> result = new ArrayList<>();
        while (rs.next()) {
          StatusOr<Map<String, Object>> valuesOr = JsonValues.getValues(rs, "field_values");
          if (valuesOr.isNotOk()) {
            return StatusOr.ofStatus(valuesOr.getStatus());
          }
          result.add(new StoredRecord(rs.getLong("record_id"), valuesOr.getValue()));
        }
        return StatusOr.ofValue(ImmutableList.copyOf(result));
      }
    } catch (SQLException e) {
      Logger.error(e, "Scan of {}.{} failed: {}", namespace, model, e.getMessage());
      return StatusOr.ofException(e);
    }
  }

  private static StatusOr<Long> nextId(Connection conn, String namespace, String model)
      throws SQLException {
    String sql = """
        INSERT INTO autoorm_sequence (namespace, model, last_id)
        VALUES (?, ?, 1)
        ON CONFLICT (namespace, model)
        DO UPDATE SET last_id = autoorm_sequence.last_id + 1
        WHERE autoorm_sequence.last_id < ?
        RETURNING last_id
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, namespace);
      stmt.setString(2, model);
      stmt.setLong(3, Long.MAX_VALUE);
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          // The guarded upsert updates nothing once last_id reaches the top of the range.
          return StatusOr.ofStatus(
              Status.failedPrecondition(
                  "No identifiers left in " + namespace + "." + model + ", the last one is "
                      + Long.MAX_VALUE));
        }
        return StatusOr.ofValue(rs.getLong("last_id"));
      }
    }
  }

  private static StatusOr<Long> reserveId(
      Connection conn, String namespace, String model, long requestedId) throws SQLException {
    String sql = """
        INSERT INTO autoorm_sequence (namespace, model, last_id)
        VALUES (?, ?, ?)
        ON CONFLICT (namespace, model)
        DO UPDATE SET last_id = GREATEST(autoorm_sequence.last_id, excluded.last_id)
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, namespace);
      stmt.setString(2, model);
      stmt.setLong(3, requestedId);
      stmt.executeUpdate();
      return StatusOr.ofValue(requestedId);
    }
  }
}
