package com.autoorm.storage.jdbc;

import static org.junit.jupiter.api.Assertions.*;

import com.autoorm.common.status.Status;
import com.autoorm.storage.StorageBackend;
import com.autoorm.storage.StorageBackendContractTest;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/** Runs the backend contract against PostgreSQL. Skipped when Docker is not available. */
@Testcontainers(disabledWithoutDocker = true)
public class JdbcStorageBackendTest extends StorageBackendContractTest {

  @Container
  private static final PostgreSQLContainer<?> postgres =
      PostgresTestHelper.createPostgresContainer("autoorm_backend_test");

  @Override
  protected StorageBackend createBackend() throws Exception {
    HikariDataSource dataSource = PostgresTestHelper.createDataSource(postgres);
    JdbcStorageBackend jdbc = new JdbcStorageBackend(dataSource);
    Status schema = jdbc.initializeSchema();
    assertTrue(schema.isOk(), () -> "Schema setup failed: " + schema);
    PostgresTestHelper.truncate(dataSource);
    return jdbc;
  }

  @Test
  void testInitializeSchema_IsIdempotent() {
    assertTrue(((JdbcStorageBackend) backend).initializeSchema().isOk());
    assertTrue(((JdbcStorageBackend) backend).initializeSchema().isOk());
  }

  @Test
  void testValues_RoundTripThroughJsonb() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("title", "Quarterly report");
    values.put("pages", 12L);
    values.put("ratio", 0.75);
    values.put("draft", true);
    values.put("due", Instant.parse("2024-05-01T10:15:30Z"));
    values.put("notes", null);

    long id = backend.insert("docs", "reports", null, values).getValue();
    Map<String, Object> fetched = backend.fetch("docs", "reports", id).getValue().get();

    assertEquals("Quarterly report", fetched.get("title"));
    assertEquals(12L, fetched.get("pages"));
    assertEquals(0.75, fetched.get("ratio"));
    assertEquals(true, fetched.get("draft"));
    // Timestamps come back in their stored text form.
    assertEquals("2024-05-01T10:15:30Z", fetched.get("due"));
    assertTrue(fetched.containsKey("notes"));
    assertNull(fetched.get("notes"));
  }
}
