package com.autoorm.engine;

import static org.junit.jupiter.api.Assertions.*;

import com.autoorm.exceptions.DuplicateKeyException;
import com.autoorm.schema.FieldDefinition;
import com.autoorm.schema.FieldType;
import com.autoorm.schema.ModelDefinition;
import com.autoorm.schema.ModelRegistry;
import com.autoorm.storage.jdbc.JdbcStorageBackend;
import com.autoorm.storage.jdbc.PostgresTestHelper;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/** The engine over PostgreSQL: stored JSON values must come back with their schema types. */
@Testcontainers(disabledWithoutDocker = true)
public class DataEngineJdbcTest {

  @Container
  private static final PostgreSQLContainer<?> postgres =
      PostgresTestHelper.createPostgresContainer("autoorm_engine_test");

  private static final ModelDefinition EVENTS =
      ModelDefinition.of(
          "events",
          FieldDefinition.of("title", FieldType.TEXT).asUnique(),
          FieldDefinition.of("seats", FieldType.INTEGER),
          FieldDefinition.of("price", FieldType.FLOAT),
          FieldDefinition.of("public", FieldType.BOOLEAN).withDefault(true),
          FieldDefinition.of("starts", FieldType.TIMESTAMP));

  private DataEngine engine;

  @BeforeEach
  void setUp() throws Exception {
    HikariDataSource dataSource = PostgresTestHelper.createDataSource(postgres);
    JdbcStorageBackend backend = new JdbcStorageBackend(dataSource);
    assertTrue(backend.initializeSchema().isOk());
    PostgresTestHelper.truncate(dataSource);
    engine =
        new DataEngine(new DataEngine.Config(ModelRegistry.of(List.of(EVENTS)), backend, "main"));
  }

  @AfterEach
  void tearDown() {
    engine.close();
  }

  @Test
  void testCrudRoundTrip() {
    Instant starts = Instant.parse("2024-09-01T18:30:00Z");

    DataRecord created =
        engine.create(
            "events", Map.of("title", "Launch", "seats", 120, "price", 20, "starts", starts));
    DataRecord fetched = engine.get("events", created.id()).orElseThrow();

    assertEquals(created, fetched);
    assertEquals(20.0, fetched.getDouble("price"));
    assertEquals(true, fetched.getBoolean("public"));
    assertEquals(starts, fetched.getInstant("starts"));

    DataRecord updated = engine.update("events", created.id(), Map.of("seats", 150));
    assertEquals(150L, updated.getLong("seats"));
    assertEquals(starts, updated.getInstant("starts"));

    assertThrows(
        DuplicateKeyException.class,
        () ->
            engine.create(
                "events", Map.of("title", "Launch", "seats", 1, "price", 1.0, "starts", starts)));

    assertTrue(engine.delete("events", created.id()));
    assertFalse(engine.delete("events", created.id()));
  }

  @Test
  void testQueryAgainstStoredTimestamps() {
    engine.create(
        "events",
        Map.of("title", "Early", "seats", 10, "price", 5.5, "starts", Instant.parse("2024-01-01T09:00:00Z")));
    engine.create(
        "events",
        Map.of("title", "Late", "seats", 30, "price", 7.25, "starts", Instant.parse("2024-12-01T09:00:00Z")));

    List<DataRecord> afterJune =
        engine
            .query(
                "events",
                Filter.where("starts", Operator.GREATER_THAN, Instant.parse("2024-06-01T00:00:00Z")))
            .toList();

    assertEquals(1, afterJune.size());
    assertEquals("Late", afterJune.get(0).getString("title"));
    assertEquals(
        List.of("Late", "Early"),
        engine.query("events", Query.all().orderBy("-seats")).stream()
            .map(r -> r.getString("title"))
            .collect(Collectors.toList()));
  }
}
