package com.autoorm.storage.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/** Sets up PostgreSQL test containers and pooled data sources for JDBC backend tests. */
public class PostgresTestHelper {

  /**
   * Creates a PostgreSQL container. The backend creates its own tables, so no init script is
   * needed.
   *
   * @param databaseName the name to use for the test database
   */
  public static PostgreSQLContainer<?> createPostgresContainer(String databaseName) {
    return new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
        .withDatabaseName(databaseName)
        .withUsername("autoorm")
        .withPassword("autoorm");
  }

  /** Creates a small connection pool against a running container. */
  public static HikariDataSource createDataSource(PostgreSQLContainer<?> container) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(container.getJdbcUrl());
    config.setUsername(container.getUsername());
    config.setPassword(container.getPassword());
    config.setMaximumPoolSize(4);
    config.setPoolName("AutoOrmTestPool");
    return new HikariDataSource(config);
  }

  /** Removes all records and identifier counters so each test starts from an empty store. */
  public static void truncate(HikariDataSource dataSource) throws SQLException {
    try (Connection conn = dataSource.getConnection();
        Statement stmt = conn.createStatement()) {
      stmt.execute("TRUNCATE autoorm_record, autoorm_sequence");
    }
  }
}
