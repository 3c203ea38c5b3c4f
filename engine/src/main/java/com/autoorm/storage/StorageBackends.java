package com.autoorm.storage;

import com.autoorm.common.status.Status;
import com.autoorm.config.EngineConfig;
import com.autoorm.exceptions.StorageException;
import com.autoorm.storage.jdbc.JdbcStorageBackend;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/** Builds the storage backend an {@link EngineConfig} asks for. */
public final class StorageBackends {

  private StorageBackends() {
    // Utility class
  }

  /**
   * Creates and initializes the configured backend.
   *
   * @throws StorageException if the JDBC backend cannot create its tables
   */
  @Nonnull
  public static StorageBackend create(EngineConfig config) {
    switch (config.backend()) {
      case MEMORY:
        return new InMemoryStorageBackend();
      case JDBC:
        return createJdbc(config);
      default:
        throw new IllegalArgumentException("Unsupported backend " + config.backend());
    }
  }

  private static JdbcStorageBackend createJdbc(EngineConfig config) {
    HikariDataSource dataSource = createDataSource(config);
    JdbcStorageBackend backend = new JdbcStorageBackend(dataSource);
    Status schemaStatus = backend.initializeSchema();
    if (schemaStatus.isError()) {
      backend.close();
      throw new StorageException("Initializing JDBC storage", schemaStatus);
    }
    return backend;
  }

  static HikariDataSource createDataSource(EngineConfig config) {
    HikariConfig hikari = new HikariConfig();
    hikari.setJdbcUrl(config.dbUrl());
    hikari.setUsername(config.dbUser());
    hikari.setPassword(config.dbPassword());
    hikari.setMaximumPoolSize(config.dbPoolSize());
    hikari.setMinimumIdle(Math.min(2, config.dbPoolSize()));
    hikari.setIdleTimeout(30000);
    hikari.setMaxLifetime(1800000);
    hikari.setConnectionTimeout(30000);
    hikari.setAutoCommit(true);
    hikari.setPoolName("AutoOrmPool");
    hikari.addDataSourceProperty("cachePrepStmts", "true");
    hikari.addDataSourceProperty("prepStmtCacheSize", "250");
    hikari.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");

    Logger.info("Initializing database connection pool with URL: {} and user {}",
        config.dbUrl(), config.dbUser());
    return new HikariDataSource(hikari);
  }
}
