package com.autoorm.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Settings for building a data engine and its storage backend.
 *
 * @param backend which storage backend to use
 * @param defaultNamespace the namespace operations use until {@code use} picks another one
 * @param dbUrl JDBC URL, required for {@link BackendKind#JDBC}
 * @param dbUser database user name
 * @param dbPassword database password
 * @param dbPoolSize maximum size of the JDBC connection pool
 */
public record EngineConfig(
    BackendKind backend,
    String defaultNamespace,
    @Nullable String dbUrl,
    @Nullable String dbUser,
    @Nullable String dbPassword,
    int dbPoolSize) {

  public static final String DEFAULT_NAMESPACE = "default";
  public static final int DEFAULT_POOL_SIZE = 10;

  /** The storage backends the engine can be configured with. */
  public enum BackendKind {
    MEMORY,
    JDBC
  }

  public EngineConfig {
    if (backend == null) {
      throw new IllegalArgumentException("backend must be set");
    }
    if (Strings.isNullOrEmpty(defaultNamespace)) {
      throw new IllegalArgumentException("defaultNamespace must not be empty");
    }
    if (backend == BackendKind.JDBC && Strings.isNullOrEmpty(dbUrl)) {
      throw new IllegalArgumentException("DB_URL is required for the jdbc backend");
    }
    if (dbPoolSize <= 0) {
      throw new IllegalArgumentException("dbPoolSize must be positive, got " + dbPoolSize);
    }
  }

  /** An in-memory configuration using the default namespace. */
  public static EngineConfig inMemory() {
    return new EngineConfig(BackendKind.MEMORY, DEFAULT_NAMESPACE, null, null, null,
        DEFAULT_POOL_SIZE);
  }

  /** Reads the configuration from the process environment. */
  public static EngineConfig fromEnvironment() {
    return fromMap(System.getenv());
  }

  /**
   * Reads the configuration from environment-style variables.
   *
   * <ul>
   *   <li>{@code AUTOORM_BACKEND}: {@code memory} (default) or {@code jdbc}
   *   <li>{@code AUTOORM_DEFAULT_NAMESPACE}: defaults to {@value #DEFAULT_NAMESPACE}
   *   <li>{@code DB_URL}, {@code DB_USER}, {@code DB_PASSWORD}: JDBC connection settings
   *   <li>{@code DB_POOL_SIZE}: defaults to {@value #DEFAULT_POOL_SIZE}
   * </ul>
   *
   * @throws IllegalArgumentException if a variable has an unusable value
   */
  public static EngineConfig fromMap(Map<String, String> env) {
    String backendName = Strings.nullToEmpty(env.get("AUTOORM_BACKEND")).trim();
    BackendKind backend;
    try {
      backend =
          backendName.isEmpty()
              ? BackendKind.MEMORY
              : BackendKind.valueOf(backendName.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unsupported AUTOORM_BACKEND '" + backendName + "'", e);
    }

    String namespace = env.get("AUTOORM_DEFAULT_NAMESPACE");
    String poolSize = env.get("DB_POOL_SIZE");
    int dbPoolSize;
    try {
      dbPoolSize = Strings.isNullOrEmpty(poolSize) ? DEFAULT_POOL_SIZE : Integer.parseInt(poolSize);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("DB_POOL_SIZE must be a number, got '" + poolSize + "'", e);
    }

    return new EngineConfig(
        backend,
        Strings.isNullOrEmpty(namespace) ? DEFAULT_NAMESPACE : namespace,
        env.get("DB_URL"),
        env.get("DB_USER"),
        env.get("DB_PASSWORD"),
        dbPoolSize);
  }

  /** Returns a string representation of this configuration that leaves out the password. */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("backend", backend)
        .add("defaultNamespace", defaultNamespace)
        .add("dbUrl", dbUrl)
        .add("dbUser", dbUser)
        .add("dbPoolSize", dbPoolSize)
        .omitNullValues()
        .toString();
  }
}
