package com.autoorm.storage.jdbc;

import com.autoorm.common.status.Status;
import com.autoorm.common.status.StatusOr;
import com.google.common.base.Strings;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import java.lang.reflect.Type;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * Converts record values to and from the JSONB column they are stored in.
 *
 * <p>Timestamps are written as ISO-8601 strings. Whole numbers come back as {@code Long} and other
 * numbers as {@code Double}; the engine decodes them against the schema.
 */
final class JsonValues {

  private static final Gson GSON =
      new GsonBuilder()
          .serializeNulls()
          .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
          .create();

  private static final Type MAP_TYPE = new TypeToken<LinkedHashMap<String, Object>>() {}.getType();

  private JsonValues() {
    // Utility class, no instances
  }

  /** Serializes a value map to a JSON object string. */
  @Nonnull
  static StatusOr<String> toJson(Map<String, Object> values) {
    if (values == null || values.isEmpty()) {
      return StatusOr.ofValue("{}");
    }
    Map<String, Object> json = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      json.put(entry.getKey(), toJsonValue(entry.getValue()));
    }
    try {
      return StatusOr.ofValue(GSON.toJson(json));
    } catch (RuntimeException e) {
      return StatusOr.ofStatus(
          Status.internal("Failed to serialize values to JSON: " + e.getMessage(), e));
    }
  }

  /** Parses a JSON object string into a value map. */
  @Nonnull
  static StatusOr<Map<String, Object>> fromJson(String json) {
    if (Strings.isNullOrEmpty(json)) {
      return StatusOr.ofValue(new LinkedHashMap<>());
    }
    try {
      Map<String, Object> values = GSON.fromJson(json, MAP_TYPE);
      return StatusOr.ofValue(values == null ? new LinkedHashMap<>() : values);
    } catch (JsonParseException e) {
      return StatusOr.ofStatus(Status.internal("Failed to parse JSON: " + e.getMessage(), e));
    }
  }

  /** Reads a JSONB column from the current row into a value map. */
  @Nonnull
  static StatusOr<Map<String, Object>> getValues(ResultSet rs, String columnName) {
    try {
      String json = rs.getString(columnName);
      return fromJson(rs.wasNull() ? null : json);
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to read JSONB: " + e.getMessage(), e));
    }
  }

  /** Binds a value map to a JSONB statement parameter. */
  @Nonnull
  static Status setValuesParameter(
      PreparedStatement stmt, int parameterIndex, Map<String, Object> values) {
    StatusOr<String> jsonOr = toJson(values);
    if (jsonOr.isNotOk()) {
      return jsonOr.getStatus();
    }
    try {
      stmt.setObject(parameterIndex, jsonOr.getValue(), Types.OTHER);
      return Status.ok();
    } catch (SQLException e) {
      return Status.internal("Failed to set JSONB parameter: " + e.getMessage(), e);
    }
  }

  private static Object toJsonValue(Object value) {
    if (value instanceof Instant) {
      return value.toString();
    }
    if (value instanceof Date) {
      return ((Date) value).toInstant().toString();
    }
    return value;
  }
}
