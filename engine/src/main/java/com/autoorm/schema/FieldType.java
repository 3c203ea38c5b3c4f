package com.autoorm.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Locale;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * The closed set of field types a model may declare.
 *
 * <p>Every type has one canonical Java representation, which is what the engine stores and what
 * {@link com.autoorm.engine.DataRecord} hands back:
 *
 * <ul>
 *   <li>{@code integer} and {@code identifier}: {@link Long}
 *   <li>{@code float}: {@link Double}
 *   <li>{@code text}: {@link String}
 *   <li>{@code boolean}: {@link Boolean}
 *   <li>{@code timestamp}: {@link Instant}
 * </ul>
 */
public enum FieldType {
  INTEGER("integer"),
  FLOAT("float"),
  TEXT("text"),
  BOOLEAN("boolean"),
  TIMESTAMP("timestamp"),
  IDENTIFIER("identifier");

  private final String tag;

  FieldType(String tag) {
    this.tag = tag;
  }

  /** Returns the tag used for this type in model definitions. */
  @Nonnull
  public String tag() {
    return tag;
  }

  /** Looks up a type by its tag, ignoring case and surrounding whitespace. */
  @Nonnull
  public static Optional<FieldType> fromTag(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    String normalized = tag.trim().toLowerCase(Locale.ROOT);
    for (FieldType type : values()) {
      if (type.tag.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  /**
   * Converts a caller-supplied value to its canonical representation.
   *
   * <p>The check is strict: only Java types that naturally represent this field type are accepted.
   * A {@code String} is never parsed into a number or a timestamp here.
   *
   * @param value a non-null input value
   * @return the canonical value, or empty if the value does not fit this type
   */
  @Nonnull
  public Optional<Object> coerce(@Nonnull Object value) {
    switch (this) {
      case INTEGER:
        return isIntegral(value) ? Optional.of(((Number) value).longValue()) : Optional.empty();
      case IDENTIFIER:
        if (isIntegral(value) && ((Number) value).longValue() >= 0) {
          return Optional.of(((Number) value).longValue());
        }
        return Optional.empty();
      case FLOAT:
        return toDouble(value);
      case TEXT:
        return value instanceof CharSequence ? Optional.of(value.toString()) : Optional.empty();
      case BOOLEAN:
        return value instanceof Boolean ? Optional.of(value) : Optional.empty();
      case TIMESTAMP:
        return toInstant(value);
      default:
        throw new AssertionError("Unhandled field type " + this);
    }
  }

  /**
   * Converts a value read back from a storage backend, or written as text in a model annotation,
   * to its canonical representation.
   *
   * <p>This is more lenient than {@link #coerce}: whole-valued doubles become longs, strings are
   * parsed, and epoch milliseconds become timestamps. That is what JSON-backed stores hand back.
   *
   * @param raw a non-null stored value
   * @return the canonical value, or empty if the value cannot be interpreted as this type
   */
  @Nonnull
  public Optional<Object> decode(@Nonnull Object raw) {
    Optional<Object> strict = coerce(raw);
    if (strict.isPresent()) {
      return strict;
    }
    switch (this) {
      case INTEGER:
      case IDENTIFIER:
        Optional<Long> whole = wholeNumber(raw);
        if (whole.isPresent() && (this == INTEGER || whole.get() >= 0)) {
          return Optional.of(whole.get());
        }
        return Optional.empty();
      case FLOAT:
        return raw instanceof String ? parseDouble((String) raw) : Optional.empty();
      case TEXT:
        return Optional.empty();
      case BOOLEAN:
        if ("true".equalsIgnoreCase(String.valueOf(raw))) {
          return Optional.of(Boolean.TRUE);
        }
        if ("false".equalsIgnoreCase(String.valueOf(raw))) {
          return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
      case TIMESTAMP:
        if (raw instanceof String) {
          try {
            return Optional.of(Instant.parse((String) raw));
          } catch (DateTimeParseException e) {
            return Optional.empty();
          }
        }
        if (isIntegral(raw)) {
          return Optional.of(Instant.ofEpochMilli(((Number) raw).longValue()));
        }
        return Optional.empty();
      default:
        throw new AssertionError("Unhandled field type " + this);
    }
  }

  @Override
  public String toString() {
    return tag;
  }

  private static boolean isIntegral(Object value) {
    return value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte;
  }

  private static Optional<Object> toDouble(Object value) {
    double d;
    if (value instanceof Float) {
      // Float.toString keeps the decimal the caller wrote, widening would not.
      d = Double.parseDouble(value.toString());
    } else if (value instanceof Number) {
      d = ((Number) value).doubleValue();
    } else {
      return Optional.empty();
    }
    return finite(d);
  }

  /** NaN and the infinities have no JSON form, so no backend could store them. */
  private static Optional<Object> finite(double d) {
    return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
  }

  private static Optional<Object> toInstant(Object value) {
    if (value instanceof Instant) {
      return Optional.of(value);
    }
    if (value instanceof Date) {
      return Optional.of(((Date) value).toInstant());
    }
    if (value instanceof OffsetDateTime) {
      return Optional.of(((OffsetDateTime) value).toInstant());
    }
    if (value instanceof ZonedDateTime) {
      return Optional.of(((ZonedDateTime) value).toInstant());
    }
    return Optional.empty();
  }

  private static Optional<Long> wholeNumber(Object raw) {
    if (raw instanceof Double || raw instanceof Float || raw instanceof BigDecimal) {
      double d = ((Number) raw).doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) <= Long.MAX_VALUE) {
        return Optional.of((long) d);
      }
      return Optional.empty();
    }
    if (raw instanceof BigInteger) {
      try {
        return Optional.of(((BigInteger) raw).longValueExact());
      } catch (ArithmeticException e) {
        return Optional.empty();
      }
    }
    if (raw instanceof String) {
      try {
        return Optional.of(Long.parseLong(((String) raw).trim()));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  private static Optional<Object> parseDouble(String raw) {
    try {
      return finite(Double.parseDouble(raw.trim()));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }
}
