package com.autoorm.engine;

import java.util.Collection;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Comparison operators a {@link Filter} condition can apply to a field. */
public enum Operator {
  EQUALS("eq"),
  NOT_EQUALS("ne"),
  GREATER_THAN("gt"),
  LESS_THAN("lt"),
  /** Matches when the field value equals any element of a collection. */
  IN("in");

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  @Nonnull
  public String symbol() {
    return symbol;
  }

  /**
   * Applies this operator to a stored value and an already-canonical operand.
   *
   * <p>A null stored value only matches {@link #NOT_EQUALS}.
   */
  boolean test(@Nullable Object stored, Object operand) {
    if (stored == null) {
      return this == NOT_EQUALS;
    }
    switch (this) {
      case EQUALS:
        return stored.equals(operand);
      case NOT_EQUALS:
        return !stored.equals(operand);
      case GREATER_THAN:
        return compare(stored, operand) > 0;
      case LESS_THAN:
        return compare(stored, operand) < 0;
      case IN:
        return ((Collection<?>) operand).contains(stored);
      default:
        throw new AssertionError("Unhandled operator " + this);
    }
  }

  @SuppressWarnings("unchecked")
  private static int compare(Object stored, Object operand) {
    return ((Comparable<Object>) stored).compareTo(operand);
  }
}
