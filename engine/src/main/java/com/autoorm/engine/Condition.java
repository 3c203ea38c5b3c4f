package com.autoorm.engine;

import javax.annotation.Nullable;

/**
 * One comparison of a {@link Filter}: {@code field operator value}.
 *
 * @param field the field to compare
 * @param operator how to compare
 * @param value the operand; a {@link java.util.Collection} for {@link Operator#IN}
 */
public record Condition(String field, Operator operator, @Nullable Object value) {

  public Condition {
    if (field == null || field.isBlank()) {
      throw new IllegalArgumentException("Condition field must not be blank");
    }
    if (operator == null) {
      throw new IllegalArgumentException("Condition on '" + field + "' has no operator");
    }
  }

  @Override
  public String toString() {
    return field + " " + operator.symbol() + " " + value;
  }
}
