package com.autoorm.engine;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * A conjunction of {@link Condition}s. A record matches when every condition holds; the empty
 * filter matches everything.
 *
 * <pre>
 * Filter adults = Filter.where("age", Operator.GREATER_THAN, 20)
 *     .and("status", Operator.IN, List.of("active", "pending"));
 * </pre>
 */
public final class Filter {

  private static final Filter ALL = new Filter(ImmutableList.of());

  private final ImmutableList<Condition> conditions;

  private Filter(ImmutableList<Condition> conditions) {
    this.conditions = conditions;
  }

  /** Returns the filter that matches every record. */
  @Nonnull
  public static Filter all() {
    return ALL;
  }

  @Nonnull
  public static Filter where(String field, Operator operator, Object value) {
    return ALL.and(field, operator, value);
  }

  /** Returns a filter testing every entry of {@code values} for equality. */
  @Nonnull
  public static Filter equalTo(Map<String, ?> values) {
    Filter filter = ALL;
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      filter = filter.and(entry.getKey(), Operator.EQUALS, entry.getValue());
    }
    return filter;
  }

  /**
   * Builds a filter from the nested form {@code field -> operator -> value}, for example
   * {@code {"age": {GREATER_THAN: 20, LESS_THAN: 65}}}.
   */
  @Nonnull
  public static Filter of(Map<String, ? extends Map<Operator, ?>> criteria) {
    Filter filter = ALL;
    for (Map.Entry<String, ? extends Map<Operator, ?>> field : criteria.entrySet()) {
      for (Map.Entry<Operator, ?> comparison : field.getValue().entrySet()) {
        filter = filter.and(field.getKey(), comparison.getKey(), comparison.getValue());
      }
    }
    return filter;
  }

  /** Returns a new filter with one more condition. */
  @Nonnull
  public Filter and(String field, Operator operator, Object value) {
    return new Filter(
        ImmutableList.<Condition>builder()
            .addAll(conditions)
            .add(new Condition(field, operator, value))
            .build());
  }

  @Nonnull
  public List<Condition> conditions() {
    return conditions;
  }

  public boolean isEmpty() {
    return conditions.isEmpty();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Filter && conditions.equals(((Filter) obj).conditions);
  }

  @Override
  public int hashCode() {
    return conditions.hashCode();
  }

  @Override
  public String toString() {
    return conditions.isEmpty() ? "<all>" : Joiner.on(" and ").join(conditions);
  }
}
