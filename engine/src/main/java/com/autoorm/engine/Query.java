package com.autoorm.engine;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A {@link Filter} plus presentation options: ordering by one field, an offset and a limit.
 *
 * <p>{@code orderBy} names a field, ascending by default; a leading {@code -} sorts descending.
 * Nulls sort first in ascending order. Without an ordering, records come back in identifier order.
 */
public final class Query {

  private final Filter filter;
  @Nullable private final String orderBy;
  @Nullable private final Integer limit;
  private final int offset;

  private Query(Filter filter, @Nullable String orderBy, @Nullable Integer limit, int offset) {
    this.filter = filter;
    this.orderBy = orderBy;
    this.limit = limit;
    this.offset = offset;
  }

  @Nonnull
  public static Query all() {
    return new Query(Filter.all(), null, null, 0);
  }

  @Nonnull
  public static Query of(Filter filter) {
    return new Query(Objects.requireNonNull(filter, "filter"), null, null, 0);
  }

  @Nonnull
  public Query filter(Filter newFilter) {
    return new Query(Objects.requireNonNull(newFilter, "filter"), orderBy, limit, offset);
  }

  /** Orders by {@code field}, or by {@code -field} for descending order. */
  @Nonnull
  public Query orderBy(String field) {
    if (field == null || field.isBlank() || "-".equals(field)) {
      throw new IllegalArgumentException("orderBy needs a field name");
    }
    return new Query(filter, field, limit, offset);
  }

  @Nonnull
  public Query limit(int maxRecords) {
    if (maxRecords < 0) {
      throw new IllegalArgumentException("limit must not be negative, got " + maxRecords);
    }
    return new Query(filter, orderBy, maxRecords, offset);
  }

  @Nonnull
  public Query offset(int skip) {
    if (skip < 0) {
      throw new IllegalArgumentException("offset must not be negative, got " + skip);
    }
    return new Query(filter, orderBy, limit, skip);
  }

  @Nonnull
  public Filter getFilter() {
    return filter;
  }

  /** Returns the field to order by, without any leading {@code -}. */
  @Nonnull
  public Optional<String> getOrderField() {
    if (orderBy == null) {
      return Optional.empty();
    }
    return Optional.of(orderBy.startsWith("-") ? orderBy.substring(1) : orderBy);
  }

  public boolean isDescending() {
    return orderBy != null && orderBy.startsWith("-");
  }

  @Nonnull
  public Optional<Integer> getLimit() {
    return Optional.ofNullable(limit);
  }

  public int getOffset() {
    return offset;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("filter", filter)
        .add("orderBy", orderBy)
        .add("limit", limit)
        .add("offset", offset)
        .omitNullValues()
        .toString();
  }
}
