package com.autoorm.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Streams;
import java.util.Iterator;
import java.util.Optional;
import java.util.stream.Stream;
import javax.annotation.Nonnull;

/**
 * The lazy result of a query.
 *
 * <p>Nothing is read from storage until iteration starts, and every new iterator runs the scan
 * again, so a sequence can be iterated any number of times. Each record reflects the store at the
 * moment it was read.
 */
public final class RecordSequence implements Iterable<DataRecord> {

  private final Iterable<DataRecord> records;

  RecordSequence(Iterable<DataRecord> records) {
    this.records = records;
  }

  @Nonnull
  @Override
  public Iterator<DataRecord> iterator() {
    return records.iterator();
  }

  @Nonnull
  public Stream<DataRecord> stream() {
    return Streams.stream(records);
  }

  /** Runs the scan and collects every record. */
  @Nonnull
  public ImmutableList<DataRecord> toList() {
    return ImmutableList.copyOf(records);
  }

  @Nonnull
  public Optional<DataRecord> first() {
    return Optional.ofNullable(Iterables.getFirst(records, null));
  }

  public boolean isEmpty() {
    return Iterables.isEmpty(records);
  }
}
