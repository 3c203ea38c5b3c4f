package com.autoorm.engine;

import com.autoorm.common.status.Status;
import com.autoorm.exceptions.StorageException;
import com.autoorm.schema.FieldSchema;
import com.autoorm.schema.ModelSchema;
import com.autoorm.storage.StoredRecord;
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import javax.annotation.Nullable;

/** Turns backend value maps into {@link DataRecord}s and filters into backend predicates. */
final class RecordConverter {

  private RecordConverter() {}

  /**
   * Builds a record from stored values, decoding each one to its canonical type. Fields missing
   * from storage read as null.
   *
   * @throws StorageException if a stored value cannot be read as its field's type
   */
  static DataRecord toRecord(ModelSchema schema, long id, Map<String, Object> stored) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (FieldSchema field : schema.fields()) {
      values.put(field.name(), field.primaryKey() ? Long.valueOf(id) : decode(schema, field, stored));
    }
    return new DataRecord(schema.name(), id, values);
  }

  static DataRecord toRecord(ModelSchema schema, StoredRecord stored) {
    return toRecord(schema, stored.id(), stored.values());
  }

  /**
   * Compiles a filter into a predicate over stored records. Operands are validated here, before
   * any scan runs.
   */
  static Predicate<StoredRecord> toPredicate(ModelSchema schema, Filter filter) {
    if (filter.isEmpty()) {
      return record -> true;
    }
    ImmutableList.Builder<Predicate<StoredRecord>> compiled = ImmutableList.builder();
    for (Condition condition : filter.conditions()) {
      FieldSchema field = schema.requireField(condition.field());
      Object operand = RecordValidator.forCondition(schema, condition);
      Operator operator = condition.operator();
      compiled.add(
          record -> operator.test(storedValue(schema, field, record), operand));
    }
    List<Predicate<StoredRecord>> predicates = compiled.build();
    return record -> {
      for (Predicate<StoredRecord> predicate : predicates) {
        if (!predicate.test(record)) {
          return false;
        }
      }
      return true;
    };
  }

  @Nullable
  private static Object storedValue(ModelSchema schema, FieldSchema field, StoredRecord record) {
    return field.primaryKey() ? Long.valueOf(record.id()) : decode(schema, field, record.values());
  }

  @Nullable
  private static Object decode(ModelSchema schema, FieldSchema field, Map<String, Object> stored) {
    Object raw = stored.get(field.name());
    if (raw == null) {
      return null;
    }
    return field.type()
        .decode(raw)
        .orElseThrow(
            () ->
                new StorageException(
                    Status.internal(
                        "Stored value '" + raw + "' of field '" + field.name() + "' in model '"
                            + schema.name() + "' is not a valid " + field.type(),
                        null)));
  }
}
