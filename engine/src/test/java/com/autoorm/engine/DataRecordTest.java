package com.autoorm.engine;

import static org.junit.jupiter.api.Assertions.*;

import com.autoorm.exceptions.UnknownFieldException;
import com.autoorm.schema.Field;
import com.autoorm.schema.Id;
import com.autoorm.schema.ModelClasses;
import com.autoorm.schema.ModelRegistry;
import com.autoorm.storage.InMemoryStorageBackend;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class DataRecordTest {

  record Book(
      @Id long id,
      @Field(unique = true, nullable = false) String title,
      int pages,
      float rating,
      @Field(defaultValue = "false") Boolean lent,
      Instant added) {}

  record Title(String title) {}

  record Shelf(String title, String location) {}

  record IntCount(int pages) {}

  record ShortCount(short pages) {}

  record ByteCount(Byte pages) {}

  record FloatRating(float rating) {}

  private static DataRecord sample() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("id", 3L);
    values.put("title", "Dune");
    values.put("pages", 412L);
    values.put("rating", 4.5);
    values.put("lent", null);
    return new DataRecord("books", 3L, values);
  }

  @Test
  void testGetters() {
    DataRecord record = sample();

    assertEquals("books", record.modelName());
    assertEquals(3L, record.id());
    assertEquals("Dune", record.getString("title"));
    assertEquals(412L, record.getLong("pages"));
    assertEquals(4.5, record.getDouble("rating"));
    assertNull(record.getBoolean("lent"));
    assertTrue(record.isNull("lent"));
    assertThrows(IllegalStateException.class, () -> record.getString("pages"));
    assertThrows(UnknownFieldException.class, () -> record.get("author"));
  }

  @Test
  void testValues_AreUnmodifiable() {
    assertThrows(
        UnsupportedOperationException.class, () -> sample().values().put("title", "Emma"));
  }

  @Test
  void testEqualityAndToString() {
    assertEquals(sample(), sample());
    assertEquals(sample().hashCode(), sample().hashCode());
    assertTrue(sample().toString().contains("Dune"));
  }

  @Test
  void testAs_BuildsMatchingRecordClass() {
    assertEquals(new Title("Dune"), sample().as(Title.class));
    assertThrows(UnknownFieldException.class, () -> sample().as(Shelf.class));
  }

  @Test
  void testAs_NarrowsOnlyValuesThatFit() {
    assertEquals(new ShortCount((short) 412), sample().as(ShortCount.class));
    assertEquals(new FloatRating(4.5f), sample().as(FloatRating.class));

    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> sample().as(ByteCount.class));
    assertTrue(e.getMessage().contains("pages"));
    assertTrue(e.getMessage().contains("412"));

    assertThrows(
        IllegalArgumentException.class,
        () -> withValue("pages", 100_000L).as(ShortCount.class));
    assertThrows(
        IllegalArgumentException.class,
        () -> withValue("pages", 5_000_000_000L).as(IntCount.class));
    assertThrows(
        IllegalArgumentException.class, () -> withValue("rating", 1e300).as(FloatRating.class));
  }

  private static DataRecord withValue(String field, Object value) {
    Map<String, Object> values = new LinkedHashMap<>(sample().values());
    values.put(field, value);
    return new DataRecord("books", 3L, values);
  }

  @Test
  void testAs_RoundTripsThroughEngine() {
    ModelRegistry registry = ModelRegistry.of(ModelClasses.definitionsOf(List.of(Book.class)));
    try (DataEngine engine =
        new DataEngine(new DataEngine.Config(registry, new InMemoryStorageBackend(), "library"))) {
      Instant added = Instant.parse("2024-02-02T12:00:00Z");

      DataRecord created =
          engine.create(
              "books", Map.of("title", "Dune", "pages", 412, "rating", 4.5f, "added", added));

      assertEquals(new Book(1L, "Dune", 412, 4.5f, false, added), created.as(Book.class));
    }
  }
}
