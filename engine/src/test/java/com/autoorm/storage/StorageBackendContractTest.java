package com.autoorm.storage;

import static org.junit.jupiter.api.Assertions.*;

import com.autoorm.common.status.StatusCode;
import com.autoorm.common.status.StatusOr;
import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Behaviour every {@link StorageBackend} must share. Subclasses supply a fresh, empty backend for
 * each test.
 */
public abstract class StorageBackendContractTest {

  protected StorageBackend backend;

  protected abstract StorageBackend createBackend() throws Exception;

  @BeforeEach
  void setUpBackend() throws Exception {
    backend = createBackend();
  }

  @AfterEach
  void tearDownBackend() {
    if (backend != null) {
      backend.close();
    }
  }

  private static Map<String, Object> user(String name, long age) {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("name", name);
    values.put("age", age);
    return values;
  }

  private static List<Long> ids(Iterable<StoredRecord> records) {
    return ImmutableList.copyOf(records).stream().map(StoredRecord::id).collect(Collectors.toList());
  }

  @Test
  void testInsert_AssignsIncreasingIdsPerModel() {
    assertEquals(1L, backend.insert("main", "users", null, user("Alice", 30)).getValue());
    assertEquals(2L, backend.insert("main", "users", null, user("Bob", 25)).getValue());
    assertEquals(1L, backend.insert("main", "posts", null, Map.of("title", "Hi")).getValue());
    assertEquals(1L, backend.insert("other", "users", null, user("Carol", 41)).getValue());
  }

  @Test
  void testInsert_RequestedIdIsHonouredAndReserved() {
    assertEquals(10L, backend.insert("main", "users", 10L, user("Alice", 30)).getValue());
    assertEquals(11L, backend.insert("main", "users", null, user("Bob", 25)).getValue());

    StatusOr<Long> duplicate = backend.insert("main", "users", 10L, user("Eve", 22));
    assertTrue(duplicate.isNotOk());
    assertEquals(StatusCode.ALREADY_EXISTS, duplicate.getStatus().getCode());
    assertEquals("Alice", backend.fetch("main", "users", 10L).getValue().get().get("name"));
  }

  @Test
  void testInsert_FailsOnceIdentifiersRunOut() {
    assertEquals(Long.MAX_VALUE,
        backend.insert("main", "users", Long.MAX_VALUE, user("Alice", 30)).getValue());

    StatusOr<Long> next = backend.insert("main", "users", null, user("Bob", 25));

    assertTrue(next.isNotOk());
    assertEquals(StatusCode.FAILED_PRECONDITION, next.getStatus().getCode());
    assertTrue(next.getStatus().getMessage().contains("main.users"));
    assertEquals(1, ids(backend.scan("main", "users", record -> true).getValue()).size());
    // Other models keep their own counters.
    assertEquals(1L, backend.insert("main", "posts", null, Map.of("title", "Hi")).getValue());
  }

  @Test
  void testFetch_ReturnsCopyOrEmpty() {
    Map<String, Object> values = user("Alice", 30);
    long id = backend.insert("main", "users", null, values).getValue();
    values.put("name", "Mallory");

    Map<String, Object> fetched = backend.fetch("main", "users", id).getValue().get();
    assertEquals("Alice", fetched.get("name"));
    assertEquals(30L, fetched.get("age"));

    fetched.put("name", "Mallory");
    assertEquals("Alice", backend.fetch("main", "users", id).getValue().get().get("name"));

    assertEquals(Optional.empty(), backend.fetch("main", "users", 99L).getValue());
    assertEquals(Optional.empty(), backend.fetch("nowhere", "users", id).getValue());
  }

  @Test
  void testUpdate_MergesAndReturnsFullValues() {
    long id = backend.insert("main", "users", null, user("Alice", 30)).getValue();

    Map<String, Object> merged = backend.update("main", "users", id, Map.of("age", 31L)).getValue();

    assertEquals("Alice", merged.get("name"));
    assertEquals(31L, merged.get("age"));
    assertEquals(merged, backend.fetch("main", "users", id).getValue().get());
  }

  @Test
  void testUpdate_CanStoreNull() {
    long id = backend.insert("main", "users", null, user("Alice", 30)).getValue();
    Map<String, Object> changes = new HashMap<>();
    changes.put("age", null);

    backend.update("main", "users", id, changes).getValue();

    Map<String, Object> fetched = backend.fetch("main", "users", id).getValue().get();
    assertTrue(fetched.containsKey("age"));
    assertNull(fetched.get("age"));
  }

  @Test
  void testUpdate_MissingRecordIsNotFound() {
    StatusOr<Map<String, Object>> result = backend.update("main", "users", 7L, Map.of("age", 1L));
    assertEquals(StatusCode.NOT_FOUND, result.getStatus().getCode());
  }

  @Test
  void testDelete_IsIdempotent() {
    long id = backend.insert("main", "users", null, user("Alice", 30)).getValue();

    assertTrue(backend.delete("main", "users", id).getValue());
    assertFalse(backend.delete("main", "users", id).getValue());
    assertFalse(backend.delete("main", "ghosts", 1L).getValue());
    assertEquals(Optional.empty(), backend.fetch("main", "users", id).getValue());
  }

  @Test
  void testDelete_DoesNotReuseIds() {
    long first = backend.insert("main", "users", null, user("Alice", 30)).getValue();
    backend.delete("main", "users", first);

    assertEquals(first + 1, backend.insert("main", "users", null, user("Bob", 25)).getValue());
  }

  @Test
  void testScan_FiltersInIdOrderAndIsRestartable() {
    backend.insert("main", "users", null, user("Alice", 30));
    backend.insert("main", "users", null, user("Bob", 17));
    backend.insert("main", "users", null, user("Carol", 41));

    Iterable<StoredRecord> adults =
        backend
            .scan("main", "users", record -> ((Number) record.values().get("age")).longValue() > 20)
            .getValue();

    assertEquals(List.of(1L, 3L), ids(adults));
    assertEquals(ids(adults), ids(adults));
  }

  @Test
  void testScan_IsLazy() {
    Iterable<StoredRecord> all = backend.scan("main", "users", record -> true).getValue();
    assertFalse(all.iterator().hasNext());

    backend.insert("main", "users", null, user("Alice", 30));

    assertEquals(List.of(1L), ids(all));
  }

  @Test
  void testScan_IsScopedToNamespaceAndModel() {
    backend.insert("a", "users", null, user("Alice", 30));
    backend.insert("b", "users", null, user("Bob", 25));
    backend.insert("a", "posts", null, Map.of("title", "Hi"));

    List<StoredRecord> inA = ImmutableList.copyOf(backend.scan("a", "users", r -> true).getValue());
    assertEquals(1, inA.size());
    assertEquals("Alice", inA.get(0).values().get("name"));
  }

  @Test
  void testNamespaces_ListsNamespacesWithData() {
    backend.insert("alpha", "users", null, user("Alice", 30));
    backend.insert("beta", "users", null, user("Bob", 25));

    assertTrue(backend.namespaces().getValue().containsAll(List.of("alpha", "beta")));
  }
}
