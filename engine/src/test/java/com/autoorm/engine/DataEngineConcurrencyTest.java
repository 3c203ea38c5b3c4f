package com.autoorm.engine;

import static org.junit.jupiter.api.Assertions.*;

import com.autoorm.exceptions.DuplicateKeyException;
import com.autoorm.schema.ModelRegistry;
import com.autoorm.storage.InMemoryStorageBackend;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

public class DataEngineConcurrencyTest {

  @Test
  void testConcurrentCreates_OnlyOneWinsAUniqueValue() throws Exception {
    int threads = 16;
    ModelRegistry registry = ModelRegistry.of(List.of(DataEngineTest.USERS));
    DataEngine engine =
        new DataEngine(new DataEngine.Config(registry, new InMemoryStorageBackend(), "main"));
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Boolean>> attempts = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        int age = i;
        Callable<Boolean> attempt =
            () -> {
              start.await();
              try {
                engine.in("main").create("users", Map.of("name", "Alice", "age", age));
                return true;
              } catch (DuplicateKeyException e) {
                return false;
              }
            };
        attempts.add(executor.submit(attempt));
      }
      start.countDown();

      int successes = 0;
      for (Future<Boolean> attempt : attempts) {
        if (attempt.get(30, TimeUnit.SECONDS)) {
          successes++;
        }
      }
      assertEquals(1, successes);
      assertEquals(1, engine.query("users").toList().size());
    } finally {
      executor.shutdownNow();
      engine.close();
    }
  }

  @Test
  void testConcurrentCreates_WithoutUniqueFieldsGetDistinctIds() throws Exception {
    ModelRegistry registry = ModelRegistry.of(List.of(DataEngineTest.PROFILES));
    DataEngine engine =
        new DataEngine(new DataEngine.Config(registry, new InMemoryStorageBackend(), "main"));
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<Long>> ids = new ArrayList<>();
      for (int i = 0; i < 200; i++) {
        ids.add(executor.submit(() -> engine.create("profiles", Map.of("handle", "h")).id()));
      }
      long distinct =
          ids.stream()
              .map(
                  future -> {
                    try {
                      return future.get(30, TimeUnit.SECONDS);
                    } catch (Exception e) {
                      throw new IllegalStateException(e);
                    }
                  })
              .distinct()
              .count();
      assertEquals(200, distinct);
    } finally {
      executor.shutdownNow();
      engine.close();
    }
  }
}
