package com.autoorm.storage;

import static org.junit.jupiter.api.Assertions.*;

import com.autoorm.config.EngineConfig;
import com.autoorm.engine.DataEngine;
import com.autoorm.engine.DataRecord;
import com.autoorm.exceptions.SchemaException;
import com.autoorm.schema.FieldDefinition;
import com.autoorm.schema.FieldType;
import com.autoorm.schema.ModelDefinition;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class StorageBackendsTest {

  @Test
  void testCreate_MemoryBackend() {
    try (StorageBackend backend = StorageBackends.create(EngineConfig.inMemory())) {
      assertTrue(backend instanceof InMemoryStorageBackend);
    }
  }

  @Test
  void testFromConfig_BuildsWorkingEngine() {
    List<ModelDefinition> models =
        List.of(ModelDefinition.of("notes", FieldDefinition.of("body", FieldType.TEXT)));

    try (DataEngine engine = DataEngine.fromConfig(EngineConfig.inMemory(), models)) {
      DataRecord note = engine.create("notes", Map.of("body", "hello"));
      assertEquals(EngineConfig.DEFAULT_NAMESPACE, engine.currentNamespace());
      assertEquals("hello", engine.get("notes", note.id()).orElseThrow().getString("body"));
    }
  }

  @Test
  void testFromConfig_InvalidModels() {
    List<ModelDefinition> models =
        List.of(ModelDefinition.of("notes", FieldDefinition.of("body", "blob")));

    assertThrows(SchemaException.class, () -> DataEngine.fromConfig(EngineConfig.inMemory(), models));
  }
}
