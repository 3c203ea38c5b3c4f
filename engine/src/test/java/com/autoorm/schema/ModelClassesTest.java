package com.autoorm.schema;

import static org.junit.jupiter.api.Assertions.*;

import com.autoorm.exceptions.SchemaException;
import com.autoorm.exceptions.UnknownFieldException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

public class ModelClassesTest {

  record User(
      @Field(unique = true, nullable = false) String name,
      int age,
      @Field(defaultValue = "active") String status,
      Double score) {}

  record Company(@Id long code, String name, Instant founded, boolean listed) {}

  @Model("people")
  record Person(String name) {}

  record Ticket(UUID reference) {}

  record Badge(@Id String code) {}

  record Reading(@Field(defaultValue = "soon") Instant takenAt) {}

  @Test
  void testModelNameOf_PluralizesOrUsesAnnotation() {
    assertEquals("users", ModelClasses.modelNameOf(User.class));
    assertEquals("companies", ModelClasses.modelNameOf(Company.class));
    assertEquals("people", ModelClasses.modelNameOf(Person.class));
  }

  @Test
  void testPluralize() {
    assertEquals("classes", ModelClasses.pluralize("class"));
    assertEquals("categories", ModelClasses.pluralize("category"));
    assertEquals("orders", ModelClasses.pluralize("order"));
  }

  @Test
  void testDefinitionOf_MapsComponentsToFields() {
    ModelDefinition definition = ModelClasses.definitionOf(User.class);

    assertEquals("users", definition.name());
    assertEquals(
        List.of(
            new FieldDefinition("name", "text", false, null, true, false),
            new FieldDefinition("age", "integer", false, null, false, false),
            new FieldDefinition("status", "text", true, "active", false, false),
            new FieldDefinition("score", "float", true, null, false, false)),
        definition.fields());

    ModelSchema schema = ModelSchema.fromDefinition(definition);
    assertEquals("id", schema.identifier().name());
  }

  @Test
  void testDefinitionOf_IdAnnotationMarksIdentifier() {
    ModelSchema schema = ModelSchema.fromDefinition(ModelClasses.definitionOf(Company.class));

    assertEquals("code", schema.identifier().name());
    assertEquals(FieldType.IDENTIFIER, schema.identifier().type());
    assertEquals(FieldType.TIMESTAMP, schema.requireField("founded").type());
    assertEquals(FieldType.BOOLEAN, schema.requireField("listed").type());
    assertFalse(schema.requireField("listed").nullable());
  }

  @Test
  void testDefinitionOf_RejectsUnsupportedComponents() {
    assertThrows(SchemaException.class, () -> ModelClasses.definitionOf(Ticket.class));
    assertThrows(SchemaException.class, () -> ModelClasses.definitionOf(Badge.class));
    assertThrows(SchemaException.class, () -> ModelClasses.definitionOf(Reading.class));
  }

  @Test
  void testDefinitionsOf_KeepsOrder() {
    List<ModelDefinition> definitions =
        ModelClasses.definitionsOf(List.of(User.class, Person.class));
    assertEquals("users", definitions.get(0).name());
    assertEquals("people", definitions.get(1).name());
  }

  @Test
  void testInstantiate_NarrowsCanonicalValues() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("id", 1L);
    values.put("name", "Alice");
    values.put("age", 30L);
    values.put("status", "active");
    values.put("score", null);

    User user = ModelClasses.instantiate(User.class, "users", values);

    assertEquals(new User("Alice", 30, "active", null), user);
  }

  @Test
  void testInstantiate_MissingFieldAndWrongType() {
    assertThrows(
        UnknownFieldException.class,
        () -> ModelClasses.instantiate(Person.class, "people", Map.of("title", "x")));

    Map<String, Object> values = new LinkedHashMap<>();
    values.put("name", "Alice");
    values.put("age", null);
    values.put("status", "active");
    values.put("score", 1.0);
    assertThrows(
        IllegalArgumentException.class,
        () -> ModelClasses.instantiate(User.class, "users", values));
  }
}
