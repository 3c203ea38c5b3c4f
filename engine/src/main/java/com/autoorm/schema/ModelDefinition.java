package com.autoorm.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A raw model declaration: a name and its fields in declaration order.
 *
 * @param name the model name, unique within a registry
 * @param fields the field declarations
 */
public record ModelDefinition(String name, List<FieldDefinition> fields) {

  public ModelDefinition {
    // Null entries are kept so that validation can report them.
    fields =
        fields == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(fields));
  }

  public static ModelDefinition of(String name, FieldDefinition... fields) {
    return new ModelDefinition(name, Arrays.asList(fields));
  }
}
