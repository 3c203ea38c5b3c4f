package com.autoorm.exceptions;

import com.autoorm.common.status.StatusCode;

/**
 * A write would break a uniqueness constraint, either a unique field or the storage-level
 * identifier.
 */
public class DuplicateKeyException extends DataEngineException {
  private final String modelName;
  private final String fieldName;

  public DuplicateKeyException(String modelName, String fieldName, Object value) {
    super(
        StatusCode.ALREADY_EXISTS,
        "Model '" + modelName + "' already has a record with " + fieldName + " = '" + value + "'");
    this.modelName = modelName;
    this.fieldName = fieldName;
  }

  public String getModelName() {
    return modelName;
  }

  public String getFieldName() {
    return fieldName;
  }
}
