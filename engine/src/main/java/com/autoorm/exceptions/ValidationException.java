package com.autoorm.exceptions;

import com.autoorm.common.status.StatusCode;

/**
 * Input supplied to a create, update or query did not satisfy the model's schema. Subclasses
 * narrow down the reason.
 */
public class ValidationException extends DataEngineException {
  private final String modelName;
  private final String fieldName;

  public ValidationException(String modelName, String fieldName, String message) {
    super(StatusCode.INVALID_ARGUMENT, message);
    this.modelName = modelName;
    this.fieldName = fieldName;
  }

  public String getModelName() {
    return modelName;
  }

  /** Returns the offending field, or null when the failure is not tied to a single field. */
  public String getFieldName() {
    return fieldName;
  }
}
