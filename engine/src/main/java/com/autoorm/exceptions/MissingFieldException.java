package com.autoorm.exceptions;

/** A non-nullable field without a default was left unset. */
public class MissingFieldException extends ValidationException {
  public MissingFieldException(String modelName, String fieldName) {
    super(
        modelName,
        fieldName,
        "Model '" + modelName + "' requires a value for field '" + fieldName + "'");
  }
}
