package com.autoorm.exceptions;

/** A field name was used that the model's schema does not declare. */
public class UnknownFieldException extends ValidationException {
  public UnknownFieldException(String modelName, String fieldName) {
    super(modelName, fieldName, "Model '" + modelName + "' has no field '" + fieldName + "'");
  }
}
