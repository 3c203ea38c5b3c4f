package com.autoorm.exceptions;

/** A supplied value does not match the declared type of its field. */
public class TypeMismatchException extends ValidationException {
  public TypeMismatchException(String modelName, String fieldName, String expectedType, Object value) {
    super(
        modelName,
        fieldName,
        "Field '" + fieldName + "' of model '" + modelName + "' expects " + expectedType
            + " but got " + describe(value));
  }

  private static String describe(Object value) {
    if (value == null) {
      return "null";
    }
    return value.getClass().getSimpleName() + " '" + value + "'";
  }
}
