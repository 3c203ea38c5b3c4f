package com.autoorm.exceptions;

import com.autoorm.common.status.StatusCode;

/** A model definition failed structural validation while loading the registry. */
public class SchemaException extends DataEngineException {
  public SchemaException(String message) {
    super(StatusCode.INVALID_ARGUMENT, message);
  }

  public SchemaException(String message, Throwable cause) {
    super(StatusCode.INVALID_ARGUMENT, message, cause);
  }
}
