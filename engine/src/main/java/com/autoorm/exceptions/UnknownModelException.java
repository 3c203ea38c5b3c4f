package com.autoorm.exceptions;

import com.autoorm.common.status.StatusCode;

/** An operation referenced a model name that is not in the registry. */
public class UnknownModelException extends DataEngineException {
  private final String modelName;

  public UnknownModelException(String modelName) {
    super(StatusCode.NOT_FOUND, "Unknown model '" + modelName + "'");
    this.modelName = modelName;
  }

  public String getModelName() {
    return modelName;
  }
}
