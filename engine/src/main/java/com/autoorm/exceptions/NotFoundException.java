package com.autoorm.exceptions;

import com.autoorm.common.status.StatusCode;

/** The record targeted by an update does not exist. */
public class NotFoundException extends DataEngineException {
  private final String modelName;
  private final long id;

  public NotFoundException(String modelName, long id) {
    super(StatusCode.NOT_FOUND, "Model '" + modelName + "' has no record with id " + id);
    this.modelName = modelName;
    this.id = id;
  }

  public String getModelName() {
    return modelName;
  }

  public long getId() {
    return id;
  }
}
