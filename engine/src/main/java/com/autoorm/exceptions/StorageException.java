package com.autoorm.exceptions;

import com.autoorm.common.status.Status;

/** The storage backend reported a failure the engine has no more specific exception for. */
public class StorageException extends DataEngineException {
  public StorageException(Status status) {
    super(status.getCode(), String.valueOf(status.getMessage()), status.getCause());
  }

  public StorageException(String context, Status status) {
    super(status.getCode(), context + ": " + status.getMessage(), status.getCause());
  }
}
