package com.autoorm.exceptions;

import com.autoorm.common.status.Status;
import com.autoorm.common.status.StatusCode;
import javax.annotation.Nonnull;

/**
 * Root of every failure the data engine reports to its caller.
 *
 * <p>Each subclass maps to a {@link StatusCode} so that a request-handling layer in front of the
 * engine can translate failures without inspecting the exception type.
 */
public abstract class DataEngineException extends RuntimeException {
  private final StatusCode code;

  protected DataEngineException(StatusCode code, String message) {
    super(message);
    this.code = code;
  }

  protected DataEngineException(StatusCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  /** Returns the status code this failure maps to. */
  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns this failure as a {@link Status}. */
  @Nonnull
  public Status toStatus() {
    return Status.of(code, getMessage(), getCause());
  }
}
