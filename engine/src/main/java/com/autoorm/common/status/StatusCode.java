package com.autoorm.common.status;

/**
 * Status codes reported by storage backends and carried by engine exceptions.
 *
 * <p>The names follow the gRPC canonical codes so that a backend wrapping a remote store can pass
 * its own failures through unchanged.
 */
public enum StatusCode {
  OK,
  INVALID_ARGUMENT,
  NOT_FOUND,
  ALREADY_EXISTS,
  FAILED_PRECONDITION,
  UNAVAILABLE,
  INTERNAL;

  /** Returns whether this status code represents a successful operation. */
  public boolean isSuccess() {
    return this == OK;
  }

  /** Returns whether this status code represents an error. */
  public boolean isError() {
    return !isSuccess();
  }
}
