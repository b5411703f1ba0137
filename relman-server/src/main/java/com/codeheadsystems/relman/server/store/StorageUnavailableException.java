package com.codeheadsystems.relman.server.store;

/**
 * A backing store could not be reached. Maps to HTTP 503.
 */
public class StorageUnavailableException extends IllegalStateException {

  public StorageUnavailableException(String message) {
    super(message);
  }

  public StorageUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
