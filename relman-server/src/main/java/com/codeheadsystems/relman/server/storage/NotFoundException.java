package com.codeheadsystems.relman.server.storage;

/**
 * The named record does not exist. Maps to HTTP 404.
 */
public class NotFoundException extends RuntimeException {

  public NotFoundException(String message) {
    super(message);
  }
}
