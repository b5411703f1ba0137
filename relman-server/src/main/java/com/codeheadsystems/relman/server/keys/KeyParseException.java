package com.codeheadsystems.relman.server.keys;

/**
 * A block of text could not be read as an OpenPGP public key.
 */
public class KeyParseException extends Exception {

  public KeyParseException(String message) {
    super(message);
  }

  public KeyParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
