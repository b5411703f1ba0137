package com.codeheadsystems.relman.server.outcome;

/**
 * Carries a checked cause out of {@link Outcome#resultOrThrow()}.
 */
public class OutcomeException extends RuntimeException {

  /**
   * Instantiates a new Outcome exception.
   *
   * @param cause the captured checked exception
   */
  public OutcomeException(Exception cause) {
    super(cause.getMessage(), cause);
  }
}
