package com.codeheadsystems.relman.server.auth;

/**
 * Raised when a credential cannot establish who the caller is.
 * <p>
 * Token faults abort the request; resources map them to HTTP 401.
 */
public class TokenException extends SecurityException {

  /**
   * Why authentication failed.
   */
  public enum Reason {
    /** No valid principal at all. */
    UNAUTHENTICATED,
    /** No personal access token matches. */
    INVALID_CREDENTIAL,
    /** The credential is past its expiry. */
    EXPIRED,
    /** The personal access token was revoked. */
    REVOKED,
    /** The JWT signature does not verify with the current secret. */
    INVALID_SIGNATURE,
    /** The JWT cannot be decoded or lacks a required claim. */
    MALFORMED
  }

  private final Reason reason;

  /**
   * Instantiates a new Token exception.
   *
   * @param reason  the reason
   * @param message the message
   */
  public TokenException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  /**
   * Instantiates a new Token exception.
   *
   * @param reason  the reason
   * @param message the message
   * @param cause   the cause
   */
  public TokenException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
